package com.meshci.orchestrator.network;

/**
 * The network could not be brought up, e.g. the build archive is missing
 * or the bootstrap process died.
 */
public class NetworkException extends RuntimeException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
