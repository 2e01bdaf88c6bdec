package com.meshci.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeshCiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeshCiApplication.class, args);
    }
}
