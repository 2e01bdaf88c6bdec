package com.meshci.orchestrator.network;

import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * An ephemeral network owned by one harness job.
 *
 * The instance directory doubles as HOME for every process of the
 * network, so the bootstrap binary, the nodes and the test clients agree on
 * {@code ~/.safe/node} without touching the orchestrator's real home.
 */
public class NetworkInstance {

    private static final Logger log = LoggerFactory.getLogger(NetworkInstance.class);

    /** JobContext attribute under which the harness stores the running instance. */
    public static final String CONTEXT_KEY = "network";

    private final Path            instanceDir;
    private final Path            binDir;
    private final NetworkSettings settings;
    private final Process         bootstrap;
    private final LogSource       logSource;
    private final ProcessRunner   processRunner;
    private final List<Process>   extraNodes = new CopyOnWriteArrayList<>();

    public NetworkInstance(Path instanceDir, Path binDir, NetworkSettings settings,
                           Process bootstrap, LogSource logSource, ProcessRunner processRunner) {
        this.instanceDir   = instanceDir;
        this.binDir        = binDir;
        this.settings      = settings;
        this.bootstrap     = bootstrap;
        this.logSource     = logSource;
        this.processRunner = processRunner;
    }

    public Path            instanceDir() { return instanceDir; }
    public Path            binDir()      { return binDir; }
    public NetworkSettings settings()    { return settings; }
    public LogSource       logSource()   { return logSource; }

    /** Environment for processes that must talk to this network. */
    public Map<String, String> environment() {
        return Map.of("HOME", instanceDir.toString());
    }

    /**
     * @throws NetworkException if the bootstrap process already exited with a non-zero code
     */
    public void checkBootstrapHealthy() {
        if (!bootstrap.isAlive() && bootstrap.exitValue() != 0) {
            throw new NetworkException("Bootstrap process exited with code " + bootstrap.exitValue());
        }
    }

    /** Launch one more node (churn). {@code index} distinguishes its directory. */
    public void addNode(int index) {
        Path nodeDir = logSource.root().resolve("sn-node-extra-" + index);
        List<String> command = new ArrayList<>();
        command.add(nodeBinaryPath().toString());
        for (String arg : settings.nodeArgs()) {
            command.add(arg.replace("{nodeDir}", nodeDir.toString()));
        }
        Process node = processRunner.start(CommandSpec.of(command)
                .in(instanceDir)
                .withEnv(environment())
                .withEnv("RUST_LOG", settings.logFilter())
                .writingTo(instanceDir.resolve("extra-node-" + index + ".out")));
        extraNodes.add(node);
        log.info("Started extra node #{} (pid {})", index, node.pid());
    }

    /** Node processes of this instance that are still running. */
    public long aliveNodeCount() {
        String node = nodeBinaryPath().getFileName().toString();
        return ownedProcesses()
                .filter(p -> p.info().command().map(c -> c.endsWith(node)).orElse(false))
                .count();
    }

    /**
     * Kill every process of this instance. Best effort: failures are logged
     * and never thrown.
     *
     * @return number of processes that were still alive and got killed
     */
    public int teardown() {
        int killed = 0;
        List<ProcessHandle> targets = new ArrayList<>();
        targets.add(bootstrap.toHandle());
        bootstrap.descendants().forEach(targets::add);
        for (Process node : extraNodes) {
            targets.add(node.toHandle());
        }
        // Nodes launched by the bootstrap binary outlive it when it exits early.
        ownedProcesses().forEach(targets::add);

        for (ProcessHandle handle : targets) {
            try {
                if (handle.isAlive() && handle.destroyForcibly()) {
                    killed++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to kill pid {}: {}", handle.pid(), e.getMessage());
            }
        }
        log.info("Teardown of {} killed {} processes", instanceDir, killed);
        return killed;
    }

    private Path nodeBinaryPath() {
        return instanceDir.resolve(".safe").resolve("node").resolve(settings.nodeBinary());
    }

    private Stream<ProcessHandle> ownedProcesses() {
        String prefix = instanceDir.toAbsolutePath().toString();
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .filter(p -> p.info().command().map(c -> c.startsWith(prefix)).orElse(false));
    }
}
