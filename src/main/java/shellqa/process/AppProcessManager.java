package shellqa.process;

import shellqa.config.HarnessConfig;
import shellqa.player.PollTimeoutException;
import shellqa.player.Poller;
import shellqa.player.ShellQAException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Boots the application under test, waits for it to serve, and guarantees it
 * is terminated. {@link #stop(AppProcess)} belongs in the run's outermost
 * {@code finally} block.
 */
public class AppProcessManager {

    private static final Logger log = LoggerFactory.getLogger(AppProcessManager.class);

    private final HarnessConfig config;
    private final ReadinessProbe probe;
    private final Poller poller;

    public AppProcessManager(HarnessConfig config) {
        this(config, new ReadinessProbe(), new Poller(config.getReadyPollInterval()));
    }

    AppProcessManager(HarnessConfig config, ReadinessProbe probe, Poller poller) {
        this.config = config;
        this.probe  = probe;
        this.poller = poller;
    }

    // ── Start ──────────────────────────────────────────────────────────────

    /**
     * Starts the configured application command in
     * {@code workspaceRoot/<app.dir>}.
     */
    public AppProcess start(Path workspaceRoot, int port, Map<String, String> extraEnv) {
        return start(config.getAppCommand(), workspaceRoot.resolve(config.getAppDir()),
                workspaceRoot, port, extraEnv);
    }

    /**
     * Starts {@code command} in {@code workingDirectory} with the dev-mode,
     * port and workspace-root variables set on top of the inherited
     * environment. Stdout and stderr are merged.
     */
    public AppProcess start(List<String> command, Path workingDirectory, Path workspaceRoot,
                            int port, Map<String, String> extraEnv) {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true);
        Map<String, String> env = pb.environment();
        env.put(config.getDevEnvVar(), "1");
        env.put(config.getPortEnvVar(), String.valueOf(port));
        env.put(config.getWorkspaceEnvVar(), workspaceRoot.toAbsolutePath().toString());
        env.putAll(extraEnv);

        log.info("Starting application: {} (cwd {}, port {})", String.join(" ", command), workingDirectory, port);
        try {
            AppProcess app = new AppProcess(pb.start());
            log.info("Application started (pid {})", app.pid());
            return app;
        } catch (IOException e) {
            throw new ShellQAException("Could not start application: " + String.join(" ", command), e);
        }
    }

    // ── Readiness ──────────────────────────────────────────────────────────

    /**
     * Polls {@code baseUrl + healthPath} until it answers with a status in
     * [200, 500). Fails fast if {@code app} exits first.
     *
     * @throws ReadinessTimeoutException if the timeout elapses
     */
    public void awaitReady(AppProcess app, String baseUrl, Duration timeout) {
        String url = baseUrl + config.getHealthPath();
        log.info("Waiting up to {}s for {}", timeout.toSeconds(), url);
        try {
            poller.until("application at " + url, () -> {
                if (app != null && !app.isAlive()) {
                    throw new ShellQAException("Application exited with code " + app.exitValue()
                            + " before becoming ready\napplication output:\n"
                            + String.join("\n", app.outputTail()));
                }
                return probe.isReady(url);
            }, Boolean::booleanValue, timeout);
        } catch (PollTimeoutException e) {
            String tail = app == null ? null : String.join("\n", app.outputTail());
            throw new ReadinessTimeoutException(url, tail, e);
        }
        log.info("Application ready at {}", url);
    }

    /** Readiness check without a process handle to watch. */
    public void awaitReady(String baseUrl, Duration timeout) {
        awaitReady(null, baseUrl, timeout);
    }

    // ── Stop ───────────────────────────────────────────────────────────────

    /**
     * Terminates the application: a no-op if it already exited, otherwise a
     * graceful termination request, then a forced kill if it is still alive
     * after the grace period. Descendants are terminated alongside it.
     */
    public void stop(AppProcess app) {
        if (app == null) return;
        Process process = app.process();
        if (!process.isAlive()) {
            log.debug("Application (pid {}) already exited", app.pid());
            return;
        }
        Duration grace = config.getStopGrace();
        log.info("Stopping application (pid {})", app.pid());
        List<ProcessHandle> descendants = process.descendants().toList();
        try {
            descendants.forEach(ProcessHandle::destroy);
            process.destroy();
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Application did not exit within {}ms — killing", grace.toMillis());
                descendants.forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            descendants.forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            log.warn("Interrupted while stopping application — killed (pid {})", app.pid());
            return;
        }
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        log.info("Application stopped (pid {})", app.pid());
    }
}
