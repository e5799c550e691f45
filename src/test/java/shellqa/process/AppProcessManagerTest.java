package shellqa.process;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import shellqa.config.HarnessConfig;
import shellqa.player.Poller;
import shellqa.player.ShellQAException;
import org.testng.annotations.AfterClass;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AppProcessManager}: readiness polling against WireMock and
 * the start/stop lifecycle against a child JVM running {@link IdleApp}.
 */
public class AppProcessManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(20);

    private WireMockServer wireMock;
    private String base;
    private AppProcessManager manager;
    private Path workspace;
    private final List<AppProcess> started = new ArrayList<>();

    // ── lifecycle ──────────────────────────────────────────────────────────

    @BeforeClass
    public void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMock.start();
        base = "http://127.0.0.1:" + wireMock.port();
    }

    @AfterClass
    public void stopWireMock() {
        if (wireMock != null) {
            wireMock.stop();
        }
    }

    @BeforeMethod
    public void setUp() throws IOException {
        wireMock.resetAll();
        Properties props = new Properties();
        props.setProperty("app.stop.grace.ms", "1000");
        HarnessConfig config = HarnessConfig.of(props);
        manager   = new AppProcessManager(config, new ReadinessProbe(), new Poller(Duration.ofMillis(20)));
        workspace = Files.createTempDirectory("workspace");
    }

    @AfterMethod(alwaysRun = true)
    public void killLeftovers() {
        for (AppProcess app : started) {
            app.process().destroyForcibly();
        }
        started.clear();
    }

    private AppProcess startIdleApp(String... args) {
        List<String> command = new ArrayList<>(List.of(
                Paths.get(System.getProperty("java.home"), "bin", "java").toString(),
                "-cp", System.getProperty("java.class.path"),
                IdleApp.class.getName()));
        command.addAll(List.of(args));
        AppProcess app = manager.start(command, workspace, workspace, 4180, Map.of("EXTRA_FLAG", "on"));
        started.add(app);
        return app;
    }

    private static void awaitOutput(AppProcess app, String line) {
        new Poller(Duration.ofMillis(20)).until("output line " + line,
                app::outputTail, tail -> tail.contains(line), WAIT);
    }

    // ── Readiness ──────────────────────────────────────────────────────────

    @Test
    public void awaitReady_returnsOnceHealthPathAnswers() {
        wireMock.stubFor(get(urlEqualTo("/ws/")).inScenario("boot")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("up"));
        wireMock.stubFor(get(urlEqualTo("/ws/")).inScenario("boot")
                .whenScenarioStateIs("up")
                .willReturn(aResponse().withStatus(200)));

        manager.awaitReady(base, Duration.ofSeconds(5));

        wireMock.verify(2, getRequestedFor(urlEqualTo("/ws/")));
    }

    @Test
    public void awaitReady_acceptsClientErrorStatus() {
        wireMock.stubFor(get(urlEqualTo("/ws/")).willReturn(aResponse().withStatus(404)));
        manager.awaitReady(base, Duration.ofSeconds(5));
    }

    @Test
    public void awaitReady_timesOutWhileServerErrors() {
        wireMock.stubFor(get(urlEqualTo("/ws/")).willReturn(aResponse().withStatus(500)));

        assertThatThrownBy(() -> manager.awaitReady(base, Duration.ofMillis(300)))
                .isInstanceOf(ReadinessTimeoutException.class)
                .hasMessageStartingWith("server did not become ready: " + base + "/ws/");
    }

    @Test
    public void awaitReady_failsFastWhenApplicationExits() {
        AppProcess app = startIdleApp("crash");

        assertThatThrownBy(() -> manager.awaitReady(app, "http://127.0.0.1:1", WAIT))
                .isInstanceOf(ShellQAException.class)
                .isNotInstanceOf(ReadinessTimeoutException.class)
                .hasMessageContaining("exited with code 3");
    }

    // ── Start / stop ───────────────────────────────────────────────────────

    @Test
    public void start_setsDevPortAndWorkspaceVariables() {
        AppProcess app = startIdleApp();
        awaitOutput(app, "ready");

        assertThat(app.outputTail()).contains(
                "WISDOM_DEV=1",
                "WISDOM_PORT=4180",
                "WISDOM_WORKSPACE_ROOT=" + workspace.toAbsolutePath(),
                "EXTRA_FLAG=on");
        manager.stop(app);
    }

    @Test
    public void start_unknownCommand_throws() {
        assertThatThrownBy(() -> manager.start(List.of("definitely-not-a-real-binary-xyz"),
                workspace, workspace, 4180, Map.of()))
                .isInstanceOf(ShellQAException.class)
                .hasMessageContaining("Could not start application");
    }

    @Test
    public void stop_terminatesAndIsIdempotent() {
        AppProcess app = startIdleApp();
        awaitOutput(app, "ready");

        manager.stop(app);
        assertThat(app.isAlive()).isFalse();

        manager.stop(app);
        manager.stop(null);
    }

    @Test
    public void stop_killsApplicationIgnoringTermination() {
        AppProcess app = startIdleApp("stubborn");
        awaitOutput(app, "ready");

        long startNanos = System.nanoTime();
        manager.stop(app);

        assertThat(app.isAlive()).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - startNanos)).isLessThan(WAIT);
    }
}
