package shellqa.runner;

import shellqa.config.HarnessConfig;
import shellqa.player.ChromeRenderingEngine;
import shellqa.player.ErrorCollector;
import shellqa.player.Poller;
import shellqa.player.RenderingEngine;
import shellqa.process.AppProcess;
import shellqa.process.AppProcessManager;
import shellqa.script.BrowserSessionOrchestrator;
import shellqa.script.DesktopScript;
import shellqa.script.InteractionScript;
import shellqa.script.MobileScript;
import shellqa.script.ScriptSettings;
import shellqa.snapshot.ComparisonResult;
import shellqa.snapshot.SnapshotDirs;
import shellqa.snapshot.SnapshotEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Top-level sequencing of one run:
 * <ol>
 *   <li>reset the current and diff snapshot directories;</li>
 *   <li>start the application and wait until it serves;</li>
 *   <li>drive every breakpoint through its interaction script;</li>
 *   <li>fail on any collected console or page error;</li>
 *   <li>compare the designated snapshots against their baselines.</li>
 * </ol>
 * The application is stopped in a {@code finally} block, whatever fails.
 */
public class ShellCheckRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellCheckRunner.class);

    private final HarnessConfig config;
    private final RunOptions options;
    private final AppProcessManager processManager;
    private final Supplier<RenderingEngine> engineFactory;
    private final SnapshotEngine snapshots;
    private final BrowserSessionOrchestrator sessions;

    public ShellCheckRunner(HarnessConfig config, RunOptions options) {
        this(config, options,
                new AppProcessManager(config),
                () -> new ChromeRenderingEngine(options.headless(), options.baseUrl()),
                new Poller(config.getPollInterval()));
    }

    ShellCheckRunner(HarnessConfig config, RunOptions options, AppProcessManager processManager,
                     Supplier<RenderingEngine> engineFactory, Poller poller) {
        this.config         = config;
        this.options        = options;
        this.processManager = processManager;
        this.engineFactory  = engineFactory;
        this.snapshots      = new SnapshotEngine(
                SnapshotDirs.under(options.workspaceRoot().resolve(config.getSnapshotDir())));
        ScriptSettings settings = ScriptSettings.from(config, options.baseUrl());
        this.sessions = new BrowserSessionOrchestrator(List.of(
                new DesktopScript(settings, snapshots, poller),
                new MobileScript(settings, snapshots, poller)));
    }

    /**
     * Executes the run.
     *
     * @return the passing result
     * @throws shellqa.player.CheckFailedError   if any check failed
     * @throws shellqa.player.ShellQAException   if the harness itself could not proceed
     */
    public RunResult run() {
        snapshots.dirs().reset();

        AppProcess app = processManager.start(options.workspaceRoot(), options.port(), Map.of());
        try {
            processManager.awaitReady(app, options.baseUrl(), config.getReadyTimeout());

            ErrorCollector errors = new ErrorCollector();
            try (RenderingEngine engine = engineFactory.get()) {
                sessions.runAll(engine, config.getProfiles(), errors);
            }
            errors.assertNone();

            List<ComparisonResult> comparisons = new ArrayList<>();
            for (String name : InteractionScript.SNAPSHOT_NAMES) {
                comparisons.add(snapshots.compare(name, options.updateSnapshots(), options.threshold()));
            }
            RunResult result = new RunResult(errors.records(), comparisons);
            result.assertComparisonsPassed();
            log.info("Run passed: {} viewports, {} snapshots", config.getProfiles().size(), comparisons.size());
            return result;
        } finally {
            processManager.stop(app);
        }
    }
}
