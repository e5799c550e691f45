package shellqa.cli;

import shellqa.config.HarnessConfig;
import shellqa.player.CheckFailedError;
import shellqa.player.ShellQAException;
import shellqa.runner.RunOptions;
import shellqa.runner.ShellCheckRunner;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: boots the application, drives the shell through
 * every breakpoint and compares snapshots.
 *
 * <p>Exit codes: {@code 0} all checks passed, {@code 1} a check failed,
 * {@code 2} the harness could not complete the run.
 */
@Command(
        name        = "shell-checks",
        description = "Visual-regression and behavioural checks for the workspace shell",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true
)
public class ShellChecksCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ShellChecksCLI.class);

    static final String SUCCESS_LINE = "Shell checks passed.";

    @Option(
            names        = {"--port"},
            description  = "Port the application binds (default: ${DEFAULT-VALUE})",
            defaultValue = "4180"
    )
    int port;

    @Option(
            names       = {"--update-snapshots"},
            description = "Overwrite baselines with this run's captures instead of comparing"
    )
    boolean updateSnapshots;

    @Option(
            names       = {"--snapshot-threshold"},
            description = "Maximum normalised mean pixel difference (default: from harness.properties, 0.004)"
    )
    Double snapshotThreshold;

    @Option(
            names        = {"--workspace-root"},
            description  = "Repository root containing the application and snapshots (default: ${DEFAULT-VALUE})",
            defaultValue = "."
    )
    Path workspaceRoot;

    @Option(
            names       = {"--headed"},
            description = "Show the browser window"
    )
    boolean headed;

    @Spec
    CommandSpec spec;

    private final HarnessConfig config;

    public ShellChecksCLI() {
        this(null);
    }

    ShellChecksCLI(HarnessConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        int exit = new CommandLine(new ShellChecksCLI()).execute(args);
        System.exit(exit);
    }

    @Override
    public Integer call() {
        HarnessConfig cfg = config != null ? config : HarnessConfig.load();
        RunOptions options = toOptions(cfg);
        try {
            new ShellCheckRunner(cfg, options).run();
        } catch (CheckFailedError e) {
            log.error("Check failed ({})", e.kind(), e);
            System.err.println("FAILED [" + e.kind() + "]: " + e.getMessage());
            return 1;
        } catch (ShellQAException | WebDriverException e) {
            log.error("Run aborted", e);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }
        System.out.println(SUCCESS_LINE);
        return 0;
    }

    /**
     * @throws CommandLine.ParameterException if {@code --snapshot-threshold}
     *         is not a finite, non-negative number
     */
    RunOptions toOptions(HarnessConfig cfg) {
        if (snapshotThreshold != null
                && (!Double.isFinite(snapshotThreshold) || snapshotThreshold < 0)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--snapshot-threshold must be a finite, non-negative number: " + snapshotThreshold);
        }
        double threshold = snapshotThreshold != null ? snapshotThreshold : cfg.getSnapshotThreshold();
        boolean headless = !headed && cfg.isHeadless();
        return new RunOptions(workspaceRoot.toAbsolutePath().normalize(), port, updateSnapshots,
                threshold, headless);
    }
}
