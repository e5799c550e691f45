package shellqa.runner;

import java.nio.file.Path;

/**
 * Per-invocation options, usually straight from the command line.
 *
 * @param workspaceRoot   repository root the application and snapshots live under
 * @param port            TCP port the application binds
 * @param updateSnapshots overwrite baselines instead of comparing
 * @param threshold       maximum normalised mean difference for a snapshot to pass
 * @param headless        run the browser without a window
 */
public record RunOptions(Path workspaceRoot, int port, boolean updateSnapshots,
                         double threshold, boolean headless) {

    public static final int DEFAULT_PORT = 4180;

    public String baseUrl() {
        return "http://127.0.0.1:" + port;
    }
}
