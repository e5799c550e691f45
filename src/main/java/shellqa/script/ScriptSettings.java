package shellqa.script;

import shellqa.config.HarnessConfig;

import java.time.Duration;

/**
 * Everything an interaction script needs to know about the shell and the
 * run, resolved once from {@link HarnessConfig}.
 */
public record ScriptSettings(
        String baseUrl,
        String rootPath,
        String nestedPath,
        String nestedLink,
        String nestedGroup,
        int nestedCheckWidth,
        int desktopSnapshotWidth,
        int mobileSnapshotWidth,
        Duration pollTimeout,
        Duration idleTimeout,
        Duration idleMargin) {

    public static ScriptSettings from(HarnessConfig config, String baseUrl) {
        return new ScriptSettings(
                baseUrl,
                config.getShellRootPath(),
                config.getNestedPath(),
                config.getNestedLink(),
                config.getNestedGroup(),
                config.getNestedCheckWidth(),
                config.getDesktopSnapshotWidth(),
                config.getMobileSnapshotWidth(),
                config.getPollTimeout(),
                config.getIdleTimeout(),
                config.getIdleMargin());
    }

    public String rootUrl() {
        return baseUrl + rootPath;
    }

    public String nestedUrl() {
        return baseUrl + nestedPath;
    }

    /** How long to stay idle to be sure the auto-hide timer has fired. */
    public Duration pastIdleTimeout() {
        return idleTimeout.plus(idleMargin);
    }
}
