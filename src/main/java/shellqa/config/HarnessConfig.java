package shellqa.config;

import shellqa.model.ViewportProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Reads {@code harness.properties} from the classpath and exposes typed
 * harness settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code harness.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class HarnessConfig {

    private static final Logger log = LoggerFactory.getLogger(HarnessConfig.class);

    private static final String CONFIG_FILE       = "harness.properties";
    private static final String CONFIG_LOCAL_FILE = "harness.local.properties";

    // Property keys
    private static final String KEY_APP_COMMAND       = "app.command";
    private static final String KEY_APP_DIR           = "app.dir";
    private static final String KEY_ENV_DEV           = "app.env.dev";
    private static final String KEY_ENV_PORT          = "app.env.port";
    private static final String KEY_ENV_WORKSPACE     = "app.env.workspace";
    private static final String KEY_HEALTH_PATH       = "app.health.path";
    private static final String KEY_READY_TIMEOUT     = "app.ready.timeout.sec";
    private static final String KEY_READY_POLL        = "app.ready.poll.ms";
    private static final String KEY_STOP_GRACE        = "app.stop.grace.ms";
    private static final String KEY_SHELL_ROOT        = "shell.root.path";
    private static final String KEY_NESTED_PATH       = "shell.nested.path";
    private static final String KEY_NESTED_LINK       = "shell.nested.link";
    private static final String KEY_NESTED_GROUP      = "shell.nested.group";
    private static final String KEY_DESKTOP_WIDTHS    = "viewport.desktop.widths";
    private static final String KEY_DESKTOP_HEIGHT    = "viewport.desktop.height";
    private static final String KEY_MOBILE_WIDTHS     = "viewport.mobile.widths";
    private static final String KEY_MOBILE_HEIGHT     = "viewport.mobile.height";
    private static final String KEY_NESTED_WIDTH      = "viewport.desktop.nested.width";
    private static final String KEY_DESKTOP_SNAP      = "viewport.desktop.snapshot.width";
    private static final String KEY_MOBILE_SNAP       = "viewport.mobile.snapshot.width";
    private static final String KEY_POLL_INTERVAL     = "poll.interval.ms";
    private static final String KEY_POLL_TIMEOUT      = "poll.timeout.ms";
    private static final String KEY_IDLE_TIMEOUT      = "fullscreen.idle.timeout.ms";
    private static final String KEY_IDLE_MARGIN       = "fullscreen.idle.margin.ms";
    private static final String KEY_SNAPSHOT_DIR      = "snapshot.dir";
    private static final String KEY_SNAPSHOT_THRESH   = "snapshot.threshold";
    private static final String KEY_HEADLESS          = "browser.headless";

    // Defaults
    private static final String  DEFAULT_APP_COMMAND     = "go run ./cmd/wisdom";
    private static final String  DEFAULT_APP_DIR         = "server";
    private static final String  DEFAULT_ENV_DEV         = "WISDOM_DEV";
    private static final String  DEFAULT_ENV_PORT        = "WISDOM_PORT";
    private static final String  DEFAULT_ENV_WORKSPACE   = "WISDOM_WORKSPACE_ROOT";
    private static final String  DEFAULT_SHELL_ROOT      = "/ws/";
    private static final int     DEFAULT_READY_TIMEOUT   = 120;
    private static final long    DEFAULT_READY_POLL      = 500L;
    private static final long    DEFAULT_STOP_GRACE      = 10_000L;
    private static final String  DEFAULT_NESTED_PATH     = "/ws/ui/src/components/";
    private static final String  DEFAULT_NESTED_LINK     = "/ws/ui/src/components/shell.tsx/";
    private static final String  DEFAULT_NESTED_GROUP    = "components";
    private static final String  DEFAULT_DESKTOP_WIDTHS  = "1024,1280,1440";
    private static final int     DEFAULT_DESKTOP_HEIGHT  = 900;
    private static final String  DEFAULT_MOBILE_WIDTHS   = "375,390,430";
    private static final int     DEFAULT_MOBILE_HEIGHT   = 844;
    private static final int     DEFAULT_NESTED_WIDTH    = 1024;
    private static final int     DEFAULT_DESKTOP_SNAP    = 1280;
    private static final int     DEFAULT_MOBILE_SNAP     = 390;
    private static final long    DEFAULT_POLL_INTERVAL   = 50L;
    private static final long    DEFAULT_POLL_TIMEOUT    = 4000L;
    private static final long    DEFAULT_IDLE_TIMEOUT    = 1800L;
    private static final long    DEFAULT_IDLE_MARGIN     = 350L;
    private static final String  DEFAULT_SNAPSHOT_DIR    = "ui/tests/shell_snapshots";
    private static final double  DEFAULT_SNAPSHOT_THRESH = 0.004;
    private static final boolean DEFAULT_HEADLESS        = true;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code harness.local.properties} values override {@code harness.properties}.
     *
     * @throws IllegalStateException if the base harness.properties cannot be loaded
     */
    public static HarnessConfig load() {
        Properties props = new Properties();

        // Base config is required
        try (InputStream base = HarnessConfig.class.getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        // Local overrides are optional
        try (InputStream local = HarnessConfig.class.getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} — using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
        return new HarnessConfig(props);
    }

    /** Wraps an already-populated {@link Properties}; missing keys fall back to defaults. */
    public static HarnessConfig of(Properties props) {
        return new HarnessConfig(props);
    }

    private HarnessConfig(Properties props) {
        this.props = props;
    }

    // ── Application under test ─────────────────────────────────────────────

    /** Command that starts the application, split on whitespace. */
    public List<String> getAppCommand() {
        return Arrays.asList(getString(KEY_APP_COMMAND, DEFAULT_APP_COMMAND).split("\\s+"));
    }

    /** Application working directory, relative to the workspace root. */
    public String getAppDir() {
        return getString(KEY_APP_DIR, DEFAULT_APP_DIR);
    }

    public String getDevEnvVar() {
        return getString(KEY_ENV_DEV, DEFAULT_ENV_DEV);
    }

    public String getPortEnvVar() {
        return getString(KEY_ENV_PORT, DEFAULT_ENV_PORT);
    }

    public String getWorkspaceEnvVar() {
        return getString(KEY_ENV_WORKSPACE, DEFAULT_ENV_WORKSPACE);
    }

    /** Path polled for readiness (default: the shell root). */
    public String getHealthPath() {
        return getString(KEY_HEALTH_PATH, getShellRootPath());
    }

    public Duration getReadyTimeout() {
        return Duration.ofSeconds(getInt(KEY_READY_TIMEOUT, DEFAULT_READY_TIMEOUT));
    }

    public Duration getReadyPollInterval() {
        return Duration.ofMillis(getLong(KEY_READY_POLL, DEFAULT_READY_POLL));
    }

    /** How long a graceful stop may take before the process is killed (default: 10s). */
    public Duration getStopGrace() {
        return Duration.ofMillis(getLong(KEY_STOP_GRACE, DEFAULT_STOP_GRACE));
    }

    // ── Shell routes ───────────────────────────────────────────────────────

    public String getShellRootPath() {
        return getString(KEY_SHELL_ROOT, DEFAULT_SHELL_ROOT);
    }

    public String getNestedPath() {
        return getString(KEY_NESTED_PATH, DEFAULT_NESTED_PATH);
    }

    public String getNestedLink() {
        return getString(KEY_NESTED_LINK, DEFAULT_NESTED_LINK);
    }

    public String getNestedGroup() {
        return getString(KEY_NESTED_GROUP, DEFAULT_NESTED_GROUP);
    }

    // ── Breakpoints ────────────────────────────────────────────────────────

    /** Desktop profiles first, then mobile, each in configured order. */
    public List<ViewportProfile> getProfiles() {
        List<ViewportProfile> profiles = new ArrayList<>();
        int desktopHeight = getInt(KEY_DESKTOP_HEIGHT, DEFAULT_DESKTOP_HEIGHT);
        for (int w : getIntList(KEY_DESKTOP_WIDTHS, DEFAULT_DESKTOP_WIDTHS)) {
            profiles.add(ViewportProfile.desktop(w, desktopHeight));
        }
        int mobileHeight = getInt(KEY_MOBILE_HEIGHT, DEFAULT_MOBILE_HEIGHT);
        for (int w : getIntList(KEY_MOBILE_WIDTHS, DEFAULT_MOBILE_WIDTHS)) {
            profiles.add(ViewportProfile.mobile(w, mobileHeight));
        }
        return List.copyOf(profiles);
    }

    /** Desktop width at which the nested-route group toggle is exercised (default: 1024). */
    public int getNestedCheckWidth() {
        return getInt(KEY_NESTED_WIDTH, DEFAULT_NESTED_WIDTH);
    }

    /** Representative desktop width for snapshots (default: 1280). */
    public int getDesktopSnapshotWidth() {
        return getInt(KEY_DESKTOP_SNAP, DEFAULT_DESKTOP_SNAP);
    }

    /** Representative mobile width for snapshots (default: 390). */
    public int getMobileSnapshotWidth() {
        return getInt(KEY_MOBILE_SNAP, DEFAULT_MOBILE_SNAP);
    }

    // ── Waits ──────────────────────────────────────────────────────────────

    public Duration getPollInterval() {
        return Duration.ofMillis(getLong(KEY_POLL_INTERVAL, DEFAULT_POLL_INTERVAL));
    }

    public Duration getPollTimeout() {
        return Duration.ofMillis(getLong(KEY_POLL_TIMEOUT, DEFAULT_POLL_TIMEOUT));
    }

    /** Fullscreen controls auto-hide after this much inactivity (default: 1800ms). */
    public Duration getIdleTimeout() {
        return Duration.ofMillis(getLong(KEY_IDLE_TIMEOUT, DEFAULT_IDLE_TIMEOUT));
    }

    public Duration getIdleMargin() {
        return Duration.ofMillis(getLong(KEY_IDLE_MARGIN, DEFAULT_IDLE_MARGIN));
    }

    // ── Snapshots / browser ────────────────────────────────────────────────

    /** Snapshot root, relative to the workspace root. */
    public String getSnapshotDir() {
        return getString(KEY_SNAPSHOT_DIR, DEFAULT_SNAPSHOT_DIR);
    }

    public double getSnapshotThreshold() {
        String raw = props.getProperty(KEY_SNAPSHOT_THRESH);
        if (raw == null || raw.isBlank()) return DEFAULT_SNAPSHOT_THRESH;
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            value = Double.NaN;
        }
        if (!Double.isFinite(value) || value < 0) {
            log.warn("Invalid threshold for key '{}': '{}' — using default {}",
                    KEY_SNAPSHOT_THRESH, raw, DEFAULT_SNAPSHOT_THRESH);
            return DEFAULT_SNAPSHOT_THRESH;
        }
        return value;
    }

    public boolean isHeadless() {
        return getBool(KEY_HEADLESS, DEFAULT_HEADLESS);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? defaultValue : raw.trim();
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    private List<Integer> getIntList(String key, String defaultValue) {
        String raw = getString(key, defaultValue);
        try {
            return parseIntList(raw);
        } catch (NumberFormatException e) {
            log.warn("Invalid integer list for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return parseIntList(defaultValue);
        }
    }

    private static List<Integer> parseIntList(String raw) {
        List<Integer> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                values.add(Integer.parseInt(part.trim()));
            }
        }
        return values;
    }
}
