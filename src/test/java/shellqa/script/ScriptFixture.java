package shellqa.script;

import shellqa.config.HarnessConfig;
import shellqa.model.ViewportProfile;
import shellqa.player.FakeClock;
import shellqa.player.Poller;
import shellqa.snapshot.SnapshotDirs;
import shellqa.snapshot.SnapshotEngine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Default settings, a simulated clock and a temporary snapshot tree, shared
 * by the script tests.
 */
final class ScriptFixture {

    static final String BASE_URL = "http://127.0.0.1:4180";

    final FakeClock clock = new FakeClock();
    final Poller poller = clock.poller(Duration.ofMillis(50));
    final ScriptSettings settings = ScriptSettings.from(HarnessConfig.of(new Properties()), BASE_URL);
    final SnapshotEngine snapshots;

    ScriptFixture() {
        try {
            Path root = Files.createTempDirectory("script-snapshots");
            SnapshotDirs dirs = SnapshotDirs.under(root);
            dirs.reset();
            snapshots = new SnapshotEngine(dirs);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    FakeShell shell(ViewportProfile profile) {
        return new FakeShell(profile, clock);
    }

    DesktopScript desktop() {
        return new DesktopScript(settings, snapshots, poller);
    }

    MobileScript mobile() {
        return new MobileScript(settings, snapshots, poller);
    }

    boolean captured(String name) {
        return Files.exists(snapshots.dirs().currentOf(name));
    }
}
