package shellqa.script;

import shellqa.model.ViewportProfile;
import shellqa.player.ConditionPoller;
import shellqa.player.Poller;
import shellqa.player.ShellQAException;
import shellqa.player.ViewportContext;
import shellqa.snapshot.SnapshotEngine;
import org.openqa.selenium.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

import static shellqa.script.ShellSelectors.*;

/**
 * A linear sequence of UI actions and polled assertions run against one
 * viewport context. Subclasses supply the device-class specific steps; the
 * navigation, conditional snapshot and fullscreen sub-sequences shared by
 * both live here.
 */
public abstract class InteractionScript {

    private static final Logger log = LoggerFactory.getLogger(InteractionScript.class);

    public static final String DEFAULT_DESKTOP              = "default-desktop";
    public static final String FULLSCREEN_HIDDEN_CONTROLS   = "fullscreen-hidden-controls";
    public static final String FULLSCREEN_REVEALED_CONTROLS = "fullscreen-revealed-controls";
    public static final String DEFAULT_MOBILE               = "default-mobile";
    public static final String MOBILE_DRAWER_OPEN           = "mobile-drawer-open";

    /** Every snapshot a full run captures, in comparison order. */
    public static final List<String> SNAPSHOT_NAMES = List.of(
            DEFAULT_DESKTOP,
            DEFAULT_MOBILE,
            FULLSCREEN_HIDDEN_CONTROLS,
            FULLSCREEN_REVEALED_CONTROLS,
            MOBILE_DRAWER_OPEN);

    protected final ScriptSettings settings;
    protected final SnapshotEngine snapshots;
    protected final Poller poller;

    protected InteractionScript(ScriptSettings settings, SnapshotEngine snapshots, Poller poller) {
        this.settings  = settings;
        this.snapshots = snapshots;
        this.poller    = poller;
    }

    /** Whether this script drives viewports of {@code profile}'s device class. */
    public abstract boolean appliesTo(ViewportProfile profile);

    /** Runs every step against {@code context}; the first failed check aborts the rest. */
    public final void run(ViewportContext context) {
        log.info("[{}] {} starting", context.profile(), getClass().getSimpleName());
        steps(context, new ConditionPoller(context, poller, settings.pollTimeout()));
        log.info("[{}] {} passed", context.profile(), getClass().getSimpleName());
    }

    protected abstract void steps(ViewportContext context, ConditionPoller checks);

    // ── Shared sub-sequences ─────────────────────────────────────────────────

    protected void openRoot(ViewportContext context) {
        context.navigate(settings.rootUrl());
    }

    /** Captures {@code name} only at the representative width of this breakpoint class. */
    protected void captureAt(ViewportContext context, int representativeWidth, String name) {
        if (context.profile().width() == representativeWidth) {
            snapshots.capture(context, name);
        }
    }

    /** Header toggle on; fullscreen starts with its controls hidden. */
    protected void enterFullscreen(ViewportContext context, ConditionPoller checks) {
        context.click(FULLSCREEN_TOGGLE_HEADER);
        checks.waitForAttribute(SHELL_ROOT, ATTR_FULLSCREEN, "true");
        checks.waitForAttribute(FULLSCREEN_CONTROLS, ATTR_VISIBLE, "false");
    }

    protected void exitFullscreenWithEscape(ViewportContext context, ConditionPoller checks) {
        context.press(Keys.ESCAPE);
        checks.waitForAttribute(SHELL_ROOT, ATTR_FULLSCREEN, "false");
    }

    /** Stays idle for a fixed duration, e.g. to let an auto-hide timer fire. */
    protected void pause(Duration duration) {
        try {
            poller.sleeper().sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ShellQAException("Interrupted while waiting " + duration.toMillis() + "ms", e);
        }
    }
}
