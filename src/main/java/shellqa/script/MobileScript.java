package shellqa.script;

import shellqa.model.ViewportProfile;
import shellqa.player.ConditionPoller;
import shellqa.player.Poller;
import shellqa.player.ViewportContext;
import shellqa.snapshot.SnapshotEngine;
import org.openqa.selenium.Keys;

import static shellqa.script.ShellSelectors.*;

/**
 * Mobile-touch checks: the navigation drawer (keyboard, pointer, backdrop and
 * route-change dismissal) and fullscreen reveal through the reveal strip.
 */
public class MobileScript extends InteractionScript {

    /** Distance from the viewport edge for backdrop and reveal-strip clicks. */
    static final int EDGE_INSET = 6;

    public MobileScript(ScriptSettings settings, SnapshotEngine snapshots, Poller poller) {
        super(settings, snapshots, poller);
    }

    @Override
    public boolean appliesTo(ViewportProfile profile) {
        return profile.isMobile();
    }

    @Override
    protected void steps(ViewportContext context, ConditionPoller checks) {
        int width = context.profile().width();

        openRoot(context);
        checks.waitForAttribute(SHELL_ROOT, ATTR_MOBILE_SIDEBAR_OPEN, "false");
        checks.waitForVisible(MOBILE_MENU_BUTTON, true);
        captureAt(context, settings.mobileSnapshotWidth(), DEFAULT_MOBILE);

        // keyboard: Enter opens, Escape closes
        context.focus(MOBILE_MENU_BUTTON);
        context.press(Keys.ENTER);
        expectDrawer(checks, true);
        context.press(Keys.ESCAPE);
        expectDrawer(checks, false);

        // pointer open, backdrop dismiss near the far corner
        context.click(MOBILE_MENU_BUTTON);
        expectDrawer(checks, true);
        captureAt(context, settings.mobileSnapshotWidth(), MOBILE_DRAWER_OPEN);
        context.clickAt(MOBILE_BACKDROP, width - EDGE_INSET, EDGE_INSET);
        expectDrawer(checks, false);

        // route change dismisses the drawer
        context.click(MOBILE_MENU_BUTTON);
        expectDrawer(checks, true);
        checks.waitForVisible(MOBILE_DRAWER, true);
        checks.requirePresent(DRAWER_NAV_LINKS, "sidebar links for route change drawer test");
        context.click(DRAWER_NAV_LINKS);
        expectDrawer(checks, false);

        enterFullscreen(context, checks);
        context.clickAt(FULLSCREEN_REVEAL_STRIP, EDGE_INSET, 1);
        checks.waitForAttribute(FULLSCREEN_CONTROLS, ATTR_VISIBLE, "true");
        exitFullscreenWithEscape(context, checks);
    }

    private static void expectDrawer(ConditionPoller checks, boolean open) {
        checks.waitForAttribute(SHELL_ROOT, ATTR_MOBILE_SIDEBAR_OPEN, String.valueOf(open));
    }
}
