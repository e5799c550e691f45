package shellqa.script;

import shellqa.model.ViewportProfile;
import shellqa.player.ConditionPoller;
import shellqa.player.Poller;
import shellqa.player.ViewportContext;
import shellqa.snapshot.SnapshotEngine;
import org.openqa.selenium.By;

import static shellqa.script.ShellSelectors.*;

/**
 * Desktop checks: sidebar layout, collapsible navigation groups, and the
 * fullscreen reveal / idle-hide / escape cycle.
 */
public class DesktopScript extends InteractionScript {

    public DesktopScript(ScriptSettings settings, SnapshotEngine snapshots, Poller poller) {
        super(settings, snapshots, poller);
    }

    @Override
    public boolean appliesTo(ViewportProfile profile) {
        return !profile.isMobile();
    }

    @Override
    protected void steps(ViewportContext context, ConditionPoller checks) {
        int width = context.profile().width();

        openRoot(context);
        checks.waitForAttribute(SHELL_ROOT, ATTR_FULLSCREEN, "false");
        checks.waitForVisible(DESKTOP_SIDEBAR, true);
        checks.waitForVisible(MOBILE_MENU_BUTTON, false);

        if (width == settings.nestedCheckWidth()) {
            checkCollapsibleGroup(context, checks);
        }

        captureAt(context, settings.desktopSnapshotWidth(), DEFAULT_DESKTOP);

        enterFullscreen(context, checks);
        checks.waitForVisible(FULLSCREEN_TOGGLE_OVERLAY, false);
        captureAt(context, settings.desktopSnapshotWidth(), FULLSCREEN_HIDDEN_CONTROLS);

        // pointer at the top edge reveals the controls
        context.moveMouse(width / 2, 0);
        checks.waitForAttribute(FULLSCREEN_CONTROLS, ATTR_VISIBLE, "true");
        checks.waitForVisible(FULLSCREEN_TOGGLE_OVERLAY, true);
        captureAt(context, settings.desktopSnapshotWidth(), FULLSCREEN_REVEALED_CONTROLS);

        // focus inside the controls suppresses auto-hide
        context.focus(FULLSCREEN_TOGGLE_OVERLAY);
        pause(settings.pastIdleTimeout());
        checks.waitForAttribute(FULLSCREEN_CONTROLS, ATTR_VISIBLE, "true");

        // the reveal strip does not
        context.focus(FULLSCREEN_REVEAL_STRIP);
        pause(settings.pastIdleTimeout());
        checks.waitForAttribute(FULLSCREEN_CONTROLS, ATTR_VISIBLE, "false");

        exitFullscreenWithEscape(context, checks);
    }

    /**
     * On a nested route the group containing it starts expanded; clicking its
     * toggle collapses it, drops {@code aria-controls} and hides its links.
     */
    private void checkCollapsibleGroup(ViewportContext context, ConditionPoller checks) {
        By link   = sidebarLink(settings.nestedLink());
        By toggle = sidebarGroupToggle(settings.nestedGroup());

        context.navigate(settings.nestedUrl());
        checks.waitForVisible(link, true);
        checks.waitForAttribute(toggle, ATTR_EXPANDED, "true");
        checks.requireAttribute(toggle, ATTR_CONTROLS);

        context.click(toggle);
        checks.waitForAttribute(toggle, ATTR_EXPANDED, "false");
        checks.requireNoAttribute(toggle, ATTR_CONTROLS);
        checks.waitForVisible(link, false);

        openRoot(context);
    }
}
