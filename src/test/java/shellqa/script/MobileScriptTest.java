package shellqa.script;

import shellqa.model.ViewportProfile;
import shellqa.player.CheckFailedError;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static shellqa.script.InteractionScript.*;
import static shellqa.script.ShellSelectors.*;

/**
 * Drives {@link MobileScript} against a {@link FakeShell}.
 */
public class MobileScriptTest {

    private ScriptFixture fx;

    @BeforeMethod
    public void setUp() {
        fx = new ScriptFixture();
    }

    @Test(description = "At 390 wide the default and drawer-open snapshots are captured")
    public void testRepresentativeWidthCapturesMobileSnapshots() {
        FakeShell shell = fx.shell(ViewportProfile.mobile(390, 844));

        fx.mobile().run(shell);

        assertThat(fx.captured(DEFAULT_MOBILE)).isTrue();
        assertThat(fx.captured(MOBILE_DRAWER_OPEN)).isTrue();
        assertThat(fx.captured(DEFAULT_DESKTOP)).isFalse();
    }

    @Test(description = "Backdrop and reveal strip are clicked near the viewport edges")
    public void testEdgeClicks() {
        FakeShell shell = fx.shell(ViewportProfile.mobile(430, 844));

        fx.mobile().run(shell);

        assertThat(shell.actions()).containsSubsequence(
                "focus " + MOBILE_MENU_BUTTON,
                "press ENTER",
                "press ESCAPE",
                "click " + MOBILE_MENU_BUTTON,
                "clickAt " + MOBILE_BACKDROP + " @424,6",
                "click " + MOBILE_MENU_BUTTON,
                "click " + DRAWER_NAV_LINKS,
                "click " + FULLSCREEN_TOGGLE_HEADER,
                "clickAt " + FULLSCREEN_REVEAL_STRIP + " @6,1",
                "press ESCAPE");
        assertThat(fx.snapshots.dirs().current()).isEmptyDirectory();
    }

    @Test(description = "A drawer without navigation links fails with a descriptive message")
    public void testMissingDrawerLinks() {
        FakeShell shell = fx.shell(ViewportProfile.mobile(375, 844)).withNavLinks(0);

        assertThatThrownBy(() -> fx.mobile().run(shell))
                .isInstanceOf(CheckFailedError.class)
                .hasMessageContaining("missing sidebar links for route change drawer test");
    }

    @Test(description = "Escape that leaves the drawer open fails the keyboard check")
    public void testEscapeMustCloseDrawer() {
        FakeShell shell = fx.shell(ViewportProfile.mobile(390, 844)).ignoreEscape();

        assertThatThrownBy(() -> fx.mobile().run(shell))
                .isInstanceOf(CheckFailedError.class)
                .hasMessageContaining("data-mobile-sidebar-open=false")
                .hasMessageContaining("got 'true'");
        assertThat(fx.captured(MOBILE_DRAWER_OPEN)).isFalse();
    }

    @Test(description = "A drawer that survives a route change fails naming the root and the open state")
    public void testNavigationMustCloseDrawer() {
        FakeShell shell = fx.shell(ViewportProfile.mobile(390, 844)).keepDrawerOpenOnNavigation();

        assertThatThrownBy(() -> fx.mobile().run(shell))
                .isInstanceOf(CheckFailedError.class)
                .hasMessageContaining(SHELL_ROOT.toString())
                .hasMessageContaining("data-mobile-sidebar-open=false")
                .hasMessageContaining("got 'true'");
        assertThat(shell.actions()).contains("click " + DRAWER_NAV_LINKS);
        assertThat(shell.actions()).doesNotContain("click " + FULLSCREEN_TOGGLE_HEADER);
    }

    @Test(description = "A backdrop click that leaves the drawer open fails before the route change step")
    public void testBackdropMustCloseDrawer() {
        FakeShell shell = fx.shell(ViewportProfile.mobile(390, 844)).ignoreBackdropClick();

        assertThatThrownBy(() -> fx.mobile().run(shell))
                .isInstanceOf(CheckFailedError.class)
                .hasMessageContaining(SHELL_ROOT.toString())
                .hasMessageContaining("data-mobile-sidebar-open=false")
                .hasMessageContaining("got 'true'");
        assertThat(shell.actions()).contains("clickAt " + MOBILE_BACKDROP + " @384,6");
        assertThat(shell.actions()).doesNotContain("click " + DRAWER_NAV_LINKS);
    }

    @Test
    public void testAppliesToMobileOnly() {
        MobileScript script = fx.mobile();
        assertThat(script.appliesTo(ViewportProfile.mobile(375, 844))).isTrue();
        assertThat(script.appliesTo(ViewportProfile.desktop(1280, 900))).isFalse();
    }
}
