package shellqa.script;

import org.openqa.selenium.By;

/**
 * Test-id hooks the shell exposes, and the attributes read from them.
 */
public final class ShellSelectors {

    public static final By SHELL_ROOT                = testId("shell-root");
    public static final By DESKTOP_SIDEBAR           = testId("desktop-sidebar");
    public static final By MOBILE_MENU_BUTTON        = testId("mobile-menu-button");
    public static final By FULLSCREEN_TOGGLE_HEADER  = testId("fullscreen-toggle-header");
    public static final By FULLSCREEN_TOGGLE_OVERLAY = testId("fullscreen-toggle-overlay");
    public static final By FULLSCREEN_CONTROLS       = testId("fullscreen-controls");
    public static final By FULLSCREEN_REVEAL_STRIP   = testId("fullscreen-reveal-strip");
    public static final By MOBILE_BACKDROP           = testId("mobile-backdrop");
    public static final By MOBILE_DRAWER             = testId("mobile-drawer");
    public static final By DRAWER_NAV_LINKS          =
            By.cssSelector("[data-testid='mobile-drawer'] [data-testid='sidebar-nav'] a");

    public static final String ATTR_FULLSCREEN          = "data-fullscreen";
    public static final String ATTR_MOBILE_SIDEBAR_OPEN = "data-mobile-sidebar-open";
    public static final String ATTR_VISIBLE             = "data-visible";
    public static final String ATTR_EXPANDED            = "aria-expanded";
    public static final String ATTR_CONTROLS            = "aria-controls";

    private ShellSelectors() {}

    public static By testId(String id) {
        return By.cssSelector("[data-testid='" + id + "']");
    }

    /** Desktop sidebar link pointing at {@code href}. */
    public static By sidebarLink(String href) {
        return By.cssSelector("[data-testid='desktop-sidebar'] a[href='" + href + "']");
    }

    /** First desktop sidebar button whose text contains {@code label}. */
    public static By sidebarGroupToggle(String label) {
        return By.xpath("//*[@data-testid='desktop-sidebar']//button[contains(normalize-space(.), '"
                + label + "')]");
    }
}
