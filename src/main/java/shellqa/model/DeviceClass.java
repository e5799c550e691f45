package shellqa.model;

/**
 * Device class a viewport is emulated as. Mobile-touch viewports carry the
 * mobile metadata flag and touch support; desktop viewports carry neither.
 */
public enum DeviceClass {
    DESKTOP,
    MOBILE_TOUCH;

    public boolean isMobile() {
        return this == MOBILE_TOUCH;
    }
}
