package shellqa.model;

/**
 * One breakpoint the shell is checked against. Drives exactly one isolated
 * viewport context per run.
 */
public record ViewportProfile(int width, int height, DeviceClass deviceClass) {

    public ViewportProfile {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Viewport dimensions must be positive: " + width + "x" + height);
        }
        if (deviceClass == null) {
            throw new IllegalArgumentException("deviceClass must not be null");
        }
    }

    public static ViewportProfile desktop(int width, int height) {
        return new ViewportProfile(width, height, DeviceClass.DESKTOP);
    }

    public static ViewportProfile mobile(int width, int height) {
        return new ViewportProfile(width, height, DeviceClass.MOBILE_TOUCH);
    }

    public boolean isMobile() {
        return deviceClass.isMobile();
    }

    /** Short label used in log lines, e.g. {@code desktop-1280x900}. */
    public String label() {
        return (isMobile() ? "mobile" : "desktop") + "-" + width + "x" + height;
    }

    @Override
    public String toString() {
        return label();
    }
}
