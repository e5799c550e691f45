package shellqa.player;

import shellqa.model.ViewportProfile;
import org.openqa.selenium.chromium.ChromiumDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Sizes and flags the current Chrome window according to a {@link ViewportProfile}
 * using raw CDP {@code Emulation.*} commands (works with every Selenium 4
 * release, no version-specific DevTools bindings needed).
 */
final class ViewportEmulation {

    private static final Logger log = LoggerFactory.getLogger(ViewportEmulation.class);

    private static final double DEVICE_SCALE_FACTOR = 1.0;
    private static final int MAX_TOUCH_POINTS = 5;

    private ViewportEmulation() {}

    static void apply(ChromiumDriver driver, ViewportProfile profile) {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("width",             profile.width());
        metrics.put("height",            profile.height());
        metrics.put("deviceScaleFactor", DEVICE_SCALE_FACTOR);
        metrics.put("mobile",            profile.isMobile());
        driver.executeCdpCommand("Emulation.setDeviceMetricsOverride", metrics);

        Map<String, Object> touch = new HashMap<>();
        touch.put("enabled", profile.isMobile());
        if (profile.isMobile()) {
            touch.put("maxTouchPoints", MAX_TOUCH_POINTS);
        }
        driver.executeCdpCommand("Emulation.setTouchEmulationEnabled", touch);

        log.debug("ViewportEmulation: applied {} mobile={}", profile, profile.isMobile());
    }

    static void reset(ChromiumDriver driver) {
        try {
            driver.executeCdpCommand("Emulation.clearDeviceMetricsOverride", Map.of());
        } catch (RuntimeException e) {
            log.warn("ViewportEmulation: reset failed: {}", e.getMessage());
        }
    }
}
