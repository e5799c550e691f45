package shellqa.player;

import shellqa.model.ViewportProfile;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WindowType;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Map;

/**
 * Chrome-backed {@link RenderingEngine}: one {@link ChromeDriver} per run,
 * one fresh window per viewport context.
 *
 * <p>The window the driver starts with is kept open as an anchor so closing a
 * context never ends the WebDriver session. Before each context is handed
 * out, cookies and origin storage for the application origin are cleared.
 */
public class ChromeRenderingEngine implements RenderingEngine {

    private static final Logger log = LoggerFactory.getLogger(ChromeRenderingEngine.class);

    private final ChromeDriver driver;
    private final String anchorHandle;
    private final String appOrigin;
    private boolean closed = false;

    /**
     * Launches Chrome. Selenium Manager resolves a matching chromedriver.
     *
     * @param headless run without a visible window
     * @param baseUrl  application base URL; its origin is cleared for each context
     */
    public ChromeRenderingEngine(boolean headless, String baseUrl) {
        this(new ChromeDriver(options(headless)), baseUrl);
    }

    ChromeRenderingEngine(ChromeDriver driver, String baseUrl) {
        this.driver       = driver;
        this.anchorHandle = driver.getWindowHandle();
        this.appOrigin    = originOf(baseUrl);
        log.info("ChromeRenderingEngine started (origin {})", appOrigin);
    }

    static ChromeOptions options(boolean headless) {
        ChromeOptions opts = new ChromeOptions();
        if (headless) {
            opts.addArguments("--headless=new");
        }
        opts.addArguments("--hide-scrollbars", "--force-color-profile=srgb", "--disable-gpu");
        return opts;
    }

    @Override
    public ViewportContext openContext(ViewportProfile profile) {
        if (closed) {
            throw new ShellQAException("Rendering engine already closed");
        }
        try {
            driver.switchTo().newWindow(WindowType.WINDOW);
            String handle = driver.getWindowHandle();
            clearOriginState();
            ViewportEmulation.apply(driver, profile);
            log.info("Opened viewport context {} (window {})", profile, handle);
            return new ChromeViewportContext(driver, handle, anchorHandle, profile);
        } catch (WebDriverException e) {
            throw new ShellQAException("Could not open viewport context for " + profile, e);
        }
    }

    private void clearOriginState() {
        driver.manage().deleteAllCookies();
        driver.executeCdpCommand("Storage.clearDataForOrigin",
                Map.of("origin", appOrigin, "storageTypes", "all"));
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            driver.quit();
            log.info("ChromeRenderingEngine stopped");
        } catch (WebDriverException e) {
            log.warn("ChromeRenderingEngine: quit failed: {}", e.getMessage());
        }
    }

    static String originOf(String baseUrl) {
        URI uri = URI.create(baseUrl);
        return uri.getScheme() + "://" + uri.getAuthority();
    }
}
