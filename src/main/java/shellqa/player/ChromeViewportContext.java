package shellqa.player;

import shellqa.model.ViewportProfile;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chromium.ChromiumDriver;
import org.openqa.selenium.devtools.DevTools;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * {@link ViewportContext} backed by one Chrome window. Diagnostic events come
 * from a DevTools session bound to that window.
 */
class ChromeViewportContext implements ViewportContext {

    private static final Logger log = LoggerFactory.getLogger(ChromeViewportContext.class);

    private static final Duration PAGE_LOAD_TIMEOUT = Duration.ofSeconds(30);

    private final ChromiumDriver driver;
    private final String handle;
    private final String anchorHandle;
    private final ViewportProfile profile;
    private final DevTools devTools;
    private boolean closed = false;

    ChromeViewportContext(ChromiumDriver driver, String handle, String anchorHandle, ViewportProfile profile) {
        this.driver       = driver;
        this.handle       = handle;
        this.anchorHandle = anchorHandle;
        this.profile      = profile;
        this.devTools     = driver.getDevTools();
        devTools.createSession(handle);
    }

    @Override
    public ViewportProfile profile() {
        return profile;
    }

    @Override
    public void navigate(String url) {
        log.debug("[{}] navigating to {}", profile, url);
        driver.get(url);
        new WebDriverWait(driver, PAGE_LOAD_TIMEOUT).until(d -> "complete".equals(
                ((JavascriptExecutor) d).executeScript("return document.readyState")));
    }

    @Override
    public String attribute(By selector, String name) {
        List<WebElement> matches = driver.findElements(selector);
        return matches.isEmpty() ? null : matches.get(0).getDomAttribute(name);
    }

    @Override
    public boolean isVisible(By selector) {
        List<WebElement> matches = driver.findElements(selector);
        return !matches.isEmpty() && matches.get(0).isDisplayed();
    }

    @Override
    public int count(By selector) {
        return driver.findElements(selector).size();
    }

    @Override
    public void click(By selector) {
        log.debug("[{}] click {}", profile, selector);
        driver.findElement(selector).click();
    }

    @Override
    public void clickAt(By selector, int offsetX, int offsetY) {
        Rectangle rect = driver.findElement(selector).getRect();
        int x = rect.getX() + offsetX;
        int y = rect.getY() + offsetY;
        log.debug("[{}] click {} at ({}, {})", profile, selector, x, y);
        new Actions(driver).moveToLocation(x, y).click().perform();
    }

    @Override
    public void focus(By selector) {
        WebElement element = driver.findElement(selector);
        ((JavascriptExecutor) driver).executeScript("arguments[0].focus();", element);
    }

    @Override
    public void press(Keys key) {
        log.debug("[{}] press {}", profile, key.name());
        new Actions(driver).sendKeys(key).perform();
    }

    @Override
    public void moveMouse(int x, int y) {
        new Actions(driver).moveToLocation(x, y).perform();
    }

    @Override
    @SuppressWarnings("unchecked")
    public byte[] captureFullPage() {
        Map<String, Object> metrics = driver.executeCdpCommand("Page.getLayoutMetrics", Map.of());
        Map<String, Object> size = (Map<String, Object>) metrics.getOrDefault("cssContentSize",
                metrics.get("contentSize"));
        Map<String, Object> clip = Map.of(
                "x", 0,
                "y", 0,
                "width", ((Number) size.get("width")).doubleValue(),
                "height", ((Number) size.get("height")).doubleValue(),
                "scale", 1);
        Map<String, Object> shot = driver.executeCdpCommand("Page.captureScreenshot", Map.of(
                "format", "png",
                "captureBeyondViewport", true,
                "clip", clip));
        return Base64.getDecoder().decode((String) shot.get("data"));
    }

    @Override
    public void onConsoleMessage(Consumer<ConsoleMessage> listener) {
        devTools.getDomains().events().addConsoleListener(event -> listener.accept(new ConsoleMessage(
                ConsoleMessage.Level.fromString(event.getType()),
                String.join(" ", event.getMessages()))));
    }

    @Override
    public void onPageError(Consumer<String> listener) {
        devTools.getDomains().events().addJavascriptExceptionListener(
                error -> listener.accept(error.getMessage()));
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            devTools.clearListeners();
            devTools.disconnectSession();
        } catch (WebDriverException e) {
            log.warn("[{}] could not detach DevTools session: {}", profile, e.getMessage());
        }
        try {
            ViewportEmulation.reset(driver);
            driver.close();
            driver.switchTo().window(anchorHandle);
            log.info("Closed viewport context {} (window {})", profile, handle);
        } catch (WebDriverException e) {
            throw new ShellQAException("Could not close viewport context " + profile, e);
        }
    }
}
