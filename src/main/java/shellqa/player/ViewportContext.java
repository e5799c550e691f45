package shellqa.player;

import shellqa.model.ViewportProfile;
import org.openqa.selenium.By;
import org.openqa.selenium.Keys;

import java.util.function.Consumer;

/**
 * An isolated browser session scoped to one {@link ViewportProfile}.
 *
 * <p>Element lookups always address the first match of the locator, re-resolved
 * on every call, so callers never hold on to stale element handles.
 */
public interface ViewportContext extends AutoCloseable {

    ViewportProfile profile();

    /** Navigates to {@code url} and returns once the document has loaded. */
    void navigate(String url);

    /**
     * Current value of attribute {@code name} on the first match of
     * {@code selector}, or {@code null} if the element or the attribute is absent.
     */
    String attribute(By selector, String name);

    /** Whether the first match of {@code selector} is rendered visibly; {@code false} when absent. */
    boolean isVisible(By selector);

    /** Number of elements currently matching {@code selector}. */
    int count(By selector);

    /** Clicks the first match of {@code selector}. */
    void click(By selector);

    /**
     * Dispatches a pointer click at an offset from the top-left corner of the
     * first match of {@code selector}, regardless of what overlaps that point.
     */
    void clickAt(By selector, int offsetX, int offsetY);

    /** Moves keyboard focus to the first match of {@code selector}. */
    void focus(By selector);

    /** Presses and releases {@code key} on the focused element. */
    void press(Keys key);

    /** Moves the pointer to viewport coordinates ({@code x}, {@code y}). */
    void moveMouse(int x, int y);

    /** Captures the whole document, not just the visible viewport, as PNG bytes. */
    byte[] captureFullPage();

    /** Subscribes to console messages of every level emitted by documents in this context. */
    void onConsoleMessage(Consumer<ConsoleMessage> listener);

    /** Subscribes to uncaught script errors raised by documents in this context. */
    void onPageError(Consumer<String> listener);

    /** Destroys the context. Must not throw checked exceptions. */
    @Override
    void close();
}
