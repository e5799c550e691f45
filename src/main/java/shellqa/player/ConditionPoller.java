package shellqa.player;

import org.openqa.selenium.By;
import org.openqa.selenium.StaleElementReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Turns asynchronous UI state changes into deterministic pass/fail checks by
 * re-reading live DOM state of one {@link ViewportContext} at a fixed interval.
 *
 * <p>Every failure is a {@link CheckFailedError} of kind
 * {@link CheckFailedError.Kind#ASSERTION_FAILED} naming the selector, the
 * expectation and the value last observed.
 */
public class ConditionPoller {

    private static final Logger log = LoggerFactory.getLogger(ConditionPoller.class);

    /** Default wait for a single condition. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(4000);

    /** Default poll period. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(50);

    private final ViewportContext context;
    private final Poller poller;
    private final Duration timeout;

    public ConditionPoller(ViewportContext context) {
        this(context, new Poller(DEFAULT_INTERVAL), DEFAULT_TIMEOUT);
    }

    public ConditionPoller(ViewportContext context, Poller poller, Duration timeout) {
        this.context = context;
        this.poller  = poller;
        this.timeout = timeout;
    }

    public void waitForAttribute(By selector, String attrName, String expectedValue) {
        waitForAttribute(selector, attrName, expectedValue, timeout);
    }

    /**
     * Waits until attribute {@code attrName} of the first match of
     * {@code selector} equals {@code expectedValue}. An expected value of
     * {@code null} waits for the attribute (or element) to be absent.
     */
    public void waitForAttribute(By selector, String attrName, String expectedValue, Duration timeout) {
        log.debug("[{}] waiting up to {}ms for {} [{}={}]",
                context.profile(), timeout.toMillis(), selector, attrName, expectedValue);
        try {
            poller.until(selector + " [" + attrName + "=" + expectedValue + "]",
                    () -> context.attribute(selector, attrName),
                    value -> Objects.equals(value, expectedValue),
                    timeout,
                    StaleElementReferenceException.class);
        } catch (PollTimeoutException e) {
            throw new CheckFailedError(CheckFailedError.Kind.ASSERTION_FAILED, String.format(
                    "[%s] expected %s [%s=%s], got %s",
                    context.profile(), selector, attrName, expectedValue, quote(e.lastObserved())), e);
        }
    }

    public void waitForVisible(By selector, boolean expectedVisible) {
        waitForVisible(selector, expectedVisible, timeout);
    }

    /** Waits until the visibility of the first match of {@code selector} equals {@code expectedVisible}. */
    public void waitForVisible(By selector, boolean expectedVisible, Duration timeout) {
        log.debug("[{}] waiting up to {}ms for {} visible={}",
                context.profile(), timeout.toMillis(), selector, expectedVisible);
        try {
            poller.until(selector + " visible=" + expectedVisible,
                    () -> context.isVisible(selector),
                    visible -> visible == expectedVisible,
                    timeout,
                    StaleElementReferenceException.class);
        } catch (PollTimeoutException e) {
            throw new CheckFailedError(CheckFailedError.Kind.ASSERTION_FAILED, String.format(
                    "[%s] expected visibility %s for %s, got %s",
                    context.profile(), expectedVisible, selector, e.lastObserved()), e);
        }
    }

    /**
     * Reads an attribute once and fails unless it is present and non-empty.
     *
     * @return the attribute value
     */
    public String requireAttribute(By selector, String attrName) {
        String value = context.attribute(selector, attrName);
        if (value == null || value.isEmpty()) {
            throw new CheckFailedError(CheckFailedError.Kind.ASSERTION_FAILED, String.format(
                    "[%s] expected %s on %s, but it is missing", context.profile(), attrName, selector));
        }
        return value;
    }

    /** Reads an attribute once and fails if it is present. */
    public void requireNoAttribute(By selector, String attrName) {
        String value = context.attribute(selector, attrName);
        if (value != null) {
            throw new CheckFailedError(CheckFailedError.Kind.ASSERTION_FAILED, String.format(
                    "[%s] expected %s to be removed from %s, got '%s'",
                    context.profile(), attrName, selector, value));
        }
    }

    /** Fails unless at least one element matches {@code selector}. */
    public void requirePresent(By selector, String what) {
        if (context.count(selector) == 0) {
            throw new CheckFailedError(CheckFailedError.Kind.ASSERTION_FAILED, String.format(
                    "[%s] missing %s: nothing matches %s", context.profile(), what, selector));
        }
    }

    private static String quote(Object value) {
        return value == null ? "null" : "'" + value + "'";
    }
}
