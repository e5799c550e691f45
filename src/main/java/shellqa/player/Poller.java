package shellqa.player;

import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.support.ui.FluentWait;
import org.openqa.selenium.support.ui.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fixed-interval retry-until-timeout primitive. Re-reads a probe at a
 * constant period until the value satisfies a predicate or the timeout
 * elapses. No backoff: the interval stays constant so short UI transitions
 * are observed with bounded latency.
 *
 * <p>Built on Selenium's {@link FluentWait}; the clock and sleeper are
 * injectable so callers can drive it with simulated time.
 */
public class Poller {

    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;

    public Poller(Duration interval) {
        this(interval, Clock.systemDefaultZone(), Sleeper.SYSTEM_SLEEPER);
    }

    public Poller(Duration interval, Clock clock, Sleeper sleeper) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + interval);
        }
        this.interval = interval;
        this.clock    = clock;
        this.sleeper  = sleeper;
    }

    public Duration interval() {
        return interval;
    }

    public Sleeper sleeper() {
        return sleeper;
    }

    /**
     * Polls {@code probe} until {@code accept} holds for its value.
     *
     * @param description what is being waited for, used in the timeout message
     * @param probe       reads the current value
     * @param accept      predicate the value must satisfy
     * @param timeout     upper bound on the wait
     * @param ignored     runtime exceptions from {@code probe} treated as "not yet"
     * @return the accepted value
     * @throws PollTimeoutException if the condition never held within {@code timeout}
     */
    @SafeVarargs
    public final <T> T until(String description, Supplier<T> probe, Predicate<? super T> accept,
                             Duration timeout, Class<? extends RuntimeException>... ignored) {
        AtomicReference<T> last = new AtomicReference<>();
        FluentWait<Supplier<T>> wait = new FluentWait<>(probe, clock, sleeper)
                .withTimeout(timeout)
                .pollingEvery(interval)
                .ignoreAll(new ArrayList<Class<? extends Throwable>>(Arrays.asList(ignored)));
        try {
            return wait.until(p -> {
                T value = p.get();
                last.set(value);
                // FluentWait treats null as "not yet", so box acceptance separately
                return accept.test(value) ? new Holder<>(value) : null;
            }).value();
        } catch (TimeoutException e) {
            throw new PollTimeoutException(
                    "Timed out after " + timeout.toMillis() + "ms waiting for " + description,
                    last.get(), e);
        }
    }

    private record Holder<T>(T value) {}
}
