package shellqa.player;

/**
 * Raised by {@link Poller} when a condition never held within its timeout.
 * Carries the value observed on the last poll so callers can report it.
 */
public class PollTimeoutException extends ShellQAException {

    private final transient Object lastObserved;

    public PollTimeoutException(String msg, Object lastObserved, Throwable cause) {
        super(msg, cause);
        this.lastObserved = lastObserved;
    }

    public Object lastObserved() {
        return lastObserved;
    }
}
