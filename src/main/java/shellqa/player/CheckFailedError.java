package shellqa.player;

/**
 * A failed check against the shell under test. Extends {@link AssertionError}
 * so a failing run surfaces the same way any failed assertion does.
 */
public class CheckFailedError extends AssertionError {

    /** What kind of check failed. */
    public enum Kind {
        /** A polled condition never reached its expected value, or a required element was absent. */
        ASSERTION_FAILED,
        /** Baseline and current raster dimensions differ. */
        SIZE_MISMATCH,
        /** Normalised mean pixel difference exceeded the threshold. */
        SNAPSHOT_MISMATCH,
        /** A console or page error was observed at some point during the run. */
        DIAGNOSTIC_ERRORS
    }

    private final Kind kind;

    public CheckFailedError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CheckFailedError(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
