package shellqa.player;

/**
 * Unchecked exception thrown by harness components when the run cannot
 * proceed for infrastructure reasons: the application never came up, the
 * browser failed, a file could not be written.
 *
 * <p>Failed checks on the shell itself are reported as {@link CheckFailedError}.
 */
public class ShellQAException extends RuntimeException {

    public ShellQAException(String msg) {
        super(msg);
    }

    public ShellQAException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
