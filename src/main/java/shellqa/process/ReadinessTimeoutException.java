package shellqa.process;

import shellqa.player.ShellQAException;

/**
 * The application under test never answered its health endpoint within the
 * readiness timeout.
 */
public class ReadinessTimeoutException extends ShellQAException {

    private final String url;

    public ReadinessTimeoutException(String url, String outputTail, Throwable cause) {
        super("server did not become ready: " + url
                + (outputTail == null || outputTail.isBlank() ? "" : "\napplication output:\n" + outputTail), cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
