package shellqa.model;

/**
 * A console error or uncaught page error observed in some viewport context.
 * Records are append-only; nothing mutates or removes them once collected.
 *
 * @param kind     what produced the record
 * @param message  the raw text reported by the browser
 * @param viewport label of the viewport profile the record came from
 */
public record DiagnosticRecord(Kind kind, String message, String viewport) {

    public enum Kind {
        CONSOLE_ERROR("console error"),
        PAGE_ERROR("page error");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public DiagnosticRecord {
        message = message != null ? message : "";
    }

    /** {@code "console error: <text>"} or {@code "page error: <text>"}. */
    public String formatted() {
        return kind.prefix() + ": " + message;
    }

    @Override
    public String toString() {
        return formatted() + " [" + viewport + "]";
    }
}
