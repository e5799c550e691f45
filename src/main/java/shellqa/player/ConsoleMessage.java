package shellqa.player;

/**
 * A browser console message as delivered by a {@link ViewportContext}.
 */
public record ConsoleMessage(Level level, String text) {

    /** Browser console message level. */
    public enum Level {
        LOG, DEBUG, INFO, WARNING, ERROR;

        public static Level fromString(String s) {
            if (s == null) return LOG;
            return switch (s.toLowerCase()) {
                case "error"           -> ERROR;
                case "warning", "warn" -> WARNING;
                case "info"            -> INFO;
                case "debug"           -> DEBUG;
                default                -> LOG;
            };
        }
    }

    public boolean isError() {
        return level == Level.ERROR;
    }
}
