package shellqa.player;

import shellqa.model.ViewportProfile;

/**
 * One rendering-engine instance per run. Hands out isolated
 * {@link ViewportContext}s, one at a time.
 */
public interface RenderingEngine extends AutoCloseable {

    /**
     * Opens a fresh context sized and flagged according to {@code profile}.
     * The caller owns the context and must close it.
     */
    ViewportContext openContext(ViewportProfile profile);

    @Override
    void close();
}
