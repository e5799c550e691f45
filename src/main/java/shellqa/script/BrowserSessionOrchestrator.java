package shellqa.script;

import shellqa.model.ViewportProfile;
import shellqa.player.ErrorCollector;
import shellqa.player.RenderingEngine;
import shellqa.player.ShellQAException;
import shellqa.player.ViewportContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the matching {@link InteractionScript} for every configured breakpoint,
 * one isolated viewport context at a time. Contexts are never open
 * concurrently and each is closed even when its script fails.
 */
public class BrowserSessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BrowserSessionOrchestrator.class);

    private final List<InteractionScript> scripts;

    public BrowserSessionOrchestrator(List<InteractionScript> scripts) {
        this.scripts = List.copyOf(scripts);
    }

    /**
     * Runs all profiles in order, attaching each context to {@code errors}.
     * The first failure aborts the remaining profiles.
     */
    public void runAll(RenderingEngine engine, List<ViewportProfile> profiles, ErrorCollector errors) {
        for (ViewportProfile profile : profiles) {
            InteractionScript script = scriptFor(profile);
            ViewportContext context = engine.openContext(profile);
            try {
                errors.attach(context);
                script.run(context);
            } finally {
                context.close();
            }
        }
        log.info("All {} viewport sessions completed", profiles.size());
    }

    InteractionScript scriptFor(ViewportProfile profile) {
        return scripts.stream()
                .filter(s -> s.appliesTo(profile))
                .findFirst()
                .orElseThrow(() -> new ShellQAException("No interaction script for " + profile));
    }
}
