package shellqa.snapshot;

import shellqa.player.ShellQAException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * The three sibling snapshot directories: {@code baseline} (persists across
 * runs), {@code current} (regenerated every run) and {@code diff} (populated
 * only on mismatch).
 */
public record SnapshotDirs(Path baseline, Path current, Path diff) {

    private static final Logger log = LoggerFactory.getLogger(SnapshotDirs.class);

    /** Lays out {@code baseline/}, {@code current/} and {@code diff/} under {@code root}. */
    public static SnapshotDirs under(Path root) {
        return new SnapshotDirs(root.resolve("baseline"), root.resolve("current"), root.resolve("diff"));
    }

    public Path baselineOf(String name) {
        return baseline.resolve(fileName(name));
    }

    public Path currentOf(String name) {
        return current.resolve(fileName(name));
    }

    public Path diffOf(String name) {
        return diff.resolve(fileName(name));
    }

    /**
     * Wipes {@code current} and {@code diff} and recreates an empty
     * {@code current}. The baseline directory is never touched.
     */
    public void reset() {
        try {
            deleteRecursively(current);
            deleteRecursively(diff);
            Files.createDirectories(current);
            log.info("Snapshot directories reset (baseline kept at {})", baseline.toAbsolutePath());
        } catch (IOException e) {
            throw new ShellQAException("Could not reset snapshot directories under " + current.getParent(), e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    private static String fileName(String name) {
        return name.replaceAll("[^a-zA-Z0-9_\\-]", "_") + ".png";
    }
}
