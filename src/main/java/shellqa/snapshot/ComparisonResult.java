package shellqa.snapshot;

import java.nio.file.Path;

/**
 * Outcome of comparing one named snapshot against its baseline.
 *
 * @param name           logical snapshot name
 * @param outcome        what happened
 * @param meanDifference normalised mean difference in [0, 1]; {@code NaN} when not computed
 * @param diffPath       where the difference image was written, or {@code null}
 * @param message        human-readable detail for failures, {@code null} on success
 */
public record ComparisonResult(String name, Outcome outcome, double meanDifference,
                               Path diffPath, String message) {

    public enum Outcome {
        /** Current became the new baseline (update mode or first run). */
        BASELINE_WRITTEN,
        /** Mean difference within threshold. */
        MATCHED,
        SIZE_MISMATCH,
        MISMATCH
    }

    public boolean passed() {
        return outcome == Outcome.BASELINE_WRITTEN || outcome == Outcome.MATCHED;
    }
}
