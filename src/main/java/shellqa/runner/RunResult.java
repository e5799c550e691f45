package shellqa.runner;

import shellqa.model.DiagnosticRecord;
import shellqa.player.CheckFailedError;
import shellqa.snapshot.ComparisonResult;
import shellqa.snapshot.SnapshotEngine;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything a run observed: diagnostic records and snapshot comparisons.
 * The run passes only when there are no diagnostics and every comparison passed.
 */
public record RunResult(List<DiagnosticRecord> diagnostics, List<ComparisonResult> comparisons) {

    public RunResult {
        diagnostics = List.copyOf(diagnostics);
        comparisons = List.copyOf(comparisons);
    }

    public boolean passed() {
        return diagnostics.isEmpty() && comparisons.stream().allMatch(ComparisonResult::passed);
    }

    public List<ComparisonResult> failedComparisons() {
        return comparisons.stream().filter(c -> !c.passed()).toList();
    }

    /**
     * Throws the first failed comparison, with every failure listed in the message.
     *
     * @throws CheckFailedError if any comparison failed
     */
    public void assertComparisonsPassed() {
        List<ComparisonResult> failed = failedComparisons();
        if (failed.isEmpty()) return;
        CheckFailedError first = SnapshotEngine.toError(failed.get(0));
        if (failed.size() == 1) throw first;
        String all = failed.stream().map(ComparisonResult::message).collect(Collectors.joining("\n  "));
        throw new CheckFailedError(first.kind(),
                failed.size() + " snapshot comparisons failed:\n  " + all, first);
    }
}
