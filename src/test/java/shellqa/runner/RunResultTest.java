package shellqa.runner;

import shellqa.model.DiagnosticRecord;
import shellqa.player.CheckFailedError;
import shellqa.snapshot.ComparisonResult;
import shellqa.snapshot.ComparisonResult.Outcome;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RunResultTest {

    private static ComparisonResult ok(String name) {
        return new ComparisonResult(name, Outcome.MATCHED, 0.0, null, null);
    }

    @Test
    public void allMatched_passes() {
        RunResult result = new RunResult(List.of(), List.of(ok("a"), ok("b")));
        assertThat(result.passed()).isTrue();
        assertThat(result.failedComparisons()).isEmpty();
        result.assertComparisonsPassed();
    }

    @Test
    public void diagnostics_failTheResult() {
        RunResult result = new RunResult(
                List.of(new DiagnosticRecord(DiagnosticRecord.Kind.PAGE_ERROR, "x", "mobile-390x844")),
                List.of(ok("a")));
        assertThat(result.passed()).isFalse();
    }

    @Test
    public void singleFailure_isThrownAsIs() {
        ComparisonResult size = new ComparisonResult("default-mobile", Outcome.SIZE_MISMATCH, Double.NaN, null,
                "snapshot size mismatch for default-mobile: (390, 844) != (390, 900)");
        RunResult result = new RunResult(List.of(), List.of(ok("a"), size));

        assertThatThrownBy(result::assertComparisonsPassed)
                .isInstanceOf(CheckFailedError.class)
                .hasMessage("snapshot size mismatch for default-mobile: (390, 844) != (390, 900)")
                .matches(e -> ((CheckFailedError) e).kind() == CheckFailedError.Kind.SIZE_MISMATCH);
    }

    @Test
    public void severalFailures_areListedTogether() {
        ComparisonResult a = new ComparisonResult("a", Outcome.MISMATCH, 0.5, Path.of("diff/a.png"), "snapshot a differs");
        ComparisonResult b = new ComparisonResult("b", Outcome.MISMATCH, 0.6, Path.of("diff/b.png"), "snapshot b differs");
        RunResult result = new RunResult(List.of(), List.of(a, b));

        assertThat(result.failedComparisons()).containsExactly(a, b);
        assertThatThrownBy(result::assertComparisonsPassed)
                .hasMessageStartingWith("2 snapshot comparisons failed:")
                .hasMessageContaining("snapshot a differs")
                .hasMessageContaining("snapshot b differs");
    }
}
