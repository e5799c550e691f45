package shellqa.player;

import shellqa.model.DiagnosticRecord;
import shellqa.model.ViewportProfile;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.Test;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ErrorCollector} (no browser required).
 */
public class ErrorCollectorTest {

    /** Attaches a collector to a mock context and returns the captured listeners. */
    @SuppressWarnings("unchecked")
    private static Listeners attach(ErrorCollector collector, ViewportProfile profile) {
        ViewportContext context = mock(ViewportContext.class);
        when(context.profile()).thenReturn(profile);
        collector.attach(context);

        ArgumentCaptor<Consumer<ConsoleMessage>> console = ArgumentCaptor.forClass(Consumer.class);
        ArgumentCaptor<Consumer<String>> page = ArgumentCaptor.forClass(Consumer.class);
        verify(context).onConsoleMessage(console.capture());
        verify(context).onPageError(page.capture());
        return new Listeners(console.getValue(), page.getValue());
    }

    private record Listeners(Consumer<ConsoleMessage> console, Consumer<String> page) {}

    @Test
    public void consoleErrors_areRecordedWithPrefix() {
        ErrorCollector collector = new ErrorCollector();
        Listeners l = attach(collector, ViewportProfile.desktop(1280, 900));

        l.console().accept(new ConsoleMessage(ConsoleMessage.Level.ERROR, "TypeError: x is undefined"));

        assertThat(collector.records()).extracting(DiagnosticRecord::formatted)
                .containsExactly("console error: TypeError: x is undefined");
    }

    @Test
    public void nonErrorConsoleMessages_areIgnored() {
        ErrorCollector collector = new ErrorCollector();
        Listeners l = attach(collector, ViewportProfile.desktop(1280, 900));

        l.console().accept(new ConsoleMessage(ConsoleMessage.Level.WARNING, "deprecated API"));
        l.console().accept(new ConsoleMessage(ConsoleMessage.Level.LOG, "hello"));

        assertThat(collector.records()).isEmpty();
        collector.assertNone();
    }

    @Test
    public void pageErrors_areRecordedWithPrefix() {
        ErrorCollector collector = new ErrorCollector();
        Listeners l = attach(collector, ViewportProfile.mobile(390, 844));

        l.page().accept("Uncaught ReferenceError: foo");

        assertThat(collector.records()).singleElement()
                .satisfies(r -> {
                    assertThat(r.kind()).isEqualTo(DiagnosticRecord.Kind.PAGE_ERROR);
                    assertThat(r.formatted()).isEqualTo("page error: Uncaught ReferenceError: foo");
                    assertThat(r.viewport()).isEqualTo("mobile-390x844");
                });
    }

    @Test
    public void records_areSharedAcrossContexts_inOrder_withoutDeduplication() {
        ErrorCollector collector = new ErrorCollector();
        Listeners first  = attach(collector, ViewportProfile.desktop(1024, 900));
        Listeners second = attach(collector, ViewportProfile.mobile(375, 844));

        first.console().accept(new ConsoleMessage(ConsoleMessage.Level.ERROR, "same"));
        second.page().accept("boom");
        second.console().accept(new ConsoleMessage(ConsoleMessage.Level.ERROR, "same"));

        List<String> formatted = collector.records().stream().map(DiagnosticRecord::formatted).toList();
        assertThat(formatted).containsExactly("console error: same", "page error: boom", "console error: same");
    }

    @Test
    public void assertNone_failsWithEveryRecord() {
        ErrorCollector collector = new ErrorCollector();
        Listeners l = attach(collector, ViewportProfile.desktop(1440, 900));
        l.console().accept(new ConsoleMessage(ConsoleMessage.Level.ERROR, "first"));
        l.page().accept("second");

        assertThatThrownBy(collector::assertNone)
                .isInstanceOf(CheckFailedError.class)
                .hasMessageStartingWith("console errors:")
                .hasMessageContaining("console error: first")
                .hasMessageContaining("page error: second")
                .matches(e -> ((CheckFailedError) e).kind() == CheckFailedError.Kind.DIAGNOSTIC_ERRORS);
    }

    @Test
    public void level_fromString_handlesAllCases() {
        assertThat(ConsoleMessage.Level.fromString("error")).isEqualTo(ConsoleMessage.Level.ERROR);
        assertThat(ConsoleMessage.Level.fromString("warning")).isEqualTo(ConsoleMessage.Level.WARNING);
        assertThat(ConsoleMessage.Level.fromString("warn")).isEqualTo(ConsoleMessage.Level.WARNING);
        assertThat(ConsoleMessage.Level.fromString("info")).isEqualTo(ConsoleMessage.Level.INFO);
        assertThat(ConsoleMessage.Level.fromString(null)).isEqualTo(ConsoleMessage.Level.LOG);
    }
}
