package shellqa.player;

import shellqa.model.DiagnosticRecord;
import shellqa.model.DiagnosticRecord.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Accumulates console errors and uncaught page errors across every viewport
 * context of a run. One collector per run; each context is attached as it is
 * opened. Order of appearance is preserved and nothing is deduplicated.
 *
 * <p>Browser events are delivered on the driver's event thread, so the
 * backing list is copy-on-write.
 */
public class ErrorCollector {

    private static final Logger log = LoggerFactory.getLogger(ErrorCollector.class);

    private final List<DiagnosticRecord> records = new CopyOnWriteArrayList<>();

    /**
     * Subscribes to {@code context}'s diagnostic events.
     *
     * @return live read-only view of the run-wide record list
     */
    public List<DiagnosticRecord> attach(ViewportContext context) {
        String viewport = context.profile().label();
        context.onConsoleMessage(message -> {
            if (message.isError()) {
                append(new DiagnosticRecord(Kind.CONSOLE_ERROR, message.text(), viewport));
            }
        });
        context.onPageError(error -> append(new DiagnosticRecord(Kind.PAGE_ERROR, error, viewport)));
        log.debug("ErrorCollector attached to {}", viewport);
        return records();
    }

    private void append(DiagnosticRecord record) {
        records.add(record);
        log.warn("[{}] {}", record.viewport(), record.formatted());
    }

    public List<DiagnosticRecord> records() {
        return Collections.unmodifiableList(records);
    }

    /**
     * Fails the run if anything was collected.
     *
     * @throws CheckFailedError of kind {@link CheckFailedError.Kind#DIAGNOSTIC_ERRORS}
     */
    public void assertNone() {
        if (records.isEmpty()) {
            log.info("ErrorCollector: no console or page errors");
            return;
        }
        String detail = records.stream()
                .map(DiagnosticRecord::toString)
                .collect(Collectors.joining("\n"));
        throw new CheckFailedError(CheckFailedError.Kind.DIAGNOSTIC_ERRORS,
                "console errors:\n" + detail);
    }
}
