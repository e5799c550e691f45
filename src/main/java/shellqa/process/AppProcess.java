package shellqa.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Handle on the running application under test. Owns the subprocess and a
 * daemon thread draining its merged stdout/stderr into the log, keeping the
 * most recent lines for failure messages.
 *
 * <p>Created and terminated only by {@link AppProcessManager}.
 */
public class AppProcess {

    private static final Logger log = LoggerFactory.getLogger(AppProcess.class);

    static final int TAIL_LINES = 50;

    private final Process process;
    private final Deque<String> tail = new ArrayDeque<>();
    private final Thread drainer;

    AppProcess(Process process) {
        this.process = process;
        this.drainer = new Thread(this::drain, "app-output-" + process.pid());
        drainer.setDaemon(true);
        drainer.start();
    }

    Process process() {
        return process;
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /** Exit code, only meaningful once {@link #isAlive()} is false. */
    public int exitValue() {
        return process.exitValue();
    }

    /** The most recent output lines, oldest first. */
    public List<String> outputTail() {
        synchronized (tail) {
            return List.copyOf(tail);
        }
    }

    private void drain() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[app] {}", line);
                synchronized (tail) {
                    if (tail.size() == TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }
            }
        } catch (IOException e) {
            // stream closes underneath us when the process is killed
            log.debug("Application output closed: {}", e.getMessage());
        }
    }
}
