package shellqa.process;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * One lightweight HTTP GET against the application's health path. Any status
 * in [200, 500) counts as ready; connection failures count as not ready.
 */
public class ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(ReadinessProbe.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(1);

    private final OkHttpClient http;

    public ReadinessProbe() {
        this(new OkHttpClient.Builder()
                .callTimeout(REQUEST_TIMEOUT)
                .followRedirects(false)
                .retryOnConnectionFailure(false)
                .build());
    }

    public ReadinessProbe(OkHttpClient http) {
        this.http = http;
    }

    /** Returns {@code true} if {@code url} answered with a status in [200, 500). */
    public boolean isReady(String url) {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = http.newCall(request).execute()) {
            int status = response.code();
            log.debug("Readiness probe {} → {}", url, status);
            return status >= 200 && status < 500;
        } catch (IOException e) {
            log.debug("Readiness probe {} failed: {}", url, e.getMessage());
            return false;
        }
    }
}
