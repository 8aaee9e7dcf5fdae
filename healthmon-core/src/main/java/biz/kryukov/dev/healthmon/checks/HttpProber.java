package biz.kryukov.dev.healthmon.checks;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.ErrorClassifier;
import biz.kryukov.dev.healthmon.Prober;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP prober: performs a single GET and treats any status below 400 as healthy.
 *
 * <p>The whole exchange (connect, response headers and the discarded body) is bounded by
 * the timeout. Redirects are followed; the final status decides.
 */
public final class HttpProber implements Prober {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProber.class);

    static final String USER_AGENT = "healthmon/0.1.0";
    static final String INTERRUPTED_MESSAGE = "Probe interrupted";

    private final HttpClient client;
    private final Clock clock;

    public HttpProber() {
        this(Clock.systemUTC());
    }

    public HttpProber(Clock clock) {
        this(defaultClient(), clock);
    }

    public HttpProber(HttpClient client, Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CheckOutcome probe(String name, String url, Duration timeout) {
        long startNs = System.nanoTime();
        CompletableFuture<HttpResponse<Void>> future = null;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();

            future = client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
            HttpResponse<Void> response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);

            CheckOutcome outcome = CheckOutcome.responded(name, url, response.statusCode(),
                    elapsedMillis(startNs), clock.instant());
            LOG.debug("healthmon: {} [{}] responded {} in {} ms",
                    name, url, response.statusCode(), outcome.responseTimeMs());
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(name, url, ErrorClassifier.TIMEOUT_MESSAGE, startNs);
        } catch (InterruptedException e) {
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            return failed(name, url, INTERRUPTED_MESSAGE, startNs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(name, url, ErrorClassifier.describe(cause), startNs);
        } catch (RuntimeException e) {
            // URI.create / HttpRequest.Builder reject malformed targets.
            return failed(name, url, ErrorClassifier.describe(e), startNs);
        }
    }

    private CheckOutcome failed(String name, String url, String message, long startNs) {
        CheckOutcome outcome = CheckOutcome.failed(name, url, message,
                elapsedMillis(startNs), clock.instant());
        LOG.debug("healthmon: {} [{}] probe failed in {} ms: {}",
                name, url, outcome.responseTimeMs(), message);
        return outcome;
    }

    /** Milliseconds since {@code startNs}, rounded to 2 decimals. */
    static double elapsedMillis(long startNs) {
        long elapsedNs = Math.max(0L, System.nanoTime() - startNs);
        return Math.round(elapsedNs / 10_000.0) / 100.0;
    }

    private static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
