package biz.kryukov.dev.healthmon;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Turns a probe failure into the human-readable {@link CheckOutcome#errorMessage()}.
 *
 * <p>Classification walks the cause chain, most specific kind first:
 * <ol>
 *   <li>timeout → {@value #TIMEOUT_MESSAGE}</li>
 *   <li>DNS resolution failure</li>
 *   <li>TLS failure</li>
 *   <li>connection refused / no route</li>
 *   <li>fallback: the exception message (or type) with its cause</li>
 * </ol>
 */
public final class ErrorClassifier {

    /** Error message of a probe that ran out of time. */
    public static final String TIMEOUT_MESSAGE = "Connection timeout";

    private static final int MAX_CAUSE_DEPTH = 16;

    private ErrorClassifier() {}

    /**
     * Describes a probe failure.
     *
     * @param err the failure, never {@code null}
     * @return a non-empty message
     */
    public static String describe(Throwable err) {
        if (find(err, SocketTimeoutException.class, HttpTimeoutException.class,
                TimeoutException.class) != null) {
            return TIMEOUT_MESSAGE;
        }
        Throwable dns = find(err, UnknownHostException.class, UnresolvedAddressException.class);
        if (dns != null) {
            return "DNS resolution failed" + suffix(dns);
        }
        Throwable tls = find(err, SSLException.class);
        if (tls != null) {
            return "TLS error" + suffix(tls);
        }
        Throwable connect = find(err, ConnectException.class, NoRouteToHostException.class);
        if (connect != null) {
            return "Connection failed" + suffix(connect);
        }
        if (err instanceof IllegalArgumentException) {
            return "Invalid URL" + suffix(err);
        }
        return fallback(err);
    }

    @SafeVarargs
    private static Throwable find(Throwable err, Class<? extends Throwable>... types) {
        Throwable current = err;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(current)) {
                    return current;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String suffix(Throwable t) {
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? "" : ": " + msg;
    }

    private static String fallback(Throwable err) {
        String msg = err.getMessage() != null && !err.getMessage().isBlank()
                ? err.getMessage() : err.getClass().getName();
        Throwable cause = err.getCause();
        if (cause != null && cause != err) {
            msg += " (cause: " + (cause.getMessage() != null
                    ? cause.getMessage() : cause.getClass().getName()) + ")";
        }
        return msg;
    }
}
