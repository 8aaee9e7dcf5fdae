package biz.kryukov.dev.healthmon.metrics;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.ResultBatch;

/**
 * Renders a batch in the Prometheus text exposition format.
 *
 * <p>Series:
 * <ul>
 *   <li>{@code service_up}: Gauge (0/1)</li>
 *   <li>{@code service_response_time_ms}: Gauge, milliseconds</li>
 * </ul>
 * Each series is preceded by its HELP/TYPE lines; services appear in batch order.
 */
public final class ExpositionFormatter {

    /** Content type of the rendered text. */
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    static final String UP_METRIC = "service_up";
    static final String RESPONSE_TIME_METRIC = "service_response_time_ms";
    private static final String UP_HELP = "Service health status (1 = up, 0 = down)";
    private static final String RESPONSE_TIME_HELP = "Service response time in milliseconds";
    private static final String LABEL = "service";

    private ExpositionFormatter() {}

    /**
     * Renders the batch. An empty batch yields the header lines only.
     */
    public static String format(ResultBatch batch) {
        StringBuilder sb = new StringBuilder(128 + batch.total() * 96);

        header(sb, UP_METRIC, UP_HELP);
        for (CheckOutcome outcome : batch.results()) {
            sample(sb, UP_METRIC, outcome.serviceName(), outcome.healthy() ? "1" : "0");
        }

        header(sb, RESPONSE_TIME_METRIC, RESPONSE_TIME_HELP);
        for (CheckOutcome outcome : batch.results()) {
            sample(sb, RESPONSE_TIME_METRIC, outcome.serviceName(),
                    formatValue(outcome.responseTimeMs()));
        }
        return sb.toString();
    }

    private static void header(StringBuilder sb, String metric, String help) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge\n");
    }

    private static void sample(StringBuilder sb, String metric, String service, String value) {
        sb.append(metric).append('{').append(LABEL).append("=\"")
                .append(escapeLabelValue(service)).append("\"} ")
                .append(value).append('\n');
    }

    static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)
                && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String escapeLabelValue(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
