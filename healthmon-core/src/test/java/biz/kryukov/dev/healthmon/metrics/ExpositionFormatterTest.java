package biz.kryukov.dev.healthmon.metrics;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.ResultBatch;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpositionFormatterTest {

    private static final Instant NOW = Instant.parse("2026-01-31T18:30:00Z");

    @Test
    void singleHealthyService() {
        ResultBatch batch = new ResultBatch(List.of(
                CheckOutcome.responded("a", "http://a.local", 200, 12.34, NOW)), NOW);

        String text = ExpositionFormatter.format(batch);

        assertTrue(text.contains("service_up{service=\"a\"} 1\n"), text);
        assertTrue(text.contains("service_response_time_ms{service=\"a\"} 12.34\n"), text);
    }

    @Test
    void fullLayout() {
        ResultBatch batch = new ResultBatch(List.of(
                CheckOutcome.responded("github", "https://api.github.com", 200, 145.32, NOW),
                CheckOutcome.failed("bad", "https://nonexistent.invalid",
                        "DNS resolution failed", 3.5, NOW)), NOW);

        String expected = """
                # HELP service_up Service health status (1 = up, 0 = down)
                # TYPE service_up gauge
                service_up{service="github"} 1
                service_up{service="bad"} 0
                # HELP service_response_time_ms Service response time in milliseconds
                # TYPE service_response_time_ms gauge
                service_response_time_ms{service="github"} 145.32
                service_response_time_ms{service="bad"} 3.5
                """;
        assertEquals(expected, ExpositionFormatter.format(batch));
    }

    @Test
    void emptyBatchHasHeadersOnly() {
        String text = ExpositionFormatter.format(ResultBatch.empty(NOW));

        List<String> lines = text.lines().toList();
        assertEquals(4, lines.size());
        assertTrue(lines.stream().allMatch(l -> l.startsWith("#")));
    }

    @Test
    void wholeMillisecondsHaveNoFraction() {
        assertEquals("100", ExpositionFormatter.formatValue(100.0));
        assertEquals("0", ExpositionFormatter.formatValue(0.0));
        assertEquals("0.5", ExpositionFormatter.formatValue(0.5));
    }

    @Test
    void labelValuesAreEscaped() {
        assertEquals("a\\\"b\\\\c\\nd", ExpositionFormatter.escapeLabelValue("a\"b\\c\nd"));
    }
}
