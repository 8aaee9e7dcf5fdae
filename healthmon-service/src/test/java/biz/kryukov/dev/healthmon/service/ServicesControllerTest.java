package biz.kryukov.dev.healthmon.service;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.HealthMonitor;
import biz.kryukov.dev.healthmon.RefreshInterruptedException;
import biz.kryukov.dev.healthmon.ResultBatch;
import biz.kryukov.dev.healthmon.ServicesSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ServicesController.class, ApiExceptionHandler.class})
class ServicesControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-31T18:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthMonitor healthMonitor;

    private static ServicesSummary mixedSummary() {
        ResultBatch batch = new ResultBatch(List.of(
                CheckOutcome.responded("good", "https://good.example", 200, 12.34, NOW),
                CheckOutcome.failed("bad", "https://bad.example", "Connection timeout", 10000.0, NOW)
        ), NOW);
        return ServicesSummary.of(batch);
    }

    @Test
    void servicesUsesCachedResults() throws Exception {
        when(healthMonitor.summary(false)).thenReturn(mixedSummary());

        mockMvc.perform(get("/api/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.healthy").value(1))
                .andExpect(jsonPath("$.unhealthy").value(1))
                .andExpect(jsonPath("$.services[0].service_name").value("good"))
                .andExpect(jsonPath("$.services[0].is_healthy").value(true))
                .andExpect(jsonPath("$.services[0].status_code").value(200))
                .andExpect(jsonPath("$.services[0].response_time_ms").value(12.34))
                .andExpect(jsonPath("$.services[0].error_message").value(nullValue()))
                .andExpect(jsonPath("$.services[0].checked_at").value("2026-01-31T18:30:00Z"))
                .andExpect(jsonPath("$.services[1].service_name").value("bad"))
                .andExpect(jsonPath("$.services[1].is_healthy").value(false))
                .andExpect(jsonPath("$.services[1].status_code").value(nullValue()))
                .andExpect(jsonPath("$.services[1].error_message").value("Connection timeout"));

        verify(healthMonitor, never()).summary(true);
    }

    @Test
    void checkForcesRefresh() throws Exception {
        when(healthMonitor.summary(true)).thenReturn(mixedSummary());

        mockMvc.perform(post("/api/check"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2));

        verify(healthMonitor).summary(true);
        verify(healthMonitor, never()).summary(false);
    }

    @Test
    void emptyRegistry() throws Exception {
        when(healthMonitor.summary(false)).thenReturn(ServicesSummary.of(ResultBatch.empty(NOW)));

        mockMvc.perform(get("/api/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.services").isEmpty())
                .andExpect(jsonPath("$.total").value(0))
                .andExpect(jsonPath("$.healthy").value(0))
                .andExpect(jsonPath("$.unhealthy").value(0));
    }

    @Test
    void abandonedRefreshIsServiceUnavailable() throws Exception {
        when(healthMonitor.summary(true)).thenThrow(
                new RefreshInterruptedException("refresh interrupted", new InterruptedException()));

        mockMvc.perform(post("/api/check"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Service Unavailable"))
                .andExpect(jsonPath("$.detail").value("refresh interrupted"));
    }
}
