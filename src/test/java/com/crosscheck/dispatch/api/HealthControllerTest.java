package com.crosscheck.dispatch.api;

import com.crosscheck.core.health.HealthCheckService;
import com.crosscheck.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when nothing is DOWN")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("bus", HealthStatus.Status.UP, "Message bus accepting messages", Map.of()),
                new HealthStatus("registry", HealthStatus.Status.DEGRADED, "1 escalation(s) awaiting a human decision",
                        Map.of("open_escalations", "1")),
                new HealthStatus("agents", HealthStatus.Status.UP, "2 agent(s) registered", Map.of("count", "2"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.bus.status").value("UP"))
                .andExpect(jsonPath("$.components.bus.metadata").doesNotExist())
                .andExpect(jsonPath("$.components.registry.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.registry.metadata.open_escalations").value("1"))
                .andExpect(jsonPath("$.components.agents.metadata.count").value("2"));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is DOWN")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("bus", HealthStatus.Status.DOWN, "Message bus not running", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.bus.detail").value("Message bus not running"));
    }
}
