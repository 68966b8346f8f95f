package com.example.gdprpdp.health;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.when;

import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.service.AuditLogService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = HealthController.class)
@Import(HealthControllerTest.FixedClock.class)
@TestPropertySource(properties = "app.env=test")
class HealthControllerTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-10-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditLogService auditLogService;

    @Test
    @DisplayName("GET /health reports ok with the audit head")
    void healthy() throws Exception {
        when(auditLogService.logId()).thenReturn("main");
        when(auditLogService.head()).thenReturn(Optional.of(AuditEntry.builder()
                .logId("main")
                .sequence(41L)
                .timestamp(1L)
                .kind(AuditEntry.Kind.DECISION)
                .payload("{}")
                .prevHash(AuditEntry.GENESIS_HASH)
                .build()));

        mockMvc.perform(MockMvcRequestBuilders.get("/health"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.status", equalTo("ok")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.ts", equalTo("2024-10-01T12:00:00Z")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.env", equalTo("test")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.audit_log_id", equalTo("main")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.audit_head_sequence", equalTo(41)));
    }

    @Test
    @DisplayName("halted writer or unreadable head reports degraded")
    void degraded() throws Exception {
        when(auditLogService.isHalted()).thenReturn(true);
        when(auditLogService.head()).thenReturn(Optional.empty());

        mockMvc.perform(MockMvcRequestBuilders.get("/health"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.status", equalTo("degraded")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.audit_head_sequence", nullValue()));

        when(auditLogService.isHalted()).thenReturn(false);
        when(auditLogService.head()).thenThrow(new IllegalStateException("table missing"));

        mockMvc.perform(MockMvcRequestBuilders.get("/health"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.status", equalTo("degraded")));
    }
}
