package com.example.gdprpdp.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.gdprpdp.models.Duty;
import com.example.gdprpdp.service.DutyScheduler;
import com.example.gdprpdp.service.TickSummary;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = DutyController.class)
@Import({RequestIdFilter.class, FixedClockConfig.class})
class DutyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DutyScheduler dutyScheduler;

    private static Duty duty(Duty.Status status) {
        return Duty.builder()
                .dutyId("d-1")
                .policyId("P1")
                .ruleId("R1")
                .dataTarget("usage-logs")
                .createdAt(1L)
                .expiresAt(2L)
                .status(status)
                .build();
    }

    @Test
    @DisplayName("GET /duties filters by status when given")
    void listByStatus() throws Exception {
        when(dutyScheduler.list(Optional.of(Duty.Status.PENDING))).thenReturn(List.of(duty(Duty.Status.PENDING)));
        when(dutyScheduler.list(Optional.empty())).thenReturn(List.of(
                duty(Duty.Status.PENDING), duty(Duty.Status.COMPLETED)));

        mockMvc.perform(MockMvcRequestBuilders.get("/duties").param("status", "pending"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].duty_id", equalTo("d-1")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].status", equalTo("PENDING")));

        mockMvc.perform(MockMvcRequestBuilders.get("/duties"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$", hasSize(2)));
    }

    @Test
    @DisplayName("unknown status is a 400")
    void unknownStatus() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/duties").param("status", "DONE"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INVALID_REQUEST")));
    }

    @Test
    @DisplayName("flush runs a pass at the server clock, or at the given instant")
    void flush() throws Exception {
        when(dutyScheduler.tick(FixedClockConfig.NOW)).thenReturn(new TickSummary(2, 1, 0, 1, false));
        Instant later = Instant.parse("2024-11-15T00:00:00Z");
        when(dutyScheduler.tick(later)).thenReturn(new TickSummary(0, 0, 0, 0, false));

        mockMvc.perform(MockMvcRequestBuilders.post("/duties/flush"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.due", equalTo(2)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.completed", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.still_pending", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.skipped", equalTo(false)));

        mockMvc.perform(MockMvcRequestBuilders.post("/duties/flush").param("now", "2024-11-15T00:00:00Z"))
                .andExpect(MockMvcResultMatchers.status().isOk());

        verify(dutyScheduler).tick(later);
    }

    @Test
    @DisplayName("malformed flush instant is a 400")
    void badFlushInstant() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/duties/flush").param("now", "soon"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INVALID_REQUEST")));
    }
}
