package com.busreview.tracker.scrape.api;

import com.busreview.tracker.scrape.model.ScrapeRunRequest;
import com.busreview.tracker.scrape.service.ActiveScrapeRunException;
import com.busreview.tracker.scrape.service.ScrapeOrchestratorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ScrapeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScrapeOrchestratorService orchestratorService;

    @Test
    void startRunReturnsAcceptedWithRunId() throws Exception {
        when(orchestratorService.startAsync(any(ScrapeRunRequest.class))).thenReturn("run-1");

        mockMvc.perform(post("/api/scrape/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"routes\":[{\"origin\":\"Chennai\",\"destination\":\"Bangalore\"}],\"concurrency\":2}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value("run-1"));
    }

    @Test
    void startRunConflictsWhileAnotherRunIsActive() throws Exception {
        when(orchestratorService.startAsync(any())).thenThrow(new ActiveScrapeRunException("Scrape run r0 is already active"));

        mockMvc.perform(post("/api/scrape/runs"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("active_scrape_run"));
    }

    @Test
    void latestRunIsEmptyBeforeAnyRun() throws Exception {
        when(orchestratorService.latestSummary()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/scrape/runs/latest"))
            .andExpect(status().isNoContent());
    }

    @Test
    void cancelReportsWhetherARunWasActive() throws Exception {
        when(orchestratorService.cancel()).thenReturn(true);

        mockMvc.perform(post("/api/scrape/runs/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    void checkpointsAreListed() throws Exception {
        mockMvc.perform(get("/api/scrape/checkpoints"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }
}
