package com.busreview.tracker.scrape.api;

import com.busreview.tracker.scrape.model.Checkpoint;
import com.busreview.tracker.scrape.model.RunSummary;
import com.busreview.tracker.scrape.model.ScrapeRunRequest;
import com.busreview.tracker.scrape.service.CheckpointService;
import com.busreview.tracker.scrape.service.ScrapeOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/scrape")
public class ScrapeController {
    private final ScrapeOrchestratorService orchestratorService;
    private final CheckpointService checkpointService;

    public ScrapeController(ScrapeOrchestratorService orchestratorService, CheckpointService checkpointService) {
        this.orchestratorService = orchestratorService;
        this.checkpointService = checkpointService;
    }

    @PostMapping("/runs")
    public ResponseEntity<ScrapeRunStarted> startRun(@RequestBody(required = false) ScrapeRunRequest request) {
        String runId = orchestratorService.startAsync(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ScrapeRunStarted(runId, "STARTED"));
    }

    @GetMapping("/runs/latest")
    public ResponseEntity<RunSummary> latestRun() {
        return orchestratorService.latestSummary()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/runs/cancel")
    public Map<String, Object> cancelRun() {
        boolean cancelled = orchestratorService.cancel();
        return Map.of("cancelled", cancelled);
    }

    @GetMapping("/checkpoints")
    public List<Checkpoint> checkpoints() {
        return checkpointService.listAll();
    }
}
