package com.companyintel.research.api;

import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchRunView;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.service.ResearchRunService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/research")
public class ResearchController {
    private final ResearchRunService researchRunService;

    public ResearchController(ResearchRunService researchRunService) {
        this.researchRunService = researchRunService;
    }

    @PostMapping
    public ResearchOutcome research(@RequestBody(required = false) ResearchApiRequest request) {
        return researchRunService.runNow(toTarget(request), toConfig(request));
    }

    @PostMapping("/async")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ResearchRunView startResearch(@RequestBody(required = false) ResearchApiRequest request) {
        return researchRunService.startAsync(toTarget(request), toConfig(request));
    }

    @GetMapping("/{runId}")
    public ResearchRunView getRun(@PathVariable("runId") String runId) {
        return researchRunService.getRun(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown research run " + runId));
    }

    @PostMapping("/{runId}/cancel")
    public ResearchRunView cancelRun(
        @PathVariable("runId") String runId,
        @RequestParam(name = "reason", required = false) String reason
    ) {
        return researchRunService.cancel(runId, reason)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown research run " + runId));
    }

    private ResearchTarget toTarget(ResearchApiRequest request) {
        if (request == null || request.companyName() == null || request.companyName().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "companyName is required");
        }
        return new ResearchTarget(request.companyName(), request.url());
    }

    private PipelineConfig toConfig(ResearchApiRequest request) {
        return researchRunService.defaultConfig().withOverrides(
            request.maxLinks(),
            request.maxCrawlDepth(),
            request.maxPrioritizedPages(),
            request.concurrency(),
            request.perPageTimeoutSeconds(),
            request.globalTimeoutSeconds(),
            request.minSubstantialContentLength()
        );
    }
}
