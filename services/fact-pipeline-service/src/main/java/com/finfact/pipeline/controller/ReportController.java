package com.finfact.pipeline.controller;

import com.finfact.pipeline.consistency.ConsistencyCheckResult;
import com.finfact.pipeline.service.ConsistencyService;
import com.finfact.pipeline.service.ResolutionOutcome;
import com.finfact.pipeline.service.ResolutionService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reports/{reportId}")
public class ReportController {

    private final ResolutionService resolutionService;
    private final ConsistencyService consistencyService;

    public ReportController(ResolutionService resolutionService, ConsistencyService consistencyService) {
        this.resolutionService = resolutionService;
        this.consistencyService = consistencyService;
    }

    @GetMapping("/facts")
    public List<ResolvedFactResponse> facts(@PathVariable String reportId) {
        return resolutionService.listFacts(reportId).stream().map(ResolvedFactResponse::from).toList();
    }

    @PostMapping("/resolve")
    public ResolutionOutcome resolve(
        @PathVariable String reportId,
        @RequestParam(defaultValue = "false") boolean overrideVerified
    ) {
        return resolutionService.resolve(reportId, overrideVerified);
    }

    @GetMapping("/consistency")
    public List<ConsistencyCheckResult> consistency(@PathVariable String reportId) {
        return consistencyService.check(reportId);
    }
}
