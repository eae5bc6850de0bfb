package com.finfact.pipeline.controller;

import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.service.DiscrepancyQuery;
import com.finfact.pipeline.service.DiscrepancyReviewService;
import com.finfact.pipeline.service.ManualResolution;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/discrepancies")
public class DiscrepancyController {

    private final DiscrepancyReviewService discrepancyReviewService;

    public DiscrepancyController(DiscrepancyReviewService discrepancyReviewService) {
        this.discrepancyReviewService = discrepancyReviewService;
    }

    @GetMapping
    public List<ResolvedFactResponse> list(
        @RequestParam(required = false) String reportId,
        @RequestParam(required = false) FactType factType,
        @RequestParam(required = false) Integer fiscalYear,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate period,
        @RequestParam(required = false) ResolutionStatus status,
        @RequestParam(defaultValue = "100") int limit
    ) {
        return discrepancyReviewService.list(new DiscrepancyQuery(reportId, factType, fiscalYear, period, status, limit))
            .stream()
            .map(ResolvedFactResponse::from)
            .toList();
    }

    @PostMapping("/resolutions")
    public ResolvedFactResponse resolve(@Valid @RequestBody ManualResolutionRequest request) {
        return ResolvedFactResponse.from(discrepancyReviewService.submit(new ManualResolution(
            request.reportId().trim(),
            request.factType(),
            request.candidateId(),
            request.reviewer(),
            request.notes()
        )));
    }
}
