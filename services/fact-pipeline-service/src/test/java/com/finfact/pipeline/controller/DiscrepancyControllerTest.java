package com.finfact.pipeline.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.service.ConsistencyService;
import com.finfact.pipeline.service.DiscrepancyQuery;
import com.finfact.pipeline.service.DiscrepancyReviewService;
import com.finfact.pipeline.service.ManualResolution;
import com.finfact.pipeline.service.ResolutionInProgressException;
import com.finfact.pipeline.service.ResolutionService;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = {DiscrepancyController.class, ReportController.class})
class DiscrepancyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DiscrepancyReviewService discrepancyReviewService;

    @MockBean
    private ResolutionService resolutionService;

    @MockBean
    private ConsistencyService consistencyService;

    @Test
    void listPassesFiltersThrough() throws Exception {
        when(discrepancyReviewService.list(any())).thenReturn(List.of());

        mockMvc.perform(get("/v1/discrepancies")
                .param("reportId", "600519-2023")
                .param("factType", "FLOW")
                .param("fiscalYear", "2023")
                .param("period", "2023-12-31")
                .param("status", "VERIFIED"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());

        ArgumentCaptor<DiscrepancyQuery> query = ArgumentCaptor.forClass(DiscrepancyQuery.class);
        verify(discrepancyReviewService).list(query.capture());
        assertThat(query.getValue()).isEqualTo(new DiscrepancyQuery(
            "600519-2023", FactType.FLOW, 2023, LocalDate.of(2023, 12, 31), ResolutionStatus.VERIFIED, 100));
    }

    @Test
    void unknownEnumValueIsBadRequest() throws Exception {
        mockMvc.perform(get("/v1/discrepancies").param("factType", "QUARTERLY"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("invalid value for factType"));
    }

    @Test
    void blankReviewerFailsValidation() throws Exception {
        String body = """
            {"reportId": "R1", "factType": "STOCK", "candidateId": "%s", "reviewer": " "}
            """.formatted(UUID.randomUUID());

        mockMvc.perform(post("/v1/discrepancies/resolutions").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));

        verifyNoInteractions(discrepancyReviewService);
    }

    @Test
    void rejectedResolutionIsBadRequest() throws Exception {
        UUID candidateId = UUID.randomUUID();
        when(discrepancyReviewService.submit(any(ManualResolution.class)))
            .thenThrow(new IllegalArgumentException("Candidate " + candidateId + " not found for report R1"));
        String body = """
            {"reportId": "R1", "factType": "STOCK", "candidateId": "%s", "reviewer": "analyst"}
            """.formatted(candidateId);

        mockMvc.perform(post("/v1/discrepancies/resolutions").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"))
            .andExpect(jsonPath("$.message").value("Candidate " + candidateId + " not found for report R1"));
    }

    @Test
    void concurrentResolutionIsConflict() throws Exception {
        when(resolutionService.resolve(anyString(), anyBoolean())).thenThrow(new ResolutionInProgressException("R1"));

        mockMvc.perform(post("/v1/reports/R1/resolve"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("conflict"));
    }
}
