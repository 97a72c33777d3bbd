package com.croppulse.decision.controller;

import com.croppulse.decision.exception.InsufficientEvidenceException;
import com.croppulse.decision.exception.RecordFrozenException;
import com.croppulse.decision.model.CompositeScore;
import com.croppulse.decision.model.PagedResponse;
import com.croppulse.decision.service.CreditScoringService;
import com.croppulse.decision.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CreditScoreController.class)
class CreditScoreControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreditScoringService creditScoringService;

    // ── Compute ──

    @Test
    void computeScore_success() throws Exception {
        when(creditScoringService.computeScore("FARMER-001"))
                .thenReturn(TestDataFactory.createCompositeScore("S-1", "FARMER-001", 650, 1_000L));

        mockMvc.perform(post("/api/v1/credit-scores/FARMER-001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scoreId").value("S-1"))
                .andExpect(jsonPath("$.value").value(650))
                .andExpect(jsonPath("$.grade").value("C"))
                .andExpect(jsonPath("$.interestRatePct").value(12.0))
                .andExpect(jsonPath("$.eligible").value(true))
                .andExpect(jsonPath("$.effectiveWeights.traditional").value(0.4))
                .andExpect(jsonPath("$.subScores[0].name").value("action"));
    }

    @Test
    void computeScore_noEvidence_returns422WithMissing() throws Exception {
        when(creditScoringService.computeScore("FARMER-404"))
                .thenThrow(new InsufficientEvidenceException("Subject FARMER-404 has no history",
                        List.of("traditional", "action", "groundTruth")));

        mockMvc.perform(post("/api/v1/credit-scores/FARMER-404"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_EVIDENCE"))
                .andExpect(jsonPath("$.missing.length()").value(3))
                .andExpect(jsonPath("$.missing[1]").value("action"));
    }

    @Test
    void computeScore_collidingRecord_returns409() throws Exception {
        when(creditScoringService.computeScore("FARMER-001"))
                .thenThrow(new RecordFrozenException("Credit score", "S-1", null));

        mockMvc.perform(post("/api/v1/credit-scores/FARMER-001"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("RECORD_FROZEN"));
    }

    // ── History ──

    @Test
    void getHistory_defaultLimit() throws Exception {
        PagedResponse<CompositeScore> page = new PagedResponse<>(List.of(
                TestDataFactory.createCompositeScore("S-2", "FARMER-001", 700, 2_000L),
                TestDataFactory.createCompositeScore("S-1", "FARMER-001", 650, 1_000L)), true, "1000");
        when(creditScoringService.getHistory("FARMER-001", 20, null)).thenReturn(page);

        mockMvc.perform(get("/api/v1/credit-scores/FARMER-001/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].scoreId").value("S-2"))
                .andExpect(jsonPath("$.hasMore").value(true))
                .andExpect(jsonPath("$.nextCursor").value("1000"));
    }

    @Test
    void getHistory_withCursor() throws Exception {
        when(creditScoringService.getHistory("FARMER-001", 5, 1000L))
                .thenReturn(new PagedResponse<>(List.of(), false, null));

        mockMvc.perform(get("/api/v1/credit-scores/FARMER-001/history")
                        .param("limit", "5")
                        .param("before", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasMore").value(false));

        verify(creditScoringService).getHistory("FARMER-001", 5, 1000L);
    }

    @Test
    void getHistory_nonNumericCursor_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/credit-scores/FARMER-001/history").param("before", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_INPUT"));
    }

    // ── Records ──

    @Test
    void getScore_found() throws Exception {
        when(creditScoringService.getScore("S-1"))
                .thenReturn(TestDataFactory.createCompositeScore("S-1", "FARMER-001", 820, 1_000L));

        mockMvc.perform(get("/api/v1/credit-scores/records/S-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.grade").value("A"));
    }

    @Test
    void getScore_notFound() throws Exception {
        when(creditScoringService.getScore("S-404")).thenReturn(null);

        mockMvc.perform(get("/api/v1/credit-scores/records/S-404"))
                .andExpect(status().isNotFound());
    }
}
