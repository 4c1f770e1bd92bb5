package org.example.lingua.controller;

import org.example.lingua.entity.Difficulty;
import org.example.lingua.model.ProgressSummary;
import org.example.lingua.model.Recommendations;
import org.example.lingua.service.ProgressService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProgressService progressService;

    @Test
    void progress_returnsSummaryForCaller() throws Exception {
        ProgressSummary summary = new ProgressSummary(
                new ProgressSummary.Summary(2, 1, 1, 3, 4, 7L, 0.75),
                List.of(new ProgressSummary.DailyStats(LocalDate.of(2026, 3, 10), 2, 3, 10, 8)),
                List.of(),
                List.of()
        );
        when(progressService.getProgressSummary("learner-1")).thenReturn(summary);

        mockMvc.perform(get("/api/analytics/progress").header("X-User-Id", "learner-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalWords", is(2)))
                .andExpect(jsonPath("$.summary.currentStreak", is(3)))
                .andExpect(jsonPath("$.summary.avgScore", is(0.75)))
                .andExpect(jsonPath("$.learningStats[0].date", is("2026-03-10")));
    }

    @Test
    void recommendations_returnsFocusAreasAndAdaptiveDifficulty() throws Exception {
        Recommendations recommendations = new Recommendations(
                List.of("practice_questions"),
                List.of(),
                "Continue with regular practice and introduce new vocabulary",
                15,
                new Recommendations.AdaptiveDifficulty(Difficulty.MEDIUM, 0.5, LocalDateTime.of(2026, 3, 11, 12, 0))
        );
        when(progressService.getRecommendations("learner-1")).thenReturn(recommendations);

        mockMvc.perform(get("/api/analytics/recommendations").header("X-User-Id", "learner-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.focusAreas[0]", is("practice_questions")))
                .andExpect(jsonPath("$.estimatedTime", is(15)))
                .andExpect(jsonPath("$.adaptiveDifficulty.recommendedDifficulty", is("medium")));
    }

    @Test
    void progress_requiresUserHeader() throws Exception {
        mockMvc.perform(get("/api/analytics/progress"))
                .andExpect(status().isBadRequest());
    }
}
