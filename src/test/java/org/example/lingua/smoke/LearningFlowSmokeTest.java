package org.example.lingua.smoke;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.lingua.entity.VocabularyListEntity;
import org.example.lingua.entity.WordEntity;
import org.example.lingua.entity.WordProgressEntity;
import org.example.lingua.repository.VocabularyListRepository;
import org.example.lingua.repository.WordProgressRepository;
import org.example.lingua.repository.WordRepository;
import org.example.lingua.service.llm.LlmOptions;
import org.example.lingua.service.llm.LlmProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class LearningFlowSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private VocabularyListRepository vocabularyListRepository;

    @Autowired
    private WordRepository wordRepository;

    @Autowired
    private WordProgressRepository wordProgressRepository;

    @MockitoBean
    private LlmProvider llmProvider;

    @Test
    void generateSubmitAndReviewProgress() throws Exception {
        String userId = "smoke-learner";
        VocabularyListEntity list = vocabularyListRepository.save(
                new VocabularyListEntity("Animals", "es", "en", userId));
        WordEntity gato = wordRepository.save(new WordEntity(list, "gato", "cat"));
        when(llmProvider.generate(anyString(), any(LlmOptions.class))).thenReturn("""
                ```json
                [
                  {"question": "What does 'gato' mean?", "type": "multiple_choice", "correctAnswer": "cat",
                   "options": ["cat", "dog", "bird"], "wordId": "%s"},
                  {"question": "Translate 'cat'", "type": "fill_blank", "correctAnswer": "gato",
                   "wordId": "invalidWordId"}
                ]
                ```
                """.formatted(gato.getId()));

        String quizJson = mockMvc.perform(post("/api/quizzes/generate")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vocabularyListId\":\"" + list.getId() + "\",\"questionCount\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.questions.length()", is(2)))
                .andReturn().getResponse().getContentAsString();
        JsonNode quiz = objectMapper.readTree(quizJson);
        String quizId = quiz.get("id").asText();
        String firstQuestion = quiz.get("questions").get(0).get("id").asText();
        String secondQuestion = quiz.get("questions").get(1).get("id").asText();

        mockMvc.perform(post("/api/quizzes/" + quizId + "/submit")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answers\":["
                                + "{\"questionId\":\"" + firstQuestion + "\",\"answer\":\" CAT \"},"
                                + "{\"questionId\":\"" + secondQuestion + "\",\"answer\":\"Gato\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score", is(1.0)))
                .andExpect(jsonPath("$.wordsUpdated", is(1)));

        WordProgressEntity progress = wordProgressRepository.findByUserIdAndWordId(userId, gato.getId()).orElseThrow();
        assertEquals(1.0, progress.getMastery(), 0.0001);
        assertEquals(1, progress.getStreak());

        mockMvc.perform(get("/api/analytics/progress").header("X-User-Id", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalWords", is(1)))
                .andExpect(jsonPath("$.summary.masteredWords", is(1)))
                .andExpect(jsonPath("$.summary.currentStreak", is(1)))
                .andExpect(jsonPath("$.summary.totalQuizzesTaken", is(1)))
                .andExpect(jsonPath("$.learningStats[0].quizzesTaken", is(1)))
                .andExpect(jsonPath("$.learningStats[0].wordsReviewed", is(1)));

        mockMvc.perform(get("/api/quizzes/" + quizId).header("X-User-Id", "someone-else"))
                .andExpect(status().isNotFound());
    }
}
