package org.example.lingua.smoke;

import org.example.lingua.entity.VocabularyListEntity;
import org.example.lingua.entity.WordEntity;
import org.example.lingua.entity.WordProgressEntity;
import org.example.lingua.model.AnswerSubmission;
import org.example.lingua.model.QuizDetails;
import org.example.lingua.model.QuizGenerationOptions;
import org.example.lingua.model.QuizOverview;
import org.example.lingua.model.ScoredAttempt;
import org.example.lingua.repository.QuizAttemptRepository;
import org.example.lingua.repository.VocabularyListRepository;
import org.example.lingua.repository.WordProgressRepository;
import org.example.lingua.repository.WordRepository;
import org.example.lingua.service.QuizGenerationService;
import org.example.lingua.service.QuizScoringService;
import org.example.lingua.service.llm.LlmOptions;
import org.example.lingua.service.llm.LlmProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Runs the quiz flows against a two-connection pool: no caller may hold a connection
 * while it waits on the generation backend or on mastery workers.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:lingua-small-pool;DB_CLOSE_DELAY=-1",
        "spring.datasource.hikari.maximum-pool-size=2",
        "spring.datasource.hikari.connection-timeout=2000"
})
class SmallConnectionPoolSmokeTest {

    @Autowired
    private QuizGenerationService quizGenerationService;

    @Autowired
    private QuizScoringService quizScoringService;

    @Autowired
    private VocabularyListRepository vocabularyListRepository;

    @Autowired
    private WordRepository wordRepository;

    @Autowired
    private WordProgressRepository wordProgressRepository;

    @Autowired
    private QuizAttemptRepository quizAttemptRepository;

    @MockitoBean
    private LlmProvider llmProvider;

    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        callers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    @Test
    void concurrentSubmissionsOutnumberingThePoolAllSucceed() throws Exception {
        String userId = "pool-learner";
        VocabularyListEntity list = vocabularyListRepository.save(new VocabularyListEntity("Food", "es", "en", userId));
        WordEntity pan = wordRepository.save(new WordEntity(list, "pan", "bread"));
        WordEntity agua = wordRepository.save(new WordEntity(list, "agua", "water"));
        when(llmProvider.generate(anyString(), any(LlmOptions.class))).thenReturn(questionsJson(pan, agua));

        QuizDetails quiz = quizGenerationService
                .generateQuiz(list.getId(), new QuizGenerationOptions(2, null), userId)
                .orElseThrow();
        List<AnswerSubmission> answers = List.of(
                new AnswerSubmission(quiz.questions().get(0).id(), "bread"),
                new AnswerSubmission(quiz.questions().get(1).id(), "water")
        );

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<ScoredAttempt>>> submissions = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            submissions.add(callers.submit(() -> {
                start.await();
                return quizScoringService.submitQuizAnswers(quiz.id(), answers, userId);
            }));
        }
        start.countDown();

        for (Future<Optional<ScoredAttempt>> submission : submissions) {
            ScoredAttempt attempt = submission.get(30, TimeUnit.SECONDS).orElseThrow();
            assertEquals(1.0, attempt.score(), 0.0001);
            assertEquals(2, attempt.wordsUpdated());
        }

        assertEquals(4, quizAttemptRepository.countByUserId(userId));
        WordProgressEntity progress = wordProgressRepository.findByUserIdAndWordId(userId, pan.getId()).orElseThrow();
        assertEquals(4, progress.getReviewCount());
    }

    @Test
    void readsStayAvailableWhileGenerationIsInFlight() throws Exception {
        String userId = "pool-generator";
        VocabularyListEntity list = vocabularyListRepository.save(new VocabularyListEntity("Home", "es", "en", userId));
        WordEntity casa = wordRepository.save(new WordEntity(list, "casa", "house"));
        WordEntity mesa = wordRepository.save(new WordEntity(list, "mesa", "table"));
        String json = questionsJson(casa, mesa);

        CountDownLatch parked = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        when(llmProvider.generate(anyString(), any(LlmOptions.class))).thenAnswer(invocation -> {
            parked.countDown();
            release.await(20, TimeUnit.SECONDS);
            return json;
        });

        List<Future<Optional<QuizDetails>>> generations = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            generations.add(callers.submit(() -> quizGenerationService
                    .generateQuiz(list.getId(), new QuizGenerationOptions(2, null), userId)));
        }

        try {
            assertTrue(parked.await(20, TimeUnit.SECONDS), "both generations should reach the backend");
            List<QuizOverview> before = quizGenerationService.getUserQuizzes(userId);
            assertTrue(before.isEmpty());
        } finally {
            release.countDown();
        }

        for (Future<Optional<QuizDetails>> generation : generations) {
            assertEquals(2, generation.get(30, TimeUnit.SECONDS).orElseThrow().questions().size());
        }
        assertEquals(2, quizGenerationService.getUserQuizzes(userId).size());
    }

    private static String questionsJson(WordEntity first, WordEntity second) {
        return """
                [
                  {"question": "Translate '%s'", "type": "fill_blank", "correctAnswer": "%s", "wordId": "%s"},
                  {"question": "Translate '%s'", "type": "fill_blank", "correctAnswer": "%s", "wordId": "%s"}
                ]
                """.formatted(
                first.getWord(), first.getTranslation(), first.getId(),
                second.getWord(), second.getTranslation(), second.getId());
    }
}
