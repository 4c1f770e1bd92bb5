package org.example.lingua.service;

import org.example.lingua.entity.Difficulty;
import org.example.lingua.entity.QuestionType;
import org.example.lingua.entity.QuizAnswerEntity;
import org.example.lingua.entity.QuizAttemptEntity;
import org.example.lingua.entity.QuizEntity;
import org.example.lingua.entity.QuizQuestionEntity;
import org.example.lingua.model.AnswerSubmission;
import org.example.lingua.model.ScoredAttempt;
import org.example.lingua.model.WordTally;
import org.example.lingua.repository.QuizAnswerRepository;
import org.example.lingua.repository.QuizAttemptRepository;
import org.example.lingua.repository.QuizQuestionRepository;
import org.example.lingua.repository.QuizRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuizScoringServiceTest {

    private static final String USER_ID = "learner-1";
    private static final String QUIZ_ID = "aaaaaaaaaaaaaaaaaaaaaaa1";
    private static final String WORD_ID = "65a1b2c3d4e5f6a7b8c9d0e1";

    @Mock
    private QuizRepository quizRepository;

    @Mock
    private QuizQuestionRepository quizQuestionRepository;

    @Mock
    private QuizAttemptRepository quizAttemptRepository;

    @Mock
    private QuizAnswerRepository quizAnswerRepository;

    @Mock
    private MasteryService masteryService;

    @Mock
    private LearningStatsService learningStatsService;

    private QuizScoringService service;

    @BeforeEach
    void setUp() {
        service = new QuizScoringService(
                quizRepository,
                quizQuestionRepository,
                quizAttemptRepository,
                quizAnswerRepository,
                masteryService,
                learningStatsService,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC)
        );
        service.setSelf(service);
    }

    @Test
    void submitQuizAnswers_matchesIgnoringCaseAndWhitespace() {
        String otherWordId = "65a1b2c3d4e5f6a7b8c9d0e2";
        QuizQuestionEntity first = question("bbbbbbbbbbbbbbbbbbbbbbb1", "Bonjour", WORD_ID);
        QuizQuestionEntity second = question("bbbbbbbbbbbbbbbbbbbbbbb2", " merci ", otherWordId);
        when(quizRepository.findByIdAndUserId(QUIZ_ID, USER_ID)).thenReturn(Optional.of(quiz()));
        when(quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(QUIZ_ID)).thenReturn(List.of(first, second));
        when(masteryService.applyQuizResults(eq(USER_ID), anyMap())).thenReturn(2);
        stubAttemptSave();

        ScoredAttempt result = service.submitQuizAnswers(QUIZ_ID, List.of(
                new AnswerSubmission(first.getId(), "bonjour"),
                new AnswerSubmission(second.getId(), "merci")
        ), USER_ID).orElseThrow();

        assertEquals(1.0, result.score(), 0.0001);
        assertEquals(2, result.correctAnswers());
        assertEquals(2, result.totalQuestions());
        assertEquals(2, result.wordsUpdated());
        assertTrue(result.completed());
        assertTrue(result.answers().get(0).correct());
        assertTrue(result.answers().get(1).correct());
        assertEquals("attempt-1", result.id());
        verify(masteryService).applyQuizResults(USER_ID,
                Map.of(WORD_ID, new WordTally(1, 1), otherWordId, new WordTally(1, 1)));
        verify(learningStatsService).recordActivity(USER_ID, 1, 2, 2, 2);
    }

    @Test
    void submitQuizAnswers_scoresAgainstAllQuestionsAndTalliesPerWord() {
        QuizQuestionEntity q1 = question("bbbbbbbbbbbbbbbbbbbbbbb1", "gato", WORD_ID);
        QuizQuestionEntity q2 = question("bbbbbbbbbbbbbbbbbbbbbbb2", "cat", WORD_ID);
        QuizQuestionEntity q3 = question("bbbbbbbbbbbbbbbbbbbbbbb3", "perro", null);
        when(quizRepository.findByIdAndUserId(QUIZ_ID, USER_ID)).thenReturn(Optional.of(quiz()));
        when(quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(QUIZ_ID)).thenReturn(List.of(q1, q2, q3));
        stubAttemptSave();

        ScoredAttempt result = service.submitQuizAnswers(QUIZ_ID, List.of(
                new AnswerSubmission(q1.getId(), "gato"),
                new AnswerSubmission(q2.getId(), "dog")
        ), USER_ID).orElseThrow();

        assertEquals(1, result.correctAnswers());
        assertEquals(3, result.totalQuestions());
        assertEquals(1.0 / 3.0, result.score(), 0.0001);
        verify(masteryService).applyQuizResults(USER_ID, Map.of(WORD_ID, new WordTally(1, 2)));

        ArgumentCaptor<QuizAttemptEntity> attemptCaptor = ArgumentCaptor.forClass(QuizAttemptEntity.class);
        verify(quizAttemptRepository).save(attemptCaptor.capture());
        assertEquals(USER_ID, attemptCaptor.getValue().getUserId());
        assertEquals(QUIZ_ID, attemptCaptor.getValue().getQuizId());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<QuizAnswerEntity>> answersCaptor = ArgumentCaptor.forClass(List.class);
        verify(quizAnswerRepository).saveAll(answersCaptor.capture());
        List<QuizAnswerEntity> savedAnswers = answersCaptor.getValue();
        assertEquals(2, savedAnswers.size());
        assertTrue(savedAnswers.get(0).isCorrect());
        assertFalse(savedAnswers.get(1).isCorrect());
        assertEquals(USER_ID, savedAnswers.get(1).getUserId());
    }

    @Test
    void submitQuizAnswers_malformedWordIdNeverReachesMastery() {
        QuizQuestionEntity question = question("bbbbbbbbbbbbbbbbbbbbbbb1", "gato", "invalidWordId");
        when(quizRepository.findByIdAndUserId(QUIZ_ID, USER_ID)).thenReturn(Optional.of(quiz()));
        when(quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(QUIZ_ID)).thenReturn(List.of(question));
        stubAttemptSave();

        ScoredAttempt result = service.submitQuizAnswers(QUIZ_ID,
                List.of(new AnswerSubmission(question.getId(), "gato")), USER_ID).orElseThrow();

        assertEquals(1.0, result.score(), 0.0001);
        verify(masteryService).applyQuizResults(USER_ID, Map.of());
        verify(learningStatsService).recordActivity(USER_ID, 1, 0, 1, 1);
    }

    @Test
    void submitQuizAnswers_unknownQuestionIsRejected() {
        QuizQuestionEntity question = question("bbbbbbbbbbbbbbbbbbbbbbb1", "gato", WORD_ID);
        when(quizRepository.findByIdAndUserId(QUIZ_ID, USER_ID)).thenReturn(Optional.of(quiz()));
        when(quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(QUIZ_ID)).thenReturn(List.of(question));

        QuizQuestionNotFoundException thrown = assertThrows(QuizQuestionNotFoundException.class,
                () -> service.submitQuizAnswers(QUIZ_ID,
                        List.of(new AnswerSubmission("cccccccccccccccccccccccc", "gato")), USER_ID));

        assertEquals("cccccccccccccccccccccccc", thrown.getQuestionId());
        verifyNoInteractions(masteryService, quizAttemptRepository, learningStatsService);
    }

    @Test
    void submitQuizAnswers_foreignOrMalformedQuizIsEmpty() {
        when(quizRepository.findByIdAndUserId(QUIZ_ID, "someone-else")).thenReturn(Optional.empty());

        assertTrue(service.submitQuizAnswers(QUIZ_ID, List.of(), "someone-else").isEmpty());
        assertTrue(service.submitQuizAnswers("not-an-id", List.of(), USER_ID).isEmpty());
        verify(quizRepository, never()).findByIdAndUserId(eq("not-an-id"), anyString());
    }

    @Test
    void submitQuizAnswers_nullAnswersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.submitQuizAnswers(QUIZ_ID, null, USER_ID));
    }

    @Test
    void submitQuizAnswers_retriesDailyStatsOnceAfterConcurrentInsert() {
        QuizQuestionEntity question = question("bbbbbbbbbbbbbbbbbbbbbbb1", "gato", WORD_ID);
        when(quizRepository.findByIdAndUserId(QUIZ_ID, USER_ID)).thenReturn(Optional.of(quiz()));
        when(quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(QUIZ_ID)).thenReturn(List.of(question));
        stubAttemptSave();
        doThrow(new DataIntegrityViolationException("duplicate key"))
                .doNothing()
                .when(learningStatsService).recordActivity(anyString(), anyInt(), anyInt(), anyInt(), anyInt());

        service.submitQuizAnswers(QUIZ_ID, List.of(new AnswerSubmission(question.getId(), "gato")), USER_ID);

        verify(learningStatsService, times(2)).recordActivity(USER_ID, 1, 1, 1, 1);
    }

    @Test
    void isCorrect_handlesNullAndNormalization() {
        assertTrue(QuizScoringService.isCorrect("  El Gato", "el gato  "));
        assertFalse(QuizScoringService.isCorrect(null, "gato"));
        assertFalse(QuizScoringService.isCorrect("gatos", "gato"));
    }

    private void stubAttemptSave() {
        when(quizAttemptRepository.save(any(QuizAttemptEntity.class))).thenAnswer(invocation -> {
            QuizAttemptEntity attempt = invocation.getArgument(0);
            attempt.setId("attempt-1");
            return attempt;
        });
        when(quizAnswerRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static QuizEntity quiz() {
        QuizEntity quiz = new QuizEntity();
        quiz.setId(QUIZ_ID);
        quiz.setTitle("Quiz: Animals");
        quiz.setDifficulty(Difficulty.MEDIUM);
        quiz.setQuestionCount(3);
        quiz.setUserId(USER_ID);
        return quiz;
    }

    private static QuizQuestionEntity question(String id, String correctAnswer, String wordId) {
        QuizQuestionEntity question = new QuizQuestionEntity(null);
        question.setId(id);
        question.setQuestion("Translate");
        question.setType(QuestionType.FILL_BLANK);
        question.setCorrectAnswer(correctAnswer);
        question.setDifficulty(Difficulty.MEDIUM);
        question.setWordId(wordId);
        return question;
    }
}
