package org.example.lingua.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.lingua.entity.Difficulty;
import org.example.lingua.entity.EntityIds;
import org.example.lingua.entity.QuizAnswerEntity;
import org.example.lingua.entity.QuizAttemptEntity;
import org.example.lingua.entity.QuizEntity;
import org.example.lingua.entity.QuizQuestionEntity;
import org.example.lingua.entity.VocabularyListEntity;
import org.example.lingua.entity.WordEntity;
import org.example.lingua.model.AttemptSummary;
import org.example.lingua.model.QuizDetails;
import org.example.lingua.model.QuizGenerationOptions;
import org.example.lingua.model.QuizOverview;
import org.example.lingua.model.QuizResults;
import org.example.lingua.repository.QuizAnswerRepository;
import org.example.lingua.repository.QuizAttemptRepository;
import org.example.lingua.repository.QuizQuestionRepository;
import org.example.lingua.repository.QuizRepository;
import org.example.lingua.repository.VocabularyListRepository;
import org.example.lingua.repository.WordRepository;
import org.example.lingua.service.generation.GeneratedQuestion;
import org.example.lingua.service.generation.LanguageGenerationClient;
import org.example.lingua.service.generation.VocabularyWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class QuizGenerationService {

    private static final Logger log = LoggerFactory.getLogger(QuizGenerationService.class);

    static final int DEFAULT_QUESTION_COUNT = 10;
    static final int MAX_QUESTION_COUNT = 20;
    private static final int MAX_WORD_ID_LENGTH = 64;
    private static final String DEFAULT_NATIVE_LANGUAGE = "en";

    private final VocabularyListRepository vocabularyListRepository;
    private final WordRepository wordRepository;
    private final QuizRepository quizRepository;
    private final QuizQuestionRepository quizQuestionRepository;
    private final QuizAttemptRepository quizAttemptRepository;
    private final QuizAnswerRepository quizAnswerRepository;
    private final LanguageGenerationClient generationClient;
    private final ObjectMapper objectMapper;

    // Self-injection so saveGeneratedQuiz runs through the transactional proxy
    private QuizGenerationService self;

    public QuizGenerationService(
            VocabularyListRepository vocabularyListRepository,
            WordRepository wordRepository,
            QuizRepository quizRepository,
            QuizQuestionRepository quizQuestionRepository,
            QuizAttemptRepository quizAttemptRepository,
            QuizAnswerRepository quizAnswerRepository,
            LanguageGenerationClient generationClient,
            ObjectMapper objectMapper) {
        this.vocabularyListRepository = vocabularyListRepository;
        this.wordRepository = wordRepository;
        this.quizRepository = quizRepository;
        this.quizQuestionRepository = quizQuestionRepository;
        this.quizAttemptRepository = quizAttemptRepository;
        this.quizAnswerRepository = quizAnswerRepository;
        this.generationClient = generationClient;
        this.objectMapper = objectMapper;
    }

    @Autowired
    @Lazy
    public void setSelf(QuizGenerationService self) {
        this.self = self;
    }

    /**
     * Generates and stores a quiz for one of the user's vocabulary lists. The backend
     * call runs outside any transaction; the quiz is stored afterwards in one short write.
     *
     * @return empty when the list does not exist or belongs to another user
     * @throws IllegalArgumentException for a question count outside 1..20
     * @throws IllegalStateException when the list has no words
     * @throws org.example.lingua.service.resilience.GenerationException when generation fails
     */
    public Optional<QuizDetails> generateQuiz(String vocabularyListId, QuizGenerationOptions options, String userId) {
        int questionCount = resolveQuestionCount(options);
        Difficulty difficulty = options == null || options.difficulty() == null
                ? Difficulty.MEDIUM
                : options.difficulty();

        if (!EntityIds.isValid(vocabularyListId)) {
            return Optional.empty();
        }
        Optional<VocabularyListEntity> list = vocabularyListRepository.findByIdAndUserId(vocabularyListId, userId);
        if (list.isEmpty()) {
            return Optional.empty();
        }

        List<WordEntity> words = wordRepository.findByVocabularyListIdOrderByCreatedAtAsc(vocabularyListId);
        if (words.isEmpty()) {
            throw new IllegalStateException("No words in vocabulary list");
        }

        VocabularyListEntity vocabularyList = list.get();
        String nativeLanguage = vocabularyList.getNativeLanguage() == null || vocabularyList.getNativeLanguage().isBlank()
                ? DEFAULT_NATIVE_LANGUAGE
                : vocabularyList.getNativeLanguage();
        List<GeneratedQuestion> generated = generationClient.generateQuestions(
                words.stream()
                        .map(w -> new VocabularyWord(w.getId(), w.getWord(), w.getTranslation(), w.getPartOfSpeech()))
                        .toList(),
                vocabularyList.getTargetLanguage(),
                nativeLanguage,
                questionCount,
                difficulty
        );

        return Optional.of(self.saveGeneratedQuiz(vocabularyList, difficulty, questionCount, generated, userId));
    }

    @Transactional
    public QuizDetails saveGeneratedQuiz(
            VocabularyListEntity vocabularyList,
            Difficulty difficulty,
            int questionCount,
            List<GeneratedQuestion> generated,
            String userId) {
        QuizEntity quiz = new QuizEntity();
        quiz.setTitle("Quiz: " + vocabularyList.getName());
        quiz.setDescription("AI-generated quiz from " + vocabularyList.getName());
        quiz.setDifficulty(difficulty);
        quiz.setQuestionCount(questionCount);
        quiz.setUserId(userId);
        quiz.setVocabularyListId(vocabularyList.getId());
        QuizEntity savedQuiz = quizRepository.save(quiz);

        List<QuizQuestionEntity> questions = new ArrayList<>();
        for (GeneratedQuestion item : generated) {
            QuizQuestionEntity question = new QuizQuestionEntity(savedQuiz);
            question.setQuestion(item.question());
            question.setType(item.type());
            question.setCorrectAnswer(item.correctAnswer());
            question.setOptionsJson(item.options() == null ? null : toJson(item.options()));
            question.setContext(item.context());
            question.setDifficulty(item.difficulty() == null ? difficulty : item.difficulty());
            question.setWordId(truncate(item.wordId()));
            questions.add(question);
        }
        List<QuizQuestionEntity> savedQuestions = quizQuestionRepository.saveAll(questions);

        log.info("Generated quiz {} with {} questions from list {} for user {}",
                savedQuiz.getId(), savedQuestions.size(), vocabularyList.getId(), userId);
        return toDetails(savedQuiz, savedQuestions);
    }

    @Transactional(readOnly = true)
    public List<QuizOverview> getUserQuizzes(String userId) {
        return quizRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(quiz -> {
                    int storedQuestions = quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(quiz.getId()).size();
                    AttemptSummary lastAttempt = quizAttemptRepository
                            .findByQuizIdAndUserIdOrderByCreatedAtDesc(quiz.getId(), userId)
                            .stream()
                            .findFirst()
                            .map(QuizGenerationService::toSummary)
                            .orElse(null);
                    return new QuizOverview(
                            quiz.getId(),
                            quiz.getTitle(),
                            quiz.getDescription(),
                            quiz.getDifficulty(),
                            quiz.getQuestionCount(),
                            storedQuestions,
                            quiz.getCreatedAt(),
                            lastAttempt
                    );
                })
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<QuizDetails> getQuiz(String quizId, String userId) {
        if (!EntityIds.isValid(quizId)) {
            return Optional.empty();
        }
        return quizRepository.findByIdAndUserId(quizId, userId)
                .map(quiz -> toDetails(quiz, quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(quizId)));
    }

    @Transactional(readOnly = true)
    public Optional<QuizResults> getQuizResults(String quizId, String userId) {
        if (!EntityIds.isValid(quizId)) {
            return Optional.empty();
        }
        Optional<QuizEntity> quiz = quizRepository.findByIdAndUserId(quizId, userId);
        if (quiz.isEmpty()) {
            return Optional.empty();
        }

        Map<String, QuizQuestionEntity> questionsById = quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(quizId)
                .stream()
                .collect(Collectors.toMap(QuizQuestionEntity::getId, Function.identity(), (a, b) -> a));

        List<QuizResults.AttemptResult> attempts = quizAttemptRepository
                .findByQuizIdAndUserIdOrderByCreatedAtDesc(quizId, userId)
                .stream()
                .map(attempt -> new QuizResults.AttemptResult(
                        toSummary(attempt),
                        quizAnswerRepository.findByAttemptId(attempt.getId()).stream()
                                .sorted(Comparator.comparing(QuizAnswerEntity::getCreatedAt))
                                .map(answer -> toAnsweredQuestion(answer, questionsById.get(answer.getQuestionId())))
                                .toList()
                ))
                .toList();

        return Optional.of(new QuizResults(quizId, quiz.get().getTitle(), quiz.get().getDifficulty(), attempts));
    }

    private int resolveQuestionCount(QuizGenerationOptions options) {
        if (options == null || options.questionCount() == null) {
            return DEFAULT_QUESTION_COUNT;
        }
        int count = options.questionCount();
        if (count < 1 || count > MAX_QUESTION_COUNT) {
            throw new IllegalArgumentException("questionCount must be between 1 and " + MAX_QUESTION_COUNT);
        }
        return count;
    }

    private QuizDetails toDetails(QuizEntity quiz, List<QuizQuestionEntity> questions) {
        return new QuizDetails(
                quiz.getId(),
                quiz.getTitle(),
                quiz.getDescription(),
                quiz.getDifficulty(),
                quiz.getQuestionCount(),
                quiz.getVocabularyListId(),
                quiz.getCreatedAt(),
                questions.stream()
                        .map(q -> new QuizDetails.Question(
                                q.getId(),
                                q.getQuestion(),
                                q.getType(),
                                fromJson(q.getOptionsJson()),
                                q.getContext(),
                                q.getDifficulty(),
                                q.getWordId()
                        ))
                        .toList()
        );
    }

    static AttemptSummary toSummary(QuizAttemptEntity attempt) {
        return new AttemptSummary(
                attempt.getId(),
                attempt.getQuizId(),
                attempt.getScore(),
                attempt.getCorrectAnswers(),
                attempt.getTotalQuestions(),
                attempt.isCompleted(),
                attempt.getCreatedAt()
        );
    }

    private QuizResults.AnsweredQuestion toAnsweredQuestion(QuizAnswerEntity answer, QuizQuestionEntity question) {
        return new QuizResults.AnsweredQuestion(
                answer.getQuestionId(),
                question == null ? null : question.getQuestion(),
                answer.getAnswer(),
                answer.isCorrect(),
                question == null ? null : question.getCorrectAnswer(),
                answer.getCreatedAt()
        );
    }

    private String toJson(List<String> options) {
        try {
            return objectMapper.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize question options", e);
        }
    }

    private List<String> fromJson(String optionsJson) {
        if (optionsJson == null || optionsJson.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(optionsJson, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored question options", e);
            return null;
        }
    }

    private String truncate(String wordId) {
        if (wordId == null || wordId.length() <= MAX_WORD_ID_LENGTH) {
            return wordId;
        }
        return wordId.substring(0, MAX_WORD_ID_LENGTH);
    }
}
