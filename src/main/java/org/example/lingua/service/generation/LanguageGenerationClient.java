package org.example.lingua.service.generation;

import org.example.lingua.entity.Difficulty;
import org.example.lingua.service.llm.LlmOptions;
import org.example.lingua.service.llm.LlmProvider;
import org.example.lingua.service.llm.LlmProviderException;
import org.example.lingua.service.resilience.GenerationRetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts the generation backend for quiz questions, example sentences, vocabulary
 * lists and complexity analysis. Every call goes through the retry executor, which in
 * turn goes through the request queue and circuit breaker.
 */
@Service
public class LanguageGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(LanguageGenerationClient.class);

    private static final LlmOptions QUESTION_OPTIONS = LlmOptions.full(0.4, 0.9, 4096);
    private static final LlmOptions SENTENCE_OPTIONS = LlmOptions.full(0.7, 0.95, 4096);
    private static final LlmOptions VOCABULARY_OPTIONS = LlmOptions.full(0.7, 0.95, 4096);
    private static final LlmOptions ANALYSIS_OPTIONS = LlmOptions.full(0.2, 0.9, 1024);

    private final LlmProvider llmProvider;
    private final GenerationRetryExecutor retryExecutor;
    private final GenerationResponseParser responseParser;

    public LanguageGenerationClient(
            LlmProvider llmProvider,
            GenerationRetryExecutor retryExecutor,
            GenerationResponseParser responseParser) {
        this.llmProvider = llmProvider;
        this.retryExecutor = retryExecutor;
        this.responseParser = responseParser;
    }

    /**
     * @throws org.example.lingua.service.resilience.GenerationException after retries are exhausted
     */
    public List<GeneratedQuestion> generateQuestions(
            List<VocabularyWord> words,
            String targetLanguage,
            String nativeLanguage,
            int questionCount,
            Difficulty difficulty) {
        String prompt = String.format("""
            Generate %d language learning questions for the following vocabulary words.
            Target language: %s
            Native language: %s
            Difficulty level: %s

            Vocabulary words (id: word (translation) - part of speech):
            %s

            Requirements:
            1. Mix question types: multiple_choice, fill_blank and sentence_completion.
            2. Questions should be contextual and practical.
            3. Include 3-4 options for multiple choice questions.
            4. Provide short context or explanation where helpful.
            5. Copy the id of the tested word into "wordId" exactly as given above.
            6. Return valid JSON only, no markdown.

            JSON SCHEMA:
            [
              {
                "question": "string",
                "type": "multiple_choice|fill_blank|sentence_completion",
                "correctAnswer": "string",
                "options": ["string", "string", "string", "string"],
                "context": "string",
                "difficulty": "easy|medium|hard",
                "wordId": "string"
              }
            ]
            """,
                questionCount,
                targetLanguage,
                nativeLanguage,
                difficulty.wireValue(),
                words.stream()
                        .map(w -> String.format("- %s: %s (%s) - %s",
                                w.id(), w.word(), w.translation(),
                                w.partOfSpeech() == null ? "unknown" : w.partOfSpeech()))
                        .collect(Collectors.joining("\n"))
        );

        return retryExecutor.execute(
                "generateQuestions",
                () -> llmProvider.generate(prompt, QUESTION_OPTIONS),
                raw -> responseParser.parseQuestions(raw, questionCount, difficulty)
        );
    }

    /**
     * @throws org.example.lingua.service.resilience.GenerationException after retries are exhausted
     */
    public List<ContextualSentences> generateContextualSentences(
            List<VocabularyWord> words,
            String targetLanguage,
            String nativeLanguage) {
        String prompt = String.format("""
            Generate 3 contextual sentences in %s for each vocabulary word below.
            Learners speak %s. Use natural, everyday situations that show how the word is used.

            Words (id: word (translation)):
            %s

            Return valid JSON only, no markdown:
            [
              {
                "wordId": "id exactly as given above",
                "sentences": ["sentence 1", "sentence 2", "sentence 3"]
              }
            ]
            """,
                targetLanguage,
                nativeLanguage,
                words.stream()
                        .map(w -> String.format("- %s: %s (%s)", w.id(), w.word(), w.translation()))
                        .collect(Collectors.joining("\n"))
        );

        return retryExecutor.execute(
                "generateContextualSentences",
                () -> llmProvider.generate(prompt, SENTENCE_OPTIONS),
                responseParser::parseSentences
        );
    }

    /**
     * Returns an empty list when generation keeps failing.
     */
    public List<VocabularyEntry> generateVocabularyList(
            String topic,
            String targetLanguage,
            String nativeLanguage,
            int wordCount) {
        String prompt = String.format("""
            Generate a list of %d useful vocabulary words for language learners based on this topic or keywords: "%s".
            Target language: %s
            Native language: %s

            For each word provide the word in the target language, its translation in the
            native language, the part of speech if possible, and a difficulty (easy, medium or hard).

            Return valid JSON only, no markdown:
            [
              { "word": "string", "translation": "string", "partOfSpeech": "string", "difficulty": "easy|medium|hard" }
            ]
            """,
                wordCount,
                topic,
                targetLanguage,
                nativeLanguage
        );

        return retryExecutor.executeOrFallback(
                "generateVocabularyList",
                () -> llmProvider.generate(prompt, VOCABULARY_OPTIONS),
                raw -> responseParser.parseVocabulary(raw, wordCount),
                List.of()
        );
    }

    /**
     * Returns {@link ComplexityReport#fallback()} when generation keeps failing.
     */
    public ComplexityReport analyzeTextComplexity(String text, String targetLanguage) {
        String prompt = String.format("""
            Analyze the complexity of this %s text and provide a difficulty assessment.

            Text: "%s"

            Consider vocabulary difficulty, grammar complexity, sentence structure and cultural context.

            Return valid JSON only, no markdown:
            {
              "complexity": "easy|medium|hard",
              "score": 0.0,
              "suggestions": ["string"]
            }
            "score" must be between 0.0 and 1.0.
            """,
                targetLanguage,
                text
        );

        return retryExecutor.executeOrFallback(
                "analyzeTextComplexity",
                () -> llmProvider.generate(prompt, ANALYSIS_OPTIONS),
                responseParser::parseComplexity,
                ComplexityReport.fallback()
        );
    }

    /**
     * Sends a trivial prompt straight to the provider.
     *
     * @throws LlmProviderException if the backend fails or answers with nothing
     */
    public void checkHealth() {
        String response = llmProvider.generate("Reply with the single word OK.", LlmOptions.withTemperature(0.0));
        if (response == null || response.isBlank()) {
            throw new LlmProviderException("Empty health check response from " + llmProvider.getProviderName());
        }
        log.debug("Generation backend {} answered health check", llmProvider.getProviderName());
    }

    public boolean isProviderAvailable() {
        return llmProvider.isAvailable();
    }

    public String getProviderName() {
        return llmProvider.getProviderName();
    }
}
