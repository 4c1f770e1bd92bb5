package org.example.lingua.service;

import org.example.lingua.entity.Difficulty;
import org.example.lingua.entity.EntityIds;
import org.example.lingua.entity.VocabularyListEntity;
import org.example.lingua.entity.WordEntity;
import org.example.lingua.model.AiVocabularyListRequest;
import org.example.lingua.model.VocabularyListDetails;
import org.example.lingua.repository.VocabularyListRepository;
import org.example.lingua.repository.WordRepository;
import org.example.lingua.service.generation.ComplexityReport;
import org.example.lingua.service.generation.ContextualSentences;
import org.example.lingua.service.generation.LanguageGenerationClient;
import org.example.lingua.service.generation.VocabularyEntry;
import org.example.lingua.service.generation.VocabularyWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Generation-backed helpers around vocabulary lists: example sentences, whole lists
 * from a topic, and text complexity.
 */
@Service
public class VocabularyAiService {

    private static final Logger log = LoggerFactory.getLogger(VocabularyAiService.class);

    static final int DEFAULT_WORD_COUNT = 10;
    static final int MAX_WORD_COUNT = 50;
    private static final String DEFAULT_NATIVE_LANGUAGE = "en";

    private final VocabularyListRepository vocabularyListRepository;
    private final WordRepository wordRepository;
    private final LanguageGenerationClient generationClient;

    // Self-injection so saveGeneratedList runs through the transactional proxy
    private VocabularyAiService self;

    public VocabularyAiService(
            VocabularyListRepository vocabularyListRepository,
            WordRepository wordRepository,
            LanguageGenerationClient generationClient) {
        this.vocabularyListRepository = vocabularyListRepository;
        this.wordRepository = wordRepository;
        this.generationClient = generationClient;
    }

    @Autowired
    @Lazy
    public void setSelf(VocabularyAiService self) {
        this.self = self;
    }

    /**
     * @return empty when the list does not exist or belongs to another user
     * @throws IllegalStateException when the list has no words
     */
    public Optional<List<ContextualSentences>> generateSentences(String listId, String userId) {
        if (!EntityIds.isValid(listId)) {
            return Optional.empty();
        }
        Optional<VocabularyListEntity> list = vocabularyListRepository.findByIdAndUserId(listId, userId);
        if (list.isEmpty()) {
            return Optional.empty();
        }
        List<WordEntity> words = wordRepository.findByVocabularyListIdOrderByCreatedAtAsc(listId);
        if (words.isEmpty()) {
            throw new IllegalStateException("No words in vocabulary list");
        }

        String nativeLanguage = list.get().getNativeLanguage() == null || list.get().getNativeLanguage().isBlank()
                ? DEFAULT_NATIVE_LANGUAGE
                : list.get().getNativeLanguage();
        return Optional.of(generationClient.generateContextualSentences(
                words.stream()
                        .map(w -> new VocabularyWord(w.getId(), w.getWord(), w.getTranslation(), w.getPartOfSpeech()))
                        .toList(),
                list.get().getTargetLanguage(),
                nativeLanguage
        ));
    }

    /**
     * Creates a list from generated entries; the list is stored even when generation
     * produced no words. Nothing is written when generation fails.
     */
    public VocabularyListDetails generateAiList(AiVocabularyListRequest request, String userId) {
        validate(request);
        int wordCount = request.wordCount() == null ? DEFAULT_WORD_COUNT : request.wordCount();

        List<VocabularyEntry> entries = generationClient.generateVocabularyList(
                request.prompt(),
                request.targetLanguage(),
                request.nativeLanguage(),
                wordCount
        );
        return self.saveGeneratedList(request, entries, userId);
    }

    @Transactional
    public VocabularyListDetails saveGeneratedList(
            AiVocabularyListRequest request,
            List<VocabularyEntry> entries,
            String userId) {
        VocabularyListEntity list = new VocabularyListEntity(
                request.name().trim(),
                request.targetLanguage(),
                request.nativeLanguage(),
                userId
        );
        list.setDescription(request.description());
        VocabularyListEntity savedList = vocabularyListRepository.save(list);

        List<WordEntity> words = entries.stream()
                .map(entry -> {
                    WordEntity word = new WordEntity(savedList, entry.word(), entry.translation());
                    word.setPartOfSpeech(entry.partOfSpeech());
                    word.setDifficulty(entry.difficulty() == null ? Difficulty.MEDIUM : entry.difficulty());
                    return word;
                })
                .toList();
        List<WordEntity> savedWords = words.isEmpty() ? List.of() : wordRepository.saveAll(words);

        log.info("Created generated vocabulary list {} with {} words for user {}",
                savedList.getId(), savedWords.size(), userId);
        return new VocabularyListDetails(
                savedList.getId(),
                savedList.getName(),
                savedList.getDescription(),
                savedList.getTargetLanguage(),
                savedList.getNativeLanguage(),
                savedWords.stream()
                        .map(w -> new VocabularyListDetails.Word(
                                w.getId(), w.getWord(), w.getTranslation(), w.getPartOfSpeech(), w.getDifficulty()))
                        .toList()
        );
    }

    public ComplexityReport analyzeComplexity(String text, String targetLanguage) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        if (targetLanguage == null || targetLanguage.isBlank()) {
            throw new IllegalArgumentException("targetLanguage is required");
        }
        return generationClient.analyzeTextComplexity(text, targetLanguage);
    }

    private void validate(AiVocabularyListRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        requireText(request.name(), "name");
        requireText(request.targetLanguage(), "targetLanguage");
        requireText(request.nativeLanguage(), "nativeLanguage");
        requireText(request.prompt(), "prompt");
        if (request.wordCount() != null && (request.wordCount() < 1 || request.wordCount() > MAX_WORD_COUNT)) {
            throw new IllegalArgumentException("wordCount must be between 1 and " + MAX_WORD_COUNT);
        }
    }

    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
