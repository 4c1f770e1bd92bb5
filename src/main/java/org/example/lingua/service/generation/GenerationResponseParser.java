package org.example.lingua.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.lingua.entity.Difficulty;
import org.example.lingua.entity.QuestionType;
import org.example.lingua.service.resilience.ResponseValidationException;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw backend text into validated generation artifacts. Malformed JSON surfaces
 * as {@link UncheckedIOException} wrapping Jackson's exception; JSON of the wrong
 * shape as {@link ResponseValidationException}.
 */
@Component
public class GenerationResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```[a-z]*\\n?|```", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public GenerationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static String stripCodeFences(String raw) {
        if (raw == null) {
            return "";
        }
        return CODE_FENCE.matcher(raw).replaceAll("").trim();
    }

    public List<GeneratedQuestion> parseQuestions(String raw, int maxCount, Difficulty requestedDifficulty) {
        JsonNode root = readArray(raw, "questions");
        List<GeneratedQuestion> questions = new ArrayList<>();
        for (JsonNode item : root) {
            if (questions.size() >= maxCount) {
                break;
            }
            questions.add(toQuestion(item, requestedDifficulty));
        }
        if (questions.isEmpty()) {
            throw new ResponseValidationException("Validation failed: no questions returned");
        }
        return questions;
    }

    public List<ContextualSentences> parseSentences(String raw) {
        JsonNode root = readArray(raw, "sentences");
        List<ContextualSentences> result = new ArrayList<>();
        for (JsonNode item : root) {
            String wordId = requiredText(item, "wordId");
            List<String> sentences = stringList(item.get("sentences"), "sentences");
            if (sentences.isEmpty()) {
                throw new ResponseValidationException("Validation failed: sentences must not be empty");
            }
            result.add(new ContextualSentences(wordId, sentences));
        }
        return result;
    }

    public List<VocabularyEntry> parseVocabulary(String raw, int maxCount) {
        JsonNode root = readArray(raw, "vocabulary");
        List<VocabularyEntry> entries = new ArrayList<>();
        for (JsonNode item : root) {
            if (entries.size() >= maxCount) {
                break;
            }
            entries.add(new VocabularyEntry(
                    requiredText(item, "word"),
                    requiredText(item, "translation"),
                    optionalText(item, "partOfSpeech"),
                    optionalDifficulty(item, null)
            ));
        }
        return entries;
    }

    public ComplexityReport parseComplexity(String raw) {
        JsonNode root = read(raw);
        if (!root.isObject()) {
            throw new ResponseValidationException("Validation failed: complexity analysis must be an object");
        }
        Difficulty complexity = Difficulty.parse(requiredText(root, "complexity"))
                .orElseThrow(() -> new ResponseValidationException("Validation failed: unknown complexity"));
        JsonNode score = root.get("score");
        if (score == null || !score.isNumber()) {
            throw new ResponseValidationException("Validation failed: score must be numeric");
        }
        double value = score.asDouble();
        if (value < 0.0 || value > 1.0) {
            throw new ResponseValidationException("Validation failed: score out of range: " + value);
        }
        return new ComplexityReport(complexity, value, stringList(root.get("suggestions"), "suggestions"));
    }

    private GeneratedQuestion toQuestion(JsonNode item, Difficulty requestedDifficulty) {
        String question = requiredText(item, "question");
        QuestionType type = QuestionType.parse(requiredText(item, "type"))
                .orElseThrow(() -> new ResponseValidationException("Validation failed: unknown question type"));
        String correctAnswer = requiredText(item, "correctAnswer");

        List<String> options = null;
        JsonNode optionsNode = item.get("options");
        if (optionsNode != null && !optionsNode.isNull()) {
            options = stringList(optionsNode, "options");
        }
        if (type == QuestionType.MULTIPLE_CHOICE && (options == null || options.size() < 2)) {
            throw new ResponseValidationException("Validation failed: multiple choice question needs at least 2 options");
        }

        return new GeneratedQuestion(
                question,
                type,
                correctAnswer,
                options,
                optionalText(item, "context"),
                optionalDifficulty(item, requestedDifficulty),
                optionalText(item, "wordId")
        );
    }

    private JsonNode readArray(String raw, String artifact) {
        JsonNode root = read(raw);
        if (!root.isArray()) {
            throw new ResponseValidationException("Validation failed: expected a JSON array of " + artifact);
        }
        return root;
    }

    private JsonNode read(String raw) {
        String cleaned = stripCodeFences(raw);
        if (cleaned.isEmpty()) {
            throw new ResponseValidationException("Validation failed: empty response");
        }
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid JSON in generation response", e);
        }
    }

    private String requiredText(JsonNode item, String field) {
        JsonNode value = item == null ? null : item.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ResponseValidationException("Validation failed: missing field " + field);
        }
        return value.asText().trim();
    }

    private String optionalText(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private Difficulty optionalDifficulty(JsonNode item, Difficulty defaultValue) {
        String value = optionalText(item, "difficulty");
        if (value == null) {
            return defaultValue;
        }
        return Difficulty.parse(value)
                .orElseThrow(() -> new ResponseValidationException("Validation failed: unknown difficulty " + value));
    }

    private List<String> stringList(JsonNode node, String field) {
        if (node == null || !node.isArray()) {
            throw new ResponseValidationException("Validation failed: " + field + " must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new ResponseValidationException("Validation failed: " + field + " must contain strings");
            }
            values.add(element.asText());
        }
        return values;
    }
}
