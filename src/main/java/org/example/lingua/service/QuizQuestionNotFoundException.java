package org.example.lingua.service;

/**
 * A submitted answer references a question that does not belong to the quiz.
 */
public class QuizQuestionNotFoundException extends RuntimeException {

    private final String questionId;

    public QuizQuestionNotFoundException(String questionId) {
        super("Question " + questionId + " not found");
        this.questionId = questionId;
    }

    public String getQuestionId() {
        return questionId;
    }
}
