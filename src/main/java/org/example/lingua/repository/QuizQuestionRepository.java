package org.example.lingua.repository;

import org.example.lingua.entity.QuizQuestionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QuizQuestionRepository extends JpaRepository<QuizQuestionEntity, String> {

    List<QuizQuestionEntity> findByQuizIdOrderByCreatedAtAsc(String quizId);
}
