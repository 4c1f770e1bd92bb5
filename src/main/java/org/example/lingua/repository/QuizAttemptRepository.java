package org.example.lingua.repository;

import org.example.lingua.entity.QuizAttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QuizAttemptRepository extends JpaRepository<QuizAttemptEntity, String> {

    List<QuizAttemptEntity> findTop10ByUserIdOrderByCreatedAtDesc(String userId);

    List<QuizAttemptEntity> findTop20ByUserIdOrderByCreatedAtDesc(String userId);

    List<QuizAttemptEntity> findByQuizIdAndUserIdOrderByCreatedAtDesc(String quizId, String userId);

    long countByUserId(String userId);
}
