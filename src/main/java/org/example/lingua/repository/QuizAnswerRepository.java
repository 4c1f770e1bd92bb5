package org.example.lingua.repository;

import org.example.lingua.entity.QuizAnswerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface QuizAnswerRepository extends JpaRepository<QuizAnswerEntity, String> {

    List<QuizAnswerEntity> findByAttemptIdIn(Collection<String> attemptIds);

    List<QuizAnswerEntity> findByAttemptId(String attemptId);
}
