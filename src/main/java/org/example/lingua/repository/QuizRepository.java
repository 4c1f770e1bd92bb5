package org.example.lingua.repository;

import org.example.lingua.entity.QuizEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface QuizRepository extends JpaRepository<QuizEntity, String> {

    Optional<QuizEntity> findByIdAndUserId(String id, String userId);

    List<QuizEntity> findByUserIdOrderByCreatedAtDesc(String userId);
}
