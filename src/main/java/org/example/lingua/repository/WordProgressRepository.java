package org.example.lingua.repository;

import org.example.lingua.entity.WordProgressEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WordProgressRepository extends JpaRepository<WordProgressEntity, String> {

    Optional<WordProgressEntity> findByUserIdAndWordId(String userId, String wordId);

    @Query("SELECT wp FROM WordProgressEntity wp JOIN FETCH wp.word " +
            "WHERE wp.userId = :userId ORDER BY wp.lastReviewed DESC")
    List<WordProgressEntity> findWithWordByUserIdOrderByLastReviewedDesc(@Param("userId") String userId);

    List<WordProgressEntity> findByUserId(String userId);
}
