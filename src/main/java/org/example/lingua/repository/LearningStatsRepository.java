package org.example.lingua.repository;

import org.example.lingua.entity.LearningStatsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface LearningStatsRepository extends JpaRepository<LearningStatsEntity, String> {

    Optional<LearningStatsEntity> findByUserIdAndStatDate(String userId, LocalDate statDate);

    List<LearningStatsEntity> findTop30ByUserIdOrderByStatDateDesc(String userId);

    List<LearningStatsEntity> findTop365ByUserIdOrderByStatDateDesc(String userId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LearningStatsEntity s SET " +
            "s.quizzesTaken = s.quizzesTaken + :quizzes, " +
            "s.wordsReviewed = s.wordsReviewed + :words, " +
            "s.totalQuestions = s.totalQuestions + :questions, " +
            "s.correctAnswers = s.correctAnswers + :correct, " +
            "s.updatedAt = :now " +
            "WHERE s.userId = :userId AND s.statDate = :statDate")
    int incrementCounters(
            @Param("userId") String userId,
            @Param("statDate") LocalDate statDate,
            @Param("quizzes") int quizzes,
            @Param("words") int words,
            @Param("questions") int questions,
            @Param("correct") int correct,
            @Param("now") LocalDateTime now);
}
