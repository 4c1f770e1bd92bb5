package org.example.lingua.repository;

import org.example.lingua.entity.VocabularyListEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VocabularyListRepository extends JpaRepository<VocabularyListEntity, String> {

    Optional<VocabularyListEntity> findByIdAndUserId(String id, String userId);
}
