package org.example.lingua.repository;

import org.example.lingua.entity.WordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WordRepository extends JpaRepository<WordEntity, String> {

    List<WordEntity> findByVocabularyListIdOrderByCreatedAtAsc(String vocabularyListId);
}
