package com.mockinterview.platform.repository;

import com.mockinterview.platform.model.MediaFile;
import com.mockinterview.platform.model.MediaKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MediaFileRepository extends JpaRepository<MediaFile, String> {

    List<MediaFile> findBySessionIdOrderByKindAscSequenceAsc(String sessionId);

    List<MediaFile> findBySessionIdAndKindOrderBySequenceAsc(String sessionId, MediaKind kind);

    @Query("select coalesce(max(m.sequence), 0) from MediaFile m where m.sessionId = :sessionId and m.kind = :kind")
    int findMaxSequence(@Param("sessionId") String sessionId, @Param("kind") MediaKind kind);

    void deleteBySessionId(String sessionId);
}
