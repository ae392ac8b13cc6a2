package com.mockinterview.platform.repository;

import com.mockinterview.platform.model.TokenUsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TokenUsageRepository extends JpaRepository<TokenUsageRecord, String> {

    List<TokenUsageRecord> findBySessionIdOrderByRecordedAtAsc(String sessionId);

    void deleteBySessionId(String sessionId);
}
