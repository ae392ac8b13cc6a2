package com.mockinterview.platform.repository;

import com.mockinterview.platform.model.AuditLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntry, Long> {

    List<AuditLogEntry> findBySessionIdOrderByIdAsc(String sessionId);
}
