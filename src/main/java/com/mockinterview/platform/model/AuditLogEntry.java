package com.mockinterview.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs", indexes = @Index(name = "idx_audit_logs_session", columnList = "session_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String component;

    @Column(nullable = false, length = 100)
    private String operation;

    @Column(name = "session_id", length = 36)
    private String sessionId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "logged_at", nullable = false)
    private LocalDateTime timestamp;

    public AuditLogEntry(String component, String operation, String sessionId, String message) {
        this.component = component;
        this.operation = operation;
        this.sessionId = sessionId;
        this.message = message;
    }

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = LocalDateTime.now();
        }
    }
}
