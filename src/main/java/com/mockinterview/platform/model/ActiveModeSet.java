package com.mockinterview.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Modes currently switched on for a session; a subset of the configured modes.
 */
@Entity
@Table(name = "session_active_modes")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActiveModeSet {

    @Id
    @Column(name = "session_id", length = 36)
    private String sessionId;

    @Convert(converter = CommunicationModeSetConverter.class)
    @Column(nullable = false)
    private Set<CommunicationMode> modes;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
