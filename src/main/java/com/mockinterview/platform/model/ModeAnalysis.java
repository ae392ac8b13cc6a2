package com.mockinterview.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-mode assessments. A field stays null when its mode was not enabled for the session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModeAnalysis {
    private String audioQuality;
    private String videoPresence;
    private String whiteboardUsage;
    private String screenShareUsage;
    private String overallCommunication;
}
