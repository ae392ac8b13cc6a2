package com.mockinterview.platform.dto;

import com.mockinterview.platform.model.CommunicationMode;
import com.mockinterview.platform.model.ResumeData;
import com.mockinterview.platform.model.SessionConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {
    @Builder.Default
    private List<String> enabledModes = new ArrayList<>();
    private String aiProvider;
    private String aiModel;
    private ResumeData resumeData;
    private Integer durationMinutes;

    public SessionConfig toConfig() {
        Set<CommunicationMode> modes = new LinkedHashSet<>();
        if (enabledModes != null) {
            enabledModes.forEach(mode -> modes.add(CommunicationMode.fromValue(mode)));
        }
        return SessionConfig.builder()
                .enabledModes(modes)
                .aiProvider(aiProvider)
                .aiModel(aiModel)
                .resumeData(resumeData)
                .durationMinutes(durationMinutes)
                .build();
    }
}
