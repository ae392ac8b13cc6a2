package com.mockinterview.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionListResponse {
    private List<SessionResponse> sessions;
    private long total;
    private int limit;
    private int offset;
}
