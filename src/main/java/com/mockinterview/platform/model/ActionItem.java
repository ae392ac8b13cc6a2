package com.mockinterview.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionItem {
    private int stepNumber;
    private String description;
    @Builder.Default
    private List<String> resources = new ArrayList<>();
}
