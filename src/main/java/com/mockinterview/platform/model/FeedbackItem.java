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
public class FeedbackItem {
    private String description;
    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    public static FeedbackItem of(String description) {
        return FeedbackItem.builder().description(description).build();
    }
}
