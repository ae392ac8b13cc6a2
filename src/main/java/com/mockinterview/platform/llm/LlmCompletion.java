package com.mockinterview.platform.llm;

import lombok.Value;

@Value
public class LlmCompletion {
    String text;
    long inputTokens;
    long outputTokens;
}
