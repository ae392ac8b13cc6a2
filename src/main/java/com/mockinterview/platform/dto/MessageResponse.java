package com.mockinterview.platform.dto;

import com.mockinterview.platform.model.ConversationMessage;
import com.mockinterview.platform.model.MessageRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageResponse {
    private Integer sequence;
    private MessageRole role;
    private String content;
    private LocalDateTime timestamp;

    public static MessageResponse from(ConversationMessage message) {
        return MessageResponse.builder()
                .sequence(message.getSequence())
                .role(message.getRole())
                .content(message.getContent())
                .timestamp(message.getTimestamp())
                .build();
    }
}
