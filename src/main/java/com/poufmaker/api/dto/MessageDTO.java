package com.poufmaker.api.dto;

import com.poufmaker.api.entity.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDTO {
    private UUID id;
    private UUID conversationId;
    private String content;
    private Boolean isUser;
    private Instant createdAt;

    public static MessageDTO fromEntity(Message message) {
        return MessageDTO.builder()
                .id(message.getId())
                .conversationId(message.getConversationId())
                .content(message.getContent())
                .isUser(message.getIsUser())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
