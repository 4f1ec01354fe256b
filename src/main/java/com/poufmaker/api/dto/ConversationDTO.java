package com.poufmaker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.poufmaker.api.entity.Conversation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A conversation with some of its messages, newest first. Listings carry only the
 * latest message; the single-conversation view carries all of them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationDTO {
    private UUID id;
    private UUID userId;
    private String userName;
    private String userPhone;
    private Instant createdAt;
    private Instant updatedAt;
    private UserSummaryDTO user;
    private List<MessageDTO> messages;

    public static ConversationDTO fromEntity(Conversation conversation, UserSummaryDTO user, List<MessageDTO> messages) {
        return ConversationDTO.builder()
                .id(conversation.getId())
                .userId(conversation.getUserId())
                .userName(conversation.getUserName())
                .userPhone(conversation.getUserPhone())
                .createdAt(conversation.getCreatedAt())
                .updatedAt(conversation.getUpdatedAt())
                .user(user)
                .messages(messages)
                .build();
    }
}
