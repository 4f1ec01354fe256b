package com.poufmaker.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationCreatedDTO {
    private ConversationDTO conversation;
    private MessageDTO message;
}
