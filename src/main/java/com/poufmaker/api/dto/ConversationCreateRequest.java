package com.poufmaker.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationCreateRequest {
    // contact details for visitors without an account
    private String userName;
    private String userPhone;

    private String initialMessage;
}
