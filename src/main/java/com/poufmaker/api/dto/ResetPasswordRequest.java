package com.poufmaker.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResetPasswordRequest {
    @NotBlank(message = "Token and new password are required")
    private String token;

    @NotBlank(message = "Token and new password are required")
    @Size(min = 8, message = "Password must be at least 8 characters long")
    private String newPassword;
}
