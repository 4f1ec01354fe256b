package com.poufmaker.api.dto;

import com.poufmaker.api.enums.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private ErrorKind kind;
    private String message;
}
