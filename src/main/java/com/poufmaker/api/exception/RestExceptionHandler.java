package com.poufmaker.api.exception;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.poufmaker.api.dto.ErrorResponse;
import com.poufmaker.api.enums.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@ControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(UnauthorizedAccessException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedAccessException ex) {
        return error(HttpStatus.UNAUTHORIZED, ErrorKind.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST, ex.getMessage());
    }

    // Duplicate bids are reported as 400, like every other client-side bid failure.
    @ExceptionHandler(DuplicateBidException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateBid(DuplicateBidException ex) {
        return error(HttpStatus.BAD_REQUEST, ErrorKind.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(IllegalBidException.class)
    public ResponseEntity<ErrorResponse> handleIllegalBid(IllegalBidException ex) {
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_STATE, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request";
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        if (ex.getCause() instanceof UnrecognizedPropertyException unknown) {
            return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST,
                    "Unknown field '" + unknown.getPropertyName() + "'");
        }
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST,
                "Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        // Framework errors (unknown route, wrong method, ...) keep their own status.
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError) {
            HttpStatusCode status = frameworkError.getStatusCode();
            ErrorKind kind = status.value() == HttpStatus.NOT_FOUND.value() ? ErrorKind.NOT_FOUND : ErrorKind.INVALID_REQUEST;
            return error(status, kind, frameworkError.getBody().getDetail());
        }
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL, "Internal server error");
    }

    private ResponseEntity<ErrorResponse> error(HttpStatusCode status, ErrorKind kind, String message) {
        return new ResponseEntity<>(new ErrorResponse(kind, message), status);
    }
}
