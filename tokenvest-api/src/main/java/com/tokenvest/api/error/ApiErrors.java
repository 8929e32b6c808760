package com.tokenvest.api.error;

import com.tokenvest.core.error.ErrorCategory;
import com.tokenvest.core.error.VestingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.stream.Collectors;

/**
 * Error body shared by the controllers' local exception handlers.
 */
public final class ApiErrors {

    private ApiErrors() {
    }

    public static ResponseEntity<ErrorResponse> toResponse(VestingException e) {
        return ResponseEntity.status(statusOf(e.getCategory()))
                .body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    public static ResponseEntity<ErrorResponse> toResponse(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(ApiErrors::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCategory.VALIDATION.code(), message));
    }

    public static HttpStatus statusOf(ErrorCategory category) {
        return switch (category) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STATE -> HttpStatus.CONFLICT;
            case CAPACITY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case DEPENDENCY_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    public record ErrorResponse(String code, String message) {}
}
