package com.taxdesk.engine.controller;

import com.taxdesk.engine.controller.dto.ErrorResponseDto;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ErrorKind;
import com.taxdesk.engine.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(CalculationException.class)
    public ResponseEntity<ErrorResponseDto> handleCalculation(CalculationException ex) {
        HttpStatus status = ex.kind() == ErrorKind.CONFIGURATION_ERROR
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.BAD_REQUEST;
        if (status.is5xxServerError()) {
            log.error("calculation_configuration_error message={}", ex.getMessage(), ex);
        }
        return build(status, ex.kind().name(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            details.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT.name(), "Request validation failed", details);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponseDto> handleUnreadable(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT.name(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(NoResourceFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("unexpected_error type={}", ex.getClass().getSimpleName(), ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String errorKind, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(errorKind, message, details, traceId));
    }
}
