package com.example.codeintel.controller;

import com.example.codeintel.model.dto.ApiError;
import com.example.codeintel.util.RequestIdHolder;
import jakarta.servlet.http.HttpServletRequest;
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
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::formatFieldError)
                .toList();
        return build(HttpStatus.BAD_REQUEST, "La peticion no es valida", details, req, ex, false);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, "La peticion no es valida", List.of(ex.getMessage()), req, ex, false);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiError> handleNotFound(NoSuchElementException ex, HttpServletRequest req) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(), req, ex, false);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(), req, ex, false);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex, HttpServletRequest req) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), List.of(), req, ex, true);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Error interno procesando la peticion", List.of(), req, ex, true);
    }

    private ResponseEntity<ApiError> build(HttpStatus status,
                                           String message,
                                           List<String> details,
                                           HttpServletRequest req,
                                           Exception ex,
                                           boolean logStack) {
        String errorId = RequestIdHolder.ensure();
        String path = req != null ? req.getRequestURI() : "";
        String method = req != null ? req.getMethod() : "";
        String handler = resolveHandler(req);

        if (logStack) {
            log.error("errorId={} status={} method={} path={} handler={} msg={}",
                    errorId, status.value(), method, path, handler, message, ex);
        } else {
            log.warn("errorId={} status={} method={} path={} handler={} msg={}",
                    errorId, status.value(), method, path, handler, message);
        }

        ApiError body = new ApiError(
                errorId,
                status.value(),
                status.getReasonPhrase(),
                message,
                method,
                path,
                Instant.now(),
                details == null ? Collections.emptyList() : details
        );
        return ResponseEntity.status(status).body(body);
    }

    private String resolveHandler(HttpServletRequest req) {
        if (req == null) return "";
        Object handler = req.getAttribute(HandlerMapping.BEST_MATCHING_HANDLER_ATTRIBUTE);
        if (handler instanceof HandlerMethod hm) {
            return hm.getBeanType().getSimpleName() + "#" + hm.getMethod().getName();
        }
        return handler == null ? "" : handler.toString();
    }

    private String formatFieldError(FieldError err) {
        String code = err.getCode() == null ? "" : err.getCode();
        return err.getField() + ": " + err.getDefaultMessage() + (code.isEmpty() ? "" : " (" + code + ")");
    }
}
