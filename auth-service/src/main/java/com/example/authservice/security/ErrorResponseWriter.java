package com.example.authservice.security;

import com.example.authservice.dto.ErrorResponse;
import com.example.authservice.exception.BaseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes the JSON error body for rejections that happen before a controller is reached.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    static final String RETRY_AFTER_SECONDS = "1";

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, BaseException ex) throws IOException {
        write(response, ex.getStatus(), ErrorResponse.of(ex.getCode(), ex.getMessage()));
    }

    public void write(HttpServletResponse response, HttpStatus status, ErrorResponse body) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        if (status == HttpStatus.SERVICE_UNAVAILABLE) {
            response.setHeader(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
