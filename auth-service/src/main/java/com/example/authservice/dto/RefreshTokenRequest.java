package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Refresh token request DTO.
 */
public record RefreshTokenRequest(
    @JsonProperty("refresh_token")
    @NotBlank(message = "Refresh token is required")
    @Size(max = 512, message = "Refresh token is too long")
    String refreshToken
) {
    @Override
    public String toString() {
        return "RefreshTokenRequest[refreshToken=***]";
    }
}
