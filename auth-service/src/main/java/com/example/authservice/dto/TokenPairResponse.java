package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token pair returned by login, refresh and admin bootstrap.
 *
 * expires_in is the access token lifetime in seconds.
 */
public record TokenPairResponse(
    @JsonProperty("access_token")
    String accessToken,

    @JsonProperty("refresh_token")
    String refreshToken,

    @JsonProperty("token_type")
    String tokenType,

    @JsonProperty("expires_in")
    long expiresIn
) {
    /**
     * Factory method with default tokenType = "Bearer"
     */
    public static TokenPairResponse of(String accessToken, String refreshToken, long expiresIn) {
        return new TokenPairResponse(accessToken, refreshToken, "Bearer", expiresIn);
    }
}
