package com.example.pbirest.core.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of an OAuth2 token endpoint response, successful or not.
 *
 * @param accessToken issued token, null on failure
 * @param expiresIn lifetime in seconds as reported by the issuer, may be null
 * @param error OAuth2 error code on failure
 * @param errorDescription human readable failure reason
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription) {

  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isBlank();
  }
}
