package com.example.pbirest.core.auth;

import reactor.core.publisher.Mono;

/** OAuth2 client-credentials grant against an identity provider. */
@FunctionalInterface
public interface ClientCredentialsExchange {

  /**
   * Requests a token for the principal.
   *
   * <p>Implementations emit the parsed response even when it carries an error payload, and fail
   * with {@link AuthException} only when no response could be read.
   *
   * @param principal client identity and secret
   * @param scope requested scope
   * @return token endpoint response
   */
  Mono<TokenResponse> requestToken(Credential.ServicePrincipal principal, String scope);
}
