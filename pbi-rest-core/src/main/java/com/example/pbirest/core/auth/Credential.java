package com.example.pbirest.core.auth;

/**
 * How the client authenticates: either a confidential client (service principal) exchanging its
 * secret for short-lived tokens, or a bearer token issued elsewhere.
 *
 * <p>The set is closed; {@link TokenCache} dispatches on the concrete type.
 */
public sealed interface Credential permits Credential.ServicePrincipal, Credential.StaticToken {

  static ServicePrincipal servicePrincipal(
      final String tenantId, final String clientId, final String clientSecret) {
    return new ServicePrincipal(tenantId, clientId, clientSecret);
  }

  static StaticToken staticToken(final String value) {
    return new StaticToken(value);
  }

  /**
   * Azure AD app registration used with the client-credentials grant.
   *
   * @param tenantId directory (tenant) id
   * @param clientId application (client) id
   * @param clientSecret client secret
   */
  record ServicePrincipal(String tenantId, String clientId, String clientSecret)
      implements Credential {

    public ServicePrincipal {
      requireText(tenantId, "tenantId");
      requireText(clientId, "clientId");
      requireText(clientSecret, "clientSecret");
    }

    @Override
    public String toString() {
      return "ServicePrincipal[tenantId=" + tenantId + ", clientId=" + clientId + "]";
    }
  }

  /**
   * Pre-issued bearer token. Never refreshed.
   *
   * @param value raw access token, without the {@code Bearer} prefix
   */
  record StaticToken(String value) implements Credential {

    public StaticToken {
      requireText(value, "value");
    }

    @Override
    public String toString() {
      return "StaticToken[***]";
    }
  }

  private static void requireText(final String value, final String name) {
    if (value == null || value.isBlank()) throw new IllegalArgumentException(name + " is required");
  }
}
