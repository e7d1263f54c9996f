package io.b2mash.cleaning.dispatch.config;

import io.b2mash.cleaning.dispatch.multitenancy.TenantFilter;
import io.b2mash.cleaning.dispatch.multitenancy.TenantLoggingFilter;
import io.b2mash.cleaning.dispatch.security.ApiKeyAuthFilter;
import io.b2mash.cleaning.dispatch.security.ClerkJwtAuthenticationConverter;
import java.nio.charset.StandardCharsets;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Local development: HS256 tokens signed with {@code local.jwt.secret} instead of the identity
 * provider's JWKS, so a developer can mint tokens without a Clerk instance.
 */
@Configuration
@EnableWebSecurity
@Profile("local")
public class LocalSecurityConfig {

  @Bean
  public JwtDecoder jwtDecoder(@Value("${local.jwt.secret}") String secret) {
    var key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
  }

  @Bean
  public SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      ClerkJwtAuthenticationConverter jwtAuthConverter,
      ApiKeyAuthFilter apiKeyAuthFilter,
      TenantFilter tenantFilter,
      TenantLoggingFilter tenantLoggingFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/internal/**")
                    .hasRole("INTERNAL_SERVICE")
                    .anyRequest()
                    .permitAll())
        .oauth2ResourceServer(
            oauth2 -> oauth2.jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter)))
        .addFilterBefore(apiKeyAuthFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(tenantFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(tenantLoggingFilter, TenantFilter.class);
    return http.build();
  }
}
