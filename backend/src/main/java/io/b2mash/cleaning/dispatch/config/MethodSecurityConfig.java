package io.b2mash.cleaning.dispatch.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;

/** Enables {@code @PreAuthorize} in every profile, independent of which filter chain is active. */
@Configuration
@EnableMethodSecurity
public class MethodSecurityConfig {}
