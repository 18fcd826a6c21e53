package com.ospicorp.geosimple.config;

import static org.springframework.security.config.Customizer.withDefaults;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

@Configuration
public class SecurityConfig {

  static final String WRITE_AUTHORITY = "SCOPE_companies:write";

  private static final String[] PUBLIC_ENDPOINTS = {
      "/",
      "/v1/ping",
      "/actuator/health/**",
      "/v3/api-docs/**",
      "/swagger-ui/**",
      "/swagger-ui.html"
  };

  @Bean
  @ConditionalOnProperty(name = "security.auth.enabled", havingValue = "true")
  SecurityFilterChain jwtChain(HttpSecurity http) throws Exception {
    http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(PUBLIC_ENDPOINTS).permitAll()
            .requestMatchers(HttpMethod.GET, "/v1/companies/**").authenticated()
            .requestMatchers("/v1/companies/**").hasAuthority(WRITE_AUTHORITY)
            .anyRequest().authenticated())
        .oauth2ResourceServer(oauth -> oauth.jwt(withDefaults()));
    configureSecurityHeaders(http);
    return http.build();
  }

  @Bean
  @ConditionalOnProperty(name = "security.auth.enabled", havingValue = "false", matchIfMissing = true)
  SecurityFilterChain openChain(HttpSecurity http) throws Exception {
    http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
    configureSecurityHeaders(http);
    return http.build();
  }

  private void configureSecurityHeaders(HttpSecurity http) throws Exception {
    http.headers(headers -> {
      headers.defaultsDisabled();
      headers.frameOptions(frame -> frame.deny());
      headers.contentTypeOptions(withDefaults());
      headers.referrerPolicy(referrer -> referrer.policy(
          ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER));
    });
  }

  @Bean
  WebServerFactoryCustomizer<TomcatServletWebServerFactory> tomcatCustomizer() {
    return factory -> factory.addConnectorCustomizers(connector -> connector.setXpoweredBy(false));
  }
}
