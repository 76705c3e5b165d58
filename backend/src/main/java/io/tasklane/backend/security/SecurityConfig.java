package io.tasklane.backend.security;

import io.tasklane.backend.logging.RequestLoggingFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final BearerTokenAuthFilter bearerTokenAuthFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final EnvelopeAuthenticationEntryPoint authenticationEntryPoint;
  private final Environment environment;

  public SecurityConfig(
      BearerTokenAuthFilter bearerTokenAuthFilter,
      RequestLoggingFilter requestLoggingFilter,
      EnvelopeAuthenticationEntryPoint authenticationEntryPoint,
      Environment environment) {
    this.bearerTokenAuthFilter = bearerTokenAuthFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.authenticationEntryPoint = authenticationEntryPoint;
    this.environment = environment;
  }

  /**
   * Stateless bearer-token chain. Sign-up, sign-in and health endpoints are public; everything else
   * requires a verified caller. Ownership of the addressed data is checked later, in the services.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .logout(logout -> logout.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health", "/actuator/health/**")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/", "/api/health")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/api/auth/signup", "/api/auth/signin")
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint))
        .addFilterBefore(bearerTokenAuthFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, BearerTokenAuthFilter.class);

    return http.build();
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
