package com.example.academics.config;

import com.example.academics.service.AppUserService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
public class SecurityConfig {

    private static final String[] STAFF = {"TEACHER", "CLASS_TEACHER", "HEADTEACHER"};

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * AppUserService and the encoder come in as method parameters so SecurityConfig has no
     * constructor-level dependency on the service.
     */
    @Bean
    public DaoAuthenticationProvider authProvider(AppUserService appUserService, PasswordEncoder passwordEncoder) {
        DaoAuthenticationProvider provider = new DaoAuthenticationProvider();
        provider.setUserDetailsService(appUserService);
        provider.setPasswordEncoder(passwordEncoder);
        return provider;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, DaoAuthenticationProvider authProvider) throws Exception {
        http
                // mark entry is a JSON API
                .csrf(csrf -> csrf.ignoringRequestMatchers("/teacher/**"))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/login").permitAll()
                        .requestMatchers("/teacher/**").hasAnyRole(STAFF)
                        .requestMatchers("/reports/grade/**", "/reports/grade").hasRole("HEADTEACHER")
                        .requestMatchers("/reports/**").hasAnyRole(STAFF)
                        .anyRequest().authenticated()
                )
                .formLogin(Customizer.withDefaults())
                .httpBasic(Customizer.withDefaults())
                .logout(Customizer.withDefaults())
                .authenticationProvider(authProvider);

        return http.build();
    }
}
