package com.propgate.backend.global.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class SecurityConfig {

    /**
     * Hashes pins and access codes. {@code matches} compares digests in constant time.
     */
    @Bean
    public PasswordEncoder passwordEncoder(@Value("${app.access.bcrypt-strength:10}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}
