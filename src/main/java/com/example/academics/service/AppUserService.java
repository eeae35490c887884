package com.example.academics.service;

import com.example.academics.entities.AppUser;
import com.example.academics.enums.UserRole;
import com.example.academics.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AppUserService implements UserDetailsService {

    private final Logger log = LoggerFactory.getLogger(AppUserService.class);

    private final AppUserRepository userRepo;
    private final PasswordEncoder passwordEncoder;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        return userRepo.findByUsername(username).orElseThrow(() -> new UsernameNotFoundException("Not found"));
    }

    /**
     * Create a staff account. Throws IllegalArgumentException if the username is taken.
     */
    @Transactional
    public AppUser createUser(String username, String rawPassword, UserRole role) {
        if (username == null || username.isBlank() || rawPassword == null || rawPassword.isEmpty() || role == null) {
            throw new IllegalArgumentException("username, password and role are required");
        }
        if (userRepo.findByUsername(username).isPresent()) {
            throw new IllegalArgumentException("Username already exists: " + username);
        }
        AppUser u = AppUser.builder()
                .username(username)
                .password(passwordEncoder.encode(rawPassword))
                .role(role)
                .build();
        try {
            AppUser saved = userRepo.saveAndFlush(u);
            log.info("Created user {} with role {}", username, role);
            return saved;
        } catch (DataIntegrityViolationException ex) {
            // unique constraint lost a race with a concurrent insert
            throw new IllegalArgumentException("Username already exists: " + username, ex);
        }
    }

    @Transactional(readOnly = true)
    public AppUser findByUsernameSafe(String username) {
        return userRepo.findByUsername(username).orElse(null);
    }
}
