package com.example.academics.service;

import com.example.academics.entities.AppUser;
import com.example.academics.enums.UserRole;
import com.example.academics.repository.AppUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class AppUserServiceTest {

    private AppUserRepository userRepo;
    private BCryptPasswordEncoder encoder;
    private AppUserService service;

    @BeforeEach
    void setUp() {
        userRepo = Mockito.mock(AppUserRepository.class);
        encoder = new BCryptPasswordEncoder(4);
        service = new AppUserService(userRepo, encoder);
        when(userRepo.saveAndFlush(any(AppUser.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createUserEncodesPassword() {
        AppUser user = service.createUser("head", "secret", UserRole.HEADTEACHER);

        assertThat(user.getPassword()).isNotEqualTo("secret");
        assertThat(encoder.matches("secret", user.getPassword())).isTrue();
        assertThat(user.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_HEADTEACHER");
    }

    @Test
    void duplicateUsernameRejected() {
        when(userRepo.findByUsername("head")).thenReturn(Optional.of(new AppUser()));

        assertThatThrownBy(() -> service.createUser("head", "secret", UserRole.HEADTEACHER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownUser() {
        assertThatThrownBy(() -> service.loadUserByUsername("ghost")).isInstanceOf(UsernameNotFoundException.class);
        assertThat(service.findByUsernameSafe("ghost")).isNull();
    }
}
