package com.worktrack.workitems.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.worktrack.workitems.domain.AppUser;
import com.worktrack.workitems.dto.AuthResponse;
import com.worktrack.workitems.exception.ConflictException;
import com.worktrack.workitems.exception.InvalidCredentialsException;
import com.worktrack.workitems.repository.AppUserRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private AppUserRepository userRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, passwordEncoder, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private AppUser storedUser(String username, String email, String rawPassword) {
        AppUser user = new AppUser();
        user.setUsername(username);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setCreatedAt(NOW);
        return user;
    }

    @Test
    void register_newUser_storesHashedPassword() {
        when(userRepository.existsByUsername("alice")).thenReturn(false);
        when(userRepository.existsByEmailIgnoreCase("alice@example.com")).thenReturn(false);
        when(userRepository.saveAndFlush(any(AppUser.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuthResponse response = authService.register(" alice ", "alice@example.com", "s3cret-password");

        ArgumentCaptor<AppUser> saved = ArgumentCaptor.forClass(AppUser.class);
        verify(userRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getUsername()).isEqualTo("alice");
        assertThat(saved.getValue().getPasswordHash()).isNotEqualTo("s3cret-password");
        assertThat(passwordEncoder.matches("s3cret-password", saved.getValue().getPasswordHash())).isTrue();
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(NOW);
        assertThat(response.username()).isEqualTo("alice");
        assertThat(response.email()).isEqualTo("alice@example.com");
    }

    @Test
    void register_takenUsername_conflicts() {
        when(userRepository.existsByUsername("alice")).thenReturn(true);

        assertThatThrownBy(() -> authService.register("alice", "other@example.com", "s3cret-password"))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("alice");
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    void register_takenEmail_conflicts() {
        when(userRepository.existsByUsername("bob")).thenReturn(false);
        when(userRepository.existsByEmailIgnoreCase("alice@example.com")).thenReturn(true);

        assertThatThrownBy(() -> authService.register("bob", "alice@example.com", "s3cret-password"))
            .isInstanceOf(ConflictException.class);
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    void register_lostRaceOnUniqueConstraint_conflicts() {
        when(userRepository.existsByUsername("alice")).thenReturn(false);
        when(userRepository.existsByEmailIgnoreCase("alice@example.com")).thenReturn(false);
        when(userRepository.saveAndFlush(any(AppUser.class)))
            .thenThrow(new DataIntegrityViolationException("unique constraint on app_users.username"));

        assertThatThrownBy(() -> authService.register("alice", "alice@example.com", "s3cret-password"))
            .isInstanceOf(ConflictException.class)
            .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void login_byUsername_succeeds() {
        when(userRepository.findByUsername("alice"))
            .thenReturn(Optional.of(storedUser("alice", "alice@example.com", "s3cret-password")));

        AuthResponse response = authService.login("alice", "s3cret-password");

        assertThat(response.username()).isEqualTo("alice");
    }

    @Test
    void login_byEmail_fallsBackAfterUsername() {
        when(userRepository.findByUsername("alice@example.com")).thenReturn(Optional.empty());
        when(userRepository.findByEmailIgnoreCase("alice@example.com"))
            .thenReturn(Optional.of(storedUser("alice", "alice@example.com", "s3cret-password")));

        AuthResponse response = authService.login("alice@example.com", "s3cret-password");

        assertThat(response.username()).isEqualTo("alice");
    }

    @Test
    void login_wrongPassword_isRejected() {
        when(userRepository.findByUsername("alice"))
            .thenReturn(Optional.of(storedUser("alice", "alice@example.com", "s3cret-password")));

        assertThatThrownBy(() -> authService.login("alice", "wrong-password"))
            .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void login_unknownUser_isRejectedWithSameError() {
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());
        when(userRepository.findByEmailIgnoreCase("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login("ghost", "whatever"))
            .isInstanceOf(InvalidCredentialsException.class)
            .hasMessage("Invalid username/email or password");
    }
}
