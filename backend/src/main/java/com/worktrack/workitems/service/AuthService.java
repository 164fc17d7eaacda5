package com.worktrack.workitems.service;

import com.worktrack.workitems.domain.AppUser;
import com.worktrack.workitems.dto.AuthResponse;
import com.worktrack.workitems.exception.ConflictException;
import com.worktrack.workitems.exception.InvalidCredentialsException;
import com.worktrack.workitems.repository.AppUserRepository;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Username/password accounts. Passwords are stored only as encoder hashes; request
 * authentication itself happens in the security filter chain against the same store.
 */
@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public AuthService(AppUserRepository userRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public AuthResponse register(String username, String email, String password) {
        String normalizedUsername = username.trim();
        String normalizedEmail = email.trim();
        if (userRepository.existsByUsername(normalizedUsername)) {
            throw new ConflictException("Username is already taken: " + normalizedUsername);
        }
        if (userRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            throw new ConflictException("Email is already registered: " + normalizedEmail);
        }

        AppUser user = new AppUser();
        user.setUsername(normalizedUsername);
        user.setEmail(normalizedEmail);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setCreatedAt(clock.instant());
        AppUser saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent registration took the username or email after the checks above
            throw new ConflictException("Username or email is already registered", ex);
        }
        log.info("Registered user {}", saved.getUsername());
        return toResponse(saved);
    }

    public AuthResponse login(String usernameOrEmail, String password) {
        AppUser user = findByUsernameOrEmail(usernameOrEmail)
            .filter(candidate -> passwordEncoder.matches(password, candidate.getPasswordHash()))
            .orElseThrow(() -> {
                log.debug("Rejected login for {}", usernameOrEmail);
                return new InvalidCredentialsException();
            });
        return toResponse(user);
    }

    private Optional<AppUser> findByUsernameOrEmail(String usernameOrEmail) {
        if (!StringUtils.hasText(usernameOrEmail)) {
            return Optional.empty();
        }
        String key = usernameOrEmail.trim();
        return userRepository.findByUsername(key)
            .or(() -> userRepository.findByEmailIgnoreCase(key));
    }

    private AuthResponse toResponse(AppUser user) {
        return new AuthResponse(user.getId(), user.getUsername(), user.getEmail());
    }
}
