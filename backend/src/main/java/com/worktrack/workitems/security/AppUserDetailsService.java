package com.worktrack.workitems.security;

import com.worktrack.workitems.domain.AppUser;
import com.worktrack.workitems.repository.AppUserRepository;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

/**
 * Resolves HTTP Basic credentials against registered accounts. Accepts either the username or the email.
 */
@Service
public class AppUserDetailsService implements UserDetailsService {

    static final String DEFAULT_ROLE = "USER";

    private final AppUserRepository userRepository;

    public AppUserDetailsService(AppUserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public UserDetails loadUserByUsername(String username) {
        AppUser user = userRepository.findByUsername(username)
            .or(() -> userRepository.findByEmailIgnoreCase(username))
            .orElseThrow(() -> new UsernameNotFoundException("Unknown user: " + username));
        return User.withUsername(user.getUsername())
            .password(user.getPasswordHash())
            .roles(DEFAULT_ROLE)
            .build();
    }
}
