package com.worktrack.workitems.controller;

import com.worktrack.workitems.dto.AuthResponse;
import com.worktrack.workitems.dto.AuthUserResponse;
import com.worktrack.workitems.dto.LoginRequest;
import com.worktrack.workitems.dto.RegisterRequest;
import com.worktrack.workitems.service.AuthService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public AuthResponse register(@Valid @RequestBody RegisterRequest request) {
        return authService.register(request.username(), request.email(), request.password());
    }

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request.usernameOrEmail(), request.password());
    }

    @GetMapping("/me")
    public AuthUserResponse me(Authentication authentication) {
        List<String> roles = authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .map(role -> role.replaceFirst("^ROLE_", ""))
            .collect(Collectors.toList());
        return new AuthUserResponse(authentication.getName(), roles);
    }
}
