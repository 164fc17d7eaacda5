package com.worktrack.workitems.dto;

import java.util.UUID;

public record AuthResponse(UUID userId, String username, String email) {}
