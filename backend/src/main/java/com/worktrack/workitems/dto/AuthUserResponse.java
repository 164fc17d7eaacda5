package com.worktrack.workitems.dto;

import java.util.List;

public record AuthUserResponse(String username, List<String> roles) {}
