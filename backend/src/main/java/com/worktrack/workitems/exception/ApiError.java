package com.worktrack.workitems.exception;

import java.time.Instant;
import java.util.List;

public record ApiError(
    int status,
    String error,
    String message,
    String path,
    Instant timestamp,
    List<String> details
) {}
