package com.worktrack.workitems.dto;

import com.worktrack.workitems.domain.WorkItemPriority;
import com.worktrack.workitems.domain.WorkItemStatus;
import java.time.Instant;
import java.util.UUID;

public record WorkItemResponse(
    UUID id,
    String title,
    String description,
    WorkItemStatus status,
    WorkItemPriority priority,
    Instant createdAt,
    Instant updatedAt
) {}
