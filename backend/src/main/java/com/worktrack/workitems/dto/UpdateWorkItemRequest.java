package com.worktrack.workitems.dto;

import com.worktrack.workitems.domain.WorkItem;
import com.worktrack.workitems.domain.WorkItemPriority;
import com.worktrack.workitems.domain.WorkItemStatus;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Every {@code null} component leaves the stored value untouched.
 */
public record UpdateWorkItemRequest(
    @Size(max = WorkItem.TITLE_MAX_LENGTH) String title,
    @Size(max = WorkItem.DESCRIPTION_MAX_LENGTH) String description,
    WorkItemStatus status,
    WorkItemPriority priority
) {}
