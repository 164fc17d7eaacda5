package com.worktrack.workitems.dto;

import com.worktrack.workitems.domain.WorkItem;
import com.worktrack.workitems.domain.WorkItemPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateWorkItemRequest(
    @NotBlank @Size(max = WorkItem.TITLE_MAX_LENGTH) String title,
    @Size(max = WorkItem.DESCRIPTION_MAX_LENGTH) String description,
    WorkItemPriority priority
) {}
