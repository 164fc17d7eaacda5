package com.worktrack.workitems.dto;

import com.worktrack.workitems.domain.WorkItem;
import org.springframework.stereotype.Component;

@Component
public class WorkItemMapper {

    public WorkItemResponse toResponse(WorkItem workItem) {
        return new WorkItemResponse(
            workItem.getId(),
            workItem.getTitle(),
            workItem.getDescription(),
            workItem.getStatus(),
            workItem.getPriority(),
            workItem.getCreatedAt(),
            workItem.getUpdatedAt()
        );
    }

    public PagedResponse<WorkItemResponse> toPagedResponse(PagedResponse<WorkItem> page) {
        return page.map(this::toResponse);
    }
}
