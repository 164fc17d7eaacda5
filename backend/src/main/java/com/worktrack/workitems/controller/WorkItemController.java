package com.worktrack.workitems.controller;

import com.worktrack.workitems.domain.WorkItem;
import com.worktrack.workitems.domain.WorkItemPriority;
import com.worktrack.workitems.domain.WorkItemStatus;
import com.worktrack.workitems.dto.CreateWorkItemRequest;
import com.worktrack.workitems.dto.PagedResponse;
import com.worktrack.workitems.dto.UpdateWorkItemRequest;
import com.worktrack.workitems.dto.WorkItemMapper;
import com.worktrack.workitems.dto.WorkItemResponse;
import com.worktrack.workitems.service.WorkItemService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/workitems")
public class WorkItemController {

    private final WorkItemService workItemService;
    private final WorkItemMapper mapper;

    public WorkItemController(WorkItemService workItemService, WorkItemMapper mapper) {
        this.workItemService = workItemService;
        this.mapper = mapper;
    }

    @GetMapping
    public PagedResponse<WorkItemResponse> list(@RequestParam(required = false) WorkItemStatus status,
                                                @RequestParam(required = false) WorkItemPriority priority,
                                                @RequestParam(required = false) String sortBy,
                                                @RequestParam(required = false) String sortDir,
                                                @RequestParam(defaultValue = "1") Integer page,
                                                @RequestParam(required = false) Integer pageSize) {
        return mapper.toPagedResponse(workItemService.getAll(status, priority, sortBy, sortDir, page, pageSize));
    }

    @GetMapping("/{id}")
    public WorkItemResponse get(@PathVariable UUID id) {
        return mapper.toResponse(workItemService.getById(id));
    }

    @PostMapping
    public ResponseEntity<WorkItemResponse> create(@Valid @RequestBody CreateWorkItemRequest request) {
        WorkItem created = workItemService.create(request);
        return ResponseEntity.created(URI.create("/workitems/" + created.getId()))
            .body(mapper.toResponse(created));
    }

    @PutMapping("/{id}")
    public WorkItemResponse update(@PathVariable UUID id, @Valid @RequestBody UpdateWorkItemRequest request) {
        return mapper.toResponse(workItemService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        workItemService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
