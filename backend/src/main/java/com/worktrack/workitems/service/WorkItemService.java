package com.worktrack.workitems.service;

import com.worktrack.workitems.config.WorkItemProperties;
import com.worktrack.workitems.domain.WorkItem;
import com.worktrack.workitems.domain.WorkItemPriority;
import com.worktrack.workitems.domain.WorkItemStatus;
import com.worktrack.workitems.dto.CreateWorkItemRequest;
import com.worktrack.workitems.dto.PagedResponse;
import com.worktrack.workitems.dto.UpdateWorkItemRequest;
import com.worktrack.workitems.exception.InvalidRequestException;
import com.worktrack.workitems.exception.NotFoundException;
import com.worktrack.workitems.repository.WorkItemRepository;
import com.worktrack.workitems.repository.WorkItemSpecifications;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class WorkItemService {

    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);

    private final WorkItemRepository workItemRepository;
    private final WorkItemProperties properties;
    private final Clock clock;

    public WorkItemService(WorkItemRepository workItemRepository, WorkItemProperties properties, Clock clock) {
        this.workItemRepository = workItemRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public WorkItem getById(UUID id) {
        return workItemRepository.findById(id)
            .orElseThrow(() -> notFound(id));
    }

    public PagedResponse<WorkItem> getAll() {
        return getAll(null, null, null, null, null, null);
    }

    /**
     * Lists work items matching the optional status and priority filters.
     *
     * <p>{@code sortBy} is one of {@code title}, {@code createdAt} or {@code updatedAt}; anything else,
     * including {@code null}, sorts by {@code createdAt}. Without an explicit {@code sortDir} the
     * timestamps sort newest first and the title sorts A to Z. Pages are 1-indexed and a page past
     * the end comes back empty.
     */
    public PagedResponse<WorkItem> getAll(WorkItemStatus status,
                                          WorkItemPriority priority,
                                          String sortBy,
                                          String sortDir,
                                          Integer page,
                                          Integer pageSize) {
        int resolvedPage = page == null || page < 1 ? 1 : page;
        int resolvedPageSize = resolvePageSize(pageSize);
        Specification<WorkItem> filter = WorkItemSpecifications.matching(status, priority);

        // the store cannot skip past Integer.MAX_VALUE rows, and no such page can hold items
        if ((long) (resolvedPage - 1) * resolvedPageSize > Integer.MAX_VALUE) {
            return PagedResponse.of(List.of(), workItemRepository.count(filter), resolvedPage, resolvedPageSize);
        }

        PageRequest pageRequest = PageRequest.of(resolvedPage - 1, resolvedPageSize, resolveSort(sortBy, sortDir));
        Page<WorkItem> result = workItemRepository.findAll(filter, pageRequest);
        return PagedResponse.of(result.getContent(), result.getTotalElements(), resolvedPage, resolvedPageSize);
    }

    public WorkItem create(CreateWorkItemRequest request) {
        WorkItem workItem = new WorkItem();
        workItem.setTitle(requireTitle(request.title()));
        workItem.setDescription(normalizeDescription(request.description()));
        workItem.setStatus(WorkItemStatus.TODO);
        workItem.setPriority(request.priority() != null ? request.priority() : WorkItemPriority.MEDIUM);
        workItem.markCreated(clock.instant());

        WorkItem saved = workItemRepository.save(workItem);
        log.info("Created work item {} ({})", saved.getId(), saved.getPriority());
        return saved;
    }

    public WorkItem update(UUID id, UpdateWorkItemRequest request) {
        WorkItem workItem = getById(id);
        if (request.title() != null) {
            workItem.setTitle(requireTitle(request.title()));
        }
        if (request.description() != null) {
            // an empty description clears the field
            workItem.setDescription(normalizeDescription(request.description()));
        }
        if (request.status() != null) {
            workItem.setStatus(request.status());
        }
        if (request.priority() != null) {
            workItem.setPriority(request.priority());
        }
        workItem.touch(clock.instant());

        WorkItem saved = workItemRepository.save(workItem);
        log.info("Updated work item {}", id);
        return saved;
    }

    public void delete(UUID id) {
        WorkItem workItem = getById(id);
        workItemRepository.delete(workItem);
        log.info("Deleted work item {}", id);
    }

    private int resolvePageSize(Integer pageSize) {
        if (pageSize == null || pageSize < 1) {
            return properties.getDefaultPageSize();
        }
        return Math.min(pageSize, properties.getMaxPageSize());
    }

    private Sort resolveSort(String sortBy, String sortDir) {
        SortField field = SortField.from(sortBy);
        Sort.Direction direction = field.defaultDirection;
        if (StringUtils.hasText(sortDir)) {
            direction = Sort.Direction.fromOptionalString(sortDir.trim()).orElse(field.defaultDirection);
        }
        // id breaks ties so equal keys page deterministically
        return Sort.by(direction, field.property).and(Sort.by(Sort.Direction.ASC, "id"));
    }

    private String requireTitle(String title) {
        if (!StringUtils.hasText(title)) {
            throw new InvalidRequestException("Title must not be empty.");
        }
        String trimmed = title.trim();
        if (trimmed.length() > WorkItem.TITLE_MAX_LENGTH) {
            throw new InvalidRequestException("Title is too long. Limit to " + WorkItem.TITLE_MAX_LENGTH + " characters.");
        }
        return trimmed;
    }

    private String normalizeDescription(String description) {
        if (!StringUtils.hasText(description)) {
            return null;
        }
        return description.trim();
    }

    private NotFoundException notFound(UUID id) {
        log.debug("Work item {} not found", id);
        return new NotFoundException("Work item not found: " + id);
    }

    private enum SortField {
        TITLE("title", Sort.Direction.ASC),
        CREATED_AT("createdAt", Sort.Direction.DESC),
        UPDATED_AT("updatedAt", Sort.Direction.DESC);

        private final String property;
        private final Sort.Direction defaultDirection;

        SortField(String property, Sort.Direction defaultDirection) {
            this.property = property;
            this.defaultDirection = defaultDirection;
        }

        static SortField from(String sortBy) {
            if (!StringUtils.hasText(sortBy)) {
                return CREATED_AT;
            }
            String wanted = sortBy.trim().replace("_", "").toLowerCase(Locale.ROOT);
            for (SortField field : values()) {
                if (field.property.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return field;
                }
            }
            return CREATED_AT;
        }
    }
}
