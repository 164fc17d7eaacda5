package com.worktrack.workitems.repository;

import com.worktrack.workitems.domain.WorkItem;
import com.worktrack.workitems.domain.WorkItemPriority;
import com.worktrack.workitems.domain.WorkItemStatus;
import org.springframework.data.jpa.domain.Specification;

/**
 * Equality filters for work item listings. A {@code null} argument means "no filter"
 * and yields a specification that matches everything.
 */
public final class WorkItemSpecifications {

    private WorkItemSpecifications() {
    }

    public static Specification<WorkItem> hasStatus(WorkItemStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<WorkItem> hasPriority(WorkItemPriority priority) {
        return (root, query, cb) -> priority == null ? null : cb.equal(root.get("priority"), priority);
    }

    public static Specification<WorkItem> matching(WorkItemStatus status, WorkItemPriority priority) {
        return Specification.where(hasStatus(status)).and(hasPriority(priority));
    }
}
