package com.worktrack.workitems.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum WorkItemStatus {
    TODO,
    IN_PROGRESS,
    DONE;

    @JsonCreator
    public static WorkItemStatus fromValue(String value) {
        return EnumNames.parse(WorkItemStatus.class, value);
    }
}
