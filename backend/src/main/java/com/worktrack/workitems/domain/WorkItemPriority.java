package com.worktrack.workitems.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum WorkItemPriority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonCreator
    public static WorkItemPriority fromValue(String value) {
        return EnumNames.parse(WorkItemPriority.class, value);
    }
}
