package com.worktrack.workitems.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EnumNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"IN_PROGRESS", "in_progress", "InProgress", "inprogress", " in-progress "})
    void status_acceptsConstantAndPascalCaseSpellings(String value) {
        assertThat(WorkItemStatus.fromValue(value)).isEqualTo(WorkItemStatus.IN_PROGRESS);
    }

    @Test
    void priority_isCaseInsensitive() {
        assertThat(WorkItemPriority.fromValue("High")).isEqualTo(WorkItemPriority.HIGH);
    }

    @Test
    void unknownValue_isRejected() {
        assertThatThrownBy(() -> WorkItemStatus.fromValue("Blocked"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown WorkItemStatus: Blocked");
    }
}
