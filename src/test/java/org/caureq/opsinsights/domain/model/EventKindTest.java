package org.caureq.opsinsights.domain.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class EventKindTest {

    @ParameterizedTest
    @CsvSource({
            "high_memory, HIGH_MEMORY",
            "HIGH-CPU, HIGH_CPU",
            "backup failure, BACKUP_FAILURE",
            "mem_high, HIGH_MEMORY",
            "oom_kill, OOM",
            "node_offline, UNRESPONSIVE",
            "storage_full, HIGH_DISK",
            "reboot, RESTART",
            "something else, OTHER"
    })
    void parsesIdsAndAlertTypes(String raw, EventKind expected) {
        assertThat(EventKind.fromId(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"oom_memory, OOM", "backup_disk, BACKUP_FAILURE"})
    void moreSpecificAlertTypesWin(String raw, EventKind expected) {
        assertThat(EventKind.fromAlertType(raw)).isEqualTo(expected);
    }
}
