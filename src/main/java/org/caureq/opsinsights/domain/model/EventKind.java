package org.caureq.opsinsights.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kinds of discrete operational events tracked for recurrence. */
public enum EventKind {
    HIGH_CPU, HIGH_MEMORY, HIGH_DISK, OOM, RESTART, BACKUP_FAILURE, UNRESPONSIVE,
    STATUS_CHANGE, CONFIG_CHANGE, MIGRATION, OTHER;

    @JsonValue
    public String id() { return name().toLowerCase(Locale.ROOT); }

    /** Accepts both enum ids ({@code high_memory}) and the looser alert type names. */
    @JsonCreator
    public static EventKind fromId(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        String s = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (EventKind k : values()) {
            if (k.id().equals(s)) return k;
        }
        return fromAlertType(s);
    }

    /** Maps the alerting engine's alert types onto event kinds. */
    public static EventKind fromAlertType(String alertType) {
        if (alertType == null) return OTHER;
        String t = alertType.toLowerCase(Locale.ROOT);
        if (t.contains("oom")) return OOM;
        if (t.contains("cpu")) return HIGH_CPU;
        if (t.contains("mem") || t.contains("ram")) return HIGH_MEMORY;
        if (t.contains("backup")) return BACKUP_FAILURE;
        if (t.contains("disk") || t.contains("storage")) return HIGH_DISK;
        if (t.contains("restart") || t.contains("reboot")) return RESTART;
        if (t.contains("offline") || t.contains("unreachable") || t.contains("down")) return UNRESPONSIVE;
        return OTHER;
    }
}
