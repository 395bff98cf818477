package org.caureq.opsinsights.service.source;

import java.util.List;

/** Operator-authored notes about a resource. */
public interface NotesSource {
    List<String> notesFor(String resourceId);
}
