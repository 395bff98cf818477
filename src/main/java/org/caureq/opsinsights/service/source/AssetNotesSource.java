package org.caureq.opsinsights.service.source;

import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.repo.AssetRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;

@Service
@RequiredArgsConstructor
public class AssetNotesSource implements NotesSource {
    private final AssetRepo assetRepo;

    @Override
    @Transactional(readOnly = true)
    public List<String> notesFor(String resourceId) {
        return assetRepo.findByResourceId(resourceId)
                .map(a -> a.getNotes() == null ? List.<String>of() : Arrays.stream(a.getNotes().split("\\R"))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList())
                .orElse(List.of());
    }
}
