package org.caureq.opsinsights.repo;

import org.caureq.opsinsights.domain.AlertRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AlertRepo extends JpaRepository<AlertRecord, String> {
    Page<AlertRecord> findAll(Pageable pageable);
    Page<AlertRecord> findByResourceId(String resourceId, Pageable pageable);
    Page<AlertRecord> findByAcknowledged(boolean acknowledged, Pageable pageable);
    Page<AlertRecord> findByResourceIdAndAcknowledged(String resourceId, boolean acknowledged, Pageable pageable);
}
