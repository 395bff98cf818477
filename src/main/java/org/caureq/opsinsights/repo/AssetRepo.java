package org.caureq.opsinsights.repo;

import org.caureq.opsinsights.domain.Asset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AssetRepo extends JpaRepository<Asset, Long> {
    Optional<Asset> findByResourceId(String resourceId);
}
