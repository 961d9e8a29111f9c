package com.github.dimitryivaniuta.outreach.passes.repo;

import com.github.dimitryivaniuta.outreach.passes.domain.TenantFeatureFlag;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link TenantFeatureFlag}.
 */
public interface TenantFeatureFlagRepository extends JpaRepository<TenantFeatureFlag, String> {

    List<TenantFeatureFlag> findByTenantId(String tenantId);
}
