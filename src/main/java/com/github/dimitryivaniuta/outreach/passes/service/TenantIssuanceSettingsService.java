package com.github.dimitryivaniuta.outreach.passes.service;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.domain.TenantFeatureFlag;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import com.github.dimitryivaniuta.outreach.passes.repo.TenantFeatureFlagRepository;
import com.github.dimitryivaniuta.outreach.passes.service.dto.TenantIssuanceSettings;
import java.util.HashMap;
import java.util.Map;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import static com.github.dimitryivaniuta.outreach.passes.config.CacheConfig.TENANT_SETTINGS_CACHE;

/**
 * Resolves the issuance switches of a tenant: service defaults overridden by the tenant's feature flags.
 *
 * <p>Always keyed by the job's own tenant, so a worker never applies one tenant's settings to another tenant's job.</p>
 */
@Service
public class TenantIssuanceSettingsService {

    private final TenantFeatureFlagRepository flagRepository;
    private final AppProperties properties;

    public TenantIssuanceSettingsService(TenantFeatureFlagRepository flagRepository, AppProperties properties) {
        this.flagRepository = flagRepository;
        this.properties = properties;
    }

    /**
     * @param tenantId tenant
     * @return effective settings
     */
    @Cacheable(cacheNames = TENANT_SETTINGS_CACHE, key = "#tenantId")
    public TenantIssuanceSettings settingsFor(String tenantId) {
        Map<String, Boolean> flags = new HashMap<>();
        for (TenantFeatureFlag flag : flagRepository.findByTenantId(tenantId)) {
            flags.put(flag.getFlagKey(), flag.isEnabled());
        }

        AppProperties.Issuance defaults = properties.getIssuance();
        return new TenantIssuanceSettings(
                tenantId,
                flags.getOrDefault(WalletPlatform.APPLE.featureFlag(), defaults.isAppleWalletEnabled()),
                flags.getOrDefault(WalletPlatform.GOOGLE.featureFlag(), defaults.isGoogleWalletEnabled()),
                flags.getOrDefault(TenantFeatureFlag.PASS_EMAIL, defaults.isNotificationsEnabled())
        );
    }
}
