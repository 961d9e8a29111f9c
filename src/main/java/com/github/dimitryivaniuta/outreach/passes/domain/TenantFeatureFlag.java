package com.github.dimitryivaniuta.outreach.passes.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-tenant feature flag overriding an issuance default ({@code apple_wallet}, {@code google_wallet},
 * {@code pass_email}).
 */
@Entity
@Table(
        name = "tenant_feature_flags",
        uniqueConstraints = @UniqueConstraint(name = "uq_tenant_feature_flag", columnNames = {"tenant_id", "flag_key"})
)
@Getter
@Setter
@NoArgsConstructor
public class TenantFeatureFlag {

    /** Flag controlling the pass email. */
    public static final String PASS_EMAIL = "pass_email";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 36)
    private String tenantId;

    @Column(name = "flag_key", nullable = false, updatable = false, length = 64)
    private String flagKey;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    /**
     * Factory method.
     *
     * @param tenantId tenant
     * @param flagKey flag key
     * @param enabled flag value
     * @return flag
     */
    public static TenantFeatureFlag of(String tenantId, String flagKey, boolean enabled) {
        TenantFeatureFlag f = new TenantFeatureFlag();
        f.id = UUID.randomUUID().toString();
        f.tenantId = tenantId;
        f.flagKey = flagKey;
        f.enabled = enabled;
        return f;
    }
}
