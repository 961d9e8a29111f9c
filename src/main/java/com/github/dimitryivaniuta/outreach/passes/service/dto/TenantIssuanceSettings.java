package com.github.dimitryivaniuta.outreach.passes.service.dto;

import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;

/**
 * Issuance switches of one tenant (cached).
 *
 * @param tenantId tenant
 * @param appleWalletEnabled Apple Wallet passes allowed
 * @param googleWalletEnabled Google Wallet passes allowed
 * @param notificationsEnabled pass email allowed
 */
public record TenantIssuanceSettings(
        String tenantId,
        boolean appleWalletEnabled,
        boolean googleWalletEnabled,
        boolean notificationsEnabled
) {

    /**
     * @param platform wallet platform
     * @return true if the tenant allows passes for the platform
     */
    public boolean walletEnabled(WalletPlatform platform) {
        return switch (platform) {
            case APPLE -> appleWalletEnabled;
            case GOOGLE -> googleWalletEnabled;
        };
    }
}
