package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;

/**
 * A wallet pass builder failed for one platform.
 */
public class WalletPassGenerationException extends IssuanceException {

    public WalletPassGenerationException(WalletPlatform platform, String message, Throwable cause) {
        super(platform.key() + " wallet pass generation failed: " + message, cause);
    }
}
