package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;

/**
 * Builds and publishes a wallet pass for one platform.
 */
public interface WalletPassBuilder {

    /**
     * @param platform platform
     * @return true if this builder issues passes for the platform
     */
    boolean supports(WalletPlatform platform);

    /**
     * @param request pass request
     * @return pass download / save URL
     * @throws WalletPassGenerationException when the pass cannot be built
     */
    String build(WalletPassRequest request);
}
