package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import org.springframework.stereotype.Component;

/**
 * Deterministic wallet pass builder used for local development and tests.
 *
 * <p>Supports every platform and returns a stable URL per card.</p>
 */
@Component
public class StubWalletPassBuilder implements WalletPassBuilder {

    private final AppProperties properties;

    public StubWalletPassBuilder(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean supports(WalletPlatform platform) {
        return true;
    }

    @Override
    public String build(WalletPassRequest request) {
        String base = properties.getIssuance().getWalletPassBaseUrl();
        return switch (request.platform()) {
            case APPLE -> base + "/apple/" + request.cardId() + ".pkpass";
            case GOOGLE -> base + "/google/" + request.cardId();
        };
    }
}
