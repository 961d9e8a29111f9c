package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deterministic QR generator used for local development and tests.
 *
 * <p>Does not render an image; returns the location a renderer stores it at: {@code qr/{tenant}/{card}.png}.</p>
 */
@Component
public class StubQrCodeGenerator implements QrCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(StubQrCodeGenerator.class);

    private final AppProperties properties;

    public StubQrCodeGenerator(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public String generate(QrCodeRequest request) {
        String location = properties.getIssuance().getQrStorageBaseUrl()
                + "/qr/" + request.tenantId() + "/" + request.cardId() + ".png";
        log.debug("QR for {} stored at {}", request.cardUrl(), location);
        return location;
    }
}
