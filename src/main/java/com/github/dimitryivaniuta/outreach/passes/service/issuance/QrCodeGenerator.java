package com.github.dimitryivaniuta.outreach.passes.service.issuance;

/**
 * Renders a QR image for the card URL and stores it.
 */
public interface QrCodeGenerator {

    /**
     * @param request QR request
     * @return location of the stored image
     */
    String generate(QrCodeRequest request);
}
