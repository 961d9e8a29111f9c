package com.github.dimitryivaniuta.outreach.passes.service.issuance;

/**
 * Input of QR generation.
 *
 * @param tenantId tenant (storage namespace)
 * @param attendeeId attendee
 * @param cardId card
 * @param cardUrl public card URL encoded in the QR code
 */
public record QrCodeRequest(String tenantId, String attendeeId, String cardId, String cardUrl) {}
