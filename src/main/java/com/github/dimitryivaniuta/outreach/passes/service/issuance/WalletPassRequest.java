package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;

/**
 * Input of wallet pass generation.
 *
 * @param platform target platform
 * @param tenantId tenant whose credentials sign the pass
 * @param eventId attendee's event
 * @param attendeeId attendee
 * @param cardId card (pass serial)
 * @param displayName name on the pass
 * @param orgName organization, may be null
 * @param title job title, may be null
 * @param cardUrl URL encoded on the pass barcode
 */
public record WalletPassRequest(
        WalletPlatform platform,
        String tenantId,
        String eventId,
        String attendeeId,
        String cardId,
        String displayName,
        String orgName,
        String title,
        String cardUrl
) {}
