package com.github.dimitryivaniuta.outreach.passes.service.dto;

import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outputs produced so far for a job. A populated field means the step is done.
 *
 * @param cardId issued card, or null
 * @param qrUrl QR image location, or null
 * @param walletPassUrls pass URL per platform
 * @param walletPassErrors last failure per platform that has no pass yet
 */
public record IssuanceProgress(
        String cardId,
        String qrUrl,
        Map<WalletPlatform, String> walletPassUrls,
        Map<WalletPlatform, String> walletPassErrors
) {

    public IssuanceProgress {
        walletPassUrls = freeze(walletPassUrls);
        walletPassErrors = freeze(walletPassErrors);
    }

    /**
     * @return progress with nothing issued
     */
    public static IssuanceProgress none() {
        return new IssuanceProgress(null, null, Map.of(), Map.of());
    }

    public IssuanceProgress withCardId(String id) {
        return new IssuanceProgress(id, qrUrl, walletPassUrls, walletPassErrors);
    }

    public IssuanceProgress withQrUrl(String url) {
        return new IssuanceProgress(cardId, url, walletPassUrls, walletPassErrors);
    }

    /**
     * Records an issued pass and clears an earlier error for the platform.
     */
    public IssuanceProgress withWalletPass(WalletPlatform platform, String url) {
        Map<WalletPlatform, String> urls = mutable(walletPassUrls);
        urls.put(platform, url);
        Map<WalletPlatform, String> errors = mutable(walletPassErrors);
        errors.remove(platform);
        return new IssuanceProgress(cardId, qrUrl, urls, errors);
    }

    public IssuanceProgress withWalletError(WalletPlatform platform, String error) {
        Map<WalletPlatform, String> errors = mutable(walletPassErrors);
        errors.put(platform, error);
        return new IssuanceProgress(cardId, qrUrl, walletPassUrls, errors);
    }

    private static Map<WalletPlatform, String> mutable(Map<WalletPlatform, String> source) {
        Map<WalletPlatform, String> copy = new EnumMap<>(WalletPlatform.class);
        copy.putAll(source);
        return copy;
    }

    private static Map<WalletPlatform, String> freeze(Map<WalletPlatform, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(mutable(source));
    }
}
