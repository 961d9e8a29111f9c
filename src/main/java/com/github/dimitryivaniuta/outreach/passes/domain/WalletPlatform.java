package com.github.dimitryivaniuta.outreach.passes.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Mobile wallet platforms a pass can be issued for.
 */
public enum WalletPlatform {
    APPLE("apple", "apple_wallet"),
    GOOGLE("google", "google_wallet");

    private final String key;
    private final String featureFlag;

    WalletPlatform(String key, String featureFlag) {
        this.key = key;
        this.featureFlag = featureFlag;
    }

    /**
     * @return lower-case key used in job metadata and in the wallet pass JSON
     */
    public String key() {
        return key;
    }

    /**
     * @return tenant feature flag enabling this platform
     */
    public String featureFlag() {
        return featureFlag;
    }

    /**
     * Resolves a platform from its key, ignoring case.
     *
     * @param key raw key
     * @return platform, empty for unknown keys
     */
    public static Optional<WalletPlatform> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (WalletPlatform p : values()) {
            if (p.key.equals(k)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
