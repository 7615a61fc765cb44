package com.flagship.drink_ledger.transaction;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates URL-safe secret keys for prepaid users.
 */
public class UserKeyGenerator {

    private final SecureRandom random = new SecureRandom();
    private final int byteLength;

    public UserKeyGenerator(int byteLength) {
        if (byteLength < 4) {
            throw new IllegalArgumentException("User keys need at least 4 random bytes");
        }
        this.byteLength = byteLength;
    }

    public String nextKey() {
        byte[] bytes = new byte[byteLength];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
