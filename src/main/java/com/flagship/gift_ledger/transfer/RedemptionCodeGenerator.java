package com.flagship.gift_ledger.transfer;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Issues redemption codes: a fixed prefix followed by URL-safe base64 of
 * {@code gifting.redemption-code.bytes} random bytes. Codes carry no
 * information about the transaction id or the sender.
 */
@Component
public class RedemptionCodeGenerator {

    public static final String CODE_PREFIX = "CADEAUTJE-";
    static final int MIN_BYTES = 16;

    private final SecureRandom secureRandom = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    private final int randomBytes;

    public RedemptionCodeGenerator(@Value("${gifting.redemption-code.bytes:18}") int randomBytes) {
        if (randomBytes < MIN_BYTES) {
            throw new IllegalArgumentException(
                "Redemption codes need at least " + MIN_BYTES + " random bytes, got " + randomBytes);
        }
        this.randomBytes = randomBytes;
    }

    public String nextCode() {
        byte[] bytes = new byte[randomBytes];
        secureRandom.nextBytes(bytes);
        return CODE_PREFIX + encoder.encodeToString(bytes);
    }
}
