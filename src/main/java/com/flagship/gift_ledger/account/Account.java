package com.flagship.gift_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A user of the platform: owns inventory and sends gifts.
 * Credentials are verified upstream; only the hash is stored here.
 */
@Value
public class Account {
    UUID id;
    String email;
    String displayName;
    String credentialHash;
    String deviceId;
    Instant createdAt;
}
