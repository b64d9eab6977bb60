package com.flagship.gift_ledger.exception;

import java.util.UUID;

/**
 * Thrown when an account holds fewer units of a gift than a debit requires.
 */
public class InsufficientBalanceException extends GiftLifecycleException {

    private final UUID accountId;
    private final Long giftDefinitionId;
    private final int requestedQuantity;

    public InsufficientBalanceException(UUID accountId, Long giftDefinitionId, int requestedQuantity) {
        super(GiftErrorCode.INSUFFICIENT_BALANCE,
                String.format("Account %s does not hold %d unit(s) of gift type %s",
                        accountId, requestedQuantity, giftDefinitionId));
        this.accountId = accountId;
        this.giftDefinitionId = giftDefinitionId;
        this.requestedQuantity = requestedQuantity;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public Long getGiftDefinitionId() {
        return giftDefinitionId;
    }

    public int getRequestedQuantity() {
        return requestedQuantity;
    }
}
