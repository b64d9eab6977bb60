package com.flagship.gift_ledger.purchase;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseReceiptRepository extends JpaRepository<PurchaseReceiptEntity, UUID> {

    Optional<PurchaseReceiptEntity> findByIdempotencyKey(String idempotencyKey);

    List<PurchaseReceiptEntity> findByAccountIdOrderByCreatedAtDesc(UUID accountId);
}
