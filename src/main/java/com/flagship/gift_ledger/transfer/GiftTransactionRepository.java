package com.flagship.gift_ledger.transfer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GiftTransactionRepository extends JpaRepository<GiftTransactionEntity, UUID> {

    Optional<GiftTransactionEntity> findByRedemptionCode(String redemptionCode);

    /**
     * ISSUED -> REDEEMED as one conditional write.
     *
     * Under read committed a concurrent caller blocks on the row lock, then
     * re-checks the status predicate against the committed row, so at most
     * one caller ever gets 1.
     *
     * @return 1 if this call redeemed the gift, 0 if it was not ISSUED
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GiftTransactionEntity t
        SET t.status = :redeemed, t.redeemedAt = :redeemedAt, t.redeemingPartyId = :partyId
        WHERE t.id = :id AND t.status = :issued
        """)
    int markRedeemed(@Param("id") UUID id,
                     @Param("redeemedAt") Instant redeemedAt,
                     @Param("partyId") UUID partyId,
                     @Param("redeemed") GiftTransactionStatus redeemed,
                     @Param("issued") GiftTransactionStatus issued);
}
