package com.flagship.gift_ledger.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GiftDefinitionRepository extends JpaRepository<GiftDefinitionEntity, Long> {

    List<GiftDefinitionEntity> findByActiveTrueOrderByCategoryAscNameAsc();

    Optional<GiftDefinitionEntity> findByIdAndActiveTrue(Long id);
}
