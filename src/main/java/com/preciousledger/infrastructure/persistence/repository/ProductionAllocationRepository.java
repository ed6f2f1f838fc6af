package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.infrastructure.persistence.entity.ProductionAllocationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProductionAllocationRepository extends JpaRepository<ProductionAllocationEntity, UUID> {

    /**
     * Production weight drawn directly from units, one row per unit.
     */
    @Query("select a.unit.unitId as unitId, sum(a.weight) as consumedWeight, count(a) as allocationCount "
            + "from ProductionAllocationEntity a "
            + "where a.unit.purchaseLot.lotId in :lotIds and (:includeDeleted = true or a.deletedAt is null) "
            + "group by a.unit.unitId")
    List<UnitConsumptionView> sumDirectConsumption(@Param("lotIds") Collection<UUID> lotIds,
                                                   @Param("includeDeleted") boolean includeDeleted);

    /**
     * Production weight drawn through contract history rows, one row per unit.
     */
    @Query("select h.unit.unitId as unitId, sum(a.weight) as consumedWeight, count(a) as allocationCount "
            + "from ProductionAllocationEntity a join a.contractHistory h "
            + "where h.unit.purchaseLot.lotId in :lotIds and (:includeDeleted = true or a.deletedAt is null) "
            + "group by h.unit.unitId")
    List<UnitConsumptionView> sumHistoryConsumption(@Param("lotIds") Collection<UUID> lotIds,
                                                    @Param("includeDeleted") boolean includeDeleted);

    interface UnitConsumptionView {
        UUID getUnitId();

        BigDecimal getConsumedWeight();

        Long getAllocationCount();
    }
}
