package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.domain.model.ContractStatus;
import com.preciousledger.infrastructure.persistence.entity.UnitEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface UnitRepository extends JpaRepository<UnitEntity, UUID> {

    /**
     * Allocation pointers of every unit of the given lots, in one query.
     */
    @Query("select u.unitId as unitId, u.purchaseLot.lotId as lotId, u.serialNumber as serialNumber, "
            + "s.lotId as saleLotId, p.poolId as poolId, k.contractId as contractId, "
            + "k.contractStatus as contractStatus "
            + "from UnitEntity u left join u.saleLot s left join u.pool p left join u.contract k "
            + "where u.purchaseLot.lotId in :lotIds and (:includeDeleted = true or u.deletedAt is null) "
            + "order by u.serialNumber")
    List<UnitPointerView> findPointersByLotIds(@Param("lotIds") Collection<UUID> lotIds,
                                               @Param("includeDeleted") boolean includeDeleted);

    interface UnitPointerView {
        UUID getUnitId();

        UUID getLotId();

        String getSerialNumber();

        UUID getSaleLotId();

        UUID getPoolId();

        UUID getContractId();

        ContractStatus getContractStatus();
    }
}
