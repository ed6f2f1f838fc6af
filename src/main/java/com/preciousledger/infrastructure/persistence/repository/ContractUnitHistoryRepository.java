package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.domain.model.ContractStatus;
import com.preciousledger.infrastructure.persistence.entity.ContractUnitHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ContractUnitHistoryRepository extends JpaRepository<ContractUnitHistoryEntity, UUID> {

    @Query("select h.unit.unitId as unitId, k.contractId as contractId, k.contractStatus as contractStatus "
            + "from ContractUnitHistoryEntity h join h.contract k "
            + "where h.unit.purchaseLot.lotId in :lotIds and (:includeDeleted = true or h.deletedAt is null)")
    List<UnitContractView> findContractsByLotIds(@Param("lotIds") Collection<UUID> lotIds,
                                                 @Param("includeDeleted") boolean includeDeleted);

    interface UnitContractView {
        UUID getUnitId();

        UUID getContractId();

        ContractStatus getContractStatus();
    }
}
