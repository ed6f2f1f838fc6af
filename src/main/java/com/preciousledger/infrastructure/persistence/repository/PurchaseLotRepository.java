package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.infrastructure.persistence.entity.PurchaseLotEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseLotRepository extends JpaRepository<PurchaseLotEntity, UUID> {

    /**
     * Lock a lot row for the rest of the transaction.
     *
     * Every allocation commit takes this lock before re-reading the lot's
     * ledger, so two commits against the same lot cannot both pass the
     * capacity check.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from PurchaseLotEntity l where l.lotId = :lotId")
    Optional<PurchaseLotEntity> findByIdForUpdate(@Param("lotId") UUID lotId);

    @Query("select l from PurchaseLotEntity l join fetch l.preciousItem "
            + "where l.lotId in :lotIds and (:includeDeleted = true or l.deletedAt is null)")
    List<PurchaseLotEntity> findWithItemByIdIn(@Param("lotIds") Collection<UUID> lotIds,
                                               @Param("includeDeleted") boolean includeDeleted);

    @Query("select l.lotId from PurchaseLotEntity l "
            + "where l.businessId = :businessId and l.requestType = :requestType and l.status in :statuses "
            + "and (:includeDeleted = true or l.deletedAt is null) order by l.createdAt")
    List<UUID> findLotIdsOwnedBy(@Param("businessId") UUID businessId,
                                 @Param("requestType") RequestType requestType,
                                 @Param("statuses") Collection<LotStatus> statuses,
                                 @Param("includeDeleted") boolean includeDeleted);

    /**
     * Requested quantity of sale lots reserving each parent lot, one row per parent.
     */
    @Query("select s.relatedLot.lotId as lotId, sum(s.requestedQuantity) as quantity "
            + "from PurchaseLotEntity s "
            + "where s.relatedLot.lotId in :lotIds and s.requestType = :saleType and s.status in :statuses "
            + "and (:includeDeleted = true or s.deletedAt is null) "
            + "group by s.relatedLot.lotId")
    List<LotQuantityView> sumSoldQuantities(@Param("lotIds") Collection<UUID> lotIds,
                                            @Param("saleType") RequestType saleType,
                                            @Param("statuses") Collection<LotStatus> statuses,
                                            @Param("includeDeleted") boolean includeDeleted);

    interface LotQuantityView {
        UUID getLotId();

        BigDecimal getQuantity();
    }
}
