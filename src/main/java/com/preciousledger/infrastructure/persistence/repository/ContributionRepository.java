package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.domain.model.ContributionStatus;
import com.preciousledger.domain.model.ContributionType;
import com.preciousledger.infrastructure.persistence.entity.ContributionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ContributionRepository extends JpaRepository<ContributionEntity, UUID> {

    @Query("select c.contributionId as contributionId, c.purchaseLot.lotId as lotId, c.quantity as quantity, "
            + "c.contributionType as contributionType, c.status as status, "
            + "k.contractId as contractId, p.poolId as poolId "
            + "from ContributionEntity c left join c.contract k left join c.pool p "
            + "where c.purchaseLot.lotId in :lotIds and (:includeDeleted = true or c.deletedAt is null)")
    List<ContributionView> findByLotIds(@Param("lotIds") Collection<UUID> lotIds,
                                        @Param("includeDeleted") boolean includeDeleted);

    @Query("select c.contributionId as contributionId, c.purchaseLot.lotId as lotId, c.quantity as quantity, "
            + "c.contributionType as contributionType, c.status as status, "
            + "k.contractId as contractId, p.poolId as poolId "
            + "from ContributionEntity c left join c.contract k left join c.pool p "
            + "where c.contributionId = :contributionId and (:includeDeleted = true or c.deletedAt is null)")
    List<ContributionView> findViewById(@Param("contributionId") UUID contributionId,
                                        @Param("includeDeleted") boolean includeDeleted);

    /**
     * Weight already pledged to a pool by contributions that are not rejected,
     * or null when there are none.
     */
    @Query("select sum(c.quantity * i.unitWeight) "
            + "from ContributionEntity c join c.purchaseLot l join l.preciousItem i "
            + "where c.pool.poolId = :poolId and c.status <> :excluded "
            + "and (:includeDeleted = true or c.deletedAt is null)")
    BigDecimal sumPledgedPoolWeight(@Param("poolId") UUID poolId,
                                    @Param("excluded") ContributionStatus excluded,
                                    @Param("includeDeleted") boolean includeDeleted);

    @Query("select count(c) from ContributionEntity c "
            + "where c.contract.contractId = :contractId and c.status <> :excluded "
            + "and (:includeDeleted = true or c.deletedAt is null)")
    long countContractContributions(@Param("contractId") UUID contractId,
                                    @Param("excluded") ContributionStatus excluded,
                                    @Param("includeDeleted") boolean includeDeleted);

    interface ContributionView {
        UUID getContributionId();

        UUID getLotId();

        BigDecimal getQuantity();

        ContributionType getContributionType();

        ContributionStatus getStatus();

        UUID getContractId();

        UUID getPoolId();
    }
}
