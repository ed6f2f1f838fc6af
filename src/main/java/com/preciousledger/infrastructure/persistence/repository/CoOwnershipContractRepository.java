package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.infrastructure.persistence.entity.CoOwnershipContractEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CoOwnershipContractRepository extends JpaRepository<CoOwnershipContractEntity, UUID> {

    /**
     * Lock the contract so only one investor can be assigned to it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CoOwnershipContractEntity c where c.contractId = :contractId")
    Optional<CoOwnershipContractEntity> findByIdForUpdate(@Param("contractId") UUID contractId);
}
