package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.infrastructure.persistence.entity.PoolEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PoolRepository extends JpaRepository<PoolEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PoolEntity p where p.poolId = :poolId")
    Optional<PoolEntity> findByIdForUpdate(@Param("poolId") UUID poolId);
}
