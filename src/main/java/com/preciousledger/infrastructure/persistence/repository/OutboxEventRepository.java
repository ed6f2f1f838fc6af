package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.infrastructure.persistence.entity.OutboxEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    @Query("select e from OutboxEventEntity e where e.status = :status order by e.createdAt asc")
    List<OutboxEventEntity> findOldestByStatus(@Param("status") OutboxEventEntity.EventStatus status,
                                               Pageable pageable);
}
