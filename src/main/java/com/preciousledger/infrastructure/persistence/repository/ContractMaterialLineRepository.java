package com.preciousledger.infrastructure.persistence.repository;

import com.preciousledger.infrastructure.persistence.entity.ContractMaterialLineEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContractMaterialLineRepository extends JpaRepository<ContractMaterialLineEntity, UUID> {

    List<ContractMaterialLineEntity> findByContractContractIdOrderByLineNumberAsc(UUID contractId);
}
