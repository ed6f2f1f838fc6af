package com.preciousledger.domain.service;

import com.preciousledger.domain.model.ContractStatus;
import com.preciousledger.domain.model.ContributionLedgerEntry;
import com.preciousledger.domain.model.ContributionStatus;
import com.preciousledger.domain.model.ContributionType;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.domain.model.UnitLedgerEntry;
import com.preciousledger.infrastructure.persistence.entity.CoOwnershipContractEntity;
import com.preciousledger.infrastructure.persistence.entity.ContractUnitHistoryEntity;
import com.preciousledger.infrastructure.persistence.entity.ContributionEntity;
import com.preciousledger.infrastructure.persistence.entity.PreciousItemEntity;
import com.preciousledger.infrastructure.persistence.entity.ProductionAllocationEntity;
import com.preciousledger.infrastructure.persistence.entity.PurchaseLotEntity;
import com.preciousledger.infrastructure.persistence.entity.UnitEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(LotLedgerService.class)
class LotLedgerServiceTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private LotLedgerService lotLedgerService;

    private PurchaseLotEntity purchase;
    private PurchaseLotEntity sale;
    private CoOwnershipContractEntity contract;

    @BeforeEach
    void setUp() {
        PreciousItemEntity gold = entityManager.persist(PreciousItemEntity.builder()
                .name("Gold bar 10g")
                .materialType(MaterialType.METAL)
                .materialItemId(UUID.randomUUID())
                .materialItemName("Gold")
                .caratTypeId(UUID.randomUUID())
                .unitWeight(new BigDecimal("10.00"))
                .build());

        UUID seller = UUID.randomUUID();
        purchase = entityManager.persist(lot(gold, seller, RequestType.PURCHASE, LotStatus.COMPLETED, "5", null));
        sale = entityManager.persist(lot(gold, seller, RequestType.SALE, LotStatus.APPROVED, "1", purchase));
        PurchaseLotEntity withdrawnSale = lot(gold, seller, RequestType.SALE, LotStatus.PENDING, "2", purchase);
        withdrawnSale.setDeletedAt(Instant.now());
        entityManager.persist(withdrawnSale);

        contract = entityManager.persist(CoOwnershipContractEntity.builder()
                .jewelerBusinessId(UUID.randomUUID())
                .investorBusinessId(seller)
                .contractStatus(ContractStatus.ACTIVE)
                .build());

        entityManager.persist(unit("SN-1"));

        UnitEntity sold = unit("SN-2");
        sold.setSaleLot(sale);
        entityManager.persist(sold);

        UnitEntity contracted = unit("SN-3");
        contracted.setContract(contract);
        entityManager.persist(contracted);
        ContractUnitHistoryEntity history = entityManager.persist(ContractUnitHistoryEntity.builder()
                .unit(contracted)
                .contract(contract)
                .contributedWeight(new BigDecimal("10.00"))
                .build());
        entityManager.persist(allocation(null, history, "3.00", false));

        UnitEntity consumed = unit("SN-4");
        entityManager.persist(consumed);
        entityManager.persist(allocation(consumed, null, "2.00", false));
        entityManager.persist(allocation(consumed, null, "5.00", true));

        UnitEntity removed = unit("SN-5");
        removed.setDeletedAt(Instant.now());
        entityManager.persist(removed);

        entityManager.persist(ContributionEntity.builder()
                .purchaseLot(purchase)
                .businessId(seller)
                .quantity(new BigDecimal("1.00"))
                .contributionType(ContributionType.CONTRACT)
                .contract(contract)
                .status(ContributionStatus.APPROVED)
                .build());

        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void load_buildsLedgerFromAllRelatedRows() {
        LotLedger ledger = lotLedgerService.load(purchase.getLotId()).orElseThrow();

        assertEquals(RequestType.PURCHASE, ledger.getRequestType());
        assertEquals(LotStatus.COMPLETED, ledger.getStatus());
        assertEquals(0, ledger.getRequestedQuantity().compareTo(new BigDecimal("5")));
        assertEquals(0, ledger.getUnitWeight().compareTo(new BigDecimal("10")));
        assertEquals(0, ledger.getTotalSold().compareTo(BigDecimal.ONE));

        assertEquals(1, ledger.getContributions().size());
        ContributionLedgerEntry contribution = ledger.getContributions().get(0);
        assertEquals(contract.getContractId(), contribution.getContractId());
        assertEquals(ContributionStatus.APPROVED, contribution.getStatus());

        List<UnitLedgerEntry> units = ledger.getUnits();
        assertEquals(List.of("SN-1", "SN-2", "SN-3", "SN-4"),
                units.stream().map(UnitLedgerEntry::getSerialNumber).collect(Collectors.toList()));

        assertTrue(units.get(0).isTrulyAvailable());
        assertEquals(sale.getLotId(), units.get(1).getSaleLotId());

        UnitLedgerEntry contracted = units.get(2);
        assertEquals(ContractStatus.ACTIVE, contracted.getContractStatus());
        assertEquals(Map.of(contract.getContractId(), ContractStatus.ACTIVE), contracted.getHistoryContracts());
        assertEquals(0, contracted.getHistoryConsumedWeight().compareTo(new BigDecimal("3")));
        assertEquals(1, contracted.getProductionAllocationCount());

        UnitLedgerEntry consumed = units.get(3);
        assertEquals(0, consumed.getDirectConsumedWeight().compareTo(new BigDecimal("2")));
        assertEquals(1, consumed.getProductionAllocationCount());
    }

    @Test
    void loadAll_includeDeleted_bringsBackSoftDeletedRows() {
        LotLedger ledger = lotLedgerService.loadAll(List.of(purchase.getLotId()), true).get(purchase.getLotId());

        assertEquals(0, ledger.getTotalSold().compareTo(new BigDecimal("3")));
        assertEquals(5, ledger.getUnits().size());
        UnitLedgerEntry consumed = ledger.getUnits().get(3);
        assertEquals(0, consumed.getDirectConsumedWeight().compareTo(new BigDecimal("7")));
        assertEquals(2, consumed.getProductionAllocationCount());
    }

    @Test
    void loadAll_keepsRequestOrderAndSkipsUnknownLots() {
        UUID unknown = UUID.randomUUID();

        Map<UUID, LotLedger> ledgers = lotLedgerService.loadAll(
                List.of(sale.getLotId(), unknown, purchase.getLotId()), false);

        assertEquals(List.of(sale.getLotId(), purchase.getLotId()), List.copyOf(ledgers.keySet()));
        assertTrue(ledgers.get(sale.getLotId()).getUnits().isEmpty());
    }

    @Test
    void load_unknownLot_isEmpty() {
        Optional<LotLedger> ledger = lotLedgerService.load(UUID.randomUUID());

        assertTrue(ledger.isEmpty());
    }

    private PurchaseLotEntity lot(PreciousItemEntity item, UUID businessId, RequestType type, LotStatus status,
                                  String quantity, PurchaseLotEntity related) {
        return PurchaseLotEntity.builder()
                .businessId(businessId)
                .preciousItem(item)
                .requestType(type)
                .status(status)
                .requestedQuantity(new BigDecimal(quantity))
                .relatedLot(related)
                .build();
    }

    private UnitEntity unit(String serial) {
        return UnitEntity.builder()
                .purchaseLot(purchase)
                .serialNumber(serial)
                .build();
    }

    private ProductionAllocationEntity allocation(UnitEntity unit, ContractUnitHistoryEntity history,
                                                  String weight, boolean deleted) {
        return ProductionAllocationEntity.builder()
                .productionPaymentId(UUID.randomUUID())
                .unit(unit)
                .contractHistory(history)
                .contract(history != null ? history.getContract() : null)
                .weight(new BigDecimal(weight))
                .deletedAt(deleted ? Instant.now() : null)
                .build();
    }
}
