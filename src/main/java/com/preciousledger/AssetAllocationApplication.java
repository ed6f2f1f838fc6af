package com.preciousledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Precious Asset Allocation Service
 *
 * Tracks how much of each purchased lot of precious metal or stones is still
 * free, and commits contributions of those lots to pools and co-ownership contracts.
 *
 * Architecture:
 * - Pure reconciliation engine over pre-loaded lot ledgers
 * - Batched ledger loading (fixed query count per request)
 * - Pessimistic lot locks and retry on allocation commits
 * - Idempotent submission intake over REST and Kafka
 * - Transactional outbox for allocation events
 * - Dead Letter Queue for failed submissions
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
public class AssetAllocationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetAllocationApplication.class, args);
    }
}
