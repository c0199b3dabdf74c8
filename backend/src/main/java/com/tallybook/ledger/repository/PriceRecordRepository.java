package com.tallybook.ledger.repository;

import com.tallybook.ledger.model.PriceRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PriceRecordRepository extends JpaRepository<PriceRecord, Long> {
    Optional<PriceRecord> findByProductIdAndCompanyAndPeriod(Long productId, String company, String period);
}
