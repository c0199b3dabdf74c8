package com.tallybook.ledger.repository;

import com.tallybook.ledger.model.ImportError;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportErrorRepository extends JpaRepository<ImportError, Long> {
    List<ImportError> findByTaskIdOrderByRowNumberAsc(String taskId, Pageable pageable);
}
