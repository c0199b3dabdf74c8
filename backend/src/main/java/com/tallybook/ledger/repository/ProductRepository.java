package com.tallybook.ledger.repository;

import com.tallybook.ledger.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {
    Optional<Product> findByNormalizedName(String normalizedName);

    // Lightweight projection for similarity scans; catalog order is id order
    interface ProductKeyProjection {
        Long getId();
        String getName();
        String getNormalizedName();
    }

    @Query("select p.id as id, p.name as name, p.normalizedName as normalizedName from Product p order by p.id")
    List<ProductKeyProjection> findAllKeys();
}
