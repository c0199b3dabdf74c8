package com.tallybook.ledger.service;

import com.tallybook.ledger.model.Product;
import com.tallybook.ledger.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

@Service
public class ProductCatalogService {
    private static final Logger log = LoggerFactory.getLogger(ProductCatalogService.class);

    private final ProductRepository productRepository;
    private final TransactionTemplate requiresNew;

    public ProductCatalogService(ProductRepository productRepository, PlatformTransactionManager transactionManager) {
        this.productRepository = productRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Returns the product owning {@code normalizedName}, creating it from {@code rawName} if absent.
     * The insert commits on its own; when a concurrent import wins the race on the unique key,
     * the winner's row is fetched in a fresh transaction and returned instead.
     */
    public Product findOrCreate(String rawName, String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            throw new IllegalArgumentException("Product name is required");
        }
        Optional<Product> existing = productRepository.findByNormalizedName(normalizedName);
        if (existing.isPresent()) return existing.get();
        String display = rawName == null ? normalizedName : rawName.trim();
        try {
            Product created = requiresNew.execute(status ->
                    productRepository.saveAndFlush(new Product(display, normalizedName)));
            log.info("[Catalog][Create] productId={} name='{}' key='{}'",
                    created != null ? created.getId() : null, display, normalizedName);
            return created;
        } catch (DataIntegrityViolationException ex) {
            log.debug("[Catalog][Race] key='{}' already inserted by another worker", normalizedName);
            return requiresNew.execute(status -> productRepository.findByNormalizedName(normalizedName))
                    .orElseThrow(() -> ex);
        }
    }
}
