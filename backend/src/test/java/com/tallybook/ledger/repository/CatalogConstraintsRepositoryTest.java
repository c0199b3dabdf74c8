package com.tallybook.ledger.repository;

import com.tallybook.ledger.model.PriceRecord;
import com.tallybook.ledger.model.Product;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatalogConstraintsRepositoryTest {

    @Autowired private ProductRepository productRepository;
    @Autowired private PriceRecordRepository priceRecordRepository;

    @Test
    void missingKeyIsFilledOnPersist() {
        Product p = new Product();
        p.setName("  Copper Wire (2mm) ");
        Product saved = productRepository.saveAndFlush(p);

        assertThat(saved.getNormalizedName()).isEqualTo("copper wire");
        assertThat(saved.getName()).isEqualTo("Copper Wire (2mm)");
        assertThat(saved.getCreatedAt()).isNotNull();
    }

    @Test
    void duplicateNormalizedNameIsRejectedByStore() {
        productRepository.saveAndFlush(new Product("Copper Wire", "copper wire"));

        assertThatThrownBy(() -> productRepository.saveAndFlush(new Product("COPPER WIRE", "copper wire")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void duplicateProductCompanyPeriodIsRejectedByStore() {
        Product p = productRepository.saveAndFlush(new Product("Hex Nut", "hex nut"));
        priceRecordRepository.saveAndFlush(new PriceRecord(p, "Acme", "2024-03", new BigDecimal("1.20")));

        assertThatThrownBy(() -> priceRecordRepository.saveAndFlush(new PriceRecord(p, "Acme", "2024-03", new BigDecimal("1.30"))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void keyProjectionFollowsCatalogOrder() {
        Product a = productRepository.saveAndFlush(new Product("Alpha", "alpha"));
        Product b = productRepository.saveAndFlush(new Product("Beta", "beta"));

        List<ProductRepository.ProductKeyProjection> keys = productRepository.findAllKeys();

        assertThat(keys).extracting(ProductRepository.ProductKeyProjection::getId)
                .containsSubsequence(a.getId(), b.getId());
        assertThat(keys).extracting(ProductRepository.ProductKeyProjection::getNormalizedName)
                .contains("alpha", "beta");
    }
}
