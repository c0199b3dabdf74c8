package com.tallybook.ledger.service;

import com.tallybook.ledger.model.Product;
import com.tallybook.ledger.repository.PriceRecordRepository;
import com.tallybook.ledger.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ProductCatalogServiceIntegrationTest {

    @Autowired private ProductCatalogService catalogService;
    @Autowired private ProductRepository productRepository;
    @Autowired private PriceRecordRepository priceRecordRepository;

    @BeforeEach
    void cleanStore() {
        priceRecordRepository.deleteAll();
        productRepository.deleteAll();
    }

    @Test
    void secondCallReturnsExistingProduct() {
        Product first = catalogService.findOrCreate("Hex Bolt", "hex bolt");
        Product second = catalogService.findOrCreate("HEX BOLT", "hex bolt");

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getName()).isEqualTo("Hex Bolt");
    }

    @Test
    void concurrentCreatorsEndWithOneProduct() throws Exception {
        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> ids = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                ids.add(pool.submit(() -> {
                    start.await();
                    return catalogService.findOrCreate("Gizmo", "gizmo").getId();
                }));
            }
            start.countDown();
            Long expected = ids.get(0).get();
            for (Future<Long> f : ids) {
                assertThat(f.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(productRepository.findAllKeys())
                .filteredOn(k -> "gizmo".equals(k.getNormalizedName()))
                .hasSize(1);
    }
}
