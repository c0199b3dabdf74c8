package com.tallybook.ledger.model;

import com.tallybook.ledger.util.ProductNameNormalizer;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "products", uniqueConstraints = {
        @UniqueConstraint(name = "uk_product_normalized_name", columnNames = {"normalized_name"})
})
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    @Column(name = "created_at")
    private Instant createdAt;

    public Product() {}

    public Product(String name, String normalizedName) {
        this.name = name;
        this.normalizedName = normalizedName;
    }

    @PrePersist
    private void prePersist() {
        if (this.name != null) {
            this.name = this.name.trim();
        }
        if (this.normalizedName == null) {
            this.normalizedName = ProductNameNormalizer.normalize(this.name);
        }
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getNormalizedName() { return normalizedName; }
    public void setNormalizedName(String normalizedName) { this.normalizedName = normalizedName; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
