package com.tallybook.ledger.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A price quoted by one company for one product in one month.
 * At most one record exists per (product, company, period).
 */
@Entity
@Table(name = "price_records", uniqueConstraints = {
        @UniqueConstraint(name = "uk_price_product_company_period", columnNames = {"product_id", "company", "period"})
}, indexes = {
        @Index(name = "idx_price_period", columnList = "period")
})
public class PriceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", nullable = false, foreignKey = @ForeignKey(name = "fk_price_product"))
    private Product product;

    @Column(nullable = false, length = 128)
    private String company;

    @Column(nullable = false, length = 7)
    private String period; // YYYY-MM

    @Column(precision = 19, scale = 4)
    private BigDecimal price;

    @Column(name = "price_type", length = 64)
    private String priceType;

    private Integer quantity;

    @Column(length = 255)
    private String note;

    @Column(name = "source_task_id", length = 36)
    private String sourceTaskId;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PriceRecord() {}

    public PriceRecord(Product product, String company, String period, BigDecimal price) {
        this.product = product;
        this.company = company;
        this.period = period;
        this.price = price;
    }

    @PrePersist
    private void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    private void preUpdate() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Product getProduct() { return product; }
    public void setProduct(Product product) { this.product = product; }
    public String getCompany() { return company; }
    public void setCompany(String company) { this.company = company; }
    public String getPeriod() { return period; }
    public void setPeriod(String period) { this.period = period; }
    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }
    public String getPriceType() { return priceType; }
    public void setPriceType(String priceType) { this.priceType = priceType; }
    public Integer getQuantity() { return quantity; }
    public void setQuantity(Integer quantity) { this.quantity = quantity; }
    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }
    public String getSourceTaskId() { return sourceTaskId; }
    public void setSourceTaskId(String sourceTaskId) { this.sourceTaskId = sourceTaskId; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
