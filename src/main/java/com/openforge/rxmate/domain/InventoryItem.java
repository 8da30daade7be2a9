package com.openforge.rxmate.domain;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Stock level of one medication in one store.
 *
 * The association fields are read-only views over the key columns; rows are
 * written through {@code storeId}/{@code medId}. A row may reference a store
 * that is not (or no longer) in the stores table.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "inventory")
@IdClass(InventoryItem.Key.class)
public class InventoryItem {

    @Id
    @Column(name = "store_id", nullable = false, length = 32)
    private String storeId;

    @Id
    @Column(name = "med_id", nullable = false, length = 32)
    private String medId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "med_id", insertable = false, updatable = false)
    private Medication medication;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "store_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(ConstraintMode.NO_CONSTRAINT))
    private Store store;

    public boolean inStock() {
        return quantity > 0;
    }

    public String stockStatus() {
        return inStock() ? "in_stock" : "out_of_stock";
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private String storeId;
        private String medId;
    }
}
