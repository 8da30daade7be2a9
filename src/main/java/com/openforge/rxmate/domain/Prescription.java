package com.openforge.rxmate.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * A prescription held by a customer. {@code userId} is deliberately not a
 * foreign key: prescriptions may be imported for customers not yet on file.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "prescriptions")
public class Prescription {

    public static final String STATUS_EXPIRED    = "expired";
    public static final String STATUS_NO_REFILLS = "no_refills";
    public static final String STATUS_ACTIVE     = "active";

    @Id
    @Column(name = "prescription_id", nullable = false, length = 32)
    private String prescriptionId;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "med_id", nullable = false, length = 32)
    private String medId;

    @Column(name = "directions", columnDefinition = "TEXT")
    private String directions;

    @Column(name = "refills_remaining", nullable = false)
    private int refillsRemaining;

    @Column(name = "expires_at", nullable = false)
    private LocalDate expiresAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "med_id", insertable = false, updatable = false)
    private Medication medication;

    public boolean isExpired(LocalDate today) {
        return expiresAt.isBefore(today);
    }

    /** Expiry wins over exhausted refills. */
    public String status(LocalDate today) {
        if (isExpired(today))      return STATUS_EXPIRED;
        if (refillsRemaining <= 0) return STATUS_NO_REFILLS;
        return STATUS_ACTIVE;
    }
}
