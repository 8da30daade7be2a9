package com.openforge.rxmate.domain;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * A submitted refill. Created by the refill tool; processing happens
 * elsewhere and only ever moves {@code status} forward.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "refill_requests")
@EntityListeners(AuditingEntityListener.class)
public class RefillRequest {

    public static final String STATUS_SUBMITTED = "submitted";

    @Id
    @Column(name = "refill_request_id", nullable = false, length = 64)
    private String refillRequestId;

    @Column(name = "prescription_id", nullable = false, length = 32)
    private String prescriptionId;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
