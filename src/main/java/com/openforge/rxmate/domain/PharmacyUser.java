package com.openforge.rxmate.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;

/** A pharmacy customer. Not an application login; the service has none. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "users")
public class PharmacyUser {

    @Id
    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "full_name")
    private String fullName;

    @Column(name = "phone", length = 64)
    private String phone;

    @Column(name = "email")
    private String email;

    @Column(name = "preferred_language", length = 8)
    private String preferredLanguage;
}
