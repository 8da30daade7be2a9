package com.openforge.rxmate.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "stores")
public class Store {

    @Id
    @Column(name = "store_id", nullable = false, length = 32)
    private String storeId;

    @Column(name = "city", length = 128)
    private String city;

    @Column(name = "name")
    private String name;
}
