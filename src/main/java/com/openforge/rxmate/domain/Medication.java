package com.openforge.rxmate.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.Arrays;
import java.util.List;

/**
 * One catalog entry. Identified by its catalog code (e.g. "MED001").
 *
 * {@code activeIngredients} is stored as a single comma-separated column
 * ("Paracetamol, Pseudoephedrine"); {@link #activeIngredientList()} splits it.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "medications")
public class Medication {

    @Id
    @Column(name = "med_id", nullable = false, length = 32)
    private String medId;

    @Column(name = "brand_name")
    private String brandName;

    @Column(name = "generic_name")
    private String genericName;

    @Column(name = "active_ingredients")
    private String activeIngredients;

    @Column(name = "form", length = 64)
    private String form;

    @Column(name = "strength", length = 64)
    private String strength;

    @Column(name = "rx_required", nullable = false)
    private boolean rxRequired;

    @Column(name = "standard_directions", columnDefinition = "TEXT")
    private String standardDirections;

    @Column(name = "warnings", columnDefinition = "TEXT")
    private String warnings;

    @Column(name = "contraindications", columnDefinition = "TEXT")
    private String contraindications;

    public List<String> activeIngredientList() {
        if (activeIngredients == null || activeIngredients.isBlank()) return List.of();
        return Arrays.stream(activeIngredients.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /** "Brand (Generic)", the display name used in prescription and stock listings. */
    public String displayName() {
        return brandName + " (" + genericName + ")";
    }
}
