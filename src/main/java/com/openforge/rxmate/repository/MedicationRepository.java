package com.openforge.rxmate.repository;

import com.openforge.rxmate.domain.Medication;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MedicationRepository extends JpaRepository<Medication, String>,
        JpaSpecificationExecutor<Medication> {

    /** Case-insensitive substring match on brand, generic name or active ingredients. */
    @Query("""
            select m from Medication m
            where lower(m.brandName) like lower(concat('%', :fragment, '%'))
               or lower(m.genericName) like lower(concat('%', :fragment, '%'))
               or lower(m.activeIngredients) like lower(concat('%', :fragment, '%'))
            order by m.medId
            """)
    List<Medication> searchByNameFragment(@Param("fragment") String fragment);

    /**
     * Same match as {@link #searchByNameFragment}, ranked brand hits first, then
     * generic-name hits, then ingredient-only hits, each by brand name.
     */
    @Query("""
            select m from Medication m
            where lower(m.brandName) like lower(concat('%', :fragment, '%'))
               or lower(m.genericName) like lower(concat('%', :fragment, '%'))
               or lower(m.activeIngredients) like lower(concat('%', :fragment, '%'))
            order by case
                       when lower(m.brandName) like lower(concat('%', :fragment, '%')) then 1
                       when lower(m.genericName) like lower(concat('%', :fragment, '%')) then 2
                       else 3
                     end,
                     m.brandName
            """)
    List<Medication> searchRanked(@Param("fragment") String fragment, Pageable page);

    /**
     * Typo-tolerant lookup over brand and generic names (PostgreSQL pg_trgm).
     * Rows are {@code [med_id, brand_name, generic_name, score]}, best first.
     * Fails on databases without the extension; callers treat that as "no candidates".
     */
    @Query(value = """
            SELECT med_id, brand_name, generic_name,
                   GREATEST(similarity(LOWER(brand_name), LOWER(:name)),
                            similarity(LOWER(generic_name), LOWER(:name))) AS score
            FROM medications
            WHERE similarity(LOWER(brand_name), LOWER(:name)) > 0.3
               OR similarity(LOWER(generic_name), LOWER(:name)) > 0.3
            ORDER BY score DESC
            LIMIT 5
            """, nativeQuery = true)
    List<Object[]> findSimilarByName(@Param("name") String name);
}
