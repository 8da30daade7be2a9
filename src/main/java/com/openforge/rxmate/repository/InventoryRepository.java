package com.openforge.rxmate.repository;

import com.openforge.rxmate.domain.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface InventoryRepository extends JpaRepository<InventoryItem, InventoryItem.Key> {

    Optional<InventoryItem> findByMedIdAndStoreId(String medId, String storeId);

    /** Every stock row of one medication with its store, ordered by city then store name. */
    @Query("""
            select i from InventoryItem i
            left join fetch i.store s
            where i.medId = :medId
            order by s.city, s.name, i.storeId
            """)
    List<InventoryItem> findByMedIdWithStore(@Param("medId") String medId);

    List<InventoryItem> findByMedIdInOrderByStoreIdAsc(Collection<String> medIds);
}
