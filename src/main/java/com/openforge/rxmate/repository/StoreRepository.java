package com.openforge.rxmate.repository;

import com.openforge.rxmate.domain.Store;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoreRepository extends JpaRepository<Store, String> {

    List<Store> findAllByOrderByCityAscNameAsc();

    List<Store> findByCityContainingIgnoreCaseOrderByNameAsc(String city);
}
