package com.openforge.rxmate.repository;

import com.openforge.rxmate.domain.ToolStat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ToolStatRepository extends JpaRepository<ToolStat, String> {

    /** Atomic in-database increment; returns 0 when the row does not exist yet. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ToolStat t set t.callCount = t.callCount + :delta where t.toolName = :toolName")
    int incrementBy(@Param("toolName") String toolName, @Param("delta") long delta);

    List<ToolStat> findAllByOrderByCallCountDesc();
}
