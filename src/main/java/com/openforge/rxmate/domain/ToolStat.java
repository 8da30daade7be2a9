package com.openforge.rxmate.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * Durable usage counter of one tool; one row per tool name ever dispatched.
 *
 * Implements {@link Persistable} so that saving a fresh row is a plain
 * INSERT: a concurrent insert by another instance then fails loudly instead
 * of being silently merged over.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "tool_stats")
public class ToolStat implements Persistable<String> {

    @Id
    @Column(name = "tool_name", nullable = false, length = 128)
    private String toolName;

    @Column(name = "call_count", nullable = false)
    private long callCount;

    @Transient
    private boolean fresh;

    /** A new row that has not been written yet. */
    public static ToolStat first(String toolName, long callCount) {
        ToolStat stat = new ToolStat();
        stat.setToolName(toolName);
        stat.setCallCount(callCount);
        stat.fresh = true;
        return stat;
    }

    @Override
    public String getId() {
        return toolName;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        fresh = false;
    }
}
