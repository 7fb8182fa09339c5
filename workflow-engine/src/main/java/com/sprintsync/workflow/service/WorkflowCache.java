package com.sprintsync.workflow.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sprintsync.workflow.config.WorkflowProperties;
import com.sprintsync.workflow.model.TaskStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Per-organization read cache for the two things every move consults:
 * the active statuses and the active edge set.
 *
 * Statuses and edges change far less often than task status, so entries live
 * until a write to the same organization evicts them. Eviction happens
 * immediately and again once the writing transaction completes, so a reader
 * that refilled the entry from pre-commit data is dropped too.
 *
 * Cached lists and maps are immutable; cached statuses are detached entities
 * and must be treated as read-only.
 */
@Component
public class WorkflowCache {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCache.class);

    private final Cache<Long, List<TaskStatus>>       activeStatuses;
    private final Cache<Long, Map<Long, Set<Long>>>   activeEdges;

    public WorkflowCache(WorkflowProperties properties, MeterRegistry meterRegistry) {
        WorkflowProperties.Cache cfg = properties.getCache();
        this.activeStatuses = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxOrganizations())
                .expireAfterWrite(cfg.getTtl())
                .recordStats()
                .build();
        this.activeEdges = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxOrganizations())
                .expireAfterWrite(cfg.getTtl())
                .recordStats()
                .build();
        CaffeineCacheMetrics.monitor(meterRegistry, activeStatuses, "sprintsync.workflow.active-statuses");
        CaffeineCacheMetrics.monitor(meterRegistry, activeEdges, "sprintsync.workflow.active-edges");
        log.info("WorkflowCache initialized: maxOrganizations={}, ttl={}",
                cfg.getMaxOrganizations(), cfg.getTtl());
    }

    /** Active statuses of an organization in display order, loading on a miss. */
    public List<TaskStatus> activeStatuses(Long organizationId,
                                           Function<Long, List<TaskStatus>> loader) {
        return activeStatuses.get(organizationId, id -> List.copyOf(loader.apply(id)));
    }

    /** Adjacency (from-status id to target ids) of active edges, loading on a miss. */
    public Map<Long, Set<Long>> activeEdges(Long organizationId,
                                            Function<Long, Map<Long, Set<Long>>> loader) {
        return activeEdges.get(organizationId, id -> Map.copyOf(loader.apply(id)));
    }

    /**
     * Drop everything cached for an organization. Call after any status or
     * edge write; inside a transaction the eviction repeats on completion.
     */
    public void invalidate(Long organizationId) {
        evict(organizationId);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    evict(organizationId);
                }
            });
        }
    }

    private void evict(Long organizationId) {
        activeStatuses.invalidate(organizationId);
        activeEdges.invalidate(organizationId);
        log.debug("Evicted workflow cache for organization {}", organizationId);
    }
}
