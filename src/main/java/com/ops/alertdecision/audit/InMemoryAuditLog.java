package com.ops.alertdecision.audit;

import com.ops.alertdecision.model.AuditEntry;
import com.ops.alertdecision.model.DecisionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local audit log. Each partition keeps at most {@code audit.memory.max-entries-per-action}
 * entries; the oldest are dropped first and counted in {@link #evictedCount()}.
 */
@Component
@ConditionalOnProperty(name = "audit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryAuditLog implements AuditLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditLog.class);

    private final Map<DecisionAction, Deque<AuditEntry>> partitions = new EnumMap<>(DecisionAction.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxEntriesPerAction;
    private long evicted;

    public InMemoryAuditLog(@Value("${audit.memory.max-entries-per-action:10000}") int maxEntriesPerAction) {
        if (maxEntriesPerAction <= 0) {
            throw new IllegalArgumentException("audit.memory.max-entries-per-action must be positive");
        }
        this.maxEntriesPerAction = maxEntriesPerAction;
        for (DecisionAction action : DecisionAction.values()) {
            partitions.put(action, new ArrayDeque<>());
        }
    }

    @Override
    public void append(AuditEntry entry) {
        lock.writeLock().lock();
        try {
            Deque<AuditEntry> partition = partitions.get(entry.getAction());
            partition.addLast(entry);
            if (partition.size() > maxEntriesPerAction) {
                partition.removeFirst();
                evicted++;
                log.debug("Audit partition {} full, dropped oldest entry", entry.getAction().getAuditKey());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> find(DecisionAction action, int limit) {
        lock.readLock().lock();
        try {
            if (action != null) {
                List<AuditEntry> result = new ArrayList<>();
                Iterator<AuditEntry> it = partitions.get(action).descendingIterator();
                while (it.hasNext() && result.size() < limit) {
                    result.add(it.next());
                }
                return result;
            }
            List<AuditEntry> all = new ArrayList<>();
            partitions.values().forEach(all::addAll);
            all.sort(Comparator.comparing(AuditEntry::getRecordedAt).reversed());
            return all.size() > limit ? new ArrayList<>(all.subList(0, limit)) : all;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> findAll() {
        lock.readLock().lock();
        try {
            List<AuditEntry> all = new ArrayList<>();
            partitions.values().forEach(all::addAll);
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long evictedCount() {
        lock.readLock().lock();
        try {
            return evicted;
        } finally {
            lock.readLock().unlock();
        }
    }
}
