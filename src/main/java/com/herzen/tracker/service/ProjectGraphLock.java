package com.herzen.tracker.service;

import com.herzen.tracker.repository.GraphLockJdbcRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes template-graph writers per project. Within this JVM a fair lock per project id;
 * across nodes the {@code graph_locks} row, held until the surrounding transaction ends.
 * Several projects are always taken in sorted order.
 */
@Service
public class ProjectGraphLock {
    private final GraphLockJdbcRepository lockRepository;
    private final TransactionTemplate transactionTemplate;
    private final Map<String, ReentrantLock> localLocks = new ConcurrentHashMap<>();

    public ProjectGraphLock(GraphLockJdbcRepository lockRepository, TransactionTemplate transactionTemplate) {
        this.lockRepository = lockRepository;
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T withProjects(Collection<String> projectIds, Supplier<T> action) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(projectIds));
        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (String projectId : ordered) {
                ReentrantLock lock = localLocks.computeIfAbsent(projectId, k -> new ReentrantLock(true));
                lock.lock();
                held.add(lock);
            }
            return transactionTemplate.execute(tx -> {
                ordered.forEach(lockRepository::lockProject);
                return action.get();
            });
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }
}
