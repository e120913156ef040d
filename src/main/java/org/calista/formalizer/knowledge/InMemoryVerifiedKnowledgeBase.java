package org.calista.formalizer.knowledge;

import org.calista.formalizer.graph.ConceptGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** Thread-safe, key-ordered in-memory knowledge base. */
public final class InMemoryVerifiedKnowledgeBase implements VerifiedKnowledgeBase {

    private final TreeMap<String, VerifiedEntry> byKey = new TreeMap<>();
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    @Override
    public boolean upsert(VerifiedEntry entry) {
        Objects.requireNonNull(entry, "entry");
        entry.validate();

        rw.writeLock().lock();
        try {
            VerifiedEntry prev = byKey.get(entry.key);
            if (prev != null) {
                entry.createdAtEpochMs = prev.createdAtEpochMs;
                if (Objects.equals(prev.code, entry.code) && Objects.equals(prev.deps, entry.deps)) return false;
            }
            entry.updatedAtEpochMs = Math.max(entry.createdAtEpochMs, System.currentTimeMillis());
            byKey.put(entry.key, entry);
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public Optional<VerifiedEntry> get(String description) {
        if (description == null) return Optional.empty();
        rw.readLock().lock();
        try {
            return Optional.ofNullable(byKey.get(ConceptGraph.normalize(description)));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<VerifiedEntry> snapshotSorted() {
        rw.readLock().lock();
        try {
            return List.copyOf(new ArrayList<>(byKey.values()));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public int size() {
        rw.readLock().lock();
        try {
            return byKey.size();
        } finally {
            rw.readLock().unlock();
        }
    }
}
