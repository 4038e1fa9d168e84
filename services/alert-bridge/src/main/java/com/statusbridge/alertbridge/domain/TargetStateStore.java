package com.statusbridge.alertbridge.domain;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every {@link TargetSnapshot}, keyed by {@link TargetSnapshot#key()}.
 * <p>
 * Writes to one target are serialized by that target's lock; different targets never contend.
 * Readers get the latest published snapshot without locking. The store also maintains the
 * service membership index used by {@link ServiceAggregator}, and tracks which snapshot
 * version was last confirmed by the backend so that publication always sends the newest state
 * exactly once per change.
 */
public final class TargetStateStore {

    private final ConcurrentMap<String, Entry> targets = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> membersByService = new ConcurrentHashMap<>();

    /**
     * Applies an alert event to its target, creating the target on first reference.
     */
    public TargetUpdate apply(AlertEvent event) {
        String key = TargetSnapshot.keyOf(event.targetInstance(), event.serviceNames());
        Entry entry = targets.computeIfAbsent(key, k -> new Entry());
        entry.lock.lock();
        try {
            TargetSnapshot previous = entry.snapshot;
            TargetSnapshot base = previous != null
                    ? previous
                    : TargetSnapshot.empty(event.targetInstance(), event.serviceNames());
            TargetSnapshot next = base.apply(event);
            index(next);
            entry.snapshot = next;
            return new TargetUpdate(previous, next);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Installs a snapshot read back from the backend, unless the target already has state.
     * Alerts applied since startup are newer than anything the backend shows, so they win.
     *
     * @param publishedHealth health currently shown by the backend component; when it matches the
     *                        snapshot the target is considered published
     * @return true if the snapshot was installed
     */
    public boolean restore(TargetSnapshot snapshot, TargetHealth publishedHealth) {
        Entry entry = targets.computeIfAbsent(snapshot.key(), k -> new Entry());
        entry.lock.lock();
        try {
            if (entry.snapshot != null) {
                return false;
            }
            index(snapshot);
            entry.snapshot = snapshot;
            entry.publishedHealth = publishedHealth;
            entry.publishedVersion = publishedHealth == snapshot.health() ? snapshot.version() : -1;
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    public Optional<TargetSnapshot> get(String targetKey) {
        Entry entry = targets.get(targetKey);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.snapshot);
    }

    /** Current snapshots of every target feeding the service. */
    public List<TargetSnapshot> membersOf(String serviceName) {
        return membersByService.getOrDefault(serviceName, Set.of()).stream()
                .map(targets::get)
                .filter(Objects::nonNull)
                .map(e -> e.snapshot)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(TargetSnapshot::key))
                .toList();
    }

    public List<TargetSnapshot> snapshots() {
        return targets.values().stream()
                .map(e -> e.snapshot)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(TargetSnapshot::key))
                .toList();
    }

    /** Every service name referenced by at least one target. */
    public Collection<String> serviceNames() {
        return List.copyOf(membersByService.keySet());
    }

    /**
     * Claims the target for publication if its newest snapshot has not been published yet and
     * no other thread is publishing it.
     */
    public Optional<TargetPublication> claimPublication(String targetKey) {
        Entry entry = targets.get(targetKey);
        if (entry == null) {
            return Optional.empty();
        }
        entry.lock.lock();
        try {
            TargetSnapshot snapshot = entry.snapshot;
            if (entry.publishing || snapshot == null || snapshot.version() <= entry.publishedVersion) {
                return Optional.empty();
            }
            entry.publishing = true;
            return Optional.of(new TargetPublication(snapshot, entry.publishedHealth));
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Releases a claim. On success the published version and health advance to the snapshot
     * that was sent.
     */
    public void completePublication(TargetSnapshot sent, boolean success) {
        Entry entry = targets.get(sent.key());
        if (entry == null) {
            return;
        }
        entry.lock.lock();
        try {
            entry.publishing = false;
            if (success && sent.version() > entry.publishedVersion) {
                entry.publishedVersion = sent.version();
                entry.publishedHealth = sent.health();
            }
        } finally {
            entry.lock.unlock();
        }
    }

    /** True when the newest snapshot of the target has not been confirmed by the backend. */
    public boolean hasPendingPublication(String targetKey) {
        Entry entry = targets.get(targetKey);
        if (entry == null) {
            return false;
        }
        entry.lock.lock();
        try {
            return entry.snapshot != null && entry.snapshot.version() > entry.publishedVersion;
        } finally {
            entry.lock.unlock();
        }
    }

    private void index(TargetSnapshot snapshot) {
        for (String service : snapshot.serviceNames()) {
            membersByService.computeIfAbsent(service, k -> ConcurrentHashMap.newKeySet())
                    .add(snapshot.key());
        }
    }

    private static final class Entry {

        private final ReentrantLock lock = new ReentrantLock();
        private volatile TargetSnapshot snapshot;

        // guarded by lock
        private long publishedVersion = -1;
        private TargetHealth publishedHealth;
        private boolean publishing;
    }
}
