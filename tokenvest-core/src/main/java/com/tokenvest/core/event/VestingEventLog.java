package com.tokenvest.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only, hash-chained log of committed vesting and distribution events.
 * Off-chain indexers read it as the audit trail; entries are only appended when the
 * enclosing operation commits.
 */
public class VestingEventLog {

    private static final Logger log = LoggerFactory.getLogger(VestingEventLog.class);

    static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    private final List<EventEntry> entries = new CopyOnWriteArrayList<>();
    private final List<Consumer<EventEntry>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private volatile String lastHash = GENESIS_HASH;

    public VestingEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Appends a committed event and notifies listeners.
     */
    public synchronized EventEntry append(VestingEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");

        String previousHash = lastHash;
        long sequenceNumber = entries.size();
        Instant timestamp = clock.instant();
        String entryHash = computeEntryHash(sequenceNumber, previousHash, event, timestamp);

        EventEntry entry = new EventEntry(
                UUID.randomUUID().toString(),
                sequenceNumber,
                event,
                timestamp,
                previousHash,
                entryHash
        );
        entries.add(entry);
        lastHash = entryHash;

        for (Consumer<EventEntry> listener : listeners) {
            try {
                listener.accept(entry);
            } catch (RuntimeException e) {
                // the entry is committed; a failing indexer must not undo it
                log.error("Event listener failed for entry {} ({})", sequenceNumber, event.type(), e);
            }
        }
        return entry;
    }

    public void subscribe(Consumer<EventEntry> listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public List<EventEntry> getEntries() {
        return new ArrayList<>(entries);
    }

    public List<EventEntry> getEntries(EventType type) {
        return entries.stream()
                .filter(e -> e.event().type() == type)
                .toList();
    }

    public List<EventEntry> getLatestEntries(int count) {
        int size = entries.size();
        int start = Math.max(0, size - Math.max(0, count));
        return new ArrayList<>(entries.subList(start, size));
    }

    /**
     * Re-walks the hash chain and reports every broken link.
     */
    public VerificationResult verifyIntegrity() {
        List<String> errors = new ArrayList<>();
        String expectedPrevHash = GENESIS_HASH;
        List<EventEntry> snapshot = getEntries();

        for (int i = 0; i < snapshot.size(); i++) {
            EventEntry entry = snapshot.get(i);
            if (entry.sequenceNumber() != i) {
                errors.add("Sequence number mismatch at index " + i);
            }
            if (!entry.previousHash().equals(expectedPrevHash)) {
                errors.add("Previous hash mismatch at index " + i);
            }
            String computedHash = computeEntryHash(
                    entry.sequenceNumber(), entry.previousHash(), entry.event(), entry.timestamp());
            if (!entry.entryHash().equals(computedHash)) {
                errors.add("Entry hash mismatch at index " + i + " - possible tampering");
            }
            expectedPrevHash = entry.entryHash();
        }
        return new VerificationResult(errors.isEmpty(), errors, snapshot.size());
    }

    public int size() {
        return entries.size();
    }

    public String getLastHash() {
        return lastHash;
    }

    /**
     * Replaces an entry in place. Only used to exercise tamper detection.
     */
    void replaceEntry(int index, EventEntry entry) {
        entries.set(index, entry);
    }

    private static String computeEntryHash(long sequenceNumber, String previousHash,
                                           VestingEvent event, Instant timestamp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String data = sequenceNumber + "|" + previousHash + "|"
                    + event.type() + "|" + new TreeMap<>(event.details()) + "|"
                    + timestamp.toEpochMilli();
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Event kinds emitted at commit points.
     */
    public enum EventType {
        PLAN_CREATED,
        TRIGGER_TIME_SET,
        GRANT_CREATED,
        CLAIMED,
        REVOKED,
        DEBT_WRITTEN_OFF,
        PLAN_DEBT_WRITTEN_OFF,
        DISBURSED,
        SWAPPED,
        LIQUIDITY_REALLOCATED
    }

    /**
     * An emitted event with string-valued details.
     */
    public record VestingEvent(EventType type, Map<String, String> details) {
        public VestingEvent {
            Objects.requireNonNull(type, "Type cannot be null");
            details = details != null ? Map.copyOf(details) : Map.of();
        }

        public static Builder of(EventType type) {
            return new Builder(type);
        }

        public String detail(String key) {
            return details.get(key);
        }

        public static final class Builder {
            private final EventType type;
            private final Map<String, String> details = new LinkedHashMap<>();

            private Builder(EventType type) {
                this.type = type;
            }

            public Builder with(String key, Object value) {
                details.put(key, String.valueOf(value));
                return this;
            }

            public VestingEvent build() {
                return new VestingEvent(type, details);
            }
        }
    }

    public record EventEntry(
            String id,
            long sequenceNumber,
            VestingEvent event,
            Instant timestamp,
            String previousHash,
            String entryHash
    ) {
        public EventEntry {
            Objects.requireNonNull(id, "ID cannot be null");
            Objects.requireNonNull(event, "Event cannot be null");
            Objects.requireNonNull(timestamp, "Timestamp cannot be null");
            Objects.requireNonNull(previousHash, "Previous hash cannot be null");
            Objects.requireNonNull(entryHash, "Entry hash cannot be null");
        }
    }

    public record VerificationResult(boolean valid, List<String> errors, int entriesVerified) {
        public VerificationResult {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }
    }
}
