package com.tokenvest.core.event;

import com.tokenvest.core.event.VestingEventLog.EventEntry;
import com.tokenvest.core.event.VestingEventLog.EventType;
import com.tokenvest.core.event.VestingEventLog.VerificationResult;
import com.tokenvest.core.event.VestingEventLog.VestingEvent;
import com.tokenvest.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VestingEventLogTest {

    private MutableClock clock;
    private VestingEventLog eventLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        eventLog = new VestingEventLog(clock);
    }

    @Test
    void entriesAreHashChained() {
        EventEntry first = eventLog.append(claimed("0xalice", 10));
        clock.advance(Duration.ofMinutes(1));
        EventEntry second = eventLog.append(claimed("0xbob", 20));

        assertThat(first.previousHash()).isEqualTo(VestingEventLog.GENESIS_HASH);
        assertThat(second.previousHash()).isEqualTo(first.entryHash());
        assertThat(second.sequenceNumber()).isEqualTo(1);
        assertThat(eventLog.getLastHash()).isEqualTo(second.entryHash());
        assertThat(eventLog.verifyIntegrity().valid()).isTrue();
    }

    @Test
    void emptyLogVerifies() {
        VerificationResult result = eventLog.verifyIntegrity();

        assertThat(result.valid()).isTrue();
        assertThat(result.entriesVerified()).isZero();
    }

    @Test
    void tamperedDetailsAreDetected() {
        eventLog.append(claimed("0xalice", 10));
        EventEntry original = eventLog.append(claimed("0xbob", 20));
        eventLog.append(claimed("0xcarol", 30));

        EventEntry forged = new EventEntry(original.id(), original.sequenceNumber(),
                claimed("0xbob", 20_000), original.timestamp(), original.previousHash(), original.entryHash());
        eventLog.replaceEntry(1, forged);

        VerificationResult result = eventLog.verifyIntegrity();
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).anyMatch(error -> error.contains("index 1"));
    }

    @Test
    void listenersSeeCommittedEntriesAndCannotBreakTheLog() {
        List<EventEntry> seen = new ArrayList<>();
        eventLog.subscribe(seen::add);
        eventLog.subscribe(entry -> {
            throw new IllegalStateException("indexer down");
        });

        eventLog.append(claimed("0xalice", 10));

        assertThat(seen).hasSize(1);
        assertThat(eventLog.size()).isEqualTo(1);
    }

    @Test
    void filtersByTypeAndRecency() {
        eventLog.append(claimed("0xalice", 10));
        eventLog.append(VestingEvent.of(EventType.REVOKED).with("beneficiary", "0xalice").build());
        eventLog.append(claimed("0xbob", 5));

        assertThat(eventLog.getEntries(EventType.CLAIMED)).hasSize(2);
        assertThat(eventLog.getLatestEntries(2)).extracting(e -> e.event().type())
                .containsExactly(EventType.REVOKED, EventType.CLAIMED);
        assertThat(eventLog.getLatestEntries(10)).hasSize(3);
    }

    private static VestingEvent claimed(String beneficiary, long amount) {
        return VestingEvent.of(EventType.CLAIMED)
                .with("beneficiary", beneficiary)
                .with("planId", 0)
                .with("amount", amount)
                .build();
    }
}
