package com.tokenvest.api.event;

import com.tokenvest.api.error.ApiErrors;
import com.tokenvest.api.error.ApiErrors.ErrorResponse;
import com.tokenvest.core.error.ValidationException;
import com.tokenvest.core.error.VestingException;
import com.tokenvest.core.event.VestingEventLog;
import com.tokenvest.core.event.VestingEventLog.EventEntry;
import com.tokenvest.core.event.VestingEventLog.EventType;
import com.tokenvest.core.event.VestingEventLog.VerificationResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read access to the committed event history.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final VestingEventLog eventLog;

    public EventController(VestingEventLog eventLog) {
        this.eventLog = eventLog;
    }

    @GetMapping
    public ResponseEntity<List<EventResponse>> getEvents(
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "100") int limit) {
        if (limit <= 0) {
            throw new ValidationException("Limit must be positive");
        }
        List<EventEntry> entries = type == null
                ? eventLog.getLatestEntries(limit)
                : latest(eventLog.getEntries(parseType(type)), limit);
        return ResponseEntity.ok(entries.stream().map(EventResponse::from).toList());
    }

    @GetMapping("/verify")
    public ResponseEntity<VerificationResult> verify() {
        return ResponseEntity.ok(eventLog.verifyIntegrity());
    }

    private static List<EventEntry> latest(List<EventEntry> entries, int limit) {
        return entries.subList(Math.max(0, entries.size() - limit), entries.size());
    }

    private static EventType parseType(String type) {
        try {
            return EventType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown event type: " + type);
        }
    }

    @ExceptionHandler(VestingException.class)
    public ResponseEntity<ErrorResponse> handleVesting(VestingException e) {
        return ApiErrors.toResponse(e);
    }

    public record EventResponse(long sequenceNumber, String type, Map<String, String> details,
                                Instant timestamp, String entryHash) {
        static EventResponse from(EventEntry entry) {
            return new EventResponse(entry.sequenceNumber(), entry.event().type().name(),
                    entry.event().details(), entry.timestamp(), entry.entryHash());
        }
    }
}
