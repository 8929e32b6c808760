package com.tokenvest.api.access;

import com.tokenvest.api.error.ApiErrors;
import com.tokenvest.api.error.ApiErrors.ErrorResponse;
import com.tokenvest.core.access.Role;
import com.tokenvest.core.access.RoleRegistry;
import com.tokenvest.core.error.ValidationException;
import com.tokenvest.core.error.VestingException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Set;

import static com.tokenvest.api.vesting.VestingController.CALLER_HEADER;

/**
 * Role membership and the global pause switch.
 */
@RestController
@RequestMapping("/api/v1/access")
public class AccessController {

    private final RoleRegistry roleRegistry;

    public AccessController(RoleRegistry roleRegistry) {
        this.roleRegistry = roleRegistry;
    }

    @GetMapping("/roles/{role}")
    public ResponseEntity<Set<String>> getMembers(@PathVariable String role) {
        return ResponseEntity.ok(roleRegistry.getMembers(parseRole(role)));
    }

    @PostMapping("/roles/{role}")
    public ResponseEntity<Set<String>> grantRole(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String role,
            @Valid @RequestBody MemberRequest request) {
        Role parsed = parseRole(role);
        roleRegistry.grantRole(caller, parsed, request.account());
        return ResponseEntity.ok(roleRegistry.getMembers(parsed));
    }

    @DeleteMapping("/roles/{role}/{account}")
    public ResponseEntity<Set<String>> revokeRole(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String role,
            @PathVariable String account) {
        Role parsed = parseRole(role);
        roleRegistry.revokeRole(caller, parsed, account);
        return ResponseEntity.ok(roleRegistry.getMembers(parsed));
    }

    @GetMapping("/pause")
    public ResponseEntity<PauseResponse> getPause() {
        return ResponseEntity.ok(new PauseResponse(roleRegistry.isPaused()));
    }

    @PostMapping("/pause")
    public ResponseEntity<PauseResponse> pause(@RequestHeader(CALLER_HEADER) String caller) {
        roleRegistry.pause(caller);
        return getPause();
    }

    @DeleteMapping("/pause")
    public ResponseEntity<PauseResponse> unpause(@RequestHeader(CALLER_HEADER) String caller) {
        roleRegistry.unpause(caller);
        return getPause();
    }

    private static Role parseRole(String role) {
        try {
            return Role.valueOf(role.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown role: " + role);
        }
    }

    @ExceptionHandler(VestingException.class)
    public ResponseEntity<ErrorResponse> handleVesting(VestingException e) {
        return ApiErrors.toResponse(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        return ApiErrors.toResponse(e);
    }

    public record MemberRequest(@NotBlank String account) {}

    public record PauseResponse(boolean paused) {}
}
