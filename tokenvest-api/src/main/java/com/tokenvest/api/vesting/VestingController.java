package com.tokenvest.api.vesting;

import com.tokenvest.api.error.ApiErrors;
import com.tokenvest.api.error.ApiErrors.ErrorResponse;
import com.tokenvest.core.error.VestingException;
import com.tokenvest.core.ledger.PoolLabel;
import com.tokenvest.core.vesting.Grant;
import com.tokenvest.core.vesting.HolderStat;
import com.tokenvest.core.vesting.VestingEngine;
import com.tokenvest.core.vesting.VestingPlan;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/vesting")
public class VestingController {

    public static final String CALLER_HEADER = "X-Account-Address";

    private final VestingEngine vestingEngine;

    public VestingController(VestingEngine vestingEngine) {
        this.vestingEngine = vestingEngine;
    }

    @PostMapping("/plans")
    public ResponseEntity<PlanResponse> createPlan(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody CreatePlanRequest request) {
        VestingPlan plan = vestingEngine.createPlan(caller,
                request.startDate(),
                Duration.ofSeconds(request.cliffSeconds()),
                Duration.ofSeconds(request.durationSeconds()),
                request.revocable(),
                request.initialReleaseBps(),
                PoolLabel.fromLabel(request.pool()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(plan));
    }

    @GetMapping("/plans")
    public ResponseEntity<List<PlanResponse>> getPlans() {
        return ResponseEntity.ok(vestingEngine.getPlans().stream().map(this::toResponse).toList());
    }

    @GetMapping("/plans/{planId}")
    public ResponseEntity<PlanResponse> getPlan(@PathVariable long planId) {
        return vestingEngine.getPlan(planId)
                .map(this::toResponse)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/plans/{planId}/trigger-time")
    public ResponseEntity<PlanResponse> setTriggerTime(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable long planId,
            @Valid @RequestBody TriggerTimeRequest request) {
        vestingEngine.setTriggerTime(caller, planId, request.triggerTime());
        return getPlan(planId);
    }

    @PostMapping("/plans/{planId}/grants")
    public ResponseEntity<GrantResponse> issueGrant(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable long planId,
            @Valid @RequestBody IssueGrantRequest request) {
        Grant grant = vestingEngine.issueGrant(caller, request.beneficiary(), request.startDate(),
                request.amount(), planId);
        return ResponseEntity.status(HttpStatus.CREATED).body(GrantResponse.from(planId, grant));
    }

    @GetMapping("/plans/{planId}/grants/{beneficiary}")
    public ResponseEntity<List<GrantResponse>> getGrants(
            @PathVariable long planId,
            @PathVariable String beneficiary) {
        List<GrantResponse> grants = vestingEngine.getGrants(beneficiary, planId).stream()
                .map(grant -> GrantResponse.from(planId, grant))
                .toList();
        return ResponseEntity.ok(grants);
    }

    @GetMapping("/plans/{planId}/grants/{beneficiary}/claimable")
    public ResponseEntity<ClaimResponse> previewClaimable(
            @PathVariable long planId,
            @PathVariable String beneficiary) {
        BigInteger amount = vestingEngine.previewClaimable(beneficiary, planId);
        return ResponseEntity.ok(new ClaimResponse(planId, beneficiary, amount));
    }

    @PostMapping("/plans/{planId}/claims")
    public ResponseEntity<ClaimResponse> claim(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable long planId) {
        BigInteger amount = vestingEngine.claim(caller, planId);
        return ResponseEntity.ok(new ClaimResponse(planId, caller, amount));
    }

    @PostMapping("/plans/{planId}/revocations")
    public ResponseEntity<RevocationResponse> revoke(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable long planId,
            @Valid @RequestBody RevokeRequest request) {
        BigInteger released = vestingEngine.revoke(caller, request.beneficiary(), planId);
        return ResponseEntity.ok(new RevocationResponse(planId, request.beneficiary(), released));
    }

    @PostMapping("/debts")
    public ResponseEntity<HolderResponse> writeOffDebt(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody WriteOffRequest request) {
        vestingEngine.writeOffDebt(caller, request.beneficiary(), request.amount());
        return getHolder(request.beneficiary());
    }

    @GetMapping("/holders/{beneficiary}")
    public ResponseEntity<HolderResponse> getHolder(@PathVariable String beneficiary) {
        HolderStat stat = vestingEngine.getHolderStat(beneficiary);
        return ResponseEntity.ok(new HolderResponse(beneficiary, stat.grantCount(),
                stat.totalGrantedAmount(), stat.totalClaimedAmount(), stat.outstandingAmount()));
    }

    @GetMapping("/summary")
    public ResponseEntity<SummaryResponse> getSummary() {
        return ResponseEntity.ok(new SummaryResponse(vestingEngine.getAddress(),
                vestingEngine.getNextPlanId(), vestingEngine.getTotalVestingAmount()));
    }

    private PlanResponse toResponse(VestingPlan plan) {
        return new PlanResponse(plan.id(), plan.startDate(), plan.cliff().toSeconds(),
                plan.duration().toSeconds(), plan.revocable(), plan.initialReleaseBps(),
                plan.pool().label(), vestingEngine.getTriggerTime(plan.id()).orElse(null));
    }

    @ExceptionHandler(VestingException.class)
    public ResponseEntity<ErrorResponse> handleVesting(VestingException e) {
        return ApiErrors.toResponse(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        return ApiErrors.toResponse(e);
    }

    public record CreatePlanRequest(
            @NotNull Instant startDate,
            @PositiveOrZero long cliffSeconds,
            @Positive long durationSeconds,
            boolean revocable,
            @Min(0) @Max(10_000) int initialReleaseBps,
            @NotBlank String pool) {}

    public record TriggerTimeRequest(@NotNull Instant triggerTime) {}

    public record IssueGrantRequest(
            @NotBlank String beneficiary,
            @NotNull Instant startDate,
            @NotNull @Positive BigInteger amount) {}

    public record RevokeRequest(@NotBlank String beneficiary) {}

    public record WriteOffRequest(@NotBlank String beneficiary, @NotNull @Positive BigInteger amount) {}

    public record PlanResponse(long id, Instant startDate, long cliffSeconds, long durationSeconds,
                               boolean revocable, int initialReleaseBps, String pool, Instant triggerTime) {}

    public record GrantResponse(long planId, String beneficiary, BigInteger totalAmount,
                                BigInteger claimedAmount, Instant startDate) {
        static GrantResponse from(long planId, Grant grant) {
            return new GrantResponse(planId, grant.beneficiary(), grant.totalAmount(),
                    grant.claimedAmount(), grant.startDate());
        }
    }

    public record ClaimResponse(long planId, String beneficiary, BigInteger amount) {}

    public record RevocationResponse(long planId, String beneficiary, BigInteger releasedAmount) {}

    public record HolderResponse(String beneficiary, long grantCount, BigInteger totalGrantedAmount,
                                 BigInteger totalClaimedAmount, BigInteger outstandingAmount) {}

    public record SummaryResponse(String engineAddress, long nextPlanId, BigInteger totalVestingAmount) {}
}
