package com.tokenvest.api.pool;

import com.tokenvest.api.error.ApiErrors;
import com.tokenvest.api.error.ApiErrors.ErrorResponse;
import com.tokenvest.core.error.VestingException;
import com.tokenvest.core.ledger.DistributionLedger;
import com.tokenvest.core.ledger.Pool;
import com.tokenvest.core.ledger.PoolLabel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

import static com.tokenvest.api.vesting.VestingController.CALLER_HEADER;

@RestController
@RequestMapping("/api/v1/pools")
public class PoolController {

    private final DistributionLedger distributionLedger;

    public PoolController(DistributionLedger distributionLedger) {
        this.distributionLedger = distributionLedger;
    }

    @GetMapping
    public ResponseEntity<List<PoolResponse>> getPools() {
        return ResponseEntity.ok(distributionLedger.getPools().stream().map(PoolResponse::from).toList());
    }

    @GetMapping("/{pool}")
    public ResponseEntity<PoolResponse> getPool(@PathVariable String pool) {
        return ResponseEntity.ok(PoolResponse.from(distributionLedger.getPool(PoolLabel.fromLabel(pool))));
    }

    @PostMapping("/{pool}/distributions")
    public ResponseEntity<PoolResponse> distribute(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String pool,
            @Valid @RequestBody TransferRequest request) {
        PoolLabel label = PoolLabel.fromLabel(pool);
        distributionLedger.distribute(caller, label, request.amount(), request.to());
        return ResponseEntity.ok(PoolResponse.from(distributionLedger.getPool(label)));
    }

    @PostMapping("/{pool}/swaps")
    public ResponseEntity<PoolResponse> swap(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String pool,
            @Valid @RequestBody TransferRequest request) {
        PoolLabel label = PoolLabel.fromLabel(pool);
        distributionLedger.swap(caller, label, request.to(), request.amount());
        return ResponseEntity.ok(PoolResponse.from(distributionLedger.getPool(label)));
    }

    @PostMapping("/{pool}/liquidity")
    public ResponseEntity<List<PoolResponse>> transferLiquidity(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String pool,
            @Valid @RequestBody LiquidityRequest request) {
        PoolLabel label = PoolLabel.fromLabel(pool);
        distributionLedger.transferLiquidity(caller, label, request.amount());
        return ResponseEntity.ok(List.of(
                PoolResponse.from(distributionLedger.getPool(label)),
                PoolResponse.from(distributionLedger.getPool(DistributionLedger.RESERVE_POOL))));
    }

    @GetMapping("/summary")
    public ResponseEntity<SupplyResponse> getSummary() {
        return ResponseEntity.ok(new SupplyResponse(distributionLedger.getAddress(),
                distributionLedger.getTotalSupply(), distributionLedger.getTotalCapacity()));
    }

    @ExceptionHandler(VestingException.class)
    public ResponseEntity<ErrorResponse> handleVesting(VestingException e) {
        return ApiErrors.toResponse(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        return ApiErrors.toResponse(e);
    }

    public record TransferRequest(@NotBlank String to, @NotNull @Positive BigInteger amount) {}

    public record LiquidityRequest(@NotNull @Positive BigInteger amount) {}

    public record PoolResponse(String label, BigInteger authorizedCapacity, BigInteger usedAmount,
                               BigInteger availableCapacity, boolean exhausted) {
        static PoolResponse from(Pool pool) {
            return new PoolResponse(pool.label().label(), pool.authorizedCapacity(), pool.usedAmount(),
                    pool.availableCapacity(), pool.isExhausted());
        }
    }

    public record SupplyResponse(String ledgerAddress, BigInteger totalSupply, BigInteger totalCapacity) {}
}
