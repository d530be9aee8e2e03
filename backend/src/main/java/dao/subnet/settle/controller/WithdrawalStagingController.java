package dao.subnet.settle.controller;

import dao.subnet.settle.integration.InMemoryWithdrawalQueue;
import dao.subnet.settle.model.WithdrawalIntent;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Stages a subnet's withdrawal queue for a block when no execution layer is wired in.
 */
@Validated
@RestController
@RequestMapping("/api/withdrawals")
@ConditionalOnProperty(prefix = "execution-layer", name = "mode", havingValue = "in-memory", matchIfMissing = true)
public class WithdrawalStagingController {

    private final InMemoryWithdrawalQueue withdrawalQueue;

    public WithdrawalStagingController(InMemoryWithdrawalQueue withdrawalQueue) {
        this.withdrawalQueue = withdrawalQueue;
    }

    @PostMapping("/{subnetId}/{blockNumber}")
    public ResponseEntity<Void> stage(@PathVariable String subnetId,
                                      @PathVariable long blockNumber,
                                      @RequestBody List<@Valid WithdrawalIntent> withdrawals) {
        withdrawalQueue.stage(subnetId, blockNumber, withdrawals);
        return ResponseEntity.accepted().build();
    }
}
