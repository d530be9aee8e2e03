package dao.subnet.settle.controller;

import dao.subnet.settle.integration.CommitmentEventQueue;
import dao.subnet.settle.model.CommitmentEvent;
import dao.subnet.settle.scheduler.CommitmentEventWorker;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/commitments")
public class CommitmentController {

    private final CommitmentEventQueue eventQueue;
    private final CommitmentEventWorker worker;

    public CommitmentController(CommitmentEventQueue eventQueue, CommitmentEventWorker worker) {
        this.eventQueue = eventQueue;
        this.worker = worker;
    }

    @PostMapping
    public ResponseEntity<Void> submitCommitment(@Valid @RequestBody CommitmentEvent event) {
        if (!eventQueue.offer(event)) {
            log.warn("Commitment queue full, rejecting subnet={} block={}", event.subnetId(), event.blockNumber());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.accepted().build();
    }

    /**
     * POST /api/commitments/resume
     * Clears a halt after an operator has dealt with its cause.
     */
    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("wasHalted", worker.isHalted());
        worker.resume();
        response.put("status", "SUCCESS");
        response.put("queued", eventQueue.getPendingCount());
        return ResponseEntity.ok(response);
    }
}
