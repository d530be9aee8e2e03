package dao.subnet.settle.controller;

import dao.subnet.settle.config.SchedulerProperties;
import dao.subnet.settle.integration.CommitmentEventQueue;
import dao.subnet.settle.model.CommitmentEvent;
import dao.subnet.settle.scheduler.CommitmentEventWorker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CommitmentControllerTest {

    private static final String BODY = "{\"subnet_id\": \"" + "ab".repeat(32) + "\", \"block_number\": 7, \"state_root\": \"0x01\"}";

    private CommitmentEventQueue queue;
    private CommitmentEventWorker worker;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        SchedulerProperties props = new SchedulerProperties();
        props.getCommitments().setQueueCapacity(1);
        queue = new CommitmentEventQueue(props);
        worker = mock(CommitmentEventWorker.class);
        mvc = MockMvcBuilders.standaloneSetup(new CommitmentController(queue, worker)).build();
    }

    @Test
    @DisplayName("Commitment is queued and acknowledged with 202, then 503 once the queue is full")
    void testSubmitCommitment() throws Exception {
        mvc.perform(post("/api/commitments").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted());
        mvc.perform(post("/api/commitments").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable());

        CommitmentEvent queued = queue.poll();
        assertEquals("ab".repeat(32), queued.subnetId());
        assertEquals(7L, queued.blockNumber());
    }

    @Test
    @DisplayName("Commitment without a block number is rejected")
    void testInvalidCommitment() throws Exception {
        mvc.perform(post("/api/commitments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subnet_id\": \"" + "ab".repeat(32) + "\"}"))
                .andExpect(status().isBadRequest());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Resume clears a halt")
    void testResume() throws Exception {
        when(worker.isHalted()).thenReturn(true);

        mvc.perform(post("/api/commitments/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.wasHalted").value(true))
                .andExpect(jsonPath("$.queued").value(0));

        verify(worker).resume();
    }
}
