package io.github.drompincen.sheetbridge.runtime.ai;

import io.github.drompincen.sheetbridge.protocol.api.SchemaProposal;
import io.github.drompincen.sheetbridge.protocol.error.AIProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Calls the configured {@link SchemaAdvisor}, retrying failures with exponential backoff
 * ({@code initialBackoffMs}, doubled after each attempt).
 */
@Service
public class SchemaProposalService {

    private static final Logger log = LoggerFactory.getLogger(SchemaProposalService.class);

    private final SchemaAdvisor advisor;
    private final int maxAttempts;
    private final long initialBackoffMs;

    public SchemaProposalService(SchemaAdvisor advisor,
                                 @Value("${sheetbridge.ai.max-attempts:3}") int maxAttempts,
                                 @Value("${sheetbridge.ai.initial-backoff-ms:1000}") long initialBackoffMs) {
        this.advisor = advisor;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
    }

    public SchemaProposal propose(List<String> columnLabels) {
        if (columnLabels == null || columnLabels.isEmpty()) {
            throw new IllegalArgumentException("At least one column label is required");
        }
        long backoff = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return advisor.propose(columnLabels);
            } catch (RuntimeException e) {
                AIProcessingException failure = e instanceof AIProcessingException ai
                        ? ai : new AIProcessingException("Schema advisor call failed: " + e.getMessage(), e);
                if (attempt >= maxAttempts) {
                    log.error("Schema proposal failed after {} attempts: {}", attempt, failure.getMessage());
                    throw failure;
                }
                log.warn("Schema proposal attempt {}/{} failed: {}; retrying in {} ms",
                        attempt, maxAttempts, failure.getMessage(), backoff);
                sleep(backoff);
                backoff *= 2;
            }
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AIProcessingException("Interrupted while waiting to retry schema proposal", e);
        }
    }
}
