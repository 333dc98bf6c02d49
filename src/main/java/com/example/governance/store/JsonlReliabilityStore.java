package com.example.governance.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Appends each row as one JSON line to {@code <directory>/<table>.jsonl}.
 *
 * <p>Writes to the same table are serialized; different tables never block each other.
 * Free-text fields are clipped before encoding.</p>
 */
public final class JsonlReliabilityStore implements ReliabilityStore {

    public static final String RECOVERY_ATTEMPTS = "recovery_attempts";
    public static final String RECOVERY_STRATEGIES = "recovery_strategies";
    public static final String DEGRADATION_EVENTS = "degradation_events";
    public static final String COORDINATION_EVENTS = "coordination_events";
    public static final String COORDINATION_SESSIONS = "recovery_coordination_sessions";

    private final ObjectMapper om;
    private final Path directory;
    private final int maxTextChars;
    private final ConcurrentHashMap<String, Object> tableLocks = new ConcurrentHashMap<>();

    public JsonlReliabilityStore(ObjectMapper om, StoreProperties props) {
        this.om = om;
        this.directory = Path.of(props.getDirectory());
        this.maxTextChars = Math.max(32, props.getMaxTextChars());
    }

    @Override
    public void appendRecoveryAttempt(RecoveryAttemptRow row) {
        RecoveryAttemptRow safe = row;
        if (row.resultData() != null) {
            RecoveryAttemptRow.ResultData r = row.resultData();
            List<String> effects = new ArrayList<>(r.sideEffects().size());
            for (String s : r.sideEffects()) {
                effects.add(clip(s));
            }
            safe = new RecoveryAttemptRow(row.attemptId(), row.errorId(), row.agentId(), row.strategyId(),
                    row.startedAt(), row.completedAt(), row.status(),
                    new RecoveryAttemptRow.ResultData(r.success(), r.errorResolved(), r.rollbackRequired(),
                            r.durationMs(), r.actionsExecuted(), effects, clip(r.error())));
        }
        append(RECOVERY_ATTEMPTS, safe);
    }

    @Override
    public void appendRecoveryStrategy(RecoveryStrategyRow row) {
        append(RECOVERY_STRATEGIES, row);
    }

    @Override
    public void appendDegradationEvent(DegradationEventRow row) {
        append(DEGRADATION_EVENTS, row);
    }

    @Override
    public void appendCoordinationEvent(CoordinationEventRow row) {
        append(COORDINATION_EVENTS, row);
    }

    @Override
    public void appendCoordinationSession(CoordinationSessionRow row) {
        append(COORDINATION_SESSIONS, row);
    }

    Path pathFor(String table) {
        return directory.resolve(table + ".jsonl");
    }

    private void append(String table, Object row) {
        if (row == null) {
            return;
        }
        String line;
        try {
            line = om.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new ReliabilityStoreException("failed to encode " + table + " row", e);
        }
        Object lock = tableLocks.computeIfAbsent(table, k -> new Object());
        synchronized (lock) {
            try {
                Files.createDirectories(directory);
                try (BufferedWriter w = Files.newBufferedWriter(
                        pathFor(table),
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.APPEND)) {
                    w.write(line);
                    w.newLine();
                }
            } catch (IOException e) {
                throw new ReliabilityStoreException("failed to append " + table + " row", e);
            }
        }
    }

    private String clip(String s) {
        if (s == null || s.length() <= maxTextChars) {
            return s;
        }
        return s.substring(0, maxTextChars);
    }
}
