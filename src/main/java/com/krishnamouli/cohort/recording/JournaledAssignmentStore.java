package com.krishnamouli.cohort.recording;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.cohort.exception.RecordingException;
import com.krishnamouli.cohort.model.RecordedAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory assignment store with an append-only JSON-lines journal.
 *
 * <p>
 * The in-memory map decides which record wins; only winners are queued for the
 * journal, so each pair is written once. Appends happen on a single background
 * thread to keep disk latency off the request path. The journal is replayed on
 * construction, first line per pair wins, which restores the same records after
 * a restart.
 */
public class JournaledAssignmentStore implements AssignmentStore {
    private static final Logger logger = LoggerFactory.getLogger(JournaledAssignmentStore.class);
    private static final long POLL_INTERVAL_MS = 100;
    private static final int MAX_BATCH = 512;

    private final InMemoryAssignmentStore memory;
    private final Path journalPath;
    private final BlockingQueue<RecordedAssignment> pending;
    private final ExecutorService writer;
    private final ObjectMapper mapper;
    private final AtomicLong journalFailures;
    private volatile boolean running = true;

    public JournaledAssignmentStore(String journalPath, int queueCapacity) {
        this.memory = new InMemoryAssignmentStore();
        this.journalPath = Paths.get(journalPath);
        this.pending = new LinkedBlockingQueue<>(queueCapacity);
        this.mapper = new ObjectMapper();
        this.journalFailures = new AtomicLong(0);

        try {
            Path parent = this.journalPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            logger.warn("Failed to create journal directory for {}", journalPath, e);
        }

        int replayed = replay();
        if (replayed > 0) {
            logger.info("Restored {} recorded assignments from {}", replayed, journalPath);
        }

        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cohort-journal-writer");
            t.setDaemon(true);
            return t;
        });
        writer.submit(this::processQueue);
    }

    @Override
    public RecordedAssignment insertIfAbsent(RecordedAssignment record) {
        RecordedAssignment stored = memory.insertIfAbsent(record);
        if (stored != record) {
            return stored;
        }
        if (!pending.offer(record)) {
            // Not durable, so do not let it become the sticky answer
            memory.removeIfSame(record);
            throw new RecordingException("Journal queue full, dropped record for "
                    + InMemoryAssignmentStore.keyOf(record));
        }
        return record;
    }

    @Override
    public Optional<RecordedAssignment> find(AssignmentKey key) {
        return memory.find(key);
    }

    @Override
    public int size() {
        return memory.size();
    }

    public int pendingWrites() {
        return pending.size();
    }

    public long getJournalFailures() {
        return journalFailures.get();
    }

    /**
     * Stops the writer, then flushes whatever is still queued.
     */
    @Override
    public void shutdown() {
        logger.info("Assignment journal shutting down, {} pending writes", pending.size());
        running = false;
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Journal writer did not stop in time");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        List<RecordedAssignment> remaining = new ArrayList<>();
        pending.drainTo(remaining);
        if (!remaining.isEmpty()) {
            append(remaining);
        }
    }

    private void processQueue() {
        List<RecordedAssignment> batch = new ArrayList<>();
        while (running) {
            try {
                RecordedAssignment first = pending.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                pending.drainTo(batch, MAX_BATCH - 1);
                append(batch);
                batch.clear();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void append(List<RecordedAssignment> batch) {
        try (BufferedWriter out = Files.newBufferedWriter(journalPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (RecordedAssignment record : batch) {
                out.write(mapper.writeValueAsString(record));
                out.newLine();
            }
        } catch (IOException e) {
            journalFailures.addAndGet(batch.size());
            logger.error("Failed to append {} records to journal {}", batch.size(), journalPath, e);
        }
    }

    private int replay() {
        if (!Files.exists(journalPath)) {
            logger.info("No journal found at {}, starting empty", journalPath);
            return 0;
        }

        int loaded = 0;
        int lineNumber = 0;
        try (BufferedReader in = Files.newBufferedReader(journalPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    RecordedAssignment record = mapper.readValue(line, RecordedAssignment.class);
                    if (record == null) {
                        logger.warn("Skipping empty journal record on line {}", lineNumber);
                        continue;
                    }
                    if (memory.insertIfAbsent(record) == record) {
                        loaded++;
                    }
                } catch (IOException | IllegalArgumentException e) {
                    logger.warn("Skipping unreadable journal line {}", lineNumber, e);
                }
            }
        } catch (IOException e) {
            logger.error("Failed to replay journal {}", journalPath, e);
        }
        return loaded;
    }
}
