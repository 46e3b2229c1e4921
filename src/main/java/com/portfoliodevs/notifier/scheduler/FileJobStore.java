package com.portfoliodevs.notifier.scheduler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliodevs.notifier.exception.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checkpoints the pending-job set to a JSON file.
 * <p>
 * The whole set is rewritten on every change through a temp file and a move,
 * so a crash mid-write leaves the previous checkpoint intact.
 */
public class FileJobStore implements JobStore {

    private static final Logger logger = LoggerFactory.getLogger(FileJobStore.class);

    private static final TypeReference<List<PersistedJob>> JOB_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, PersistedJob> jobs = new LinkedHashMap<>();

    public FileJobStore(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public synchronized void save(ScheduledJob job) {
        jobs.put(job.getId(), job.toPersisted());
        try {
            write();
        } catch (JobStoreException e) {
            jobs.remove(job.getId());
            throw e;
        }
    }

    @Override
    public synchronized void remove(String jobId) {
        if (jobs.remove(jobId) != null) {
            write();
        }
    }

    @Override
    public synchronized List<PersistedJob> loadPending() {
        jobs.clear();
        if (!Files.exists(file)) {
            logger.info("No reminder checkpoint at {}, starting empty", file);
            return List.of();
        }
        try {
            List<PersistedJob> loaded = objectMapper.readValue(file.toFile(), JOB_LIST);
            List<PersistedJob> pending = new ArrayList<>();
            for (PersistedJob job : loaded) {
                if (job.state() == JobState.PENDING) {
                    jobs.put(job.id(), job);
                    pending.add(job);
                }
            }
            logger.info("Loaded {} pending reminder(s) from {}", pending.size(), file);
            return pending;
        } catch (IOException e) {
            throw new JobStoreException("Failed to read reminder checkpoint " + file, e);
        }
    }

    private void write() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), new ArrayList<>(jobs.values()));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new JobStoreException("Failed to write reminder checkpoint " + file, e);
        }
    }
}
