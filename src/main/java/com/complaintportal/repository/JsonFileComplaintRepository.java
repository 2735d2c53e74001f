package com.complaintportal.repository;

import com.complaintportal.model.Complaint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory complaint list mirrored to a single JSON file, rewritten in full after every mutation.
 * <p>
 * The in-memory list is the source of truth for the lifetime of the process: a failed load starts
 * empty and a failed write is only logged.
 */
@Slf4j
@Repository
public class JsonFileComplaintRepository implements ComplaintRepository {

    private static final Comparator<Complaint> NEWEST_FIRST =
            Comparator.comparing(Complaint::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final ObjectMapper objectMapper;
    private final Path dataFile;

    // Guards complaints and the file write
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Complaint> complaints = new ArrayList<>();

    public JsonFileComplaintRepository(ObjectMapper objectMapper,
                                       @Value("${app.data-file:data.json}") String dataFileProp) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.dataFile = Paths.get(dataFileProp);
        loadAll();
    }

    /** Replaces the in-memory list with the file contents; an unreadable file leaves the store empty. */
    public void loadAll() {
        lock.lock();
        try {
            complaints.clear();
            if (!Files.exists(dataFile)) {
                log.info("No data file at {}, starting with an empty store", dataFile.toAbsolutePath());
                return;
            }
            String raw = Files.readString(dataFile);
            if (raw.isBlank()) {
                return;
            }
            JsonNode root = objectMapper.readTree(raw);
            if (!root.isArray()) {
                log.error("Data file {} does not hold a JSON array, starting with an empty store", dataFile);
                return;
            }
            Set<String> seen = new HashSet<>();
            int index = 0;
            for (JsonNode node : root) {
                Complaint c = readRecord(node, index++);
                if (c == null) {
                    continue;
                }
                if (c.getId() == null || !seen.add(c.getId())) {
                    log.warn("Skipping complaint without a unique id in {}", dataFile);
                    continue;
                }
                complaints.add(c);
            }
            log.info("Loaded {} complaints from {}", complaints.size(), dataFile.toAbsolutePath());
        } catch (IOException | RuntimeException e) {
            log.error("Error loading complaints from {}, starting with an empty store", dataFile, e);
            complaints.clear();
        } finally {
            lock.unlock();
        }
    }

    /** One unreadable record, e.g. an unknown status label, is skipped instead of the whole file. */
    private Complaint readRecord(JsonNode node, int index) {
        if (node == null || node.isNull()) {
            log.warn("Skipping empty record #{} in {}", index, dataFile);
            return null;
        }
        try {
            return objectMapper.treeToValue(node, Complaint.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable record #{} in {}: {}", index, dataFile, e.getMessage());
            return null;
        }
    }

    @Override
    public List<Complaint> findAllNewestFirst() {
        lock.lock();
        try {
            List<Complaint> sorted = new ArrayList<>(complaints.size());
            for (Complaint c : complaints) {
                sorted.add(c.copy());
            }
            sorted.sort(NEWEST_FIRST); // List.sort is stable
            return sorted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Complaint> findById(String id) {
        lock.lock();
        try {
            return find(id).map(Complaint::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Complaint append(Complaint complaint) {
        lock.lock();
        try {
            Complaint stored = complaint.copy();
            String id = nextId();
            while (find(id).isPresent()) {
                id = nextId();
            }
            stored.setId(id);
            complaints.add(stored);
            persist();
            return stored.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Complaint> update(String id, Predicate<Complaint> mutation) {
        lock.lock();
        try {
            Optional<Complaint> found = find(id);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            Complaint c = found.get();
            if (mutation.test(c)) {
                persist();
            }
            return Optional.of(c.copy());
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private Optional<Complaint> find(String id) {
        return complaints.stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    // Caller holds the lock
    private void persist() {
        try {
            Path parent = dataFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = dataFile.resolveSibling(dataFile.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), complaints);
            try {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Error saving complaints to {}", dataFile, e);
        }
    }

    // "c_" + base-36 millis + 6 random base-36 chars
    private static String nextId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("c_").append(Long.toString(System.currentTimeMillis(), 36));
        for (int i = 0; i < 6; i++) {
            sb.append(Character.forDigit(random.nextInt(36), 36));
        }
        return sb.toString();
    }
}
