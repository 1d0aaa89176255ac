package com.cronium.engine.store;

import com.cronium.channel.ToolCredential;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ExecutionLog;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link InMemoryStore} that mirrors its contents into a single JSON file,
 * rewritten after every mutation and loaded on construction. A missing or
 * unreadable file starts an empty store.
 */
@Slf4j
public class JsonFileStore extends InMemoryStore {

    static final String VERSION = "1";

    private final Path path;
    private final Object writeLock = new Object();

    /** On-disk layout. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoreFile {
        private String version;
        private Instant savedAt;
        private List<Event> events = new ArrayList<>();
        private List<ExecutionLog> logs = new ArrayList<>();
        private List<ToolCredential> credentials = new ArrayList<>();
        private Map<String, Map<String, String>> variables = new LinkedHashMap<>();
    }

    public JsonFileStore(Path path) {
        this.path = path;
        load();
    }

    public Path getPath() {
        return path;
    }

    private void load() {
        if (!Files.exists(path)) {
            log.debug("Store file not found: {}", path);
            return;
        }
        try {
            String content = Files.readString(path);
            if (content.isBlank())
                return;
            StoreFile file = MAPPER.readValue(content, StoreFile.class);
            if (file.getEvents() != null) {
                for (Event event : file.getEvents()) {
                    if (event.getId() == null)
                        continue;
                    events.put(event.getId(), event);
                    eventIds.accumulateAndGet(event.getId(), Math::max);
                }
            }
            if (file.getLogs() != null) {
                for (ExecutionLog entry : file.getLogs()) {
                    if (entry.getId() == null)
                        continue;
                    logs.put(entry.getId(), entry);
                    logIds.accumulateAndGet(entry.getId(), Math::max);
                }
            }
            if (file.getCredentials() != null) {
                for (ToolCredential credential : file.getCredentials()) {
                    if (credential.getId() == null)
                        continue;
                    credentials.put(credential.getId(), credential);
                    credentialIds.accumulateAndGet(credential.getId(), Math::max);
                }
            }
            if (file.getVariables() != null) {
                file.getVariables().forEach((user, vars) -> variables.put(user, new ConcurrentHashMap<>(vars)));
            }
            log.info("Loaded {} events and {} execution records from {}", events.size(), logs.size(), path);
        } catch (IOException e) {
            log.error("Failed to load store from {}: {}", path, e.getMessage());
        }
    }

    @Override
    protected void onChange() {
        synchronized (writeLock) {
            StoreFile file = new StoreFile(VERSION, Instant.now(),
                    new ArrayList<>(events.values()),
                    new ArrayList<>(logs.values()),
                    new ArrayList<>(credentials.values()),
                    new LinkedHashMap<>(variables));
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null)
                    Files.createDirectories(parent);
                Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
                MAPPER.writer().with(SerializationFeature.INDENT_OUTPUT).writeValue(tmp.toFile(), file);
                try {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                log.error("Failed to persist store to {}: {}", path, e.getMessage());
            }
        }
    }
}
