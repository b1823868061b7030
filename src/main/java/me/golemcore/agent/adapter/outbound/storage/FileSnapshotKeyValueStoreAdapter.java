package me.golemcore.agent.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.infrastructure.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * In-memory store that survives restarts by writing a JSON snapshot of its
 * whole contents after every write.
 *
 * <p>
 * The snapshot is written to a {@code .tmp} sibling with fsync, verified,
 * optionally backed up to {@code .bak} and atomically moved over the target.
 * The file is loaded once on startup; an unreadable snapshot stops startup
 * instead of silently starting empty. Active when {@code agent.storage.type}
 * is {@code file}.
 */
@Component
@ConditionalOnProperty(prefix = "agent.storage", name = "type", havingValue = "file")
@Slf4j
public class FileSnapshotKeyValueStoreAdapter extends InMemoryKeyValueStoreAdapter {

    private final ObjectMapper objectMapper;
    private final AgentProperties.StorageProperties storage;
    private Path snapshotPath;

    public FileSnapshotKeyValueStoreAdapter(ObjectMapper objectMapper, AgentProperties properties) {
        this.objectMapper = objectMapper;
        this.storage = properties.getStorage();
    }

    @PostConstruct
    public void init() {
        this.snapshotPath = Paths.get(storage.getPath().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Path parent = snapshotPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create store directory for " + snapshotPath, e);
        }
        if (!Files.exists(snapshotPath)) {
            log.info("[Store] No snapshot at {}, starting empty", snapshotPath);
            return;
        }
        StoreSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(snapshotPath.toFile(), StoreSnapshot.class);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable store snapshot: " + snapshotPath, e);
        }
        if (snapshot == null) {
            throw new IllegalStateException("Empty store snapshot: " + snapshotPath);
        }
        restore(snapshot);
        log.info("[Store] Loaded snapshot from {}", snapshotPath);
    }

    Path getSnapshotPath() {
        return snapshotPath;
    }

    @Override
    protected void afterWrite() {
        if (snapshotPath != null) {
            persist();
        }
    }

    /**
     * Writes the current contents atomically. The snapshot is taken inside the
     * monitor, so the last completed call always reflects every write that
     * finished before it started.
     */
    synchronized void persist() {
        Path tempPath = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
        Path backupPath = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".bak");
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(snapshot());
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            if (storage.isBackup() && Files.exists(snapshotPath)) {
                Files.copy(snapshotPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
            }

            try {
                Files.move(tempPath, snapshotPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Store] Atomic move not supported, using regular move");
                Files.move(tempPath, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("[Store] Snapshot written ({} bytes)", bytes.length);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Store] Failed to cleanup temp file: {}", tempPath);
            }
            throw new UncheckedIOException("Snapshot write failed: " + snapshotPath, e);
        }
    }
}
