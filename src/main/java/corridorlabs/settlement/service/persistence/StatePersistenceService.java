package corridorlabs.settlement.service.persistence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import corridorlabs.settlement.state.SettlementStateRepository;
import corridorlabs.settlement.state.StateSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Optional JSON snapshot of the engine state on local disk.
 * Loaded once at start-up, rewritten on a fixed delay whenever the state changed, and on shutdown.
 */
@Service
@Slf4j
public class StatePersistenceService {

    private final SettlementStateRepository state;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Value("${settlement.persistence.enabled:false}")
    private boolean persistenceEnabled;

    @Value("${settlement.persistence.file-path:./data/settlement-state.json}")
    private String persistenceFilePath;

    private long persistedVersion = -1;

    public StatePersistenceService(SettlementStateRepository state) {
        this.state = state;
    }

    @PostConstruct
    public void loadSnapshot() {
        if (!persistenceEnabled) {
            return;
        }
        Path path = Path.of(persistenceFilePath);
        if (!Files.exists(path)) {
            log.info("No settlement snapshot at {}, starting empty", persistenceFilePath);
            return;
        }
        try {
            StateSnapshot snapshot = objectMapper.readValue(path.toFile(), StateSnapshot.class);
            state.restore(snapshot);
            persistedVersion = state.version();
        } catch (IOException ex) {
            // intent ids must never restart from 1 over existing data
            throw new IllegalStateException("Failed to load settlement snapshot from " + persistenceFilePath, ex);
        }
    }

    @Scheduled(fixedDelayString = "${settlement.persistence.flush-interval-ms:5000}")
    public void flushIfDirty() {
        if (!persistenceEnabled) {
            return;
        }
        long current = state.version();
        if (current == persistedVersion) {
            return;
        }
        if (writeSnapshot()) {
            persistedVersion = current;
        }
    }

    @PreDestroy
    public void flushOnShutdown() {
        flushIfDirty();
    }

    boolean writeSnapshot() {
        Path path = Path.of(persistenceFilePath);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), state.snapshot());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (IOException ex) {
            log.warn("Failed to persist settlement snapshot to {}: {}", persistenceFilePath, ex.getMessage());
            return false;
        }
    }
}
