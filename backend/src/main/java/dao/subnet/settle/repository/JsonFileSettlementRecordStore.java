package dao.subnet.settle.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.model.SettlementKey;
import dao.subnet.settle.model.SettlementRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settlement log persisted as a JSON array so replay protection survives restarts.
 * Every write rewrites the file through a temp file and an atomic move.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "settlement.store", name = "type", havingValue = "file")
public class JsonFileSettlementRecordStore implements SettlementRecordStore {

    private static final TypeReference<List<SettlementRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Map<SettlementKey, SettlementRecord> records = new LinkedHashMap<>();

    @Autowired
    public JsonFileSettlementRecordStore(SettlementProperties props, ObjectMapper objectMapper) {
        this(Paths.get(props.getStore().getPath()), objectMapper);
    }

    public JsonFileSettlementRecordStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public synchronized Optional<SettlementRecord> get(SettlementKey key) {
        SettlementRecord r = records.get(key);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public synchronized void put(SettlementRecord record) {
        SettlementKey key = record.key();
        SettlementRecord previous = records.get(key);
        SettlementRecordStore.checkWritable(previous, record);
        records.put(key, record.copy());
        try {
            flush();
        } catch (IOException e) {
            if (previous == null) records.remove(key);
            else records.put(key, previous);
            log.error("Failed to persist settlement {} to {}", key, path, e);
            throw new IllegalStateException("Settlement log write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<SettlementRecord> scanBySubnet(String subnetId) {
        List<SettlementRecord> out = new ArrayList<>();
        for (SettlementRecord r : records.values()) {
            if (r.getSubnetId().equals(subnetId)) out.add(r.copy());
        }
        out.sort(Comparator.comparingLong(SettlementRecord::getBlockNumber));
        return out;
    }

    @Override
    public synchronized List<SettlementRecord> findAll() {
        List<SettlementRecord> out = new ArrayList<>();
        for (SettlementRecord r : records.values()) out.add(r.copy());
        return out;
    }

    private void load() {
        if (!Files.exists(path)) {
            log.info("Settlement log {} does not exist yet, starting empty", path);
            return;
        }
        try {
            List<SettlementRecord> loaded = objectMapper.readValue(path.toFile(), RECORD_LIST);
            for (SettlementRecord r : loaded) {
                records.put(r.key(), r);
            }
            log.info("Loaded {} settlement record(s) from {}", records.size(), path);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read settlement log " + path + ": " + e.getMessage(), e);
        }
    }

    private void flush() throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new ArrayList<>(records.values()));
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
