package com.nepsegateway.marketgateway.validation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nepsegateway.marketgateway.config.SnapshotProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Read side of the symbol snapshot file. Loaded once, on first use, and kept for the life of the
 * process; a rewritten file is only picked up after a restart.
 *
 * <p>A missing or unreadable file yields an empty snapshot rather than a failure, so validation
 * degrades to "unknown symbol" instead of taking the gateway down.
 */
@Component
@Slf4j
public class StockSnapshotStore {
  private static final TypeReference<LinkedHashMap<String, StockRecord>> SNAPSHOT_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final Path path;

  private volatile Map<String, StockRecord> stocks;

  public StockSnapshotStore(ObjectMapper objectMapper, SnapshotProperties properties) {
    this.objectMapper = objectMapper;
    this.path = Path.of(properties.path());
  }

  /** Symbol to record, upper-cased keys, in file order. */
  public Map<String, StockRecord> stocks() {
    Map<String, StockRecord> loaded = stocks;
    if (loaded != null) {
      return loaded;
    }
    synchronized (this) {
      if (stocks == null) {
        stocks = load();
      }
      return stocks;
    }
  }

  public Path path() {
    return path;
  }

  private Map<String, StockRecord> load() {
    if (!Files.exists(path)) {
      log.warn("Symbol snapshot {} not found; validation starts empty", path.toAbsolutePath());
      return Map.of();
    }
    try {
      LinkedHashMap<String, StockRecord> raw =
          objectMapper.readValue(path.toFile(), SNAPSHOT_TYPE);
      Map<String, StockRecord> canonical = new LinkedHashMap<>();
      raw.forEach(
          (symbol, info) -> {
            if (symbol != null && !symbol.isBlank() && info != null) {
              canonical.put(symbol.trim().toUpperCase(Locale.ROOT), info);
            }
          });
      log.info("Loaded {} symbols from {}", canonical.size(), path);
      return Collections.unmodifiableMap(canonical);
    } catch (IOException ex) {
      log.warn("Symbol snapshot {} could not be parsed: {}", path, ex.getMessage());
      return Map.of();
    }
  }
}
