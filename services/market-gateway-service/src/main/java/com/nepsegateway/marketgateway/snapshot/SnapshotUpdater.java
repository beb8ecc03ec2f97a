package com.nepsegateway.marketgateway.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nepsegateway.marketgateway.client.UpstreamClient;
import com.nepsegateway.marketgateway.client.UpstreamPaths;
import com.nepsegateway.marketgateway.client.UpstreamUnavailableException;
import com.nepsegateway.marketgateway.config.SnapshotProperties;
import com.nepsegateway.marketgateway.config.UpstreamProperties;
import com.nepsegateway.marketgateway.validation.StockRecord;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the symbol snapshot from the upstream security list and sector mapping. The target file
 * is replaced only when every step succeeded.
 */
@Service
@Slf4j
public class SnapshotUpdater {

  static final String UNKNOWN_SECTOR = "Unknown";
  static final String DEFAULT_INTERNAL_SECTOR = "Others Index";

  /** Sector names from the sector mapping, translated to the labels used for index lookups. */
  static final Map<String, String> INTERNAL_SECTORS =
      Map.ofEntries(
          Map.entry("Commercial Banks", "Banking SubIndex"),
          Map.entry("Development Banks", "Development Bank Ind."),
          Map.entry("Finance", "Finance Index"),
          Map.entry("Hotels And Tourism", "Hotels And Tourism"),
          Map.entry("Hydro Power", "HydroPower Index"),
          Map.entry("Investment", "Investment"),
          Map.entry("Life Insurance", "Life Insurance"),
          Map.entry("Manufacturing And Processing", "Manufacturing And Pr."),
          Map.entry("Microfinance", "Microfinance Index"),
          Map.entry("Mutual Fund", "Mutual Fund"),
          Map.entry("NEPSE", "NEPSE Index"),
          Map.entry("Non Life Insurance", "Non Life Insurance"),
          Map.entry("Others", "Others Index"),
          Map.entry("Tradings", "Trading Index"),
          Map.entry("Promoter Share", "Promoter Share"));

  private final UpstreamClient upstreamClient;
  private final ObjectMapper objectMapper;
  private final Path target;
  private final Duration timeout;

  public SnapshotUpdater(
      UpstreamClient upstreamClient,
      ObjectMapper objectMapper,
      SnapshotProperties snapshotProperties,
      UpstreamProperties upstreamProperties) {
    this.upstreamClient = upstreamClient;
    this.objectMapper = objectMapper;
    this.target = Path.of(snapshotProperties.path());
    this.timeout = upstreamProperties.batchTimeout();
  }

  public synchronized boolean update() {
    log.info("Snapshot update: checking upstream health");
    if (!upstreamHealthy()) {
      log.error("Snapshot update aborted: upstream is not healthy, {} left untouched", target);
      return false;
    }
    try {
      log.info("Snapshot update: fetching security list");
      JsonNode securities = upstreamClient.fetch(UpstreamPaths.SECURITY_LIST, timeout);
      log.info("Security list fetched: {} items", securities.size());

      log.info("Snapshot update: fetching sector mapping");
      JsonNode sectors = upstreamClient.fetch(UpstreamPaths.SECTOR_SCRIPS, timeout);
      log.info("Sector mapping fetched: {} sectors", sectors.size());

      Map<String, String> sectorBySymbol = sectorBySymbol(sectors);
      Map<String, StockRecord> snapshot = buildSnapshot(securities, sectorBySymbol);

      log.info("Snapshot update: writing {} symbols to {}", snapshot.size(), target);
      write(snapshot);
      log.info("Snapshot update completed");
      return true;
    } catch (UpstreamUnavailableException | IOException ex) {
      log.error("Snapshot update failed: {}", ex.getMessage(), ex);
      return false;
    }
  }

  private boolean upstreamHealthy() {
    try {
      upstreamClient.fetch(UpstreamPaths.HEALTH, timeout);
      return true;
    } catch (UpstreamUnavailableException ex) {
      log.error("Upstream health check failed: {}", ex.getMessage());
      return false;
    }
  }

  static Map<String, String> sectorBySymbol(JsonNode sectors) {
    Map<String, String> out = new HashMap<>();
    sectors
        .fields()
        .forEachRemaining(
            entry -> {
              if (entry.getValue().isArray()) {
                for (JsonNode symbol : entry.getValue()) {
                  out.put(symbol.asText(), entry.getKey());
                }
              }
            });
    log.info("Symbol to sector index built: {} entries", out.size());
    return out;
  }

  /** Active securities with a textual symbol; everything else is left out. */
  static Map<String, StockRecord> buildSnapshot(
      JsonNode securities, Map<String, String> sectorBySymbol) {
    Map<String, StockRecord> out = new LinkedHashMap<>();
    for (JsonNode security : securities) {
      JsonNode symbolNode = security.path("symbol");
      if (!"A".equals(security.path("activeStatus").asText())
          || !symbolNode.isTextual()
          || symbolNode.asText().isEmpty()) {
        continue;
      }
      String symbol = symbolNode.asText();
      String sector = sectorBySymbol.getOrDefault(symbol, UNKNOWN_SECTOR);
      String name = security.path("securityName").asText(symbol);
      out.put(
          symbol,
          new StockRecord(
              name, sector, INTERNAL_SECTORS.getOrDefault(sector, DEFAULT_INTERNAL_SECTOR)));
    }
    return out;
  }

  private void write(Map<String, StockRecord> snapshot) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
