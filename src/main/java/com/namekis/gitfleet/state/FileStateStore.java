package com.namekis.gitfleet.state;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.namekis.gitfleet.domain.MachineSnapshot;
import com.namekis.gitfleet.domain.RepoMetadata;

/**
 * YAML files under a home directory:
 *
 * <pre>
 * ~/.config/gitfleet/config.yaml
 * ~/.config/gitfleet/machines/&lt;machine-id&gt;.yaml
 * ~/.config/gitfleet/repos/&lt;repo-key&gt;.yaml
 * ~/.local/state/gitfleet/machine-id
 * ~/.local/state/gitfleet/lock
 * </pre>
 */
public class FileStateStore implements StateStore {
  private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

  private final Path home;
  private final Clock clock;
  private final ObjectMapper yaml;
  private String machineId;

  public FileStateStore(Path home, Clock clock) {
    this.home = home;
    this.clock = clock;
    this.yaml = yamlMapper();
  }

  public static ObjectMapper yamlMapper() {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
    mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    return mapper;
  }

  public Path configRoot() {
    return home.resolve(".config").resolve("gitfleet");
  }

  public Path localStateRoot() {
    return home.resolve(".local").resolve("state").resolve("gitfleet");
  }

  public Path configPath() {
    return configRoot().resolve("config.yaml");
  }

  public Path machinePath(String id) {
    return configRoot().resolve("machines").resolve(id + ".yaml");
  }

  public Path repoMetadataPath(String repoKey) {
    return configRoot().resolve("repos").resolve(repoMetadataFileName(repoKey));
  }

  static String repoMetadataFileName(String repoKey) {
    return repoKey.replace("/", "__").replace(":", "_").replace("\\", "_").replace("?", "_").replace("*", "_") + ".yaml";
  }

  @Override
  public StateLock acquireLock() {
    return LockFile.acquire(localStateRoot().resolve("lock"), hostname(), clock);
  }

  @Override
  public FleetConfig loadConfig() {
    Path path = configPath();
    if (!Files.exists(path)) {
      log.debug("no config at {}, using defaults", path);
      return new FleetConfig();
    }
    return read(path, FleetConfig.class);
  }

  public void saveConfig(FleetConfig config) {
    write(configPath(), config);
  }

  @Override
  public MachineSnapshot loadMachine() {
    String id = machineId();
    Path path = machinePath(id);
    if (!Files.exists(path)) {
      MachineSnapshot machine = new MachineSnapshot();
      machine.machineId = id;
      machine.hostname = hostname();
      machine.updatedAt = clock.instant();
      return machine;
    }
    return read(path, MachineSnapshot.class);
  }

  @Override
  public void saveMachine(MachineSnapshot machine) {
    if (machine.machineId == null || machine.machineId.isBlank()) {
      machine.machineId = machineId();
    }
    machine.updatedAt = clock.instant();
    write(machinePath(machine.machineId), machine);
  }

  @Override
  public Optional<RepoMetadata> loadRepoMetadata(String repoKey) {
    Path path = repoMetadataPath(repoKey);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    return Optional.of(read(path, RepoMetadata.class));
  }

  @Override
  public void saveRepoMetadata(RepoMetadata metadata) {
    if (metadata.repoKey == null || metadata.repoKey.isBlank()) {
      throw new StateStoreException("repo_key is required to save repo metadata");
    }
    Path path = repoMetadataPath(metadata.repoKey);
    write(path, metadata);
    log.debug("wrote repo metadata {}", path);
  }

  @Override
  public List<RepoMetadata> loadAllRepoMetadata() {
    Path dir = configRoot().resolve("repos");
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    List<RepoMetadata> out = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(f -> f.getFileName().toString().endsWith(".yaml")).toList()) {
        RepoMetadata metadata = read(file, RepoMetadata.class);
        if (metadata.repoKey != null && !metadata.repoKey.isBlank()) {
          out.add(metadata);
        }
      }
    } catch (IOException e) {
      throw new StateStoreException("Failed listing %s: %s".formatted(dir, e.getMessage()), e);
    }
    out.sort(Comparator.comparing(m -> m.repoKey));
    return out;
  }

  /** Reads the persisted machine id, creating one on first use. */
  public synchronized String machineId() {
    if (machineId != null) {
      return machineId;
    }
    Path idPath = localStateRoot().resolve("machine-id");
    try {
      if (Files.exists(idPath)) {
        String id = Files.readString(idPath, StandardCharsets.UTF_8).trim();
        if (!id.isEmpty()) {
          machineId = id;
          return id;
        }
      }
      String id = hostname() + "-" + UUID.randomUUID().toString().substring(0, 8);
      Files.createDirectories(idPath.getParent());
      Files.writeString(idPath, id + "\n", StandardCharsets.UTF_8);
      machineId = id;
      return id;
    } catch (IOException e) {
      throw new StateStoreException("Failed on machine id %s: %s".formatted(idPath, e.getMessage()), e);
    }
  }

  static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      String env = System.getenv("HOSTNAME");
      log.debug("hostname lookup failed, using {}: {}", env, e.getMessage());
      return env == null || env.isBlank() ? "localhost" : env;
    }
  }

  private <T> T read(Path path, Class<T> type) {
    try {
      return yaml.readValue(path.toFile(), type);
    } catch (IOException e) {
      throw new StateStoreException("Failed to parse %s: %s".formatted(path, e.getMessage()), e);
    }
  }

  private void write(Path path, Object value) {
    try {
      Files.createDirectories(path.getParent());
      Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
      yaml.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new StateStoreException("Failed to write %s: %s".formatted(path, e.getMessage()), e);
    }
  }
}
