package com.namekis.gitfleet.fix;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.namekis.gitfleet.domain.MachineSnapshot;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.state.FileStateStore;
import com.namekis.gitfleet.state.FleetConfig;
import com.namekis.gitfleet.state.StateLock;
import com.namekis.gitfleet.state.StateStore;
import com.namekis.gitfleet.state.StateStoreException;

/**
 * Keeps state in memory but hands out copies, like a store that reads files. A second lock while one is held fails, so nested
 * locking shows up in tests.
 */
public class InMemoryStateStore implements StateStore {
  private static final ObjectMapper mapper = FileStateStore.yamlMapper();

  public FleetConfig config = new FleetConfig();
  public MachineSnapshot machine = new MachineSnapshot();
  public final Map<String, RepoMetadata> metadata = new TreeMap<>();
  public int locksAcquired;
  public boolean locked;
  public int machineSaves;

  @Override
  public StateLock acquireLock() {
    if (locked) {
      throw new StateStoreException("lock already held");
    }
    locked = true;
    locksAcquired++;
    return () -> locked = false;
  }

  @Override
  public FleetConfig loadConfig() {
    return copy(config, FleetConfig.class);
  }

  @Override
  public MachineSnapshot loadMachine() {
    return copy(machine, MachineSnapshot.class);
  }

  @Override
  public void saveMachine(MachineSnapshot snapshot) {
    machine = copy(snapshot, MachineSnapshot.class);
    machineSaves++;
  }

  @Override
  public Optional<RepoMetadata> loadRepoMetadata(String repoKey) {
    return Optional.ofNullable(metadata.get(repoKey)).map(m -> copy(m, RepoMetadata.class));
  }

  @Override
  public void saveRepoMetadata(RepoMetadata m) {
    if (m.repoKey == null || m.repoKey.isBlank()) {
      throw new StateStoreException("repo_key is required to save repo metadata");
    }
    metadata.put(m.repoKey, copy(m, RepoMetadata.class));
  }

  @Override
  public List<RepoMetadata> loadAllRepoMetadata() {
    return metadata.values().stream().map(m -> copy(m, RepoMetadata.class)).toList();
  }

  private static <T> T copy(T value, Class<T> type) {
    try {
      return mapper.readValue(mapper.writeValueAsString(value), type);
    } catch (JsonProcessingException e) {
      throw new StateStoreException("cannot copy %s: %s".formatted(type.getSimpleName(), e.getMessage()), e);
    }
  }
}
