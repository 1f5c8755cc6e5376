package com.namekis.gitfleet.state;

import java.util.List;
import java.util.Optional;

import com.namekis.gitfleet.domain.MachineSnapshot;
import com.namekis.gitfleet.domain.RepoMetadata;

/** Configuration, machine snapshot and per repository metadata of this machine. */
public interface StateStore {
  /** @throws StateStoreException when another process holds the lock */
  StateLock acquireLock();

  FleetConfig loadConfig();

  MachineSnapshot loadMachine();

  void saveMachine(MachineSnapshot machine);

  Optional<RepoMetadata> loadRepoMetadata(String repoKey);

  void saveRepoMetadata(RepoMetadata metadata);

  /** Every stored metadata with a repo key, sorted by repo key. */
  List<RepoMetadata> loadAllRepoMetadata();
}
