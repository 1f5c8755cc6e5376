package com.namekis.gitfleet.scan;

import java.nio.file.Path;
import java.util.List;

import com.namekis.gitfleet.domain.Catalog;
import com.namekis.gitfleet.domain.MachineSnapshot;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.state.FleetConfig;

/** Produces the observed state of repositories. */
public interface RepoScanner {
  /**
   * Observes one repository of a catalog.
   *
   * @param previous the last observation of the same path, used to keep its observed-at time when nothing changed; may be null
   */
  RepositoryRecord observe(FleetConfig config, Catalog catalog, Path repoPath, RepositoryRecord previous);

  /**
   * Rediscovers the repositories of the named catalogs (all when empty) and replaces their records in the snapshot, recording the
   * scan time and the scanned catalogs. The snapshot is not saved.
   */
  void scan(FleetConfig config, MachineSnapshot machine, List<String> catalogs);
}
