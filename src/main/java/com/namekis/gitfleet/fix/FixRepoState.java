package com.namekis.gitfleet.fix;

import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.risk.RiskSnapshot;

/**
 * Joined view of one repository used by fixes, rebuilt on every load and never persisted.
 *
 * @param metadata null when the repository has no stored metadata yet
 */
public record FixRepoState(RepositoryRecord record, RepoMetadata metadata, RiskSnapshot risk, SyncFeasibility syncFeasibility,
    boolean defaultCatalog) {

  public FixRepoState {
    risk = risk == null ? RiskSnapshot.EMPTY : risk;
    syncFeasibility = syncFeasibility == null ? SyncFeasibility.UNCHECKED : syncFeasibility;
  }

  public FixRepoState withMetadata(RepoMetadata newMetadata) {
    return new FixRepoState(record, newMetadata, risk, syncFeasibility, defaultCatalog);
  }

  public String preferredRemote() {
    return metadata == null || metadata.preferredRemote == null ? "" : metadata.preferredRemote.trim();
  }
}
