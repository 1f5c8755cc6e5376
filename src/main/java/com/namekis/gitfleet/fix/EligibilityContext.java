package com.namekis.gitfleet.fix;

import com.namekis.gitfleet.git.SyncStrategy;
import com.namekis.gitfleet.risk.RiskSnapshot;

/** Caller side inputs of the eligibility rules besides the repository itself. */
public record EligibilityContext(boolean interactive, RiskSnapshot risk, SyncStrategy syncStrategy, SyncFeasibility syncFeasibility) {
  public EligibilityContext {
    risk = risk == null ? RiskSnapshot.EMPTY : risk;
    syncStrategy = syncStrategy == null ? SyncStrategy.DEFAULT : syncStrategy;
    syncFeasibility = syncFeasibility == null ? SyncFeasibility.UNCHECKED : syncFeasibility;
  }

  public static EligibilityContext of(FixRepoState state, boolean interactive, SyncStrategy strategy) {
    return new EligibilityContext(interactive, state.risk(), strategy, state.syncFeasibility());
  }
}
