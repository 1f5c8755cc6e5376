package com.namekis.gitfleet.risk;

import java.util.List;

/** What is about to be committed in a working tree and whether any of it looks dangerous. */
public record RiskSnapshot(List<ChangedFile> changedFiles, List<String> secretLikeChangedPaths, List<String> noisyChangedPaths,
    boolean missingRootGitignore, List<String> suggestedGitignorePatterns, List<String> missingGitignorePatterns) {

  public static final RiskSnapshot EMPTY = new RiskSnapshot(List.of(), List.of(), List.of(), false, List.of(), List.of());

  public RiskSnapshot {
    changedFiles = List.copyOf(changedFiles);
    secretLikeChangedPaths = List.copyOf(secretLikeChangedPaths);
    noisyChangedPaths = List.copyOf(noisyChangedPaths);
    suggestedGitignorePatterns = List.copyOf(suggestedGitignorePatterns);
    missingGitignorePatterns = List.copyOf(missingGitignorePatterns);
  }

  public boolean hasSecretLikeChanges() {
    return !secretLikeChangedPaths.isEmpty();
  }

  public boolean hasNoisyChangesWithoutGitignore() {
    return missingRootGitignore && !noisyChangedPaths.isEmpty();
  }
}
