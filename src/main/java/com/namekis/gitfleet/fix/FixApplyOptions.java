package com.namekis.gitfleet.fix;

import java.util.List;

import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.git.SyncStrategy;

/**
 * Caller choices for one fix run.
 *
 * @param commitMessage blank or {@code auto} uses {@link FixPlanBuilder#DEFAULT_COMMIT_MESSAGE}
 * @param createProjectVisibility {@link Visibility#UNKNOWN} uses {@code github.default_visibility}
 */
public record FixApplyOptions(boolean interactive, String commitMessage, SyncStrategy syncStrategy, String createProjectName,
    Visibility createProjectVisibility, boolean generateGitignore, List<String> gitignorePatterns) {

  public FixApplyOptions {
    commitMessage = commitMessage == null ? "" : commitMessage.trim();
    syncStrategy = syncStrategy == null ? SyncStrategy.DEFAULT : syncStrategy;
    createProjectName = createProjectName == null ? "" : createProjectName.trim();
    createProjectVisibility = createProjectVisibility == null ? Visibility.UNKNOWN : createProjectVisibility;
    gitignorePatterns = gitignorePatterns == null ? List.of() : List.copyOf(gitignorePatterns);
  }

  public static FixApplyOptions defaults() {
    return new FixApplyOptions(false, "", SyncStrategy.DEFAULT, "", Visibility.UNKNOWN, false, List.of());
  }

  public FixApplyOptions withInteractive(boolean value) {
    return new FixApplyOptions(value, commitMessage, syncStrategy, createProjectName, createProjectVisibility, generateGitignore,
      gitignorePatterns);
  }

  public FixApplyOptions withCommitMessage(String value) {
    return new FixApplyOptions(interactive, value, syncStrategy, createProjectName, createProjectVisibility, generateGitignore,
      gitignorePatterns);
  }

  public FixApplyOptions withSyncStrategy(SyncStrategy value) {
    return new FixApplyOptions(interactive, commitMessage, value, createProjectName, createProjectVisibility, generateGitignore,
      gitignorePatterns);
  }

  public FixApplyOptions withCreateProject(String name, Visibility visibility) {
    return new FixApplyOptions(interactive, commitMessage, syncStrategy, name, visibility, generateGitignore, gitignorePatterns);
  }

  public FixApplyOptions withGitignore(List<String> patterns) {
    return new FixApplyOptions(interactive, commitMessage, syncStrategy, createProjectName, createProjectVisibility,
      patterns != null && !patterns.isEmpty(), patterns);
  }

  public boolean writesGitignore() {
    return generateGitignore && !gitignorePatterns.isEmpty();
  }
}
