package com.namekis.gitfleet.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Persisted per repository policy, keyed by repo key. Fixes rewrite individual fields only. */
public class RepoMetadata {
  public String repoKey = "";
  public String name = "";
  public String originUrl = "";
  public Visibility visibility = Visibility.UNKNOWN;
  public String preferredCatalog = "";
  public String preferredRemote = "";
  public AutoPushMode autoPush = AutoPushMode.DISABLED;
  public PushAccess pushAccess = PushAccess.UNKNOWN;
  public Instant pushAccessCheckedAt;
  public String pushAccessCheckedRemote = "";
  public boolean pushAccessManualOverride;
  public List<String> previousRepoKeys = new ArrayList<>();

  /** Forget the last push access probe so the next load verifies it again. */
  public void resetPushAccessProbe() {
    pushAccess = PushAccess.UNKNOWN;
    pushAccessCheckedAt = null;
    pushAccessCheckedRemote = "";
    pushAccessManualOverride = false;
  }

  public RepoMetadata copy() {
    RepoMetadata m = new RepoMetadata();
    m.repoKey = repoKey;
    m.name = name;
    m.originUrl = originUrl;
    m.visibility = visibility;
    m.preferredCatalog = preferredCatalog;
    m.preferredRemote = preferredRemote;
    m.autoPush = autoPush;
    m.pushAccess = pushAccess;
    m.pushAccessCheckedAt = pushAccessCheckedAt;
    m.pushAccessCheckedRemote = pushAccessCheckedRemote;
    m.pushAccessManualOverride = pushAccessManualOverride;
    m.previousRepoKeys = previousRepoKeys == null ? new ArrayList<>() : new ArrayList<>(previousRepoKeys);
    return m;
  }

  @Override
  public String toString() {
    return "RepoMetadata[%s autoPush=%s pushAccess=%s remote=%s]".formatted(repoKey, autoPush, pushAccess, preferredRemote);
  }
}
