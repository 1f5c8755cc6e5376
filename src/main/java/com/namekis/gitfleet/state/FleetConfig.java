package com.namekis.gitfleet.state;

import com.namekis.gitfleet.domain.Visibility;

/** User configuration, {@code config.yaml}. */
public class FleetConfig {
  public GitHub github = new GitHub();
  public Sync sync = new Sync();

  public static class GitHub {
    public String owner = "";
    public String defaultVisibility = "private";
    /** {@code ssh} or {@code https}. */
    public String remoteProtocol = "ssh";

    /** Anything but an explicit {@code public} is private. */
    public Visibility visibility() {
      return "public".equalsIgnoreCase(defaultVisibility == null ? "" : defaultVisibility.trim()) ? Visibility.PUBLIC : Visibility.PRIVATE;
    }
  }

  public static class Sync {
    public boolean includeUntrackedAsDirty = true;
    public boolean defaultAutoPushPrivate = true;
    public boolean defaultAutoPushPublic = false;
    public boolean fetchPrune = true;
    public int scanFreshnessSeconds = 60;
  }

  public String owner() {
    return github.owner == null ? "" : github.owner.trim();
  }

  public boolean defaultAutoPushFor(Visibility visibility) {
    return switch (visibility) {
      case PRIVATE -> sync.defaultAutoPushPrivate;
      case PUBLIC -> sync.defaultAutoPushPublic;
      case UNKNOWN -> false;
    };
  }
}
