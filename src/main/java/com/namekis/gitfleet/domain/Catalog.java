package com.namekis.gitfleet.domain;

/** Named root directory under which repositories live {@link #repoPathDepth} levels deep. */
public class Catalog {
  public static final int DEFAULT_REPO_PATH_DEPTH = 1;

  public String name = "";
  public String root = "";
  public int repoPathDepth;
  public Boolean allowAutoPushDefaultBranchPrivate;
  public Boolean allowAutoPushDefaultBranchPublic;

  public Catalog() {
  }

  public Catalog(String name, String root) {
    this.name = name;
    this.root = root;
  }

  public int effectiveRepoPathDepth() {
    return repoPathDepth == 2 ? 2 : DEFAULT_REPO_PATH_DEPTH;
  }

  public boolean allowsDefaultBranchAutoPush(Visibility visibility) {
    Boolean allowed = visibility == Visibility.PUBLIC ? allowAutoPushDefaultBranchPublic : allowAutoPushDefaultBranchPrivate;
    return allowed != null && allowed;
  }
}
