package com.namekis.gitfleet.state;

/** When loading repositories for a fix, whether to rescan the catalogs first. */
public enum RefreshMode {
  NEVER,
  /** Rescan only when the last scan is older than the freshness window or did not cover the requested catalogs. */
  IF_STALE,
  ALWAYS
}
