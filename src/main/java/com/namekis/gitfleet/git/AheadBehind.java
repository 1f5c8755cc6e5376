package com.namekis.gitfleet.git;

public record AheadBehind(int ahead, int behind) {
  public static final AheadBehind NONE = new AheadBehind(0, 0);

  public boolean diverged() {
    return ahead > 0 && behind > 0;
  }
}
