package com.namekis.gitfleet.risk;

/** One uncommitted path with its status ({@code modified, added, deleted, renamed, untracked}) and line counts. */
public record ChangedFile(String path, String status, int added, int deleted) {
}
