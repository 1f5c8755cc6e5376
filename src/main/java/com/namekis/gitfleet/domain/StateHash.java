package com.namekis.gitfleet.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Change detection hash over the observable fields of a {@link RepositoryRecord}. Not an integrity check. */
public final class StateHash {
  private static final ObjectMapper json = new ObjectMapper();

  private StateHash() {
  }

  public static String compute(RepositoryRecord record) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("branch", RepositoryRecord.nullToEmpty(record.branch));
    payload.put("head_sha", RepositoryRecord.nullToEmpty(record.headSha));
    payload.put("upstream", RepositoryRecord.nullToEmpty(record.upstream));
    payload.put("remote_head_sha", RepositoryRecord.nullToEmpty(record.remoteHeadSha));
    payload.put("ahead", record.ahead);
    payload.put("behind", record.behind);
    payload.put("diverged", record.diverged);
    payload.put("has_dirty_tracked", record.hasDirtyTracked);
    payload.put("has_untracked", record.hasUntracked);
    payload.put("operation_in_progress", record.operationInProgress == null ? Operation.NONE : record.operationInProgress);
    payload.put("syncable", record.syncable);
    payload.put("unsyncable_reasons", record.unsyncableReasons == null ? new ReasonSet() : record.unsyncableReasons);
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(json.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8));
      return "sha256:" + HexFormat.of().formatHex(digest);
    } catch (JsonProcessingException | NoSuchAlgorithmException e) {
      throw new IllegalStateException("Failed to hash state of %s: %s".formatted(record.path, e.getMessage()), e);
    }
  }
}
