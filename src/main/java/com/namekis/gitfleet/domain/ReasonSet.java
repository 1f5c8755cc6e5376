package com.namekis.gitfleet.domain;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import one.util.streamex.StreamEx;

/**
 * Insertion ordered set of {@link UnsyncableReason}s. Adding a reason twice keeps the first position.
 */
public final class ReasonSet implements Iterable<UnsyncableReason> {
  private final Set<UnsyncableReason> reasons = new LinkedHashSet<>();

  public ReasonSet() {
  }

  public static ReasonSet of(UnsyncableReason... reasons) {
    return from(List.of(reasons));
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ReasonSet from(Collection<UnsyncableReason> reasons) {
    ReasonSet set = new ReasonSet();
    if (reasons != null) {
      reasons.forEach(set::add);
    }
    return set;
  }

  /** @return true when the reason was not present before */
  public boolean add(UnsyncableReason reason) {
    if (reason == null) {
      throw new IllegalArgumentException("reason is required");
    }
    return reasons.add(reason);
  }

  public boolean contains(UnsyncableReason reason) {
    return reasons.contains(reason);
  }

  public boolean isEmpty() {
    return reasons.isEmpty();
  }

  public int size() {
    return reasons.size();
  }

  @JsonValue
  public List<UnsyncableReason> asList() {
    return List.copyOf(reasons);
  }

  /** Codes sorted alphabetically, used for stable display. */
  public List<String> sortedCodes() {
    return StreamEx.of(reasons).map(UnsyncableReason::code).sorted().toList();
  }

  public ReasonSet copy() {
    return from(reasons);
  }

  @Override
  public Iterator<UnsyncableReason> iterator() {
    return asList().iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ReasonSet other)) {
      return false;
    }
    return asList().equals(other.asList());
  }

  @Override
  public int hashCode() {
    return asList().hashCode();
  }

  @Override
  public String toString() {
    return StreamEx.of(reasons).map(UnsyncableReason::code).joining(", ", "[", "]");
  }
}
