package com.farmcrm.db;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Conversations grouped by review state.
 *
 * <p>{@code approved} is always empty: the schema has no column recording approval.
 */
public record ApprovalQueue(List<ApprovalEntry> unapproved, List<ApprovalEntry> approved) {

  public static ApprovalQueue ofUnapproved(List<ApprovalEntry> unapproved) {
    return new ApprovalQueue(ImmutableList.copyOf(unapproved), ImmutableList.of());
  }
}
