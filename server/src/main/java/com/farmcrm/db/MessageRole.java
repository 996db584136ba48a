package com.farmcrm.db;

import com.google.common.base.Strings;
import javax.annotation.Nullable;

/** Values of the 'role' column of 'incoming_messages'. */
public enum MessageRole {
  USER("user"),
  ASSISTANT("assistant");

  private final String dbValue;

  MessageRole(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  /**
   * Returns {@code text} if a message with the stored {@code role} belongs in this role's slot,
   * otherwise "". A message fills exactly one slot; unknown roles fill none.
   */
  public String slot(@Nullable String role, @Nullable String text) {
    return dbValue.equals(role) ? Strings.nullToEmpty(text) : "";
  }
}
