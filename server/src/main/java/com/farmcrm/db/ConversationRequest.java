package com.farmcrm.db;

import javax.annotation.Nullable;

/**
 * A question and the answer given to it, to be stored as a user/assistant message pair.
 *
 * @param waPhoneNumber sender's number; stored as "unknown" when null
 */
public record ConversationRequest(
    String question, String answer, @Nullable String waPhoneNumber) {

  public static final String UNKNOWN_PHONE = "unknown";

  public ConversationRequest(String question, String answer) {
    this(question, answer, null);
  }

  public String phoneOrUnknown() {
    return waPhoneNumber == null ? UNKNOWN_PHONE : waPhoneNumber;
  }
}
