package com.farmcrm.db;

import java.time.Instant;
import javax.annotation.Nullable;

/**
 * One stored message seen as a conversation turn. Exactly one of {@code userInput} and {@code
 * avaResponse} holds the message text, depending on its role; the other is "".
 */
public record ConversationTurn(
    long id,
    String userInput,
    String avaResponse,
    @Nullable Instant timestamp,
    String messageType,
    double confidenceScore,
    boolean approvedStatus) {

  static ConversationTurn of(long id, String text, String role, @Nullable Instant timestamp) {
    return new ConversationTurn(
        id,
        MessageRole.USER.slot(role, text),
        MessageRole.ASSISTANT.slot(role, text),
        timestamp,
        UnmodeledFields.MESSAGE_TYPE,
        UnmodeledFields.CONFIDENCE_SCORE,
        UnmodeledFields.APPROVED_STATUS);
  }
}
