package com.farmcrm.db;

import java.time.Instant;
import javax.annotation.Nullable;

/**
 * A farmer's most recent user message, waiting for an agronomist's review.
 *
 * @param id message id
 * @param lastMessage message text, cut to {@link Messages#PREVIEW_LENGTH} characters plus "..."
 */
public record ApprovalEntry(
    long id,
    long farmerId,
    String farmerName,
    String farmerPhone,
    String farmerLocation,
    String farmerType,
    String farmerSize,
    String lastMessage,
    @Nullable Instant timestamp) {}
