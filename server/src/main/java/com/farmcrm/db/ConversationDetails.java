package com.farmcrm.db;

import java.time.Instant;
import javax.annotation.Nullable;

/** A single message with its farmer's display fields. */
public record ConversationDetails(
    long id,
    long farmerId,
    String farmerName,
    String farmerPhone,
    String farmerLocation,
    @Nullable String farmName,
    String userInput,
    String avaResponse,
    @Nullable Instant timestamp,
    boolean approvedStatus) {}
