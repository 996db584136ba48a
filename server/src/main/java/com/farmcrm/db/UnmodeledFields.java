package com.farmcrm.db;

import java.math.BigDecimal;

/**
 * Values the returned records carry but the live schema does not store.
 *
 * <p>Callers must treat every constant here as a placeholder, not as data read from the database.
 * Each entry names the record field it fills.
 */
public final class UnmodeledFields {

  private UnmodeledFields() {
    // Constants only
  }

  /** {@link Farmer#totalHectares()}: the farmers table has no size column. */
  public static final BigDecimal FARMER_TOTAL_HECTARES = BigDecimal.ZERO;

  /**
   * {@link Farmer#farmerType()}, {@link FarmerSummary#farmType()} and {@link
   * ApprovalEntry#farmerType()}: the farmers table has no type column.
   */
  public static final String FARMER_TYPE = "Farm";

  /** {@link FarmerSummary#totalSizeHa()}. */
  public static final double FARMER_SIZE_HA = 0.0;

  /** {@link ApprovalEntry#farmerSize()}, rendered as text. */
  public static final String FARMER_SIZE_LABEL = "0.0";

  /** {@link ConversationTurn#messageType()}: incoming_messages has no type column. */
  public static final String MESSAGE_TYPE = "chat";

  /** {@link ConversationTurn#confidenceScore()}: no score is recorded per message. */
  public static final double CONFIDENCE_SCORE = 0.8;

  /**
   * {@link ConversationTurn#approvedStatus()} and {@link ConversationDetails#approvedStatus()}:
   * approval state is not persisted anywhere, so nothing is ever approved.
   */
  public static final boolean APPROVED_STATUS = false;

  /** {@link CropInfo#id()}: crop_technology is a projection without its own key. */
  public static final long CROP_INFO_ID = 1;

  /** {@link CropInfo#category()}. */
  public static final String CROP_CATEGORY = "Crop";

  /** {@link CropInfo#plantingSeason()}. */
  public static final String CROP_PLANTING_SEASON = "Spring";

  /** {@link CropInfo#harvestSeason()}. */
  public static final String CROP_HARVEST_SEASON = "Fall";

  /** {@link CropInfo#description()}. */
  public static String cropDescription(String cropName) {
    return "Information about " + cropName;
  }
}
