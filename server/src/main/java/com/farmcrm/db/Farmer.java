package com.farmcrm.db;

import java.math.BigDecimal;

/**
 * A row of the 'farmers' table.
 *
 * @param id primary key
 * @param farmName name of the farm
 * @param managerName first name of the farm manager
 * @param managerLastName last name of the farm manager
 * @param city city the farm is in
 * @param waPhoneNumber WhatsApp number used for messaging
 * @param totalHectares placeholder, see {@link UnmodeledFields#FARMER_TOTAL_HECTARES}
 * @param farmerType placeholder, see {@link UnmodeledFields#FARMER_TYPE}
 */
public record Farmer(
    long id,
    String farmName,
    String managerName,
    String managerLastName,
    String city,
    String waPhoneNumber,
    BigDecimal totalHectares,
    String farmerType) {}
