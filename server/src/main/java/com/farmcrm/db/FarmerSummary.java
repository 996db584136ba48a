package com.farmcrm.db;

/**
 * A farmer as shown in a selection list.
 *
 * @param id farmer id
 * @param name manager's full name, or "Unknown" when either part is missing
 * @param farmName farm name, or "Unknown Farm"
 * @param phone primary phone, falling back to the WhatsApp number, then ""
 * @param location city, or ""
 * @param farmType placeholder
 * @param totalSizeHa placeholder
 */
public record FarmerSummary(
    long id,
    String name,
    String farmName,
    String phone,
    String location,
    String farmType,
    double totalSizeHa) {}
