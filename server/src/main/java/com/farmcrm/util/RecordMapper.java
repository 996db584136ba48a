package com.farmcrm.util;

import com.farmcrm.db.ApprovalEntry;
import com.farmcrm.db.ApprovalQueue;
import com.farmcrm.db.ConversationDetails;
import com.farmcrm.db.ConversationTurn;
import com.farmcrm.db.CropInfo;
import com.farmcrm.db.Farmer;
import com.farmcrm.db.FarmerSummary;
import com.farmcrm.db.FieldView;
import com.google.common.base.CaseFormat;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts data-access records to JSON-friendly maps of primitive values.
 *
 * <p>Keys default to snake_case ({@code wa_phone_number}, {@code ava_response}), the names the
 * dashboard and chat clients read. Timestamps become ISO-8601 strings; absent values stay as null
 * entries rather than being dropped.
 */
public final class RecordMapper {

  private RecordMapper() {
    // Utility class, no instances
  }

  /** Naming conventions for map keys. */
  public enum NamingConvention {
    CAMEL_CASE,
    SNAKE_CASE
  }

  private static final NamingConvention DEFAULT_CONVENTION = NamingConvention.SNAKE_CASE;

  private static final Gson GSON = new GsonBuilder().serializeNulls().create();

  public static Map<String, Object> toJsonMap(Farmer farmer) {
    return toJsonMap(farmer, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(Farmer farmer, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(formatName("id", convention), farmer.id());
    map.put(formatName("farmName", convention), farmer.farmName());
    map.put(formatName("managerName", convention), farmer.managerName());
    map.put(formatName("managerLastName", convention), farmer.managerLastName());
    map.put(formatName("city", convention), farmer.city());
    map.put(formatName("waPhoneNumber", convention), farmer.waPhoneNumber());
    map.put(formatName("totalHectares", convention), farmer.totalHectares());
    map.put(formatName("farmerType", convention), farmer.farmerType());
    return map;
  }

  public static Map<String, Object> toJsonMap(FarmerSummary summary) {
    return toJsonMap(summary, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(
      FarmerSummary summary, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(formatName("id", convention), summary.id());
    map.put(formatName("name", convention), summary.name());
    map.put(formatName("farmName", convention), summary.farmName());
    map.put(formatName("phone", convention), summary.phone());
    map.put(formatName("location", convention), summary.location());
    map.put(formatName("farmType", convention), summary.farmType());
    map.put(formatName("totalSizeHa", convention), summary.totalSizeHa());
    return map;
  }

  public static Map<String, Object> toJsonMap(FieldView field) {
    return toJsonMap(field, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(FieldView field, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(formatName("fieldId", convention), field.fieldId());
    map.put(formatName("fieldName", convention), field.fieldName());
    map.put(formatName("fieldSize", convention), field.fieldSize());
    map.put(formatName("fieldLocation", convention), field.fieldLocation());
    map.put(formatName("soilType", convention), field.soilType());
    map.put(formatName("currentCrop", convention), field.currentCrop());
    map.put(formatName("variety", convention), field.variety());
    map.put(formatName("plantingDate", convention), field.plantingDate());
    map.put(formatName("cropStatus", convention), field.cropStatus());
    return map;
  }

  public static Map<String, Object> toJsonMap(ConversationTurn turn) {
    return toJsonMap(turn, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(ConversationTurn turn, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(formatName("id", convention), turn.id());
    map.put(formatName("userInput", convention), turn.userInput());
    map.put(formatName("avaResponse", convention), turn.avaResponse());
    map.put(formatName("timestamp", convention), formatTimestamp(turn.timestamp()));
    map.put(formatName("messageType", convention), turn.messageType());
    map.put(formatName("confidenceScore", convention), turn.confidenceScore());
    map.put(formatName("approvedStatus", convention), turn.approvedStatus());
    return map;
  }

  public static Map<String, Object> toJsonMap(CropInfo crop) {
    return toJsonMap(crop, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(CropInfo crop, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(formatName("id", convention), crop.id());
    map.put(formatName("cropName", convention), crop.cropName());
    map.put(formatName("localizedName", convention), crop.localizedName());
    map.put(formatName("category", convention), crop.category());
    map.put(formatName("plantingSeason", convention), crop.plantingSeason());
    map.put(formatName("harvestSeason", convention), crop.harvestSeason());
    map.put(formatName("description", convention), crop.description());
    return map;
  }

  public static Map<String, Object> toJsonMap(ApprovalEntry entry) {
    return toJsonMap(entry, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(ApprovalEntry entry, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(formatName("id", convention), entry.id());
    map.put(formatName("farmerId", convention), entry.farmerId());
    map.put(formatName("farmerName", convention), entry.farmerName());
    map.put(formatName("farmerPhone", convention), entry.farmerPhone());
    map.put(formatName("farmerLocation", convention), entry.farmerLocation());
    map.put(formatName("farmerType", convention), entry.farmerType());
    map.put(formatName("farmerSize", convention), entry.farmerSize());
    map.put(formatName("lastMessage", convention), entry.lastMessage());
    map.put(formatName("timestamp", convention), formatTimestamp(entry.timestamp()));
    return map;
  }

  public static Map<String, Object> toJsonMap(ApprovalQueue queue) {
    return toJsonMap(queue, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(ApprovalQueue queue, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("unapproved", mapAll(queue.unapproved(), e -> toJsonMap(e, convention)));
    map.put("approved", mapAll(queue.approved(), e -> toJsonMap(e, convention)));
    return map;
  }

  public static Map<String, Object> toJsonMap(ConversationDetails details) {
    return toJsonMap(details, DEFAULT_CONVENTION);
  }

  public static Map<String, Object> toJsonMap(
      ConversationDetails details, NamingConvention convention) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(formatName("id", convention), details.id());
    map.put(formatName("farmerId", convention), details.farmerId());
    map.put(formatName("farmerName", convention), details.farmerName());
    map.put(formatName("farmerPhone", convention), details.farmerPhone());
    map.put(formatName("farmerLocation", convention), details.farmerLocation());
    map.put(formatName("farmName", convention), details.farmName());
    map.put(formatName("userInput", convention), details.userInput());
    map.put(formatName("avaResponse", convention), details.avaResponse());
    map.put(formatName("timestamp", convention), formatTimestamp(details.timestamp()));
    map.put(formatName("approvedStatus", convention), details.approvedStatus());
    return map;
  }

  /** Serializes a map produced by this class to JSON. */
  public static String toJson(Object jsonMap) {
    return GSON.toJson(jsonMap);
  }

  private static <T> List<Map<String, Object>> mapAll(
      List<T> records, Function<T, Map<String, Object>> mapper) {
    return records.stream().map(mapper).toList();
  }

  private static String formatName(String camelCaseName, NamingConvention convention) {
    if (convention == NamingConvention.SNAKE_CASE) {
      return CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, camelCaseName);
    }
    return camelCaseName;
  }

  private static String formatTimestamp(Instant timestamp) {
    return timestamp == null ? null : timestamp.toString();
  }
}
