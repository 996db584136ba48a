package com.farmcrm.db;

/**
 * A crop known to the crop technology reference table. Only {@code cropName} comes from the
 * database; {@code localizedName} repeats it and the remaining fields are placeholders from {@link
 * UnmodeledFields}.
 */
public record CropInfo(
    long id,
    String cropName,
    String localizedName,
    String category,
    String plantingSeason,
    String harvestSeason,
    String description) {

  static CropInfo of(String storedName) {
    return new CropInfo(
        UnmodeledFields.CROP_INFO_ID,
        storedName,
        storedName,
        UnmodeledFields.CROP_CATEGORY,
        UnmodeledFields.CROP_PLANTING_SEASON,
        UnmodeledFields.CROP_HARVEST_SEASON,
        UnmodeledFields.cropDescription(storedName));
  }
}
