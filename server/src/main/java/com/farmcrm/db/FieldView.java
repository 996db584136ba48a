package com.farmcrm.db;

import java.math.BigDecimal;
import javax.annotation.Nullable;

/**
 * A field joined to its active planting, if any. The crop columns are all null when the field has
 * nothing planted.
 *
 * @param plantingDate {@code yyyy-MM-dd}, or null
 */
public record FieldView(
    long fieldId,
    String fieldName,
    BigDecimal fieldSize,
    @Nullable String fieldLocation,
    @Nullable String soilType,
    @Nullable String currentCrop,
    @Nullable String variety,
    @Nullable String plantingDate,
    @Nullable String cropStatus) {}
