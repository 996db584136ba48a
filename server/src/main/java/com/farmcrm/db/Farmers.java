package com.farmcrm.db;

import com.farmcrm.common.status.StatusOr;
import com.farmcrm.db.util.DbUtil;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * DAO helper class for the 'farmers' table.
 */
public final class Farmers {

    static final String UNKNOWN_NAME = "Unknown";
    static final String UNKNOWN_FARM = "Unknown Farm";

    private Farmers() {
        // Utility class
    }

    /**
     * Loads a single farmer by ID.
     *
     * @param conn an open JDBC connection
     * @param farmerId the id of the farmer to load
     * @return StatusOr containing an Optional Farmer or an error
     */
    @Nonnull
    public static StatusOr<Optional<Farmer>> loadById(Connection conn, long farmerId) {
        String sql = """
                SELECT id, farm_name, manager_name, manager_last_name,
                       city, wa_phone_number
                  FROM farmers
                 WHERE id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, farmerId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return StatusOr.ofValue(Optional.of(extractFarmer(rs)));
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }

    /**
     * Loads up to {@code limit} farmers ordered by farm name.
     *
     * @param conn an open JDBC connection
     * @param limit maximum number of rows to return
     * @return StatusOr containing the summaries or an error
     */
    @Nonnull
    public static StatusOr<List<FarmerSummary>> loadSummaries(Connection conn, int limit) {
        String sql = """
                SELECT id, farm_name, manager_name, manager_last_name,
                       email, phone, city, wa_phone_number
                  FROM farmers
                 ORDER BY farm_name
                 LIMIT ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                ImmutableList.Builder<FarmerSummary> result = ImmutableList.builder();
                while (rs.next()) {
                    result.add(extractSummary(rs));
                }
                return StatusOr.ofValue(result.build());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }

    /**
     * Builds the display name of a farm manager: "first last", or "Unknown" when either part is
     * missing.
     */
    @Nonnull
    public static String displayName(String managerName, String managerLastName) {
        if (Strings.isNullOrEmpty(managerName) || Strings.isNullOrEmpty(managerLastName)) {
            return UNKNOWN_NAME;
        }
        return (managerName + " " + managerLastName).trim();
    }

    private static Farmer extractFarmer(ResultSet rs) throws SQLException {
        return new Farmer(
                rs.getLong("id"),
                rs.getString("farm_name"),
                rs.getString("manager_name"),
                rs.getString("manager_last_name"),
                rs.getString("city"),
                rs.getString("wa_phone_number"),
                UnmodeledFields.FARMER_TOTAL_HECTARES,
                UnmodeledFields.FARMER_TYPE);
    }

    private static FarmerSummary extractSummary(ResultSet rs) throws SQLException {
        String farmName = rs.getString("farm_name");
        return new FarmerSummary(
                rs.getLong("id"),
                displayName(rs.getString("manager_name"), rs.getString("manager_last_name")),
                Strings.isNullOrEmpty(farmName) ? UNKNOWN_FARM : farmName,
                DbUtil.firstNonEmpty(rs.getString("phone"), rs.getString("wa_phone_number")),
                Strings.nullToEmpty(rs.getString("city")),
                UnmodeledFields.FARMER_TYPE,
                UnmodeledFields.FARMER_SIZE_HA);
    }
}
