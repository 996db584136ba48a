package com.farmcrm.db;

import com.farmcrm.common.status.StatusOr;
import com.farmcrm.db.util.DbUtil;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * DAO helper class for the 'fields' table and its active 'field_crops' row.
 */
public final class Fields {

    static final String ACTIVE_STATUS = "active";

    private Fields() {
        // Utility class
    }

    /**
     * Loads all fields of a farmer, each joined to its active planting if there is one.
     *
     * @param conn an open JDBC connection
     * @param farmerId the owning farmer
     * @return StatusOr containing the fields ordered by name, or an error
     */
    @Nonnull
    public static StatusOr<List<FieldView>> loadByFarmer(Connection conn, long farmerId) {
        String sql = """
                SELECT f.field_id, f.field_name, f.field_size, f.field_location,
                       f.soil_type,
                       fc.crop_name, fc.variety, fc.planting_date, fc.status
                  FROM fields f
                  LEFT JOIN field_crops fc
                    ON f.field_id = fc.field_id
                   AND fc.status = ?
                 WHERE f.farmer_id = ?
                 ORDER BY f.field_name
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, ACTIVE_STATUS);
            stmt.setLong(2, farmerId);
            try (ResultSet rs = stmt.executeQuery()) {
                ImmutableList.Builder<FieldView> result = ImmutableList.builder();
                while (rs.next()) {
                    result.add(extractField(rs));
                }
                return StatusOr.ofValue(result.build());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }

    private static FieldView extractField(ResultSet rs) throws SQLException {
        return new FieldView(
                rs.getLong("field_id"),
                rs.getString("field_name"),
                DbUtil.getDecimalOrZero(rs, "field_size"),
                rs.getString("field_location"),
                rs.getString("soil_type"),
                rs.getString("crop_name"),
                rs.getString("variety"),
                DbUtil.getIsoDate(rs, "planting_date"),
                rs.getString("status"));
    }
}
