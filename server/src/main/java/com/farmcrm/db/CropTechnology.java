package com.farmcrm.db;

import com.farmcrm.common.status.StatusOr;
import com.farmcrm.db.util.DbUtil;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * DAO helper class for the 'crop_technology' reference table.
 */
public final class CropTechnology {

    private CropTechnology() {
        // Utility class
    }

    /**
     * Looks up a crop type by name, ignoring case.
     *
     * @param conn an open JDBC connection
     * @param cropName the name to look for
     * @return StatusOr containing the crop under its stored name, an empty Optional, or an error
     */
    @Nonnull
    public static StatusOr<Optional<CropInfo>> findByName(Connection conn, String cropName) {
        String sql = """
                SELECT DISTINCT crop_type
                  FROM crop_technology
                 WHERE LOWER(crop_type) = LOWER(?)
                 LIMIT 1
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, cropName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return StatusOr.ofValue(Optional.of(CropInfo.of(rs.getString("crop_type"))));
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }
}
