package com.farmcrm.db;

import com.farmcrm.common.status.StatusOr;
import com.farmcrm.db.util.DbUtil;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.annotation.Nonnull;

/**
 * The tables this layer reads and writes.
 *
 * <p>Table names are compiled in; they are the only identifiers ever concatenated into SQL.
 */
public enum Table {
    FARMERS("farmers"),
    FIELDS("fields"),
    FIELD_CROPS("field_crops"),
    INCOMING_MESSAGES("incoming_messages"),
    CROP_TECHNOLOGY("crop_technology");

    private final String tableName;

    Table(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Counts the rows in this table.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing the row count or an error
     */
    @Nonnull
    public StatusOr<Long> countRows(Connection conn) {
        String sql = "SELECT COUNT(*) FROM " + tableName;
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return StatusOr.ofValue(rs.getLong(1));
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }
}
