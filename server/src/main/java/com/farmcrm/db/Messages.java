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
 * DAO helper class for the 'incoming_messages' table.
 *
 * <p>Messages are append-only. Timestamps are assigned by the database on insert.
 */
public final class Messages {

    /** Characters of a message shown in the approval queue before it is cut. */
    public static final int PREVIEW_LENGTH = 100;
    static final String PREVIEW_ELLIPSIS = "...";

    private Messages() {
        // Utility class
    }

    /**
     * Loads the most recent messages of a farmer, newest first.
     *
     * @param conn an open JDBC connection
     * @param farmerId the farmer whose messages to load
     * @param limit maximum number of messages
     * @return StatusOr containing the messages as conversation turns, or an error
     */
    @Nonnull
    public static StatusOr<List<ConversationTurn>> loadRecent(
            Connection conn, long farmerId, int limit) {
        String sql = """
                SELECT id, message_text, timestamp, role
                  FROM incoming_messages
                 WHERE farmer_id = ?
                 ORDER BY timestamp DESC, id DESC
                 LIMIT ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, farmerId);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                ImmutableList.Builder<ConversationTurn> result = ImmutableList.builder();
                while (rs.next()) {
                    result.add(ConversationTurn.of(
                            rs.getLong("id"),
                            rs.getString("message_text"),
                            rs.getString("role"),
                            DbUtil.getNullableInstant(rs, "timestamp")));
                }
                return StatusOr.ofValue(result.build());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }

    /**
     * Inserts one message stamped with the database's current time.
     *
     * <p>Runs in whatever transaction {@code conn} is in; the caller commits.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing the generated message id or an error
     */
    @Nonnull
    public static StatusOr<Long> insert(
            Connection conn, long farmerId, String phoneNumber, String text, MessageRole role) {
        String sql = """
                INSERT INTO incoming_messages
                       (farmer_id, phone_number, message_text, role, timestamp)
                VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)
                RETURNING id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, farmerId);
            stmt.setString(2, phoneNumber);
            stmt.setString(3, text);
            stmt.setString(4, role.dbValue());
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return StatusOr.ofValue(rs.getLong(1));
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }

    /**
     * Loads each farmer's latest user message together with the farmer's display fields.
     *
     * <p>{@code DISTINCT ON (farmer_id)} keeps one row per farmer, so the result never holds two
     * entries for the same farmer. Rows are ordered newest first and capped at {@code limit}.
     *
     * @param conn an open JDBC connection
     * @param limit maximum number of entries
     * @return StatusOr containing the entries or an error
     */
    @Nonnull
    public static StatusOr<List<ApprovalEntry>> loadLatestUserMessages(Connection conn, int limit) {
        String sql = """
                WITH latest_messages AS (
                    SELECT DISTINCT ON (m.farmer_id)
                           m.id, m.farmer_id, m.message_text, m.timestamp,
                           f.manager_name, f.manager_last_name, f.phone,
                           f.city, f.farm_name
                      FROM incoming_messages m
                      JOIN farmers f ON m.farmer_id = f.id
                     WHERE m.role = ?
                     ORDER BY m.farmer_id, m.timestamp DESC
                )
                SELECT *
                  FROM latest_messages
                 ORDER BY timestamp DESC
                 LIMIT ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, MessageRole.USER.dbValue());
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                ImmutableList.Builder<ApprovalEntry> result = ImmutableList.builder();
                while (rs.next()) {
                    result.add(extractApprovalEntry(rs));
                }
                return StatusOr.ofValue(result.build());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }

    /**
     * Loads a single message joined to its farmer.
     *
     * @param conn an open JDBC connection
     * @param messageId the message to load
     * @return StatusOr containing an Optional with the details, or an error
     */
    @Nonnull
    public static StatusOr<Optional<ConversationDetails>> loadDetails(
            Connection conn, long messageId) {
        String sql = """
                SELECT m.id, m.farmer_id, m.message_text, m.timestamp, m.role,
                       f.manager_name, f.manager_last_name, f.phone,
                       f.city, f.farm_name
                  FROM incoming_messages m
                  JOIN farmers f ON m.farmer_id = f.id
                 WHERE m.id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, messageId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return StatusOr.ofValue(Optional.of(extractDetails(rs)));
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus(e));
        }
    }

    /** Cuts a message to {@link #PREVIEW_LENGTH} characters plus "..." when it is longer. */
    @Nonnull
    public static String preview(String text) {
        return DbUtil.truncate(text, PREVIEW_LENGTH, PREVIEW_ELLIPSIS);
    }

    private static ApprovalEntry extractApprovalEntry(ResultSet rs) throws SQLException {
        return new ApprovalEntry(
                rs.getLong("id"),
                rs.getLong("farmer_id"),
                Farmers.displayName(rs.getString("manager_name"), rs.getString("manager_last_name")),
                Strings.nullToEmpty(rs.getString("phone")),
                Strings.nullToEmpty(rs.getString("city")),
                UnmodeledFields.FARMER_TYPE,
                UnmodeledFields.FARMER_SIZE_LABEL,
                preview(rs.getString("message_text")),
                DbUtil.getNullableInstant(rs, "timestamp"));
    }

    private static ConversationDetails extractDetails(ResultSet rs) throws SQLException {
        String text = rs.getString("message_text");
        String role = rs.getString("role");
        return new ConversationDetails(
                rs.getLong("id"),
                rs.getLong("farmer_id"),
                Farmers.displayName(rs.getString("manager_name"), rs.getString("manager_last_name")),
                Strings.nullToEmpty(rs.getString("phone")),
                Strings.nullToEmpty(rs.getString("city")),
                rs.getString("farm_name"),
                MessageRole.USER.slot(role, text),
                MessageRole.ASSISTANT.slot(role, text),
                DbUtil.getNullableInstant(rs, "timestamp"),
                UnmodeledFields.APPROVED_STATUS);
    }
}
