package com.farmcrm;

import com.farmcrm.common.status.Status;
import com.farmcrm.common.status.StatusOr;
import com.farmcrm.db.ApprovalEntry;
import com.farmcrm.db.ApprovalQueue;
import com.farmcrm.db.ConversationDetails;
import com.farmcrm.db.ConversationRequest;
import com.farmcrm.db.ConversationTurn;
import com.farmcrm.db.CropInfo;
import com.farmcrm.db.CropTechnology;
import com.farmcrm.db.Farmer;
import com.farmcrm.db.FarmerSummary;
import com.farmcrm.db.Farmers;
import com.farmcrm.db.FieldView;
import com.farmcrm.db.Fields;
import com.farmcrm.db.MessageRole;
import com.farmcrm.db.Messages;
import com.farmcrm.db.Table;
import com.farmcrm.db.util.DbUtil;
import com.google.common.collect.ImmutableMap;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * Data access for farmers, their fields and crops, and their conversations with the assistant.
 *
 * <p>Every operation borrows one connection from the configured pool and returns it before
 * returning, on success and on failure alike. Nothing is kept between calls, so the service may be
 * used from any number of threads; concurrency is bounded by the pool size.
 *
 * <h2>Results</h2>
 *
 * <p>No operation throws. Each returns a {@link StatusOr}:
 *
 * <ul>
 *   <li>OK with a value when the query ran; a missing row is an OK result holding an empty
 *       {@code Optional} or an empty list
 *   <li>{@code UNAVAILABLE} when the database could not be reached
 *   <li>{@code INTERNAL} when a statement failed
 *   <li>{@code INVALID_ARGUMENT} when the request was rejected before touching the database
 * </ul>
 *
 * <p>Every failure is logged here. Callers that only need a fallback value can use {@link
 * StatusOr#getOrDefault}.
 */
public class FarmerCrmService {

  public static final int DEFAULT_FARMER_LIMIT = 100;
  public static final int DEFAULT_CONVERSATION_LIMIT = 10;
  public static final int APPROVAL_QUEUE_LIMIT = 100;

  private final Config config;

  /** @param dataSource the process-wide connection pool, see {@link com.farmcrm.config.DataSources} */
  public record Config(DataSource dataSource) {}

  public FarmerCrmService(Config config) {
    this.config = config;
  }

  /** Loads a farmer by id. */
  public StatusOr<Optional<Farmer>> getFarmer(long farmerId) {
    return withConnection("load farmer " + farmerId, conn -> Farmers.loadById(conn, farmerId));
  }

  /** Lists the first {@value #DEFAULT_FARMER_LIMIT} farmers by farm name. */
  public StatusOr<List<FarmerSummary>> listFarmers() {
    return listFarmers(DEFAULT_FARMER_LIMIT);
  }

  /** Lists up to {@code limit} farmers ordered by farm name. */
  public StatusOr<List<FarmerSummary>> listFarmers(int limit) {
    if (limit < 0) {
      return rejected("limit must not be negative: " + limit);
    }
    return withConnection("list farmers", conn -> Farmers.loadSummaries(conn, limit));
  }

  /** Lists a farmer's fields with the crop currently planted in each, ordered by field name. */
  public StatusOr<List<FieldView>> listFields(long farmerId) {
    return withConnection(
        "list fields of farmer " + farmerId, conn -> Fields.loadByFarmer(conn, farmerId));
  }

  /** Lists the {@value #DEFAULT_CONVERSATION_LIMIT} most recent messages of a farmer. */
  public StatusOr<List<ConversationTurn>> listRecentConversations(long farmerId) {
    return listRecentConversations(farmerId, DEFAULT_CONVERSATION_LIMIT);
  }

  /** Lists up to {@code limit} messages of a farmer, newest first. */
  public StatusOr<List<ConversationTurn>> listRecentConversations(long farmerId, int limit) {
    if (limit < 0) {
      return rejected("limit must not be negative: " + limit);
    }
    return withConnection(
        "list conversations of farmer " + farmerId,
        conn -> Messages.loadRecent(conn, farmerId, limit));
  }

  /**
   * Stores a question and its answer as a user message followed by an assistant message.
   *
   * <p>Both rows are written in one transaction: either both become visible or neither does.
   *
   * @return the id of the assistant message
   */
  public StatusOr<Long> saveConversation(long farmerId, ConversationRequest request) {
    if (request == null || request.question() == null || request.answer() == null) {
      return rejected("question and answer are required");
    }
    StatusOr<Long> idOr =
        withConnection(
            "save conversation for farmer " + farmerId,
            conn -> inTransaction(conn, tx -> insertPair(tx, farmerId, request)));
    if (idOr.isOk()) {
      Logger.info(
          "Saved conversation pair for farmer {} (assistant message {})",
          farmerId,
          idOr.getValue());
    }
    return idOr;
  }

  /** Looks up a crop by name, ignoring case. */
  public StatusOr<Optional<CropInfo>> getCropInfo(String cropName) {
    if (cropName == null) {
      return rejected("crop name is required");
    }
    return withConnection(
        "look up crop " + cropName, conn -> CropTechnology.findByName(conn, cropName));
  }

  /**
   * Builds the review queue: the latest user message of each farmer, newest first, at most
   * {@value #APPROVAL_QUEUE_LIMIT} entries. The approved bucket is always empty.
   */
  public StatusOr<ApprovalQueue> listApprovalQueue() {
    StatusOr<List<ApprovalEntry>> entriesOr =
        withConnection(
            "load approval queue",
            conn -> Messages.loadLatestUserMessages(conn, APPROVAL_QUEUE_LIMIT));
    return entriesOr.map(ApprovalQueue::ofUnapproved);
  }

  /** Loads a single message with its farmer's display fields. */
  public StatusOr<Optional<ConversationDetails>> getConversationDetails(long messageId) {
    return withConnection(
        "load conversation " + messageId, conn -> Messages.loadDetails(conn, messageId));
  }

  /**
   * Returns true if the farmers table can be counted. Never throws; an unreachable database
   * yields false.
   */
  public boolean healthCheck() {
    StatusOr<Long> countOr = withConnection("run health check", Table.FARMERS::countRows);
    if (countOr.isNotOk()) {
      return false;
    }
    Logger.info("Database health check: connected, {} farmers", countOr.getValue());
    return true;
  }

  /** Counts the rows of every table this service uses, in {@link Table} order. */
  public StatusOr<Map<String, Long>> tableCounts() {
    return withConnection(
        "count table rows",
        conn -> {
          ImmutableMap.Builder<String, Long> counts = ImmutableMap.builder();
          for (Table table : Table.values()) {
            StatusOr<Long> countOr = table.countRows(conn);
            if (countOr.isNotOk()) {
              return StatusOr.ofStatus(countOr.getStatus());
            }
            counts.put(table.tableName(), countOr.getValue());
          }
          return StatusOr.ofValue(counts.build());
        });
  }

  private static StatusOr<Long> insertPair(
      Connection conn, long farmerId, ConversationRequest request) {
    String phone = request.phoneOrUnknown();
    StatusOr<Long> userIdOr =
        Messages.insert(conn, farmerId, phone, request.question(), MessageRole.USER);
    if (userIdOr.isNotOk()) {
      return userIdOr;
    }
    return Messages.insert(conn, farmerId, phone, request.answer(), MessageRole.ASSISTANT);
  }

  /**
   * Runs {@code work} with auto-commit off. Commits if it returns OK, otherwise rolls back.
   * Auto-commit is restored before the connection goes back to the pool.
   */
  private static <T> StatusOr<T> inTransaction(
      Connection conn, Function<Connection, StatusOr<T>> work) {
    try {
      conn.setAutoCommit(false);
      conn.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
      try {
        StatusOr<T> result = work.apply(conn);
        if (result.isOk()) {
          conn.commit();
        } else {
          conn.rollback();
        }
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e));
    }
  }

  private static void rollbackQuietly(Connection conn, Exception original) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      original.addSuppressed(e);
    }
  }

  private <T> StatusOr<T> withConnection(
      String operation, Function<Connection, StatusOr<T>> work) {
    StatusOr<T> result;
    try (Connection conn = config.dataSource().getConnection()) {
      result = work.apply(conn);
    } catch (SQLException e) {
      result = StatusOr.ofStatus(DbUtil.toStatus(e));
    } catch (RuntimeException e) {
      result = StatusOr.ofException(e);
    }
    if (result.isNotOk()) {
      Status status = result.getStatus();
      if (status.getCause() != null) {
        Logger.error(status.getCause(), "Failed to {}: {}", operation, status);
      } else {
        Logger.error("Failed to {}: {}", operation, status);
      }
    }
    return result;
  }

  private static <T> StatusOr<T> rejected(String message) {
    Logger.error("Rejected request: {}", message);
    return StatusOr.ofStatus(Status.invalidArgument(message));
  }
}
