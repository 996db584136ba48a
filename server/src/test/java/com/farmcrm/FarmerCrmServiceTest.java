package com.farmcrm;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.farmcrm.common.status.StatusCode;
import com.farmcrm.common.status.StatusOr;
import com.farmcrm.db.ApprovalQueue;
import com.farmcrm.db.ConversationRequest;
import com.farmcrm.db.Farmer;
import com.farmcrm.db.FarmerSummary;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for FarmerCrmService against a mocked connection pool.
 *
 * <p>These cover failure handling, connection release and transaction boundaries. Query results
 * against a real database are covered by FarmerCrmServiceIntegrationTest.
 */
@ExtendWith(MockitoExtension.class)
public class FarmerCrmServiceTest {

  @Mock private DataSource dataSource;
  @Mock private Connection connection;
  @Mock private PreparedStatement statement;
  @Mock private ResultSet resultSet;

  private FarmerCrmService service;

  @BeforeEach
  void setUp() {
    service = new FarmerCrmService(new FarmerCrmService.Config(dataSource));
  }

  @Test
  void testHealthCheckReturnsFalseWhenDatabaseIsUnreachable() throws SQLException {
    when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

    assertFalse(service.healthCheck());
  }

  @Test
  void testReadsReportUnavailableWhenDatabaseIsUnreachable() throws SQLException {
    when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

    StatusOr<Optional<Farmer>> farmerOr = service.getFarmer(1);
    assertTrue(farmerOr.isNotOk());
    assertEquals(StatusCode.UNAVAILABLE, farmerOr.getStatus().getCode());

    StatusOr<ApprovalQueue> queueOr = service.listApprovalQueue();
    assertEquals(StatusCode.UNAVAILABLE, queueOr.getStatus().getCode());
    assertEquals(
        List.of(), service.listFarmers().getOrDefault(List.<FarmerSummary>of()));
  }

  @Test
  void testStatementFailureIsInternalAndConnectionIsReleased() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString()))
        .thenThrow(new SQLException("relation \"farmers\" does not exist", "42P01"));

    StatusOr<Optional<Farmer>> farmerOr = service.getFarmer(7);

    assertEquals(StatusCode.INTERNAL, farmerOr.getStatus().getCode());
    verify(connection).close();
  }

  @Test
  void testNotFoundIsAnEmptyResultNotAnError() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(false);

    StatusOr<Optional<Farmer>> farmerOr = service.getFarmer(404);

    assertTrue(farmerOr.isOk());
    assertTrue(farmerOr.getValue().isEmpty());
    verify(statement).setLong(1, 404L);
    verify(resultSet).close();
    verify(statement).close();
    verify(connection).close();
  }

  @Test
  void testSaveConversationCommitsBothInserts() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(true);
    when(resultSet.getLong(1)).thenReturn(41L, 42L);

    StatusOr<Long> idOr =
        service.saveConversation(3, new ConversationRequest("When to plant?", "In April."));

    assertTrue(idOr.isOk());
    assertEquals(42L, idOr.getValue());

    InOrder order = inOrder(connection, statement);
    order.verify(connection).setAutoCommit(false);
    order.verify(statement).setString(2, "unknown");
    order.verify(statement).setString(3, "When to plant?");
    order.verify(statement).setString(4, "user");
    order.verify(statement).setString(3, "In April.");
    order.verify(statement).setString(4, "assistant");
    order.verify(connection).commit();
    order.verify(connection).setAutoCommit(true);
    order.verify(connection).close();
    verify(connection, never()).rollback();
  }

  @Test
  void testSaveConversationRollsBackWhenSecondInsertFails() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery())
        .thenReturn(resultSet)
        .thenThrow(new SQLException("value too long for type character varying(20)", "22001"));
    when(resultSet.next()).thenReturn(true);
    when(resultSet.getLong(1)).thenReturn(41L);

    StatusOr<Long> idOr =
        service.saveConversation(3, new ConversationRequest("q", "a", "555-0100"));

    assertTrue(idOr.isNotOk());
    assertEquals(StatusCode.INTERNAL, idOr.getStatus().getCode());
    verify(connection).rollback();
    verify(connection, never()).commit();
    verify(connection).setAutoCommit(true);
    verify(connection).close();
  }

  @Test
  void testSaveConversationReportsFailedCommit() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(true);
    when(resultSet.getLong(1)).thenReturn(41L, 42L);
    doThrow(new SQLException("An I/O error occurred", "08006"))
        .when(connection)
        .commit();

    StatusOr<Long> idOr = service.saveConversation(3, new ConversationRequest("q", "a"));

    assertEquals(StatusCode.UNAVAILABLE, idOr.getStatus().getCode());
    verify(connection).rollback();
    verify(connection).close();
  }

  @Test
  void testSaveConversationRejectsMissingText() {
    StatusOr<Long> idOr = service.saveConversation(3, new ConversationRequest(null, "a"));

    assertEquals(StatusCode.INVALID_ARGUMENT, idOr.getStatus().getCode());
    verifyNoInteractions(dataSource);
  }

  @Test
  void testNegativeLimitsAreRejected() {
    assertEquals(StatusCode.INVALID_ARGUMENT, service.listFarmers(-1).getStatus().getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.listRecentConversations(1, -5).getStatus().getCode());
    verifyNoInteractions(dataSource);
  }

  @Test
  void testUnexpectedRuntimeFailureDoesNotEscape() throws SQLException {
    when(dataSource.getConnection()).thenThrow(new IllegalStateException("pool closed"));

    assertFalse(service.healthCheck());
    assertEquals(StatusCode.INTERNAL, service.listFields(1).getStatus().getCode());
  }
}
