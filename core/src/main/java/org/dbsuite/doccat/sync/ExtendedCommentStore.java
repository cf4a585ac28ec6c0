/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dbsuite.doccat.sync;

import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.config.DocCatConfig;
import org.dbsuite.doccat.generate.TriggerAction;
import org.dbsuite.doccat.sql.SqlDelete;
import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.SqlDynamicParam;
import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlInsert;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlNodeList;
import org.dbsuite.doccat.sql.SqlSelect;
import org.dbsuite.doccat.sql.SqlStdOperatorTable;
import org.dbsuite.doccat.sql.SqlTableRef;
import org.dbsuite.doccat.sql.SqlUpdate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Reads and writes the extended comments of one object kind directly,
 * without going through a merge view.
 *
 * <p>{@link #apply} follows the same {@link TriggerAction} table as the
 * trigger on the merge view. The trigger copies the kind's
 * {@link ObjectKind#carriedColumns() carried columns} from the native row
 * when it creates an extended row; this class has no native row to copy
 * from, so rows it creates leave those columns null unless they are given
 * to {@link #put(CommentKey, String, Map)}.
 */
public class ExtendedCommentStore {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ExtendedCommentStore.class);

  private final DataSource dataSource;
  private final SqlDialect dialect;
  private final ObjectKind kind;
  private final SqlIdentifier table;
  private final String commentColumn;

  public ExtendedCommentStore(DataSource dataSource, SqlDialect dialect,
      DocCatConfig config, ObjectKind kind) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    this.kind = kind;
    this.table = SqlIdentifier.of(config.extendedSchema(), kind.tableName());
    this.commentColumn = config.commentColumn();
  }

  public ObjectKind kind() {
    return kind;
  }

  /** Returns the extended comment of an object, or null if it has none. */
  public @Nullable String find(CommentKey key) {
    checkKind(key);
    try (Connection connection = dataSource.getConnection()) {
      return find(connection, key);
    } catch (SQLException e) {
      throw RESOURCE.metadataFailed(table.toString()).ex(e);
    }
  }

  /** Returns whether an object has an extended row. */
  public boolean exists(CommentKey key) {
    checkKind(key);
    try (Connection connection = dataSource.getConnection()) {
      return exists(connection, key);
    } catch (SQLException e) {
      throw RESOURCE.metadataFailed(table.toString()).ex(e);
    }
  }

  /** Sets the extended comment of an object, creating its row if
   * needed. */
  public void put(CommentKey key, String text) {
    put(key, text, ImmutableMap.of());
  }

  /**
   * Sets the extended comment of an object, creating its row if needed.
   *
   * @param carried Values of carried columns, written only if the row is
   *                created
   */
  public void put(CommentKey key, String text, Map<String, ?> carried) {
    checkKind(key);
    Preconditions.checkNotNull(text, "text");
    for (String column : carried.keySet()) {
      Preconditions.checkArgument(kind.carriedColumns().contains(column),
          "%s is not a carried column of %s", column, kind);
    }
    inTransaction(connection -> {
      if (exists(connection, key)) {
        update(connection, key, text);
        return TriggerAction.UPDATE;
      } else {
        insert(connection, key, carried, text);
        return TriggerAction.INSERT;
      }
    });
  }

  /** Removes the extended row of an object. Returns whether there was
   * one. */
  public boolean delete(CommentKey key) {
    checkKind(key);
    return inTransaction(connection ->
        JdbcSupport.update(connection, deleteSql(), key.values) > 0
            ? TriggerAction.DELETE
            : TriggerAction.NOOP) == TriggerAction.DELETE;
  }

  /**
   * Writes a comment the way the merge view's trigger does: a null comment
   * removes the extended row, any other comment (the empty string included)
   * creates or replaces it.
   *
   * @return The action that was performed
   */
  public TriggerAction apply(CommentKey key, @Nullable String text) {
    checkKind(key);
    return inTransaction(connection -> {
      final TriggerAction action =
          TriggerAction.of(exists(connection, key), text == null);
      switch (action) {
      case INSERT:
        insert(connection, key, ImmutableMap.of(), text);
        break;
      case UPDATE:
        update(connection, key, text);
        break;
      case DELETE:
        JdbcSupport.update(connection, deleteSql(), key.values);
        break;
      default:
        break;
      }
      LOGGER.debug("{} on {}", action, key);
      return action;
    });
  }

  /** Returns the number of extended rows. */
  public int count() {
    final String sql = "SELECT COUNT(*) FROM " + table.toSqlString(dialect);
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(sql);
         ResultSet resultSet = statement.executeQuery()) {
      resultSet.next();
      return resultSet.getInt(1);
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(sql).ex(e);
    }
  }

  private void checkKind(CommentKey key) {
    Preconditions.checkArgument(key.kind == kind,
        "key %s is not of kind %s", key, kind);
  }

  private TriggerAction inTransaction(Work work) {
    try (Connection connection = dataSource.getConnection()) {
      final boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try {
        final TriggerAction action = work.run(connection);
        connection.commit();
        return action;
      } catch (SQLException | RuntimeException e) {
        JdbcSupport.rollback(connection, e);
        throw e;
      } finally {
        connection.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(table.toString()).ex(e);
    }
  }

  private @Nullable String find(Connection connection, CommentKey key)
      throws SQLException {
    final SqlSelect select =
        new SqlSelect(
            new SqlNodeList(ImmutableList.of(SqlIdentifier.of(commentColumn))),
            new SqlTableRef(table, null), keyCondition(), null);
    final String sql = select.toSqlString(dialect);
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      JdbcSupport.bind(statement, key.values);
      try (ResultSet resultSet = statement.executeQuery()) {
        return resultSet.next() ? resultSet.getString(1) : null;
      }
    }
  }

  private boolean exists(Connection connection, CommentKey key)
      throws SQLException {
    final SqlSelect select =
        new SqlSelect(
            new SqlNodeList(
                ImmutableList.of(SqlIdentifier.of(kind.keyColumns.get(0)))),
            new SqlTableRef(table, null), keyCondition(), null);
    final String sql = select.toSqlString(dialect);
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      JdbcSupport.bind(statement, key.values);
      try (ResultSet resultSet = statement.executeQuery()) {
        return resultSet.next();
      }
    }
  }

  private void insert(Connection connection, CommentKey key,
      Map<String, ?> carried, @Nullable String text) {
    final List<String> columns = new ArrayList<>(kind.keyColumns);
    columns.addAll(carried.keySet());
    columns.add(commentColumn);
    final List<SqlNode> params = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      params.add(SqlDynamicParam.INSTANCE);
    }
    final SqlInsert insert =
        new SqlInsert(table, SqlNodeList.ofNames(columns),
            new SqlNodeList(params));
    final List<@Nullable Object> values = new ArrayList<>(key.values);
    values.addAll(carried.values());
    values.add(text);
    JdbcSupport.update(connection, insert.toSqlString(dialect), values);
  }

  private void update(Connection connection, CommentKey key,
      @Nullable String text) {
    final SqlUpdate update =
        new SqlUpdate(table,
            SqlNodeList.ofNames(ImmutableList.of(commentColumn)),
            new SqlNodeList(ImmutableList.of(SqlDynamicParam.INSTANCE)),
            keyCondition());
    final List<@Nullable Object> values = new ArrayList<>();
    values.add(text);
    values.addAll(key.values);
    JdbcSupport.update(connection, update.toSqlString(dialect), values);
  }

  private String deleteSql() {
    return new SqlDelete(table, keyCondition()).toSqlString(dialect);
  }

  /** Returns {@code k1 = ? AND k2 = ? ...}. */
  private SqlNode keyCondition() {
    final ImmutableList.Builder<SqlNode> conditions = ImmutableList.builder();
    for (String keyColumn : kind.keyColumns) {
      conditions.add(
          SqlStdOperatorTable.eq(SqlIdentifier.of(keyColumn),
              SqlDynamicParam.INSTANCE));
    }
    return SqlStdOperatorTable.and(conditions.build());
  }

  /** Unit of work run in a transaction. */
  @FunctionalInterface
  private interface Work {
    TriggerAction run(Connection connection) throws SQLException;
  }
}
