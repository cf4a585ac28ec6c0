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

import org.dbsuite.doccat.catalog.CatalogColumn;
import org.dbsuite.doccat.catalog.CatalogIntrospector;
import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.config.DocCatConfig;
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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Copies the extended comments of a routine, and of its parameters, to
 * another specific routine of the same schema. Used to document overloads
 * that share a description.
 */
public class RoutineCommentCopier {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RoutineCommentCopier.class);

  static final String SCHEMA_COLUMN = "ROUTINESCHEMA";
  static final String SPECIFIC_NAME_COLUMN = "SPECIFICNAME";

  private final DataSource dataSource;
  private final SqlDialect dialect;
  private final DocCatConfig config;
  private final CatalogIntrospector introspector;

  public RoutineCommentCopier(DataSource dataSource, SqlDialect dialect,
      DocCatConfig config) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    this.config = config;
    this.introspector = new CatalogIntrospector(dataSource, dialect);
  }

  /**
   * Replaces the comments of routine {@code target} and its parameters with
   * copies of those of {@code source}. Runs in one transaction.
   *
   * @return Number of rows copied
   */
  public int copy(String schema, String source, String target) {
    final List<ObjectKind> kinds = new ArrayList<>();
    for (ObjectKind kind
        : ImmutableList.of(ObjectKind.ROUTINES, ObjectKind.ROUTINEPARMS)) {
      if (introspector.tableExists(config.extendedSchema(), kind.tableName())) {
        kinds.add(kind);
      }
    }
    int count = 0;
    try (Connection connection = dataSource.getConnection()) {
      final boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try {
        for (ObjectKind kind : kinds) {
          count += copy(connection, kind, schema, source, target);
        }
        connection.commit();
      } catch (SQLException | RuntimeException e) {
        JdbcSupport.rollback(connection, e);
        throw e;
      } finally {
        connection.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw RESOURCE.statementFailed("COMMIT").ex(e);
    }
    LOGGER.info("Copied {} comments of routine {}.{} to {}", count, schema,
        source, target);
    return count;
  }

  private int copy(Connection connection, ObjectKind kind, String schema,
      String source, String target) throws SQLException {
    final SqlIdentifier table =
        SqlIdentifier.of(config.extendedSchema(), kind.tableName());
    final List<String> columns = new ArrayList<>();
    for (CatalogColumn column
        : introspector.columnsOf(config.extendedSchema(), kind.tableName())) {
      columns.add(column.name);
    }
    final int nameIndex = columns.indexOf(SPECIFIC_NAME_COLUMN);
    final SqlNode routineCondition =
        SqlStdOperatorTable.and(
            ImmutableList.of(
                SqlStdOperatorTable.eq(SqlIdentifier.of(SCHEMA_COLUMN),
                    SqlDynamicParam.INSTANCE),
                SqlStdOperatorTable.eq(SqlIdentifier.of(SPECIFIC_NAME_COLUMN),
                    SqlDynamicParam.INSTANCE)));

    final List<List<@Nullable Object>> rows = new ArrayList<>();
    final String selectSql =
        new SqlSelect(SqlNodeList.ofNames(columns),
            new SqlTableRef(table, null), routineCondition,
            SqlNodeList.ofNames(kind.keyColumns)).toSqlString(dialect);
    LOGGER.debug("Executing [{}]", selectSql);
    try (PreparedStatement statement = connection.prepareStatement(selectSql)) {
      JdbcSupport.bind(statement, ImmutableList.of(schema, source));
      try (ResultSet resultSet = statement.executeQuery()) {
        while (resultSet.next()) {
          final List<@Nullable Object> row = new ArrayList<>();
          for (int i = 0; i < columns.size(); i++) {
            row.add(resultSet.getObject(i + 1));
          }
          row.set(nameIndex, target);
          rows.add(row);
        }
      }
    }

    JdbcSupport.update(connection,
        new SqlDelete(table, routineCondition).toSqlString(dialect),
        ImmutableList.of(schema, target));

    final List<SqlNode> params = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      params.add(SqlDynamicParam.INSTANCE);
    }
    final String insertSql =
        new SqlInsert(table, SqlNodeList.ofNames(columns),
            new SqlNodeList(params)).toSqlString(dialect);
    for (List<@Nullable Object> row : rows) {
      JdbcSupport.update(connection, insertSql, row);
    }
    return rows.size();
  }
}
