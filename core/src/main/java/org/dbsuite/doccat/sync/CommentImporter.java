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
import org.dbsuite.doccat.runtime.ImportIncompleteException;
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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Copies native comments into the extended store.
 *
 * <p>Import is a mirror, not a merge. For each kind it replaces the whole
 * extended table with the non-blank comments of the native catalog, so
 * extended comments of objects the native catalog does not comment on are
 * lost, and so is any text that was longer than the native catalog allows.
 */
public class CommentImporter {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CommentImporter.class);

  private final DataSource dataSource;
  private final SqlDialect dialect;
  private final DocCatConfig config;
  private final CatalogIntrospector introspector;

  public CommentImporter(DataSource dataSource, SqlDialect dialect,
      DocCatConfig config) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    this.config = config;
    this.introspector = new CatalogIntrospector(dataSource, dialect);
  }

  /** Returns the kinds that have both an extended and a native table,
   * sorted by table name. */
  public List<ObjectKind> importableKinds() {
    final List<ObjectKind> kinds = new ArrayList<>();
    for (ObjectKind kind : ObjectKind.values()) {
      if (introspector.tableExists(config.extendedSchema(), kind.tableName())
          && introspector.tableExists(config.nativeSchema(),
              kind.tableName())) {
        kinds.add(kind);
      }
    }
    kinds.sort(Comparator.comparing(ObjectKind::tableName));
    return kinds;
  }

  /**
   * Replaces the extended comments with the native ones.
   *
   * <p>Destroys data: every extended row of an imported kind is deleted
   * first, including rows whose object has no native comment, and long
   * comments come back as the native catalog stored them. Each kind is
   * committed on its own; if one fails it is rolled back and the kinds
   * already committed stay imported.
   *
   * @throws ImportIncompleteException if a kind could not be imported
   */
  public ImportSummary importFromNative() {
    final List<ObjectKind> kinds = importableKinds();
    final Map<ObjectKind, Integer> counts = new LinkedHashMap<>();
    final List<ObjectKind> committed = new ArrayList<>();
    try (Connection connection = dataSource.getConnection()) {
      final boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try {
        for (ObjectKind kind : kinds) {
          try {
            counts.put(kind, importKind(connection, kind));
            connection.commit();
            committed.add(kind);
          } catch (SQLException | RuntimeException e) {
            JdbcSupport.rollback(connection, e);
            throw new ImportIncompleteException(
                RESOURCE.importIncomplete(kind.name(), committed.toString())
                    .str(),
                e, kind, committed);
          }
        }
      } finally {
        connection.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw RESOURCE.statementFailed("COMMIT").ex(e);
    }
    final ImportSummary summary = new ImportSummary(counts);
    LOGGER.info("Imported comments: {}", summary);
    return summary;
  }

  private int importKind(Connection connection, ObjectKind kind)
      throws SQLException {
    final SqlIdentifier extended =
        SqlIdentifier.of(config.extendedSchema(), kind.tableName());
    final SqlIdentifier nativeTable =
        SqlIdentifier.of(config.nativeSchema(), kind.tableName());
    final List<String> carried = carriedColumns(kind);

    final List<String> columns = new ArrayList<>(kind.keyColumns);
    columns.addAll(carried);
    columns.add(config.commentColumn());

    JdbcSupport.update(connection,
        new SqlDelete(extended, null).toSqlString(dialect), ImmutableList.of());

    final SqlIdentifier comment = SqlIdentifier.of(config.commentColumn());
    final SqlSelect select =
        new SqlSelect(SqlNodeList.ofNames(columns),
            new SqlTableRef(nativeTable, null),
            SqlStdOperatorTable.IS_NOT_NULL.createCall(comment),
            SqlNodeList.ofNames(kind.keyColumns));
    final List<SqlNode> params = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      params.add(SqlDynamicParam.INSTANCE);
    }
    final String insertSql =
        new SqlInsert(extended, SqlNodeList.ofNames(columns),
            new SqlNodeList(params)).toSqlString(dialect);
    final String selectSql = select.toSqlString(dialect);

    final int nameIndex = nameColumnIndex(kind, columns);
    final int ordinalIndex = kind.keyColumns.indexOf("ORDINAL");
    final int commentIndex = columns.size() - 1;
    int count = 0;
    LOGGER.debug("Executing [{}]", selectSql);
    try (PreparedStatement query = connection.prepareStatement(selectSql);
         ResultSet resultSet = query.executeQuery();
         PreparedStatement insert = connection.prepareStatement(insertSql)) {
      while (resultSet.next()) {
        final List<@Nullable Object> row = new ArrayList<>();
        for (int i = 0; i < commentIndex; i++) {
          row.add(resultSet.getObject(i + 1));
        }
        final String text = resultSet.getString(commentIndex + 1);
        row.add(text);
        if (CommentText.isBlank(text)) {
          continue;
        }
        for (int i = 0; i < kind.keyColumns.size(); i++) {
          if (row.get(i) == null) {
            row.set(i, "");
          }
        }
        if (nameIndex >= 0 && ordinalIndex >= 0
            && CommentText.isBlank((String) row.get(nameIndex))) {
          final Object ordinal = row.get(ordinalIndex);
          row.set(nameIndex,
              kind.defaultName(((Number) ordinal).intValue()));
        }
        JdbcSupport.bind(insert, row);
        insert.addBatch();
        ++count;
      }
      if (count > 0) {
        insert.executeBatch();
      }
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(insertSql).ex(e);
    }
    LOGGER.debug("Imported {} {} comments", count, kind);
    return count;
  }

  /** Returns the carried columns of a kind that the extended table has. */
  private List<String> carriedColumns(ObjectKind kind) {
    if (kind.carriedColumns().isEmpty()) {
      return ImmutableList.of();
    }
    final List<String> extendedColumns = new ArrayList<>();
    for (CatalogColumn column
        : introspector.columnsOf(config.extendedSchema(), kind.tableName())) {
      extendedColumns.add(column.name);
    }
    final List<String> carried = new ArrayList<>();
    for (String column : kind.carriedColumns()) {
      if (extendedColumns.contains(column)) {
        carried.add(column);
      }
    }
    return carried;
  }

  private static int nameColumnIndex(ObjectKind kind, List<String> columns) {
    final String nameColumn = kind.defaultNameColumn();
    return nameColumn == null ? -1 : columns.indexOf(nameColumn);
  }
}
