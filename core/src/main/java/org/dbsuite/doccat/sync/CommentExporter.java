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

import org.dbsuite.doccat.catalog.CatalogIntrospector;
import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.config.DocCatConfig;
import org.dbsuite.doccat.runtime.JdbcEnumerable;
import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlJoin;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlNodeList;
import org.dbsuite.doccat.sql.SqlSelect;
import org.dbsuite.doccat.sql.SqlStdOperatorTable;
import org.dbsuite.doccat.sql.SqlTableRef;
import org.dbsuite.doccat.sql.ddl.SqlCommentOn;

import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Turns extended comments into native comment statements.
 *
 * <p>Only objects that still exist in the native catalog are exported; an
 * extended row whose object has gone is skipped. Every non-null comment is
 * exported, including an empty one. Kinds are visited in
 * {@link ObjectKind#EXPORT_ORDER}, and rows in key order, so two exports of
 * unchanged data produce the same statements.
 */
public class CommentExporter {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CommentExporter.class);

  private final DataSource dataSource;
  private final SqlDialect dialect;
  private final DocCatConfig config;
  private final CatalogIntrospector introspector;
  private final CommentText commentText;

  public CommentExporter(DataSource dataSource, SqlDialect dialect,
      DocCatConfig config) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    this.config = config;
    this.introspector = new CatalogIntrospector(dataSource, dialect);
    this.commentText = CommentText.of(config);
  }

  /**
   * Returns the statements that would copy the extended comments into the
   * native catalog.
   *
   * <p>The result is lazy. Each enumeration queries the extended store
   * again; the kinds to visit are decided when this method is called.
   */
  public Enumerable<CommentStatement> exportStatements() {
    final List<Enumerable<CommentStatement>> enumerables = new ArrayList<>();
    for (ObjectKind kind : ObjectKind.EXPORT_ORDER) {
      if (introspector.tableExists(config.extendedSchema(), kind.tableName())
          && introspector.tableExists(config.nativeSchema(),
              kind.tableName())) {
        enumerables.add(statements(kind));
      } else {
        LOGGER.debug("Skipping {}; no extended or native table", kind);
      }
    }
    return Linq4j.concat(enumerables);
  }

  private Enumerable<CommentStatement> statements(ObjectKind kind) {
    final String sql = query(kind).toSqlString(dialect);
    final int keyCount = kind.keyColumns.size();
    final boolean hasDiscriminator = kind.discriminatorColumn() != null;
    return JdbcEnumerable.<Row>of(dataSource, sql, resultSet -> () -> {
      final ImmutableList.Builder<String> key = ImmutableList.builder();
      for (int i = 1; i <= keyCount; i++) {
        key.add(
            Strings.nullToEmpty(JdbcEnumerable.getString(sql, resultSet, i)));
      }
      final @Nullable String discriminator = hasDiscriminator
          ? JdbcEnumerable.getString(sql, resultSet, keyCount + 1)
          : null;
      final @Nullable String text = JdbcEnumerable.getString(sql, resultSet,
          keyCount + (hasDiscriminator ? 2 : 1));
      return new Row(key.build(), discriminator, text);
    })
        .select(row -> toStatement(kind, row));
  }

  /** Returns the query that reads the exportable comments of a kind. */
  SqlSelect query(ObjectKind kind) {
    final String d = "D";
    final String s = "S";
    final ImmutableList.Builder<SqlNode> selectList = ImmutableList.builder();
    final ImmutableList.Builder<SqlNode> orderBy = ImmutableList.builder();
    final ImmutableList.Builder<SqlNode> conditions = ImmutableList.builder();
    for (String key : kind.keyColumns) {
      selectList.add(SqlIdentifier.of(d, key));
      orderBy.add(SqlIdentifier.of(d, key));
      conditions.add(
          SqlStdOperatorTable.eq(SqlIdentifier.of(s, key),
              SqlIdentifier.of(d, key)));
    }
    final String discriminator = kind.discriminatorColumn();
    if (discriminator != null) {
      selectList.add(SqlIdentifier.of(s, discriminator));
    }
    final SqlIdentifier comment = SqlIdentifier.of(d, config.commentColumn());
    selectList.add(comment);
    return new SqlSelect(new SqlNodeList(selectList.build()),
        new SqlJoin(
            new SqlTableRef(
                SqlIdentifier.of(config.extendedSchema(), kind.tableName()),
                d),
            SqlJoin.JoinType.INNER,
            new SqlTableRef(
                SqlIdentifier.of(config.nativeSchema(), kind.tableName()), s),
            SqlStdOperatorTable.and(conditions.build())),
        SqlStdOperatorTable.IS_NOT_NULL.createCall(comment),
        new SqlNodeList(orderBy.build()));
  }

  private CommentStatement toStatement(ObjectKind kind, Row row) {
    final String text = row.text;
    final String fitted = commentText.encode(text);
    final SqlCommentOn node =
        new SqlCommentOn(kind.commentTarget(row.discriminator),
            new SqlIdentifier(row.key), fitted);
    return new CommentStatement(kind, node, node.toSqlString(dialect),
        CommentText.length(text), !fitted.equals(text));
  }

  /**
   * Executes every export statement against the native catalog, in one
   * transaction.
   *
   * <p>The statements are read in full before the first is executed, so
   * that the comments being written do not disturb the query that reads
   * them.
   */
  public ExportSummary exportToNative() {
    final List<CommentStatement> statements = exportStatements().toList();
    int truncated = 0;
    try (Connection connection = dataSource.getConnection()) {
      final boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try (Statement statement = connection.createStatement()) {
        for (CommentStatement commentStatement : statements) {
          if (commentStatement.isTruncated()) {
            ++truncated;
            LOGGER.info(
                RESOURCE.commentTruncated(commentStatement.node.name.toString(),
                    commentStatement.originalLength).str());
          }
          LOGGER.debug("Executing [{}]", commentStatement.sql);
          execute(statement, commentStatement.sql);
        }
        connection.commit();
      } catch (RuntimeException e) {
        JdbcSupport.rollback(connection, e);
        throw e;
      } finally {
        connection.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw RESOURCE.statementFailed("COMMIT").ex(e);
    }
    final ExportSummary summary =
        new ExportSummary(statements.size(), truncated);
    LOGGER.info("Exported comments: {}", summary);
    return summary;
  }

  private static void execute(Statement statement, String sql) {
    try {
      statement.execute(sql);
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(sql).ex(e);
    }
  }

  /** Extended comment row joined with its native object. */
  private static class Row {
    final ImmutableList<String> key;
    final @Nullable String discriminator;
    final String text;

    Row(ImmutableList<String> key, @Nullable String discriminator,
        @Nullable String text) {
      this.key = key;
      this.discriminator = discriminator;
      this.text = text == null ? "" : text;
    }
  }
}
