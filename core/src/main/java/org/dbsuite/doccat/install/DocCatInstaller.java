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
package org.dbsuite.doccat.install;

import org.dbsuite.doccat.catalog.CatalogColumn;
import org.dbsuite.doccat.catalog.CatalogIntrospector;
import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.catalog.RoutineRef;
import org.dbsuite.doccat.config.DocCatConfig;
import org.dbsuite.doccat.generate.MergeViewTemplate;
import org.dbsuite.doccat.generate.MergeViews;
import org.dbsuite.doccat.generate.SyncTriggers;
import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlLiteral;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlNodeList;
import org.dbsuite.doccat.sql.SqlStdOperatorTable;
import org.dbsuite.doccat.sql.ddl.SqlColumnDeclaration;
import org.dbsuite.doccat.sql.ddl.SqlCreateAlias;
import org.dbsuite.doccat.sql.ddl.SqlCreateSchema;
import org.dbsuite.doccat.sql.ddl.SqlCreateTable;
import org.dbsuite.doccat.sql.ddl.SqlDropObject;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Creates and removes the objects of the unified schema, and creates the
 * extended store.
 *
 * <p>Installation reads the catalog and executes DDL as it goes; it expects
 * nobody else to change the three schemas meanwhile.
 */
public class DocCatInstaller {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DocCatInstaller.class);

  private final DocCatConfig config;
  private final CatalogIntrospector introspector;
  private final DdlExecutor executor;

  public DocCatInstaller(DataSource dataSource, SqlDialect dialect,
      DocCatConfig config) {
    this(config, new CatalogIntrospector(dataSource, dialect),
        new DdlExecutor(dataSource, dialect));
  }

  DocCatInstaller(DocCatConfig config, CatalogIntrospector introspector,
      DdlExecutor executor) {
    this.config = config;
    this.introspector = introspector;
    this.executor = executor;
  }

  /**
   * Creates the extended schema and, for each object kind whose native
   * table exists, an extended table if there is none yet.
   *
   * @return Names of the tables created
   */
  public List<String> createExtendedStore() {
    final String extended = config.extendedSchema();
    if (!introspector.schemaExists(extended)) {
      executor.execute(new SqlCreateSchema(SqlIdentifier.of(extended)));
    }
    final List<String> created = new ArrayList<>();
    for (ObjectKind kind : ObjectKind.values()) {
      final String table = kind.tableName();
      if (!introspector.tableExists(config.nativeSchema(), table)) {
        LOGGER.debug("No native table for {}", kind);
      } else if (introspector.tableExists(extended, table)) {
        LOGGER.debug("Extended table for {} exists", kind);
      } else {
        executor.execute(
            createTable(kind,
                introspector.columnsOf(config.nativeSchema(), table)));
        created.add(table);
      }
    }
    LOGGER.info("Created extended tables {}", created);
    return created;
  }

  /** Builds the extended table of a kind, with column types copied from the
   * native table. */
  SqlCreateTable createTable(ObjectKind kind,
      List<CatalogColumn> nativeColumns) {
    final String table = kind.tableName();
    final List<SqlColumnDeclaration> columns = new ArrayList<>();
    for (String key : kind.keyColumns) {
      final CatalogColumn column = nativeColumn(nativeColumns, table, key);
      columns.add(
          new SqlColumnDeclaration(SqlIdentifier.of(key), column.typeSpec(),
              true));
    }
    for (String carried : kind.carriedColumns()) {
      final CatalogColumn column = nativeColumn(nativeColumns, table, carried);
      columns.add(
          new SqlColumnDeclaration(SqlIdentifier.of(carried),
              column.typeSpec(), false));
    }
    final String longTextType = config.longTextType();
    columns.add(
        new SqlColumnDeclaration(SqlIdentifier.of(config.commentColumn()),
            longTextType != null
                ? longTextType
                : executor.getDialect().longTextType(),
            false));

    final List<SqlNode> checks = new ArrayList<>();
    for (Map.Entry<String, ImmutableList<String>> entry
        : kind.allowedValues().entrySet()) {
      final List<SqlNode> values = new ArrayList<>();
      for (String value : entry.getValue()) {
        values.add(SqlLiteral.createCharString(value));
      }
      checks.add(
          SqlStdOperatorTable.IN.createCall(SqlIdentifier.of(entry.getKey()),
              new SqlNodeList(values)));
    }
    for (String column : kind.nonNegativeColumns()) {
      checks.add(
          SqlStdOperatorTable.GREATER_THAN_OR_EQUAL.createCall(
              SqlIdentifier.of(column), SqlLiteral.createExactNumeric(0)));
    }
    return new SqlCreateTable(
        SqlIdentifier.of(config.extendedSchema(), table), columns,
        SqlNodeList.ofNames(kind.keyColumns), checks);
  }

  private CatalogColumn nativeColumn(List<CatalogColumn> columns,
      String table, String name) {
    for (CatalogColumn column : columns) {
      if (column.name.equals(name)) {
        return column;
      }
    }
    throw RESOURCE.columnNotFound(name, config.nativeSchema(), table).ex();
  }

  /**
   * Creates the unified schema's objects: for each native table, a merge
   * view and its trigger if the extended store has a table of the same name,
   * otherwise an alias of the native table.
   *
   * <p>Meant for a unified schema that holds none of these objects yet.
   */
  public InstallSummary install() {
    final String unified = config.unifiedSchema();
    if (!introspector.schemaExists(unified)) {
      executor.execute(new SqlCreateSchema(SqlIdentifier.of(unified)));
    }
    final List<String> mergeViews = new ArrayList<>();
    final List<String> aliases = new ArrayList<>();
    for (String table
        : introspector.tableNames(config.nativeSchema(), "TABLE", "VIEW")) {
      if (introspector.tableExists(config.extendedSchema(), table)) {
        createMergeView(table);
        mergeViews.add(table);
      } else {
        executor.execute(
            new SqlCreateAlias(SqlIdentifier.of(unified, table),
                SqlIdentifier.of(config.nativeSchema(), table)));
        aliases.add(table);
      }
    }
    final InstallSummary summary = new InstallSummary(mergeViews, aliases);
    LOGGER.info("Installed {}: {}", unified, summary);
    return summary;
  }

  private void createMergeView(String table) {
    final MergeViewTemplate template =
        MergeViewTemplate.derive(config, table,
            introspector.columnsOf(config.nativeSchema(), table),
            introspector.columnsOf(config.extendedSchema(), table));
    executor.execute(MergeViews.createView(template));
    try {
      executor.execute(SyncTriggers.createTrigger(template));
    } catch (RuntimeException e) {
      try {
        executor.execute(
            new SqlDropObject(SqlDropObject.ObjectType.VIEW,
                template.unifiedView(), false));
      } catch (RuntimeException dropFailure) {
        e.addSuppressed(dropFailure);
      }
      throw e;
    }
  }

  /**
   * Removes the unified schema's objects, the extended tables and both
   * schemas.
   *
   * <p>Objects are dropped in dependency order: aliases, triggers, merge
   * views, routines (except the retained routine), extended tables, then the
   * extended and unified schemas. Schemas are dropped with {@code RESTRICT};
   * the unified schema stays if the retained routine is in it.
   *
   * @throws org.dbsuite.doccat.runtime.TeardownBlockedException if the
   *     database refuses to drop a schema that is not empty
   */
  public void uninstall() {
    final String unified = config.unifiedSchema();
    final String extended = config.extendedSchema();
    final boolean hasUnified = introspector.schemaExists(unified);
    final boolean hasExtended = introspector.schemaExists(extended);
    final Set<String> extendedTables = hasExtended
        ? introspector.tableNames(extended, "TABLE")
        : ImmutableSortedSet.of();
    boolean retained = false;

    if (hasUnified) {
      final Set<String> mergeViews =
          Sets.intersection(introspector.tableNames(unified, "VIEW"),
              extendedTables);
      final Set<String> aliases =
          Sets.difference(
              introspector.tableNames(unified,
                  executor.getDialect().aliasTableType()),
              mergeViews);
      for (String alias : aliases) {
        drop(SqlDropObject.ObjectType.ALIAS, unified, alias);
      }
      for (String trigger : introspector.triggerNames(unified)) {
        drop(SqlDropObject.ObjectType.TRIGGER, unified, trigger);
      }
      for (String view : mergeViews) {
        drop(SqlDropObject.ObjectType.VIEW, unified, view);
      }
      final @Nullable String retainedRoutine =
          Strings.emptyToNull(config.retainedRoutine());
      for (RoutineRef routine : introspector.procedures(unified)) {
        if (routine.name.equals(retainedRoutine)) {
          retained = true;
        } else {
          drop(SqlDropObject.ObjectType.SPECIFIC_PROCEDURE, unified,
              routine.specificName);
        }
      }
    }
    for (String table : extendedTables) {
      drop(SqlDropObject.ObjectType.TABLE, extended, table);
    }
    if (hasExtended) {
      dropSchema(extended);
    }
    if (retained) {
      LOGGER.info("Keeping schema {}; it holds routine {}", unified,
          config.retainedRoutine());
    } else if (hasUnified) {
      dropSchema(unified);
    }
    LOGGER.info("Uninstalled {} and {}", unified, extended);
  }

  private void drop(SqlDropObject.ObjectType type, String schema,
      String name) {
    executor.execute(
        new SqlDropObject(type, SqlIdentifier.of(schema, name), false));
  }

  private void dropSchema(String schema) {
    final SqlDropObject drop =
        new SqlDropObject(SqlDropObject.ObjectType.SCHEMA,
            SqlIdentifier.of(schema), true);
    try {
      executor.executeSql(drop.toSqlString(executor.getDialect()));
    } catch (SQLException e) {
      throw RESOURCE.teardownBlocked(schema, e.getMessage()).ex(e);
    }
  }
}
