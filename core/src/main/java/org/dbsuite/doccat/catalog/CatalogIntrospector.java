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
package org.dbsuite.doccat.catalog;

import org.dbsuite.doccat.sql.SqlDialect;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Reads schema, table, column, key, trigger and routine metadata through
 * JDBC.
 *
 * <p>Names are matched exactly; wildcard characters in names are escaped
 * before they are passed to {@link DatabaseMetaData} methods that take
 * patterns. Every call uses its own connection.
 */
public class CatalogIntrospector {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CatalogIntrospector.class);

  private final DataSource dataSource;
  private final SqlDialect dialect;

  public CatalogIntrospector(DataSource dataSource, SqlDialect dialect) {
    this.dataSource = dataSource;
    this.dialect = dialect;
  }

  /**
   * Returns the columns of a table or view, in declared order.
   *
   * @throws org.dbsuite.doccat.runtime.MetadataNotFoundException if the
   *     table does not exist
   */
  public ImmutableList<CatalogColumn> columnsOf(String schema, String table) {
    try (Connection connection = dataSource.getConnection()) {
      final DatabaseMetaData metaData = connection.getMetaData();
      if (!tableExists(metaData, schema, table)) {
        throw RESOURCE.tableNotFound(schema, table).ex();
      }
      final Map<String, Integer> keyPositions = new HashMap<>();
      try (ResultSet r = metaData.getPrimaryKeys(null, schema, table)) {
        while (r.next()) {
          keyPositions.put(r.getString("COLUMN_NAME"), r.getInt("KEY_SEQ"));
        }
      }
      final List<CatalogColumn> columns = new ArrayList<>();
      try (ResultSet r = metaData.getColumns(null, escape(metaData, schema),
          escape(metaData, table), "%")) {
        while (r.next()) {
          if (!schema.equals(r.getString("TABLE_SCHEM"))
              || !table.equals(r.getString("TABLE_NAME"))) {
            continue;
          }
          final String name = r.getString("COLUMN_NAME");
          columns.add(
              new CatalogColumn(name,
                  r.getInt("ORDINAL_POSITION"),
                  r.getInt("DATA_TYPE"),
                  r.getString("TYPE_NAME"),
                  r.getInt("COLUMN_SIZE"),
                  r.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls,
                  keyPositions.get(name)));
        }
      }
      columns.sort(Comparator.comparingInt(c -> c.ordinal));
      LOGGER.debug("Columns of {}.{}: {}", schema, table, columns);
      return ImmutableList.copyOf(columns);
    } catch (SQLException e) {
      throw RESOURCE.metadataFailed(schema + "." + table).ex(e);
    }
  }

  /** Returns whether a table, view or alias exists. */
  public boolean tableExists(String schema, String table) {
    try (Connection connection = dataSource.getConnection()) {
      return tableExists(connection.getMetaData(), schema, table);
    } catch (SQLException e) {
      throw RESOURCE.metadataFailed(schema + "." + table).ex(e);
    }
  }

  private static boolean tableExists(DatabaseMetaData metaData, String schema,
      String table) throws SQLException {
    try (ResultSet r = metaData.getTables(null, escape(metaData, schema),
        escape(metaData, table), null)) {
      while (r.next()) {
        if (schema.equals(r.getString("TABLE_SCHEM"))
            && table.equals(r.getString("TABLE_NAME"))) {
          return true;
        }
      }
      return false;
    }
  }

  /** Returns whether a schema exists. */
  public boolean schemaExists(String schema) {
    try (Connection connection = dataSource.getConnection()) {
      final DatabaseMetaData metaData = connection.getMetaData();
      try (ResultSet r =
               metaData.getSchemas(null, escape(metaData, schema))) {
        while (r.next()) {
          if (schema.equals(r.getString("TABLE_SCHEM"))) {
            return true;
          }
        }
        return false;
      }
    } catch (SQLException e) {
      throw RESOURCE.metadataFailed(schema).ex(e);
    }
  }

  /**
   * Returns the names of the tables of given types in a schema, sorted.
   *
   * @param schema Schema name
   * @param types  Table types, as in {@link DatabaseMetaData#getTables}, for
   *               example "TABLE" and "VIEW"
   */
  public ImmutableSortedSet<String> tableNames(String schema,
      String... types) {
    try (Connection connection = dataSource.getConnection()) {
      final DatabaseMetaData metaData = connection.getMetaData();
      final ImmutableSortedSet.Builder<String> names =
          ImmutableSortedSet.naturalOrder();
      try (ResultSet r = metaData.getTables(null, escape(metaData, schema),
          "%", types)) {
        while (r.next()) {
          if (schema.equals(r.getString("TABLE_SCHEM"))) {
            names.add(r.getString("TABLE_NAME"));
          }
        }
      }
      return names.build();
    } catch (SQLException e) {
      throw RESOURCE.metadataFailed(schema).ex(e);
    }
  }

  /** Returns the names of the triggers in a schema, sorted. */
  public ImmutableSortedSet<String> triggerNames(String schema) {
    final String sql = dialect.triggerListQuery();
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, schema);
      final ImmutableSortedSet.Builder<String> names =
          ImmutableSortedSet.naturalOrder();
      try (ResultSet r = statement.executeQuery()) {
        while (r.next()) {
          names.add(r.getString(1));
        }
      }
      return names.build();
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(sql).ex(e);
    }
  }

  /** Returns the procedures in a schema, ordered by specific name. */
  public ImmutableList<RoutineRef> procedures(String schema) {
    try (Connection connection = dataSource.getConnection()) {
      final DatabaseMetaData metaData = connection.getMetaData();
      final List<RoutineRef> routines = new ArrayList<>();
      try (ResultSet r = metaData.getProcedures(null,
          escape(metaData, schema), "%")) {
        while (r.next()) {
          if (!schema.equals(r.getString("PROCEDURE_SCHEM"))) {
            continue;
          }
          final String name = r.getString("PROCEDURE_NAME");
          final @Nullable String specificName = r.getString("SPECIFIC_NAME");
          routines.add(
              new RoutineRef(schema, name,
                  specificName == null ? name : specificName));
        }
      }
      routines.sort(Comparator.comparing(routine -> routine.specificName));
      return ImmutableList.copyOf(routines);
    } catch (SQLException e) {
      throw RESOURCE.metadataFailed(schema).ex(e);
    }
  }

  /** Escapes the wildcard characters in a name, so that it can be used as
   * a metadata search pattern that matches only itself. */
  static String escape(DatabaseMetaData metaData, String name)
      throws SQLException {
    final String escape = metaData.getSearchStringEscape();
    if (escape == null || escape.isEmpty()) {
      return name;
    }
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (c == '_' || c == '%' || escape.indexOf(c) >= 0) {
        buf.append(escape);
      }
      buf.append(c);
    }
    return buf.toString();
  }
}
