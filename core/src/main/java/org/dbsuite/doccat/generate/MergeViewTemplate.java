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
package org.dbsuite.doccat.generate;

import org.dbsuite.doccat.catalog.CatalogColumn;
import org.dbsuite.doccat.config.DocCatConfig;
import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlLiteral;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlStdOperatorTable;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Everything needed to generate the merge view and sync trigger for one
 * extended table.
 *
 * <p>A template is derived from column metadata by {@link #derive}, a pure
 * function, and is immutable. {@link MergeViews} and {@link SyncTriggers}
 * turn it into statements.
 */
public class MergeViewTemplate {
  public final String table;
  public final String nativeSchema;
  public final String extendedSchema;
  public final String unifiedSchema;
  public final String triggerName;
  public final String commentColumn;
  /** Columns of the native table, in declared order. The merge view has
   * exactly these columns. */
  public final ImmutableList<CatalogColumn> nativeColumns;
  /** Key columns of the extended table, in key order. */
  public final ImmutableList<KeyColumn> keys;
  /** Extended columns that are neither key nor comment, copied from the
   * native row when an extended row is created. */
  public final ImmutableList<String> carriedColumns;

  private MergeViewTemplate(String table, String nativeSchema,
      String extendedSchema, String unifiedSchema, String triggerName,
      String commentColumn, ImmutableList<CatalogColumn> nativeColumns,
      ImmutableList<KeyColumn> keys, ImmutableList<String> carriedColumns) {
    this.table = table;
    this.nativeSchema = nativeSchema;
    this.extendedSchema = extendedSchema;
    this.unifiedSchema = unifiedSchema;
    this.triggerName = triggerName;
    this.commentColumn = commentColumn;
    this.nativeColumns = nativeColumns;
    this.keys = keys;
    this.carriedColumns = carriedColumns;
  }

  /**
   * Derives a template.
   *
   * @param config          Configuration (schemas, comment column, trigger
   *                        suffix)
   * @param table           Name of the table, the same in the native catalog
   *                        and the extended store
   * @param nativeColumns   Columns of the native table
   * @param extendedColumns Columns of the extended table, with key positions
   *
   * @throws org.dbsuite.doccat.runtime.KeyShapeViolationException if the
   *     extended table has no key
   * @throws org.dbsuite.doccat.runtime.MetadataNotFoundException if either
   *     table lacks the comment column, or a key column of the extended
   *     table is not in the native table
   */
  public static MergeViewTemplate derive(DocCatConfig config, String table,
      List<CatalogColumn> nativeColumns, List<CatalogColumn> extendedColumns) {
    final String commentColumn = config.commentColumn();
    if (find(nativeColumns, commentColumn) == null) {
      throw RESOURCE.columnNotFound(commentColumn, config.nativeSchema(),
          table).ex();
    }
    if (find(extendedColumns, commentColumn) == null) {
      throw RESOURCE.columnNotFound(commentColumn, config.extendedSchema(),
          table).ex();
    }
    final ImmutableList<CatalogColumn> keyColumns = extendedColumns.stream()
        .filter(CatalogColumn::isKey)
        .sorted(
            Comparator.comparingInt(c -> Objects.requireNonNull(c.keyPosition)))
        .collect(ImmutableList.toImmutableList());
    if (keyColumns.isEmpty()) {
      throw RESOURCE.noKeyColumns(config.extendedSchema(), table).ex();
    }
    final ImmutableList.Builder<KeyColumn> keys = ImmutableList.builder();
    for (CatalogColumn keyColumn : keyColumns) {
      final CatalogColumn nativeColumn = find(nativeColumns, keyColumn.name);
      if (nativeColumn == null) {
        throw RESOURCE.keyColumnNotInNative(keyColumn.name,
            config.extendedSchema(), table, config.nativeSchema()).ex();
      }
      keys.add(
          new KeyColumn(keyColumn.name,
              nativeColumn.nullable && nativeColumn.isCharacter()));
    }
    final ImmutableList.Builder<String> carried = ImmutableList.builder();
    for (CatalogColumn column : extendedColumns) {
      if (!column.isKey()
          && !column.name.equals(commentColumn)
          && find(nativeColumns, column.name) != null) {
        carried.add(column.name);
      }
    }
    final ImmutableList<CatalogColumn> sortedNativeColumns =
        nativeColumns.stream()
            .sorted(Comparator.comparingInt(c -> c.ordinal))
            .collect(ImmutableList.toImmutableList());
    return new MergeViewTemplate(table, config.nativeSchema(),
        config.extendedSchema(), config.unifiedSchema(),
        table + config.triggerSuffix(), commentColumn, sortedNativeColumns,
        keys.build(), carried.build());
  }

  private static @Nullable CatalogColumn find(List<CatalogColumn> columns,
      String name) {
    for (CatalogColumn column : columns) {
      if (column.name.equals(name)) {
        return column;
      }
    }
    return null;
  }

  public SqlIdentifier nativeTable() {
    return SqlIdentifier.of(nativeSchema, table);
  }

  public SqlIdentifier extendedTable() {
    return SqlIdentifier.of(extendedSchema, table);
  }

  public SqlIdentifier unifiedView() {
    return SqlIdentifier.of(unifiedSchema, table);
  }

  public SqlIdentifier trigger() {
    return SqlIdentifier.of(unifiedSchema, triggerName);
  }

  /** Returns the names of the native columns, in order. */
  public ImmutableList<String> columnNames() {
    return nativeColumns.stream()
        .map(c -> c.name)
        .collect(ImmutableList.toImmutableList());
  }

  @Override public String toString() {
    return "MergeViewTemplate(" + table + ", keys=" + keys + ", carried="
        + carriedColumns + ")";
  }

  /** Key column of an extended table. */
  public static class KeyColumn {
    public final String name;
    /** Whether the native column may be null. The extended store holds an
     * empty string in place of null, so native values are coalesced. */
    public final boolean coalesce;

    KeyColumn(String name, boolean coalesce) {
      this.name = name;
      this.coalesce = coalesce;
    }

    /** Returns this column of a native row, qualified by {@code alias},
     * with null replaced by an empty string if the column is nullable. */
    public SqlNode nativeValue(String alias) {
      final SqlNode ref = SqlIdentifier.of(alias, name);
      if (!coalesce) {
        return ref;
      }
      return SqlStdOperatorTable.COALESCE.createCall(ref,
          SqlLiteral.createCharString(""));
    }

    @Override public String toString() {
      return coalesce ? name + "?" : name;
    }
  }
}
