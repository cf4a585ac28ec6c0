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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Category of commentable catalog object.
 *
 * <p>Each kind names a table that exists with the same name, and the same
 * key columns, in the native catalog and in the extended store.
 */
public enum ObjectKind {
  DATATYPES(9, "TYPE", "TYPESCHEMA", "TYPENAME"),
  COLUMNS(4, "COLUMN", "TABSCHEMA", "TABNAME", "COLNAME"),
  TABCONST(5, "CONSTRAINT", "TABSCHEMA", "TABNAME", "CONSTNAME"),
  INDEXES(6, "INDEX", "INDSCHEMA", "INDNAME"),
  TRIGGERS(7, "TRIGGER", "TRIGSCHEMA", "TRIGNAME"),
  ROUTINES(8, "SPECIFIC FUNCTION", "ROUTINESCHEMA", "SPECIFICNAME"),
  /** Routine parameters. The native catalog cannot comment on them, so they
   * are never exported. */
  ROUTINEPARMS(0, null, "ROUTINESCHEMA", "SPECIFICNAME", "ROWTYPE",
      "ORDINAL"),
  SCHEMATA(2, "SCHEMA", "SCHEMANAME"),
  TABLES(3, "TABLE", "TABSCHEMA", "TABNAME"),
  TABLESPACES(1, "TABLESPACE", "TBSPACE");

  /** Exportable kinds in the order that export visits them. */
  public static final ImmutableList<ObjectKind> EXPORT_ORDER =
      Arrays.stream(values())
          .filter(ObjectKind::isExportable)
          .sorted(Comparator.comparingInt(k -> k.exportOrder))
          .collect(ImmutableList.toImmutableList());

  private final int exportOrder;
  private final @Nullable String commentTarget;
  public final ImmutableList<String> keyColumns;

  ObjectKind(int exportOrder, @Nullable String commentTarget,
      String... keyColumns) {
    this.exportOrder = exportOrder;
    this.commentTarget = commentTarget;
    this.keyColumns = ImmutableList.copyOf(keyColumns);
  }

  /** Returns the kind whose table has a given name, or null. */
  public static @Nullable ObjectKind of(String tableName) {
    for (ObjectKind kind : values()) {
      if (kind.name().equals(tableName.toUpperCase(Locale.ROOT))) {
        return kind;
      }
    }
    return null;
  }

  /** Returns the name of the table of this kind, in both the native catalog
   * and the extended store. */
  public String tableName() {
    return name();
  }

  /** Returns whether the native catalog has a comment statement for objects
   * of this kind. */
  public boolean isExportable() {
    return commentTarget != null;
  }

  /** Returns extended columns, besides key and comment, that are copied
   * from the native catalog. */
  public ImmutableList<String> carriedColumns() {
    return this == ROUTINEPARMS
        ? ImmutableList.of("PARMNAME")
        : ImmutableList.of();
  }

  /** Returns the native column that decides the comment target, or null if
   * the target is the same for every object of this kind. */
  public @Nullable String discriminatorColumn() {
    return this == ROUTINES ? "ROUTINETYPE" : null;
  }

  /**
   * Returns the keywords that name an object of this kind in a
   * {@code COMMENT ON} statement.
   *
   * @param discriminator Value of {@link #discriminatorColumn()}, if this
   *                      kind has one
   */
  public String commentTarget(@Nullable String discriminator) {
    if (commentTarget == null) {
      throw RESOURCE.notExportable(name()).ex();
    }
    if (this == ROUTINES && "P".equals(discriminator)) {
      return "SPECIFIC PROCEDURE";
    }
    return commentTarget;
  }

  /** Returns the column whose blank native values are replaced by a
   * synthesized name on import, or null. */
  public @Nullable String defaultNameColumn() {
    return this == ROUTINEPARMS ? "PARMNAME" : null;
  }

  /** Returns the name given to an unnamed routine parameter. */
  public String defaultName(int ordinal) {
    return "P" + ordinal;
  }

  /** Returns columns whose values are limited to a fixed set, with that
   * set. */
  public ImmutableMap<String, ImmutableList<String>> allowedValues() {
    return this == ROUTINEPARMS
        ? ImmutableMap.of("ROWTYPE", ImmutableList.of("B", "C", "O", "P", "R"))
        : ImmutableMap.of();
  }

  /** Returns numeric columns that may not be negative. */
  public ImmutableList<String> nonNegativeColumns() {
    return this == ROUTINEPARMS
        ? ImmutableList.of("ORDINAL")
        : ImmutableList.of();
  }
}
