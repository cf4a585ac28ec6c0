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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.Types;
import java.util.Objects;

/**
 * Column of a table, as reported by
 * {@link java.sql.DatabaseMetaData#getColumns}.
 */
public class CatalogColumn {
  public final String name;
  /** 1-based position of the column in its table. */
  public final int ordinal;
  /** Type code from {@link java.sql.Types}. */
  public final int jdbcType;
  public final String typeName;
  public final int size;
  public final boolean nullable;
  /** 1-based position of the column in the table's primary key, or null if
   * the column is not part of the key. */
  public final @Nullable Integer keyPosition;

  public CatalogColumn(String name, int ordinal, int jdbcType,
      String typeName, int size, boolean nullable,
      @Nullable Integer keyPosition) {
    this.name = Objects.requireNonNull(name, "name");
    this.ordinal = ordinal;
    this.jdbcType = jdbcType;
    this.typeName = Objects.requireNonNull(typeName, "typeName");
    this.size = size;
    this.nullable = nullable;
    this.keyPosition = keyPosition;
  }

  /** Returns whether this column is part of its table's primary key. */
  public boolean isKey() {
    return keyPosition != null;
  }

  /** Returns whether this column holds character strings. */
  public boolean isCharacter() {
    switch (jdbcType) {
    case Types.CHAR:
    case Types.VARCHAR:
    case Types.LONGVARCHAR:
    case Types.NCHAR:
    case Types.NVARCHAR:
    case Types.LONGNVARCHAR:
    case Types.CLOB:
    case Types.NCLOB:
      return true;
    default:
      return false;
    }
  }

  /** Returns the type of this column as it would be written in a column
   * declaration, for example "VARCHAR(128)" or "SMALLINT". */
  public String typeSpec() {
    switch (jdbcType) {
    case Types.CHAR:
    case Types.VARCHAR:
    case Types.NCHAR:
    case Types.NVARCHAR:
      return typeName + "(" + size + ")";
    default:
      return typeName;
    }
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof CatalogColumn
        && name.equals(((CatalogColumn) obj).name)
        && ordinal == ((CatalogColumn) obj).ordinal
        && jdbcType == ((CatalogColumn) obj).jdbcType
        && nullable == ((CatalogColumn) obj).nullable
        && Objects.equals(keyPosition, ((CatalogColumn) obj).keyPosition);
  }

  @Override public int hashCode() {
    return Objects.hash(name, ordinal, jdbcType, nullable, keyPosition);
  }

  @Override public String toString() {
    return name + " " + typeSpec() + (nullable ? "" : " NOT NULL")
        + (keyPosition == null ? "" : " KEY " + keyPosition);
  }
}
