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
package org.dbsuite.doccat.sql;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reference to a table in a FROM clause, with an optional correlation
 * name, as in {@code "SYSCAT"."TABLES" "S"}.
 */
public class SqlTableRef extends SqlNode {
  public final SqlIdentifier table;
  public final @Nullable String alias;

  public SqlTableRef(SqlIdentifier table, @Nullable String alias) {
    this.table = table;
    this.alias = alias;
  }

  @Override public SqlKind getKind() {
    return SqlKind.TABLE_REF;
  }

  @Override public void unparse(SqlWriter writer) {
    table.unparse(writer);
    if (alias != null) {
      SqlIdentifier.of(alias).unparse(writer);
    }
  }
}
