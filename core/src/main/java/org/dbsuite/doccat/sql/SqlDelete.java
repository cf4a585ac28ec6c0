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
 * A <code>SqlDelete</code> is a node of a parse tree which represents a
 * DELETE statement.
 */
public class SqlDelete extends SqlNode {
  public final SqlIdentifier targetTable;
  public final @Nullable SqlNode condition;

  public SqlDelete(SqlIdentifier targetTable, @Nullable SqlNode condition) {
    this.targetTable = targetTable;
    this.condition = condition;
  }

  @Override public SqlKind getKind() {
    return SqlKind.DELETE;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("DELETE FROM");
    targetTable.unparse(writer);
    if (condition != null) {
      writer.keyword("WHERE");
      condition.unparse(writer);
    }
  }
}
