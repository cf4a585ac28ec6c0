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
package org.dbsuite.doccat.sql.ddl;

import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlKind;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlNodeList;
import org.dbsuite.doccat.sql.SqlWriter;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Parse tree for {@code CREATE TABLE} statement with a primary key and
 * optional check constraints.
 */
public class SqlCreateTable extends SqlDdl {
  public final ImmutableList<SqlColumnDeclaration> columns;
  public final SqlNodeList primaryKey;
  public final ImmutableList<SqlNode> checks;

  public SqlCreateTable(SqlIdentifier name,
      List<SqlColumnDeclaration> columns, SqlNodeList primaryKey,
      List<SqlNode> checks) {
    super(name);
    Preconditions.checkArgument(!columns.isEmpty(), "table has no columns");
    this.columns = ImmutableList.copyOf(columns);
    this.primaryKey = primaryKey;
    this.checks = ImmutableList.copyOf(checks);
  }

  @Override public SqlKind getKind() {
    return SqlKind.CREATE_TABLE;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("CREATE TABLE");
    name.unparse(writer);
    final SqlWriter.Frame frame = writer.startList("(", ")");
    int i = 0;
    for (SqlColumnDeclaration column : columns) {
      if (i++ > 0) {
        writer.sep(",");
      }
      column.unparse(writer);
    }
    if (!primaryKey.isEmpty()) {
      writer.sep(",");
      writer.keyword("PRIMARY KEY");
      primaryKey.unparse(writer);
    }
    for (SqlNode check : checks) {
      writer.sep(",");
      writer.keyword("CHECK");
      final SqlWriter.Frame checkFrame = writer.startList("(", ")");
      check.unparse(writer);
      writer.endList(checkFrame);
    }
    writer.endList(frame);
  }
}
