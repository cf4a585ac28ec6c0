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

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A <code>SqlUpdate</code> is a node of a parse tree which represents an
 * UPDATE statement.
 */
public class SqlUpdate extends SqlNode {
  public final SqlIdentifier targetTable;
  public final SqlNodeList targetColumnList;
  public final SqlNodeList sourceExpressionList;
  public final @Nullable SqlNode condition;

  public SqlUpdate(SqlIdentifier targetTable, SqlNodeList targetColumnList,
      SqlNodeList sourceExpressionList, @Nullable SqlNode condition) {
    Preconditions.checkArgument(
        targetColumnList.size() == sourceExpressionList.size(),
        "column and expression counts differ");
    this.targetTable = targetTable;
    this.targetColumnList = targetColumnList;
    this.sourceExpressionList = sourceExpressionList;
    this.condition = condition;
  }

  @Override public SqlKind getKind() {
    return SqlKind.UPDATE;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("UPDATE");
    targetTable.unparse(writer);
    writer.keyword("SET");
    for (int i = 0; i < targetColumnList.size(); i++) {
      if (i > 0) {
        writer.sep(",");
      }
      targetColumnList.getList().get(i).unparse(writer);
      writer.print("=");
      sourceExpressionList.getList().get(i).unparse(writer);
    }
    if (condition != null) {
      writer.keyword("WHERE");
      condition.unparse(writer);
    }
  }
}
