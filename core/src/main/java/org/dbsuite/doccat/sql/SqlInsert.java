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

/**
 * A <code>SqlInsert</code> is a node of a parse tree which represents an
 * INSERT statement with an explicit column list.
 *
 * <p>The source is either a {@link SqlNodeList} of values, written as a
 * single-row VALUES clause, or a {@link SqlSelect}.
 */
public class SqlInsert extends SqlNode {
  public final SqlIdentifier targetTable;
  public final SqlNodeList targetColumnList;
  public final SqlNode source;

  public SqlInsert(SqlIdentifier targetTable, SqlNodeList targetColumnList,
      SqlNode source) {
    if (source instanceof SqlNodeList) {
      Preconditions.checkArgument(
          ((SqlNodeList) source).size() == targetColumnList.size(),
          "column and value counts differ");
    }
    this.targetTable = targetTable;
    this.targetColumnList = targetColumnList;
    this.source = source;
  }

  @Override public SqlKind getKind() {
    return SqlKind.INSERT;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("INSERT INTO");
    targetTable.unparse(writer);
    targetColumnList.unparse(writer);
    if (source instanceof SqlNodeList) {
      writer.keyword("VALUES");
    }
    source.unparse(writer);
  }
}
