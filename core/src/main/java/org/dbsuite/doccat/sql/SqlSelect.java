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
 * A <code>SqlSelect</code> is a node of a parse tree which represents a select
 * statement.
 */
public class SqlSelect extends SqlNode {
  public final SqlNodeList selectList;
  public final SqlNode from;
  public final @Nullable SqlNode where;
  public final SqlNodeList orderBy;

  public SqlSelect(SqlNodeList selectList, SqlNode from,
      @Nullable SqlNode where, @Nullable SqlNodeList orderBy) {
    this.selectList = selectList;
    this.from = from;
    this.where = where;
    this.orderBy = orderBy == null ? SqlNodeList.EMPTY : orderBy;
  }

  @Override public SqlKind getKind() {
    return SqlKind.SELECT;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("SELECT");
    selectList.commaList(writer);
    writer.keyword("FROM");
    from.unparse(writer);
    if (where != null) {
      writer.keyword("WHERE");
      where.unparse(writer);
    }
    if (!orderBy.isEmpty()) {
      writer.keyword("ORDER BY");
      orderBy.commaList(writer);
    }
  }
}
