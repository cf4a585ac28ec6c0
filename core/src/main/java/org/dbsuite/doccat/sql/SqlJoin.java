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

import java.util.Locale;

/**
 * Parse tree node representing a {@code JOIN} clause.
 */
public class SqlJoin extends SqlNode {
  public final SqlNode left;
  public final JoinType joinType;
  public final SqlNode right;
  public final SqlNode condition;

  public SqlJoin(SqlNode left, JoinType joinType, SqlNode right,
      SqlNode condition) {
    this.left = left;
    this.joinType = joinType;
    this.right = right;
    this.condition = condition;
  }

  @Override public SqlKind getKind() {
    return SqlKind.JOIN;
  }

  @Override public void unparse(SqlWriter writer) {
    left.unparse(writer);
    writer.keyword(joinType.name().toUpperCase(Locale.ROOT) + " JOIN");
    right.unparse(writer);
    writer.keyword("ON");
    condition.unparse(writer);
  }

  /** Enumerates the types of join. */
  public enum JoinType {
    INNER,
    LEFT
  }
}
