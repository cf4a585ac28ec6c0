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
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Procedural {@code IF} statement, as used in the body of a trigger.
 *
 * <p>Written as {@code IF condition THEN s1; ... [ELSE s2; ...] END IF}.
 * An empty THEN branch is not valid SQL; use {@link #of} to get a statement
 * whose condition is negated instead.
 */
public class SqlIf extends SqlNode {
  public final SqlNode condition;
  public final ImmutableList<SqlNode> thenList;
  public final ImmutableList<SqlNode> elseList;

  public SqlIf(SqlNode condition, List<SqlNode> thenList,
      List<SqlNode> elseList) {
    Preconditions.checkArgument(!thenList.isEmpty(), "empty THEN branch");
    this.condition = condition;
    this.thenList = ImmutableList.copyOf(thenList);
    this.elseList = ImmutableList.copyOf(elseList);
  }

  /** Creates an IF statement, or an empty list if both branches are empty.
   * If only the ELSE branch has statements, the condition is negated. */
  public static ImmutableList<SqlNode> of(SqlNode condition,
      List<SqlNode> thenList, List<SqlNode> elseList) {
    if (thenList.isEmpty() && elseList.isEmpty()) {
      return ImmutableList.of();
    }
    if (thenList.isEmpty()) {
      return ImmutableList.of(
          new SqlIf(SqlStdOperatorTable.not(condition), elseList,
              ImmutableList.of()));
    }
    return ImmutableList.of(new SqlIf(condition, thenList, elseList));
  }

  @Override public SqlKind getKind() {
    return SqlKind.IF;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("IF");
    condition.unparse(writer);
    writer.keyword("THEN");
    unparseStatements(writer, thenList);
    if (!elseList.isEmpty()) {
      writer.keyword("ELSE");
      unparseStatements(writer, elseList);
    }
    writer.keyword("END IF");
  }

  /** Writes a sequence of statements, each followed by a semicolon. */
  public static void unparseStatements(SqlWriter writer,
      List<SqlNode> statements) {
    for (SqlNode statement : statements) {
      Preconditions.checkArgument(statement.getKind().isStatement(),
          "not a statement: %s", statement.getKind());
      statement.unparse(writer);
      writer.sep(";");
    }
  }
}
