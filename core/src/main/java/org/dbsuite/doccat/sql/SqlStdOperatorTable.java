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

import java.util.List;

/**
 * Standard operators used by generated SQL.
 */
public class SqlStdOperatorTable {
  private SqlStdOperatorTable() {}

  public static final SqlOperator OR =
      new SqlOperator("OR", SqlKind.OR, SqlSyntax.BINARY, 22);

  public static final SqlOperator AND =
      new SqlOperator("AND", SqlKind.AND, SqlSyntax.BINARY, 24);

  public static final SqlOperator NOT =
      new SqlOperator("NOT", SqlKind.NOT, SqlSyntax.PREFIX, 26);

  public static final SqlOperator EQUALS =
      new SqlOperator("=", SqlKind.EQUALS, SqlSyntax.BINARY, 30);

  public static final SqlOperator NOT_EQUALS =
      new SqlOperator("<>", SqlKind.NOT_EQUALS, SqlSyntax.BINARY, 30);

  public static final SqlOperator GREATER_THAN_OR_EQUAL =
      new SqlOperator(">=", SqlKind.GREATER_THAN_OR_EQUAL, SqlSyntax.BINARY,
          30);

  public static final SqlOperator IN =
      new SqlOperator("IN", SqlKind.IN, SqlSyntax.BINARY, 30);

  public static final SqlOperator IS_NULL =
      new SqlOperator("IS NULL", SqlKind.IS_NULL, SqlSyntax.POSTFIX, 28);

  public static final SqlOperator IS_NOT_NULL =
      new SqlOperator("IS NOT NULL", SqlKind.IS_NOT_NULL, SqlSyntax.POSTFIX,
          28);

  public static final SqlOperator EXISTS =
      new SqlOperator("EXISTS", SqlKind.EXISTS, SqlSyntax.PREFIX, 40);

  public static final SqlOperator COALESCE =
      new SqlOperator("COALESCE", SqlKind.OTHER_FUNCTION, SqlSyntax.FUNCTION,
          100);

  /** Combines conditions with AND. A single condition is returned as is. */
  public static SqlNode and(List<? extends SqlNode> conditions) {
    if (conditions.size() == 1) {
      return conditions.get(0);
    }
    return AND.createCall(conditions.toArray(new SqlNode[0]));
  }

  /** Creates {@code left = right}. */
  public static SqlNode eq(SqlNode left, SqlNode right) {
    return EQUALS.createCall(left, right);
  }

  /** Negates a condition; {@code x IS NULL} becomes {@code x IS NOT NULL}. */
  public static SqlNode not(SqlNode condition) {
    if (condition.getKind() == SqlKind.IS_NULL) {
      return IS_NOT_NULL.createCall(((SqlBasicCall) condition).operand(0));
    }
    return NOT.createCall(condition);
  }
}
