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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Implementation of a call to an operator, such as
 * {@code x = y} or {@code COALESCE(a, b)}.
 */
public class SqlBasicCall extends SqlNode {
  private final SqlOperator operator;
  private final ImmutableList<SqlNode> operands;

  public SqlBasicCall(SqlOperator operator, SqlNode... operands) {
    this.operator = operator;
    this.operands = ImmutableList.copyOf(operands);
  }

  public SqlOperator getOperator() {
    return operator;
  }

  public List<SqlNode> getOperandList() {
    return operands;
  }

  public SqlNode operand(int i) {
    return operands.get(i);
  }

  public int operandCount() {
    return operands.size();
  }

  @Override public SqlKind getKind() {
    return operator.getKind();
  }

  @Override public void unparse(SqlWriter writer) {
    operator.unparse(writer, this);
  }
}
