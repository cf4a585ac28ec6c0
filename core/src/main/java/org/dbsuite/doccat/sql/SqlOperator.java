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
 * A <code>SqlOperator</code> is a type of node in a SQL parse tree (it is NOT
 * a node in a SQL parse tree). It includes functions, operators such as '=',
 * and syntactic constructs such as 'EXISTS'.
 *
 * <p>Operators are stateless; the standard ones are in
 * {@link SqlStdOperatorTable}.
 */
public class SqlOperator {
  private final String name;
  private final SqlKind kind;
  private final SqlSyntax syntax;
  private final int prec;

  /**
   * Creates an operator.
   *
   * @param name   Name, as written in SQL
   * @param kind   Kind
   * @param syntax How a call to this operator is written
   * @param prec   Precedence; an operand whose operator binds less tightly
   *               than this is parenthesized
   */
  public SqlOperator(String name, SqlKind kind, SqlSyntax syntax, int prec) {
    this.name = name;
    this.kind = kind;
    this.syntax = syntax;
    this.prec = prec;
  }

  public String getName() {
    return name;
  }

  public SqlKind getKind() {
    return kind;
  }

  public SqlSyntax getSyntax() {
    return syntax;
  }

  public int getPrecedence() {
    return prec;
  }

  /** Creates a call to this operator. */
  public SqlBasicCall createCall(SqlNode... operands) {
    return new SqlBasicCall(this, operands);
  }

  /** Writes a call to this operator. */
  public void unparse(SqlWriter writer, SqlBasicCall call) {
    switch (syntax) {
    case FUNCTION:
      final SqlWriter.Frame frame = writer.startFunCall(name);
      int i = 0;
      for (SqlNode operand : call.getOperandList()) {
        if (i++ > 0) {
          writer.sep(",");
        }
        operand.unparse(writer);
      }
      writer.endList(frame);
      break;
    case BINARY:
      Preconditions.checkArgument(call.operandCount() >= 2, name);
      i = 0;
      for (SqlNode operand : call.getOperandList()) {
        if (i++ > 0) {
          writer.keyword(name);
        }
        unparseOperand(writer, operand);
      }
      break;
    case PREFIX:
      writer.keyword(name);
      unparseOperand(writer, call.operand(0));
      break;
    case POSTFIX:
      unparseOperand(writer, call.operand(0));
      writer.keyword(name);
      break;
    default:
      throw new AssertionError(syntax);
    }
  }

  private void unparseOperand(SqlWriter writer, SqlNode operand) {
    final boolean parens;
    if (operand instanceof SqlBasicCall) {
      final SqlOperator operator = ((SqlBasicCall) operand).getOperator();
      parens = operator.syntax != SqlSyntax.FUNCTION
          && operator.prec <= prec;
    } else {
      parens = operand instanceof SqlSelect;
    }
    if (parens) {
      final SqlWriter.Frame frame = writer.startList("(", ")");
      operand.unparse(writer);
      writer.endList(frame);
    } else {
      operand.unparse(writer);
    }
  }

  @Override public String toString() {
    return name;
  }
}
