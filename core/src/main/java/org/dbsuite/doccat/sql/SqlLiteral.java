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
 * A <code>SqlLiteral</code> is a constant: a character string, an exact
 * number, or NULL.
 */
public class SqlLiteral extends SqlNode {
  private final @Nullable Object value;

  protected SqlLiteral(@Nullable Object value) {
    this.value = value;
  }

  /** Creates a character string literal. */
  public static SqlLiteral createCharString(String s) {
    return new SqlLiteral(s);
  }

  /** Creates an exact numeric literal. */
  public static SqlLiteral createExactNumeric(long n) {
    return new SqlLiteral(n);
  }

  /** Creates the NULL literal. */
  public static SqlLiteral createNull() {
    return new SqlLiteral(null);
  }

  public @Nullable Object getValue() {
    return value;
  }

  @Override public SqlKind getKind() {
    return SqlKind.LITERAL;
  }

  @Override public void unparse(SqlWriter writer) {
    if (value == null) {
      writer.keyword("NULL");
    } else if (value instanceof String) {
      writer.literal((String) value);
    } else {
      writer.print(value.toString());
    }
  }
}
