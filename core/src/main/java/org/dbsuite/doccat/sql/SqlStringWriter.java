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
 * Implementation of {@link SqlWriter} that builds a single-line string.
 *
 * <p>A writer is not thread-safe, and is used for one statement only. Nodes
 * get a fresh writer each time they are rendered.
 */
public class SqlStringWriter implements SqlWriter {
  private final SqlDialect dialect;
  private final StringBuilder buf = new StringBuilder();
  private boolean needWhitespace;

  public SqlStringWriter(SqlDialect dialect) {
    this.dialect = dialect;
  }

  @Override public SqlDialect getDialect() {
    return dialect;
  }

  private void maybeWhitespace() {
    if (needWhitespace) {
      buf.append(' ');
    }
  }

  @Override public void keyword(String s) {
    maybeWhitespace();
    buf.append(s);
    needWhitespace = true;
  }

  @Override public void print(String s) {
    maybeWhitespace();
    buf.append(s);
    needWhitespace = true;
  }

  @Override public void identifier(List<String> names) {
    maybeWhitespace();
    dialect.quoteIdentifier(buf, names);
    needWhitespace = true;
  }

  @Override public void literal(String value) {
    maybeWhitespace();
    dialect.quoteStringLiteral(buf, value);
    needWhitespace = true;
  }

  @Override public void sep(String sep) {
    buf.append(sep);
    needWhitespace = true;
  }

  @Override public Frame startList(String open, String close) {
    maybeWhitespace();
    buf.append(open);
    needWhitespace = false;
    return () -> close;
  }

  @Override public Frame startFunCall(String funName) {
    maybeWhitespace();
    buf.append(funName).append('(');
    needWhitespace = false;
    return () -> ")";
  }

  @Override public void endList(Frame frame) {
    buf.append(frame.close());
    needWhitespace = true;
  }

  @Override public String toSqlString() {
    return buf.toString();
  }

  @Override public String toString() {
    return buf.toString();
  }
}
