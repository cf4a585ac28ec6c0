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

import org.dbsuite.doccat.sql.dialect.AnsiSqlDialect;

/**
 * A <code>SqlNode</code> is a SQL parse tree.
 *
 * <p>It may be an operator, literal, identifier, statement, and so forth.
 * Nodes are immutable; render one with {@link #toSqlString(SqlDialect)}.
 */
public abstract class SqlNode {
  /** Returns the kind of this node. */
  public abstract SqlKind getKind();

  /**
   * Writes a SQL representation of this node to a writer.
   *
   * @param writer Target writer
   */
  public abstract void unparse(SqlWriter writer);

  /**
   * Returns the SQL text of the tree of which this <code>SqlNode</code> is
   * the root.
   *
   * @param dialect Dialect
   */
  public String toSqlString(SqlDialect dialect) {
    final SqlWriter writer = new SqlStringWriter(dialect);
    unparse(writer);
    return writer.toSqlString();
  }

  @Override public String toString() {
    return toSqlString(AnsiSqlDialect.DEFAULT);
  }
}
