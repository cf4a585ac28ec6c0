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
package org.dbsuite.doccat.sync;

import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.sql.ddl.SqlCommentOn;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Statement that sets one native comment, produced by export.
 */
public class CommentStatement {
  public final ObjectKind kind;
  public final SqlCommentOn node;
  /** The statement, rendered in the target dialect. */
  public final String sql;
  /** Length of the extended comment before it was fitted. */
  public final int originalLength;
  private final boolean truncated;

  CommentStatement(ObjectKind kind, SqlCommentOn node, String sql,
      int originalLength, boolean truncated) {
    this.kind = kind;
    this.node = node;
    this.sql = sql;
    this.originalLength = originalLength;
    this.truncated = truncated;
  }

  /** Returns whether the comment was cut to fit the native limit. */
  public boolean isTruncated() {
    return truncated;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof CommentStatement
        && sql.equals(((CommentStatement) obj).sql);
  }

  @Override public int hashCode() {
    return sql.hashCode();
  }

  @Override public String toString() {
    return sql;
  }
}
