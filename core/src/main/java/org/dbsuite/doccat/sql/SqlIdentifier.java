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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A <code>SqlIdentifier</code> is an identifier, possibly compound.
 *
 * <p>Every part is quoted when written, so names keep their case.
 */
public class SqlIdentifier extends SqlNode {
  /** Array of the components of this compound identifier. */
  public final ImmutableList<String> names;

  public SqlIdentifier(List<String> names) {
    Preconditions.checkArgument(!names.isEmpty(), "empty identifier");
    this.names = ImmutableList.copyOf(names);
  }

  /** Creates an identifier from its parts. */
  public static SqlIdentifier of(String... names) {
    return new SqlIdentifier(ImmutableList.copyOf(names));
  }

  /** Returns the last component of this identifier. */
  public String getSimple() {
    return names.get(names.size() - 1);
  }

  /** Returns an identifier with {@code name} appended, such as a column
   * qualified by this table alias. */
  public SqlIdentifier plus(String name) {
    return new SqlIdentifier(
        ImmutableList.<String>builder().addAll(names).add(name).build());
  }

  @Override public SqlKind getKind() {
    return SqlKind.IDENTIFIER;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.identifier(names);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof SqlIdentifier
        && names.equals(((SqlIdentifier) obj).names);
  }

  @Override public int hashCode() {
    return names.hashCode();
  }
}
