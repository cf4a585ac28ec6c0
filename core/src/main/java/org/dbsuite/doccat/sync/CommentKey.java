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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Objects;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Identity of a commentable object: its kind and one value per key column
 * of the kind, in key order.
 */
public class CommentKey {
  public final ObjectKind kind;
  public final ImmutableList<Object> values;

  private CommentKey(ObjectKind kind, ImmutableList<Object> values) {
    this.kind = kind;
    this.values = values;
  }

  /**
   * Creates a key.
   *
   * @throws org.dbsuite.doccat.runtime.KeyShapeViolationException if the
   *     number of values differs from the number of key columns
   */
  public static CommentKey of(ObjectKind kind, Object... values) {
    if (values.length != kind.keyColumns.size()) {
      throw RESOURCE.keyArity(kind.name(), kind.keyColumns.toString(),
          values.length).ex();
    }
    return new CommentKey(kind, ImmutableList.copyOf(Arrays.asList(values)));
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof CommentKey
        && kind == ((CommentKey) obj).kind
        && values.equals(((CommentKey) obj).values);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, values);
  }

  @Override public String toString() {
    return kind + values.toString();
  }
}
