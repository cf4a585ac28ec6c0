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
package org.dbsuite.doccat.generate;

import com.google.common.collect.ImmutableTable;

import java.util.Objects;

/**
 * What happens to the extended store when a comment is written through a
 * merge view.
 *
 * <p>The action depends on two facts: whether the object already has an
 * extended row, and whether the new comment is null.
 *
 * <table>
 *   <caption>Actions</caption>
 *   <tr><th></th><th>new comment not null</th><th>new comment null</th></tr>
 *   <tr><td>no extended row</td><td>INSERT</td><td>NOOP</td></tr>
 *   <tr><td>extended row</td><td>UPDATE</td><td>DELETE</td></tr>
 * </table>
 */
public enum TriggerAction {
  /** Create an extended row holding the new comment. */
  INSERT,
  /** Leave the extended store unchanged. */
  NOOP,
  /** Remove the extended row, so the native comment shows again. */
  DELETE,
  /** Replace the comment in the extended row. */
  UPDATE;

  private static final ImmutableTable<Boolean, Boolean, TriggerAction> TABLE =
      ImmutableTable.<Boolean, Boolean, TriggerAction>builder()
          .put(false, false, INSERT)
          .put(false, true, NOOP)
          .put(true, true, DELETE)
          .put(true, false, UPDATE)
          .build();

  /**
   * Returns the action for a row.
   *
   * @param rowExists Whether the extended store has a row for the object
   * @param newNull   Whether the new comment is null
   */
  public static TriggerAction of(boolean rowExists, boolean newNull) {
    return Objects.requireNonNull(TABLE.get(rowExists, newNull));
  }

  /** Returns whether this action changes the extended store. */
  public boolean isWrite() {
    return this != NOOP;
  }
}
