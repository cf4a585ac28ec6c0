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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** Number of comments imported per object kind. */
public class ImportSummary {
  private final ImmutableMap<ObjectKind, Integer> rowCounts;

  public ImportSummary(Map<ObjectKind, Integer> rowCounts) {
    this.rowCounts = ImmutableMap.copyOf(rowCounts);
  }

  /** Returns the kinds imported, in import order, with their row counts. */
  public ImmutableMap<ObjectKind, Integer> rowCounts() {
    return rowCounts;
  }

  /** Returns the number of rows imported for a kind, or 0. */
  public int rowCount(ObjectKind kind) {
    return rowCounts.getOrDefault(kind, 0);
  }

  public int totalCount() {
    int total = 0;
    for (int count : rowCounts.values()) {
      total += count;
    }
    return total;
  }

  @Override public String toString() {
    return totalCount() + " rows " + rowCounts;
  }
}
