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
package org.dbsuite.doccat.install;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** Objects created in the unified schema by an installation. */
public class InstallSummary {
  private final ImmutableList<String> mergeViews;
  private final ImmutableList<String> aliases;

  public InstallSummary(List<String> mergeViews, List<String> aliases) {
    this.mergeViews = ImmutableList.copyOf(mergeViews);
    this.aliases = ImmutableList.copyOf(aliases);
  }

  /** Returns the tables that got a merge view and trigger, sorted. */
  public ImmutableList<String> mergeViews() {
    return mergeViews;
  }

  /** Returns the tables that got a pass-through alias, sorted. */
  public ImmutableList<String> aliases() {
    return aliases;
  }

  @Override public String toString() {
    return mergeViews.size() + " merge views " + mergeViews + ", "
        + aliases.size() + " aliases";
  }
}
