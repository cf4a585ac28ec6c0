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
package org.dbsuite.doccat.runtime;

import org.dbsuite.doccat.catalog.ObjectKind;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when importing native comments fails part way.
 *
 * <p>Import commits one object kind at a time. The kind that failed has been
 * rolled back; the kinds in {@link #committedKinds()} were already replaced
 * by native comments and stay that way.
 */
public class ImportIncompleteException extends DocCatException {
  private static final long serialVersionUID = 1877413925306315862L;

  private final ObjectKind failedKind;
  private final ImmutableList<ObjectKind> committedKinds;

  public ImportIncompleteException(String message, Throwable cause,
      ObjectKind failedKind, List<ObjectKind> committedKinds) {
    super(message, cause);
    this.failedKind = failedKind;
    this.committedKinds = ImmutableList.copyOf(committedKinds);
  }

  /** Returns the kind whose import failed and was rolled back. */
  public ObjectKind failedKind() {
    return failedKind;
  }

  /** Returns the kinds committed before the failure, in import order. */
  public ImmutableList<ObjectKind> committedKinds() {
    return committedKinds;
  }
}
