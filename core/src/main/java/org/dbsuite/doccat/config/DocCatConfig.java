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
package org.dbsuite.doccat.config;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Interface for reading DocCat configuration properties.
 *
 * @see DocCatProperty */
public interface DocCatConfig {
  /** Returns the value of {@link DocCatProperty#NATIVE_SCHEMA}. */
  String nativeSchema();

  /** Returns the value of {@link DocCatProperty#EXTENDED_SCHEMA}. */
  String extendedSchema();

  /** Returns the value of {@link DocCatProperty#UNIFIED_SCHEMA}. */
  String unifiedSchema();

  /** Returns the value of {@link DocCatProperty#COMMENT_COLUMN}. */
  String commentColumn();

  /** Returns the value of {@link DocCatProperty#MAX_COMMENT_LENGTH}. */
  int maxCommentLength();

  /** Returns the value of {@link DocCatProperty#TRUNCATION_MARKER}. */
  String truncationMarker();

  /** Returns the value of {@link DocCatProperty#TRIGGER_SUFFIX}. */
  String triggerSuffix();

  /** Returns the value of {@link DocCatProperty#RETAINED_ROUTINE}. */
  @Nullable String retainedRoutine();

  /** Returns the value of {@link DocCatProperty#DIALECT}. */
  @Nullable String dialect();

  /** Returns the value of {@link DocCatProperty#LONG_TEXT_TYPE}. */
  @Nullable String longTextType();
}
