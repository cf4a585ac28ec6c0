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

import org.dbsuite.doccat.config.DocCatConfig;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Fits comment text into the native catalog's length limit.
 *
 * <p>Text no longer than the limit is kept as is. Longer text is cut and
 * ends with a marker, so that the result is exactly as long as the limit.
 * Lengths count Unicode code points, so a surrogate pair is never split.
 * Quoting is left to {@link org.dbsuite.doccat.sql.SqlDialect}.
 */
public class CommentText {
  private final int maxLength;
  private final String marker;

  public CommentText(int maxLength, String marker) {
    Preconditions.checkArgument(
        marker.codePointCount(0, marker.length()) < maxLength,
        "marker '%s' does not fit in %s characters", marker, maxLength);
    this.maxLength = maxLength;
    this.marker = marker;
  }

  /** Creates a CommentText with the limit and marker of a
   * configuration. */
  public static CommentText of(DocCatConfig config) {
    return new CommentText(config.maxCommentLength(),
        config.truncationMarker());
  }

  /** Returns whether a comment is absent: null or empty. */
  public static boolean isBlank(@Nullable String text) {
    return text == null || text.isEmpty();
  }

  public int maxLength() {
    return maxLength;
  }

  /** Returns the length of a text in code points. */
  public static int length(String text) {
    return text.codePointCount(0, text.length());
  }

  /** Returns whether a text is longer than the limit. */
  public boolean needsTruncation(String text) {
    return length(text) > maxLength;
  }

  /** Returns the text, truncated and marked if it is longer than the
   * limit. */
  public String encode(String text) {
    if (!needsTruncation(text)) {
      return text;
    }
    final int keep = maxLength - length(marker);
    final int end = text.offsetByCodePoints(0, keep);
    return text.substring(0, end) + marker;
  }
}
