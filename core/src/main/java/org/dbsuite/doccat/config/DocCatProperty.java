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

import org.apache.calcite.avatica.ConnectionProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import static org.apache.calcite.avatica.ConnectionConfigImpl.PropEnv;
import static org.apache.calcite.avatica.ConnectionConfigImpl.parse;

/**
 * Properties that configure where DocCat finds the native catalog, where it
 * keeps extended comments, and how it renders SQL.
 */
public enum DocCatProperty implements ConnectionProperty {
  /** Schema of the native catalog, read-only to DocCat. */
  NATIVE_SCHEMA("nativeSchema", Type.STRING, "SYSCAT", false),

  /** Schema of the extended comment tables. */
  EXTENDED_SCHEMA("extendedSchema", Type.STRING, "DOCDATA", false),

  /** Schema that holds the generated merge views, triggers and aliases. */
  UNIFIED_SCHEMA("unifiedSchema", Type.STRING, "DOCCAT", false),

  /** Name of the comment column, in both native and extended tables. */
  COMMENT_COLUMN("commentColumn", Type.STRING, "REMARKS", false),

  /** Longest comment the native catalog accepts, in characters. */
  MAX_COMMENT_LENGTH("maxCommentLength", Type.NUMBER, 254, false),

  /** Text appended to a comment that was cut to fit
   * {@link #MAX_COMMENT_LENGTH}. */
  TRUNCATION_MARKER("truncationMarker", Type.STRING, "...", false),

  /** Suffix appended to a merge view's name to name its trigger. */
  TRIGGER_SUFFIX("triggerSuffix", Type.STRING, "_SYNC", false),

  /** Routine in the unified schema that uninstall leaves in place. While it
   * exists, uninstall does not drop the unified schema. */
  RETAINED_ROUTINE("retainedRoutine", Type.STRING, "UNINSTALL", false),

  /** Name of the SQL dialect, for example "DB2" or "HSQLDB". If not set,
   * the dialect is deduced from the database's metadata. */
  DIALECT("dialect", Type.STRING, null, false),

  /** Column type of the extended comment column. If not set, the dialect's
   * long text type is used. */
  LONG_TEXT_TYPE("longTextType", Type.STRING, null, false);

  private final String camelName;
  private final Type type;
  @SuppressWarnings("ImmutableEnumChecker")
  private final @Nullable Object defaultValue;
  private final boolean required;
  private final @Nullable Class valueClass;

  private static final Map<String, DocCatProperty> NAME_TO_PROPS;

  static {
    NAME_TO_PROPS = new HashMap<>();
    for (DocCatProperty p : DocCatProperty.values()) {
      NAME_TO_PROPS.put(p.camelName.toUpperCase(Locale.ROOT), p);
      NAME_TO_PROPS.put(p.name(), p);
    }
  }

  DocCatProperty(String camelName, Type type, @Nullable Object defaultValue,
      boolean required) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    this.required = required;
    this.valueClass = type.deduceValueClass(defaultValue, null);
    if (!type.valid(defaultValue, this.valueClass)) {
      throw new AssertionError(camelName);
    }
  }

  @Override public String camelName() {
    return camelName;
  }

  @Override public @Nullable Object defaultValue() {
    return defaultValue;
  }

  @Override public Type type() {
    return type;
  }

  @Override public @Nullable Class valueClass() {
    return valueClass;
  }

  @Override public boolean required() {
    return required;
  }

  @Override public PropEnv wrap(Properties properties) {
    return new PropEnv(parse(properties, NAME_TO_PROPS), this);
  }
}
