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

import org.apache.calcite.avatica.ConnectionConfigImpl;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/** Implementation of {@link DocCatConfig}. */
public class DocCatConfigImpl extends ConnectionConfigImpl
    implements DocCatConfig {
  /** Name of the classpath resource read by {@link #load()}. */
  public static final String RESOURCE_NAME = "doccat.properties";

  /** Configuration in which every property has its default value. */
  public static final DocCatConfigImpl DEFAULT =
      new DocCatConfigImpl(new Properties());

  public DocCatConfigImpl(Properties properties) {
    super(properties);
  }

  /** Creates a configuration from the {@code doccat.properties} resource on
   * the class path, if there is one, overridden by system properties whose
   * names start with "doccat.". */
  public static DocCatConfigImpl load() {
    final Properties properties = new Properties();
    final ClassLoader classLoader = DocCatConfigImpl.class.getClassLoader();
    try (InputStream stream = classLoader.getResourceAsStream(RESOURCE_NAME)) {
      if (stream != null) {
        properties.load(stream);
      }
    } catch (IOException e) {
      throw RESOURCE.configUnreadable(RESOURCE_NAME).ex(e);
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith("doccat.")) {
        properties.setProperty(name.substring("doccat.".length()),
            System.getProperty(name));
      }
    }
    return new DocCatConfigImpl(properties);
  }

  /** Returns a copy of this configuration with one property changed.
   *
   * <p>Does not modify this configuration. */
  public DocCatConfigImpl set(DocCatProperty property, String value) {
    final Properties newProperties = (Properties) properties.clone();
    newProperties.setProperty(property.camelName(), value);
    return new DocCatConfigImpl(newProperties);
  }

  /** Returns a copy of this configuration with the value of a property
   * removed.
   *
   * <p>Does not modify this configuration. */
  public DocCatConfigImpl unset(DocCatProperty property) {
    final Properties newProperties = (Properties) properties.clone();
    newProperties.remove(property.camelName());
    return new DocCatConfigImpl(newProperties);
  }

  /** Returns whether a given property has been assigned a value.
   *
   * <p>If not, the value returned for the property will be its default value.
   */
  public boolean isSet(DocCatProperty property) {
    return properties.containsKey(property.camelName());
  }

  @Override public String nativeSchema() {
    return DocCatProperty.NATIVE_SCHEMA.wrap(properties).getString();
  }

  @Override public String extendedSchema() {
    return DocCatProperty.EXTENDED_SCHEMA.wrap(properties).getString();
  }

  @Override public String unifiedSchema() {
    return DocCatProperty.UNIFIED_SCHEMA.wrap(properties).getString();
  }

  @Override public String commentColumn() {
    return DocCatProperty.COMMENT_COLUMN.wrap(properties).getString();
  }

  @Override public int maxCommentLength() {
    return Math.toIntExact(
        DocCatProperty.MAX_COMMENT_LENGTH.wrap(properties).getLong());
  }

  @Override public String truncationMarker() {
    return DocCatProperty.TRUNCATION_MARKER.wrap(properties).getString();
  }

  @Override public String triggerSuffix() {
    return DocCatProperty.TRIGGER_SUFFIX.wrap(properties).getString();
  }

  @Override public @Nullable String retainedRoutine() {
    return DocCatProperty.RETAINED_ROUTINE.wrap(properties).getString();
  }

  @Override public @Nullable String dialect() {
    return DocCatProperty.DIALECT.wrap(properties).getString();
  }

  @Override public @Nullable String longTextType() {
    return DocCatProperty.LONG_TEXT_TYPE.wrap(properties).getString();
  }
}
