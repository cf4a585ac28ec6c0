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
package org.dbsuite.doccat;

import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.config.DocCatConfigImpl;
import org.dbsuite.doccat.config.DocCatProperty;
import org.dbsuite.doccat.runtime.DocCatException;
import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.dialect.Db2SqlDialect;
import org.dbsuite.doccat.sync.CommentKey;
import org.dbsuite.doccat.test.CatalogFixture;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests the {@link DocCat} facade from end to end.
 */
class DocCatTest {
  @Test void testDialectFromMetadata() throws SQLException {
    try (CatalogFixture fixture = CatalogFixture.empty()) {
      final DocCat docCat =
          DocCat.create(fixture.dataSource, DocCatConfigImpl.DEFAULT);
      assertThat(docCat.getDialect().getDatabaseProduct(),
          is(SqlDialect.DatabaseProduct.HSQLDB));
    }
  }

  @Test void testDialectFromConfig() throws SQLException {
    try (CatalogFixture fixture = CatalogFixture.empty()) {
      assertThat(DocCat.create(fixture.dataSource).getConfig().dialect(),
          is("hsqldb"));
      final DocCat db2 =
          DocCat.create(fixture.dataSource,
              DocCatConfigImpl.DEFAULT.set(DocCatProperty.DIALECT, "DB2"));
      assertThat(db2.getDialect(), sameInstance(Db2SqlDialect.DEFAULT));
      assertThrows(DocCatException.class, () ->
          DocCat.create(fixture.dataSource,
              DocCatConfigImpl.DEFAULT.set(DocCatProperty.DIALECT, "sybase")));
    }
  }

  /** Documents objects through the unified schema, pushes the comments to
   * the native catalog, and takes everything down again. */
  @Test void testLifecycle() throws SQLException {
    try (CatalogFixture fixture = CatalogFixture.create()) {
      final DocCat docCat = fixture.docCat();
      docCat.createExtendedStore();
      docCat.install();

      fixture.run("UPDATE DOCCAT.TABLES SET REMARKS = 'Orders placed online'"
          + " WHERE TABSCHEMA = 'APP' AND TABNAME = 'T2'");
      assertThat(
          docCat.store(ObjectKind.TABLES)
              .find(CommentKey.of(ObjectKind.TABLES, "APP", "T2")),
          is("Orders placed online"));
      assertThat(docCat.exportStatements().select(s -> s.sql).toList(),
          is(
              ImmutableList.of(
                  "COMMENT ON TABLE \"APP\".\"T2\" IS 'Orders placed online'")));
      assertThat(docCat.exportToNative().executedCount(), is(1));
      assertThat(
          fixture.queryValue("SELECT REMARKS FROM INFORMATION_SCHEMA.SYSTEM_TABLES"
              + " WHERE TABLE_SCHEM = 'APP' AND TABLE_NAME = 'T2'"),
          is("Orders placed online"));

      docCat.uninstall();
      assertThat(
          fixture.query("SELECT SCHEMA_NAME FROM INFORMATION_SCHEMA.SCHEMATA"
              + " WHERE SCHEMA_NAME IN ('DOCCAT', 'DOCDATA')").isEmpty(),
          is(true));
    }
  }
}
