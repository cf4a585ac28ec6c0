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

import org.dbsuite.doccat.DocCat;
import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.test.CatalogFixture;

import org.apache.calcite.linq4j.Enumerable;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests {@link CommentExporter}.
 */
class CommentExporterTest {
  private CatalogFixture fixture;
  private DocCat docCat;

  @BeforeEach void setUp() {
    fixture = CatalogFixture.create();
    docCat = fixture.docCat();
    docCat.createExtendedStore();
  }

  @AfterEach void tearDown() throws SQLException {
    fixture.close();
  }

  private void put(ObjectKind kind, String text, Object... key) {
    docCat.store(kind).put(CommentKey.of(kind, key), text);
  }

  private static List<String> sql(List<CommentStatement> statements) {
    return statements.stream()
        .map(statement -> statement.sql)
        .collect(Collectors.toList());
  }

  @Test void testExportStatements() {
    put(ObjectKind.ROUTINES, "Resets everything", "APP", "RESET1");
    put(ObjectKind.ROUTINES, "Adds", "APP", "ADD_INT");
    put(ObjectKind.COLUMNS, "It's the key", "APP", "T1", "C1");
    put(ObjectKind.TABLES, "Extended comment on T1", "APP", "T1");
    put(ObjectKind.SCHEMATA, "Application", "APP");
    put(ObjectKind.ROUTINEPARMS, "Never exported", "APP", "ADD_INT", "P", 1);
    assertThat(sql(docCat.exportStatements().toList()),
        is(
            ImmutableList.of(
                "COMMENT ON SCHEMA \"APP\" IS 'Application'",
                "COMMENT ON TABLE \"APP\".\"T1\" IS 'Extended comment on T1'",
                "COMMENT ON COLUMN \"APP\".\"T1\".\"C1\" IS 'It''s the key'",
                "COMMENT ON SPECIFIC FUNCTION \"APP\".\"ADD_INT\" IS 'Adds'",
                "COMMENT ON SPECIFIC PROCEDURE \"APP\".\"RESET1\""
                    + " IS 'Resets everything'")));
  }

  @Test void testSkipsOrphanComments() {
    put(ObjectKind.TABLES, "Table was dropped", "APP", "GONE");
    put(ObjectKind.TABLES, "Kept", "APP", "T2");
    assertThat(sql(docCat.exportStatements().toList()),
        is(ImmutableList.of("COMMENT ON TABLE \"APP\".\"T2\" IS 'Kept'")));
  }

  @Test void testExportsEmptyComment() {
    put(ObjectKind.TABLES, "", "APP", "T1");
    put(ObjectKind.TABLES, "Kept", "APP", "T2");
    assertThat(sql(docCat.exportStatements().toList()),
        is(
            ImmutableList.of("COMMENT ON TABLE \"APP\".\"T1\" IS ''",
                "COMMENT ON TABLE \"APP\".\"T2\" IS 'Kept'")));
  }

  @Test void testExportIsRepeatable() {
    put(ObjectKind.TABLES, "One", "APP", "T1");
    put(ObjectKind.COLUMNS, "Two", "APP", "T1", "C2");
    final List<CommentStatement> first = docCat.exportStatements().toList();
    final List<CommentStatement> second = docCat.exportStatements().toList();
    assertThat(first.size(), is(2));
    assertThat(second, is(first));

    // The same enumerable queries again each time it is enumerated.
    final Enumerable<CommentStatement> statements =
        docCat.exportStatements();
    assertThat(statements.toList(), is(first));
    put(ObjectKind.TABLES, "Three", "APP", "T2");
    assertThat(statements.toList().size(), is(3));
  }

  @Test void testTruncation() {
    final String text = Strings.repeat("x", 250) + "'bcd";
    put(ObjectKind.TABLES, text, "APP", "T1");
    put(ObjectKind.TABLES, Strings.repeat("y", 254), "APP", "T2");
    final List<CommentStatement> statements =
        docCat.exportStatements().toList();
    assertThat(statements.get(0).isTruncated(), is(false));
    assertThat(statements.get(0).originalLength, is(254));
    assertThat(statements.get(0).sql,
        is("COMMENT ON TABLE \"APP\".\"T1\" IS '"
            + Strings.repeat("x", 250) + "''bcd'"));
    assertThat(statements.get(1).isTruncated(), is(false));

    put(ObjectKind.TABLES, text + "e", "APP", "T1");
    final CommentStatement truncated =
        docCat.exportStatements().toList().get(0);
    assertThat(truncated.isTruncated(), is(true));
    assertThat(truncated.originalLength, is(255));
    assertThat(truncated.sql,
        is("COMMENT ON TABLE \"APP\".\"T1\" IS '"
            + Strings.repeat("x", 250) + "''...'"));
  }

  @Test void testExportToNative() {
    put(ObjectKind.TABLES, "Exported table comment", "APP", "T1");
    put(ObjectKind.COLUMNS, Strings.repeat("z", 300), "APP", "T1", "C2");
    final ExportSummary summary = docCat.exportToNative();
    assertThat(summary.executedCount(), is(2));
    assertThat(summary.truncatedCount(), is(1));
    assertThat(
        fixture.queryValue("SELECT REMARKS FROM INFORMATION_SCHEMA.SYSTEM_TABLES"
            + " WHERE TABLE_SCHEM = 'APP' AND TABLE_NAME = 'T1'"),
        is("Exported table comment"));
    assertThat(
        fixture.queryValue("SELECT REMARKS FROM INFORMATION_SCHEMA.SYSTEM_COLUMNS"
            + " WHERE TABLE_SCHEM = 'APP' AND TABLE_NAME = 'T1'"
            + " AND COLUMN_NAME = 'C2'"),
        is(Strings.repeat("z", 251) + "..."));
  }
}
