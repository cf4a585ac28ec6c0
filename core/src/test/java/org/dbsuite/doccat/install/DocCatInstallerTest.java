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

import org.dbsuite.doccat.catalog.CatalogColumn;
import org.dbsuite.doccat.catalog.CatalogIntrospector;
import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.config.DocCatConfigImpl;
import org.dbsuite.doccat.config.DocCatProperty;
import org.dbsuite.doccat.runtime.DocCatException;
import org.dbsuite.doccat.runtime.KeyShapeViolationException;
import org.dbsuite.doccat.runtime.TeardownBlockedException;
import org.dbsuite.doccat.test.CatalogFixture;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests {@link DocCatInstaller} against an in-memory database with a
 * simulated catalog.
 */
class DocCatInstallerTest {
  private CatalogFixture fixture;
  private CatalogIntrospector introspector;
  private DocCatInstaller installer;

  @BeforeEach void setUp() {
    fixture = CatalogFixture.create();
    introspector = new CatalogIntrospector(fixture.dataSource, fixture.dialect);
    installer =
        new DocCatInstaller(fixture.dataSource, fixture.dialect,
            CatalogFixture.config());
  }

  @AfterEach void tearDown() throws SQLException {
    fixture.close();
  }

  private static List<String> names(List<CatalogColumn> columns) {
    return columns.stream().map(c -> c.name).collect(Collectors.toList());
  }

  @Test void testCreateExtendedStore() {
    assertThat(installer.createExtendedStore(),
        is(
            ImmutableList.of("COLUMNS", "INDEXES", "ROUTINES", "ROUTINEPARMS",
                "SCHEMATA", "TABLES")));
    assertThat(installer.createExtendedStore().isEmpty(), is(true));

    final List<CatalogColumn> columns =
        introspector.columnsOf("DOCDATA", "ROUTINEPARMS");
    assertThat(names(columns),
        is(
            ImmutableList.of("ROUTINESCHEMA", "SPECIFICNAME", "ROWTYPE",
                "ORDINAL", "PARMNAME", "REMARKS")));
    assertThat(columns.get(0).keyPosition, is(1));
    assertThat(columns.get(3).keyPosition, is(4));
    assertThat(columns.get(0).nullable, is(false));
    assertThat(columns.get(4).nullable, is(true));

    // Check constraints on the routine parameter key
    assertThrows(IllegalStateException.class, () ->
        fixture.run("INSERT INTO DOCDATA.ROUTINEPARMS"
            + " VALUES ('APP', 'F', 'Q', 1, NULL, 'bad row type')"));
    assertThrows(IllegalStateException.class, () ->
        fixture.run("INSERT INTO DOCDATA.ROUTINEPARMS"
            + " VALUES ('APP', 'F', 'P', -1, NULL, 'negative ordinal')"));
    fixture.run("INSERT INTO DOCDATA.ROUTINEPARMS"
        + " VALUES ('APP', 'F', 'P', 0, NULL, 'fine')");
  }

  @Test void testLongTextType() {
    final DocCatInstaller custom =
        new DocCatInstaller(fixture.dataSource, fixture.dialect,
            CatalogFixture.config()
                .set(DocCatProperty.LONG_TEXT_TYPE, "VARCHAR(4000)"));
    assertThat(
        custom.createTable(ObjectKind.TABLES,
                introspector.columnsOf("SYSCAT", "TABLES"))
            .toSqlString(fixture.dialect),
        containsString("\"REMARKS\" VARCHAR(4000),"));
    assertThat(
        installer.createTable(ObjectKind.TABLES,
                introspector.columnsOf("SYSCAT", "TABLES"))
            .toSqlString(fixture.dialect),
        containsString("\"REMARKS\" VARCHAR(32768),"));
  }

  @Test void testInstall() {
    installer.createExtendedStore();
    final InstallSummary summary = installer.install();
    assertThat(summary.mergeViews(),
        is(
            ImmutableList.of("COLUMNS", "INDEXES", "ROUTINEPARMS", "ROUTINES",
                "SCHEMATA", "TABLES")));
    assertThat(summary.aliases(), is(ImmutableList.of("BUFFERPOOLS")));
    for (String table : summary.mergeViews()) {
      assertThat(table,
          names(introspector.columnsOf("DOCCAT", table)),
          is(names(introspector.columnsOf("SYSCAT", table))));
    }
    assertThat(ImmutableList.copyOf(introspector.triggerNames("DOCCAT")),
        is(
            ImmutableList.of("COLUMNS_SYNC", "INDEXES_SYNC",
                "ROUTINEPARMS_SYNC", "ROUTINES_SYNC", "SCHEMATA_SYNC",
                "TABLES_SYNC")));
    assertThat(fixture.query("SELECT BPNAME FROM DOCCAT.BUFFERPOOLS"),
        is(ImmutableList.of("IBMDEFAULTBP")));
  }

  @Test void testMergeViewPrefersExtendedComment() {
    installer.createExtendedStore();
    installer.install();
    fixture.run("INSERT INTO DOCDATA.COLUMNS"
        + " VALUES ('APP', 'T1', 'C2', 'Extended comment on C2')");
    fixture.run("INSERT INTO DOCDATA.COLUMNS"
        + " VALUES ('APP', 'T1', 'C1', NULL)");
    assertThat(
        fixture.query("SELECT COLNAME, REMARKS FROM DOCCAT.COLUMNS"
            + " WHERE TABNAME = 'T1' ORDER BY COLNO"),
        is(
            ImmutableList.of("C1; Identifier",
                "C2; Extended comment on C2")));
  }

  @Test void testTriggerRoundTrip() {
    installer.createExtendedStore();
    installer.install();
    final String select = "SELECT REMARKS FROM DOCCAT.TABLES"
        + " WHERE TABSCHEMA = 'APP' AND TABNAME = 'T1'";
    final String extended = "SELECT REMARKS FROM DOCDATA.TABLES";

    fixture.run("UPDATE DOCCAT.TABLES SET REMARKS = 'Written through view'"
        + " WHERE TABSCHEMA = 'APP' AND TABNAME = 'T1'");
    assertThat(fixture.queryValue(select), is("Written through view"));
    assertThat(fixture.query(extended),
        is(ImmutableList.of("Written through view")));

    fixture.run("UPDATE DOCCAT.TABLES SET REMARKS = 'Changed'"
        + " WHERE TABSCHEMA = 'APP' AND TABNAME = 'T1'");
    assertThat(fixture.query(extended), is(ImmutableList.of("Changed")));

    fixture.run("UPDATE DOCCAT.TABLES SET REMARKS = NULL"
        + " WHERE TABSCHEMA = 'APP' AND TABNAME = 'T1'");
    assertThat(fixture.query(extended).isEmpty(), is(true));
    assertThat(fixture.queryValue(select), is("Native comment on T1"));

    // An empty comment hides the native one instead of removing the row
    fixture.run("UPDATE DOCCAT.TABLES SET REMARKS = ''"
        + " WHERE TABSCHEMA = 'APP' AND TABNAME = 'T1'");
    assertThat(fixture.queryValue(select), is(""));
    assertThat(fixture.query(extended), is(ImmutableList.of("")));

    fixture.run("UPDATE DOCCAT.TABLES SET REMARKS = 'Restored'"
        + " WHERE TABSCHEMA = 'APP' AND TABNAME = 'T1'");
    assertThat(fixture.query(extended), is(ImmutableList.of("Restored")));
  }

  @Test void testTriggerWithNullKey() {
    installer.createExtendedStore();
    installer.install();
    fixture.run("UPDATE DOCCAT.ROUTINEPARMS SET REMARKS = 'Documented'"
        + " WHERE SPECIFICNAME = 'SYSFUN1'");
    assertThat(
        fixture.query("SELECT ROUTINESCHEMA, SPECIFICNAME, REMARKS"
            + " FROM DOCDATA.ROUTINEPARMS"),
        is(ImmutableList.of("; SYSFUN1; Documented")));
    assertThat(
        fixture.queryValue("SELECT REMARKS FROM DOCCAT.ROUTINEPARMS"
            + " WHERE SPECIFICNAME = 'SYSFUN1'"),
        is("Documented"));
  }

  @Test void testUninstall() {
    installer.createExtendedStore();
    installer.install();
    installer.uninstall();
    assertThat(introspector.schemaExists("DOCCAT"), is(false));
    assertThat(introspector.schemaExists("DOCDATA"), is(false));
    assertThat(introspector.tableExists("SYSCAT", "TABLES"), is(true));

    // Install again after uninstall
    installer.createExtendedStore();
    assertThat(installer.install().mergeViews().size(), is(6));
  }

  @Test void testUninstallKeepsRetainedRoutine() {
    installer.createExtendedStore();
    installer.install();
    fixture.run("CREATE PROCEDURE DOCCAT.UNINSTALL() BEGIN ATOMIC"
        + " DECLARE N INTEGER DEFAULT 0; SET N = N + 1; END");
    fixture.run("CREATE PROCEDURE DOCCAT.COPY_ROUTINE() BEGIN ATOMIC"
        + " DECLARE N INTEGER DEFAULT 0; SET N = N + 1; END");
    installer.uninstall();
    assertThat(introspector.schemaExists("DOCDATA"), is(false));
    assertThat(introspector.schemaExists("DOCCAT"), is(true));
    assertThat(
        introspector.procedures("DOCCAT").stream()
            .map(routine -> routine.name)
            .collect(Collectors.toList()),
        is(ImmutableList.of("UNINSTALL")));
    assertThat(introspector.tableNames("DOCCAT", "TABLE", "VIEW").isEmpty(),
        is(true));
  }

  @Test void testUninstallBlockedByForeignObject() {
    installer.createExtendedStore();
    installer.install();
    fixture.run("CREATE SEQUENCE DOCDATA.FOREIGN_SEQ");
    final TeardownBlockedException e =
        assertThrows(TeardownBlockedException.class, installer::uninstall);
    assertThat(e.getMessage(), startsWith("Cannot drop schema 'DOCDATA': "));
    assertThat(e.getCause() instanceof SQLException, is(true));
    assertThat(e.getMessage(), containsString(e.getCause().getMessage()));
    assertThat(introspector.schemaExists("DOCDATA"), is(true));
  }

  @Test void testFailedTriggerLeavesNoView() {
    installer.createExtendedStore();
    final DdlExecutor failingTriggers =
        new DdlExecutor(fixture.dataSource, fixture.dialect) {
          @Override protected void executeSql(String sql)
              throws SQLException {
            if (sql.startsWith("CREATE TRIGGER")) {
              throw new SQLException("triggers are not allowed");
            }
            super.executeSql(sql);
          }
        };
    final DocCatInstaller failing =
        new DocCatInstaller(CatalogFixture.config(), introspector,
            failingTriggers);
    final DocCatException e =
        assertThrows(DocCatException.class, failing::install);
    assertThat(e.getMessage(), startsWith("While executing SQL [CREATE TRIGGER"));
    assertThat(introspector.tableExists("DOCCAT", "BUFFERPOOLS"), is(true));
    assertThat(introspector.tableExists("DOCCAT", "COLUMNS"), is(false));
    assertThat(e.getSuppressed().length, is(0));
  }

  @Test void testNoKeyFailsBeforeDdl() {
    fixture.run("CREATE SCHEMA DOCDATA",
        "CREATE TABLE DOCDATA.TABLES (TABSCHEMA VARCHAR(128),"
            + " TABNAME VARCHAR(128), REMARKS VARCHAR(1000))");
    final KeyShapeViolationException e =
        assertThrows(KeyShapeViolationException.class, installer::install);
    assertThat(e.getMessage(),
        is("Table 'DOCDATA'.'TABLES' declares no key columns"));
    assertThat(introspector.tableExists("DOCCAT", "TABLES"), is(false));
  }

  @Test void testCustomNamespaces() {
    final DocCatConfigImpl config = CatalogFixture.config()
        .set(DocCatProperty.EXTENDED_SCHEMA, "NOTES")
        .set(DocCatProperty.UNIFIED_SCHEMA, "CATALOG")
        .set(DocCatProperty.RETAINED_ROUTINE, "");
    final DocCatInstaller custom =
        new DocCatInstaller(fixture.dataSource, fixture.dialect, config);
    custom.createExtendedStore();
    custom.install();
    assertThat(introspector.tableExists("NOTES", "TABLES"), is(true));
    assertThat(introspector.tableExists("CATALOG", "TABLES"), is(true));
    custom.uninstall();
    assertThat(introspector.schemaExists("CATALOG"), is(false));
  }
}
