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
package org.dbsuite.doccat.catalog;

import org.dbsuite.doccat.runtime.MetadataNotFoundException;
import org.dbsuite.doccat.test.CatalogFixture;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.endsWith;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests {@link CatalogIntrospector} against an in-memory database.
 */
class CatalogIntrospectorTest {
  private CatalogFixture fixture;
  private CatalogIntrospector introspector;

  @BeforeEach void setUp() {
    fixture = CatalogFixture.create();
    introspector = new CatalogIntrospector(fixture.dataSource, fixture.dialect);
  }

  @AfterEach void tearDown() throws SQLException {
    fixture.close();
  }

  @Test void testColumnsOf() {
    final List<CatalogColumn> columns =
        introspector.columnsOf("SYSCAT", "ROUTINEPARMS");
    assertThat(
        columns.stream().map(c -> c.name).collect(Collectors.toList()),
        is(
            ImmutableList.of("ROUTINESCHEMA", "SPECIFICNAME", "PARMNAME",
                "ROWTYPE", "ORDINAL", "TYPENAME", "REMARKS")));
    final CatalogColumn schema = columns.get(0);
    assertThat(schema.nullable, is(true));
    assertThat(schema.isCharacter(), is(true));
    assertThat(schema.typeSpec(), endsWith("(128)"));
    assertThat(schema.keyPosition, nullValue());
    assertThat(columns.get(3).nullable, is(false));
    assertThat(columns.get(3).typeSpec(), endsWith("(1)"));
    assertThat(columns.get(4).isCharacter(), is(false));
    assertThat(columns.get(4).typeSpec(), is("SMALLINT"));
  }

  @Test void testKeyPositions() {
    fixture.run("CREATE SCHEMA X",
        "CREATE TABLE X.K (B INTEGER NOT NULL, A INTEGER NOT NULL,"
            + " C VARCHAR(10), PRIMARY KEY (A, B))");
    final List<CatalogColumn> columns = introspector.columnsOf("X", "K");
    assertThat(columns.get(0).name, is("B"));
    assertThat(columns.get(0).keyPosition, is(2));
    assertThat(columns.get(1).keyPosition, is(1));
    assertThat(columns.get(2).isKey(), is(false));
  }

  @Test void testColumnsOfMissingTable() {
    final MetadataNotFoundException e =
        assertThrows(MetadataNotFoundException.class,
            () -> introspector.columnsOf("SYSCAT", "NOPE"));
    assertThat(e.getMessage(), is("Table 'SYSCAT'.'NOPE' not found"));
  }

  @Test void testTableExists() {
    assertThat(introspector.tableExists("SYSCAT", "TABLES"), is(true));
    assertThat(introspector.tableExists("SYSCAT", "TAB_ES"), is(false));
    assertThat(introspector.tableExists("DOCDATA", "TABLES"), is(false));
  }

  @Test void testSchemaExists() {
    assertThat(introspector.schemaExists("SYSCAT"), is(true));
    assertThat(introspector.schemaExists("DOCDATA"), is(false));
  }

  @Test void testTableNames() {
    assertThat(
        ImmutableList.copyOf(introspector.tableNames("SYSCAT", "TABLE")),
        is(
            ImmutableList.of("BUFFERPOOLS", "COLUMNS", "INDEXES",
                "ROUTINEPARMS", "ROUTINES", "SCHEMATA", "TABLES")));
    assertThat(introspector.tableNames("SYSCAT", "VIEW").isEmpty(), is(true));
  }

  @Test void testTriggerNames() {
    assertThat(introspector.triggerNames("APP").isEmpty(), is(true));
    fixture.run("CREATE TABLE APP.AUDIT (ID INTEGER)",
        "CREATE TRIGGER APP.T1_INS AFTER INSERT ON APP.T1"
            + " FOR EACH ROW INSERT INTO APP.AUDIT VALUES (1)");
    assertThat(ImmutableList.copyOf(introspector.triggerNames("APP")),
        is(ImmutableList.of("T1_INS")));
  }

  @Test void testProcedures() {
    assertThat(introspector.procedures("APP").isEmpty(), is(true));
    fixture.run("CREATE PROCEDURE APP.NOTHING() BEGIN ATOMIC"
        + " DECLARE N INTEGER DEFAULT 0; SET N = N + 1; END");
    final List<RoutineRef> procedures = introspector.procedures("APP");
    assertThat(procedures.size(), is(1));
    assertThat(procedures.get(0).name, is("NOTHING"));
    assertThat(procedures.get(0).schema, is("APP"));
  }
}
