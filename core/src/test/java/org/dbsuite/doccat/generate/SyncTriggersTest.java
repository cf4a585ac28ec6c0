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
package org.dbsuite.doccat.generate;

import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.dialect.Db2SqlDialect;
import org.dbsuite.doccat.sql.dialect.HsqldbSqlDialect;
import org.dbsuite.doccat.sql.ddl.SqlCreateTrigger;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests {@link SyncTriggers}.
 */
class SyncTriggersTest {
  private static final String KEY_MATCH = "\"TABSCHEMA\" = \"O\".\"TABSCHEMA\""
      + " AND \"TABNAME\" = \"O\".\"TABNAME\"";

  @Test void testCreateTrigger() {
    final SqlCreateTrigger trigger =
        SyncTriggers.createTrigger(Templates.tables());
    assertThat(trigger.toSqlString(Db2SqlDialect.DEFAULT),
        is("CREATE TRIGGER \"DOCCAT\".\"TABLES_SYNC\" INSTEAD OF UPDATE"
            + " ON \"DOCCAT\".\"TABLES\""
            + " REFERENCING OLD AS \"O\" NEW AS \"N\""
            + " FOR EACH ROW BEGIN ATOMIC"
            + " IF EXISTS (SELECT 1 FROM \"DOCDATA\".\"TABLES\" \"D\""
            + " WHERE \"D\".\"TABSCHEMA\" = \"O\".\"TABSCHEMA\""
            + " AND \"D\".\"TABNAME\" = \"O\".\"TABNAME\")"
            + " THEN IF \"N\".\"REMARKS\" IS NULL"
            + " THEN DELETE FROM \"DOCDATA\".\"TABLES\" WHERE " + KEY_MATCH + ";"
            + " ELSE UPDATE \"DOCDATA\".\"TABLES\""
            + " SET \"REMARKS\" = \"N\".\"REMARKS\" WHERE " + KEY_MATCH + ";"
            + " END IF;"
            + " ELSE IF \"N\".\"REMARKS\" IS NOT NULL"
            + " THEN INSERT INTO \"DOCDATA\".\"TABLES\""
            + " (\"TABSCHEMA\", \"TABNAME\", \"REMARKS\")"
            + " VALUES (\"O\".\"TABSCHEMA\", \"O\".\"TABNAME\","
            + " \"N\".\"REMARKS\");"
            + " END IF;"
            + " END IF; END"));
  }

  @Test void testHsqldbTransitionVariables() {
    final SqlCreateTrigger trigger =
        SyncTriggers.createTrigger(Templates.tables());
    assertThat(trigger.toSqlString(HsqldbSqlDialect.DEFAULT),
        containsString(" REFERENCING OLD ROW AS \"O\" NEW ROW AS \"N\" "));
  }

  @Test void testNoopHasNoStatements() {
    assertThat(
        SyncTriggers.statements(Templates.tables(), TriggerAction.NOOP)
            .isEmpty(),
        is(true));
  }

  @Test void testInsertCopiesKeysAndCarriedColumns() {
    final List<SqlNode> statements =
        SyncTriggers.statements(Templates.routineParms(),
            TriggerAction.INSERT);
    assertThat(statements.size(), is(1));
    assertThat(statements.get(0).toSqlString(Db2SqlDialect.DEFAULT),
        is("INSERT INTO \"DOCDATA\".\"ROUTINEPARMS\""
            + " (\"ROUTINESCHEMA\", \"SPECIFICNAME\", \"ROWTYPE\", \"ORDINAL\","
            + " \"PARMNAME\", \"REMARKS\")"
            + " VALUES (COALESCE(\"O\".\"ROUTINESCHEMA\", ''),"
            + " COALESCE(\"O\".\"SPECIFICNAME\", ''), \"O\".\"ROWTYPE\","
            + " \"O\".\"ORDINAL\", \"O\".\"PARMNAME\", \"N\".\"REMARKS\")"));
  }

  @Test void testDeleteMatchesCoalescedKey() {
    final List<SqlNode> statements =
        SyncTriggers.statements(Templates.routineParms(),
            TriggerAction.DELETE);
    assertThat(statements.get(0).toSqlString(Db2SqlDialect.DEFAULT),
        is("DELETE FROM \"DOCDATA\".\"ROUTINEPARMS\""
            + " WHERE \"ROUTINESCHEMA\" = COALESCE(\"O\".\"ROUTINESCHEMA\", '')"
            + " AND \"SPECIFICNAME\" = COALESCE(\"O\".\"SPECIFICNAME\", '')"
            + " AND \"ROWTYPE\" = \"O\".\"ROWTYPE\""
            + " AND \"ORDINAL\" = \"O\".\"ORDINAL\""));
  }
}
