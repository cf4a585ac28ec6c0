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
package org.dbsuite.doccat.sql;

import org.dbsuite.doccat.runtime.DocCatException;
import org.dbsuite.doccat.sql.ddl.SqlCommentOn;
import org.dbsuite.doccat.sql.ddl.SqlCreateAlias;
import org.dbsuite.doccat.sql.ddl.SqlDropObject;
import org.dbsuite.doccat.sql.dialect.AnsiSqlDialect;
import org.dbsuite.doccat.sql.dialect.Db2SqlDialect;
import org.dbsuite.doccat.sql.dialect.HsqldbSqlDialect;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SqlDialect} and {@link SqlDialects}.
 */
class SqlDialectTest {
  @Test void testQuoteIdentifier() {
    final SqlDialect dialect = Db2SqlDialect.DEFAULT;
    assertThat(dialect.quoteIdentifier("TABLES"), is("\"TABLES\""));
    assertThat(dialect.quoteIdentifier("my \"odd\" name"),
        is("\"my \"\"odd\"\" name\""));
    assertThat(SqlIdentifier.of("SYSCAT", "TABLES").toSqlString(dialect),
        is("\"SYSCAT\".\"TABLES\""));
  }

  @Test void testQuoteStringLiteral() {
    final SqlDialect dialect = AnsiSqlDialect.DEFAULT;
    assertThat(dialect.quoteStringLiteral("can't run"), is("'can''t run'"));
    assertThat(dialect.quoteStringLiteral("''"), is("''''''"));
    assertThat(dialect.quoteStringLiteral(""), is("''"));
  }

  @Test void testCommentOn() {
    final SqlCommentOn comment =
        new SqlCommentOn("TABLE", SqlIdentifier.of("APP", "T1"),
            "It's a table");
    assertThat(comment.toSqlString(Db2SqlDialect.DEFAULT),
        is("COMMENT ON TABLE \"APP\".\"T1\" IS 'It''s a table'"));
  }

  @Test void testAlias() {
    final SqlCreateAlias alias =
        new SqlCreateAlias(SqlIdentifier.of("DOCCAT", "BUFFERPOOLS"),
            SqlIdentifier.of("SYSCAT", "BUFFERPOOLS"));
    assertThat(alias.toSqlString(Db2SqlDialect.DEFAULT),
        is("CREATE ALIAS \"DOCCAT\".\"BUFFERPOOLS\""
            + " FOR \"SYSCAT\".\"BUFFERPOOLS\""));
    assertThat(alias.toSqlString(HsqldbSqlDialect.DEFAULT),
        is("CREATE VIEW \"DOCCAT\".\"BUFFERPOOLS\""
            + " AS SELECT * FROM \"SYSCAT\".\"BUFFERPOOLS\""));

    final SqlDropObject drop =
        new SqlDropObject(SqlDropObject.ObjectType.ALIAS,
            SqlIdentifier.of("DOCCAT", "BUFFERPOOLS"), false);
    assertThat(drop.toSqlString(Db2SqlDialect.DEFAULT),
        is("DROP ALIAS \"DOCCAT\".\"BUFFERPOOLS\""));
    assertThat(drop.toSqlString(HsqldbSqlDialect.DEFAULT),
        is("DROP VIEW \"DOCCAT\".\"BUFFERPOOLS\""));
  }

  @Test void testDropSchemaRestrict() {
    final SqlDropObject drop =
        new SqlDropObject(SqlDropObject.ObjectType.SCHEMA,
            SqlIdentifier.of("DOCDATA"), true);
    assertThat(drop.toSqlString(Db2SqlDialect.DEFAULT),
        is("DROP SCHEMA \"DOCDATA\" RESTRICT"));
  }

  @Test void testGetProduct() {
    assertThat(SqlDialect.getProduct("DB2/LINUXX8664"),
        is(SqlDialect.DatabaseProduct.DB2));
    assertThat(SqlDialect.getProduct("HSQL Database Engine"),
        is(SqlDialect.DatabaseProduct.HSQLDB));
    assertThat(SqlDialect.getProduct("Oracle"),
        is(SqlDialect.DatabaseProduct.UNKNOWN));
  }

  @Test void testForName() {
    assertThat(SqlDialects.forName("db2"),
        sameInstance(Db2SqlDialect.DEFAULT));
    assertThat(SqlDialects.forName(" HSQLDB "),
        sameInstance(HsqldbSqlDialect.DEFAULT));
    final DocCatException e =
        assertThrows(DocCatException.class,
            () -> SqlDialects.forName("oracle"));
    assertThat(e.getMessage(),
        is("No dialect for database product 'oracle'"));
  }
}
