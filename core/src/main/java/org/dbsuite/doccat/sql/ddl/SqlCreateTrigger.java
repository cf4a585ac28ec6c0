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
package org.dbsuite.doccat.sql.ddl;

import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlIf;
import org.dbsuite.doccat.sql.SqlKind;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlWriter;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Parse tree for a row-level {@code CREATE TRIGGER} statement whose body is
 * a {@code BEGIN ATOMIC} compound statement.
 *
 * <p>For example,
 *
 * <blockquote><pre>CREATE TRIGGER "DOCCAT"."TABLES_SYNC"
 *   INSTEAD OF UPDATE ON "DOCCAT"."TABLES"
 *   REFERENCING OLD AS "O" NEW AS "N"
 *   FOR EACH ROW BEGIN ATOMIC ...; END</pre></blockquote>
 */
public class SqlCreateTrigger extends SqlDdl {
  public final String event;
  public final SqlIdentifier table;
  public final String oldAlias;
  public final String newAlias;
  public final ImmutableList<SqlNode> body;

  public SqlCreateTrigger(SqlIdentifier name, String event,
      SqlIdentifier table, String oldAlias, String newAlias,
      List<SqlNode> body) {
    super(name);
    this.event = event;
    this.table = table;
    this.oldAlias = oldAlias;
    this.newAlias = newAlias;
    this.body = ImmutableList.copyOf(body);
  }

  @Override public SqlKind getKind() {
    return SqlKind.CREATE_TRIGGER;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("CREATE TRIGGER");
    name.unparse(writer);
    writer.keyword(event);
    writer.keyword("ON");
    table.unparse(writer);
    writer.keyword("REFERENCING");
    writer.keyword(writer.getDialect().oldRowKeyword());
    SqlIdentifier.of(oldAlias).unparse(writer);
    writer.keyword(writer.getDialect().newRowKeyword());
    SqlIdentifier.of(newAlias).unparse(writer);
    writer.keyword("FOR EACH ROW BEGIN ATOMIC");
    SqlIf.unparseStatements(writer, body);
    writer.keyword("END");
  }
}
