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
package org.dbsuite.doccat.sql.dialect;

import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.SqlWriter;
import org.dbsuite.doccat.sql.ddl.SqlCreateAlias;
import org.dbsuite.doccat.sql.ddl.SqlDropObject;

/**
 * A <code>SqlDialect</code> implementation for the Hsqldb database.
 *
 * <p>Hsqldb has no aliases; an alias becomes a view that selects every
 * column of its target.
 */
public class HsqldbSqlDialect extends SqlDialect {
  public static final SqlDialect DEFAULT = new HsqldbSqlDialect();

  public HsqldbSqlDialect() {
    super(DatabaseProduct.HSQLDB, "\"");
  }

  @Override public String aliasTableType() {
    return "VIEW";
  }

  @Override public String longTextType() {
    return "VARCHAR(32768)";
  }

  @Override public String triggerListQuery() {
    return "SELECT TRIGGER_NAME FROM INFORMATION_SCHEMA.TRIGGERS"
        + " WHERE TRIGGER_SCHEMA = ? ORDER BY TRIGGER_NAME";
  }

  @Override public String oldRowKeyword() {
    return "OLD ROW AS";
  }

  @Override public String newRowKeyword() {
    return "NEW ROW AS";
  }

  @Override public void unparseCreateAlias(SqlWriter writer,
      SqlCreateAlias alias) {
    writer.keyword("CREATE VIEW");
    alias.name.unparse(writer);
    writer.keyword("AS SELECT * FROM");
    alias.target.unparse(writer);
  }

  @Override public void unparseDropAlias(SqlWriter writer,
      SqlDropObject drop) {
    writer.keyword("DROP VIEW");
    drop.name.unparse(writer);
  }
}
