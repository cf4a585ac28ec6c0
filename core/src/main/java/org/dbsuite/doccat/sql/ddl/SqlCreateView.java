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
import org.dbsuite.doccat.sql.SqlKind;
import org.dbsuite.doccat.sql.SqlNodeList;
import org.dbsuite.doccat.sql.SqlSelect;
import org.dbsuite.doccat.sql.SqlWriter;

import com.google.common.base.Preconditions;

/**
 * Parse tree for {@code CREATE VIEW} statement with an explicit column list.
 */
public class SqlCreateView extends SqlDdl {
  public final SqlNodeList columnList;
  public final SqlSelect query;

  public SqlCreateView(SqlIdentifier name, SqlNodeList columnList,
      SqlSelect query) {
    super(name);
    Preconditions.checkArgument(
        columnList.size() == query.selectList.size(),
        "view %s declares %s columns but selects %s", name,
        columnList.size(), query.selectList.size());
    this.columnList = columnList;
    this.query = query;
  }

  @Override public SqlKind getKind() {
    return SqlKind.CREATE_VIEW;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("CREATE VIEW");
    name.unparse(writer);
    columnList.unparse(writer);
    writer.keyword("AS");
    query.unparse(writer);
  }
}
