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
import org.dbsuite.doccat.sql.SqlWriter;

/**
 * Parse tree for {@code DROP ALIAS}, {@code DROP TABLE},
 * {@code DROP VIEW}, {@code DROP TRIGGER}, {@code DROP SCHEMA} and
 * {@code DROP SPECIFIC PROCEDURE} statements.
 */
public class SqlDropObject extends SqlDdl {
  public final ObjectType objectType;
  public final boolean restrict;

  public SqlDropObject(ObjectType objectType, SqlIdentifier name,
      boolean restrict) {
    super(name);
    this.objectType = objectType;
    this.restrict = restrict;
  }

  @Override public SqlKind getKind() {
    return SqlKind.DROP_OBJECT;
  }

  @Override public void unparse(SqlWriter writer) {
    if (objectType == ObjectType.ALIAS) {
      writer.getDialect().unparseDropAlias(writer, this);
      return;
    }
    writer.keyword("DROP");
    writer.keyword(objectType.keyword);
    name.unparse(writer);
    if (restrict) {
      writer.keyword("RESTRICT");
    }
  }

  /** Type of object that a drop statement removes. */
  public enum ObjectType {
    ALIAS("ALIAS"),
    TRIGGER("TRIGGER"),
    VIEW("VIEW"),
    SPECIFIC_PROCEDURE("SPECIFIC PROCEDURE"),
    TABLE("TABLE"),
    SCHEMA("SCHEMA");

    public final String keyword;

    ObjectType(String keyword) {
      this.keyword = keyword;
    }
  }
}
