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
 * Parse tree for {@code COMMENT ON target name IS 'text'} statement.
 *
 * <p>The target is a keyword sequence such as "TABLE", "COLUMN" or
 * "SPECIFIC PROCEDURE". The text is written as a string literal, so single
 * quotes in it are doubled.
 */
public class SqlCommentOn extends SqlDdl {
  public final String target;
  public final String text;

  public SqlCommentOn(String target, SqlIdentifier name, String text) {
    super(name);
    this.target = target;
    this.text = text;
  }

  @Override public SqlKind getKind() {
    return SqlKind.COMMENT;
  }

  @Override public void unparse(SqlWriter writer) {
    writer.keyword("COMMENT ON");
    writer.keyword(target);
    name.unparse(writer);
    writer.keyword("IS");
    writer.literal(text);
  }
}
