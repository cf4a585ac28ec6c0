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

import org.dbsuite.doccat.catalog.CatalogColumn;
import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlJoin;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlNodeList;
import org.dbsuite.doccat.sql.SqlSelect;
import org.dbsuite.doccat.sql.SqlStdOperatorTable;
import org.dbsuite.doccat.sql.SqlTableRef;
import org.dbsuite.doccat.sql.ddl.SqlCreateView;

import com.google.common.collect.ImmutableList;

/**
 * Generates the merge view of an extended table.
 *
 * <p>The view has the native table's columns in the native order. Every
 * column passes through from the native row, except the comment column,
 * which takes the extended comment if there is one and the native comment
 * otherwise:
 *
 * <blockquote><pre>CREATE VIEW "DOCCAT"."TABLES" ("TABSCHEMA", ..., "REMARKS")
 * AS SELECT "S"."TABSCHEMA", ..., COALESCE("D"."REMARKS", "S"."REMARKS")
 * FROM "SYSCAT"."TABLES" "S"
 * LEFT JOIN "DOCDATA"."TABLES" "D"
 * ON "S"."TABSCHEMA" = "D"."TABSCHEMA" AND ...</pre></blockquote>
 */
public class MergeViews {
  /** Correlation name of the native table. */
  public static final String NATIVE_ALIAS = "S";

  /** Correlation name of the extended table. */
  public static final String EXTENDED_ALIAS = "D";

  private MergeViews() {}

  /** Creates the CREATE VIEW statement for a template. */
  public static SqlCreateView createView(MergeViewTemplate template) {
    final ImmutableList.Builder<SqlNode> selectList = ImmutableList.builder();
    for (CatalogColumn column : template.nativeColumns) {
      final SqlIdentifier nativeRef =
          SqlIdentifier.of(NATIVE_ALIAS, column.name);
      if (column.name.equals(template.commentColumn)) {
        selectList.add(
            SqlStdOperatorTable.COALESCE.createCall(
                SqlIdentifier.of(EXTENDED_ALIAS, column.name), nativeRef));
      } else {
        selectList.add(nativeRef);
      }
    }
    final SqlSelect query =
        new SqlSelect(new SqlNodeList(selectList.build()),
            new SqlJoin(new SqlTableRef(template.nativeTable(), NATIVE_ALIAS),
                SqlJoin.JoinType.LEFT,
                new SqlTableRef(template.extendedTable(), EXTENDED_ALIAS),
                joinCondition(template)),
            null, null);
    return new SqlCreateView(template.unifiedView(),
        SqlNodeList.ofNames(template.columnNames()), query);
  }

  /** Returns the condition that matches a native row to its extended row:
   * equality on every key column. */
  static SqlNode joinCondition(MergeViewTemplate template) {
    final ImmutableList.Builder<SqlNode> conditions = ImmutableList.builder();
    for (MergeViewTemplate.KeyColumn key : template.keys) {
      conditions.add(
          SqlStdOperatorTable.eq(key.nativeValue(NATIVE_ALIAS),
              SqlIdentifier.of(EXTENDED_ALIAS, key.name)));
    }
    return SqlStdOperatorTable.and(conditions.build());
  }
}
