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

import org.dbsuite.doccat.sql.SqlDelete;
import org.dbsuite.doccat.sql.SqlIdentifier;
import org.dbsuite.doccat.sql.SqlIf;
import org.dbsuite.doccat.sql.SqlInsert;
import org.dbsuite.doccat.sql.SqlLiteral;
import org.dbsuite.doccat.sql.SqlNode;
import org.dbsuite.doccat.sql.SqlNodeList;
import org.dbsuite.doccat.sql.SqlSelect;
import org.dbsuite.doccat.sql.SqlStdOperatorTable;
import org.dbsuite.doccat.sql.SqlTableRef;
import org.dbsuite.doccat.sql.SqlUpdate;
import org.dbsuite.doccat.sql.ddl.SqlCreateTrigger;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Generates the instead-of-update trigger that makes the comment column of a
 * merge view writable.
 *
 * <p>The trigger body is built from {@link TriggerAction}: for each
 * combination of "extended row exists" and "new comment is null" it emits
 * the statements of the action in that cell, so the trigger and
 * {@link org.dbsuite.doccat.sync.ExtendedCommentStore#apply} follow the same
 * table. Updates to columns other than the comment are ignored.
 */
public class SyncTriggers {
  /** Correlation name of the row before the update. */
  public static final String OLD_ALIAS = "O";

  /** Correlation name of the row after the update. */
  public static final String NEW_ALIAS = "N";

  private SyncTriggers() {}

  /** Creates the CREATE TRIGGER statement for a template. */
  public static SqlCreateTrigger createTrigger(MergeViewTemplate template) {
    final SqlNode rowExists =
        SqlStdOperatorTable.EXISTS.createCall(existsQuery(template));
    final List<SqlNode> body =
        SqlIf.of(rowExists,
            branch(template, true),
            branch(template, false));
    return new SqlCreateTrigger(template.trigger(), "INSTEAD OF UPDATE",
        template.unifiedView(), OLD_ALIAS, NEW_ALIAS, body);
  }

  /** Returns the statements to run when the extended row does, or does not,
   * exist. */
  private static List<SqlNode> branch(MergeViewTemplate template,
      boolean rowExists) {
    final SqlNode newComment =
        SqlIdentifier.of(NEW_ALIAS, template.commentColumn);
    return SqlIf.of(SqlStdOperatorTable.IS_NULL.createCall(newComment),
        statements(template, TriggerAction.of(rowExists, true)),
        statements(template, TriggerAction.of(rowExists, false)));
  }

  /** Returns the statements that perform an action. */
  static List<SqlNode> statements(MergeViewTemplate template,
      TriggerAction action) {
    final SqlNode newComment =
        SqlIdentifier.of(NEW_ALIAS, template.commentColumn);
    switch (action) {
    case NOOP:
      return ImmutableList.of();
    case INSERT:
      final ImmutableList.Builder<String> columns = ImmutableList.builder();
      final ImmutableList.Builder<SqlNode> values = ImmutableList.builder();
      for (MergeViewTemplate.KeyColumn key : template.keys) {
        columns.add(key.name);
        values.add(key.nativeValue(OLD_ALIAS));
      }
      for (String carried : template.carriedColumns) {
        columns.add(carried);
        values.add(SqlIdentifier.of(OLD_ALIAS, carried));
      }
      columns.add(template.commentColumn);
      values.add(newComment);
      return ImmutableList.of(
          new SqlInsert(template.extendedTable(),
              SqlNodeList.ofNames(columns.build()),
              new SqlNodeList(values.build())));
    case DELETE:
      return ImmutableList.of(
          new SqlDelete(template.extendedTable(), keyMatch(template, null)));
    case UPDATE:
      return ImmutableList.of(
          new SqlUpdate(template.extendedTable(),
              SqlNodeList.ofNames(ImmutableList.of(template.commentColumn)),
              new SqlNodeList(ImmutableList.of(newComment)),
              keyMatch(template, null)));
    default:
      throw new AssertionError(action);
    }
  }

  /** Returns {@code SELECT 1 FROM extended "D" WHERE "D".key = old key}. */
  private static SqlSelect existsQuery(MergeViewTemplate template) {
    return new SqlSelect(
        new SqlNodeList(ImmutableList.of(SqlLiteral.createExactNumeric(1))),
        new SqlTableRef(template.extendedTable(), MergeViews.EXTENDED_ALIAS),
        keyMatch(template, MergeViews.EXTENDED_ALIAS), null);
  }

  /** Returns a condition that matches the extended row of the old row.
   * Extended columns are qualified by {@code alias}, if not null. */
  private static SqlNode keyMatch(MergeViewTemplate template,
      @Nullable String alias) {
    final ImmutableList.Builder<SqlNode> conditions = ImmutableList.builder();
    for (MergeViewTemplate.KeyColumn key : template.keys) {
      final SqlIdentifier extendedRef = alias == null
          ? SqlIdentifier.of(key.name)
          : SqlIdentifier.of(alias, key.name);
      conditions.add(
          SqlStdOperatorTable.eq(extendedRef, key.nativeValue(OLD_ALIAS)));
    }
    return SqlStdOperatorTable.and(conditions.build());
  }
}
