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

import org.dbsuite.doccat.runtime.DocCatException;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests {@link ObjectKind}.
 */
class ObjectKindTest {
  @Test void testExportOrder() {
    assertThat(ObjectKind.EXPORT_ORDER,
        is(
            ImmutableList.of(ObjectKind.TABLESPACES, ObjectKind.SCHEMATA,
                ObjectKind.TABLES, ObjectKind.COLUMNS, ObjectKind.TABCONST,
                ObjectKind.INDEXES, ObjectKind.TRIGGERS, ObjectKind.ROUTINES,
                ObjectKind.DATATYPES)));
  }

  @Test void testRoutineParmsAreNotExportable() {
    assertThat(ObjectKind.ROUTINEPARMS.isExportable(), is(false));
    final DocCatException e =
        assertThrows(DocCatException.class,
            () -> ObjectKind.ROUTINEPARMS.commentTarget(null));
    assertThat(e.getMessage(),
        is("Object kind ROUTINEPARMS has no native comment target"));
  }

  @Test void testRoutineCommentTarget() {
    assertThat(ObjectKind.ROUTINES.commentTarget("P"),
        is("SPECIFIC PROCEDURE"));
    assertThat(ObjectKind.ROUTINES.commentTarget("F"),
        is("SPECIFIC FUNCTION"));
    assertThat(ObjectKind.COLUMNS.commentTarget(null), is("COLUMN"));
  }

  @Test void testKeyColumns() {
    assertThat(ObjectKind.ROUTINEPARMS.keyColumns,
        is(
            ImmutableList.of("ROUTINESCHEMA", "SPECIFICNAME", "ROWTYPE",
                "ORDINAL")));
    assertThat(ObjectKind.TABLESPACES.keyColumns,
        is(ImmutableList.of("TBSPACE")));
  }

  @Test void testOf() {
    assertThat(ObjectKind.of("columns"), is(ObjectKind.COLUMNS));
    assertThat(ObjectKind.of("BUFFERPOOLS"), nullValue());
  }

  @Test void testDefaultName() {
    assertThat(ObjectKind.ROUTINEPARMS.defaultNameColumn(), is("PARMNAME"));
    assertThat(ObjectKind.ROUTINEPARMS.defaultName(3), is("P3"));
    assertThat(ObjectKind.TABLES.defaultNameColumn(), nullValue());
  }
}
