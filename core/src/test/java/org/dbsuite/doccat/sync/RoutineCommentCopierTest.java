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
package org.dbsuite.doccat.sync;

import org.dbsuite.doccat.DocCat;
import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.test.CatalogFixture;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests {@link RoutineCommentCopier}.
 */
class RoutineCommentCopierTest {
  @Test void testCopyRoutine() throws SQLException {
    try (CatalogFixture fixture = CatalogFixture.create()) {
      final DocCat docCat = fixture.docCat();
      docCat.createExtendedStore();
      final ExtendedCommentStore routines = docCat.store(ObjectKind.ROUTINES);
      final ExtendedCommentStore parms = docCat.store(ObjectKind.ROUTINEPARMS);
      routines.put(CommentKey.of(ObjectKind.ROUTINES, "APP", "ADD_INT"),
          "Adds two numbers");
      parms.put(
          CommentKey.of(ObjectKind.ROUTINEPARMS, "APP", "ADD_INT", "P", 1),
          "First addend");
      parms.put(
          CommentKey.of(ObjectKind.ROUTINEPARMS, "APP", "ADD_INT", "P", 2),
          "Second addend");
      parms.put(
          CommentKey.of(ObjectKind.ROUTINEPARMS, "APP", "ADD_DEC", "P", 9),
          "Replaced by the copy");

      assertThat(docCat.copyRoutine("APP", "ADD_INT", "ADD_DEC"), is(3));

      assertThat(
          routines.find(CommentKey.of(ObjectKind.ROUTINES, "APP", "ADD_DEC")),
          is("Adds two numbers"));
      assertThat(
          fixture.query("SELECT ORDINAL, REMARKS FROM DOCDATA.ROUTINEPARMS"
              + " WHERE SPECIFICNAME = 'ADD_DEC' ORDER BY ORDINAL"),
          is(ImmutableList.of("1; First addend", "2; Second addend")));
      assertThat(routines.count(), is(2));
      assertThat(parms.count(), is(4));
    }
  }
}
