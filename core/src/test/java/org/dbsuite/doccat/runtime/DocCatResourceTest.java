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
package org.dbsuite.doccat.runtime;

import org.dbsuite.doccat.catalog.ObjectKind;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.dbsuite.doccat.util.Static.RESOURCE;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests {@link DocCatResource} and the {@link Resources} machinery behind
 * it.
 */
class DocCatResourceTest {
  /** Checks that every message is in the resource bundle, that its
   * parameters match the method's, and that each exception can be
   * created. */
  @Test void testValidate() {
    Resources.validate(RESOURCE);
  }

  @Test void testMessages() {
    assertThat(RESOURCE.tableNotFound("SYSCAT", "TABLES").str(),
        is("Table 'SYSCAT'.'TABLES' not found"));
    assertThat(RESOURCE.commentTruncated("\"APP\".\"T1\"", 1200).str(),
        is("Comment on \"APP\".\"T1\" truncated from 1200 characters"));
  }

  @Test void testExceptionTypes() {
    assertThat(RESOURCE.noKeyColumns("DOCDATA", "T").ex(),
        instanceOf(KeyShapeViolationException.class));
    assertThat(RESOURCE.columnNotFound("C", "S", "T").ex(),
        instanceOf(MetadataNotFoundException.class));
    final SQLException cause = new SQLException("schema not empty");
    final TeardownBlockedException e =
        RESOURCE.teardownBlocked("DOCDATA", cause.getMessage()).ex(cause);
    assertThat(e.getMessage(),
        is("Cannot drop schema 'DOCDATA': schema not empty"));
    assertThat(e.getCause(), sameInstance(cause));
  }

  @Test void testImportIncomplete() {
    final RuntimeException cause = new RuntimeException("boom");
    final ImportIncompleteException e =
        new ImportIncompleteException(
            RESOURCE.importIncomplete("TABLES", "[COLUMNS]").str(), cause,
            ObjectKind.TABLES, ImmutableList.of(ObjectKind.COLUMNS));
    assertThat(e.getMessage(),
        is("Import of TABLES failed; kinds already committed: [COLUMNS]"));
    assertThat(e.failedKind(), is(ObjectKind.TABLES));
    assertThat(e.committedKinds(), is(ImmutableList.of(ObjectKind.COLUMNS)));
  }
}
