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

import static org.dbsuite.doccat.runtime.Resources.BaseMessage;
import static org.dbsuite.doccat.runtime.Resources.ExInst;
import static org.dbsuite.doccat.runtime.Resources.ExInstWithCause;
import static org.dbsuite.doccat.runtime.Resources.Inst;

/**
 * Compiler-checked resources for DocCat.
 */
public interface DocCatResource {
  @BaseMessage("Table ''{0}''.''{1}'' not found")
  ExInst<MetadataNotFoundException> tableNotFound(String a0, String a1);

  @BaseMessage("Column ''{0}'' not found in table ''{1}''.''{2}''")
  ExInst<MetadataNotFoundException> columnNotFound(String a0, String a1,
      String a2);

  @BaseMessage("Key column ''{0}'' of ''{1}''.''{2}'' has no counterpart in ''{3}''.''{2}''")
  ExInst<MetadataNotFoundException> keyColumnNotInNative(String a0,
      String a1, String a2, String a3);

  @BaseMessage("Table ''{0}''.''{1}'' declares no key columns")
  ExInst<KeyShapeViolationException> noKeyColumns(String a0, String a1);

  @BaseMessage("Key of {0} has columns {1} but {2,number,#} values were given")
  ExInst<KeyShapeViolationException> keyArity(String a0, String a1, int a2);

  @BaseMessage("Object kind {0} has no native comment target")
  ExInst<DocCatException> notExportable(String a0);

  @BaseMessage("Cannot drop schema ''{0}'': {1}")
  ExInstWithCause<TeardownBlockedException> teardownBlocked(String a0,
      String a1);

  @BaseMessage("Import of {0} failed; kinds already committed: {1}")
  Inst importIncomplete(String a0, String a1);

  @BaseMessage("While executing SQL [{0}]")
  ExInstWithCause<DocCatException> statementFailed(String a0);

  @BaseMessage("While reading catalog metadata of ''{0}''")
  ExInstWithCause<DocCatException> metadataFailed(String a0);

  @BaseMessage("No dialect for database product ''{0}''")
  ExInst<DocCatException> unknownDialect(String a0);

  @BaseMessage("Cannot read configuration resource ''{0}''")
  ExInstWithCause<DocCatException> configUnreadable(String a0);

  @BaseMessage("Comment on {0} truncated from {1,number,#} characters")
  Inst commentTruncated(String a0, int a1);
}
