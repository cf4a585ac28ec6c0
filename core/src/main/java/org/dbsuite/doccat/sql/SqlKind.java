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
package org.dbsuite.doccat.sql;

/**
 * Enumerates the possible types of {@link SqlNode}.
 */
public enum SqlKind {
  IDENTIFIER,
  LITERAL,
  DYNAMIC_PARAM,
  NODE_LIST,
  TABLE_REF,
  JOIN,
  OTHER_FUNCTION,

  // operators
  EQUALS,
  NOT_EQUALS,
  GREATER_THAN_OR_EQUAL,
  AND,
  OR,
  NOT,
  IS_NULL,
  IS_NOT_NULL,
  IN,
  EXISTS,

  // statements
  SELECT,
  INSERT,
  UPDATE,
  DELETE,
  IF,

  // DDL
  CREATE_SCHEMA,
  CREATE_TABLE,
  COLUMN_DECL,
  CREATE_VIEW,
  CREATE_TRIGGER,
  CREATE_ALIAS,
  DROP_OBJECT,
  COMMENT;

  /** Returns whether this is a statement that ends with a semicolon inside
   * a compound statement. */
  public boolean isStatement() {
    switch (this) {
    case SELECT:
    case INSERT:
    case UPDATE:
    case DELETE:
    case IF:
      return true;
    default:
      return false;
    }
  }
}
