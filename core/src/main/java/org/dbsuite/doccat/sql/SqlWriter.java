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

import java.util.List;

/**
 * A <code>SqlWriter</code> is the target to construct a SQL statement from a
 * parse tree. It deals with dialect differences; for example, Oracle and DB2
 * quote identifiers differently from MySQL.
 *
 * <p>The writer inserts whitespace between tokens as needed. Callers only
 * emit tokens.
 */
public interface SqlWriter {
  /** Returns the dialect of SQL. */
  SqlDialect getDialect();

  /**
   * Prints a sequence of keywords. Must not start or end with space, but may
   * contain a space. For example, <code>keyword("INSTEAD OF")</code>.
   */
  void keyword(String s);

  /** Prints a string, preceded by whitespace if necessary. Used for
   * operators and numbers. */
  void print(String s);

  /** Prints an identifier, quoting each part the way the dialect does. */
  void identifier(List<String> names);

  /** Prints a character literal, quoted the way the dialect does. */
  void literal(String value);

  /** Prints a separator, such as "," or ";", directly after the previous
   * token. */
  void sep(String sep);

  /** Starts a list enclosed in {@code open} and {@code close}. */
  Frame startList(String open, String close);

  /** Starts the argument list of a function call. */
  Frame startFunCall(String funName);

  /** Ends a list started by {@link #startList} or {@link #startFunCall}. */
  void endList(Frame frame);

  /** Returns the SQL written so far. */
  String toSqlString();

  /** A part of a statement that is enclosed in brackets, such as a column
   * list or the argument list of a function. */
  interface Frame {
    /** Returns the string that closes this frame. */
    String close();
  }
}
