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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/** JDBC utilities shared by the synchronization classes. Failures are
 * reported as {@link org.dbsuite.doccat.runtime.DocCatException} with the
 * SQL in the message. */
final class JdbcSupport {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(JdbcSupport.class);

  private JdbcSupport() {}

  /** Executes a statement with dynamic parameters and returns the update
   * count. */
  static int update(Connection connection, String sql,
      List<? extends @Nullable Object> parameters) {
    LOGGER.debug("Executing [{}] with {}", sql, parameters);
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      bind(statement, parameters);
      return statement.executeUpdate();
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(sql).ex(e);
    }
  }

  /** Binds values to the dynamic parameters of a statement. Nulls are
   * bound as character nulls; the only nullable values are comments and
   * names. */
  static void bind(PreparedStatement statement,
      List<? extends @Nullable Object> parameters) throws SQLException {
    for (int i = 0; i < parameters.size(); i++) {
      final Object value = parameters.get(i);
      if (value == null) {
        statement.setNull(i + 1, Types.VARCHAR);
      } else {
        statement.setObject(i + 1, value);
      }
    }
  }

  /** Rolls back a transaction after a failure. A failure to roll back is
   * attached to the original one. */
  static void rollback(Connection connection, Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
