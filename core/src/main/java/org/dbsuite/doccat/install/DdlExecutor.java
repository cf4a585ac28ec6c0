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
package org.dbsuite.doccat.install;

import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.SqlNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Renders statement trees in a dialect and executes them, one statement per
 * call, each in its own auto-committed connection.
 */
public class DdlExecutor {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DdlExecutor.class);

  private final DataSource dataSource;
  private final SqlDialect dialect;

  public DdlExecutor(DataSource dataSource, SqlDialect dialect) {
    this.dataSource = dataSource;
    this.dialect = dialect;
  }

  public SqlDialect getDialect() {
    return dialect;
  }

  /** Executes a statement.
   *
   * @throws org.dbsuite.doccat.runtime.DocCatException with the SQL in its
   *     message if the database rejects it */
  public void execute(SqlNode node) {
    final String sql = node.toSqlString(dialect);
    try {
      executeSql(sql);
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(sql).ex(e);
    }
  }

  /** Executes SQL text; the database error is not wrapped. */
  protected void executeSql(String sql) throws SQLException {
    LOGGER.debug("Executing [{}]", sql);
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement()) {
      statement.execute(sql);
    }
  }
}
