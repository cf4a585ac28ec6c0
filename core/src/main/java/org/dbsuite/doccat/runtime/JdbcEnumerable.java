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

import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.linq4j.function.Function0;
import org.apache.calcite.linq4j.function.Function1;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Executes a SQL query and returns the result as an
 * {@link org.apache.calcite.linq4j.Enumerable}.
 *
 * <p>Each call to {@link #enumerator()} runs the query again on a fresh
 * connection, so the enumerable can be iterated any number of times. The
 * connection is released when the enumerator is closed.
 *
 * @param <T> Element type
 */
public class JdbcEnumerable<T> extends AbstractEnumerable<T> {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(JdbcEnumerable.class);

  private final DataSource dataSource;
  private final String sql;
  private final Function1<ResultSet, Function0<T>> rowBuilderFactory;

  private JdbcEnumerable(DataSource dataSource, String sql,
      Function1<ResultSet, Function0<T>> rowBuilderFactory) {
    this.dataSource = dataSource;
    this.sql = sql;
    this.rowBuilderFactory = rowBuilderFactory;
  }

  /** Executes a SQL query and returns the results as an enumerable, using a
   * row builder to convert JDBC column values into rows. */
  public static <T> JdbcEnumerable<T> of(DataSource dataSource, String sql,
      Function1<ResultSet, Function0<T>> rowBuilderFactory) {
    return new JdbcEnumerable<>(dataSource, sql, rowBuilderFactory);
  }

  @Override public Enumerator<T> enumerator() {
    Connection connection = null;
    PreparedStatement statement = null;
    try {
      connection = dataSource.getConnection();
      statement = connection.prepareStatement(sql);
      LOGGER.debug("Executing query [{}]", sql);
      final ResultSet resultSet = statement.executeQuery();
      final Enumerator<T> enumerator =
          new ResultSetEnumerator<>(sql, resultSet, rowBuilderFactory);
      statement = null;
      connection = null;
      return enumerator;
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(sql).ex(e);
    } finally {
      closeIfPossible(connection, statement);
    }
  }

  private static void closeIfPossible(@Nullable Connection connection,
      @Nullable PreparedStatement statement) {
    try {
      if (statement != null) {
        statement.close();
      }
      if (connection != null) {
        connection.close();
      }
    } catch (SQLException e) {
      LOGGER.debug("Error while releasing statement", e);
    }
  }

  /** Reads a string column of the current row of a query's result. */
  public static @Nullable String getString(String sql, ResultSet resultSet,
      int column) {
    return get(sql, () -> resultSet.getString(column));
  }

  /** Wraps a JDBC call that may throw {@link SQLException} and converts the
   * exception the way the rest of DocCat does. */
  public static <T> T get(String sql, SqlSupplier<T> supplier) {
    try {
      return supplier.get();
    } catch (SQLException e) {
      throw RESOURCE.statementFailed(sql).ex(e);
    }
  }

  /** Supplier that may throw {@link SQLException}; typically reads one
   * column of the current row.
   *
   * @param <T> Value type */
  @FunctionalInterface
  public interface SqlSupplier<T> {
    T get() throws SQLException;
  }

  /** Implementation of {@link Enumerator} that reads from a
   * {@link ResultSet}.
   *
   * @param <T> element type */
  private static class ResultSetEnumerator<T> implements Enumerator<T> {
    private final String sql;
    private final Function0<T> rowBuilder;
    private @Nullable ResultSet resultSet;

    ResultSetEnumerator(String sql, ResultSet resultSet,
        Function1<ResultSet, Function0<T>> rowBuilderFactory) {
      this.sql = sql;
      this.resultSet = resultSet;
      this.rowBuilder = rowBuilderFactory.apply(resultSet);
    }

    @Override public T current() {
      return rowBuilder.apply();
    }

    @Override public boolean moveNext() {
      final ResultSet resultSet = this.resultSet;
      if (resultSet == null) {
        return false;
      }
      try {
        if (resultSet.next()) {
          return true;
        }
      } catch (SQLException e) {
        close();
        throw RESOURCE.statementFailed(sql).ex(e);
      }
      close();
      return false;
    }

    @Override public void reset() {
      throw new UnsupportedOperationException();
    }

    @Override public void close() {
      final ResultSet savedResultSet = resultSet;
      if (savedResultSet == null) {
        return;
      }
      resultSet = null;
      try {
        final Statement statement = savedResultSet.getStatement();
        savedResultSet.close();
        if (statement != null) {
          final Connection connection = statement.getConnection();
          statement.close();
          if (connection != null) {
            connection.close();
          }
        }
      } catch (SQLException e) {
        LOGGER.debug("Error while closing result set", e);
      }
    }
  }
}
