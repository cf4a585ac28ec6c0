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
package org.dbsuite.doccat.test;

import org.dbsuite.doccat.DocCat;
import org.dbsuite.doccat.config.DocCatConfigImpl;
import org.dbsuite.doccat.config.DocCatProperty;
import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.dialect.HsqldbSqlDialect;

import com.google.common.base.Splitter;
import com.google.common.io.Resources;

import org.apache.commons.dbcp2.BasicDataSource;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;

/**
 * In-memory Hsqldb database holding a small simulated DB2 catalog in schema
 * {@code SYSCAT}, plus helpers to run SQL against it.
 *
 * <p>Closing the fixture shuts the database down and closes its connection
 * pool.
 */
public class CatalogFixture implements AutoCloseable {
  private static final String SCRIPT = "org/dbsuite/doccat/test/syscat.sql";

  public final String url;
  public final DataSource dataSource;
  public final SqlDialect dialect = HsqldbSqlDialect.DEFAULT;

  private CatalogFixture(String url) {
    this.url = url;
    this.dataSource = DocCat.dataSource(url, "SA", "");
  }

  /** Creates a database with the simulated catalog. */
  public static CatalogFixture create() {
    final CatalogFixture fixture =
        new CatalogFixture(TempDb.INSTANCE.getUrl());
    fixture.run(script());
    return fixture;
  }

  /** Creates an empty database. */
  public static CatalogFixture empty() {
    return new CatalogFixture(TempDb.INSTANCE.getUrl());
  }

  /** Returns the configuration tests use: the defaults, with the Hsqldb
   * dialect. */
  public static DocCatConfigImpl config() {
    return DocCatConfigImpl.DEFAULT
        .set(DocCatProperty.DIALECT, "hsqldb");
  }

  public DocCat docCat() {
    return DocCat.create(dataSource, config());
  }

  private static List<String> script() {
    final String text;
    try {
      text = Resources.toString(Resources.getResource(SCRIPT),
          StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    final StringBuilder buf = new StringBuilder();
    for (String line : Splitter.on('\n').split(text)) {
      if (!line.startsWith("--")) {
        buf.append(line).append('\n');
      }
    }
    final List<String> statements = new ArrayList<>();
    for (String statement
        : Splitter.on(';').trimResults().omitEmptyStrings().split(buf)) {
      statements.add(statement);
    }
    return statements;
  }

  @Override public void close() throws SQLException {
    try {
      run("SHUTDOWN");
    } finally {
      dataSource.unwrap(BasicDataSource.class).close();
    }
  }

  /** Executes statements, in order, in one connection. */
  public void run(String... statements) {
    run(Arrays.asList(statements));
  }

  private void run(List<String> statements) {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  /** Runs a query and returns its rows, each formatted as its values
   * separated by "; ". */
  public List<String> query(String sql) {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement();
         ResultSet resultSet = statement.executeQuery(sql)) {
      final int columnCount = resultSet.getMetaData().getColumnCount();
      final List<String> rows = new ArrayList<>();
      while (resultSet.next()) {
        final StringBuilder buf = new StringBuilder();
        for (int i = 1; i <= columnCount; i++) {
          if (i > 1) {
            buf.append("; ");
          }
          buf.append(resultSet.getString(i));
        }
        rows.add(buf.toString());
      }
      return rows;
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  /** Runs a query that returns at most one value. */
  public @Nullable String queryValue(String sql) {
    final List<String> rows = query(sql);
    return rows.isEmpty() ? null : rows.get(0);
  }

  /** Allocates unique names for in-memory Hsqldb databases. */
  static class TempDb {
    public static final TempDb INSTANCE = new TempDb();

    private final AtomicInteger id = new AtomicInteger(1);

    TempDb() {}

    /** Allocates a URL for a new Hsqldb database. */
    public String getUrl() {
      return "jdbc:hsqldb:mem:doccat" + id.getAndIncrement();
    }
  }
}
