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
package org.dbsuite.doccat;

import org.dbsuite.doccat.catalog.ObjectKind;
import org.dbsuite.doccat.config.DocCatConfig;
import org.dbsuite.doccat.config.DocCatConfigImpl;
import org.dbsuite.doccat.install.DocCatInstaller;
import org.dbsuite.doccat.install.InstallSummary;
import org.dbsuite.doccat.sql.SqlDialect;
import org.dbsuite.doccat.sql.SqlDialects;
import org.dbsuite.doccat.sync.CommentExporter;
import org.dbsuite.doccat.sync.CommentImporter;
import org.dbsuite.doccat.sync.CommentStatement;
import org.dbsuite.doccat.sync.ExportSummary;
import org.dbsuite.doccat.sync.ExtendedCommentStore;
import org.dbsuite.doccat.sync.ImportSummary;
import org.dbsuite.doccat.sync.RoutineCommentCopier;

import org.apache.calcite.linq4j.Enumerable;

import org.apache.commons.dbcp2.BasicDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import javax.sql.DataSource;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Entry point: extended catalog comments over a database.
 *
 * <p>Example:
 *
 * <blockquote><pre>
 * DataSource dataSource = DocCat.dataSource(url, user, password);
 * DocCat docCat = DocCat.create(dataSource);
 * docCat.createExtendedStore();
 * docCat.install();
 * </pre></blockquote>
 */
public class DocCat {
  private static final Logger LOGGER = LoggerFactory.getLogger(DocCat.class);

  private final DataSource dataSource;
  private final DocCatConfig config;
  private final SqlDialect dialect;
  private final DocCatInstaller installer;
  private final CommentExporter exporter;
  private final CommentImporter importer;

  private DocCat(DataSource dataSource, DocCatConfig config,
      SqlDialect dialect) {
    this.dataSource = dataSource;
    this.config = config;
    this.dialect = dialect;
    this.installer = new DocCatInstaller(dataSource, dialect, config);
    this.exporter = new CommentExporter(dataSource, dialect, config);
    this.importer = new CommentImporter(dataSource, dialect, config);
  }

  /** Creates a DocCat with the configuration in
   * {@link DocCatConfigImpl#RESOURCE_NAME}, if any. */
  public static DocCat create(DataSource dataSource) {
    return create(dataSource, DocCatConfigImpl.load());
  }

  /** Creates a DocCat. If the configuration names no dialect, the dialect
   * is deduced from the database. */
  public static DocCat create(DataSource dataSource, DocCatConfig config) {
    final String dialectName = config.dialect();
    final SqlDialect dialect;
    if (dialectName != null) {
      dialect = SqlDialects.forName(dialectName);
    } else {
      try (Connection connection = dataSource.getConnection()) {
        dialect = SqlDialects.create(connection.getMetaData());
      } catch (SQLException e) {
        throw RESOURCE.metadataFailed("database product").ex(e);
      }
    }
    LOGGER.debug("Using dialect {}", dialect.getDatabaseProduct());
    return new DocCat(dataSource, config, dialect);
  }

  /** Creates a pooled data source. */
  public static DataSource dataSource(String url, String user,
      String password) {
    final BasicDataSource dataSource = new BasicDataSource();
    dataSource.setUrl(url);
    dataSource.setUsername(user);
    dataSource.setPassword(password);
    return dataSource;
  }

  public DocCatConfig getConfig() {
    return config;
  }

  public SqlDialect getDialect() {
    return dialect;
  }

  /** @see DocCatInstaller#createExtendedStore() */
  public List<String> createExtendedStore() {
    return installer.createExtendedStore();
  }

  /** @see DocCatInstaller#install() */
  public InstallSummary install() {
    return installer.install();
  }

  /** @see DocCatInstaller#uninstall() */
  public void uninstall() {
    installer.uninstall();
  }

  /** @see CommentExporter#exportStatements() */
  public Enumerable<CommentStatement> exportStatements() {
    return exporter.exportStatements();
  }

  /** @see CommentExporter#exportToNative() */
  public ExportSummary exportToNative() {
    return exporter.exportToNative();
  }

  /** @see CommentImporter#importFromNative() */
  public ImportSummary importFromNative() {
    return importer.importFromNative();
  }

  /** Returns a store for editing the extended comments of a kind. */
  public ExtendedCommentStore store(ObjectKind kind) {
    return new ExtendedCommentStore(dataSource, dialect, config, kind);
  }

  /** @see RoutineCommentCopier#copy(String, String, String) */
  public int copyRoutine(String schema, String sourceSpecificName,
      String targetSpecificName) {
    return new RoutineCommentCopier(dataSource, dialect, config)
        .copy(schema, sourceSpecificName, targetSpecificName);
  }
}
