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

import org.dbsuite.doccat.sql.ddl.SqlCreateAlias;
import org.dbsuite.doccat.sql.ddl.SqlDropObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * <code>SqlDialect</code> encapsulates the differences between dialects of
 * SQL.
 *
 * <p>It is used by {@link SqlWriter} to quote identifiers and literals, and
 * by DDL nodes whose syntax differs between databases. Sub-classes hold a
 * public static final member {@code DEFAULT}.
 */
public class SqlDialect {
  protected static final Logger LOGGER =
      LoggerFactory.getLogger(SqlDialect.class);

  private final DatabaseProduct databaseProduct;
  private final String identifierQuoteString;
  private final String identifierEndQuoteString;
  private final String identifierEscapedQuote;

  /**
   * Creates a SqlDialect.
   *
   * @param databaseProduct       Database product
   * @param identifierQuoteString String to quote identifiers, usually a
   *                              double quote
   */
  protected SqlDialect(DatabaseProduct databaseProduct,
      String identifierQuoteString) {
    this.databaseProduct = databaseProduct;
    this.identifierQuoteString = identifierQuoteString;
    this.identifierEndQuoteString = identifierQuoteString;
    this.identifierEscapedQuote =
        identifierEndQuoteString + identifierEndQuoteString;
  }

  /**
   * Converts a product name (as returned by
   * {@link java.sql.DatabaseMetaData#getDatabaseProductName()}) into a
   * {@link DatabaseProduct}.
   *
   * @param productName Product name
   * @return database product, or {@link DatabaseProduct#UNKNOWN}
   */
  public static DatabaseProduct getProduct(String productName) {
    final String upperProductName =
        productName.toUpperCase(Locale.ROOT).trim();
    if (upperProductName.startsWith("DB2")) {
      return DatabaseProduct.DB2;
    } else if (upperProductName.contains("HSQL")) {
      return DatabaseProduct.HSQLDB;
    } else {
      return DatabaseProduct.UNKNOWN;
    }
  }

  public DatabaseProduct getDatabaseProduct() {
    return databaseProduct;
  }

  /**
   * Encloses an identifier in quotation marks appropriate for the current SQL
   * dialect.
   *
   * <p>For example, <code>quoteIdentifier("emp")</code> yields a string
   * containing <code>"emp"</code>.
   *
   * @param val Identifier to quote
   * @return Quoted identifier
   */
  public String quoteIdentifier(String val) {
    return quoteIdentifier(new StringBuilder(), val).toString();
  }

  /**
   * Encloses an identifier in quotation marks and appends it to a buffer.
   * Quote characters inside the identifier are doubled.
   *
   * @param buf Buffer
   * @param val Identifier to quote
   * @return The buffer
   */
  public StringBuilder quoteIdentifier(StringBuilder buf, String val) {
    buf.append(identifierQuoteString);
    buf.append(val.replace(identifierEndQuoteString, identifierEscapedQuote));
    buf.append(identifierEndQuoteString);
    return buf;
  }

  /**
   * Quotes a multi-part identifier.
   *
   * @param buf         Buffer
   * @param identifiers List of parts of the identifier to quote
   * @return The buffer
   */
  public StringBuilder quoteIdentifier(StringBuilder buf,
      List<String> identifiers) {
    int i = 0;
    for (String identifier : identifiers) {
      if (i++ > 0) {
        buf.append('.');
      }
      quoteIdentifier(buf, identifier);
    }
    return buf;
  }

  /** Converts a string into a string literal, doubling any single quotes
   * it contains.
   *
   * <p>For example, {@code "can't run"} becomes {@code "'can''t run'"}. */
  public final String quoteStringLiteral(String val) {
    final StringBuilder buf = new StringBuilder();
    quoteStringLiteral(buf, val);
    return buf.toString();
  }

  /** Appends a string literal to a buffer. */
  public void quoteStringLiteral(StringBuilder buf, String val) {
    buf.append('\'');
    buf.append(val.replace("'", "''"));
    buf.append('\'');
  }

  /** Returns the JDBC table type under which aliases created by
   * {@link #unparseCreateAlias} are listed. */
  public String aliasTableType() {
    return "ALIAS";
  }

  /** Returns the type of a column that holds extended comments. */
  public String longTextType() {
    return "CLOB(32K)";
  }

  /** Returns a query, with one dynamic parameter for the schema name, that
   * lists the names of the triggers in a schema. */
  public String triggerListQuery() {
    throw new UnsupportedOperationException("triggerListQuery in "
        + databaseProduct);
  }

  /** Returns the keywords that introduce the old transition variable of a
   * row trigger, for example "OLD AS". */
  public String oldRowKeyword() {
    return "OLD AS";
  }

  /** Returns the keywords that introduce the new transition variable of a
   * row trigger, for example "NEW AS". */
  public String newRowKeyword() {
    return "NEW AS";
  }

  /** Writes a statement that makes {@code alias} a synonym for its target
   * table. */
  public void unparseCreateAlias(SqlWriter writer, SqlCreateAlias alias) {
    writer.keyword("CREATE ALIAS");
    alias.name.unparse(writer);
    writer.keyword("FOR");
    alias.target.unparse(writer);
  }

  /** Writes a statement that drops an alias. */
  public void unparseDropAlias(SqlWriter writer, SqlDropObject drop) {
    writer.keyword("DROP ALIAS");
    drop.name.unparse(writer);
  }

  @Override public String toString() {
    return getClass().getSimpleName();
  }

  /** Database products that DocCat knows how to detect. Only those with a
   * dialect sub-class can be installed into. */
  public enum DatabaseProduct {
    DB2("IBM DB2"),
    HSQLDB("HSQLDB"),
    UNKNOWN("Unknown");

    private final String productName;

    DatabaseProduct(String productName) {
      this.productName = productName;
    }

    public String getProductName() {
      return productName;
    }
  }
}
