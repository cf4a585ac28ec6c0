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

import org.dbsuite.doccat.sql.dialect.Db2SqlDialect;
import org.dbsuite.doccat.sql.dialect.HsqldbSqlDialect;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

import static org.dbsuite.doccat.util.Static.RESOURCE;

/**
 * Creates a {@link SqlDialect} from a product name or from a database's
 * metadata.
 */
public class SqlDialects {
  private SqlDialects() {}

  /** Returns the dialect for a database product. */
  public static SqlDialect of(SqlDialect.DatabaseProduct product) {
    switch (product) {
    case DB2:
      return Db2SqlDialect.DEFAULT;
    case HSQLDB:
      return HsqldbSqlDialect.DEFAULT;
    default:
      throw RESOURCE.unknownDialect(product.getProductName()).ex();
    }
  }

  /** Returns the dialect with a given name, such as "DB2" or "hsqldb". */
  public static SqlDialect forName(String name) {
    final SqlDialect.DatabaseProduct product;
    try {
      product = SqlDialect.DatabaseProduct.valueOf(
          name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw RESOURCE.unknownDialect(name).ex(e);
    }
    return of(product);
  }

  /** Deduces the dialect from a database's metadata. */
  public static SqlDialect create(DatabaseMetaData metaData)
      throws SQLException {
    final String productName = metaData.getDatabaseProductName();
    final SqlDialect.DatabaseProduct product =
        SqlDialect.getProduct(productName);
    if (product == SqlDialect.DatabaseProduct.UNKNOWN) {
      throw RESOURCE.unknownDialect(productName).ex();
    }
    return of(product);
  }
}
