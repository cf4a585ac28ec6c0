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

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

/**
 * A <code>SqlNodeList</code> is a list of {@link SqlNode}s, written in
 * parentheses and separated by commas.
 */
public class SqlNodeList extends SqlNode implements Iterable<SqlNode> {
  public static final SqlNodeList EMPTY = new SqlNodeList(ImmutableList.of());

  private final ImmutableList<SqlNode> list;

  public SqlNodeList(List<? extends SqlNode> list) {
    this.list = ImmutableList.copyOf(list);
  }

  /** Creates a list of simple identifiers. */
  public static SqlNodeList ofNames(List<String> names) {
    final ImmutableList.Builder<SqlNode> b = ImmutableList.builder();
    for (String name : names) {
      b.add(SqlIdentifier.of(name));
    }
    return new SqlNodeList(b.build());
  }

  public List<SqlNode> getList() {
    return list;
  }

  public int size() {
    return list.size();
  }

  public boolean isEmpty() {
    return list.isEmpty();
  }

  @Override public Iterator<SqlNode> iterator() {
    return list.iterator();
  }

  @Override public SqlKind getKind() {
    return SqlKind.NODE_LIST;
  }

  @Override public void unparse(SqlWriter writer) {
    final SqlWriter.Frame frame = writer.startList("(", ")");
    commaList(writer);
    writer.endList(frame);
  }

  /** Writes the elements separated by commas, without parentheses. */
  public void commaList(SqlWriter writer) {
    int i = 0;
    for (SqlNode node : list) {
      if (i++ > 0) {
        writer.sep(",");
      }
      node.unparse(writer);
    }
  }
}
