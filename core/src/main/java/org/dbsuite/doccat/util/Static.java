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
package org.dbsuite.doccat.util;

import org.dbsuite.doccat.runtime.DocCatResource;
import org.dbsuite.doccat.runtime.Resources;

/**
 * Definitions of objects to be statically imported.
 *
 * <p>Please give careful consideration before including an object in this
 * class; static imports pollute the namespace of every class that uses
 * them.
 */
public abstract class Static {
  private Static() {}

  /** Resources. */
  public static final DocCatResource RESOURCE =
      Resources.create(DocCatResource.class);
}
