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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all exceptions originating from DocCat.
 *
 * <p>Instances are usually created through
 * {@link org.dbsuite.doccat.util.Static#RESOURCE}, so that each message is
 * declared once in {@link DocCatResource}.
 */
public class DocCatException extends RuntimeException {
  private static final long serialVersionUID = 4308571736409821519L;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(DocCatException.class);

  /**
   * Creates a DocCatException.
   *
   * @param message error message
   * @param cause   underlying cause
   */
  public DocCatException(String message, @Nullable Throwable cause) {
    super(message, cause);
    LOGGER.trace("DocCatException", this);
  }
}
