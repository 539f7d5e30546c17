/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.metaprob.parse;

import net.hydromatic.metaprob.ast.Pos;
import net.hydromatic.metaprob.util.MetaprobException;

/** Exception caused by malformed surface text. */
public class SurfaceParseException extends RuntimeException
    implements MetaprobException {
  private final Pos pos;

  public SurfaceParseException(String message, Pos pos) {
    super(message);
    this.pos = pos;
  }

  SurfaceParseException(String message, Pos pos, Throwable cause) {
    super(message, cause);
    this.pos = pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End SurfaceParseException.java
