/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.flc.common.exceptions;

import exm.flc.ast.FilePosition;

/**
 * Error in the user program, reported with the position of the construct
 * being compiled.
 */
public class UserException
extends Exception
{
  private final FilePosition pos;

  public UserException(FilePosition pos, String message)
  {
    super(pos == null ? message : pos.toString() + ": " + message);
    this.pos = pos;
  }

  public UserException(String message) {
    this(null, message);
  }

  /**
   * @return position of the error, may be null
   */
  public FilePosition getPosition() {
    return pos;
  }

  private static final long serialVersionUID = 1L;
}
