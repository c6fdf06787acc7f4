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
 * Raised after continuable errors were reported for a construct that
 * cannot be lowered further.  The messages have already been recorded,
 * so this exception only carries the first one.
 */
public class CompilationStoppedException extends UserException
{
  private final int errorCount;

  public CompilationStoppedException(FilePosition pos, String firstError,
                                     int errorCount)
  {
    super(pos, errorCount + " error(s), first: " + firstError);
    this.errorCount = errorCount;
  }

  public int getErrorCount() {
    return errorCount;
  }

  private static final long serialVersionUID = 1L;
}
