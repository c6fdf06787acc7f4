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

package exm.flc.ast;

/**
 * Source position of a tree node, for diagnostics and logging.
 */
public class FilePosition {
  public final String file;
  public final int line;

  public FilePosition(String file, int line) {
    this.file = file;
    this.line = line;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FilePosition)) {
      return false;
    }
    FilePosition other = (FilePosition)o;
    return other.line == line &&
           (file == null ? other.file == null : file.equals(other.file));
  }

  @Override
  public int hashCode() {
    return (file == null ? 0 : file.hashCode()) * 31 + line;
  }

  @Override
  public String toString() {
    return file + ":" + line;
  }
}
