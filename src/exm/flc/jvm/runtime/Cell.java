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
package exm.flc.jvm.runtime;

/**
 * Storage for one variable.  Several frames may share a cell: a ref
 * intent aliases the outer variable's cell.
 */
public class Cell {
  private volatile Object value;

  public Cell() {
    this(null);
  }

  public Cell(Object value) {
    this.value = value;
  }

  public Object get() {
    return value;
  }

  public void set(Object value) {
    this.value = value;
  }

  /**
   * Atomic integer increment; an unset cell counts as zero
   */
  public synchronized void add(Object delta) throws LogicException {
    long current = value == null ? 0 : asLong(value);
    value = current + asLong(delta);
  }

  static long asLong(Object v) throws LogicException {
    if (!(v instanceof Long)) {
      throw new LogicException("expected an integer, got " + v);
    }
    return (Long)v;
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
