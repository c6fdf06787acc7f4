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

import java.util.List;

/**
 * A value a loop can iterate over.
 */
public interface Iterand {

  /**
   * @return the values of a serial loop, in order
   */
  public List<Object> serial(RuntimeLibrary lib) throws LogicException;

  /**
   * @param followThis part of the iteration space chosen by a leader,
   *                   relative to the start, counting from 0
   * @param fast if true, the caller checked that the fast path applies
   */
  public List<Object> follow(RuntimeLibrary lib, RangeValue followThis,
                             boolean fast) throws LogicException;

  /**
   * @return true if this kind of value supports fast following
   */
  public boolean canFastFollow();

  /**
   * @return number of values, or -1 if not known without iterating
   */
  public long size();
}
