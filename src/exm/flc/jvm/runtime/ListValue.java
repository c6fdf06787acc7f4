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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable list.  Only has a serial iterator.
 */
public class ListValue implements Iterand {
  private final List<Object> elems;

  public ListValue(List<Object> elems) {
    this.elems = Collections.unmodifiableList(new ArrayList<Object>(elems));
  }

  @Override
  public List<Object> serial(RuntimeLibrary lib) {
    return elems;
  }

  @Override
  public List<Object> follow(RuntimeLibrary lib, RangeValue followThis,
                             boolean fast) throws LogicException {
    throw new LogicException("a list cannot be iterated in parallel");
  }

  @Override
  public boolean canFastFollow() {
    return false;
  }

  @Override
  public long size() {
    return elems.size();
  }

  @Override
  public String toString() {
    return "[" + StringUtils.join(elems, ", ") + "]";
  }
}
