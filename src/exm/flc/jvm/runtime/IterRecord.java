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

import exm.flc.ast.FnSymbol;

/**
 * Result of calling an iterator: the iterator and its arguments, not yet
 * run.
 */
public class IterRecord implements Iterand {
  private final FnSymbol iterator;
  private final List<Object> args;

  public IterRecord(FnSymbol iterator, List<Object> args) {
    this.iterator = iterator;
    this.args = Collections.unmodifiableList(new ArrayList<Object>(args));
  }

  public FnSymbol getIterator() {
    return iterator;
  }

  public List<Object> getArgs() {
    return args;
  }

  /**
   * All values in one sequence, whatever the flavor of the iterator
   */
  @Override
  public List<Object> serial(RuntimeLibrary lib) throws LogicException {
    List<Object> result = new ArrayList<Object>();
    for (List<Object> group: lib.iterator(iterator).iterate(args, 1)) {
      result.addAll(group);
    }
    return result;
  }

  @Override
  public List<Object> follow(RuntimeLibrary lib, RangeValue followThis,
                             boolean fast) throws LogicException {
    List<Object> followArgs = new ArrayList<Object>(args);
    followArgs.add(followThis);
    followArgs.add(fast);
    List<Object> result = new ArrayList<Object>();
    for (List<Object> group:
         lib.follower(iterator).iterate(followArgs, 1)) {
      result.addAll(group);
    }
    lib.noteFollow(fast);
    return result;
  }

  @Override
  public boolean canFastFollow() {
    return false;
  }

  @Override
  public long size() {
    return -1;
  }

  @Override
  public String toString() {
    return iterator.getName() + args;
  }
}
