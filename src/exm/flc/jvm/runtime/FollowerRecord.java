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
 * An iterable restricted to the part of the iteration space a leader
 * chose.
 */
public class FollowerRecord implements Iterand {
  private final Iterand iterable;
  private final RangeValue followThis;
  private final boolean fast;

  public FollowerRecord(Iterand iterable, RangeValue followThis,
                        boolean fast) {
    this.iterable = iterable;
    this.followThis = followThis;
    this.fast = fast;
  }

  public boolean isFast() {
    return fast;
  }

  @Override
  public List<Object> serial(RuntimeLibrary lib) throws LogicException {
    return iterable.follow(lib, followThis, fast);
  }

  @Override
  public List<Object> follow(RuntimeLibrary lib, RangeValue followThis,
                             boolean fast) throws LogicException {
    throw new LogicException("a follower cannot be followed");
  }

  @Override
  public boolean canFastFollow() {
    return false;
  }

  @Override
  public long size() {
    return followThis.size();
  }
}
