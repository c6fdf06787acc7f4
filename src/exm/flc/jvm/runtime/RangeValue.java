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

/**
 * Bounded integer range lo..hi, empty if hi < lo.  Ranges starting at 0
 * also describe the work a leader hands to its followers.
 */
public class RangeValue implements Iterand {
  private final long lo;
  private final long hi;

  public RangeValue(long lo, long hi) {
    this.lo = lo;
    this.hi = hi;
  }

  public long lo() {
    return lo;
  }

  public long hi() {
    return hi;
  }

  @Override
  public long size() {
    return hi < lo ? 0 : hi - lo + 1;
  }

  @Override
  public List<Object> serial(RuntimeLibrary lib) {
    return values(lo, hi);
  }

  /**
   * Split into at most numTasks contiguous pieces of nearly equal size
   * @param relative if true, pieces are given relative to lo
   */
  public List<RangeValue> split(int numTasks, boolean relative) {
    List<RangeValue> result = new ArrayList<RangeValue>();
    long n = size();
    if (n == 0) {
      return result;
    }
    long pieces = Math.max(1, Math.min(numTasks, n));
    long base = relative ? 0 : lo;
    long start = 0;
    for (long k = 0; k < pieces; k++) {
      long len = n / pieces + (k < n % pieces ? 1 : 0);
      result.add(new RangeValue(base + start, base + start + len - 1));
      start += len;
    }
    return result;
  }

  @Override
  public List<Object> follow(RuntimeLibrary lib, RangeValue followThis,
                             boolean fast) throws LogicException {
    lib.noteFollow(fast);
    if (fast) {
      return values(lo + followThis.lo, lo + followThis.hi);
    }
    List<Object> result = new ArrayList<Object>();
    for (Object v: serial(lib)) {
      long offset = (Long)v - lo;
      if (offset >= followThis.lo && offset <= followThis.hi) {
        result.add(v);
      }
    }
    if (result.size() != followThis.size()) {
      throw new LogicException("range " + this + " cannot follow " +
                               followThis);
    }
    return result;
  }

  @Override
  public boolean canFastFollow() {
    return true;
  }

  private static List<Object> values(long from, long to) {
    List<Object> result = new ArrayList<Object>();
    for (long i = from; i <= to; i++) {
      result.add(i);
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RangeValue)) {
      return false;
    }
    RangeValue other = (RangeValue)o;
    return lo == other.lo && hi == other.hi;
  }

  @Override
  public int hashCode() {
    return (int)(lo * 31 + hi);
  }

  @Override
  public String toString() {
    return lo + ".." + hi;
  }
}
