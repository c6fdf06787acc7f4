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
 * Stateful iterator driving a serial loop.  Must be freed; the library
 * counts handles still live.
 */
public class IterHandle {
  private final RuntimeLibrary owner;
  private final List<Object> values;
  private int pos = 0;
  private boolean freed = false;

  IterHandle(RuntimeLibrary owner, List<Object> values) {
    this.owner = owner;
    this.values = values;
    owner.handleOpened();
  }

  public boolean hasNext() {
    return pos < values.size();
  }

  public Object next() {
    return values.get(pos++);
  }

  /**
   * Freeing twice has no further effect
   */
  public synchronized void free() {
    if (!freed) {
      freed = true;
      owner.handleFreed();
    }
  }

  public boolean isFreed() {
    return freed;
  }
}
