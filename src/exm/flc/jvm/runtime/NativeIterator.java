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
 * Implementation of a library iterator.
 *
 * The values come in groups, one task per group: a serial iterator
 * returns a single group, a standalone iterator one group per chunk, a
 * leader one group per follower descriptor.  A follower receives the
 * descriptor and the fast flag after the iterator's own arguments.
 */
public interface NativeIterator {
  public List<List<Object>> iterate(List<Object> args, int numTasks)
                                    throws LogicException;
}
