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
 * Per-task accumulator of a reduce shadow variable.  Starts out empty,
 * which acts as the operator's identity.
 */
public class ReduceCell extends Cell {
  private final ReduceScanOp op;

  public ReduceCell(ReduceScanOp op) {
    this.op = op;
  }

  public ReduceScanOp getOp() {
    return op;
  }

  public synchronized void accumulate(Object x) throws LogicException {
    set(op.combine(get(), x));
  }

  @Override
  public synchronized void add(Object delta) throws LogicException {
    accumulate(delta);
  }
}
