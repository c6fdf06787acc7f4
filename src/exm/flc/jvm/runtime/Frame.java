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

import java.util.HashMap;
import java.util.Map;

import exm.flc.ast.Symbol;
import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Variables of one scope.  Lookups fall through to the enclosing frame.
 *
 * A frame is only written by the thread that created it; tasks read
 * their parent's frame while the parent waits for them.
 */
public class Frame {
  private final Frame parent;
  private final Map<Symbol, Cell> cells = new HashMap<Symbol, Cell>();

  public Frame(Frame parent) {
    this.parent = parent;
  }

  public Frame getParent() {
    return parent;
  }

  public Cell define(Symbol sym, Object value) {
    Cell cell = new Cell(value);
    cells.put(sym, cell);
    return cell;
  }

  /**
   * Make sym refer to an existing cell
   */
  public void bind(Symbol sym, Cell cell) {
    cells.put(sym, cell);
  }

  public Cell lookup(Symbol sym) {
    for (Frame f = this; f != null; f = f.parent) {
      Cell cell = f.cells.get(sym);
      if (cell != null) {
        return cell;
      }
    }
    throw new FlcRuntimeError("No storage for " + sym.getName() + " (" +
                              sym.id() + ")");
  }

  public boolean isDefined(Symbol sym) {
    for (Frame f = this; f != null; f = f.parent) {
      if (f.cells.containsKey(sym)) {
        return true;
      }
    }
    return false;
  }

  public Object get(Symbol sym) {
    return lookup(sym).get();
  }
}
