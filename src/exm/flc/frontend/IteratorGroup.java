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
package exm.flc.frontend;

import org.apache.log4j.Logger;

import exm.flc.ast.ArgSymbol;
import exm.flc.ast.FnSymbol;
import exm.flc.common.lang.IterKind;

/**
 * The parallel overloads that belong with a serial iterator: same name,
 * same formals, selected by the tag argument.
 */
public class IteratorGroup {
  public final FnSymbol serial;
  private FnSymbol standalone;
  private FnSymbol leader;

  /** The standalone overload exists but is not an iterator */
  private boolean noniterSA = false;

  /** The leader overload exists but is not an iterator */
  private boolean noniterL = false;

  IteratorGroup(FnSymbol serial) {
    this.serial = serial;
  }

  static IteratorGroup build(GlobalContext globals, FnSymbol serial,
                             Logger logger) {
    IteratorGroup group = new IteratorGroup(serial);
    for (FnSymbol fn: globals.lookupFunctions(serial.getName())) {
      if (fn == serial || !sameFormals(fn, serial)) {
        continue;
      }
      if (fn.getIterKind() == IterKind.STANDALONE) {
        group.standalone = fn;
        group.noniterSA = !fn.isIterator();
      } else if (fn.getIterKind() == IterKind.LEADER) {
        group.leader = fn;
        group.noniterL = !fn.isIterator();
      }
    }
    logger.trace("iterator group for " + serial.getName() + ": standalone=" +
                 (group.standalone != null) + " leader=" +
                 (group.leader != null));
    return group;
  }

  static boolean sameFormals(FnSymbol a, FnSymbol b) {
    if (a.numFormals() != b.numFormals()) {
      return false;
    }
    for (int i = 0; i < a.numFormals(); i++) {
      ArgSymbol fa = a.getFormal(i);
      ArgSymbol fb = b.getFormal(i);
      if (fa.isGeneric() != fb.isGeneric()) {
        return false;
      }
      if (!fa.isGeneric() && !fa.getType().equals(fb.getType())) {
        return false;
      }
    }
    return true;
  }

  public FnSymbol getStandalone() {
    return standalone;
  }

  public FnSymbol getLeader() {
    return leader;
  }

  public boolean noniterSA() {
    return noniterSA;
  }

  public boolean noniterL() {
    return noniterL;
  }

  /**
   * @return the slot for the given flavor
   */
  public FnSymbol forFlavor(ParIterFlavor flavor) {
    switch (flavor) {
      case SERIAL:
        return serial;
      case STANDALONE:
        return standalone;
      case LEADER:
        return leader;
      default:
        return null;
    }
  }
}
