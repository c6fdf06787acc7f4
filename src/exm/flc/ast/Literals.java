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

package exm.flc.ast;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import exm.flc.common.lang.Types;

/**
 * Shared constant symbols.  They are immutable, so one instance per
 * value serves every compilation.
 */
public class Literals {
  public static final VarSymbol TRUE = new VarSymbol("true", Types.BOOL,
                                                     Boolean.TRUE);
  public static final VarSymbol FALSE = new VarSymbol("false", Types.BOOL,
                                                      Boolean.FALSE);

  private static final ConcurrentMap<Long, VarSymbol> ints =
                          new ConcurrentHashMap<Long, VarSymbol>();

  static {
    TRUE.addFlag(Flag.CONST);
    FALSE.addFlag(Flag.CONST);
  }

  public static VarSymbol intConst(long val) {
    VarSymbol sym = ints.get(val);
    if (sym == null) {
      VarSymbol newSym = new VarSymbol(Long.toString(val), Types.INT, val);
      newSym.addFlag(Flag.CONST);
      sym = ints.putIfAbsent(val, newSym);
      if (sym == null) {
        sym = newSym;
      }
    }
    return sym;
  }

  public static VarSymbol boolConst(boolean val) {
    return val ? TRUE : FALSE;
  }

  /**
   * String constants are only used as error messages, so are untyped
   */
  public static VarSymbol stringConst(String val) {
    VarSymbol sym = new VarSymbol("\"" + val + "\"", null, val);
    sym.addFlag(Flag.CONST);
    return sym;
  }
}
