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

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Old-to-new symbol mapping used when copying subtrees.
 */
public class SymbolMap {
  private final Map<Symbol, Symbol> map = new IdentityHashMap<Symbol, Symbol>();

  public void put(Symbol from, Symbol to) {
    map.put(from, to);
  }

  public Symbol get(Symbol from) {
    return map.get(from);
  }

  public int size() {
    return map.size();
  }
}
