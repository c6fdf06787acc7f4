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

import java.util.ArrayList;
import java.util.List;

import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForallStmt;

/**
 * Checks made on foralls once the enclosing function is resolved.
 */
public class ForallPostCheck {

  private final Diagnostics diag;

  public ForallPostCheck(Diagnostics diag) {
    this.diag = diag;
  }

  public void check(FnSymbol fn) {
    if (fn.getBody() == null) {
      return;
    }
    List<ForallStmt> foralls = new ArrayList<ForallStmt>();
    fn.getBody().collect(ForallStmt.class, foralls);
    for (ForallStmt fs: foralls) {
      if (!fs.inTree() || fs.fromReduce()) {
        continue;
      }
      if (fn.isIterator() && !fn.hasFlag(Flag.INLINE_ITERATOR)) {
        diag.errorCont(fs,
            "invalid use of parallel construct in serial iterator");
      }
    }
  }
}
