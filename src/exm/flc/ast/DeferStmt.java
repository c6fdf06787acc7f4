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

import java.util.Collections;
import java.util.List;

import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Action run when control leaves the enclosing block, however it leaves.
 */
public class DeferStmt extends Expr {
  private BlockStmt body;

  public DeferStmt(Expr action) {
    if (action instanceof BlockStmt) {
      this.body = adoptChild((BlockStmt)action);
    } else {
      this.body = adoptChild(new BlockStmt(action));
    }
  }

  public BlockStmt body() {
    return body;
  }

  @Override
  public List<Expr> getChildren() {
    return Collections.<Expr>singletonList(body);
  }

  @Override
  protected void replaceChild(Expr oldChild, Expr newChild) {
    if (oldChild != body || !(newChild instanceof BlockStmt)) {
      throw new FlcRuntimeError("Defer body must be a block");
    }
    orphan(body);
    body = adoptChild((BlockStmt)newChild);
  }

  @Override
  protected Expr copyInner(SymbolMap map) {
    return samePos(new DeferStmt(body.copyInner(map)));
  }
}
