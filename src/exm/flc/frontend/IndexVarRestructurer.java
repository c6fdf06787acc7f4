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

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.ExprList;
import exm.flc.ast.Flag;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Gives a forall the single index variable of its parallel iterator.
 *
 * For a leader, the user's index variables move into the body and are
 * bound from the follower index: directly if there is one, else
 * component by component.
 */
public class IndexVarRestructurer {

  public static final String FOLLOW_THIS = "chpl_followThis";
  public static final String FOLLOW_IDX = "chpl__followIdx";

  /**
   * @param gotSA true for standalone or serial iteration, where the user
   *              index already is the parallel index
   */
  public void addParIdxVarsAndRestruct(ForallStmt fs, boolean gotSA) {
    if (gotSA) {
      VarSymbol parIdx = fs.parIdxVar();
      parIdx.addFlag(Flag.INDEX_OF_INTEREST);
      parIdx.addFlag(Flag.INDEX_VAR);
      return;
    }

    BlockStmt userBody = fs.loopBody();
    BlockStmt loopBody = new BlockStmt();
    userBody.replace(loopBody);
    loopBody.insertAtTail(userBody);

    VarSymbol parIdx = VarSymbol.newTemp(FOLLOW_THIS);
    VarSymbol followIdx = VarSymbol.newTemp(FOLLOW_IDX);
    userBody.insertBefore(new DefExpr(followIdx));

    ExprList indices = fs.inductionVariables();
    if (indices.size() == 1) {
      fs.setNotZippered();
      VarSymbol index = (VarSymbol)((DefExpr)indices.head()).getSymbol();
      userBody.insertAtHead(CallExpr.move(index, new SymExpr(followIdx)));
    } else {
      for (int k = indices.size(); k >= 1; k--) {
        VarSymbol index = (VarSymbol)((DefExpr)indices.get(k - 1))
                                                              .getSymbol();
        userBody.insertAtHead(CallExpr.move(index,
            new CallExpr(Prim.TUPLE_GET, new SymExpr(followIdx),
                         new SymExpr(Literals.intConst(k)))));
      }
    }

    for (Expr def = indices.tail(); def != null; def = indices.tail()) {
      userBody.insertAtHead(def.remove());
    }

    indices.insertAtHead(new DefExpr(parIdx));
    parIdx.addFlag(Flag.INDEX_OF_INTEREST);
    parIdx.addFlag(Flag.INSERT_AUTO_DESTROY);
    followIdx.addFlag(Flag.INDEX_OF_INTEREST);
    followIdx.addFlag(Flag.INDEX_VAR);

    if (fs.numInductionVars() != 1) {
      throw new FlcRuntimeError("forall " + fs.id() + " has " +
          fs.numInductionVars() + " index variables after restructuring");
    }
  }
}
