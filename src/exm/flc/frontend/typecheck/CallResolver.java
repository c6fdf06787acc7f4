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
package exm.flc.frontend.typecheck;

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForLoop;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.Types.Type;

/**
 * Binds calls to functions and computes the types of expressions.
 */
public interface CallResolver {

  /**
   * Try to resolve a call without reporting anything.  On success the
   * call records the function and its type.
   */
  public ResolveResult tryResolveCall(CallExpr call);

  /**
   * Resolve a call, reporting failure as a user error
   * @return the function bound, or null for primitives and type
   *         constructors
   */
  public FnSymbol resolveCall(CallExpr call) throws UserException;

  /**
   * Resolve an expression or statement.  Type queries may fold into
   * references to type symbols, so the result may replace e.
   * @return e or its replacement
   */
  public Expr resolveExpr(Expr e) throws UserException;

  public void resolveBlock(BlockStmt block) throws UserException;

  /**
   * Type the index of a serial loop from its iterator
   */
  public void resolveForLoopIndex(ForLoop loop);

  /**
   * @return type of a resolved expression, UNKNOWN if not known
   */
  public Type typeOf(Expr e);
}
