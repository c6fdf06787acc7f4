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

import java.util.List;

import exm.flc.ast.AstUtil;
import exm.flc.ast.CallExpr;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.Symbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.TypeSymbol;
import exm.flc.ast.UnresolvedSymExpr;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.ForallIntentTag;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.ShadowVarPrefix;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.Type;
import exm.flc.common.lang.Types.TypeInstance;

/**
 * Shadow variables of forall loops: building them from the "with" clause
 * and resolving them once the loop's header is known.
 */
public class ShadowVars {

  private final LoweringContext ctx;

  public ShadowVars(LoweringContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Build a shadow variable from a "with" clause item such as
   * <code>ref x</code> or <code>var x: int = 0</code>.  With a type or
   * initializer the item declares a task-private variable, otherwise it
   * gives the intent for capturing the outer variable of the same name.
   * Problems are reported as continuable errors and a variable is
   * returned regardless.
   */
  public static ShadowVarSymbol buildForPrefix(Diagnostics diag,
      ShadowVarPrefix prefix, UnresolvedSymExpr nameExp, Expr type,
      Expr init) {
    String name = nameExp.getName();

    ShadowVarSymbol svar;
    if (type == null && init == null) {
      if (prefix == ShadowVarPrefix.VAR) {
        diag.errorCont(nameExp, "a task private variable '" + name +
                       "' requires a type and/or initializing expression");
        svar = buildTaskPrivate(prefix, name, null, null);
      } else {
        svar = new ShadowVarSymbol(intentFor(prefix), name, nameExp);
        new DefExpr(svar);
      }
    } else {
      checkDeclaration(diag, prefix, nameExp, type, init);
      svar = buildTaskPrivate(prefix, name, type, init);
    }
    svar.getDefPoint().setPosition(nameExp.getPosition());
    return svar;
  }

  private static void checkDeclaration(Diagnostics diag,
      ShadowVarPrefix prefix, UnresolvedSymExpr nameExp, Expr type,
      Expr init) {
    String name = nameExp.getName();
    switch (prefix) {
      case IN:
      case CONST_IN:
        diag.errorCont(nameExp, "an 'in' or 'const in' intent for '" + name +
            "' does not allow a type or an initializing expression");
        diag.note(nameExp, "if you mean to declare a task-private variable, " +
                           "use 'var' or 'const'");
        break;
      case REF:
      case CONST_REF:
        if (init == null) {
          diag.errorCont(nameExp, "a 'ref' or 'const ref' task-private " +
              "variable '" + name + "' must have an initializing expression");
        }
        if (type != null) {
          diag.errorCont(nameExp, "a 'ref' or 'const ref' task-private " +
              "variable '" + name + "' cannot have a type");
        }
        break;
      default:
        break;
    }
  }

  private static ShadowVarSymbol buildTaskPrivate(ShadowVarPrefix prefix,
                                        String name, Expr type, Expr init) {
    ShadowVarSymbol svar = new ShadowVarSymbol(ForallIntentTag.TASK_PRIVATE,
                                               name, null);
    switch (prefix) {
      case CONST:
        svar.setQual(Qualifier.CONST_VAL);
        svar.addFlag(Flag.CONST);
        break;
      case REF:
        svar.setQual(Qualifier.REF);
        svar.addFlag(Flag.REF_VAR);
        break;
      case CONST_REF:
        svar.setQual(Qualifier.CONST_REF);
        svar.addFlag(Flag.CONST);
        svar.addFlag(Flag.REF_VAR);
        break;
      default:
        svar.setQual(Qualifier.VAL);
        break;
    }
    svar.addFlag(Flag.NO_AUTO_DESTROY);
    new DefExpr(svar, init, type);
    return svar;
  }

  private static ForallIntentTag intentFor(ShadowVarPrefix prefix) {
    switch (prefix) {
      case CONST:
        return ForallIntentTag.CONST;
      case IN:
        return ForallIntentTag.IN;
      case CONST_IN:
        return ForallIntentTag.CONST_IN;
      case REF:
        return ForallIntentTag.REF;
      case CONST_REF:
        return ForallIntentTag.CONST_REF;
      default:
        return ForallIntentTag.TASK_PRIVATE;
    }
  }

  /**
   * Build a reduce intent such as <code>+ reduce sum</code>
   * @param outerVar names the outer variable
   * @param reduceOp operator spelling or reduce class
   */
  public static ShadowVarSymbol buildFromReduceIntent(
                      UnresolvedSymExpr outerVar, Expr reduceOp) {
    return new ShadowVarSymbol(ForallIntentTag.REDUCE, outerVar.getName(),
                               outerVar, reduceOp);
  }

  /**
   * Find outer variables, fix qualifiers and types, and redirect
   * references in the loop body to the shadow variables.
   */
  public void setupAndResolve(ForallStmt fs) throws UserException {
    List<ShadowVarSymbol> svars = fs.shadowVarSymbols();
    for (ShadowVarSymbol svar: svars) {
      if (svar.intent().isReduceInternal()) {
        continue;
      } else if (svar.isTaskPrivate()) {
        resolveTaskPrivate(svar);
        continue;
      }

      Symbol outer = findOuterVar(fs, svar);
      if (outer == null) {
        ctx.diag.errorCont(fs, "no variable called '" + svar.getName() +
                           "' is visible to this forall intent");
        continue;
      }
      svar.setOuterVar(outer);
      if (!(svar.getOuterVarRef() instanceof SymExpr)) {
        svar.setOuterVarRef(new SymExpr(outer));
      }
      svar.setType(outer.getType());
      svar.setQual(qualifierFor(svar.intent(), outer.getType()));

      if (svar.isReduce()) {
        resolveReduceOp(fs, svar, outer);
      }
      redirectUses(fs, outer, svar);
      LogHelper.trace(fs, "shadow variable " + svar.getName() + ": " +
                      svar.intent() + " " + svar.qualType());
    }
  }

  private Symbol findOuterVar(ForallStmt fs, ShadowVarSymbol svar) {
    Expr ref = svar.getOuterVarRef();
    if (ref instanceof SymExpr) {
      return ((SymExpr)ref).symbol();
    }
    String name = ref instanceof UnresolvedSymExpr ?
                  ((UnresolvedSymExpr)ref).getName() : svar.getName();
    return AstUtil.lookupVisible(fs, name);
  }

  static Qualifier qualifierFor(ForallIntentTag intent, Type outerType) {
    switch (intent) {
      case IN:
      case REDUCE:
        return Qualifier.VAL;
      case CONST_IN:
        return Qualifier.CONST_VAL;
      case REF:
        return Qualifier.REF;
      case CONST_REF:
        return Qualifier.CONST_REF;
      default:
        return outerType.isAggregate() ? Qualifier.CONST_REF :
                                         Qualifier.CONST_VAL;
    }
  }

  private void resolveReduceOp(ForallStmt fs, ShadowVarSymbol svar,
                               Symbol outer) throws UserException {
    Expr op = svar.getReduceOpExpr();
    if (op instanceof UnresolvedSymExpr) {
      String spelling = ((UnresolvedSymExpr)op).getName();
      TypeSymbol opClass = ctx.globals.reduceOpClass(spelling);
      if (opClass == null) {
        TypeSymbol named = ctx.globals.lookupType(spelling);
        if (named != null && named.hasFlag(Flag.REDUCE_SCAN_OP)) {
          opClass = named;
        }
      }
      if (opClass == null) {
        ctx.diag.errorCont(fs, "'" + spelling + "' is not a reduce operator");
        return;
      }
      CallExpr instance = new CallExpr(opClass,
          new SymExpr(ctx.globals.typeSymbolFor(outer.getType())));
      svar.setReduceOpExpr(instance);
      op = instance;
    }
    if (op instanceof CallExpr) {
      ctx.resolver.resolveCall((CallExpr)op);
      Type opType = ctx.resolver.typeOf(op);
      if (!outer.hasType() && opType instanceof TypeInstance) {
        // result variable of a reduce expression
        outer.setType(((TypeInstance)opType).getArg());
        svar.setType(outer.getType());
      }
    }
  }

  private void resolveTaskPrivate(ShadowVarSymbol svar)
                                  throws UserException {
    DefExpr def = svar.getDefPoint();
    Type t = Types.UNKNOWN;
    if (def.getExprType() != null) {
      t = ctx.resolver.typeOf(ctx.resolver.resolveExpr(def.getExprType()));
    }
    if (def.getInit() != null) {
      Expr init = ctx.resolver.resolveExpr(def.getInit());
      if (t == Types.UNKNOWN) {
        t = ctx.resolver.typeOf(init);
      }
    }
    svar.setType(t);
  }

  private static void redirectUses(ForallStmt fs, Symbol outer,
                                   ShadowVarSymbol svar) {
    for (SymExpr use: AstUtil.symbolUses(fs.loopBody(), outer)) {
      use.setSymbol(svar);
    }
  }
}
