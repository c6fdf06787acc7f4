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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.flc.ast.AstUtil;
import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.CondStmt;
import exm.flc.ast.DefExpr;
import exm.flc.ast.DeferStmt;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.NamedExpr;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.Symbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.TypeSymbol;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.IteratorClassType;
import exm.flc.common.lang.Types.TupleType;
import exm.flc.common.lang.Types.Type;
import exm.flc.common.lang.Types.TypeInstance;
import exm.flc.frontend.Diagnostics;
import exm.flc.frontend.GlobalContext;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;

/**
 * Resolves calls by matching actual types against the overloads of the
 * called name.  Formals without a declared type accept anything; the
 * candidate with most exactly-matched formals wins.  The tag actual, if
 * any, must select the overload's iteration kind; calls without one only
 * match overloads without a kind.
 */
public class OverloadResolver implements CallResolver {

  public static final String TAG_ACTUAL = "tag";

  private final GlobalContext globals;
  private final Diagnostics diag;
  private final Logger logger;

  public OverloadResolver(GlobalContext globals, Diagnostics diag) {
    this.globals = globals;
    this.diag = diag;
    this.logger = globals.getLogger();
  }

  @Override
  public ResolveResult tryResolveCall(CallExpr call) {
    if (call.isPrimitive()) {
      return resolvePrim(call);
    }

    for (Expr actual: call.actuals()) {
      Expr inner = unwrapNamed(actual);
      if (inner instanceof CallExpr &&
          ((CallExpr)inner).getCallType() == null) {
        ResolveResult r = tryResolveCall((CallExpr)inner);
        if (!r.succeeded()) {
          return r;
        }
      }
    }

    Symbol base = call.getBaseSymbol();
    if (base instanceof TypeSymbol) {
      return resolveTypeConstructor(call, (TypeSymbol)base);
    }

    List<FnSymbol> candidates;
    if (base instanceof FnSymbol) {
      candidates = Collections.singletonList((FnSymbol)base);
    } else if (base == null && call.getName() != null) {
      candidates = globals.lookupFunctions(call.getName());
    } else {
      return ResolveResult.failure("'" + base + "' is not a function");
    }

    IterKind tag = null;
    boolean typeActual = false;
    List<Type> types = new ArrayList<Type>();
    for (Expr actual: call.actuals()) {
      if (actual instanceof NamedExpr &&
          ((NamedExpr)actual).getName().equals(TAG_ACTUAL)) {
        Expr tagVal = ((NamedExpr)actual).getActual();
        tag = tagVal instanceof SymExpr ?
              globals.iterKindOf(((SymExpr)tagVal).symbol()) : null;
        if (tag == null) {
          return ResolveResult.failure("tag actual is not an iteration kind");
        }
      } else {
        typeActual |= AstUtil.isTypeExpr(actual);
        types.add(typeOf(actual));
      }
    }

    FnSymbol best = null;
    Type bestType = null;
    int bestScore = -1;
    boolean ambiguous = false;
    for (FnSymbol fn: candidates) {
      if (fn.getIterKind() != tag) {
        continue;
      }
      if (typeActual && fn.getReturnTypeRule() == null) {
        // only library functions take types
        continue;
      }
      Type t = match(fn, types);
      if (t == null) {
        continue;
      }
      int score = score(fn, types);
      if (score > bestScore) {
        best = fn;
        bestType = t;
        bestScore = score;
        ambiguous = false;
      } else if (score == bestScore) {
        ambiguous = true;
      }
    }

    if (best == null) {
      return ResolveResult.failure("no overload of '" + call.getName() +
          "' accepts (" + StringUtils.join(types, ", ") + ")" +
          (tag == null ? "" : " with tag " + tag.tagName()));
    } else if (ambiguous) {
      return ResolveResult.failure("call to '" + call.getName() +
                                   "' is ambiguous");
    }
    call.setResolvedFunction(best);
    call.setCallType(bestType);
    if (logger.isTraceEnabled()) {
      logger.trace("resolved " + call.getName() + "(" +
                   StringUtils.join(types, ", ") + ") : " + bestType);
    }
    return ResolveResult.success(best, bestType);
  }

  /**
   * @return the result type if fn accepts the actual types, else null
   */
  private Type match(FnSymbol fn, List<Type> types) {
    if (fn.getReturnTypeRule() != null) {
      if (!fn.isVariadic() && fn.numFormals() != types.size()) {
        return null;
      }
      return fn.getReturnTypeRule().returnType(types);
    }
    if (fn.numFormals() != types.size()) {
      return null;
    }
    for (int i = 0; i < types.size(); i++) {
      if (!fn.getFormal(i).isGeneric() &&
          !fn.getFormal(i).getType().equals(types.get(i))) {
        return null;
      }
    }
    return fn.getRetType();
  }

  private int score(FnSymbol fn, List<Type> types) {
    int score = 0;
    for (int i = 0; i < fn.numFormals() && i < types.size(); i++) {
      if (!fn.getFormal(i).isGeneric()) {
        score++;
      }
    }
    return score;
  }

  private ResolveResult resolveTypeConstructor(CallExpr call,
                                               TypeSymbol ts) {
    if (!ts.hasFlag(Flag.REDUCE_SCAN_OP) || call.numActuals() != 1) {
      return ResolveResult.failure("type '" + ts.getName() +
                                   "' cannot be instantiated here");
    }
    Type arg = typeOf(call.actual(0));
    if (arg == Types.UNKNOWN) {
      return ResolveResult.failure("type of " + ts.getName() +
                                   " argument is not known");
    }
    Type t = new TypeInstance(ts.getName(), arg);
    call.setCallType(t);
    return ResolveResult.success(null, t);
  }

  private ResolveResult resolvePrim(CallExpr call) {
    Prim prim = call.getPrim();
    if (prim == Prim.REDUCE) {
      return ResolveResult.failure("reduce expression was not lowered");
    }
    for (Expr actual: call.actuals()) {
      if (actual instanceof CallExpr &&
          ((CallExpr)actual).getCallType() == null) {
        ResolveResult r = tryResolveCall((CallExpr)actual);
        if (!r.succeeded()) {
          return r;
        }
      }
    }
    Type t;
    switch (prim) {
      case MOVE: {
        Symbol lhs = ((SymExpr)call.actual(0)).symbol();
        Type rhsType = typeOf(call.actual(1));
        if (!lhs.hasType()) {
          lhs.setType(rhsType);
        }
        if (lhs.getQual() == Qualifier.UNKNOWN) {
          lhs.setQual(Qualifier.VAL);
        }
        t = Types.VOID;
        break;
      }
      case ZIP:
      case BUILD_TUPLE: {
        List<Type> fields = new ArrayList<Type>();
        for (Expr actual: call.actuals()) {
          fields.add(typeOf(actual));
        }
        t = TupleType.makeTuple(fields);
        break;
      }
      case TUPLE_GET: {
        Type tuple = typeOf(call.actual(0));
        Symbol k = ((SymExpr)call.actual(1)).symbol();
        if (!(tuple instanceof TupleType) || !(k instanceof VarSymbol) ||
            !(((VarSymbol)k).getImmediate() instanceof Long)) {
          return ResolveResult.failure("cannot index " + tuple);
        }
        int i = ((Long)((VarSymbol)k).getImmediate()).intValue();
        if (i < 1 || i > ((TupleType)tuple).numFields()) {
          return ResolveResult.failure("tuple index " + i +
                                       " out of bounds for " + tuple);
        }
        t = ((TupleType)tuple).getField(i);
        break;
      }
      default:
        t = Types.VOID;
        break;
    }
    call.setCallType(t);
    return ResolveResult.success(null, t);
  }

  @Override
  public FnSymbol resolveCall(CallExpr call) throws UserException {
    ResolveResult r = tryResolveCall(call);
    if (!r.succeeded()) {
      throw diag.fatal(call, "unresolved call '" + describe(call) + "': " +
                              r.getReason());
    }
    return r.getFunction();
  }

  @Override
  public Expr resolveExpr(Expr e) throws UserException {
    if (e instanceof ForallStmt) {
      // Headers are resolved by the forall pass when it reaches them
      logger.trace("resolver skips nested forall " + e.id());
      return e;
    } else if (e instanceof BlockStmt) {
      resolveBlock((BlockStmt)e);
    } else if (e instanceof CondStmt) {
      CondStmt cond = (CondStmt)e;
      resolveExpr(cond.condExpr());
      resolveBlock(cond.thenStmt());
      if (cond.elseStmt() != null) {
        resolveBlock(cond.elseStmt());
      }
    } else if (e instanceof DeferStmt) {
      resolveBlock(((DeferStmt)e).body());
    } else if (e instanceof DefExpr) {
      resolveDef((DefExpr)e);
    } else if (e instanceof NamedExpr) {
      resolveExpr(((NamedExpr)e).getActual());
    } else if (e instanceof CallExpr) {
      return resolveCallExpr((CallExpr)e);
    }
    return e;
  }

  private Expr resolveCallExpr(CallExpr call) throws UserException {
    for (Expr actual: call.actuals()) {
      Expr inner = unwrapNamed(actual);
      if (inner instanceof CallExpr) {
        resolveExpr(inner);
      }
    }

    if (call.isPrimitive()) {
      ResolveResult r = resolvePrim(call);
      if (!r.succeeded()) {
        throw diag.fatal(call, r.getReason());
      }
      return call;
    }

    FnSymbol fn = resolveCall(call);
    if (fn != null && isTypeQuery(fn)) {
      TypeSymbol ts = globals.findTypeSymbol(call.getCallType());
      if (ts != null) {
        SymExpr folded = new SymExpr(ts);
        if (call.getParent() != null) {
          call.replace(folded);
        }
        return folded;
      }
    }
    return call;
  }

  private boolean isTypeQuery(FnSymbol fn) {
    return fn == globals.getEntryPoints().get(LibraryOp.ITERATOR_INDEX_TYPE) ||
        fn == globals.getEntryPoints().get(LibraryOp.ITERATOR_INDEX_TYPE_ZIP);
  }

  private void resolveDef(DefExpr def) throws UserException {
    Symbol sym = def.getSymbol();
    if (sym instanceof ShadowVarSymbol || sym instanceof TypeSymbol) {
      return;
    }
    if (def.getExprType() != null) {
      Expr typeExpr = resolveExpr(def.getExprType());
      if (!sym.hasType()) {
        sym.setType(typeOf(typeExpr));
      }
    }
    if (def.getInit() != null) {
      Expr init = resolveExpr(def.getInit());
      if (!sym.hasType()) {
        sym.setType(typeOf(init));
      }
      if (sym.getQual() == Qualifier.UNKNOWN) {
        sym.setQual(Qualifier.VAL);
      }
    }
  }

  @Override
  public void resolveBlock(BlockStmt block) throws UserException {
    if (block instanceof ForLoop) {
      resolveForLoopIndex((ForLoop)block);
    }
    for (Expr stmt: block.getBody()) {
      resolveExpr(stmt);
    }
  }

  @Override
  public void resolveForLoopIndex(ForLoop loop) {
    Symbol index = loop.indexGet().symbol();
    Type iter = loop.iteratorGet().symbol().getType();
    if (!index.hasType() && iter instanceof IteratorClassType) {
      index.setType(iter.yieldType());
      index.setQual(Qualifier.CONST_VAL);
    }
  }

  @Override
  public Type typeOf(Expr e) {
    if (e instanceof SymExpr) {
      return ((SymExpr)e).symbol().getType();
    } else if (e instanceof NamedExpr) {
      return typeOf(((NamedExpr)e).getActual());
    } else if (e instanceof CallExpr) {
      Type t = ((CallExpr)e).getCallType();
      return t == null ? Types.UNKNOWN : t;
    }
    return Types.UNKNOWN;
  }

  private static Expr unwrapNamed(Expr e) {
    return e instanceof NamedExpr ? ((NamedExpr)e).getActual() : e;
  }

  private String describe(CallExpr call) {
    List<String> actuals = new ArrayList<String>();
    for (Expr actual: call.actuals()) {
      String s = typeOf(actual).toString();
      if (actual instanceof NamedExpr) {
        Expr v = ((NamedExpr)actual).getActual();
        s = ((NamedExpr)actual).getName() + "=" +
            (v instanceof SymExpr ? ((SymExpr)v).symbol().getName() : s);
      }
      actuals.add(s);
    }
    return call.getName() + "(" + StringUtils.join(actuals, ", ") + ")";
  }
}
