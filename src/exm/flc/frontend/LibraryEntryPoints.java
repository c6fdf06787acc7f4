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
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import exm.flc.ast.ArgSymbol;
import exm.flc.ast.CallExpr;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ReturnTypeRule;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.IteratorClassType;
import exm.flc.common.lang.Types.TupleType;
import exm.flc.common.lang.Types.Type;
import exm.flc.frontend.typecheck.CallResolver;

/**
 * Library functions the lowering refers to by fixed name.
 *
 * The table is populated once per compilation.  An entry is checked the
 * first time it is used: a missing or overloaded entry point is an
 * internal error.
 */
public class LibraryEntryPoints {

  public static final String ELEMENTS_OF_NAME = "these";

  public static enum LibraryOp {
    /** Serial or tagged elements of a value, overloaded per type */
    ELEMENTS_OF(ELEMENTS_OF_NAME, 1),
    TO_FOLLOWER("_toFollower", 2),
    TO_FOLLOWER_ZIP("_toFollowerZip", 2),
    TO_FAST_FOLLOWER("_toFastFollower", 2),
    TO_FAST_FOLLOWER_ZIP("_toFastFollowerZip", 2),
    GET_ITERATOR("_getIterator", 1),
    GET_ITERATOR_ZIP("_getIteratorZip", 1),
    FREE_ITERATOR("_freeIterator", 1),
    ITERATOR_INDEX("iteratorIndex", 1),
    ITERATOR_INDEX_TYPE("iteratorIndexType", 1),
    /** Any number of actuals */
    ITERATOR_INDEX_TYPE_ZIP("iteratorIndexTypeZip", -1),
    STATIC_FAST_FOLLOW_CHECK("chpl__staticFastFollowCheck", 1),
    STATIC_FAST_FOLLOW_CHECK_ZIP("chpl__staticFastFollowCheckZip", 1),
    DYNAMIC_FAST_FOLLOW_CHECK("chpl__dynamicFastFollowCheck", 1),
    DYNAMIC_FAST_FOLLOW_CHECK_ZIP("chpl__dynamicFastFollowCheckZip", 1),
    TRIVIAL_LEADER("chpl_trivialLeader", 0);

    public final String fnName;
    public final int arity;

    private LibraryOp(String fnName, int arity) {
      this.fnName = fnName;
      this.arity = arity;
    }

    public static LibraryOp toFollower(boolean fast, boolean zippered) {
      if (fast) {
        return zippered ? TO_FAST_FOLLOWER_ZIP : TO_FAST_FOLLOWER;
      } else {
        return zippered ? TO_FOLLOWER_ZIP : TO_FOLLOWER;
      }
    }

    public static LibraryOp getIterator(boolean zippered) {
      return zippered ? GET_ITERATOR_ZIP : GET_ITERATOR;
    }

    public static LibraryOp staticCheck(boolean zippered) {
      return zippered ? STATIC_FAST_FOLLOW_CHECK_ZIP : STATIC_FAST_FOLLOW_CHECK;
    }

    public static LibraryOp dynamicCheck(boolean zippered) {
      return zippered ? DYNAMIC_FAST_FOLLOW_CHECK_ZIP :
                        DYNAMIC_FAST_FOLLOW_CHECK;
    }
  }

  private final GlobalContext globals;
  private final Map<LibraryOp, FnSymbol> bound =
                    new EnumMap<LibraryOp, FnSymbol>(LibraryOp.class);
  private final Map<LibraryOp, Boolean> validated =
                    new EnumMap<LibraryOp, Boolean>(LibraryOp.class);

  /** Resolved once per compilation */
  private FnSymbol trivialLeader = null;

  LibraryEntryPoints(GlobalContext globals) {
    this.globals = globals;
  }

  public String name(LibraryOp op) {
    return op.fnName;
  }

  /**
   * @return the single function implementing op
   */
  public FnSymbol get(LibraryOp op) {
    if (op == LibraryOp.ELEMENTS_OF) {
      throw new FlcRuntimeError(op.fnName + " is overloaded per type");
    }
    if (!validated.containsKey(op)) {
      List<FnSymbol> candidates = globals.lookupFunctions(op.fnName);
      if (candidates.size() != 1) {
        throw new FlcRuntimeError("library entry point '" + op.fnName +
            "' has " + candidates.size() + " definitions, expected 1");
      }
      if (bound.get(op) != candidates.get(0)) {
        throw new FlcRuntimeError("library entry point '" + op.fnName +
            "' was redefined");
      }
      validated.put(op, true);
    }
    return bound.get(op);
  }

  /**
   * @return the iterator that yields once, used to run zippered serial
   *         iterators in a forall
   */
  public FnSymbol trivialLeader(CallResolver resolver) throws UserException {
    if (trivialLeader == null) {
      CallExpr call = new CallExpr(name(LibraryOp.TRIVIAL_LEADER));
      trivialLeader = resolver.resolveCall(call);
      if (trivialLeader != get(LibraryOp.TRIVIAL_LEADER)) {
        throw new FlcRuntimeError("chpl_trivialLeader resolved to " +
                                  trivialLeader);
      }
    }
    return trivialLeader;
  }

  private void bind(LibraryOp op, FnSymbol fn) {
    if (bound.containsKey(op)) {
      throw new FlcRuntimeError("Entry point bound twice: " + op);
    }
    bound.put(op, fn);
    globals.defineFunction(fn);
  }

  private static List<ArgSymbol> generic(String ...names) {
    List<ArgSymbol> result = new ArrayList<ArgSymbol>();
    for (String name: names) {
      result.add(new ArgSymbol(name, null));
    }
    return result;
  }

  /**
   * Declare the entry points with the rules giving their result types
   */
  void declare() {
    ReturnTypeRule toFollower = new ReturnTypeRule() {
      @Override
      public Type returnType(List<Type> actualTypes) {
        FnSymbol follower = globals.findFollower(actualTypes.get(0));
        return follower == null ? null : follower.getRetType();
      }
    };
    ReturnTypeRule toFollowerZip = new ReturnTypeRule() {
      @Override
      public Type returnType(List<Type> actualTypes) {
        if (!(actualTypes.get(0) instanceof TupleType)) {
          return null;
        }
        List<Type> followers = new ArrayList<Type>();
        for (Type t: ((TupleType)actualTypes.get(0)).getFields()) {
          FnSymbol follower = globals.findFollower(t);
          if (follower == null) {
            return null;
          }
          followers.add(follower.getRetType());
        }
        return TupleType.makeTuple(followers);
      }
    };
    bind(LibraryOp.TO_FOLLOWER, FnSymbol.library(
        LibraryOp.TO_FOLLOWER.fnName, generic("iterable", "followThis"),
        toFollower));
    bind(LibraryOp.TO_FAST_FOLLOWER, FnSymbol.library(
        LibraryOp.TO_FAST_FOLLOWER.fnName, generic("iterable", "followThis"),
        toFollower));
    bind(LibraryOp.TO_FOLLOWER_ZIP, FnSymbol.library(
        LibraryOp.TO_FOLLOWER_ZIP.fnName, generic("iterables", "followThis"),
        toFollowerZip));
    bind(LibraryOp.TO_FAST_FOLLOWER_ZIP, FnSymbol.library(
        LibraryOp.TO_FAST_FOLLOWER_ZIP.fnName,
        generic("iterables", "followThis"), toFollowerZip));

    bind(LibraryOp.GET_ITERATOR, FnSymbol.library(
        LibraryOp.GET_ITERATOR.fnName, generic("iterable"),
        new ReturnTypeRule() {
          @Override
          public Type returnType(List<Type> actualTypes) {
            Type yt = globals.serialYieldType(actualTypes.get(0));
            return yt == null ? null : new IteratorClassType(yt);
          }
        }));
    bind(LibraryOp.GET_ITERATOR_ZIP, FnSymbol.library(
        LibraryOp.GET_ITERATOR_ZIP.fnName, generic("iterables"),
        new ReturnTypeRule() {
          @Override
          public Type returnType(List<Type> actualTypes) {
            if (!(actualTypes.get(0) instanceof TupleType)) {
              return null;
            }
            Type yt = globals.serialYieldType(actualTypes.get(0));
            return yt == null ? null : new IteratorClassType(yt);
          }
        }));
    bind(LibraryOp.FREE_ITERATOR, FnSymbol.library(
        LibraryOp.FREE_ITERATOR.fnName, generic("iterator"),
        new ReturnTypeRule() {
          @Override
          public Type returnType(List<Type> actualTypes) {
            return actualTypes.get(0) instanceof IteratorClassType ?
                   Types.VOID : null;
          }
        }));
    bind(LibraryOp.ITERATOR_INDEX, FnSymbol.library(
        LibraryOp.ITERATOR_INDEX.fnName, generic("iterator"),
        new ReturnTypeRule() {
          @Override
          public Type returnType(List<Type> actualTypes) {
            return actualTypes.get(0) instanceof IteratorClassType ?
                   actualTypes.get(0).yieldType() : null;
          }
        }));
    bind(LibraryOp.ITERATOR_INDEX_TYPE, FnSymbol.library(
        LibraryOp.ITERATOR_INDEX_TYPE.fnName, generic("iterable"),
        new ReturnTypeRule() {
          @Override
          public Type returnType(List<Type> actualTypes) {
            return globals.serialYieldType(actualTypes.get(0));
          }
        }));
    bind(LibraryOp.ITERATOR_INDEX_TYPE_ZIP, FnSymbol.libraryVariadic(
        LibraryOp.ITERATOR_INDEX_TYPE_ZIP.fnName,
        new ReturnTypeRule() {
          @Override
          public Type returnType(List<Type> actualTypes) {
            if (actualTypes.isEmpty()) {
              return null;
            }
            return globals.serialYieldType(
                                  TupleType.makeTuple(actualTypes));
          }
        }));

    ReturnTypeRule check = new ReturnTypeRule() {
      @Override
      public Type returnType(List<Type> actualTypes) {
        return Types.BOOL;
      }
    };
    for (LibraryOp op: Arrays.asList(LibraryOp.STATIC_FAST_FOLLOW_CHECK,
          LibraryOp.STATIC_FAST_FOLLOW_CHECK_ZIP,
          LibraryOp.DYNAMIC_FAST_FOLLOW_CHECK,
          LibraryOp.DYNAMIC_FAST_FOLLOW_CHECK_ZIP)) {
      bind(op, FnSymbol.library(op.fnName, generic("iterable"), check));
    }

    bind(LibraryOp.TRIVIAL_LEADER, FnSymbol.iterator(
        LibraryOp.TRIVIAL_LEADER.fnName, new ArrayList<ArgSymbol>(), null,
        new QualifiedType(Types.INT, Qualifier.CONST_VAL)));
  }
}
