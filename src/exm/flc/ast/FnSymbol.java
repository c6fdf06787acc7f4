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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.Type;
import exm.flc.frontend.IteratorGroup;

/**
 * A function or iterator.  Library functions have no body: their
 * behaviour is supplied by the runtime and their result type either
 * declared or computed by a {@link ReturnTypeRule}.
 */
public class FnSymbol extends Symbol {
  private final List<ArgSymbol> formals;
  private final boolean iterator;

  /** Accepts any number of actuals; only for library functions */
  private boolean variadic = false;

  /** Parallel flavor selected by the tag argument, null if none */
  private final IterKind iterKind;

  /** What an iterator yields, null while not yet known */
  private QualifiedType yieldType;

  private Type retType;
  private ReturnTypeRule retTypeRule;
  private BlockStmt body;
  private boolean resolved = false;
  private IteratorGroup iteratorGroup;

  private FnSymbol(String name, List<ArgSymbol> formals, boolean iterator,
                   IterKind iterKind) {
    super(name, null);
    this.formals = Collections.unmodifiableList(
                                      new ArrayList<ArgSymbol>(formals));
    this.iterator = iterator;
    this.iterKind = iterKind;
  }

  /**
   * @param iterKind null for a serial iterator
   * @param yieldType null if not known yet
   */
  public static FnSymbol iterator(String name, List<ArgSymbol> formals,
                        IterKind iterKind, QualifiedType yieldType) {
    FnSymbol fn = new FnSymbol(name, formals, true, iterKind);
    fn.yieldType = yieldType;
    fn.retType = new Types.IteratorRecordType(fn);
    return fn;
  }

  public static FnSymbol function(String name, List<ArgSymbol> formals,
                                  Type retType) {
    FnSymbol fn = new FnSymbol(name, formals, false, null);
    fn.retType = retType;
    return fn;
  }

  /**
   * A parallel overload that, although selected by a tag, is a plain
   * function rather than an iterator.
   */
  public static FnSymbol taggedFunction(String name, List<ArgSymbol> formals,
                                  IterKind iterKind, Type retType) {
    FnSymbol fn = new FnSymbol(name, formals, false, iterKind);
    fn.retType = retType;
    return fn;
  }

  public static FnSymbol library(String name, List<ArgSymbol> formals,
                                 ReturnTypeRule rule) {
    FnSymbol fn = new FnSymbol(name, formals, false, null);
    fn.retTypeRule = rule;
    return fn;
  }

  /**
   * Library function taking any number of actuals
   */
  public static FnSymbol libraryVariadic(String name, ReturnTypeRule rule) {
    FnSymbol fn = library(name, Collections.<ArgSymbol>emptyList(), rule);
    fn.variadic = true;
    return fn;
  }

  public boolean isVariadic() {
    return variadic;
  }

  public List<ArgSymbol> getFormals() {
    return formals;
  }

  public int numFormals() {
    return formals.size();
  }

  /**
   * @param i 0-based
   */
  public ArgSymbol getFormal(int i) {
    return formals.get(i);
  }

  public boolean isIterator() {
    return iterator;
  }

  public IterKind getIterKind() {
    return iterKind;
  }

  public boolean isStandaloneIterator() {
    return iterKind == IterKind.STANDALONE;
  }

  public boolean isLeaderIterator() {
    return iterKind == IterKind.LEADER;
  }

  public QualifiedType getYieldType() {
    return yieldType;
  }

  public Type getRetType() {
    return retType;
  }

  public ReturnTypeRule getReturnTypeRule() {
    return retTypeRule;
  }

  public BlockStmt getBody() {
    return body;
  }

  public void setBody(BlockStmt body) {
    if (this.body != null) {
      this.body.setParentSymbol(null);
    }
    this.body = body;
    if (body != null) {
      body.setParentSymbol(this);
    }
  }

  public boolean isResolved() {
    return resolved;
  }

  public void setResolved(boolean resolved) {
    this.resolved = resolved;
  }

  public IteratorGroup getIteratorGroup() {
    return iteratorGroup;
  }

  public void setIteratorGroup(IteratorGroup iteratorGroup) {
    this.iteratorGroup = iteratorGroup;
  }

  @Override
  public Symbol copySymbol() {
    throw new FlcRuntimeError("Functions are not copied: " + name);
  }
}
