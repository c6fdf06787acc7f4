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
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Base class of all program tree nodes.
 *
 * Each node has at most one parent.  A node is either held in one of the
 * parent's {@link ExprList}s or in a single-valued slot of the parent.
 * Moving a node means removing it first: attaching a node that still has
 * a parent is an internal error.
 */
public abstract class Expr {
  private static final AtomicInteger nextId = new AtomicInteger(1);

  private final int id;

  /** Parent node, null if detached */
  Expr parentExpr;

  /** List containing this node, null if held in a slot or detached */
  ExprList list;

  FilePosition pos;

  protected Expr() {
    this.id = nextId.getAndIncrement();
  }

  public int id() {
    return id;
  }

  public Expr getParent() {
    return parentExpr;
  }

  public ExprList getList() {
    return list;
  }

  public FilePosition getPosition() {
    return pos;
  }

  public void setPosition(FilePosition pos) {
    this.pos = pos;
  }

  /**
   * @return position of this node or of its closest positioned ancestor
   */
  public FilePosition findPosition() {
    Expr e = this;
    while (e != null) {
      if (e.pos != null) {
        return e.pos;
      }
      e = e.parentExpr;
    }
    return null;
  }

  /**
   * Owned children, in program order
   */
  public abstract List<Expr> getChildren();

  /**
   * Replace a child held in a slot.  A null replacement empties the slot.
   */
  protected abstract void replaceChild(Expr oldChild, Expr newChild);

  /**
   * Shallow part of a deep copy: copy this node and its children.
   * Definitions copy their symbols and record the old-to-new mapping.
   */
  protected abstract Expr copyInner(SymbolMap map);

  public final Expr copy() {
    return copy(new SymbolMap());
  }

  /**
   * Deep copy.  References to symbols in the map, including symbols
   * defined inside this subtree, are redirected to their copies.
   */
  public final Expr copy(SymbolMap map) {
    Expr result = copyInner(map);
    List<SymExpr> refs = new ArrayList<SymExpr>();
    result.collect(SymExpr.class, refs);
    for (SymExpr ref: refs) {
      Symbol repl = map.get(ref.symbol());
      if (repl != null) {
        ref.setSymbol(repl);
      }
    }
    return result;
  }

  /**
   * Give a copy the position of this node
   */
  protected final <T extends Expr> T samePos(T copy) {
    copy.pos = pos;
    return copy;
  }

  protected final <T extends Expr> T adoptChild(T child) {
    if (child == null) {
      return null;
    }
    checkDetached(child);
    child.parentExpr = this;
    child.list = null;
    if (child.pos == null) {
      child.pos = pos;
    }
    return child;
  }

  static void checkDetached(Expr child) {
    if (child.parentExpr != null || child.list != null) {
      throw new FlcRuntimeError("Node " + child.id + " " +
          child.getClass().getSimpleName() + " already has a parent");
    }
  }

  protected static void orphan(Expr child) {
    if (child != null) {
      child.parentExpr = null;
      child.list = null;
    }
  }

  /**
   * Detach this node from its parent.
   * @return this
   */
  public Expr remove() {
    if (list != null) {
      list.removeItem(this);
    } else if (parentExpr != null) {
      parentExpr.replaceChild(this, null);
    }
    return this;
  }

  /**
   * Put replacement where this node is, and detach this node.
   */
  public void replace(Expr replacement) {
    if (list != null) {
      list.replaceItem(this, replacement);
    } else if (parentExpr != null) {
      parentExpr.replaceChild(this, replacement);
    } else {
      throw new FlcRuntimeError("Cannot replace detached node " + id);
    }
  }

  public void insertBefore(Expr e) {
    checkInList();
    list.insertBefore(this, e);
  }

  public void insertAfter(Expr e) {
    checkInList();
    list.insertAfter(this, e);
  }

  private void checkInList() {
    if (list == null) {
      throw new FlcRuntimeError("Node " + id + " " +
            getClass().getSimpleName() + " is not in a list");
    }
  }

  public Expr next() {
    return list == null ? null : list.after(this);
  }

  public Expr prev() {
    return list == null ? null : list.before(this);
  }

  private Expr root() {
    Expr e = this;
    while (e.parentExpr != null) {
      e = e.parentExpr;
    }
    return e;
  }

  /**
   * @return true if this node is reachable from a function body
   */
  public boolean inTree() {
    Expr top = root();
    return top instanceof BlockStmt &&
           ((BlockStmt)top).getParentSymbol() != null;
  }

  /**
   * @return function whose body contains this node, or null
   */
  public FnSymbol getFunction() {
    Expr top = root();
    if (top instanceof BlockStmt) {
      Symbol s = ((BlockStmt)top).getParentSymbol();
      if (s instanceof FnSymbol) {
        return (FnSymbol)s;
      }
    }
    return null;
  }

  /**
   * @return the statement containing this node: the ancestor, possibly
   *        this node, that sits directly in a block body
   */
  public Expr getStmtExpr() {
    Expr e = this;
    while (e != null) {
      if (e.list != null && e.parentExpr instanceof BlockStmt &&
          ((BlockStmt)e.parentExpr).getBody() == e.list) {
        return e;
      }
      e = e.parentExpr;
    }
    return null;
  }

  /**
   * Collect this node and all descendants of the given class, in program
   * order.
   */
  public <T extends Expr> void collect(Class<T> cls, List<T> out) {
    if (cls.isInstance(this)) {
      out.add(cls.cast(this));
    }
    for (Expr child: getChildren()) {
      child.collect(cls, out);
    }
  }

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }
}
