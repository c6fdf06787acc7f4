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
import java.util.Iterator;
import java.util.List;

import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Ordered list of nodes owned by one parent.  Iteration is over a
 * snapshot, so the list may be modified while iterating.
 */
public class ExprList implements Iterable<Expr> {
  private final Expr owner;
  private final ArrayList<Expr> items = new ArrayList<Expr>();

  public ExprList(Expr owner) {
    this.owner = owner;
  }

  private Expr adopt(Expr e) {
    Expr.checkDetached(e);
    e.parentExpr = owner;
    e.list = this;
    if (e.pos == null) {
      e.pos = owner.pos;
    }
    return e;
  }

  public void insertAtTail(Expr e) {
    items.add(adopt(e));
  }

  public void insertAtHead(Expr e) {
    items.add(0, adopt(e));
  }

  void insertBefore(Expr ref, Expr e) {
    int i = indexOfChecked(ref);
    items.add(i, adopt(e));
  }

  void insertAfter(Expr ref, Expr e) {
    int i = indexOfChecked(ref);
    items.add(i + 1, adopt(e));
  }

  void removeItem(Expr e) {
    items.remove(indexOfChecked(e));
    Expr.orphan(e);
  }

  void replaceItem(Expr old, Expr replacement) {
    int i = indexOfChecked(old);
    adopt(replacement);
    items.set(i, replacement);
    Expr.orphan(old);
  }

  private int indexOfChecked(Expr e) {
    for (int i = 0; i < items.size(); i++) {
      if (items.get(i) == e) {
        return i;
      }
    }
    throw new FlcRuntimeError("Node " + e.id() + " not in list of node " +
                              owner.id());
  }

  Expr after(Expr e) {
    int i = indexOfChecked(e);
    return i + 1 < items.size() ? items.get(i + 1) : null;
  }

  Expr before(Expr e) {
    int i = indexOfChecked(e);
    return i > 0 ? items.get(i - 1) : null;
  }

  /**
   * @param i 0-based position
   */
  public Expr get(int i) {
    return items.get(i);
  }

  public Expr head() {
    return items.isEmpty() ? null : items.get(0);
  }

  public Expr tail() {
    return items.isEmpty() ? null : items.get(items.size() - 1);
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public List<Expr> toList() {
    return Collections.unmodifiableList(new ArrayList<Expr>(items));
  }

  @Override
  public Iterator<Expr> iterator() {
    return toList().iterator();
  }
}
