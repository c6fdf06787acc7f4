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

import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicInteger;

import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.Type;

/**
 * Named entity: variable, formal, function or type.
 * Symbols compare by identity.
 */
public abstract class Symbol {
  private static final AtomicInteger nextId = new AtomicInteger(1);

  private final int id;
  protected final String name;
  private Type type;
  private Qualifier qual;
  protected final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);

  DefExpr defPoint;

  /** Declaration position for symbols without a definition in the tree */
  private FilePosition declPos;

  protected Symbol(String name, Type type) {
    this.id = nextId.getAndIncrement();
    this.name = name;
    this.type = type == null ? Types.UNKNOWN : type;
    this.qual = Qualifier.UNKNOWN;
  }

  public int id() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  public void setType(Type type) {
    this.type = type;
  }

  public Qualifier getQual() {
    return qual;
  }

  public void setQual(Qualifier qual) {
    this.qual = qual;
  }

  public QualifiedType qualType() {
    return new QualifiedType(type, qual);
  }

  public boolean hasType() {
    return type != Types.UNKNOWN;
  }

  public boolean hasFlag(Flag f) {
    return flags.contains(f);
  }

  public void addFlag(Flag f) {
    flags.add(f);
  }

  public DefExpr getDefPoint() {
    return defPoint;
  }

  public FilePosition getDeclPosition() {
    if (defPoint != null && defPoint.findPosition() != null) {
      return defPoint.findPosition();
    }
    return declPos;
  }

  public void setDeclPosition(FilePosition declPos) {
    this.declPos = declPos;
  }

  /**
   * @return a fresh symbol with the same name, type and flags, to be
   *        defined by a copied definition
   */
  public abstract Symbol copySymbol();

  protected void copyAttrsTo(Symbol other) {
    other.type = type;
    other.qual = qual;
    other.flags.addAll(flags);
  }

  @Override
  public String toString() {
    return name;
  }
}
