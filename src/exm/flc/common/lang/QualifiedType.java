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

package exm.flc.common.lang;

import exm.flc.common.lang.Types.Type;

/**
 * A type together with the way values of it are held.
 */
public class QualifiedType {
  private final Type type;
  private final Qualifier qual;

  public QualifiedType(Type type, Qualifier qual) {
    this.type = type;
    this.qual = qual;
  }

  public QualifiedType(Type type) {
    this(type, Qualifier.VAL);
  }

  public Type type() {
    return type;
  }

  public Qualifier getQual() {
    return qual;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof QualifiedType)) {
      return false;
    }
    QualifiedType other = (QualifiedType)o;
    return other.qual == qual && other.type.equals(type);
  }

  @Override
  public int hashCode() {
    return type.hashCode() * 5 + qual.hashCode();
  }

  @Override
  public String toString() {
    return qual.toString().toLowerCase() + " " + type;
  }
}
