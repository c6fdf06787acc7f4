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
package exm.flc.jvm.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.TupleType;
import exm.flc.common.lang.Types.Type;

/**
 * Reduction operators, named by the class the front end instantiates.
 *
 * Null is the identity of every operator while accumulating; a reduction
 * over no elements yields {@link #identity(Type)}.  Tuples are reduced
 * componentwise.
 */
public enum ReduceScanOp {
  SUM("SumReduceScanOp", 0L, null) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      return Cell.asLong(a) + Cell.asLong(b);
    }
  },
  PRODUCT("ProductReduceScanOp", 1L, null) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      return Cell.asLong(a) * Cell.asLong(b);
    }
  },
  MIN("MinReduceScanOp", Long.MAX_VALUE, null) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      return Math.min(Cell.asLong(a), Cell.asLong(b));
    }
  },
  MAX("MaxReduceScanOp", Long.MIN_VALUE, null) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      return Math.max(Cell.asLong(a), Cell.asLong(b));
    }
  },
  LOGICAL_AND("LogicalAndReduceScanOp", null, true) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      return asBool(a) && asBool(b);
    }
  },
  LOGICAL_OR("LogicalOrReduceScanOp", null, false) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      return asBool(a) || asBool(b);
    }
  },
  BITWISE_AND("BitwiseAndReduceScanOp", -1L, true) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      if (a instanceof Boolean) {
        return asBool(a) & asBool(b);
      }
      return Cell.asLong(a) & Cell.asLong(b);
    }
  },
  BITWISE_OR("BitwiseOrReduceScanOp", 0L, false) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      if (a instanceof Boolean) {
        return asBool(a) | asBool(b);
      }
      return Cell.asLong(a) | Cell.asLong(b);
    }
  },
  BITWISE_XOR("BitwiseXorReduceScanOp", 0L, false) {
    @Override
    protected Object apply(Object a, Object b) throws LogicException {
      if (a instanceof Boolean) {
        return asBool(a) ^ asBool(b);
      }
      return Cell.asLong(a) ^ Cell.asLong(b);
    }
  };

  private final String className;

  /** Identity over int, null if the operator does not apply to ints */
  private final Long intIdentity;

  /** Identity over bool, null if the operator does not apply to bools */
  private final Boolean boolIdentity;

  private ReduceScanOp(String className, Long intIdentity,
                       Boolean boolIdentity) {
    this.className = className;
    this.intIdentity = intIdentity;
    this.boolIdentity = boolIdentity;
  }

  public String className() {
    return className;
  }

  /**
   * @return null if no operator has this class name
   */
  public static ReduceScanOp forClassName(String className) {
    for (ReduceScanOp op: values()) {
      if (op.className.equals(className)) {
        return op;
      }
    }
    return null;
  }

  /**
   * @param elemType type of the reduced elements
   * @return result of reducing no elements
   */
  public Object identity(Type elemType) throws LogicException {
    if (elemType instanceof TupleType) {
      List<Object> result = new ArrayList<Object>();
      for (Type field: ((TupleType)elemType).getFields()) {
        result.add(identity(field));
      }
      return Collections.unmodifiableList(result);
    }
    Object identity = null;
    if (Types.INT.equals(elemType)) {
      identity = intIdentity;
    } else if (Types.BOOL.equals(elemType)) {
      identity = boolIdentity;
    }
    if (identity == null) {
      throw new LogicException(className + " has no identity for " +
                               elemType);
    }
    return identity;
  }

  protected abstract Object apply(Object a, Object b) throws LogicException;

  public Object combine(Object a, Object b) throws LogicException {
    if (a == null) {
      return b;
    } else if (b == null) {
      return a;
    } else if (a instanceof List) {
      List<?> la = (List<?>)a;
      List<?> lb = (List<?>)b;
      if (la.size() != lb.size()) {
        throw new LogicException("cannot reduce tuples of sizes " +
                                 la.size() + " and " + lb.size());
      }
      List<Object> result = new ArrayList<Object>(la.size());
      for (int i = 0; i < la.size(); i++) {
        result.add(combine(la.get(i), lb.get(i)));
      }
      return Collections.unmodifiableList(result);
    }
    return apply(a, b);
  }

  private static boolean asBool(Object v) throws LogicException {
    if (!(v instanceof Boolean)) {
      throw new LogicException("expected a bool, got " + v);
    }
    return (Boolean)v;
  }
}
