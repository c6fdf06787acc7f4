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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.flc.ast.FnSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;

/**
 * Types seen by the forall lowering pass.  Only the structure needed to
 * pick iterators and type index variables is modelled.
 */
public class Types {

  public static enum StructureType {
    PRIMITIVE,
    NAMED,
    TUPLE,
    ITERATOR_RECORD,
    ITERATOR_CLASS,
    TYPE_INSTANCE,
  }

  public abstract static class Type {

    public abstract StructureType structureType();

    /** Prints out a description of type for user */
    @Override
    public abstract String toString();

    /** Print out a short unique name for type */
    public abstract String typeName();

    /** equals is required */
    @Override
    public abstract boolean equals(Object o);

    /** hashcode is required */
    @Override
    public abstract int hashCode();

    /**
     * Whether values of this type are aggregates: a default forall intent
     * passes them by const reference rather than by const value.
     */
    public boolean isAggregate() {
      return false;
    }

    public Type yieldType() {
      throw new FlcRuntimeError("yieldType() not implemented " +
                                "for class " + getClass().getName());
    }
  }

  /**
   * Built-in scalar type, identified by name
   */
  public static class PrimType extends Type {
    private final String name;

    private PrimType(String name) {
      this.name = name;
    }

    @Override
    public StructureType structureType() {
      return StructureType.PRIMITIVE;
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof PrimType && ((PrimType)o).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /**
   * Record or class type provided by a library, e.g. range or list.
   */
  public static class NamedType extends Type {
    private final String name;
    private final boolean aggregate;

    public NamedType(String name, boolean aggregate) {
      this.name = name;
      this.aggregate = aggregate;
    }

    public String getName() {
      return name;
    }

    @Override
    public boolean isAggregate() {
      return aggregate;
    }

    @Override
    public StructureType structureType() {
      return StructureType.NAMED;
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof NamedType)) {
        return false;
      }
      NamedType other = (NamedType)o;
      return other.name.equals(name) && other.aggregate == aggregate;
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 7 + (aggregate ? 1 : 0);
    }
  }

  public static class TupleType extends Type {
    private final List<Type> fields;

    private TupleType(ArrayList<Type> fields) {
      this.fields = Collections.unmodifiableList(fields);
    }

    public List<Type> getFields() {
      return fields;
    }

    public int numFields() {
      return fields.size();
    }

    /**
     * @param i 1-based component number
     */
    public Type getField(int i) {
      return fields.get(i - 1);
    }

    public static TupleType makeTuple(List<Type> fields) {
      return new TupleType(new ArrayList<Type>(fields));
    }

    public static TupleType makeTuple(Type ...fields) {
      return makeTuple(Arrays.asList(fields));
    }

    @Override
    public boolean isAggregate() {
      return true;
    }

    @Override
    public StructureType structureType() {
      return StructureType.TUPLE;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("(");
      boolean first = true;
      for (Type field: fields) {
        if (first) {
          first = false;
        } else {
          sb.append(", ");
        }
        sb.append(field.toString());
      }
      sb.append(")");
      return sb.toString();
    }

    @Override
    public String typeName() {
      return toString();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof TupleType && ((TupleType)o).fields.equals(fields);
    }

    @Override
    public int hashCode() {
      return fields.hashCode();
    }
  }

  /**
   * The value produced by calling an iterator, before iteration begins.
   */
  public static class IteratorRecordType extends Type {
    private final FnSymbol iterator;

    public IteratorRecordType(FnSymbol iterator) {
      this.iterator = iterator;
    }

    /**
     * @return the iterator function whose call produced this record
     */
    public FnSymbol getIterator() {
      return iterator;
    }

    @Override
    public Type yieldType() {
      QualifiedType yt = iterator.getYieldType();
      return yt == null ? UNKNOWN : yt.type();
    }

    @Override
    public boolean isAggregate() {
      return true;
    }

    @Override
    public StructureType structureType() {
      return StructureType.ITERATOR_RECORD;
    }

    @Override
    public String toString() {
      return "_ir_" + iterator.getName();
    }

    @Override
    public String typeName() {
      return toString();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof IteratorRecordType &&
             ((IteratorRecordType)o).iterator == iterator;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(iterator);
    }
  }

  /**
   * A stateful iterator handle obtained from an iterator record.
   */
  public static class IteratorClassType extends Type {
    private final Type yieldType;

    public IteratorClassType(Type yieldType) {
      this.yieldType = yieldType;
    }

    @Override
    public Type yieldType() {
      return yieldType;
    }

    @Override
    public boolean isAggregate() {
      return true;
    }

    @Override
    public StructureType structureType() {
      return StructureType.ITERATOR_CLASS;
    }

    @Override
    public String toString() {
      return "_ic(" + yieldType + ")";
    }

    @Override
    public String typeName() {
      return toString();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof IteratorClassType &&
             ((IteratorClassType)o).yieldType.equals(yieldType);
    }

    @Override
    public int hashCode() {
      return yieldType.hashCode() * 31 + 3;
    }
  }

  /**
   * A generic class instantiated over one type, e.g. a reduce operator
   * class instantiated over the element type it reduces.
   */
  public static class TypeInstance extends Type {
    private final String className;
    private final Type arg;

    public TypeInstance(String className, Type arg) {
      this.className = className;
      this.arg = arg;
    }

    public String getClassName() {
      return className;
    }

    public Type getArg() {
      return arg;
    }

    @Override
    public boolean isAggregate() {
      return true;
    }

    @Override
    public StructureType structureType() {
      return StructureType.TYPE_INSTANCE;
    }

    @Override
    public String toString() {
      return className + "(" + arg + ")";
    }

    @Override
    public String typeName() {
      return toString();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof TypeInstance)) {
        return false;
      }
      TypeInstance other = (TypeInstance)o;
      return other.className.equals(className) && other.arg.equals(arg);
    }

    @Override
    public int hashCode() {
      return className.hashCode() * 31 + arg.hashCode();
    }
  }

  public static boolean isIteratorRecord(Type t) {
    return t != null && t.structureType() == StructureType.ITERATOR_RECORD;
  }

  public static final Type INT = new PrimType("int");
  public static final Type BOOL = new PrimType("bool");
  public static final Type VOID = new PrimType("void");
  public static final Type UNKNOWN = new PrimType("unknown");
  public static final Type RANGE = new NamedType("range", false);
  public static final Type ITER_KIND = new NamedType("iterKind", false);
}
