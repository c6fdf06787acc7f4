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
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import exm.flc.ast.FnSymbol;
import exm.flc.ast.Flag;
import exm.flc.ast.Symbol;
import exm.flc.ast.TypeSymbol;
import exm.flc.ast.VarSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.IteratorClassType;
import exm.flc.common.lang.Types.IteratorRecordType;
import exm.flc.common.lang.Types.NamedType;
import exm.flc.common.lang.Types.TupleType;
import exm.flc.common.lang.Types.Type;

/**
 * Global context for entire program: functions, types, the iteration
 * tags and the library entry points.
 */
public class GlobalContext {

  /**
   * Reduce operator spelling to the class implementing it
   */
  public static final Map<String, String> REDUCE_OP_CLASSES =
      ImmutableMap.<String, String>builder()
        .put("+", "SumReduceScanOp")
        .put("*", "ProductReduceScanOp")
        .put("min", "MinReduceScanOp")
        .put("max", "MaxReduceScanOp")
        .put("&&", "LogicalAndReduceScanOp")
        .put("||", "LogicalOrReduceScanOp")
        .put("&", "BitwiseAndReduceScanOp")
        .put("|", "BitwiseOrReduceScanOp")
        .put("^", "BitwiseXorReduceScanOp")
        .build();

  private final String inputFile;
  private final Logger logger;

  private final ListMultimap<String, FnSymbol> functions =
                                    ArrayListMultimap.create();

  private final Map<String, TypeSymbol> types =
                                    new HashMap<String, TypeSymbol>();

  private final Map<Type, TypeSymbol> typeSymbols =
                                    new HashMap<Type, TypeSymbol>();

  private final Map<IterKind, VarSymbol> tags =
                    new EnumMap<IterKind, VarSymbol>(IterKind.class);

  private final LibraryEntryPoints entryPoints;

  public GlobalContext(String inputFile, Logger logger) {
    this.inputFile = inputFile;
    this.logger = logger;

    for (IterKind kind: IterKind.values()) {
      VarSymbol tag = new VarSymbol(kind.tagName(), Types.ITER_KIND, kind);
      tag.addFlag(Flag.CONST);
      tags.put(kind, tag);
    }

    defineType(new TypeSymbol("int", Types.INT));
    defineType(new TypeSymbol("bool", Types.BOOL));
    defineType(new TypeSymbol("range", Types.RANGE));
    defineType(new TypeSymbol("iterKind", Types.ITER_KIND));
    for (String className: REDUCE_OP_CLASSES.values()) {
      TypeSymbol op = new TypeSymbol(className,
                                     new NamedType(className, true));
      op.addFlag(Flag.REDUCE_SCAN_OP);
      defineType(op);
    }

    this.entryPoints = new LibraryEntryPoints(this);
    entryPoints.declare();
  }

  public String getInputFile() {
    return inputFile;
  }

  public Logger getLogger() {
    return logger;
  }

  public LibraryEntryPoints getEntryPoints() {
    return entryPoints;
  }

  public void defineFunction(FnSymbol fn) {
    if (functions.containsEntry(fn.getName(), fn)) {
      throw new FlcRuntimeError("Function defined twice: " + fn.getName());
    }
    functions.put(fn.getName(), fn);
  }

  /**
   * @return overloads with this name, in definition order
   */
  public List<FnSymbol> lookupFunctions(String name) {
    return Collections.unmodifiableList(functions.get(name));
  }

  public List<FnSymbol> allFunctions() {
    return new ArrayList<FnSymbol>(functions.values());
  }

  public void defineType(TypeSymbol ts) {
    if (types.containsKey(ts.getName())) {
      throw new FlcRuntimeError("Type defined twice: " + ts.getName());
    }
    types.put(ts.getName(), ts);
    typeSymbols.put(ts.getType(), ts);
  }

  public TypeSymbol lookupType(String name) {
    return types.get(name);
  }

  /**
   * @return the type symbol naming t, null if t has no name
   */
  public TypeSymbol findTypeSymbol(Type t) {
    return typeSymbols.get(t);
  }

  /**
   * @return a type symbol naming t, created if necessary
   */
  public TypeSymbol typeSymbolFor(Type t) {
    TypeSymbol ts = typeSymbols.get(t);
    if (ts == null) {
      ts = new TypeSymbol(t.typeName(), t);
      typeSymbols.put(t, ts);
    }
    return ts;
  }

  /**
   * @return class implementing a reduce operator, null if unknown
   */
  public TypeSymbol reduceOpClass(String spelling) {
    String className = REDUCE_OP_CLASSES.get(spelling);
    return className == null ? null : types.get(className);
  }

  public VarSymbol tagSymbol(IterKind kind) {
    return tags.get(kind);
  }

  /**
   * @return kind selected by a tag symbol, null if sym is not a tag
   */
  public IterKind iterKindOf(Symbol sym) {
    for (Map.Entry<IterKind, VarSymbol> e: tags.entrySet()) {
      if (e.getValue() == sym) {
        return e.getKey();
      }
    }
    return null;
  }

  public IteratorGroup iteratorGroup(FnSymbol serial) {
    IteratorGroup group = serial.getIteratorGroup();
    if (group == null) {
      group = IteratorGroup.build(this, serial, logger);
      serial.setIteratorGroup(group);
    }
    return group;
  }

  /**
   * Type of the values a serial loop over a value of type t binds
   * @return null if t cannot be iterated serially
   */
  public Type serialYieldType(Type t) {
    if (t instanceof IteratorRecordType || t instanceof IteratorClassType) {
      Type yt = t.yieldType();
      return yt == Types.UNKNOWN ? null : yt;
    } else if (t instanceof TupleType) {
      List<Type> fields = new ArrayList<Type>();
      for (Type field: ((TupleType)t).getFields()) {
        Type yt = serialYieldType(field);
        if (yt == null) {
          return null;
        }
        fields.add(yt);
      }
      return TupleType.makeTuple(fields);
    }
    FnSymbol these = findOverload(LibraryEntryPoints.ELEMENTS_OF_NAME,
                                  null, t);
    if (these == null) {
      return null;
    }
    Type ret = these.getRetType();
    return ret instanceof IteratorRecordType ? serialYieldType(ret) : null;
  }

  /**
   * @return follower iterator for a value of type t, null if none
   */
  public FnSymbol findFollower(Type t) {
    if (t instanceof IteratorRecordType) {
      FnSymbol serial = ((IteratorRecordType)t).getIterator();
      for (FnSymbol fn: functions.get(serial.getName())) {
        if (fn.getIterKind() == IterKind.FOLLOWER && fn.isIterator() &&
            IteratorGroup.sameFormals(fn, serial)) {
          return fn;
        }
      }
      return null;
    }
    return findOverload(LibraryEntryPoints.ELEMENTS_OF_NAME,
                        IterKind.FOLLOWER, t);
  }

  private FnSymbol findOverload(String name, IterKind kind, Type argType) {
    for (FnSymbol fn: functions.get(name)) {
      if (fn.getIterKind() != kind || fn.numFormals() != 1) {
        continue;
      }
      if (fn.getFormal(0).isGeneric() ||
          fn.getFormal(0).getType().equals(argType)) {
        return fn;
      }
    }
    return null;
  }
}
