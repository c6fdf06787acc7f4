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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import exm.flc.ast.ArgSymbol;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ReturnTypeRule;
import exm.flc.ast.TypeSymbol;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.NamedType;
import exm.flc.common.lang.Types.Type;
import exm.flc.frontend.GlobalContext;
import exm.flc.frontend.LibraryEntryPoints;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;

/**
 * Standard library of the reference runtime: declares range and list
 * iteration to the front end and implements them, along with the entry
 * points the lowering calls.
 */
public class RuntimeLibrary {

  public static final Type LIST = new NamedType("list", true);

  public static final String BUILD_RANGE = "chpl_build_bounded_range";
  public static final String BUILD_LIST = "chpl_build_list";

  private static final QualifiedType CONST_INT =
                  new QualifiedType(Types.INT, Qualifier.CONST_VAL);

  private final GlobalContext globals;
  private final Map<FnSymbol, NativeFn> functions =
                    new HashMap<FnSymbol, NativeFn>();
  private final Map<FnSymbol, NativeIterator> iterators =
                    new HashMap<FnSymbol, NativeIterator>();

  private final AtomicInteger liveHandles = new AtomicInteger(0);
  private final AtomicInteger fastFollows = new AtomicInteger(0);
  private final AtomicInteger generalFollows = new AtomicInteger(0);

  private RuntimeLibrary(GlobalContext globals) {
    this.globals = globals;
  }

  /**
   * Declare the library in globals and bind its implementation
   */
  public static RuntimeLibrary install(GlobalContext globals) {
    RuntimeLibrary lib = new RuntimeLibrary(globals);
    globals.defineType(new TypeSymbol("list", LIST));
    lib.declareRanges();
    lib.declareLists();
    lib.bindEntryPoints();
    return lib;
  }

  public GlobalContext getGlobals() {
    return globals;
  }

  public void defineFunction(FnSymbol fn, NativeFn impl) {
    globals.defineFunction(fn);
    functions.put(fn, impl);
  }

  public void defineIterator(FnSymbol fn, NativeIterator impl) {
    if (!fn.isIterator()) {
      throw new FlcRuntimeError(fn.getName() + " is not an iterator");
    }
    globals.defineFunction(fn);
    iterators.put(fn, impl);
  }

  public NativeFn function(FnSymbol fn) {
    NativeFn impl = functions.get(fn);
    if (impl == null) {
      throw new FlcRuntimeError("No implementation of function " +
                                fn.getName());
    }
    return impl;
  }

  public NativeIterator iterator(FnSymbol fn) {
    NativeIterator impl = iterators.get(fn);
    if (impl == null) {
      throw new FlcRuntimeError("No implementation of iterator " +
                                fn.getName());
    }
    return impl;
  }

  /**
   * @param serial iterator producing the records to follow
   */
  public NativeIterator follower(FnSymbol serial) {
    FnSymbol follower = globals.findFollower(serial.getRetType());
    if (follower == null) {
      throw new FlcRuntimeError("No follower for " + serial.getName());
    }
    return iterator(follower);
  }

  public int liveHandles() {
    return liveHandles.get();
  }

  public int fastFollows() {
    return fastFollows.get();
  }

  public int generalFollows() {
    return generalFollows.get();
  }

  void handleOpened() {
    liveHandles.incrementAndGet();
  }

  void handleFreed() {
    liveHandles.decrementAndGet();
  }

  void noteFollow(boolean fast) {
    if (fast) {
      fastFollows.incrementAndGet();
    } else {
      generalFollows.incrementAndGet();
    }
  }

  static Iterand iterand(Object v) throws LogicException {
    if (!(v instanceof Iterand)) {
      throw new LogicException("cannot iterate over " + v);
    }
    return (Iterand)v;
  }

  static List<?> tuple(Object v) throws LogicException {
    if (!(v instanceof List)) {
      throw new LogicException("expected a tuple, got " + v);
    }
    return (List<?>)v;
  }

  private static RangeValue range(Object v) throws LogicException {
    if (!(v instanceof RangeValue)) {
      throw new LogicException("expected a range, got " + v);
    }
    return (RangeValue)v;
  }

  private static List<List<Object>> oneGroup(List<Object> values) {
    return Collections.singletonList(values);
  }

  private static List<ArgSymbol> formals(Object ...namesAndTypes) {
    List<ArgSymbol> result = new ArrayList<ArgSymbol>();
    for (int i = 0; i < namesAndTypes.length; i += 2) {
      result.add(new ArgSymbol((String)namesAndTypes[i],
                               (Type)namesAndTypes[i + 1]));
    }
    return result;
  }

  private void declareRanges() {
    String these = LibraryEntryPoints.ELEMENTS_OF_NAME;
    defineFunction(FnSymbol.function(BUILD_RANGE,
        formals("lo", Types.INT, "hi", Types.INT), Types.RANGE),
        new NativeFn() {
          @Override
          public Object call(List<Object> args) throws LogicException {
            return new RangeValue(Cell.asLong(args.get(0)),
                                  Cell.asLong(args.get(1)));
          }
        });

    defineIterator(FnSymbol.iterator(these, formals("r", Types.RANGE),
        null, CONST_INT), new NativeIterator() {
          @Override
          public List<List<Object>> iterate(List<Object> args, int numTasks)
                                            throws LogicException {
            return oneGroup(range(args.get(0)).serial(RuntimeLibrary.this));
          }
        });

    defineIterator(FnSymbol.iterator(these, formals("r", Types.RANGE),
        IterKind.STANDALONE, CONST_INT), new NativeIterator() {
          @Override
          public List<List<Object>> iterate(List<Object> args, int numTasks)
                                            throws LogicException {
            List<List<Object>> chunks = new ArrayList<List<Object>>();
            for (RangeValue chunk: range(args.get(0)).split(numTasks, false)) {
              chunks.add(chunk.serial(RuntimeLibrary.this));
            }
            return chunks;
          }
        });

    defineIterator(FnSymbol.iterator(these, formals("r", Types.RANGE),
        IterKind.LEADER, new QualifiedType(Types.RANGE, Qualifier.CONST_VAL)),
        new NativeIterator() {
          @Override
          public List<List<Object>> iterate(List<Object> args, int numTasks)
                                            throws LogicException {
            List<List<Object>> descriptors = new ArrayList<List<Object>>();
            for (RangeValue d: range(args.get(0)).split(numTasks, true)) {
              descriptors.add(Collections.<Object>singletonList(d));
            }
            return descriptors;
          }
        });

    defineIterator(FnSymbol.iterator(these, formals("r", Types.RANGE),
        IterKind.FOLLOWER, CONST_INT), new NativeIterator() {
          @Override
          public List<List<Object>> iterate(List<Object> args, int numTasks)
                                            throws LogicException {
            return oneGroup(range(args.get(0)).follow(RuntimeLibrary.this,
                range(args.get(1)), (Boolean)args.get(2)));
          }
        });
  }

  private void declareLists() {
    defineFunction(FnSymbol.libraryVariadic(BUILD_LIST, new ReturnTypeRule() {
          @Override
          public Type returnType(List<Type> actualTypes) {
            return LIST;
          }
        }), new NativeFn() {
          @Override
          public Object call(List<Object> args) {
            return new ListValue(args);
          }
        });

    defineIterator(FnSymbol.iterator(LibraryEntryPoints.ELEMENTS_OF_NAME,
        formals("l", LIST), null, CONST_INT), new NativeIterator() {
          @Override
          public List<List<Object>> iterate(List<Object> args, int numTasks)
                                            throws LogicException {
            return oneGroup(iterand(args.get(0)).serial(RuntimeLibrary.this));
          }
        });
  }

  private void bindEntryPoints() {
    LibraryEntryPoints entryPoints = globals.getEntryPoints();
    for (final LibraryOp op: Arrays.asList(LibraryOp.TO_FOLLOWER,
                                    LibraryOp.TO_FAST_FOLLOWER)) {
      functions.put(entryPoints.get(op), new NativeFn() {
        @Override
        public Object call(List<Object> args) throws LogicException {
          return new FollowerRecord(iterand(args.get(0)),
              range(args.get(1)), op == LibraryOp.TO_FAST_FOLLOWER);
        }
      });
    }
    for (final LibraryOp op: Arrays.asList(LibraryOp.TO_FOLLOWER_ZIP,
                                    LibraryOp.TO_FAST_FOLLOWER_ZIP)) {
      functions.put(entryPoints.get(op), new NativeFn() {
        @Override
        public Object call(List<Object> args) throws LogicException {
          List<Object> followers = new ArrayList<Object>();
          for (Object iterable: tuple(args.get(0))) {
            followers.add(new FollowerRecord(iterand(iterable),
                range(args.get(1)), op == LibraryOp.TO_FAST_FOLLOWER_ZIP));
          }
          return Collections.unmodifiableList(followers);
        }
      });
    }

    functions.put(entryPoints.get(LibraryOp.GET_ITERATOR), new NativeFn() {
      @Override
      public Object call(List<Object> args) throws LogicException {
        return new IterHandle(RuntimeLibrary.this,
                      iterand(args.get(0)).serial(RuntimeLibrary.this));
      }
    });
    functions.put(entryPoints.get(LibraryOp.GET_ITERATOR_ZIP), new NativeFn() {
      @Override
      public Object call(List<Object> args) throws LogicException {
        return new IterHandle(RuntimeLibrary.this, zipValues(args.get(0)));
      }
    });
    functions.put(entryPoints.get(LibraryOp.FREE_ITERATOR), new NativeFn() {
      @Override
      public Object call(List<Object> args) throws LogicException {
        if (!(args.get(0) instanceof IterHandle)) {
          throw new LogicException("not an iterator: " + args.get(0));
        }
        ((IterHandle)args.get(0)).free();
        return null;
      }
    });

    NativeFn staticCheck = new NativeFn() {
      @Override
      public Object call(List<Object> args) throws LogicException {
        for (Object iterable: components(args.get(0))) {
          if (!(iterable instanceof Iterand) ||
              !((Iterand)iterable).canFastFollow()) {
            return false;
          }
        }
        return true;
      }
    };
    functions.put(entryPoints.get(LibraryOp.STATIC_FAST_FOLLOW_CHECK),
                  staticCheck);
    functions.put(entryPoints.get(LibraryOp.STATIC_FAST_FOLLOW_CHECK_ZIP),
                  staticCheck);

    NativeFn dynamicCheck = new NativeFn() {
      @Override
      public Object call(List<Object> args) throws LogicException {
        long size = -1;
        for (Object iterable: components(args.get(0))) {
          Iterand it = iterand(iterable);
          if (!it.canFastFollow() || it.size() < 0 ||
              (size >= 0 && it.size() != size)) {
            return false;
          }
          size = it.size();
        }
        return true;
      }
    };
    functions.put(entryPoints.get(LibraryOp.DYNAMIC_FAST_FOLLOW_CHECK),
                  dynamicCheck);
    functions.put(entryPoints.get(LibraryOp.DYNAMIC_FAST_FOLLOW_CHECK_ZIP),
                  dynamicCheck);

    iterators.put(entryPoints.get(LibraryOp.TRIVIAL_LEADER),
        new NativeIterator() {
          @Override
          public List<List<Object>> iterate(List<Object> args,
                                            int numTasks) {
            return oneGroup(Collections.<Object>singletonList(0L));
          }
        });
  }

  /**
   * @return the components of a tuple, or v itself
   */
  private static List<?> components(Object v) {
    if (v instanceof List) {
      return (List<?>)v;
    }
    return Collections.singletonList(v);
  }

  private List<Object> zipValues(Object iterables) throws LogicException {
    List<List<Object>> columns = new ArrayList<List<Object>>();
    for (Object iterable: tuple(iterables)) {
      columns.add(iterand(iterable).serial(this));
    }
    int length = columns.isEmpty() ? 0 : columns.get(0).size();
    for (List<Object> column: columns) {
      if (column.size() != length) {
        throw new LogicException("zippered iterands have different " +
                                 "lengths: " + length + " and " + column.size());
      }
    }
    List<Object> result = new ArrayList<Object>(length);
    for (int i = 0; i < length; i++) {
      List<Object> row = new ArrayList<Object>(columns.size());
      for (List<Object> column: columns) {
        row.add(column.get(i));
      }
      result.add(Collections.unmodifiableList(row));
    }
    return result;
  }
}
