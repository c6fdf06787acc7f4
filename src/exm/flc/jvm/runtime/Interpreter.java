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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CondStmt;
import exm.flc.ast.DefExpr;
import exm.flc.ast.DeferStmt;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.NamedExpr;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.Symbol;
import exm.flc.ast.TypeSymbol;
import exm.flc.ast.VarSymbol;
import exm.flc.ast.BlockStmt.BlockTag;
import exm.flc.common.Logging;
import exm.flc.common.Settings;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.exceptions.InvalidOptionException;
import exm.flc.common.lang.Types.Type;
import exm.flc.common.lang.Types.TypeInstance;

/**
 * Runs lowered programs.  Each forall runs one task per group of values
 * its iterator produces, on a shared thread pool.  Foralls nested in a
 * task run their tasks inline.
 */
public class Interpreter {

  private static final Logger logger = Logging.getFlcLogger();

  private static final ThreadLocal<Boolean> inTask =
      new ThreadLocal<Boolean>() {
        @Override
        protected Boolean initialValue() {
          return false;
        }
      };

  private final RuntimeLibrary lib;
  private final int numTasks;
  private final ExecutorService executor;

  public Interpreter(RuntimeLibrary lib, int numTasks) {
    this.lib = lib;
    this.numTasks = numTasks;
    this.executor = Executors.newFixedThreadPool(numTasks,
        new ThreadFactoryBuilder().setNameFormat("flc-task-%d")
                                  .setDaemon(true).build());
  }

  public static Interpreter fromSettings(RuntimeLibrary lib)
                                         throws InvalidOptionException {
    long n = Settings.getLong(Settings.RUNTIME_NUM_TASKS);
    if (n < 1 || n > Integer.MAX_VALUE) {
      throw new InvalidOptionException(Settings.RUNTIME_NUM_TASKS +
                                       " must be positive, was " + n);
    }
    return new Interpreter(lib, (int)n);
  }

  public int getNumTasks() {
    return numTasks;
  }

  public void shutdown() {
    executor.shutdown();
  }

  /**
   * Run the body of fn
   * @return the frame holding fn's top-level variables
   */
  public Frame run(FnSymbol fn) throws LogicException {
    if (fn.getBody() == null) {
      throw new FlcRuntimeError(fn.getName() + " has no body");
    }
    logger.debug("running " + fn.getName());
    Frame frame = new Frame(null);
    execBlockIn(fn.getBody(), frame);
    return frame;
  }

  /**
   * Deferred actions and reductions of one executing block
   */
  private static class BlockScope {
    final List<BlockStmt> defers = new ArrayList<BlockStmt>();
    final List<TaskShadows> shadows = new ArrayList<TaskShadows>();
  }

  /**
   * Shadow variables of one task
   */
  private static class TaskShadows {
    final Frame frame;
    final Map<ShadowVarSymbol, ReduceCell> reductions =
                        new LinkedHashMap<ShadowVarSymbol, ReduceCell>();

    TaskShadows(Frame frame) {
      this.frame = frame;
    }
  }

  private void execBlock(BlockStmt block, Frame parent)
                         throws LogicException {
    if (block.getTag() == BlockTag.TYPE) {
      return;
    }
    Frame frame = block.getTag() == BlockTag.SCOPELESS ? parent :
                                                         new Frame(parent);
    execBlockIn(block, frame);
  }

  private void execBlockIn(BlockStmt block, Frame frame)
                           throws LogicException {
    BlockScope scope = new BlockScope();
    try {
      for (Expr stmt: block.getBody()) {
        execStmt(stmt, frame, scope);
      }
      for (TaskShadows ts: scope.shadows) {
        combineReductions(ts.reductions.keySet(),
                          Collections.singletonList(ts), frame);
      }
    } finally {
      for (int i = scope.defers.size() - 1; i >= 0; i--) {
        execBlock(scope.defers.get(i), frame);
      }
    }
  }

  private void execStmt(Expr stmt, Frame frame, BlockScope scope)
                        throws LogicException {
    if (stmt instanceof ForallStmt) {
      execForall((ForallStmt)stmt, frame);
    } else if (stmt instanceof ForLoop) {
      execForLoop((ForLoop)stmt, frame);
    } else if (stmt instanceof BlockStmt) {
      execBlock((BlockStmt)stmt, frame);
    } else if (stmt instanceof CondStmt) {
      CondStmt cond = (CondStmt)stmt;
      Object test = eval(cond.condExpr(), frame);
      if (!(test instanceof Boolean)) {
        throw new LogicException("condition is not a bool: " + test);
      }
      if ((Boolean)test) {
        execBlock(cond.thenStmt(), frame);
      } else if (cond.elseStmt() != null) {
        execBlock(cond.elseStmt(), frame);
      }
    } else if (stmt instanceof DeferStmt) {
      scope.defers.add(((DeferStmt)stmt).body());
    } else if (stmt instanceof DefExpr) {
      execDef((DefExpr)stmt, frame, scope);
    } else {
      eval(stmt, frame);
    }
  }

  private void execDef(DefExpr def, Frame frame, BlockScope scope)
                       throws LogicException {
    Symbol sym = def.getSymbol();
    if (sym.hasFlag(Flag.TYPE_VARIABLE)) {
      return;
    }
    if (sym instanceof ShadowVarSymbol) {
      // Outside a forall: the loop was made serial, so one task
      TaskShadows ts = new TaskShadows(frame);
      setupShadow((ShadowVarSymbol)sym, ts);
      scope.shadows.add(ts);
      return;
    }
    Object value = def.getInit() == null ? null : eval(def.getInit(), frame);
    frame.define(sym, value);
  }

  private void execForLoop(ForLoop loop, Frame frame)
                           throws LogicException {
    Object iter = frame.get(loop.iteratorGet().symbol());
    if (!(iter instanceof IterHandle)) {
      throw new FlcRuntimeError("loop over " + iter + ", not an iterator");
    }
    IterHandle handle = (IterHandle)iter;
    Symbol index = loop.indexGet().symbol();
    while (handle.hasNext()) {
      Frame iterFrame = new Frame(frame);
      iterFrame.define(index, handle.next());
      execBlockIn(loop, iterFrame);
    }
  }

  private void execForall(final ForallStmt fs, Frame frame)
                          throws LogicException {
    if (fs.numIteratedExprs() != 1 ||
        !(fs.firstIteratedExpr() instanceof CallExpr)) {
      throw new FlcRuntimeError("forall " + fs.id() + " was not lowered");
    }
    CallExpr iterCall = (CallExpr)fs.firstIteratedExpr();
    FnSymbol fn = iterCall.resolvedFunction();
    if (fn == null) {
      throw new FlcRuntimeError("forall " + fs.id() +
                                " iterates an unresolved call");
    }
    List<List<Object>> groups = lib.iterator(fn).iterate(
                                      evalActuals(iterCall, frame), numTasks);
    final VarSymbol idx = fs.parIdxVar();
    logger.trace("forall " + fs.id() + " over " + fn.getName() + ": " +
                 groups.size() + " tasks");

    List<TaskShadows> perTask = new ArrayList<TaskShadows>();
    List<Callable<Void>> tasks = new ArrayList<Callable<Void>>();
    for (final List<Object> group: groups) {
      final TaskShadows ts = new TaskShadows(new Frame(frame));
      for (ShadowVarSymbol svar: fs.shadowVarSymbols()) {
        setupShadow(svar, ts);
      }
      perTask.add(ts);
      tasks.add(new Callable<Void>() {
        @Override
        public Void call() throws LogicException {
          for (Object value: group) {
            Frame iterFrame = new Frame(ts.frame);
            iterFrame.define(idx, value);
            execBlock(fs.loopBody(), iterFrame);
          }
          return null;
        }
      });
    }
    runAll(tasks);
    combineReductions(fs.shadowVarSymbols(), perTask, frame);
  }

  /**
   * Run all tasks to completion, then report the first failure
   */
  private void runAll(List<Callable<Void>> tasks) throws LogicException {
    LogicException firstError = null;
    if (inTask.get() || tasks.size() <= 1) {
      for (Callable<Void> task: tasks) {
        try {
          task.call();
        } catch (LogicException e) {
          if (firstError == null) {
            firstError = e;
          }
        } catch (RuntimeException e) {
          throw e;
        } catch (Exception e) {
          throw new FlcRuntimeError("Unexpected task failure", e);
        }
      }
    } else {
      List<Callable<Void>> wrapped = new ArrayList<Callable<Void>>();
      for (final Callable<Void> task: tasks) {
        wrapped.add(new Callable<Void>() {
          @Override
          public Void call() throws Exception {
            inTask.set(true);
            return task.call();
          }
        });
      }
      List<Future<Void>> futures;
      try {
        futures = executor.invokeAll(wrapped);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new LogicException("interrupted while waiting for tasks", e);
      }
      for (Future<Void> f: futures) {
        try {
          f.get();
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof LogicException) {
            if (firstError == null) {
              firstError = (LogicException)cause;
            }
          } else if (cause instanceof RuntimeException) {
            throw (RuntimeException)cause;
          } else if (cause instanceof Error) {
            throw (Error)cause;
          } else {
            throw new FlcRuntimeError("Unexpected task failure", cause);
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new LogicException("interrupted while waiting for tasks", e);
        }
      }
    }
    if (firstError != null) {
      throw firstError;
    }
  }

  private void setupShadow(ShadowVarSymbol svar, TaskShadows ts)
                           throws LogicException {
    Frame taskFrame = ts.frame;
    switch (svar.intent()) {
      case TASK_PRIVATE: {
        Expr init = svar.getDefPoint().getInit();
        if (svar.hasFlag(Flag.REF_VAR) && init instanceof SymExpr) {
          taskFrame.bind(svar, taskFrame.lookup(((SymExpr)init).symbol()));
        } else {
          taskFrame.define(svar, init == null ? null :
                                 eval(init, taskFrame));
        }
        break;
      }
      case REF:
      case CONST_REF:
        taskFrame.bind(svar, taskFrame.lookup(outerVar(svar)));
        break;
      case REDUCE: {
        ReduceCell cell = new ReduceCell(reduceOp(svar));
        taskFrame.bind(svar, cell);
        ts.reductions.put(svar, cell);
        break;
      }
      case REDUCE_OP:
      case PARENT_REDUCE_AS:
      case PARENT_REDUCE_OP:
        break;
      default:
        taskFrame.define(svar, taskFrame.get(outerVar(svar)));
        break;
    }
  }

  private static Symbol outerVar(ShadowVarSymbol svar) {
    if (svar.getOuterVar() == null) {
      throw new FlcRuntimeError("shadow variable " + svar.getName() +
                                " has no outer variable");
    }
    return svar.getOuterVar();
  }

  private static ReduceScanOp reduceOp(ShadowVarSymbol svar) {
    Expr opExpr = svar.getReduceOpExpr();
    if (opExpr instanceof CallExpr &&
        ((CallExpr)opExpr).getBaseSymbol() instanceof TypeSymbol) {
      String className = ((CallExpr)opExpr).getBaseSymbol().getName();
      ReduceScanOp op = ReduceScanOp.forClassName(className);
      if (op != null) {
        return op;
      }
    }
    throw new FlcRuntimeError("no reduce operator for " + svar.getName() +
                              ": " + opExpr);
  }

  /**
   * Fold the tasks' accumulators, in task order, into the outer
   * variables.  An outer variable left without a value gets the
   * operator's identity.
   */
  private void combineReductions(Collection<ShadowVarSymbol> svars,
              List<TaskShadows> tasks, Frame outerFrame)
              throws LogicException {
    for (ShadowVarSymbol svar: svars) {
      if (!svar.isReduce()) {
        continue;
      }
      ReduceScanOp op = reduceOp(svar);
      Object combined = null;
      for (TaskShadows ts: tasks) {
        combined = op.combine(combined, ts.reductions.get(svar).get());
      }
      Cell outer = outerFrame.lookup(outerVar(svar));
      synchronized (outer) {
        Object result = op.combine(outer.get(), combined);
        if (result == null) {
          result = op.identity(reduceElemType(svar));
        }
        outer.set(result);
      }
    }
  }

  private static Type reduceElemType(ShadowVarSymbol svar) {
    Type t = ((CallExpr)svar.getReduceOpExpr()).getCallType();
    if (!(t instanceof TypeInstance)) {
      throw new FlcRuntimeError("reduce operator of " + svar.getName() +
                                " was not instantiated: " + t);
    }
    return ((TypeInstance)t).getArg();
  }

  private List<Object> evalActuals(CallExpr call, Frame frame)
                                   throws LogicException {
    List<Object> args = new ArrayList<Object>();
    for (Expr actual: call.actuals()) {
      if (actual instanceof NamedExpr) {
        // tag arguments only select the overload
        continue;
      }
      args.add(eval(actual, frame));
    }
    return args;
  }

  Object eval(Expr e, Frame frame) throws LogicException {
    if (e instanceof SymExpr) {
      Symbol sym = ((SymExpr)e).symbol();
      if (sym instanceof VarSymbol && ((VarSymbol)sym).isImmediate()) {
        return ((VarSymbol)sym).getImmediate();
      } else if (sym instanceof TypeSymbol || sym instanceof FnSymbol) {
        return sym;
      }
      return frame.get(sym);
    } else if (e instanceof NamedExpr) {
      return eval(((NamedExpr)e).getActual(), frame);
    } else if (e instanceof CallExpr) {
      return evalCall((CallExpr)e, frame);
    }
    throw new FlcRuntimeError("cannot evaluate " + e);
  }

  private Object evalCall(CallExpr call, Frame frame) throws LogicException {
    if (!call.isPrimitive()) {
      FnSymbol fn = call.resolvedFunction();
      if (fn == null) {
        throw new FlcRuntimeError("unresolved call " + call.getName());
      }
      List<Object> args = evalActuals(call, frame);
      if (fn.isIterator()) {
        return new IterRecord(fn, args);
      }
      return lib.function(fn).call(args);
    }

    switch (call.getPrim()) {
      case MOVE: {
        Symbol lhs = ((SymExpr)call.actual(0)).symbol();
        if (lhs.hasFlag(Flag.TYPE_VARIABLE)) {
          return null;
        }
        Object value = eval(call.actual(1), frame);
        frame.lookup(lhs).set(value);
        return null;
      }
      case ZIP:
      case BUILD_TUPLE:
        return Collections.unmodifiableList(evalActuals(call, frame));
      case TUPLE_GET: {
        List<?> tuple = RuntimeLibrary.tuple(eval(call.actual(0), frame));
        long k = Cell.asLong(eval(call.actual(1), frame));
        if (k < 1 || k > tuple.size()) {
          throw new LogicException("tuple index " + k + " out of bounds");
        }
        return tuple.get((int)k - 1);
      }
      case NOOP:
        return null;
      case REDUCE_ASSIGN: {
        Cell cell = frame.lookup(((SymExpr)call.actual(0)).symbol());
        if (!(cell instanceof ReduceCell)) {
          throw new FlcRuntimeError("reduce into a non-reduce variable: " +
                                    call);
        }
        ((ReduceCell)cell).accumulate(eval(call.actual(1), frame));
        return null;
      }
      case ADD_ASSIGN: {
        Cell cell = frame.lookup(((SymExpr)call.actual(0)).symbol());
        cell.add(eval(call.actual(1), frame));
        return null;
      }
      case THROW:
        throw new LogicException(String.valueOf(eval(call.actual(0), frame)));
      default:
        throw new FlcRuntimeError("cannot execute primitive " +
                                  call.getPrim());
    }
  }
}
