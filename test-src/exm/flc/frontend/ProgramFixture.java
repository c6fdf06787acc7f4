package exm.flc.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.flc.ast.ArgSymbol;
import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.FilePosition;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.UnresolvedSymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.ShadowVarPrefix;
import exm.flc.common.lang.Types;
import exm.flc.frontend.typecheck.OverloadResolver;
import exm.flc.jvm.runtime.Frame;
import exm.flc.jvm.runtime.Interpreter;
import exm.flc.jvm.runtime.LogicException;
import exm.flc.jvm.runtime.NativeIterator;
import exm.flc.jvm.runtime.RangeValue;
import exm.flc.jvm.runtime.RuntimeLibrary;

/**
 * Builds small programs around a "main" function for the lowering and
 * runtime tests.
 */
public class ProgramFixture {
  public static final String COUNT = "count";

  private static final QualifiedType CONST_INT =
                  new QualifiedType(Types.INT, Qualifier.CONST_VAL);

  public final Logger logger = Logging.getFlcLogger();
  public final GlobalContext globals;
  public final RuntimeLibrary lib;
  public final Diagnostics diag;
  public final FnSymbol main;
  public final BlockStmt body;

  private int line = 1;

  public ProgramFixture(String name) {
    globals = new GlobalContext(name + ".flc", logger);
    lib = RuntimeLibrary.install(globals);
    diag = new Diagnostics(logger);
    body = new BlockStmt();
    main = FnSymbol.function("main", new ArrayList<ArgSymbol>(), Types.VOID);
    main.setBody(body);
    globals.defineFunction(main);
  }

  public LoweringContext context(boolean noFastFollowers) {
    return new LoweringContext(globals, new OverloadResolver(globals, diag),
        new CallTempNormalizer(), diag, noFastFollowers, true);
  }

  public void compile() throws UserException {
    compile(false);
  }

  public void compile(boolean noFastFollowers) throws UserException {
    new ForallPass(context(noFastFollowers)).resolveProgram();
  }

  public Frame run(int numTasks) throws LogicException {
    Interpreter interp = new Interpreter(lib, numTasks);
    try {
      return interp.run(main);
    } finally {
      interp.shutdown();
    }
  }

  /**
   * Append a statement to main, giving it the next source line
   */
  public <T extends Expr> T add(T stmt) {
    stmt.setPosition(new FilePosition(globals.getInputFile(), line++));
    body.insertAtTail(stmt);
    return stmt;
  }

  public VarSymbol intVar(String name, long init) {
    VarSymbol v = new VarSymbol(name);
    add(new DefExpr(v, new SymExpr(Literals.intConst(init)), null));
    return v;
  }

  public VarSymbol range(String name, long lo, long hi) {
    VarSymbol v = new VarSymbol(name);
    add(new DefExpr(v, new CallExpr(RuntimeLibrary.BUILD_RANGE,
        new SymExpr(Literals.intConst(lo)),
        new SymExpr(Literals.intConst(hi))), null));
    return v;
  }

  public VarSymbol list(String name, long ...elems) {
    CallExpr build = new CallExpr(RuntimeLibrary.BUILD_LIST);
    for (long e: elems) {
      build.insertAtTail(new SymExpr(Literals.intConst(e)));
    }
    VarSymbol v = new VarSymbol(name);
    add(new DefExpr(v, build, null));
    return v;
  }

  /**
   * An uninitialized variable, for results
   */
  public VarSymbol var(String name) {
    VarSymbol v = new VarSymbol(name);
    add(new DefExpr(v));
    return v;
  }

  public static List<VarSymbol> indices(String ...names) {
    List<VarSymbol> result = new ArrayList<VarSymbol>();
    for (String name: names) {
      result.add(new VarSymbol(name));
    }
    return result;
  }

  public static List<Expr> iterables(Expr ...exprs) {
    return new ArrayList<Expr>(Arrays.asList(exprs));
  }

  public static List<Expr> refs(VarSymbol ...vars) {
    List<Expr> result = new ArrayList<Expr>();
    for (VarSymbol v: vars) {
      result.add(new SymExpr(v));
    }
    return result;
  }

  public ShadowVarSymbol refIntent(String outer) {
    return ShadowVars.buildForPrefix(diag, ShadowVarPrefix.REF,
                                     new UnresolvedSymExpr(outer), null, null);
  }

  public ShadowVarSymbol reduceIntent(String op, String outer) {
    return ShadowVars.buildFromReduceIntent(new UnresolvedSymExpr(outer),
                                            new UnresolvedSymExpr(op));
  }

  /**
   * Append a forall to main; zippered if more than one iterable
   */
  public ForallStmt forall(List<VarSymbol> indices, List<Expr> iterables,
      List<ShadowVarSymbol> intents, Expr ...bodyStmts) {
    ForallStmt fs = ForallStmt.build(indices, iterables, intents,
        new BlockStmt(bodyStmts), iterables.size() > 1);
    return add(fs);
  }

  public static List<ShadowVarSymbol> with(ShadowVarSymbol ...svars) {
    return new ArrayList<ShadowVarSymbol>(Arrays.asList(svars));
  }

  public static CallExpr addAssign(VarSymbol target, VarSymbol value) {
    return new CallExpr(CallExpr.Prim.ADD_ASSIGN, new SymExpr(target),
                        new SymExpr(value));
  }

  public static List<ArgSymbol> intFormal(String name) {
    return Collections.singletonList(new ArgSymbol(name, Types.INT));
  }

  /**
   * Define "count(n)", yielding 1..n, with the requested parallel
   * overloads.  Leaders yield descriptors relative to 1.
   * @return the serial iterator
   */
  public FnSymbol defineCount(boolean standalone, boolean leader,
                              boolean follower) {
    FnSymbol serial = FnSymbol.iterator(COUNT, intFormal("n"), null,
                                        CONST_INT);
    lib.defineIterator(serial, new NativeIterator() {
      @Override
      public List<List<Object>> iterate(List<Object> args, int numTasks) {
        return Collections.singletonList(upTo((Long)args.get(0)).serial(lib));
      }
    });
    if (standalone) {
      lib.defineIterator(FnSymbol.iterator(COUNT, intFormal("n"),
          IterKind.STANDALONE, CONST_INT), new NativeIterator() {
            @Override
            public List<List<Object>> iterate(List<Object> args,
                                              int numTasks) {
              List<List<Object>> chunks = new ArrayList<List<Object>>();
              for (RangeValue chunk:
                   upTo((Long)args.get(0)).split(numTasks, false)) {
                chunks.add(chunk.serial(lib));
              }
              return chunks;
            }
          });
    }
    if (leader) {
      lib.defineIterator(FnSymbol.iterator(COUNT, intFormal("n"),
          IterKind.LEADER, new QualifiedType(Types.RANGE,
                                             Qualifier.CONST_VAL)),
          new NativeIterator() {
            @Override
            public List<List<Object>> iterate(List<Object> args,
                                              int numTasks) {
              List<List<Object>> descriptors = new ArrayList<List<Object>>();
              for (RangeValue d:
                   upTo((Long)args.get(0)).split(numTasks, true)) {
                descriptors.add(Collections.<Object>singletonList(d));
              }
              return descriptors;
            }
          });
    }
    if (follower) {
      lib.defineIterator(FnSymbol.iterator(COUNT, intFormal("n"),
          IterKind.FOLLOWER, CONST_INT), new NativeIterator() {
            @Override
            public List<List<Object>> iterate(List<Object> args,
                                              int numTasks)
                                              throws LogicException {
              RangeValue all = upTo((Long)args.get(0));
              return Collections.singletonList(all.follow(lib,
                  (RangeValue)args.get(1), (Boolean)args.get(2)));
            }
          });
    }
    return serial;
  }

  private static RangeValue upTo(long n) {
    return new RangeValue(1, n);
  }

  public static CallExpr countCall(long n) {
    return new CallExpr(COUNT, new SymExpr(Literals.intConst(n)));
  }

  public String firstError() {
    return diag.getErrors().isEmpty() ? null : diag.getErrors().get(0).text;
  }
}
