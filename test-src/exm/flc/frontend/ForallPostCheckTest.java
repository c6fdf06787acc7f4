package exm.flc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.ArrayList;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.flc.ast.ArgSymbol;
import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.DefExpr;
import exm.flc.ast.FilePosition;
import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.Types;
import exm.flc.jvm.runtime.RuntimeLibrary;

public class ForallPostCheckTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ForallPostCheckTest.flc.log", true);
  }

  /**
   * iter gen() { const r = 1..4; forall i in r { } }
   */
  private static FnSymbol defineIteratorWithForall(ProgramFixture p,
                                                   IterKind kind) {
    FnSymbol gen = FnSymbol.iterator("gen", new ArrayList<ArgSymbol>(), kind,
        new QualifiedType(Types.INT, Qualifier.CONST_VAL));
    VarSymbol r = new VarSymbol("r");
    DefExpr def = new DefExpr(r, new CallExpr(RuntimeLibrary.BUILD_RANGE,
        new SymExpr(Literals.intConst(1)), new SymExpr(Literals.intConst(4))),
        null);
    ForallStmt fs = ForallStmt.build(ProgramFixture.indices("i"),
        ProgramFixture.refs(r), Collections.<ShadowVarSymbol>emptyList(),
        new BlockStmt(), false);
    fs.setPosition(new FilePosition("gen.flc", 7));
    gen.setBody(new BlockStmt(def, fs));
    p.globals.defineFunction(gen);
    return gen;
  }

  @Test
  public void testForallInSerialIterator() throws Exception {
    ProgramFixture p = new ProgramFixture("serialIter");
    defineIteratorWithForall(p, null);
    p.compile();
    assertEquals("invalid use of parallel construct in serial iterator",
                 p.firstError());
    assertEquals(7, p.diag.getErrors().get(0).pos.line);
  }

  @Test
  public void testForallInInlinedIterator() throws Exception {
    ProgramFixture p = new ProgramFixture("inlineIter");
    FnSymbol gen = defineIteratorWithForall(p, IterKind.STANDALONE);
    gen.addFlag(Flag.INLINE_ITERATOR);
    p.compile();
    assertFalse(p.diag.hasErrors());
  }

  @Test
  public void testReduceInSerialIterator() throws Exception {
    ProgramFixture p = new ProgramFixture("reduceInIter");
    FnSymbol gen = FnSymbol.iterator("gen", new ArrayList<ArgSymbol>(), null,
        new QualifiedType(Types.INT, Qualifier.CONST_VAL));
    VarSymbol r = new VarSymbol("r");
    VarSymbol total = new VarSymbol("total");
    gen.setBody(new BlockStmt(
        new DefExpr(r, new CallExpr(RuntimeLibrary.BUILD_RANGE,
            new SymExpr(Literals.intConst(1)),
            new SymExpr(Literals.intConst(4))), null),
        new DefExpr(total),
        CallExpr.move(total, new CallExpr(Prim.REDUCE,
            new SymExpr(p.globals.reduceOpClass("+")), new SymExpr(r),
            new SymExpr(Literals.boolConst(false))))));
    p.globals.defineFunction(gen);
    p.compile();
    assertFalse(p.diag.hasErrors());
  }

  @Test
  public void testForallInFunction() throws Exception {
    ProgramFixture p = new ProgramFixture("plainFn");
    VarSymbol r = p.range("r", 1, 4);
    p.forall(ProgramFixture.indices("i"), ProgramFixture.refs(r),
             ProgramFixture.with());
    p.compile();
    assertFalse(p.diag.hasErrors());
  }
}
