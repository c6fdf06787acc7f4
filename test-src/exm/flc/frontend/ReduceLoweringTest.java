package exm.flc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.Symbol;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.lang.ForallIntentTag;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.TupleType;
import exm.flc.common.lang.Types.TypeInstance;

public class ReduceLoweringTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ReduceLoweringTest.flc.log", true);
  }

  private static CallExpr reduce(ProgramFixture p, String op, VarSymbol data,
                                 boolean zippered) {
    return new CallExpr(Prim.REDUCE,
        new SymExpr(p.globals.reduceOpClass(op)), new SymExpr(data),
        new SymExpr(Literals.boolConst(zippered)));
  }

  private static DefExpr findDef(ProgramFixture p, String name) {
    for (Expr stmt: p.body.getBody()) {
      if (stmt instanceof DefExpr &&
          ((DefExpr)stmt).getSymbol().getName().equals(name)) {
        return (DefExpr)stmt;
      }
    }
    return null;
  }

  @Test
  public void testReduceBecomesForall() throws Exception {
    ProgramFixture p = new ProgramFixture("lowerReduce");
    VarSymbol r = p.range("r", 1, 10);
    VarSymbol total = p.var("total");
    CallExpr move = p.add(CallExpr.move(total, reduce(p, "+", r, false)));
    p.compile();
    assertFalse(p.diag.hasErrors());

    DefExpr resultDef = findDef(p, ReduceLowering.RED_RESULT);
    assertNotNull(resultDef);
    Symbol result = resultDef.getSymbol();
    assertEquals(Types.INT, result.getType());

    ForallStmt fs = (ForallStmt)resultDef.next();
    assertTrue(fs.fromReduce());
    assertTrue(fs.allowSerialIterator());
    assertFalse(fs.zippered());
    assertTrue(fs.next() == move);

    ShadowVarSymbol svar = fs.shadowVarSymbols().get(0);
    assertEquals(ForallIntentTag.REDUCE, svar.intent());
    assertTrue(svar.getOuterVar() == result);
    assertEquals(new TypeInstance("SumReduceScanOp", Types.INT),
                 ((CallExpr)svar.getReduceOpExpr()).getCallType());

    // The expression now reads the result
    assertTrue(((SymExpr)move.actual(1)).symbol() == result);
    assertEquals(Types.INT, total.getType());

    for (Expr stmt: p.body.getBody()) {
      assertFalse("anchor left behind", stmt instanceof CallExpr &&
                  ((CallExpr)stmt).isPrimitive(Prim.NOOP));
    }
  }

  @Test
  public void testZipperedReduceComputesIndexTypeTemp() throws Exception {
    ProgramFixture p = new ProgramFixture("lowerZipReduce");
    VarSymbol r1 = p.range("r1", 1, 5);
    VarSymbol r2 = p.range("r2", 11, 15);
    VarSymbol z = p.var("z");
    p.add(CallExpr.move(z, new CallExpr(Prim.ZIP, new SymExpr(r1),
                                        new SymExpr(r2))));
    VarSymbol total = p.var("total");
    CallExpr move = p.add(CallExpr.move(total, reduce(p, "+", z, true)));
    p.compile();
    assertFalse(p.diag.hasErrors());

    DefExpr typeTemp = findDef(p, ReduceLowering.IITR_TEMP);
    assertNotNull(typeTemp);
    assertTrue(typeTemp.getSymbol().hasFlag(Flag.TYPE_VARIABLE));
    assertEquals(TupleType.makeTuple(Types.INT, Types.INT),
                 typeTemp.getSymbol().getType());

    // The leader iterator record is defined between the result and the loop
    assertTrue(move.prev() instanceof ForallStmt);
    ForallStmt fs = (ForallStmt)move.prev();
    assertTrue(fs.fromReduce());
    assertTrue(fs.zippered());
    assertEquals(2, fs.numIteratedExprs());
    assertEquals(TupleType.makeTuple(Types.INT, Types.INT),
                 findDef(p, ReduceLowering.RED_RESULT).getSymbol().getType());
  }

  @Test
  public void testMaxReduce() throws Exception {
    ProgramFixture p = new ProgramFixture("lowerMax");
    VarSymbol a = p.list("a", 4, 9, 2);
    VarSymbol biggest = p.var("biggest");
    CallExpr move = p.add(CallExpr.move(biggest, reduce(p, "max", a, false)));
    p.compile();
    assertFalse(p.diag.hasErrors());

    ForallStmt fs = (ForallStmt)move.prev();
    ShadowVarSymbol svar = fs.shadowVarSymbols().get(0);
    assertEquals(new TypeInstance("MaxReduceScanOp", Types.INT),
                 ((CallExpr)svar.getReduceOpExpr()).getCallType());
  }
}
