package exm.flc.frontend;

import static exm.flc.frontend.ProgramFixture.addAssign;
import static exm.flc.frontend.ProgramFixture.indices;
import static exm.flc.frontend.ProgramFixture.refs;
import static exm.flc.frontend.ProgramFixture.with;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.DefExpr;
import exm.flc.ast.DeferStmt;
import exm.flc.ast.Expr;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.exceptions.FlcRuntimeError;
import exm.flc.common.lang.Types.IteratorClassType;

public class RecIterScaffoldTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("RecIterScaffoldTest.flc.log", true);
  }

  private ProgramFixture program;

  private ForallStmt compiledRangeSum() throws Exception {
    program = new ProgramFixture("scaffold");
    VarSymbol r = program.range("r", 1, 10);
    VarSymbol sum = program.intVar("sum", 0);
    List<VarSymbol> idx = indices("i");
    ForallStmt fs = program.forall(idx, refs(r),
        with(program.refIntent("sum")), addAssign(sum, idx.get(0)));
    program.compile();
    assertFalse(program.diag.hasErrors());
    return fs;
  }

  @Test
  public void testScaffoldIsDetached() throws Exception {
    ForallStmt fs = compiledRangeSum();
    assertTrue(fs.hasRecIterScaffold());
    assertNull(fs.recIterIRdef().getParent());
    assertNull(fs.recIterGetIterator().getParent());
    assertTrue(fs.recIterIRdef().getSymbol().getName()
                 .startsWith(RecIterScaffold.ITER_PAR));
    assertTrue(fs.recIterICdef().getSymbol().getType()
                                         instanceof IteratorClassType);
  }

  @Test
  public void testCommit() throws Exception {
    ForallStmt fs = compiledRangeSum();
    VarSymbol parIdx = fs.parIdxVar();
    ShadowVarSymbol svar = fs.shadowVarSymbols().get(0);
    DefExpr icDef = fs.recIterICdef();
    CallExpr freeIterator = fs.recIterFreeIterator();

    BlockStmt serial = RecIterScaffold.commit(fs);
    assertFalse(fs.inTree());
    assertTrue(serial.inTree());
    assertFalse(fs.hasRecIterScaffold());

    List<Expr> stmts = serial.getBody().toList();
    assertTrue(stmts.get(1) == icDef);
    DeferStmt defer = (DeferStmt)stmts.get(3);
    assertTrue(freeIterator.getParent() == defer.body());
    assertTrue(svar.getDefPoint().getParent() == serial);

    ForLoop loop = (ForLoop)stmts.get(stmts.size() - 1);
    assertTrue(loop.indexGet().symbol() == parIdx);
    assertTrue(loop.iteratorGet().symbol() == icDef.getSymbol());
  }

  @Test
  public void testDiscard() throws Exception {
    ForallStmt fs = compiledRangeSum();
    RecIterScaffold.discard(fs);
    assertFalse(fs.hasRecIterScaffold());
    assertTrue(fs.inTree());
    try {
      RecIterScaffold.commit(fs);
      fail("Expected FlcRuntimeError");
    } catch (FlcRuntimeError e) {
      assertTrue(e.getMessage().contains("has no scaffold"));
    }
  }

  @Test
  public void testReduceLoopHasScaffold() throws Exception {
    ProgramFixture p = new ProgramFixture("reduceScaffold");
    VarSymbol r = p.range("r", 1, 3);
    VarSymbol total = p.var("total");
    p.add(CallExpr.move(total, new CallExpr(CallExpr.Prim.REDUCE,
        new SymExpr(p.globals.reduceOpClass("+")),
        new SymExpr(r),
        new SymExpr(Literals.boolConst(false)))));
    p.compile();
    for (Expr stmt: p.body.getBody()) {
      if (stmt instanceof ForallStmt) {
        assertTrue(((ForallStmt)stmt).hasRecIterScaffold());
        assertEquals(1, ((ForallStmt)stmt).numIteratedExprs());
        return;
      }
    }
    fail("no forall for the reduce expression");
  }
}
