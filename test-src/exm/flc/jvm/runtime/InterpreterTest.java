package exm.flc.jvm.runtime;

import static exm.flc.frontend.ProgramFixture.addAssign;
import static exm.flc.frontend.ProgramFixture.indices;
import static exm.flc.frontend.ProgramFixture.iterables;
import static exm.flc.frontend.ProgramFixture.refs;
import static exm.flc.frontend.ProgramFixture.with;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.lang.ForallIntentTag;
import exm.flc.frontend.ForallPass;
import exm.flc.frontend.LibraryEntryPoints.LibraryOp;
import exm.flc.frontend.ProgramFixture;
import exm.flc.frontend.RecIterScaffold;

public class InterpreterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("InterpreterTest.flc.log", true);
  }

  private static CallExpr reduce(ProgramFixture p, String op, VarSymbol data,
                                 boolean zippered) {
    return new CallExpr(Prim.REDUCE,
        new SymExpr(p.globals.reduceOpClass(op)), new SymExpr(data),
        new SymExpr(Literals.boolConst(zippered)));
  }

  /**
   * forall i in lo..hi with (ref sum) { sum += i; }
   */
  private static ProgramFixture rangeSum(long lo, long hi) {
    ProgramFixture p = new ProgramFixture("rangeSum");
    VarSymbol r = p.range("r", lo, hi);
    VarSymbol sum = p.intVar("sum", 0);
    List<VarSymbol> idx = indices("i");
    p.forall(idx, refs(r), with(p.refIntent("sum")),
             addAssign(sum, idx.get(0)));
    return p;
  }

  @Test
  public void testStandaloneRefIntent() throws Exception {
    for (int numTasks: Arrays.asList(1, 3, 4, 16)) {
      ProgramFixture p = rangeSum(1, 10);
      p.compile();
      Frame frame = p.run(numTasks);
      VarSymbol sum = (VarSymbol)((DefExpr)p.body.getBody().get(1))
                                                            .getSymbol();
      assertEquals("tasks: " + numTasks, 55L, frame.get(sum));
    }
  }

  @Test
  public void testEmptyRange() throws Exception {
    ProgramFixture p = rangeSum(1, 0);
    p.compile();
    Frame frame = p.run(4);
    VarSymbol sum = (VarSymbol)((DefExpr)p.body.getBody().get(1))
                                                          .getSymbol();
    assertEquals(0L, frame.get(sum));
  }

  @Test
  public void testReduceExpression() throws Exception {
    ProgramFixture p = new ProgramFixture("reduceExpr");
    VarSymbol r = p.range("r", 1, 10);
    VarSymbol total = p.var("total");
    VarSymbol largest = p.var("largest");
    p.add(CallExpr.move(total, reduce(p, "+", r, false)));
    p.add(CallExpr.move(largest, reduce(p, "max", r, false)));
    p.compile();

    Frame frame = p.run(4);
    assertEquals(55L, frame.get(total));
    assertEquals(10L, frame.get(largest));
    assertEquals(0, p.lib.liveHandles());
  }

  @Test
  public void testReduceOverEmptyRangeYieldsIdentity() throws Exception {
    ProgramFixture p = new ProgramFixture("emptyReduce");
    VarSymbol r = p.range("r", 1, 0);
    VarSymbol total = p.var("total");
    VarSymbol smallest = p.var("smallest");
    p.add(CallExpr.move(total, reduce(p, "+", r, false)));
    p.add(CallExpr.move(smallest, reduce(p, "min", r, false)));
    p.compile();

    Frame frame = p.run(4);
    assertEquals(0L, frame.get(total));
    assertEquals(Long.MAX_VALUE, frame.get(smallest));
    assertEquals(0, p.lib.liveHandles());
  }

  @Test
  public void testEmptyReduceIntentKeepsOuterValue() throws Exception {
    ProgramFixture p = new ProgramFixture("emptyReduceIntent");
    VarSymbol r = p.range("r", 1, 0);
    VarSymbol total = p.intVar("total", 100);
    List<VarSymbol> idx = indices("i");
    p.forall(idx, refs(r), with(p.reduceIntent("+", "total")),
        new CallExpr(Prim.REDUCE_ASSIGN, new SymExpr(total),
                     new SymExpr(idx.get(0))));
    p.compile();

    assertEquals(100L, p.run(4).get(total));
  }

  @Test
  public void testReduceIntentCombinesWithOuterValue() throws Exception {
    ProgramFixture p = new ProgramFixture("reduceIntent");
    VarSymbol r = p.range("r", 1, 10);
    VarSymbol total = p.intVar("total", 100);
    List<VarSymbol> idx = indices("i");
    p.forall(idx, refs(r), with(p.reduceIntent("+", "total")),
        new CallExpr(Prim.REDUCE_ASSIGN, new SymExpr(total),
                     new SymExpr(idx.get(0))));
    p.compile();

    Frame frame = p.run(4);
    assertEquals(155L, frame.get(total));
  }

  /**
   * forall i in 1..10 with (+ reduce s) { s += i; }
   */
  @Test
  public void testPlusReduceIntentWithAddAssign() throws Exception {
    ProgramFixture p = new ProgramFixture("plusReduce");
    VarSymbol r = p.range("r", 1, 10);
    VarSymbol s = p.intVar("s", 0);
    List<VarSymbol> idx = indices("i");
    ForallStmt fs = p.forall(idx, refs(r), with(p.reduceIntent("+", "s")),
                             addAssign(s, idx.get(0)));
    p.compile();
    assertEquals(ForallIntentTag.REDUCE,
                 fs.shadowVarSymbols().get(0).intent());

    for (int numTasks: Arrays.asList(1, 4)) {
      assertEquals(55L, p.run(numTasks).get(s));
    }
  }

  private static ProgramFixture zipSum(long hi2) {
    ProgramFixture p = new ProgramFixture("zipSum");
    VarSymbol r1 = p.range("r1", 1, 5);
    VarSymbol r2 = p.range("r2", 11, hi2);
    VarSymbol sumI = p.intVar("sumI", 0);
    VarSymbol sumJ = p.intVar("sumJ", 0);
    List<VarSymbol> idx = indices("i", "j");
    p.forall(idx, refs(r1, r2),
        with(p.refIntent("sumI"), p.refIntent("sumJ")),
        addAssign(sumI, idx.get(0)), addAssign(sumJ, idx.get(1)));
    return p;
  }

  private static void checkZipSums(ProgramFixture p, Frame frame) {
    VarSymbol sumI = (VarSymbol)((DefExpr)p.body.getBody().get(2))
                                                         .getSymbol();
    VarSymbol sumJ = (VarSymbol)((DefExpr)p.body.getBody().get(3))
                                                         .getSymbol();
    assertEquals(15L, frame.get(sumI));
    assertEquals(65L, frame.get(sumJ));
  }

  @Test
  public void testZipperedFastFollowers() throws Exception {
    ProgramFixture p = zipSum(15);
    p.compile();
    checkZipSums(p, p.run(4));
    assertTrue(p.lib.fastFollows() > 0);
    assertEquals(0, p.lib.generalFollows());
    assertEquals(0, p.lib.liveHandles());
  }

  @Test
  public void testZipperedWithoutFastFollowers() throws Exception {
    ProgramFixture p = zipSum(15);
    p.compile(true);
    checkZipSums(p, p.run(4));
    assertEquals(0, p.lib.fastFollows());
    assertTrue(p.lib.generalFollows() > 0);
    assertEquals(0, p.lib.liveHandles());
  }

  @Test
  public void testUnequalSizesTakeGeneralFollowers() throws Exception {
    // The leader's iteration space decides: r2's extra element is not
    // visited
    ProgramFixture p = zipSum(16);
    p.compile();
    checkZipSums(p, p.run(4));
    assertEquals(0, p.lib.fastFollows());
    assertTrue(p.lib.generalFollows() > 0);
  }

  @Test
  public void testZipperedSerialLists() throws Exception {
    ProgramFixture p = new ProgramFixture("zipSerial");
    VarSymbol a = p.list("a", 1, 2, 3);
    VarSymbol b = p.list("b", 10, 20, 30);
    VarSymbol sumI = p.intVar("sumI", 0);
    VarSymbol sumJ = p.intVar("sumJ", 0);
    List<VarSymbol> idx = indices("i", "j");
    ForallStmt fs = p.forall(idx, refs(a, b),
        with(p.refIntent("sumI"), p.refIntent("sumJ")),
        addAssign(sumI, idx.get(0)), addAssign(sumJ, idx.get(1)));
    fs.setAllowSerialIterator(true);
    p.compile();

    CallExpr iterCall = (CallExpr)fs.firstIteratedExpr();
    assertEquals(p.globals.getEntryPoints().get(LibraryOp.TRIVIAL_LEADER),
                 iterCall.resolvedFunction());

    Frame frame = p.run(4);
    assertEquals(6L, frame.get(sumI));
    assertEquals(60L, frame.get(sumJ));
    assertEquals(0, p.lib.liveHandles());
  }

  @Test
  public void testZipperedSerialLengthMismatch() throws Exception {
    ProgramFixture p = new ProgramFixture("zipMismatch");
    VarSymbol a = p.list("a", 1, 2, 3);
    VarSymbol b = p.list("b", 10, 20);
    VarSymbol sumI = p.intVar("sumI", 0);
    List<VarSymbol> idx = indices("i", "j");
    ForallStmt fs = p.forall(idx, refs(a, b), with(p.refIntent("sumI")),
        addAssign(sumI, idx.get(0)));
    fs.setAllowSerialIterator(true);
    p.compile();
    try {
      p.run(2);
      fail("Expected LogicException");
    } catch (LogicException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("different lengths"));
    }
  }

  @Test
  public void testThrowInBodyReleasesIterators() throws Exception {
    ProgramFixture p = new ProgramFixture("throwInBody");
    VarSymbol r1 = p.range("r1", 1, 8);
    VarSymbol r2 = p.range("r2", 1, 8);
    p.forall(indices("i", "j"), refs(r1, r2), with(),
        new CallExpr(Prim.THROW, new SymExpr(Literals.stringConst("boom"))));
    p.compile();
    try {
      p.run(4);
      fail("Expected LogicException");
    } catch (LogicException e) {
      assertEquals("boom", e.getMessage());
    }
    assertEquals(0, p.lib.liveHandles());
  }

  @Test
  public void testIteratorRecordLeader() throws Exception {
    ProgramFixture p = new ProgramFixture("irLeader");
    p.defineCount(false, true, true);
    VarSymbol sum = p.intVar("sum", 0);
    List<VarSymbol> idx = indices("i");
    p.forall(idx, iterables(ProgramFixture.countCall(6)),
             with(p.refIntent("sum")), addAssign(sum, idx.get(0)));
    p.compile();

    Frame frame = p.run(4);
    assertEquals(21L, frame.get(sum));
    assertTrue(p.lib.generalFollows() > 0);
    assertEquals(0, p.lib.liveHandles());
  }

  @Test
  public void testIteratorRecordStandalone() throws Exception {
    ProgramFixture p = new ProgramFixture("irStandalone");
    p.defineCount(true, true, true);
    VarSymbol sum = p.intVar("sum", 0);
    List<VarSymbol> idx = indices("i");
    p.forall(idx, iterables(ProgramFixture.countCall(6)),
             with(p.refIntent("sum")), addAssign(sum, idx.get(0)));
    p.compile();

    for (Expr stmt: p.body.getBody()) {
      if (stmt instanceof DefExpr) {
        assertTrue("iterable temporary should be gone",
            !((DefExpr)stmt).getSymbol().getName()
                                  .equals(ForallPass.ITERABLE_TMP));
      }
    }
    Frame frame = p.run(4);
    assertEquals(21L, frame.get(sum));
    assertEquals(0, p.lib.fastFollows() + p.lib.generalFollows());
  }

  @Test
  public void testZipperedReduceExpression() throws Exception {
    ProgramFixture p = new ProgramFixture("zipReduce");
    VarSymbol r1 = p.range("r1", 1, 5);
    VarSymbol r2 = p.range("r2", 11, 15);
    VarSymbol z = p.var("z");
    p.add(CallExpr.move(z, new CallExpr(Prim.ZIP, new SymExpr(r1),
                                        new SymExpr(r2))));
    VarSymbol total = p.var("total");
    p.add(CallExpr.move(total, reduce(p, "+", z, true)));
    p.compile();

    Frame frame = p.run(3);
    assertEquals(Arrays.asList(15L, 65L), frame.get(total));
  }

  @Test
  public void testCommittedScaffoldRunsSerially() throws Exception {
    ProgramFixture p = rangeSum(1, 10);
    p.compile();
    ForallStmt fs = null;
    for (Expr stmt: p.body.getBody()) {
      if (stmt instanceof ForallStmt) {
        fs = (ForallStmt)stmt;
      }
    }
    RecIterScaffold.commit(fs);
    assertTrue(!fs.inTree());

    Frame frame = p.run(4);
    VarSymbol sum = (VarSymbol)((DefExpr)p.body.getBody().get(1))
                                                          .getSymbol();
    assertEquals(55L, frame.get(sum));
    assertEquals(0, p.lib.liveHandles());
  }
}
