package exm.flc.frontend;

import static exm.flc.frontend.ProgramFixture.addAssign;
import static exm.flc.frontend.ProgramFixture.indices;
import static exm.flc.frontend.ProgramFixture.iterables;
import static exm.flc.frontend.ProgramFixture.refs;
import static exm.flc.frontend.ProgramFixture.with;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.flc.ast.ArgSymbol;
import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CondStmt;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.FnSymbol;
import exm.flc.ast.ForLoop;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.Literals;
import exm.flc.ast.NamedExpr;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.TypeSymbol;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.exceptions.CompilationStoppedException;
import exm.flc.common.exceptions.UserException;
import exm.flc.common.lang.ForallIntentTag;
import exm.flc.common.lang.IterKind;
import exm.flc.common.lang.QualifiedType;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.IteratorRecordType;
import exm.flc.common.lang.Types.NamedType;
import exm.flc.common.lang.Types.Type;

public class ForallResolverTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ForallResolverTest.flc.log", true);
  }

  private static void compileExpectingError(ProgramFixture p,
                                            String expected) {
    try {
      p.compile();
      fail("Expected compile error: " + expected);
    } catch (UserException e) {
      assertEquals(expected, p.firstError());
    }
  }

  @Test
  public void testStandaloneHeader() throws Exception {
    ProgramFixture p = new ProgramFixture("standalone");
    VarSymbol r = p.range("r", 1, 10);
    VarSymbol sum = p.intVar("sum", 0);
    List<VarSymbol> idx = indices("i");
    ForallStmt fs = p.forall(idx, refs(r), with(p.refIntent("sum")),
                             addAssign(sum, idx.get(0)));
    p.compile();

    assertEquals(1, fs.numIteratedExprs());
    CallExpr iterCall = (CallExpr)fs.firstIteratedExpr();
    assertTrue(iterCall.resolvedFunction().isStandaloneIterator());
    assertTrue(iterCall.isNamed(LibraryEntryPoints.ELEMENTS_OF_NAME));

    VarSymbol parIdx = fs.parIdxVar();
    assertTrue(parIdx == idx.get(0));
    assertEquals(Types.INT, parIdx.getType());
    assertEquals(Qualifier.CONST_VAL, parIdx.getQual());
    assertTrue(parIdx.hasFlag(Flag.INDEX_OF_INTEREST));
    assertTrue(parIdx.hasFlag(Flag.INDEX_VAR));
    assertTrue(fs.hasRecIterScaffold());

    ShadowVarSymbol svar = fs.shadowVarSymbols().get(0);
    assertTrue(svar.getOuterVar() == sum);
    assertEquals(ForallIntentTag.REF, svar.intent());
    assertEquals(Qualifier.REF, svar.getQual());
    assertFalse(p.diag.hasErrors());
  }

  private static ForallStmt zipForall(ProgramFixture p) {
    VarSymbol r1 = p.range("r1", 1, 5);
    VarSymbol r2 = p.range("r2", 11, 15);
    VarSymbol sum = p.intVar("sum", 0);
    List<VarSymbol> idx = indices("i", "j");
    return p.forall(idx, refs(r1, r2), with(p.refIntent("sum")),
                    addAssign(sum, idx.get(1)));
  }

  @Test
  public void testLeaderBodyWithFastFollowers() throws Exception {
    ProgramFixture p = new ProgramFixture("leaderFast");
    ForallStmt fs = zipForall(p);
    p.compile(false);

    assertEquals(1, fs.numIteratedExprs());
    assertEquals(1, fs.numInductionVars());
    CallExpr iterCall = (CallExpr)fs.firstIteratedExpr();
    assertTrue(iterCall.resolvedFunction().isLeaderIterator());
    VarSymbol parIdx = fs.parIdxVar();
    assertEquals(IndexVarRestructurer.FOLLOW_THIS, parIdx.getName());
    assertEquals(Types.RANGE, parIdx.getType());

    // The iterables were gathered into a tuple ahead of the loop
    Expr before = fs.prev();
    assertTrue(before instanceof CallExpr &&
               ((CallExpr)before).isPrimitive(CallExpr.Prim.MOVE));
    assertEquals(LeaderFollowerBuilder.ITER_LF,
        ((SymExpr)((CallExpr)before).actual(0)).symbol().getName());

    BlockStmt body = fs.loopBody();
    assertEquals(5, body.getBody().size());
    assertEquals(LeaderFollowerBuilder.STATIC_CHECK,
        ((DefExpr)body.getBody().get(0)).getSymbol().getName());
    assertEquals(LeaderFollowerBuilder.DYNAMIC_CHECK,
        ((DefExpr)body.getBody().get(1)).getSymbol().getName());
    CondStmt branch = (CondStmt)body.getBody().tail();
    assertNotNull(branch.elseStmt());

    BlockStmt fast = branch.thenStmt();
    BlockStmt general = branch.elseStmt();
    ForLoop fastLoop = (ForLoop)fast.getBody().tail();
    ForLoop generalLoop = (ForLoop)general.getBody().tail();
    assertTrue(fastLoop.zippered());
    assertEquals(LeaderFollowerBuilder.FAST_FOLLOW_IDX,
                 fastLoop.indexGet().symbol().getName());
    assertEquals(IndexVarRestructurer.FOLLOW_IDX,
                 generalLoop.indexGet().symbol().getName());
    assertTrue(fastLoop.indexGet().symbol().hasFlag(Flag.FOLLOWER_INDEX));
    assertEquals(Types.TupleType.makeTuple(Types.INT, Types.INT),
                 generalLoop.indexGet().symbol().getType());
  }

  @Test
  public void testLeaderBodyWithoutFastFollowers() throws Exception {
    ProgramFixture p = new ProgramFixture("leaderNoFast");
    ForallStmt fs = zipForall(p);
    p.compile(true);

    BlockStmt body = fs.loopBody();
    assertEquals(1, body.getBody().size());
    BlockStmt follow = (BlockStmt)body.getBody().head();
    assertTrue(follow.getBody().tail() instanceof ForLoop);
    List<CondStmt> conds = new ArrayList<CondStmt>();
    body.collect(CondStmt.class, conds);
    assertTrue(conds.isEmpty());
  }

  @Test
  public void testNoParallelIterator() {
    ProgramFixture p = new ProgramFixture("noParIter");
    VarSymbol a = p.list("a", 1, 2);
    p.forall(indices("i"), refs(a), with());
    compileExpectingError(p, "A standalone or leader iterator is not " +
        "found for the iterable expression in this forall loop");
  }

  @Test
  public void testNoLeaderZippered() {
    ProgramFixture p = new ProgramFixture("noLeader");
    VarSymbol a = p.list("a", 1, 2);
    VarSymbol b = p.list("b", 1, 2);
    p.forall(indices("i", "j"), refs(a, b), with());
    compileExpectingError(p, "A leader iterator is not found for the " +
        "iterable expression in this forall loop");
  }

  @Test
  public void testIterateOverType() {
    ProgramFixture p = new ProgramFixture("overType");
    TypeSymbol intType = p.globals.lookupType("int");
    p.forall(indices("i"), iterables(new SymExpr(intType)), with());
    compileExpectingError(p, "unable to iterate over type 'int'");
  }

  @Test
  public void testExplicitTagArgument() {
    ProgramFixture p = new ProgramFixture("explicitTag");
    p.defineCount(false, true, true);
    CallExpr call = ProgramFixture.countCall(5);
    call.insertAtTail(new NamedExpr("tag",
        new SymExpr(p.globals.tagSymbol(IterKind.LEADER))));
    p.forall(indices("i"), iterables(call), with());
    compileExpectingError(p, "user invocation of a parallel iterator " +
        "should not supply tag arguments -- they are added implicitly " +
        "by the compiler");
    assertEquals("actual argument 2 of the iterator call",
                 p.diag.getNotes().get(0).text);
  }

  @Test
  public void testFormalIteratorRecord() throws Exception {
    ProgramFixture p = new ProgramFixture("formalIR");
    FnSymbol count = p.defineCount(true, true, true);
    ArgSymbol it = new ArgSymbol("it", new IteratorRecordType(count));
    FnSymbol f = FnSymbol.function("f", Collections.singletonList(it),
                                   Types.VOID);
    ForallStmt fs = ForallStmt.build(indices("i"),
        iterables(new SymExpr(it)), with(), new BlockStmt(), false);
    f.setBody(new BlockStmt(fs));
    p.globals.defineFunction(f);
    try {
      new ForallPass(p.context(false)).resolveFunction(f);
      fail("Expected compile error");
    } catch (CompilationStoppedException e) {
      assertEquals("a forall loop over a formal argument corresponding " +
          "to a for/forall/promoted expression or an iterator call is not " +
          "implemented", p.firstError());
      assertEquals("the actual argument is here",
                   p.diag.getNotes().get(0).text);
    }
  }

  @Test
  public void testNonIteratorStandalone() {
    ProgramFixture p = new ProgramFixture("nonIterSA");
    p.defineCount(false, true, true);
    FnSymbol fake = FnSymbol.taggedFunction(ProgramFixture.COUNT,
        ProgramFixture.intFormal("n"), IterKind.STANDALONE, Types.INT);
    p.globals.defineFunction(fake);
    p.forall(indices("i"), iterables(ProgramFixture.countCall(4)), with());
    compileExpectingError(p, "The iterable-expression resolves to a " +
        "non-iterator function 'count' when looking for a parallel iterator");
    assertEquals("The function 'count' is declared here",
                 p.diag.getNotes().get(0).text);
  }

  @Test
  public void testRecursionPattern() {
    ProgramFixture p = new ProgramFixture("recursion");
    String name = "walk";
    FnSymbol serial = FnSymbol.iterator(name, ProgramFixture.intFormal("n"),
        null, new QualifiedType(Types.INT, Qualifier.CONST_VAL));
    FnSymbol standalone = FnSymbol.iterator(name,
        ProgramFixture.intFormal("n"), IterKind.STANDALONE, null);
    p.globals.defineFunction(serial);
    p.globals.defineFunction(standalone);
    p.forall(indices("i"), iterables(new CallExpr(name,
        new SymExpr(Literals.intConst(3)))), with());
    compileExpectingError(p, "the recursion pattern seen in the first " +
        "iterable in this forall loop is not supported");
    assertEquals(2, p.diag.getNotes().size());
    assertEquals("try declaring its return type",
                 p.diag.getNotes().get(1).text);
  }

  @Test
  public void testForwardingParallelOverload() throws Exception {
    ProgramFixture p = new ProgramFixture("forwarder");
    FnSymbol count = p.defineCount(true, true, true);
    FnSymbol countSA = null;
    for (FnSymbol fn: p.globals.lookupFunctions(ProgramFixture.COUNT)) {
      if (fn.isStandaloneIterator()) {
        countSA = fn;
      }
    }
    Type wrapper = new NamedType("wrapper", true);
    p.globals.defineType(new TypeSymbol("wrapper", wrapper));
    List<ArgSymbol> formals = Collections.singletonList(
                                      new ArgSymbol("w", wrapper));
    p.globals.defineFunction(FnSymbol.function("mkWrapper",
        new ArrayList<ArgSymbol>(), wrapper));
    p.globals.defineFunction(FnSymbol.function(
        LibraryEntryPoints.ELEMENTS_OF_NAME, formals,
        new IteratorRecordType(count)));
    p.globals.defineFunction(FnSymbol.taggedFunction(
        LibraryEntryPoints.ELEMENTS_OF_NAME, formals, IterKind.STANDALONE,
        new IteratorRecordType(countSA)));

    VarSymbol w = new VarSymbol("w");
    p.add(new DefExpr(w, new CallExpr("mkWrapper"), null));
    List<VarSymbol> idx = indices("i");
    ForallStmt fs = p.forall(idx, refs(w), with());
    p.compile();

    assertEquals(IterKind.STANDALONE, ((CallExpr)fs.firstIteratedExpr())
                                     .resolvedFunction().getIterKind());
    assertEquals(Types.INT, idx.get(0).getType());
    assertEquals(Qualifier.CONST_VAL, idx.get(0).getQual());
  }

  @Test
  public void testZipperedSerialRejectsParallelComponent() {
    ProgramFixture p = new ProgramFixture("zipMix");
    p.defineCount(false, true, true);
    VarSymbol a = p.list("a", 1, 2, 3);
    CallExpr leaderCall = ProgramFixture.countCall(3);
    leaderCall.insertAtTail(new NamedExpr("tag",
        new SymExpr(p.globals.tagSymbol(IterKind.LEADER))));
    ForallStmt fs = p.forall(indices("i", "j"),
        iterables(new SymExpr(a), leaderCall), with());
    fs.setAllowSerialIterator(true);
    compileExpectingError(p, "Support for this combination of zippered " +
        "iterators is not currently implemented");
  }

  @Test
  public void testZipperedSerialHeader() throws Exception {
    ProgramFixture p = new ProgramFixture("zipSerialHeader");
    VarSymbol a = p.list("a", 1, 2, 3);
    VarSymbol b = p.list("b", 4, 5, 6);
    List<VarSymbol> idx = indices("i", "j");
    ForallStmt fs = p.forall(idx, refs(a, b), with());
    fs.setAllowSerialIterator(true);
    p.compile();

    assertEquals(1, fs.numIteratedExprs());
    assertEquals(1, fs.numInductionVars());
    VarSymbol trivialIdx = fs.parIdxVar();
    assertEquals(ZipperedSerial.TRIVIAL_IDX, trivialIdx.getName());
    assertEquals(Types.INT, trivialIdx.getType());

    List<ForLoop> loops = new ArrayList<ForLoop>();
    fs.loopBody().collect(ForLoop.class, loops);
    assertEquals(1, loops.size());
    assertTrue(loops.get(0).zippered());
    // user indices now live in the serial loop
    assertTrue(idx.get(0).getDefPoint().getParent() == loops.get(0));
    assertEquals(Types.INT, idx.get(1).getType());
  }
}
