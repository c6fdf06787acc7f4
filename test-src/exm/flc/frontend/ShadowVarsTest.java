package exm.flc.frontend;

import static exm.flc.frontend.ProgramFixture.indices;
import static exm.flc.frontend.ProgramFixture.refs;
import static exm.flc.frontend.ProgramFixture.with;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.flc.ast.CallExpr;
import exm.flc.ast.FilePosition;
import exm.flc.ast.Flag;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.TypeSymbol;
import exm.flc.ast.UnresolvedSymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.lang.ForallIntentTag;
import exm.flc.common.lang.Qualifier;
import exm.flc.common.lang.ShadowVarPrefix;
import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.TypeInstance;
import exm.flc.jvm.runtime.RuntimeLibrary;

public class ShadowVarsTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ShadowVarsTest.flc.log", true);
  }

  private static UnresolvedSymExpr name(String name) {
    UnresolvedSymExpr e = new UnresolvedSymExpr(name);
    e.setPosition(new FilePosition("with.flc", 3));
    return e;
  }

  private static SymExpr intType(ProgramFixture p) {
    return new SymExpr(p.globals.lookupType("int"));
  }

  @Test
  public void testIntentWithoutDeclaration() {
    ProgramFixture p = new ProgramFixture("intent");
    ShadowVarSymbol svar = ShadowVars.buildForPrefix(p.diag,
        ShadowVarPrefix.CONST_IN, name("x"), null, null);
    assertEquals(ForallIntentTag.CONST_IN, svar.intent());
    assertFalse(svar.isTaskPrivate());
    assertFalse(p.diag.hasErrors());
    assertEquals(3, svar.getDefPoint().getPosition().line);
  }

  @Test
  public void testVarNeedsTypeOrInit() {
    ProgramFixture p = new ProgramFixture("varNoInit");
    ShadowVarSymbol svar = ShadowVars.buildForPrefix(p.diag,
        ShadowVarPrefix.VAR, name("x"), null, null);
    assertTrue(svar.isTaskPrivate());
    assertEquals("a task private variable 'x' requires a type and/or " +
                 "initializing expression", p.firstError());
    assertEquals(3, svar.getDefPoint().getPosition().line);
  }

  @Test
  public void testVarWithTypeOnly() {
    ProgramFixture p = new ProgramFixture("varTyped");
    ShadowVarSymbol v = ShadowVars.buildForPrefix(p.diag,
        ShadowVarPrefix.VAR, name("v"), intType(p), null);
    assertFalse(p.diag.hasErrors());
    assertEquals(ForallIntentTag.TASK_PRIVATE, v.intent());
    assertEquals(Qualifier.VAL, v.getQual());
    assertTrue(v.hasFlag(Flag.NO_AUTO_DESTROY));
    assertFalse(v.hasFlag(Flag.CONST));
    assertEquals(3, v.getDefPoint().getPosition().line);
  }

  @Test
  public void testInIntentRejectsDeclaration() {
    ProgramFixture p = new ProgramFixture("inDecl");
    ShadowVars.buildForPrefix(p.diag, ShadowVarPrefix.IN, name("x"),
                              intType(p), null);
    assertEquals("an 'in' or 'const in' intent for 'x' does not allow a " +
                 "type or an initializing expression", p.firstError());
    assertEquals("if you mean to declare a task-private variable, use " +
                 "'var' or 'const'", p.diag.getNotes().get(0).text);
    assertEquals(3, p.diag.getErrors().get(0).pos.line);
  }

  @Test
  public void testRefTaskPrivate() {
    ProgramFixture p = new ProgramFixture("refDecl");
    ShadowVars.buildForPrefix(p.diag, ShadowVarPrefix.CONST_REF, name("x"),
                              intType(p), null);
    assertEquals(2, p.diag.errorCount());
    assertEquals("a 'ref' or 'const ref' task-private variable 'x' must " +
                 "have an initializing expression",
                 p.diag.getErrors().get(0).text);
    assertEquals("a 'ref' or 'const ref' task-private variable 'x' cannot " +
                 "have a type", p.diag.getErrors().get(1).text);
  }

  @Test
  public void testTaskPrivateQualifiers() {
    ProgramFixture p = new ProgramFixture("taskPrivate");
    VarSymbol outer = new VarSymbol("y");
    ShadowVarSymbol c = ShadowVars.buildForPrefix(p.diag,
        ShadowVarPrefix.CONST, name("c"), intType(p), null);
    ShadowVarSymbol r = ShadowVars.buildForPrefix(p.diag,
        ShadowVarPrefix.REF, name("r"), null, new SymExpr(outer));
    assertFalse(p.diag.hasErrors());

    assertEquals(ForallIntentTag.TASK_PRIVATE, c.intent());
    assertEquals(Qualifier.CONST_VAL, c.getQual());
    assertTrue(c.hasFlag(Flag.CONST));
    assertEquals(Qualifier.REF, r.getQual());
    assertTrue(r.hasFlag(Flag.REF_VAR));
    assertTrue(r.hasFlag(Flag.NO_AUTO_DESTROY));
    assertEquals(3, r.getDefPoint().getPosition().line);
  }

  @Test
  public void testDefaultQualifiers() {
    assertEquals(Qualifier.CONST_VAL,
        ShadowVars.qualifierFor(ForallIntentTag.DEFAULT, Types.INT));
    assertEquals(Qualifier.CONST_REF,
        ShadowVars.qualifierFor(ForallIntentTag.CONST, RuntimeLibrary.LIST));
    assertEquals(Qualifier.CONST_VAL,
        ShadowVars.qualifierFor(ForallIntentTag.CONST, Types.RANGE));
    assertEquals(Qualifier.VAL,
        ShadowVars.qualifierFor(ForallIntentTag.REDUCE, Types.INT));
  }

  @Test
  public void testMissingOuterVariable() throws Exception {
    ProgramFixture p = new ProgramFixture("noOuter");
    VarSymbol r = p.range("r", 1, 3);
    p.forall(indices("i"), refs(r), with(p.refIntent("zz")));
    p.compile();
    assertEquals("no variable called 'zz' is visible to this forall intent",
                 p.firstError());
  }

  @Test
  public void testUnknownReduceOperator() throws Exception {
    ProgramFixture p = new ProgramFixture("badOp");
    VarSymbol r = p.range("r", 1, 3);
    p.intVar("total", 0);
    p.forall(indices("i"), refs(r), with(p.reduceIntent("foo", "total")));
    p.compile();
    assertEquals("'foo' is not a reduce operator", p.firstError());
  }

  @Test
  public void testReduceOperatorInstantiated() throws Exception {
    ProgramFixture p = new ProgramFixture("reduceOp");
    VarSymbol r = p.range("r", 1, 3);
    VarSymbol total = p.intVar("total", 0);
    ForallStmt fs = p.forall(indices("i"), refs(r),
                             with(p.reduceIntent("*", "total")));
    p.compile();
    assertFalse(p.diag.hasErrors());

    ShadowVarSymbol svar = fs.shadowVarSymbols().get(0);
    assertTrue(svar.getOuterVar() == total);
    assertEquals(Qualifier.VAL, svar.getQual());
    CallExpr op = (CallExpr)svar.getReduceOpExpr();
    TypeSymbol opClass = (TypeSymbol)op.getBaseSymbol();
    assertEquals("ProductReduceScanOp", opClass.getName());
    assertEquals(new TypeInstance("ProductReduceScanOp", Types.INT),
                 op.getCallType());
  }
}
