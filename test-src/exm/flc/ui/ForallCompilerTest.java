package exm.flc.ui;

import static exm.flc.frontend.ProgramFixture.addAssign;
import static exm.flc.frontend.ProgramFixture.indices;
import static exm.flc.frontend.ProgramFixture.refs;
import static exm.flc.frontend.ProgramFixture.with;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.Literals;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;
import exm.flc.common.Logging;
import exm.flc.common.Settings;
import exm.flc.common.exceptions.FlcFatal;
import exm.flc.frontend.Diagnostics;
import exm.flc.frontend.ProgramFixture;
import exm.flc.jvm.runtime.Frame;

public class ForallCompilerTest {

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("ForallCompilerTest.flc.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset(Settings.NO_FAST_FOLLOWERS);
    Settings.reset(Settings.VERIFY);
    Settings.reset(Settings.RUNTIME_NUM_TASKS);
  }

  /**
   * forall (i, j) in zip(1..4, 5..8) with (ref sum) { sum += j; }
   * @return sum
   */
  private static VarSymbol zipSum(ProgramFixture p) {
    VarSymbol r1 = p.range("r1", 1, 4);
    VarSymbol r2 = p.range("r2", 5, 8);
    VarSymbol sum = p.intVar("sum", 0);
    List<VarSymbol> idx = indices("i", "j");
    p.forall(idx, refs(r1, r2), with(p.refIntent("sum")),
             addAssign(sum, idx.get(1)));
    return sum;
  }

  @Test
  public void testCompileAndRun() {
    ProgramFixture p = new ProgramFixture("facade");
    VarSymbol sum = zipSum(p);
    ForallCompiler compiler = new ForallCompiler(logger);
    Diagnostics diag = compiler.compile(p.globals);
    assertFalse(diag.hasErrors());

    Settings.set(Settings.RUNTIME_NUM_TASKS, "2");
    Frame frame = compiler.run(p.lib, p.main);
    assertEquals(26L, frame.get(sum));
    assertTrue(p.lib.fastFollows() > 0);
  }

  @Test
  public void testNoFastFollowersSetting() {
    Settings.set(Settings.NO_FAST_FOLLOWERS, "true");
    ProgramFixture p = new ProgramFixture("facadeNoFast");
    VarSymbol sum = zipSum(p);
    ForallCompiler compiler = new ForallCompiler(logger);
    compiler.compile(p.globals);

    Frame frame = compiler.run(p.lib, p.main);
    assertEquals(26L, frame.get(sum));
    assertEquals(0, p.lib.fastFollows());
  }

  @Test
  public void testUserErrorExitCode() {
    ProgramFixture p = new ProgramFixture("facadeError");
    VarSymbol a = p.list("a", 1, 2);
    p.forall(indices("x"), refs(a), with());
    try {
      new ForallCompiler(logger).compile(p.globals);
      fail("Expected FlcFatal");
    } catch (FlcFatal e) {
      assertEquals(ExitCode.ERROR_USER.code(), e.exitCode);
    }
  }

  @Test
  public void testBadSetting() {
    Settings.set(Settings.VERIFY, "maybe");
    ProgramFixture p = new ProgramFixture("facadeSetting");
    exception.expect(FlcFatal.class);
    new ForallCompiler(logger).compile(p.globals);
  }

  @Test
  public void testRuntimeFailureExitCode() {
    ProgramFixture p = new ProgramFixture("facadeThrow");
    VarSymbol r = p.range("r", 1, 3);
    p.forall(indices("i"), refs(r), with(), new CallExpr(Prim.THROW,
             new SymExpr(Literals.stringConst("out of cheese"))));
    ForallCompiler compiler = new ForallCompiler(logger);
    compiler.compile(p.globals);
    try {
      compiler.run(p.lib, p.main);
      fail("Expected FlcFatal");
    } catch (FlcFatal e) {
      assertEquals(ExitCode.ERROR_USER.code(), e.exitCode);
    }
  }

  @Test
  public void testBadTaskCount() {
    ProgramFixture p = new ProgramFixture("facadeTasks");
    ForallCompiler compiler = new ForallCompiler(logger);
    compiler.compile(p.globals);
    Settings.set(Settings.RUNTIME_NUM_TASKS, "0");
    try {
      compiler.run(p.lib, p.main);
      fail("Expected FlcFatal");
    } catch (FlcFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
    }
  }
}
