package exm.flc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.flc.ast.BlockStmt;
import exm.flc.ast.CallExpr;
import exm.flc.ast.CallExpr.Prim;
import exm.flc.ast.DefExpr;
import exm.flc.ast.Expr;
import exm.flc.ast.Flag;
import exm.flc.ast.ForallStmt;
import exm.flc.ast.ShadowVarSymbol;
import exm.flc.ast.SymExpr;
import exm.flc.ast.VarSymbol;

public class IndexVarRestructurerTest {

  private static ForallStmt forall(List<VarSymbol> indices, BlockStmt body) {
    List<Expr> iterables = ProgramFixture.refs(new VarSymbol("a"),
                                               new VarSymbol("b"));
    return ForallStmt.build(indices, iterables.subList(0, indices.size()),
        Collections.<ShadowVarSymbol>emptyList(), body, indices.size() > 1);
  }

  @Test
  public void testStandaloneKeepsUserIndex() {
    List<VarSymbol> idx = ProgramFixture.indices("i");
    BlockStmt body = new BlockStmt();
    ForallStmt fs = forall(idx, body);
    new IndexVarRestructurer().addParIdxVarsAndRestruct(fs, true);
    assertTrue(fs.parIdxVar() == idx.get(0));
    assertTrue(idx.get(0).hasFlag(Flag.INDEX_OF_INTEREST));
    assertTrue(fs.loopBody() == body);
  }

  @Test
  public void testLeaderSingleIndex() {
    List<VarSymbol> idx = ProgramFixture.indices("i");
    BlockStmt userBody = new BlockStmt();
    ForallStmt fs = forall(idx, userBody);
    new IndexVarRestructurer().addParIdxVarsAndRestruct(fs, false);

    VarSymbol parIdx = fs.parIdxVar();
    assertEquals(IndexVarRestructurer.FOLLOW_THIS, parIdx.getName());
    assertTrue(parIdx.hasFlag(Flag.INSERT_AUTO_DESTROY));

    List<Expr> outer = fs.loopBody().getBody().toList();
    assertEquals(2, outer.size());
    VarSymbol followIdx = (VarSymbol)((DefExpr)outer.get(0)).getSymbol();
    assertEquals(IndexVarRestructurer.FOLLOW_IDX, followIdx.getName());
    assertTrue(outer.get(1) == userBody);

    // def i; i = chpl__followIdx
    List<Expr> inner = userBody.getBody().toList();
    assertTrue(((DefExpr)inner.get(0)).getSymbol() == idx.get(0));
    CallExpr move = (CallExpr)inner.get(1);
    assertTrue(move.isPrimitive(Prim.MOVE));
    assertTrue(((SymExpr)move.actual(1)).symbol() == followIdx);
  }

  @Test
  public void testLeaderZipperedIndices() {
    List<VarSymbol> idx = ProgramFixture.indices("i", "j");
    BlockStmt userBody = new BlockStmt();
    ForallStmt fs = forall(idx, userBody);
    new IndexVarRestructurer().addParIdxVarsAndRestruct(fs, false);
    assertEquals(1, fs.numInductionVars());
    assertTrue(fs.zippered());

    List<Expr> inner = userBody.getBody().toList();
    assertEquals(4, inner.size());
    assertTrue(((DefExpr)inner.get(0)).getSymbol() == idx.get(0));
    assertTrue(((DefExpr)inner.get(1)).getSymbol() == idx.get(1));
    for (int k = 1; k <= 2; k++) {
      CallExpr move = (CallExpr)inner.get(k + 1);
      assertTrue(((SymExpr)move.actual(0)).symbol() == idx.get(k - 1));
      CallExpr get = (CallExpr)move.actual(1);
      assertTrue(get.isPrimitive(Prim.TUPLE_GET));
      assertEquals(Long.valueOf(k),
          ((VarSymbol)((SymExpr)get.actual(1)).symbol()).getImmediate());
    }
  }
}
