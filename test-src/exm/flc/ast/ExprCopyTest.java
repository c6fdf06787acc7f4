package exm.flc.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.flc.ast.CallExpr.Prim;

public class ExprCopyTest {

  @Test
  public void testCopyRedirectsInnerDefinitions() {
    VarSymbol outer = new VarSymbol("outer");
    VarSymbol inner = new VarSymbol("inner");
    BlockStmt block = new BlockStmt(
        new DefExpr(inner, new SymExpr(Literals.intConst(1)), null),
        new CallExpr(Prim.ADD_ASSIGN, new SymExpr(outer),
                     new SymExpr(inner)));
    block.setPosition(new FilePosition("copy.flc", 12));

    SymbolMap map = new SymbolMap();
    BlockStmt copy = (BlockStmt)block.copy(map);
    assertEquals(1, map.size());
    VarSymbol innerCopy = (VarSymbol)map.get(inner);
    assertTrue(innerCopy != inner);
    assertEquals("inner", innerCopy.getName());
    assertEquals(12, copy.getPosition().line);

    CallExpr add = (CallExpr)copy.getBody().get(1);
    assertTrue(((SymExpr)add.actual(0)).symbol() == outer);
    assertTrue(((SymExpr)add.actual(1)).symbol() == innerCopy);
    assertTrue(add.getParent() == copy);
    assertFalse(copy.inTree());
  }

  @Test
  public void testCopyWithPresetMapping() {
    VarSymbol from = new VarSymbol("from");
    VarSymbol to = new VarSymbol("to");
    SymbolMap map = new SymbolMap();
    map.put(from, to);
    CallExpr call = new CallExpr("f", new SymExpr(from));
    CallExpr copy = (CallExpr)call.copy(map);
    assertTrue(((SymExpr)copy.actual(0)).symbol() == to);
    assertTrue(((SymExpr)call.actual(0)).symbol() == from);
  }

  @Test
  public void testRemoveAndInsert() {
    CallExpr a = new CallExpr("a");
    CallExpr b = new CallExpr("b");
    CallExpr c = new CallExpr("c");
    BlockStmt block = new BlockStmt(a, c);
    c.insertBefore(b);
    List<Expr> stmts = block.getBody().toList();
    assertEquals(3, stmts.size());
    assertTrue(a.next() == b && b.next() == c && c.prev() == b);

    b.remove();
    assertTrue(b.getParent() == null);
    assertTrue(a.next() == c);
    assertEquals("{\n  a()\n  c()\n}\n", AstPrinter.print(block));
  }
}
