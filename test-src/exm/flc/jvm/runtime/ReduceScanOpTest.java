package exm.flc.jvm.runtime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import exm.flc.common.lang.Types;
import exm.flc.common.lang.Types.TupleType;

public class ReduceScanOpTest {

  @Test
  public void testNullIsIdentity() throws LogicException {
    for (ReduceScanOp op: ReduceScanOp.values()) {
      assertEquals(op.name(), 7L, op.combine(null, 7L));
      assertEquals(op.name(), 7L, op.combine(7L, null));
    }
    assertNull(ReduceScanOp.SUM.combine(null, null));
  }

  @Test
  public void testIdentity() throws LogicException {
    assertEquals(0L, ReduceScanOp.SUM.identity(Types.INT));
    assertEquals(1L, ReduceScanOp.PRODUCT.identity(Types.INT));
    assertEquals(Long.MIN_VALUE, ReduceScanOp.MAX.identity(Types.INT));
    assertEquals(-1L, ReduceScanOp.BITWISE_AND.identity(Types.INT));
    assertEquals(true, ReduceScanOp.LOGICAL_AND.identity(Types.BOOL));
    assertEquals(false, ReduceScanOp.BITWISE_XOR.identity(Types.BOOL));
    assertEquals(Arrays.asList(0L, 0L), ReduceScanOp.SUM.identity(
        TupleType.makeTuple(Types.INT, Types.INT)));
    try {
      ReduceScanOp.LOGICAL_OR.identity(Types.INT);
      fail("Expected LogicException");
    } catch (LogicException e) {
      assertEquals("LogicalOrReduceScanOp has no identity for int",
                   e.getMessage());
    }
  }

  @Test
  public void testIntegerOperators() throws LogicException {
    assertEquals(9L, ReduceScanOp.SUM.combine(4L, 5L));
    assertEquals(20L, ReduceScanOp.PRODUCT.combine(4L, 5L));
    assertEquals(4L, ReduceScanOp.MIN.combine(4L, 5L));
    assertEquals(5L, ReduceScanOp.MAX.combine(4L, 5L));
    assertEquals(4L, ReduceScanOp.BITWISE_AND.combine(6L, 5L));
    assertEquals(7L, ReduceScanOp.BITWISE_OR.combine(6L, 5L));
    assertEquals(3L, ReduceScanOp.BITWISE_XOR.combine(6L, 5L));
  }

  @Test
  public void testBoolOperators() throws LogicException {
    assertEquals(false, ReduceScanOp.LOGICAL_AND.combine(true, false));
    assertEquals(true, ReduceScanOp.LOGICAL_OR.combine(true, false));
    assertEquals(true, ReduceScanOp.BITWISE_XOR.combine(true, false));
    try {
      ReduceScanOp.LOGICAL_AND.combine(true, 1L);
      fail("Expected LogicException");
    } catch (LogicException e) {
      assertEquals("expected a bool, got 1", e.getMessage());
    }
  }

  @Test
  public void testTuplesComponentwise() throws LogicException {
    assertEquals(Arrays.asList(4L, 30L), ReduceScanOp.SUM.combine(
        Arrays.<Object>asList(1L, 10L), Arrays.<Object>asList(3L, 20L)));
    try {
      ReduceScanOp.SUM.combine(Arrays.<Object>asList(1L),
                               Arrays.<Object>asList(1L, 2L));
      fail("Expected LogicException");
    } catch (LogicException e) {
      assertEquals("cannot reduce tuples of sizes 1 and 2", e.getMessage());
    }
  }

  @Test
  public void testClassNames() {
    assertEquals(ReduceScanOp.MAX,
                 ReduceScanOp.forClassName("MaxReduceScanOp"));
    assertNull(ReduceScanOp.forClassName("int"));
  }

  @Test
  public void testReduceCellAccumulates() throws LogicException {
    ReduceCell cell = new ReduceCell(ReduceScanOp.MIN);
    cell.accumulate(8L);
    cell.add(3L);
    cell.accumulate(5L);
    assertEquals(3L, cell.get());
  }
}
