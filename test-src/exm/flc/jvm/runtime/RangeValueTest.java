package exm.flc.jvm.runtime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import exm.flc.common.Logging;
import exm.flc.frontend.GlobalContext;

public class RangeValueTest {

  private RuntimeLibrary lib;

  @Before
  public void setup() {
    lib = RuntimeLibrary.install(new GlobalContext("range.flc",
                                                   Logging.getFlcLogger()));
  }

  @Test
  public void testSplitAbsolute() {
    List<RangeValue> pieces = new RangeValue(5, 14).split(3, false);
    assertEquals(Arrays.asList(new RangeValue(5, 8), new RangeValue(9, 11),
                               new RangeValue(12, 14)), pieces);
  }

  @Test
  public void testSplitRelative() {
    List<RangeValue> pieces = new RangeValue(5, 14).split(3, true);
    assertEquals(Arrays.asList(new RangeValue(0, 3), new RangeValue(4, 6),
                               new RangeValue(7, 9)), pieces);
  }

  @Test
  public void testSplitSmallAndEmpty() {
    assertEquals(2, new RangeValue(1, 2).split(8, true).size());
    assertTrue(new RangeValue(1, 0).split(4, true).isEmpty());
    assertEquals(0, new RangeValue(3, 2).size());
  }

  @Test
  public void testFastAndGeneralFollowAgree() throws LogicException {
    RangeValue r = new RangeValue(11, 20);
    List<Object> all = new ArrayList<Object>();
    for (RangeValue piece: new RangeValue(1, 10).split(4, true)) {
      List<Object> fast = r.follow(lib, piece, true);
      assertEquals(fast, r.follow(lib, piece, false));
      all.addAll(fast);
    }
    assertEquals(r.serial(lib), all);
    assertEquals(4, lib.fastFollows());
    assertEquals(4, lib.generalFollows());
  }

  @Test
  public void testGeneralFollowOutOfRange() {
    try {
      new RangeValue(1, 3).follow(lib, new RangeValue(2, 5), false);
      fail("Expected LogicException");
    } catch (LogicException e) {
      assertEquals("range 1..3 cannot follow 2..5", e.getMessage());
    }
  }

  @Test
  public void testListCannotFollow() {
    ListValue l = new ListValue(Arrays.<Object>asList(1L, 2L));
    assertEquals(false, l.canFastFollow());
    try {
      l.follow(lib, new RangeValue(0, 1), false);
      fail("Expected LogicException");
    } catch (LogicException e) {
      assertTrue(e.getMessage().contains("cannot be iterated in parallel"));
    }
  }
}
