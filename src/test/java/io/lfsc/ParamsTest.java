package io.lfsc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParamsTest {

  @Test
  public void defaultsApplyUntilSet() {
    try (Context ctx = new Context()) {
      final Params p = ctx.mkParams();

      assertEquals(2, p.getInt("dag_thresh"));
      assertTrue(p.getBool("proof_lets"));
      assertFalse(p.getBool("trust_unsupported"));
      assertEquals("(params)", p.toString());

      p.add("dag_thresh", 3);
      p.add("comments", "false");
      assertEquals(3, p.getInt("dag_thresh"));
      assertFalse(p.getBool("comments"));
      assertEquals("(params dag_thresh 3 comments false)", p.toString());
    }
  }

  @Test
  public void badSettingsAreRejected() {
    try (Context ctx = new Context()) {
      final Params p = ctx.mkParams();

      assertThrows(LfscException.class, () -> p.add("timeout", 10));
      assertThrows(LfscException.class, () -> p.add("dag_thresh", 1));
      assertThrows(LfscException.class, () -> p.add("dag_thresh", true));
      assertThrows(LfscException.class, () -> p.add("dag_thresh", "many"));
      assertThrows(LfscException.class, () -> p.add("comments", "maybe"));
      assertThrows(LfscException.class, () -> p.getInt("comments"));
    }
  }

  @Test
  public void thresholdReachesThePrinter() {
    try (Context ctx = new Context()) {
      final Expr x = ctx.mkBoolConst("x");
      final Expr y = ctx.mkBoolConst("y");
      final Expr t = ctx.mkAnd(x, ctx.mkOr(x, y), ctx.mkNot(y));
      final Params p = ctx.mkParams();
      p.add("dag_thresh", 3);

      assertEquals("(@ @t0 x\n(@ @t1 y\n(and @t0 (or @t0 @t1) (not @t1))))",
          new LfscPrinter().toString(t));
      assertEquals("(and x (or x y) (not y))", new LfscPrinter(p).toString(t));
    }
  }
}
