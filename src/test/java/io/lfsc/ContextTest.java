package io.lfsc;

import org.junit.jupiter.api.Test;

import io.lfsc.enumerations.AstKind;
import io.lfsc.enumerations.DeclKind;
import io.lfsc.enumerations.PfRule;
import io.lfsc.enumerations.SortKind;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ContextTest {

  @Test
  public void termsAreHashConsed() {
    try (Context ctx = new Context()) {
      final Sort u = ctx.mkUninterpretedSort("U");
      final Expr a = ctx.mkConst("a", u);

      assertSame(u, ctx.mkUninterpretedSort("U"));
      assertSame(a, ctx.mkConst("a", u));
      assertSame(ctx.mkEq(a, a), ctx.mkEq(ctx.mkConst("a", u), a));
      assertSame(ctx.mkInt(7), ctx.mkInt("7"));
      assertSame(ctx.mkSymbol("a"), ctx.mkSymbol("a"));
      assertNotEquals(ctx.mkAnd(ctx.mkTrue(), ctx.mkFalse()), ctx.mkAnd(ctx.mkFalse(), ctx.mkTrue()));
    }
  }

  @Test
  public void kindsAreReported() {
    try (Context ctx = new Context()) {
      final Expr x = ctx.mkIntConst("x");
      final IntNum three = ctx.mkInt(3);

      assertEquals(AstKind.APP, x.getASTKind());
      assertTrue(x.isConst());
      assertEquals(AstKind.NUMERAL, three.getASTKind());
      assertEquals(3, three.getInt());
      assertTrue(three.isExpr());
      assertFalse(three.isApp());
      assertEquals(SortKind.INT, x.getSort().getSortKind());
      assertEquals(DeclKind.LT, ctx.mkLt(x, three).getFuncDecl().getDeclKind());
      assertTrue(ctx.mkITE(ctx.mkGt(x, three), x, three).isITE());
      assertTrue(ctx.getBoolSort().isSort());
      assertTrue(x.getFuncDecl().isFuncDecl());
      assertEquals("(ite (> x 3) x 3)", ctx.mkITE(ctx.mkGt(x, three), x, three).toString());
      assertEquals("k!4", ctx.mkConst(ctx.mkSymbol(4), ctx.getIntSort()).toString());
    }
  }

  @Test
  public void enumerationsMapBackFromInts() {
    assertEquals(PfRule.CHAIN_RESOLUTION, PfRule.fromInt(PfRule.CHAIN_RESOLUTION.toInt()));
    assertEquals(PfRule.TRUST, PfRule.fromInt(-1));
    assertEquals(DeclKind.IMPLIES, DeclKind.fromInt(265));
    assertEquals(AstKind.UNKNOWN, AstKind.fromInt(42));
    assertEquals(SortKind.BOOL, SortKind.fromInt(SortKind.BOOL.toInt()));
  }

  @Test
  public void illSortedApplicationIsRejected() {
    try (Context ctx = new Context()) {
      final FuncDecl f = ctx.mkFuncDecl("f", ctx.getIntSort(), ctx.getBoolSort());
      final Expr p = ctx.mkBoolConst("p");

      assertThrows(LfscException.class, () -> f.apply(p));
      assertThrows(LfscException.class, () -> ctx.mkAnd(p, ctx.mkIntConst("x")));
      assertThrows(LfscException.class, () -> f.apply());
    }
    try (Context ctx = new Context(Map.of("well_sorted_check", "false"))) {
      final FuncDecl f = ctx.mkFuncDecl("f", ctx.getIntSort(), ctx.getBoolSort());

      assertEquals("(f p)", f.apply(ctx.mkBoolConst("p")).toString());
    }
  }

  @Test
  public void misuseIsRejected() {
    assertThrows(LfscException.class, () -> new Context(Map.of("proof", "true")));
    try (Context ctx = new Context(); Context other = new Context()) {
      final Expr p = ctx.mkBoolConst("p");

      assertThrows(LfscException.class, () -> other.mkNot(p));
      assertThrows(LfscException.class, () -> ctx.mkBoolConst("and"));
      assertThrows(LfscException.class, () -> ctx.mkBoolConst("has space"));
      assertThrows(LfscException.class, () -> ctx.mkUninterpretedSort("Bool"));
      assertThrows(LfscException.class, () -> ctx.mkIntConst("p"));
      assertThrows(LfscException.class, () -> ctx.mkInt("seven"));
      assertThrows(LfscException.class, () -> ctx.mkProof(PfRule.REFL, new Proof[0], ctx.mkInt(1)));
      assertThrows(LfscException.class,
          () -> ctx.mkProof(PfRule.ASSUME, new Proof[] {ctx.mkAssume(p)}, p));
    }
  }

  @Test
  public void closedContextCreatesNothing() {
    final Context ctx = new Context();
    final Expr p = ctx.mkBoolConst("p");
    ctx.close();

    assertEquals("p", p.toString());
    assertThrows(LfscException.class, () -> ctx.mkBoolConst("q"));
    assertThrows(LfscException.class, ctx::mkParams);
  }

  @Test
  public void proofsKeepTheirStructure() {
    try (Context ctx = new Context()) {
      final Expr p = ctx.mkBoolConst("p");
      final Proof a = ctx.mkAssume(p);
      final Proof s = ctx.mkProof(PfRule.SYMM, new Proof[] {a}, p);

      assertTrue(a.isAssume());
      assertEquals(PfRule.SYMM, s.getRule());
      assertSame(a, s.getChildren().get(0));
      assertSame(p, s.getResult());
      assertTrue(s.getArgs().isEmpty());
      assertThrows(UnsupportedOperationException.class, () -> s.getChildren().add(a));
    }
  }
}
