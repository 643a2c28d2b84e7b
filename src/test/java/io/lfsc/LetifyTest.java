package io.lfsc;

import org.junit.jupiter.api.Test;

import io.lfsc.enumerations.PfRule;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LetifyTest {

  @Test
  public void sharedSubtermAcrossRootsIsBound() {
    try (Context ctx = new Context()) {
      final Expr p = ctx.mkBoolConst("P");
      final Expr q = ctx.mkBoolConst("Q");
      final LetMap<Expr> lets = Letify.computeTermLets(Arrays.asList(p, ctx.mkAnd(p, q)), 2);

      assertEquals(List.of(p), lets.getList());
      assertEquals(0, lets.getId(p));
      assertFalse(lets.contains(q));
    }
  }

  @Test
  public void repeatedOccurrenceInsideOneRootCounts() {
    try (Context ctx = new Context()) {
      final Expr x = ctx.mkBoolConst("x");
      final Expr y = ctx.mkBoolConst("y");
      final Expr o = ctx.mkOr(x, y);
      final LetMap<Expr> lets = Letify.computeTermLet(ctx.mkAnd(o, ctx.mkNot(o)), 2);

      assertEquals(List.of(o), lets.getList());
    }
  }

  @Test
  public void childrenAreBoundBeforeParents() {
    try (Context ctx = new Context()) {
      final Expr x = ctx.mkBoolConst("x");
      final Expr y = ctx.mkBoolConst("y");
      final Expr s = ctx.mkOr(x, y);
      final Expr t = ctx.mkAnd(s, s);
      final Expr u = ctx.mkImplies(t, s);
      final LetMap<Expr> lets = Letify.computeTermLets(Arrays.asList(t, u, ctx.mkNot(u)), 2);

      assertEquals(List.of(s, t, u), lets.getList());
      final List<Expr> order = lets.getList();
      for (int i = 0; i < order.size(); i++) {
        for (Expr child : order.get(i).getArgs()) {
          if (lets.contains(child)) assertTrue(lets.getId(child) < i, "child bound after parent");
        }
      }
    }
  }

  @Test
  public void thresholdRaisesTheBar() {
    try (Context ctx = new Context()) {
      final Expr p = ctx.mkBoolConst("P");
      final Expr q = ctx.mkBoolConst("Q");
      final List<Expr> roots = Arrays.asList(ctx.mkAnd(p, q), ctx.mkOr(p, q), ctx.mkNot(p));

      assertEquals(List.of(p, q), Letify.computeTermLets(roots, 2).getList());
      assertEquals(List.of(p), Letify.computeTermLets(roots, 3).getList());
      assertThrows(LfscException.class, () -> Letify.computeTermLets(roots, 1));
    }
  }

  @Test
  public void sharedLemmaIsBoundOnceAndAssumptionsNever() {
    try (Context ctx = new Context()) {
      final Sort u = ctx.mkUninterpretedSort("U");
      final Expr a = ctx.mkConst("a", u);
      final Expr b = ctx.mkConst("b", u);
      final Proof assume = ctx.mkAssume(ctx.mkEq(a, b));
      final Proof lemma = ctx.mkProof(PfRule.SYMM, new Proof[] {assume}, ctx.mkEq(b, a));
      final Proof other = ctx.mkProof(PfRule.SYMM, new Proof[] {assume}, ctx.mkEq(b, a));
      final Proof root =
          ctx.mkProof(PfRule.AND_INTRO, new Proof[] {lemma, lemma, other},
              ctx.mkAnd(ctx.mkEq(b, a), ctx.mkEq(b, a), ctx.mkEq(b, a)));

      final LetMap<Proof> plets = Letify.computeProofLets(root, 2);
      assertEquals(1, plets.size());
      assertTrue(plets.getList().get(0) == lemma);
      assertFalse(plets.contains(assume));
    }
  }

  @Test
  public void proofLetsAreKeyedByIdentity() {
    try (Context ctx = new Context()) {
      final Expr p = ctx.mkBoolConst("P");
      final Proof s1 = ctx.mkProof(PfRule.SPLIT, new Proof[0], ctx.mkOr(p, ctx.mkNot(p)), p);
      final Proof s2 = ctx.mkProof(PfRule.SPLIT, new Proof[0], ctx.mkOr(p, ctx.mkNot(p)), p);
      final Proof root = ctx.mkProof(PfRule.AND_INTRO, new Proof[] {s1, s2}, p);

      assertTrue(Letify.computeProofLets(root, 2).isEmpty());
    }
  }

  @Test
  public void exponentialUnrollingStaysLinear() {
    try (Context ctx = new Context()) {
      final Expr a = ctx.mkBoolConst("A");
      Proof p = ctx.mkAssume(a);
      for (int i = 0; i < 60; i++) {
        p = ctx.mkProof(PfRule.AND_INTRO, new Proof[] {p, p}, a);
      }

      final LetMap<Proof> plets = Letify.computeProofLets(p, 2);
      assertEquals(59, plets.size());
      for (int i = 1; i < plets.size(); i++) {
        assertTrue(plets.getList().get(i).getChildren().get(0) == plets.getList().get(i - 1));
      }
    }
  }

  @Test
  public void deepTermsDoNotOverflow() {
    try (Context ctx = new Context()) {
      Expr t = ctx.mkBoolConst("P");
      for (int i = 0; i < 200_000; i++) {
        t = ctx.mkNot(t);
      }
      assertTrue(Letify.computeTermLet(t, 2).isEmpty());
    }
  }

  @Test
  public void collectsPrintedProofTerms() {
    try (Context ctx = new Context()) {
      final Expr x = ctx.mkBoolConst("x");
      final Expr y = ctx.mkBoolConst("y");
      final Proof a0 = ctx.mkAssume(ctx.mkOr(x, y));
      final Proof a1 = ctx.mkAssume(ctx.mkNot(x));
      final Proof res = ctx.mkProof(PfRule.RESOLUTION, new Proof[] {a0, a1}, y, x);
      final Proof split = ctx.mkProof(PfRule.SPLIT, new Proof[0], ctx.mkOr(y, ctx.mkNot(y)), y);
      final Proof root = ctx.mkProof(PfRule.AND_INTRO, new Proof[] {res, split, res}, y);

      final List<Expr> terms = Letify.collectProofTerms(root, new LfscRuleConverter());
      assertEquals(2, terms.size());
      assertTrue(terms.contains(x));
      assertTrue(terms.contains(y));
    }
  }
}
