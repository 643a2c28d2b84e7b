/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    Letify.java

Abstract:

    Sharing detection for term and proof DAGs. A count pass records how
    often each node is reached, then an ordering pass binds the nodes that
    reached the threshold, children before parents.

Author:

Notes:
    
**/ 

package io.lfsc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes let bindings for shared subterms and shared sub-proofs.
 **/
public final class Letify
{
    private static final Logger log = LogManager.getLogger(Letify.class);

    private static final Function<Expr, List<Expr>> TERM_CHILDREN =
        e -> Arrays.asList(e.getArgs());
    private static final Function<Proof, List<Proof>> PROOF_CHILDREN =
        Proof::getChildren;

    private Letify() {}

    /**
     * Computes the let bindings for the terms occurring at least
     * {@code threshold} times in the forest {@code roots}. A term occurring
     * more than once inside a single root counts each occurrence.
     **/
    public static LetMap<Expr> computeTermLets(List<Expr> roots, int threshold)
    {
        List<Expr> visitList = new ArrayList<>();
        Map<Expr, Integer> count = new HashMap<>();
        for (Expr r : roots)
            updateCounts(r, TERM_CHILDREN, visitList, count);
        LetMap<Expr> letMap = LetMap.forTerms();
        convertCountToLet(visitList, count, threshold, letMap);
        log.debug("{} term lets over {} distinct terms", letMap.size(), visitList.size());
        return letMap;
    }

    /**
     * Computes the let bindings for a single term.
     **/
    public static LetMap<Expr> computeTermLet(Expr root, int threshold)
    {
        return computeTermLets(Collections.singletonList(root), threshold);
    }

    /**
     * Computes the let bindings for the sub-proofs of {@code root} that are
     * the premise of at least {@code threshold} rule applications. Proof
     * nodes are keyed by identity. Assumption leaves are never bound.
     **/
    public static LetMap<Proof> computeProofLets(Proof root, int threshold)
    {
        List<Proof> visitList = new ArrayList<>();
        Map<Proof, Integer> count = new IdentityHashMap<>();
        updateCounts(root, PROOF_CHILDREN, visitList, count);
        LetMap<Proof> pletMap = LetMap.forIdentity();
        List<Proof> candidates = new ArrayList<>(visitList.size());
        for (Proof p : visitList)
            if (!p.isAssume())
                candidates.add(p);
        convertCountToLet(candidates, count, threshold, pletMap);
        log.debug("{} proof lets over {} distinct proof nodes", pletMap.size(), visitList.size());
        return pletMap;
    }

    /**
     * Collects the terms {@code converter} prints as rule arguments
     * anywhere in the proof DAG, once per distinct proof node.
     **/
    public static List<Expr> collectProofTerms(Proof root, RuleConverter converter)
    {
        List<Expr> terms = new ArrayList<>();
        Set<Proof> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Proof> visit = new ArrayDeque<>();
        visit.push(root);
        while (!visit.isEmpty())
        {
            Proof cur = visit.pop();
            if (!visited.add(cur) || cur.isAssume())
                continue;
            for (PExpr a : converter.computeProofArgs(cur))
            {
                if (a.isTerm() && a.getTerm().isExpr())
                    terms.add((Expr) a.getTerm());
            }
            for (Proof c : cur.getChildren())
                visit.push(c);
        }
        return terms;
    }

    /**
     * Post-order count pass. A node's children are descended into only on
     * its first visit; later visits just bump its count. {@code visitList}
     * receives each distinct node once, after all of its children.
     **/
    static <T> void updateCounts(T root, Function<T, List<T>> children,
        List<T> visitList, Map<T, Integer> count)
    {
        Deque<T> visit = new ArrayDeque<>();
        visit.push(root);
        while (!visit.isEmpty())
        {
            T cur = visit.peek();
            Integer c = count.get(cur);
            if (c == null)
            {
                // children pending
                count.put(cur, 0);
                List<T> cs = children.apply(cur);
                for (int i = cs.size() - 1; i >= 0; i--)
                    visit.push(cs.get(i));
            }
            else if (c == 0)
            {
                visit.pop();
                count.put(cur, 1);
                visitList.add(cur);
            }
            else
            {
                visit.pop();
                count.put(cur, c + 1);
            }
        }
    }

    /**
     * Ordering pass: binds, in visit order, every node whose count reached
     * {@code threshold}.
     **/
    static <T> void convertCountToLet(List<T> visitList, Map<T, Integer> count,
        int threshold, LetMap<T> letMap)
    {
        if (threshold < 2)
            throw new LfscException("Let threshold must be at least 2, got " + threshold);
        for (T n : visitList)
        {
            Integer c = count.get(n);
            if (c == null)
                throw new LfscConsistencyException("Node was visited but never counted: "
                    + TermPrinter.describe(n));
            if (c >= threshold && !letMap.contains(n))
                letMap.add(n);
        }
    }
}
