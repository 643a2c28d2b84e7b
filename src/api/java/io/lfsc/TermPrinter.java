/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    TermPrinter.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Prints terms and sorts as s-expressions. Let-bound subterms print as
 * their identifier. Sorts are never let-bound.
 **/
final class TermPrinter
{
    static final String TERM_ID_PREFIX = "@t";

    private static final String CLOSE = ")";
    private static final String SPACE = " ";

    private TermPrinter() {}

    /**
     * Prints a let binding for every term in {@code letMap}, in binding
     * order, and pushes the closer of each onto {@code cparen}.
     **/
    static void printLetList(Appendable out, Deque<String> cparen, LetMap<Expr> letMap)
        throws IOException
    {
        for (Expr nl : letMap.getList())
        {
            out.append("(@ ");
            printId(out, letMap.getId(nl));
            out.append(' ');
            printInternal(out, nl, letMap, nl);
            out.append('\n');
            cparen.push(CLOSE);
        }
    }

    /**
     * Renders a node for a diagnostic. Terms are let-bound at every shared
     * subterm, so the text grows with the number of distinct subterms.
     **/
    static String describe(Object n)
    {
        if (!(n instanceof Expr))
            return String.valueOf(n);
        Expr e = (Expr) n;
        StringBuilder sb = new StringBuilder();
        Deque<String> cparen = new ArrayDeque<>();
        try
        {
            LetMap<Expr> letMap = Letify.computeTermLet(e, 2);
            printLetList(sb, cparen, letMap);
            printInternal(sb, e, letMap, null);
        } catch (IOException ex)
        {
            throw new LfscException("Failed to print term", ex);
        }
        while (!cparen.isEmpty())
            sb.append(cparen.pop());
        return sb.toString();
    }

    /**
     * Prints {@code n}, replacing every subterm bound in {@code letMap} by
     * its identifier. {@code exclude} is printed structurally even if it is
     * bound; it is the term a let binding is defining.
     **/
    static void printInternal(Appendable out, AST n, LetMap<Expr> letMap, Expr exclude)
        throws IOException
    {
        if (n.isSort())
        {
            printSort(out, (Sort) n);
            return;
        }
        if (n.isFuncDecl())
        {
            out.append(((FuncDecl) n).getName().toString());
            return;
        }
        Deque<Object> visit = new ArrayDeque<>();
        visit.push(n);
        while (!visit.isEmpty())
        {
            Object item = visit.pop();
            if (item instanceof String)
            {
                out.append((String) item);
                continue;
            }
            Expr cur = (Expr) item;
            Integer id = cur == exclude ? null : letMap.lookup(cur);
            if (id != null)
            {
                printId(out, id);
            }
            else if (cur.isNumeral())
            {
                printNumeral(out, ((IntNum) cur).getBigInteger());
            }
            else if (cur.getNumArgs() == 0)
            {
                out.append(opName(cur.getFuncDecl()));
            }
            else
            {
                out.append('(').append(opName(cur.getFuncDecl()));
                visit.push(CLOSE);
                for (int i = cur.getNumArgs() - 1; i >= 0; i--)
                {
                    visit.push(cur.getArg(i));
                    visit.push(SPACE);
                }
            }
        }
    }

    /**
     * Prints a sort. Sorts are always printed as-is.
     **/
    static void printSort(Appendable out, Sort s) throws IOException
    {
        out.append(s.getName().toString());
    }

    /**
     * Prints the type of a declared symbol: its range if it is a constant,
     * otherwise {@code (-> D1 ... Dn R)}.
     **/
    static void printDeclType(Appendable out, Sort[] domain, Sort range) throws IOException
    {
        if (domain.length == 0)
        {
            printSort(out, range);
            return;
        }
        out.append("(->");
        for (Sort d : domain)
        {
            out.append(' ');
            printSort(out, d);
        }
        out.append(' ');
        printSort(out, range);
        out.append(')');
    }

    static void printId(Appendable out, int id) throws IOException
    {
        out.append(TERM_ID_PREFIX).append(Integer.toString(id));
    }

    private static void printNumeral(Appendable out, BigInteger v) throws IOException
    {
        if (v.signum() < 0)
            out.append("(- ").append(v.negate().toString()).append(')');
        else
            out.append(v.toString());
    }

    private static String opName(FuncDecl f)
    {
        String op = f.getDeclKind().getOpName();
        return op != null ? op : f.getName().toString();
    }
}
