/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    SymbolCollector.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the free symbols of a set of terms, and the user sorts their
 * signatures mention, in the order they are first reached.
 **/
public class SymbolCollector
{
    private final Set<FuncDecl> m_symbols = new LinkedHashSet<>();
    private final Set<Sort> m_sorts = new LinkedHashSet<>();
    private final Set<Expr> m_visited = new HashSet<>();

    /**
     * Adds the symbols of {@code n}. Subterms already visited through an
     * earlier call are skipped.
     **/
    public void collect(Expr n)
    {
        Deque<Expr> visit = new ArrayDeque<>();
        visit.push(n);
        while (!visit.isEmpty())
        {
            Expr cur = visit.pop();
            if (!m_visited.add(cur))
                continue;
            FuncDecl f = cur.getFuncDecl();
            if (f.isUninterpreted() && m_symbols.add(f))
            {
                for (Sort s : f.getDomain())
                    addSort(s);
                addSort(f.getRange());
            }
            for (int i = cur.getNumArgs() - 1; i >= 0; i--)
                visit.push(cur.getArg(i));
        }
    }

    /**
     * Adds the symbols of every term in {@code ns}.
     **/
    public void collect(List<Expr> ns)
    {
        for (Expr n : ns)
            collect(n);
    }

    /**
     * The uninterpreted function and constant symbols collected so far.
     **/
    public Set<FuncDecl> getSymbols()
    {
        return Collections.unmodifiableSet(m_symbols);
    }

    /**
     * The user-declared sorts collected so far.
     **/
    public Set<Sort> getSorts()
    {
        return Collections.unmodifiableSet(m_sorts);
    }

    private void addSort(Sort s)
    {
        if (s.isUninterpreted())
            m_sorts.add(s);
    }
}
