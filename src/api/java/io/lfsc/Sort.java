/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    Sort.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import io.lfsc.enumerations.AstKind;
import io.lfsc.enumerations.SortKind;

/**
 * The Sort class implements type information for ASTs.
 **/
public abstract class Sort extends AST
{
    private final Symbol m_name;

    @Override
    public AstKind getASTKind()
    {
        return AstKind.SORT;
    }

    /**
     * The kind of the sort.
     **/
    public abstract SortKind getSortKind();

    /**
     * The name of the sort
     **/
    public Symbol getName()
    {
        return m_name;
    }

    /**
     * Indicates whether the sort was declared by the user.
     **/
    public boolean isUninterpreted()
    {
        return getSortKind() == SortKind.UNINTERPRETED;
    }

    /**
     * Indicates whether the sort is the Boolean sort.
     **/
    public boolean isBool()
    {
        return getSortKind() == SortKind.BOOL;
    }

    /**
     * Sort constructor
     **/
    Sort(Context ctx, int id, Symbol name)
    {
        super(ctx, id);
        m_name = name;
    }
}
