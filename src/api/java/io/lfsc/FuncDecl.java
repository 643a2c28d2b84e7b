/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    FuncDecl.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import io.lfsc.enumerations.AstKind;
import io.lfsc.enumerations.DeclKind;

/**
 * Function declarations.
 **/
public class FuncDecl extends AST
{
    private final Symbol m_name;
    private final Sort[] m_domain;
    private final Sort m_range;
    private final DeclKind m_kind;

    @Override
    public AstKind getASTKind()
    {
        return AstKind.FUNC_DECL;
    }

    /**
     * The arity of the function declaration
     **/
    public int getArity()
    {
        return m_domain.length;
    }

    /**
     * The size of the domain of the function declaration 
     * @see #getArity
     **/
    public int getDomainSize()
    {
        return m_domain.length;
    }

    /**
     * The domain of the function declaration
     **/
    public Sort[] getDomain()
    {
        return m_domain.clone();
    }

    /**
     * The range of the function declaration
     **/
    public Sort getRange()
    {
        return m_range;
    }

    /**
     * The kind of the function declaration.
     **/
    public DeclKind getDeclKind()
    {
        return m_kind;
    }

    /**
     * The name of the function declaration
     **/
    public Symbol getName()
    {
        return m_name;
    }

    /**
     * Indicates whether this is a user-declared (uninterpreted) symbol.
     **/
    public boolean isUninterpreted()
    {
        return m_kind == DeclKind.UNINTERPRETED;
    }

    /**
     * Create expression that applies function to arguments.
     **/
    public Expr apply(Expr ... args)
    {
        getContext().checkContextMatch(args);
        return getContext().mkApp(this, args);
    }

    FuncDecl(Context ctx, int id, Symbol name, Sort[] domain, Sort range, DeclKind kind)
    {
        super(ctx, id);
        m_name = name;
        m_domain = domain;
        m_range = range;
        m_kind = kind;
    }
}
