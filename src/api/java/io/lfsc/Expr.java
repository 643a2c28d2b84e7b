/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    Expr.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import io.lfsc.enumerations.AstKind;
import io.lfsc.enumerations.DeclKind;

/**
 * Expressions are terms.
 **/
public class Expr extends AST
{
    private final FuncDecl m_decl;
    private final Expr[] m_args;

    @Override
    public AstKind getASTKind()
    {
        return AstKind.APP;
    }

    /**
     * The function declaration of the function that is applied in this
     * expression.
     * @return a FuncDecl
     **/
    public FuncDecl getFuncDecl()
    {
        return m_decl;
    }

    /**
     * The number of arguments of the expression.
     * @return an int
     **/
    public int getNumArgs()
    {
        return m_args.length;
    }

    /**
     * The i-th argument of the expression.
     **/
    public Expr getArg(int i)
    {
        return m_args[i];
    }

    /**
     * The arguments of the expression.
     * @return an Expr[]
     **/
    public Expr[] getArgs()
    {
        return m_args.clone();
    }

    /**
     * The Sort of the term.
     **/
    public Sort getSort()
    {
        return m_decl.getRange();
    }

    /**
     * Indicates whether the term represents a constant.
     **/
    public boolean isConst()
    {
        return isApp() && getNumArgs() == 0 && m_decl.isUninterpreted();
    }

    /**
     * Indicates whether the term has Boolean sort.
     **/
    public boolean isBool()
    {
        return getSort().isBool();
    }

    /**
     * Indicates whether the term is the constant true.
     **/
    public boolean isTrue()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.TRUE;
    }

    /**
     * Indicates whether the term is the constant false.
     **/
    public boolean isFalse()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.FALSE;
    }

    /**
     * Indicates whether the term is an equality predicate.
     **/
    public boolean isEq()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.EQ;
    }

    /**
     * Indicates whether the term is an n-ary conjunction
     **/
    public boolean isAnd()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.AND;
    }

    /**
     * Indicates whether the term is an n-ary disjunction
     **/
    public boolean isOr()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.OR;
    }

    /**
     * Indicates whether the term is an implication
     **/
    public boolean isImplies()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.IMPLIES;
    }

    /**
     * Indicates whether the term is a negation
     **/
    public boolean isNot()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.NOT;
    }

    /**
     * Indicates whether the term is a ternary if-then-else term
     **/
    public boolean isITE()
    {
        return isApp() && m_decl.getDeclKind() == DeclKind.ITE;
    }

    Expr(Context ctx, int id, FuncDecl decl, Expr[] args)
    {
        super(ctx, id);
        m_decl = decl;
        m_args = args;
    }
}
