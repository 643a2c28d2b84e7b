/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    AST.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.io.IOException;

import io.lfsc.enumerations.AstKind;

/**
 * The abstract syntax tree (AST) class.
 *
 * ASTs are hash-consed by their {@link Context}: two ASTs are equal exactly
 * when they are the same object.
 **/
public abstract class AST extends LfscObject implements Comparable<AST>
{
    /**
     * Object comparison.
     * 
     * @param o another AST
     **/
    @Override
    public boolean equals(Object o)
    {
        if (o == this) return true;
        if (!(o instanceof AST)) return false;
        AST casted = (AST) o;

        return
            (getContext() == casted.getContext()) &&
                (getId() == casted.getId());
    }

    /**
     * Object Comparison. 
     * @param other Another AST
     * 
     * @return Negative if the object should be sorted before {@code other}, 
     * positive if after else zero.
     **/
    @Override
    public int compareTo(AST other)
    {
        if (other == null) {
            return 1;
        }
        return Integer.compare(getId(), other.getId());
    }

    /**
     * The AST's hash code.
     * 
     * @return A hash code
     **/
    @Override
    public int hashCode()
    {
        return getId();
    }

    /**
     * The kind of the AST.
     **/
    public abstract AstKind getASTKind();

    /**
     * Indicates whether the AST is an Expr
     **/
    public boolean isExpr()
    {
        switch (getASTKind())
        {
        case APP:
        case NUMERAL:
            return true;
        default:
            return false;
        }
    }

    /**
     * Indicates whether the AST is an application
     * @return a boolean
     **/
    public boolean isApp()
    {
        return this.getASTKind() == AstKind.APP;
    }

    /**
     * Indicates whether the AST is a numeral
     **/
    public boolean isNumeral()
    {
        return this.getASTKind() == AstKind.NUMERAL;
    }

    /**
     * Indicates whether the AST is a Sort
     **/
    public boolean isSort()
    {
        return this.getASTKind() == AstKind.SORT;
    }

    /**
     * Indicates whether the AST is a FunctionDeclaration
     **/
    public boolean isFuncDecl()
    {
        return this.getASTKind() == AstKind.FUNC_DECL;
    }

    /**
     * A string representation of the AST.
     **/
    @Override
    public String toString() {
        return getSExpr();
    }

    /**
     * A string representation of the AST in s-expression notation, without
     * any let bindings.
     **/
    public String getSExpr()
    {
        StringBuilder sb = new StringBuilder();
        try
        {
            TermPrinter.printInternal(sb, this, LetMap.<Expr>empty(), null);
        } catch (IOException e)
        {
            throw new LfscException("Failed to print AST", e);
        }
        return sb.toString();
    }

    AST(Context ctx, int id) {
        super(ctx, id);
    }
}
