/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    Symbol.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * Symbols are used to name several term and type constructors.
 **/
public abstract class Symbol extends LfscObject {
    /**
     * Indicates whether the symbol is of Int kind
     **/
    public boolean isIntSymbol()
    {
        return this instanceof IntSymbol;
    }

    /**
     * Indicates whether the symbol is of string kind.
     **/
    public boolean isStringSymbol()
    {
        return this instanceof StringSymbol;
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this) return true;
        if (!(o instanceof Symbol)) return false;
        Symbol other = (Symbol) o;
        return getContext() == other.getContext()
            && isIntSymbol() == other.isIntSymbol()
            && toString().equals(other.toString());
    }

    @Override
    public int hashCode()
    {
        return toString().hashCode();
    }

    /**
     * A string representation of the symbol.
     **/
    @Override
    public abstract String toString();

    /**
     * Symbol constructor
     **/
    protected Symbol(Context ctx, int id)
    {
        super(ctx, id);
    }
}
