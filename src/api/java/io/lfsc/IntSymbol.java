/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    IntSymbol.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * Numbered symbols
 **/
public class IntSymbol extends Symbol
{
    private final int m_value;

    /**
     * The int value of the symbol.
     **/
    public int getInt()
    {
        return m_value;
    }

    /**
     * Numbered symbols print with a leading {@code k!} so they never read as
     * numerals.
     **/
    @Override
    public String toString()
    {
        return "k!" + m_value;
    }

    IntSymbol(Context ctx, int id, int i)
    {
        super(ctx, id);
        if (i < 0)
            throw new LfscException("Symbol number must be non-negative");
        m_value = i;
    }
}
