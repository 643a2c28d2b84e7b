/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    StringSymbol.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * Named symbols
 **/
public class StringSymbol extends Symbol
{
    private final String m_name;

    /**
     * The string value of the symbol.
     **/
    public String getString()
    {
        return m_name;
    }

    @Override
    public String toString()
    {
        return m_name;
    }

    StringSymbol(Context ctx, int id, String s)
    {
        super(ctx, id);
        if (s == null || s.isEmpty())
            throw new LfscException("Symbol name must be non-empty");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ';')
                throw new LfscException("Symbol name contains a reserved character: " + s);
        }
        m_name = s;
    }
}
