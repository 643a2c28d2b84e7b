/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    IntNum.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.math.BigInteger;

import io.lfsc.enumerations.AstKind;

/**
 * Integer Numerals
 **/
public class IntNum extends Expr
{
    private final BigInteger m_value;

    @Override
    public AstKind getASTKind()
    {
        return AstKind.NUMERAL;
    }

    /**
     * Retrieve the int value.
     **/
    public int getInt()
    {
        if (m_value.bitLength() > 31)
            throw new LfscException("Numeral is not an int");
        return m_value.intValue();
    }

    /**
     * Retrieve the BigInteger value.
     **/
    public BigInteger getBigInteger()
    {
        return m_value;
    }

    IntNum(Context ctx, int id, FuncDecl decl, BigInteger value)
    {
        super(ctx, id, decl, new Expr[0]);
        m_value = value;
    }
}
