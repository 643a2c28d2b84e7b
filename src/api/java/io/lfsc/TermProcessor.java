/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    TermProcessor.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * Translates terms and sorts into the printable signature. The translation
 * must be injective.
 **/
public interface TermProcessor
{
    /**
     * Leaves terms and sorts unchanged.
     **/
    TermProcessor IDENTITY = new TermProcessor() {
        @Override
        public Expr toInternal(Expr n)
        {
            return n;
        }

        @Override
        public Sort toInternalType(Sort tn)
        {
            return tn;
        }
    };

    Expr toInternal(Expr n);

    Sort toInternalType(Sort tn);
}
