/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    LfscConsistencyException.java

Abstract:

    Raised when the printer finds a broken invariant in its inputs or
    in its own let maps. The current print call is aborted.

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * A consistency violation found while printing. Output written before the
 * violation is incomplete and must be discarded.
 **/
@SuppressWarnings("serial")
public class LfscConsistencyException extends LfscException
{
    /**
     * Constructor.
     **/
    public LfscConsistencyException(String message)
    {
        super(message);
    }
}
