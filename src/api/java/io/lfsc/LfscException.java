/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    LfscException.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * The exception base class for error reporting from the LFSC printer
 **/
@SuppressWarnings("serial")
public class LfscException extends RuntimeException
{
    /**
     * Constructor.
     **/
    public LfscException()
    {
        super();
    }

    /**
     * Constructor.
     **/
    public LfscException(String message)
    {
        super(message);
    }

    /**
     * Constructor.
     **/
    public LfscException(String message, Exception inner)
    {
        super(message, inner);
    }
}
