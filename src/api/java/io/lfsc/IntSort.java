/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    IntSort.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import io.lfsc.enumerations.SortKind;

/**
 * Integer sort
 **/
public class IntSort extends Sort
{
    @Override
    public SortKind getSortKind()
    {
        return SortKind.INT;
    }

    IntSort(Context ctx, int id, Symbol name)
    {
        super(ctx, id, name);
    }
}
