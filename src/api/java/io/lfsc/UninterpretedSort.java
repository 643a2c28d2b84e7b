/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    UninterpretedSort.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import io.lfsc.enumerations.SortKind;

/**
 * Uninterpreted Sorts
 **/
public class UninterpretedSort extends Sort
{
    @Override
    public SortKind getSortKind()
    {
        return SortKind.UNINTERPRETED;
    }

    UninterpretedSort(Context ctx, int id, Symbol name)
    {
        super(ctx, id, name);
    }
}
