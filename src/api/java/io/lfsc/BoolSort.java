/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    BoolSort.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import io.lfsc.enumerations.SortKind;

/**
 * Boolean sort
 **/
public class BoolSort extends Sort
{
    @Override
    public SortKind getSortKind()
    {
        return SortKind.BOOL;
    }

    BoolSort(Context ctx, int id, Symbol name)
    {
        super(ctx, id, name);
    }
}
