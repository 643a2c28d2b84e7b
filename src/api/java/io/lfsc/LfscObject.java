/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    LfscObject.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * Internal base class for objects owned by a {@link Context}. Every object
 * carries an identifier that is unique among the objects of its context.
 **/
public abstract class LfscObject {

    private final Context m_ctx;
    private final int m_id;

    LfscObject(Context ctx, int id) {
        m_ctx = ctx;
        m_id = id;
    }

    /**
     * A unique identifier for the object (unique among all objects of the
     * same context and class family).
     **/
    public int getId()
    {
        return m_id;
    }

    Context getContext()
    {
        return m_ctx;
    }

    static int[] arrayToIds(LfscObject[] a)
    {
        if (a == null)
            return null;
        int[] an = new int[a.length];
        for (int i = 0; i < a.length; i++)
            an[i] = (a[i] == null) ? -1 : a[i].getId();
        return an;
    }

    public static int arrayLength(LfscObject[] a)
    {
        return (a == null) ? 0 : a.length;
    }
}
