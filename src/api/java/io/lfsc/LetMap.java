/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    LetMap.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The let bindings computed for a DAG: the bound nodes in definition order,
 * and the identifier of each. Every node's bound descendants come before it
 * in the list.
 **/
public class LetMap<T>
{
    private final List<T> m_list = new ArrayList<>();
    private final Map<T, Integer> m_ids;

    private LetMap(Map<T, Integer> ids)
    {
        m_ids = ids;
    }

    /**
     * A let map keyed by term equality, which for hash-consed terms is
     * identity.
     **/
    static <T> LetMap<T> forTerms()
    {
        return new LetMap<>(new HashMap<>());
    }

    /**
     * A let map keyed by object identity.
     **/
    static <T> LetMap<T> forIdentity()
    {
        return new LetMap<>(new IdentityHashMap<>());
    }

    /**
     * An empty let map.
     **/
    public static <T> LetMap<T> empty()
    {
        return new LetMap<>(Collections.emptyMap());
    }

    /**
     * Binds {@code key} to the next identifier.
     **/
    void add(T key)
    {
        m_ids.put(key, m_list.size());
        m_list.add(key);
    }

    /**
     * The bound nodes, first-defined first.
     **/
    public List<T> getList()
    {
        return Collections.unmodifiableList(m_list);
    }

    /**
     * The number of bindings.
     **/
    public int size()
    {
        return m_list.size();
    }

    /**
     * Indicates whether the map is empty.
     **/
    public boolean isEmpty()
    {
        return m_list.isEmpty();
    }

    /**
     * Indicates whether {@code key} is bound.
     **/
    public boolean contains(T key)
    {
        return m_ids.containsKey(key);
    }

    /**
     * The identifier of {@code key}, or {@code null} if it is not bound.
     **/
    public Integer lookup(T key)
    {
        return m_ids.get(key);
    }

    /**
     * The identifier of a node known to be bound.
     * 
     * @throws LfscConsistencyException if {@code key} is not bound
     **/
    public int getId(T key)
    {
        Integer id = m_ids.get(key);
        if (id == null)
            throw new LfscConsistencyException("No let identifier for "
                + TermPrinter.describe(key));
        return id;
    }
}
