/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    Params.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A ParameterSet represents a printer configuration in the form of
 * name/value pairs.
 * Remarks:
 * The following parameters can be set:
 *     - dag_thresh (unsigned, 2)          occurrences at which a term or proof is let-bound
 *     - term_lets (Boolean, true)         let-bind shared terms
 *     - proof_lets (Boolean, true)        let-bind shared sub-proofs
 *     - proof_term_lets (Boolean, true)   count terms used as proof rule arguments for term lets
 *     - trust_unsupported (Boolean, false) print a trust step for unsupported rules
 *     - comments (Boolean, true)          print comment lines
 **/
public class Params extends LfscObject {

    static final String DAG_THRESH = "dag_thresh";
    static final String TERM_LETS = "term_lets";
    static final String PROOF_LETS = "proof_lets";
    static final String PROOF_TERM_LETS = "proof_term_lets";
    static final String TRUST_UNSUPPORTED = "trust_unsupported";
    static final String COMMENTS = "comments";

    private static final Map<String, Object> DEFAULTS = new LinkedHashMap<>();

    static {
        DEFAULTS.put(DAG_THRESH, 2);
        DEFAULTS.put(TERM_LETS, true);
        DEFAULTS.put(PROOF_LETS, true);
        DEFAULTS.put(PROOF_TERM_LETS, true);
        DEFAULTS.put(TRUST_UNSUPPORTED, false);
        DEFAULTS.put(COMMENTS, true);
    }

    private final Map<String, Object> m_values = new LinkedHashMap<>();

    /**
     * Adds a parameter setting.
     **/
    public void add(String name, boolean value)
    {
        checkType(name, Boolean.class);
        m_values.put(name, value);
    }

    /**
     * Adds a parameter setting.
     **/
    public void add(String name, int value)
    {
        checkType(name, Integer.class);
        if (name.equals(DAG_THRESH) && value < 2)
            throw new LfscException("dag_thresh must be at least 2, got " + value);
        m_values.put(name, value);
    }

    /**
     * Adds a parameter setting, parsing {@code value} according to the
     * parameter's type.
     **/
    public void add(String name, String value)
    {
        Object def = DEFAULTS.get(name);
        if (def == null)
            throw new LfscException("Unknown parameter: " + name);
        if (def instanceof Boolean)
            add(name, parseBool(name, value));
        else
        {
            try
            {
                add(name, Integer.parseInt(value.trim()));
            } catch (NumberFormatException e)
            {
                throw new LfscException("Parameter " + name + " expects an unsigned integer, got " + value, e);
            }
        }
    }

    /**
     * Retrieves a Boolean parameter, or its default.
     **/
    public boolean getBool(String name)
    {
        checkType(name, Boolean.class);
        return (Boolean) m_values.getOrDefault(name, DEFAULTS.get(name));
    }

    /**
     * Retrieves an integer parameter, or its default.
     **/
    public int getInt(String name)
    {
        checkType(name, Integer.class);
        return (Integer) m_values.getOrDefault(name, DEFAULTS.get(name));
    }

    /**
     * A string representation of the parameter set.
     **/
    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("(params");
        for (Map.Entry<String, Object> kv : m_values.entrySet())
            sb.append(' ').append(kv.getKey()).append(' ').append(kv.getValue());
        sb.append(')');
        return sb.toString();
    }

    static boolean parseBool(String name, String value)
    {
        String v = value.trim();
        if (v.equalsIgnoreCase("true"))
            return true;
        if (v.equalsIgnoreCase("false"))
            return false;
        throw new LfscException("Parameter " + name + " expects true or false, got " + value);
    }

    private static void checkType(String name, Class<?> type)
    {
        Object def = DEFAULTS.get(name);
        if (def == null)
            throw new LfscException("Unknown parameter: " + name);
        if (!type.isInstance(def))
            throw new LfscException("Parameter " + name + " has type "
                + (def instanceof Boolean ? "bool" : "int"));
    }

    /**
     * A parameter set holding only defaults, not tied to a context.
     **/
    static Params defaults()
    {
        return new Params(null);
    }

    Params(Context ctx)
    {
        super(ctx, 0);
    }
}
