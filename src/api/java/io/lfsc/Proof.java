/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    Proof.java

Abstract:

    Proof nodes. A proof is a DAG: the same node may be the premise of
    several parents. Nodes are compared by identity.

Author:

Notes:
    
**/ 

package io.lfsc;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.lfsc.enumerations.PfRule;

/**
 * An application of a proof rule to premises.
 **/
public class Proof extends LfscObject
{
    private final PfRule m_rule;
    private final List<Proof> m_children;
    private final Expr m_result;
    private final List<AST> m_args;

    /**
     * The rule this node applies.
     **/
    public PfRule getRule()
    {
        return m_rule;
    }

    /**
     * The sub-proofs establishing the premises of the rule.
     **/
    public List<Proof> getChildren()
    {
        return m_children;
    }

    /**
     * The number of premises.
     **/
    public int getNumChildren()
    {
        return m_children.size();
    }

    /**
     * The conclusion of the rule.
     **/
    public Expr getResult()
    {
        return m_result;
    }

    /**
     * The rule-specific arguments (terms or sorts).
     **/
    public List<AST> getArgs()
    {
        return m_args;
    }

    /**
     * Indicates whether the node stands for an asserted formula.
     **/
    public boolean isAssume()
    {
        return m_rule == PfRule.ASSUME;
    }

    @Override
    public String toString()
    {
        return "Proof#" + getId() + "(" + m_rule + " : Expr#" + m_result.getId() + ")";
    }

    Proof(Context ctx, int id, PfRule rule, Proof[] children, Expr result, AST[] args)
    {
        super(ctx, id);
        m_rule = rule;
        m_children = Collections.unmodifiableList(Arrays.asList(children.clone()));
        m_result = result;
        m_args = Collections.unmodifiableList(Arrays.asList(args.clone()));
    }
}
