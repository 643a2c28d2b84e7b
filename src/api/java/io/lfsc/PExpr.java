/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    PExpr.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

/**
 * A work item of the proof printer: a term (or sort) to print, a proof to
 * print, or a hole. Exactly one alternative is populated.
 **/
public final class PExpr
{
    private static final PExpr HOLE = new PExpr(null, null);

    private final AST m_term;
    private final Proof m_proof;

    private PExpr(AST term, Proof proof)
    {
        m_term = term;
        m_proof = proof;
    }

    /**
     * A term or sort argument.
     **/
    public static PExpr of(AST term)
    {
        if (term == null)
            throw new LfscException("Term argument must not be null");
        return new PExpr(term, null);
    }

    /**
     * A sub-proof argument.
     **/
    public static PExpr of(Proof proof)
    {
        if (proof == null)
            throw new LfscException("Proof argument must not be null");
        return new PExpr(null, proof);
    }

    /**
     * An elided argument the checker reconstructs.
     **/
    public static PExpr hole()
    {
        return HOLE;
    }

    public boolean isTerm()
    {
        return m_term != null;
    }

    public boolean isProof()
    {
        return m_proof != null;
    }

    public boolean isHole()
    {
        return m_term == null && m_proof == null;
    }

    public AST getTerm()
    {
        return m_term;
    }

    public Proof getProof()
    {
        return m_proof;
    }

    @Override
    public String toString()
    {
        if (isTerm())
            return m_term.toString();
        if (isProof())
            return m_proof.toString();
        return "_";
    }
}
