/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    LfscRuleConverter.java

Abstract:

    The default rule calculus: printed rule names and argument shapes.
    Premises whose conclusion the checker can infer print as holes.

Author:

Notes:
    
**/ 

package io.lfsc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts proof rule applications of the default calculus.
 **/
public class LfscRuleConverter implements RuleConverter
{
    private static final Logger log = LogManager.getLogger(LfscRuleConverter.class);

    private final boolean m_trustUnsupported;

    /**
     * Constructor. Unsupported rules raise
     * {@link LfscUnsupportedRuleException}.
     **/
    public LfscRuleConverter()
    {
        this(false);
    }

    /**
     * Constructor.
     *
     * @param trustUnsupported print unsupported rules as a {@code trust}
     *        step on their conclusion instead of failing
     **/
    public LfscRuleConverter(boolean trustUnsupported)
    {
        m_trustUnsupported = trustUnsupported;
    }

    @Override
    public String getRuleName(Proof pn)
    {
        switch (pn.getRule())
        {
        case ASSUME:
            throw new LfscConsistencyException("Assumption " + pn + " has no rule name");
        case TRUST:
            if (!m_trustUnsupported)
                throw unsupported(pn);
            log.warn("Printing unsupported step {} as trust", pn);
            return "trust";
        default:
            return pn.getRule().name().toLowerCase(Locale.ROOT);
        }
    }

    @Override
    public List<PExpr> computeProofArgs(Proof pn)
    {
        List<PExpr> pargs = new ArrayList<>();
        List<Proof> children = pn.getChildren();
        switch (pn.getRule())
        {
        case ASSUME:
            throw new LfscConsistencyException("Assumption " + pn + " has no rule arguments");
        case REFL:
        {
            requireShape(pn, 0, 0);
            Expr res = pn.getResult();
            if (!res.isEq())
                throw new LfscConsistencyException("Reflexivity must conclude an equality: " + pn);
            pargs.add(PExpr.of(res.getArg(0)));
            break;
        }
        case SYMM:
            requireShape(pn, 1, 0);
            pargs.add(PExpr.of(children.get(0)));
            break;
        case TRANS:
        case AND_INTRO:
            requireMinChildren(pn, 1);
            requireShape(pn, children.size(), 0);
            addProofs(pargs, children);
            break;
        case CONG:
            requireMinChildren(pn, 1);
            requireShape(pn, children.size(), 0);
            pargs.add(PExpr.hole());
            pargs.add(PExpr.hole());
            addProofs(pargs, children);
            break;
        case TRUE_INTRO:
        case TRUE_ELIM:
        case FALSE_INTRO:
        case FALSE_ELIM:
        case NOT_NOT_ELIM:
        case NOT_AND:
            requireShape(pn, 1, 0);
            pargs.add(PExpr.hole());
            pargs.add(PExpr.of(children.get(0)));
            break;
        case MODUS_PONENS:
        case EQ_RESOLVE:
            requireShape(pn, 2, 0);
            pargs.add(PExpr.hole());
            pargs.add(PExpr.hole());
            addProofs(pargs, children);
            break;
        case IMPLIES_ELIM:
            requireShape(pn, 1, 0);
            pargs.add(PExpr.hole());
            pargs.add(PExpr.hole());
            pargs.add(PExpr.of(children.get(0)));
            break;
        case AND_ELIM:
            requireShape(pn, 1, 1);
            if (!pn.getArgs().get(0).isNumeral())
                throw new LfscConsistencyException("and_elim expects a numeral index: " + pn);
            pargs.add(PExpr.hole());
            pargs.add(PExpr.of(children.get(0)));
            pargs.add(PExpr.of(pn.getArgs().get(0)));
            break;
        case CONTRA:
            requireShape(pn, 2, 0);
            pargs.add(PExpr.hole());
            addProofs(pargs, children);
            break;
        case RESOLUTION:
            requireShape(pn, 2, 1);
            pargs.add(PExpr.hole());
            pargs.add(PExpr.hole());
            addProofs(pargs, children);
            pargs.add(PExpr.of(pn.getArgs().get(0)));
            break;
        case CHAIN_RESOLUTION:
            requireMinChildren(pn, 2);
            requireShape(pn, children.size(), children.size() - 1);
            for (int i = 0; i < children.size(); i++)
            {
                if (i > 0)
                    pargs.add(PExpr.of(pn.getArgs().get(i - 1)));
                pargs.add(PExpr.of(children.get(i)));
            }
            break;
        case SPLIT:
            requireShape(pn, 0, 1);
            pargs.add(PExpr.of(pn.getArgs().get(0)));
            break;
        case SCOPE:
            requireShape(pn, 1, pn.getArgs().size());
            pargs.add(PExpr.of(children.get(0)));
            for (AST a : pn.getArgs())
                pargs.add(PExpr.of(a));
            break;
        case TRUST:
            if (!m_trustUnsupported)
                throw unsupported(pn);
            pargs.add(PExpr.of(pn.getResult()));
            break;
        default:
            throw unsupported(pn);
        }
        return pargs;
    }

    private static LfscUnsupportedRuleException unsupported(Proof pn)
    {
        return new LfscUnsupportedRuleException(pn.getRule(),
            "No printed form for rule " + pn.getRule() + " in " + pn);
    }

    private static void addProofs(List<PExpr> pargs, List<Proof> children)
    {
        for (Proof c : children)
            pargs.add(PExpr.of(c));
    }

    private static void requireMinChildren(Proof pn, int n)
    {
        if (pn.getNumChildren() < n)
            throw new LfscConsistencyException("Rule " + pn.getRule() + " expects at least "
                + n + " premises, got " + pn.getNumChildren() + " in " + pn);
    }

    private static void requireShape(Proof pn, int nchildren, int nargs)
    {
        if (pn.getNumChildren() != nchildren)
            throw new LfscConsistencyException("Rule " + pn.getRule() + " expects "
                + nchildren + " premises, got " + pn.getNumChildren() + " in " + pn);
        if (pn.getArgs().size() != nargs)
            throw new LfscConsistencyException("Rule " + pn.getRule() + " expects "
                + nargs + " arguments, got " + pn.getArgs().size() + " in " + pn);
    }
}
