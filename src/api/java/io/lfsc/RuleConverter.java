/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    RuleConverter.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.util.List;

/**
 * Resolves the printed name and the argument list of a proof rule
 * application. Implementations define a proof calculus and must handle
 * every {@link io.lfsc.enumerations.PfRule} other than {@code ASSUME},
 * either by converting it or by throwing
 * {@link LfscUnsupportedRuleException}.
 **/
public interface RuleConverter
{
    /**
     * The name the rule application prints with.
     **/
    String getRuleName(Proof pn);

    /**
     * The arguments of the rule application, left to right.
     **/
    List<PExpr> computeProofArgs(Proof pn);
}
