/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    LfscUnsupportedRuleException.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import io.lfsc.enumerations.PfRule;

/**
 * Signals a proof rule the rule converter has no printed form for.
 **/
@SuppressWarnings("serial")
public class LfscUnsupportedRuleException extends LfscException
{
    private final PfRule m_rule;

    /**
     * Constructor.
     **/
    public LfscUnsupportedRuleException(PfRule rule, String message)
    {
        super(message);
        m_rule = rule;
    }

    /**
     * The rule that could not be converted.
     **/
    public PfRule getRule()
    {
        return m_rule;
    }
}
