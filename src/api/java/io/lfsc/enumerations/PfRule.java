/**
 *  Proof rules
 **/

package io.lfsc.enumerations;

/**
 * PfRule
 *
 * The closed set of rules a proof node can be labelled with.
 * {@code ASSUME} marks a leaf standing for a top-level assertion.
 **/
public enum PfRule {
    ASSUME (0),
    SCOPE (1),
    TRUST (2),
    REFL (10),
    SYMM (11),
    TRANS (12),
    CONG (13),
    TRUE_INTRO (14),
    TRUE_ELIM (15),
    FALSE_INTRO (16),
    FALSE_ELIM (17),
    MODUS_PONENS (20),
    EQ_RESOLVE (21),
    AND_ELIM (30),
    AND_INTRO (31),
    NOT_NOT_ELIM (32),
    CONTRA (33),
    RESOLUTION (34),
    CHAIN_RESOLUTION (35),
    SPLIT (36),
    IMPLIES_ELIM (37),
    NOT_AND (38);

    private final int intValue;

    PfRule(int v) {
        this.intValue = v;
    }

    public static final PfRule fromInt(int v) {
        for (PfRule k: values()) 
            if (k.intValue == v) return k;
        return TRUST;
    }

    public final int toInt() { return this.intValue; }
}
