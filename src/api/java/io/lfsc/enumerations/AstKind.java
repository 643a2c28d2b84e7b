/**
 *  Kinds of abstract syntax tree nodes
 **/

package io.lfsc.enumerations;

/**
 * AstKind
 **/
public enum AstKind {
    NUMERAL (0),
    APP (1),
    SORT (4),
    FUNC_DECL (5),
    UNKNOWN (1000);

    private final int intValue;

    AstKind(int v) {
        this.intValue = v;
    }

    public static final AstKind fromInt(int v) {
        for (AstKind k: values()) 
            if (k.intValue == v) return k;
        return UNKNOWN;
    }

    public final int toInt() { return this.intValue; }
}
