/**
 *  Kinds of function declarations
 **/

package io.lfsc.enumerations;

/**
 * DeclKind
 *
 * Builtin kinds carry the operator name they print with.
 **/
public enum DeclKind {
    TRUE (256, "true"),
    FALSE (257, "false"),
    EQ (258, "="),
    DISTINCT (259, "distinct"),
    ITE (260, "ite"),
    AND (261, "and"),
    OR (262, "or"),
    IMPLIES (265, "=>"),
    NOT (266, "not"),
    NUMERAL (512, null),
    LE (514, "<="),
    GE (515, ">="),
    LT (516, "<"),
    GT (517, ">"),
    ADD (518, "+"),
    SUB (519, "-"),
    MUL (521, "*"),
    UNINTERPRETED (45056, null);

    private final int intValue;
    private final String opName;

    DeclKind(int v, String opName) {
        this.intValue = v;
        this.opName = opName;
    }

    public static final DeclKind fromInt(int v) {
        for (DeclKind k: values()) 
            if (k.intValue == v) return k;
        return UNINTERPRETED;
    }

    public final int toInt() { return this.intValue; }

    /**
     * The printed operator name, or {@code null} for kinds named by their
     * declaration (uninterpreted symbols and numerals).
     **/
    public final String getOpName() { return this.opName; }

    public final boolean isBuiltin() { return this.opName != null; }
}
