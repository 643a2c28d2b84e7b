/**
 *  Kinds of sorts
 **/

package io.lfsc.enumerations;

/**
 * SortKind
 **/
public enum SortKind {
    UNINTERPRETED (0),
    BOOL (1),
    INT (2),
    UNKNOWN (1000);

    private final int intValue;

    SortKind(int v) {
        this.intValue = v;
    }

    public static final SortKind fromInt(int v) {
        for (SortKind k: values()) 
            if (k.intValue == v) return k;
        return UNKNOWN;
    }

    public final int toInt() { return this.intValue; }
}
