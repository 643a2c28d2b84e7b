/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    Context.java

Abstract:

Author:

Notes:
    
**/ 

package io.lfsc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.lfsc.enumerations.DeclKind;
import io.lfsc.enumerations.PfRule;

/**
 * The Context creates and owns terms, sorts, declarations and proofs.
 *
 * Terms, sorts and declarations are hash-consed: building the same
 * structure twice yields the same object.
 **/
public class Context implements AutoCloseable
{
    /**
     * Constructor.
     **/
    public Context()
    {
        this(new HashMap<String, String>());
    }

    /**
     * Constructor.
     * Remarks:
     * The following parameters can be set:        
     *     - well_sorted_check (Boolean)  reject applications whose arguments
     *                                    do not match the declaration domain
     **/
    public Context(Map<String, String> settings)
    {
        for (Map.Entry<String, String> kv : settings.entrySet())
        {
            if (kv.getKey().equals("well_sorted_check"))
                m_wellSortedCheck = Params.parseBool(kv.getKey(), kv.getValue());
            else
                throw new LfscException("Unknown context setting: " + kv.getKey());
        }
        m_boolSort = new BoolSort(this, nextAstId(), mkSymbol("Bool"));
        m_intSort = new IntSort(this, nextAstId(), mkSymbol("Int"));
    }

    private boolean m_wellSortedCheck = true;
    private boolean m_closed = false;

    private int m_astCount = 0;
    private int m_symbolCount = 0;
    private int m_proofCount = 0;

    private final Map<String, StringSymbol> m_stringSymbols = new HashMap<>();
    private final Map<Integer, IntSymbol> m_intSymbols = new HashMap<>();
    private final Map<Symbol, UninterpretedSort> m_userSorts = new HashMap<>();
    private final Map<List<Object>, FuncDecl> m_decls = new HashMap<>();
    private final Map<Symbol, FuncDecl> m_userDeclsByName = new HashMap<>();
    private final Map<List<Integer>, Expr> m_apps = new HashMap<>();
    private final Map<BigInteger, IntNum> m_numerals = new HashMap<>();

    private final BoolSort m_boolSort;
    private final IntSort m_intSort;

    /**
     * Creates a new symbol using an integer. 
     * Remarks: Integer symbols must be non-negative.
     **/
    public IntSymbol mkSymbol(int i)
    {
        checkOpen();
        IntSymbol s = m_intSymbols.get(i);
        if (s == null)
        {
            s = new IntSymbol(this, m_symbolCount++, i);
            m_intSymbols.put(i, s);
        }
        return s;
    }

    /**
     * Create a symbol using a string.
     **/
    public StringSymbol mkSymbol(String name)
    {
        checkOpen();
        StringSymbol s = m_stringSymbols.get(name);
        if (s == null)
        {
            s = new StringSymbol(this, m_symbolCount++, name);
            m_stringSymbols.put(name, s);
        }
        return s;
    }

    /**
     * Retrieves the Boolean sort of the context.
     **/
    public BoolSort getBoolSort()
    {
        return m_boolSort;
    }

    /**
     * Retrieves the Integer sort of the context.
     **/
    public IntSort getIntSort()
    {
        return m_intSort;
    }

    /**
     * Create a new uninterpreted sort.
     **/
    public UninterpretedSort mkUninterpretedSort(Symbol s)
    {
        checkOpen();
        checkContextMatch(s);
        if (s.equals(m_boolSort.getName()) || s.equals(m_intSort.getName()))
            throw new LfscException("Sort name is reserved: " + s);
        UninterpretedSort res = m_userSorts.get(s);
        if (res == null)
        {
            res = new UninterpretedSort(this, nextAstId(), s);
            m_userSorts.put(s, res);
        }
        return res;
    }

    /**
     * Create a new uninterpreted sort.
     **/
    public UninterpretedSort mkUninterpretedSort(String str)
    {
        return mkUninterpretedSort(mkSymbol(str));
    }

    /**
     * Creates a new function declaration.
     * Remarks: A name can only be declared with one signature.
     **/
    public FuncDecl mkFuncDecl(Symbol name, Sort[] domain, Sort range)
    {
        checkOpen();
        checkContextMatch(name);
        checkContextMatch(domain);
        checkContextMatch(range);
        for (DeclKind k : DeclKind.values())
            if (k.isBuiltin() && k.getOpName().equals(name.toString()))
                throw new LfscException("Symbol name is reserved: " + name);
        FuncDecl existing = m_userDeclsByName.get(name);
        if (existing != null)
        {
            if (existing.getRange() != range
                || !Arrays.equals(LfscObject.arrayToIds(existing.getDomain()),
                    LfscObject.arrayToIds(domain)))
                throw new LfscException("Symbol " + name + " is already declared with a different signature");
            return existing;
        }
        FuncDecl res = mkDecl(DeclKind.UNINTERPRETED, name, domain, range);
        m_userDeclsByName.put(name, res);
        return res;
    }

    /**
     * Creates a new function declaration.
     **/
    public FuncDecl mkFuncDecl(Symbol name, Sort domain, Sort range)
    {
        return mkFuncDecl(name, new Sort[] { domain }, range);
    }

    /**
     * Creates a new function declaration.
     **/
    public FuncDecl mkFuncDecl(String name, Sort[] domain, Sort range)
    {
        return mkFuncDecl(mkSymbol(name), domain, range);
    }

    /**
     * Creates a new function declaration.
     **/
    public FuncDecl mkFuncDecl(String name, Sort domain, Sort range)
    {
        return mkFuncDecl(mkSymbol(name), new Sort[] { domain }, range);
    }

    /**
     * Creates a new constant function declaration.
     **/
    public FuncDecl mkConstDecl(String name, Sort range)
    {
        return mkFuncDecl(mkSymbol(name), new Sort[0], range);
    }

    /**
     * Creates a new Constant of sort {@code range} and named
     * {@code name}.
     **/
    public Expr mkConst(Symbol name, Sort range)
    {
        return mkApp(mkFuncDecl(name, new Sort[0], range));
    }

    /**
     * Creates a new Constant of sort {@code range} and named
     * {@code name}.
     **/
    public Expr mkConst(String name, Sort range)
    {
        return mkConst(mkSymbol(name), range);
    }

    /**
     * Creates a Boolean constant.
     **/
    public Expr mkBoolConst(String name)
    {
        return mkConst(mkSymbol(name), getBoolSort());
    }

    /**
     * Creates an integer constant.
     **/
    public Expr mkIntConst(String name)
    {
        return mkConst(mkSymbol(name), getIntSort());
    }

    /**
     * Create a new function application.
     **/
    public Expr mkApp(FuncDecl f, Expr ... args)
    {
        checkOpen();
        checkContextMatch(f);
        checkContextMatch(args);
        if (args.length != f.getArity())
            throw new LfscException("Number of arguments does not match the arity of " + f.getName());
        if (m_wellSortedCheck)
        {
            Sort[] domain = f.getDomain();
            for (int i = 0; i < args.length; i++)
                if (args[i].getSort() != domain[i])
                    throw new LfscException("Argument " + i + " of " + f.getName()
                        + " has sort " + args[i].getSort() + ", expected " + domain[i]);
        }
        List<Integer> key = new ArrayList<>(args.length + 1);
        key.add(f.getId());
        for (Expr a : args)
            key.add(a.getId());
        Expr res = m_apps.get(key);
        if (res == null)
        {
            res = new Expr(this, nextAstId(), f, args.clone());
            m_apps.put(key, res);
        }
        return res;
    }

    /**
     * The true Term.
     **/
    public Expr mkTrue()
    {
        return mkApp(mkBuiltin(DeclKind.TRUE, new Sort[0], getBoolSort()));
    }

    /**
     * The false Term.
     **/
    public Expr mkFalse()
    {
        return mkApp(mkBuiltin(DeclKind.FALSE, new Sort[0], getBoolSort()));
    }

    /**
     * Creates a Boolean value.
     **/
    public Expr mkBool(boolean value)
    {
        return value ? mkTrue() : mkFalse();
    }

    /**
     * Creates the equality {@code x = y}
     **/
    public Expr mkEq(Expr x, Expr y)
    {
        checkContextMatch(x);
        checkContextMatch(y);
        return mkApp(mkBuiltin(DeclKind.EQ, new Sort[] { x.getSort(), x.getSort() },
            getBoolSort()), x, y);
    }

    /**
     * Creates a {@code distinct} term.
     **/
    public Expr mkDistinct(Expr ... args)
    {
        checkContextMatch(args);
        if (args.length < 2)
            throw new LfscException("distinct expects at least two arguments");
        return mkApp(mkBuiltin(DeclKind.DISTINCT, sameSorts(args[0].getSort(), args.length),
            getBoolSort()), args);
    }

    /**
     * Mk an expression representing {@code not(a)}.
     **/
    public Expr mkNot(Expr a)
    {
        checkContextMatch(a);
        return mkApp(mkBuiltin(DeclKind.NOT, new Sort[] { getBoolSort() }, getBoolSort()), a);
    }

    /**
     * Create an expression representing an if-then-else:
     * {@code ite(t1, t2, t3)}.
     **/
    public Expr mkITE(Expr t1, Expr t2, Expr t3)
    {
        checkContextMatch(t1);
        checkContextMatch(t2);
        checkContextMatch(t3);
        return mkApp(mkBuiltin(DeclKind.ITE,
            new Sort[] { getBoolSort(), t2.getSort(), t2.getSort() }, t2.getSort()), t1, t2, t3);
    }

    /**
     * Create an expression representing {@code t1 implies t2}.
     **/
    public Expr mkImplies(Expr t1, Expr t2)
    {
        return mkBoolOp(DeclKind.IMPLIES, t1, t2);
    }

    /**
     * Create an expression representing {@code t[0] and t[1] and ...}.
     **/
    public Expr mkAnd(Expr ... t)
    {
        return mkBoolOp(DeclKind.AND, t);
    }

    /**
     * Create an expression representing {@code t[0] or t[1] or ...}.
     **/
    public Expr mkOr(Expr ... t)
    {
        return mkBoolOp(DeclKind.OR, t);
    }

    /**
     * Create an expression representing {@code t[0] + t[1] + ...}.
     **/
    public Expr mkAdd(Expr ... t)
    {
        return mkIntOp(DeclKind.ADD, getIntSort(), t);
    }

    /**
     * Create an expression representing {@code t[0] - t[1] - ...}.
     **/
    public Expr mkSub(Expr ... t)
    {
        return mkIntOp(DeclKind.SUB, getIntSort(), t);
    }

    /**
     * Create an expression representing {@code t[0] * t[1] * ...}.
     **/
    public Expr mkMul(Expr ... t)
    {
        return mkIntOp(DeclKind.MUL, getIntSort(), t);
    }

    /**
     * Create an expression representing {@code t1 < t2}
     **/
    public Expr mkLt(Expr t1, Expr t2)
    {
        return mkIntOp(DeclKind.LT, getBoolSort(), t1, t2);
    }

    /**
     * Create an expression representing {@code t1 <= t2}
     **/
    public Expr mkLe(Expr t1, Expr t2)
    {
        return mkIntOp(DeclKind.LE, getBoolSort(), t1, t2);
    }

    /**
     * Create an expression representing {@code t1 > t2}
     **/
    public Expr mkGt(Expr t1, Expr t2)
    {
        return mkIntOp(DeclKind.GT, getBoolSort(), t1, t2);
    }

    /**
     * Create an expression representing {@code t1 >= t2}
     **/
    public Expr mkGe(Expr t1, Expr t2)
    {
        return mkIntOp(DeclKind.GE, getBoolSort(), t1, t2);
    }

    /**
     * Create an integer numeral.
     **/
    public IntNum mkInt(BigInteger v)
    {
        checkOpen();
        IntNum res = m_numerals.get(v);
        if (res == null)
        {
            FuncDecl numeral = mkDecl(DeclKind.NUMERAL, mkSymbol("numeral"),
                new Sort[0], getIntSort());
            res = new IntNum(this, nextAstId(), numeral, v);
            m_numerals.put(v, res);
        }
        return res;
    }

    /**
     * Create an integer numeral.
     **/
    public IntNum mkInt(long v)
    {
        return mkInt(BigInteger.valueOf(v));
    }

    /**
     * Create an integer numeral.
     *
     * @param v A string representing the value in decimal notation.
     **/
    public IntNum mkInt(String v)
    {
        try
        {
            return mkInt(new BigInteger(v));
        } catch (NumberFormatException e)
        {
            throw new LfscException("Not an integer numeral: " + v, e);
        }
    }

    /**
     * Creates a proof node applying {@code rule} to the premises
     * {@code children}, concluding {@code result}.
     **/
    public Proof mkProof(PfRule rule, Proof[] children, Expr result, AST ... args)
    {
        checkOpen();
        checkContextMatch(children);
        checkContextMatch(result);
        checkContextMatch(args);
        if (!result.isBool())
            throw new LfscException("Proof conclusion must be a formula: "
                + TermPrinter.describe(result));
        if (rule == PfRule.ASSUME && children.length != 0)
            throw new LfscException("ASSUME proofs have no premises");
        return new Proof(this, m_proofCount++, rule, children, result, args);
    }

    /**
     * Creates a proof node applying {@code rule} to the premises
     * {@code children}, concluding {@code result}.
     **/
    public Proof mkProof(PfRule rule, List<Proof> children, Expr result, List<? extends AST> args)
    {
        return mkProof(rule, children.toArray(new Proof[0]), result, args.toArray(new AST[0]));
    }

    /**
     * Creates a proof leaf standing for the assertion {@code result}.
     **/
    public Proof mkAssume(Expr result)
    {
        return mkProof(PfRule.ASSUME, new Proof[0], result);
    }

    /**
     * Creates a parameter set for the printer.
     **/
    public Params mkParams()
    {
        checkOpen();
        return new Params(this);
    }

    /**
     * Whether applications are sort checked.
     **/
    public boolean isWellSortedCheck()
    {
        return m_wellSortedCheck;
    }

    /**
     * Disposes of the context. Objects created by it stay readable, but
     * the context cannot create new ones.
     **/
    @Override
    public void close()
    {
        m_closed = true;
        m_stringSymbols.clear();
        m_intSymbols.clear();
        m_userSorts.clear();
        m_decls.clear();
        m_userDeclsByName.clear();
        m_apps.clear();
        m_numerals.clear();
    }

    void checkContextMatch(LfscObject other)
    {
        if (other == null)
            throw new LfscException("Argument must not be null");
        if (this != other.getContext())
            throw new LfscException("Context mismatch");
    }

    void checkContextMatch(LfscObject[] arr)
    {
        if (arr == null)
            throw new LfscException("Argument array must not be null");
        for (LfscObject a : arr)
            checkContextMatch(a);
    }

    private void checkOpen()
    {
        if (m_closed)
            throw new LfscException("Context is closed");
    }

    private int nextAstId()
    {
        return m_astCount++;
    }

    private FuncDecl mkDecl(DeclKind kind, Symbol name, Sort[] domain, Sort range)
    {
        List<Object> key = new ArrayList<>(domain.length + 3);
        key.add(kind);
        key.add(name);
        key.add(range.getId());
        for (Sort s : domain)
            key.add(s.getId());
        FuncDecl res = m_decls.get(key);
        if (res == null)
        {
            res = new FuncDecl(this, nextAstId(), name, domain.clone(), range, kind);
            m_decls.put(key, res);
        }
        return res;
    }

    private FuncDecl mkBuiltin(DeclKind kind, Sort[] domain, Sort range)
    {
        checkOpen();
        return mkDecl(kind, mkSymbol(kind.getOpName()), domain, range);
    }

    private Expr mkBoolOp(DeclKind kind, Expr ... t)
    {
        checkContextMatch(t);
        if (t.length == 0)
            throw new LfscException(kind.getOpName() + " expects at least one argument");
        return mkApp(mkBuiltin(kind, sameSorts(getBoolSort(), t.length), getBoolSort()), t);
    }

    private Expr mkIntOp(DeclKind kind, Sort range, Expr ... t)
    {
        checkContextMatch(t);
        if (t.length == 0)
            throw new LfscException(kind.getOpName() + " expects at least one argument");
        return mkApp(mkBuiltin(kind, sameSorts(getIntSort(), t.length), range), t);
    }

    private static Sort[] sameSorts(Sort s, int n)
    {
        Sort[] res = new Sort[n];
        Arrays.fill(res, s);
        return res;
    }
}
