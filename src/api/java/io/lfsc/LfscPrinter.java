/**
Copyright (c) 2026 lfsc-printer contributors
   
Module Name:

    LfscPrinter.java

Abstract:

    Prints LFSC certificates: declarations, term lets, named assumptions,
    proof lets and the proof body. Scopes are closed from an explicit
    stack of pending closers and proofs are printed from an explicit work
    stack, so neither depends on the depth of the input.

Author:

Notes:
    
**/ 

package io.lfsc;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The LFSC proof printer.
 **/
public class LfscPrinter
{
    private static final Logger log = LogManager.getLogger(LfscPrinter.class);

    static final String PROOF_ID_PREFIX = "@p";
    static final String ASSUME_ID_PREFIX = "@a";

    private final TermProcessor m_tproc;
    private final RuleConverter m_converter;
    private final int m_dagThresh;
    private final boolean m_termLets;
    private final boolean m_proofLets;
    private final boolean m_proofTermLets;
    private final boolean m_comments;

    /**
     * Constructor. Uses the default parameters and rule calculus.
     **/
    public LfscPrinter()
    {
        this(Params.defaults());
    }

    /**
     * Constructor.
     **/
    public LfscPrinter(Params p)
    {
        this(p, TermProcessor.IDENTITY,
            new LfscRuleConverter(p.getBool(Params.TRUST_UNSUPPORTED)));
    }

    /**
     * Constructor.
     *
     * @param p printer parameters
     * @param tproc translation into the printable signature
     * @param converter the rule calculus
     **/
    public LfscPrinter(Params p, TermProcessor tproc, RuleConverter converter)
    {
        m_tproc = tproc;
        m_converter = converter;
        m_dagThresh = p.getInt(Params.DAG_THRESH);
        m_termLets = p.getBool(Params.TERM_LETS);
        m_proofLets = p.getBool(Params.PROOF_LETS);
        m_proofTermLets = p.getBool(Params.PROOF_TERM_LETS);
        m_comments = p.getBool(Params.COMMENTS);
    }

    /**
     * Prints the certificate that {@code pn} refutes {@code assertions}.
     **/
    public void print(Appendable out, List<Expr> assertions, Proof pn)
    {
        try
        {
            printCheck(out, assertions, pn);
        } catch (IOException e)
        {
            throw new LfscException("Failed to write proof", e);
        }
    }

    /**
     * Prints a proof on its own. Assumption leaves have no name here, so
     * {@code pn} must not contain any.
     **/
    public void print(Appendable out, Proof pn)
    {
        try
        {
            Deque<String> cparen = new ArrayDeque<>();
            LetMap<Expr> letMap = LetMap.empty();
            if (m_termLets && m_proofTermLets)
            {
                letMap = Letify.computeTermLets(internalize(
                    Letify.collectProofTerms(pn, m_converter)), m_dagThresh);
                TermPrinter.printLetList(out, cparen, letMap);
            }
            printProofLetify(out, pn, letMap, Collections.<Expr, Integer>emptyMap());
            flush(out, cparen);
        } catch (IOException e)
        {
            throw new LfscException("Failed to write proof", e);
        }
    }

    /**
     * Prints a term with its shared subterms let-bound.
     **/
    public void print(Appendable out, Expr n)
    {
        try
        {
            printLetify(out, m_tproc.toInternal(n));
        } catch (IOException e)
        {
            throw new LfscException("Failed to write term", e);
        }
    }

    /**
     * Prints a sort.
     **/
    public void print(Appendable out, Sort tn)
    {
        try
        {
            TermPrinter.printSort(out, m_tproc.toInternalType(tn));
        } catch (IOException e)
        {
            throw new LfscException("Failed to write sort", e);
        }
    }

    /**
     * The certificate that {@code pn} refutes {@code assertions}.
     **/
    public String toString(List<Expr> assertions, Proof pn)
    {
        StringBuilder sb = new StringBuilder();
        print(sb, assertions, pn);
        return sb.toString();
    }

    /**
     * A proof printed on its own.
     **/
    public String toString(Proof pn)
    {
        StringBuilder sb = new StringBuilder();
        print(sb, pn);
        return sb.toString();
    }

    /**
     * A term printed with its shared subterms let-bound.
     **/
    public String toString(Expr n)
    {
        StringBuilder sb = new StringBuilder();
        print(sb, n);
        return sb.toString();
    }

    /**
     * Names the assertions {@code 0..n-1} in order. If the same term is
     * asserted twice, the later position's name is the one recorded.
     **/
    public static Map<Expr, Integer> bindAssumptions(List<Expr> assertions)
    {
        Map<Expr, Integer> passumeMap = new HashMap<>();
        for (int i = 0, nasserts = assertions.size(); i < nasserts; i++)
            passumeMap.put(assertions.get(i), i);
        return passumeMap;
    }

    private void printCheck(Appendable out, List<Expr> assertions, Proof pn)
        throws IOException
    {
        Deque<String> cparen = new ArrayDeque<>();

        // [1] declarations
        SymbolCollector syms = new SymbolCollector();
        syms.collect(assertions);
        List<Expr> iasserts = internalize(assertions);
        for (Sort st : syms.getSorts())
        {
            out.append("(declare ");
            TermPrinter.printSort(out, m_tproc.toInternalType(st));
            out.append(" sort)\n");
        }
        for (FuncDecl s : syms.getSymbols())
        {
            out.append("(declare ").append(s.getName().toString()).append(' ');
            printDeclType(out, s);
            out.append(")\n");
        }
        log.debug("Declared {} sorts and {} symbols", syms.getSorts().size(),
            syms.getSymbols().size());

        // [2] the check command and term lets
        out.append("(check\n");
        cparen.push(")");
        LetMap<Expr> letMap = LetMap.empty();
        if (m_termLets)
        {
            List<Expr> roots = iasserts;
            if (m_proofTermLets)
            {
                roots = new ArrayList<>(iasserts);
                roots.addAll(internalize(Letify.collectProofTerms(pn, m_converter)));
            }
            letMap = Letify.computeTermLets(roots, m_dagThresh);
        }
        TermPrinter.printLetList(out, cparen, letMap);

        // [3] the assertions
        Map<Expr, Integer> passumeMap = bindAssumptions(iasserts);
        for (int i = 0, nasserts = iasserts.size(); i < nasserts; i++)
        {
            out.append("(% ");
            printAssumeId(out, i);
            out.append(' ');
            TermPrinter.printInternal(out, iasserts.get(i), letMap, null);
            out.append('\n');
            cparen.push(")");
        }

        // [4] the goal
        out.append("(: (holds false)\n");
        cparen.push(")");

        // [5] the proof body
        printProofLetify(out, pn, letMap, passumeMap);

        flush(out, cparen);
        out.append('\n');
    }

    private void printProofLetify(Appendable out, Proof pn, LetMap<Expr> letMap,
        Map<Expr, Integer> passumeMap) throws IOException
    {
        Deque<String> cparen = new ArrayDeque<>();

        // [1] the proof lets
        LetMap<Proof> pletMap = m_proofLets
            ? Letify.computeProofLets(pn, m_dagThresh) : LetMap.<Proof>empty();
        if (!pletMap.isEmpty() && m_comments)
            out.append("; Let proofs:\n");
        for (Proof p : pletMap.getList())
        {
            int id = pletMap.getId(p);
            out.append("(plet _ _ ");
            printProofInternal(out, p, letMap, pletMap, passumeMap, p);
            out.append(" (\\ ");
            printProofId(out, id);
            out.append('\n');
            cparen.push("))");
        }

        // [2] the proof body
        printProofInternal(out, pn, letMap, pletMap, passumeMap, null);

        flush(out, cparen);
    }

    /**
     * Prints {@code pn} from an explicit work stack. A rule application
     * pushes itself back as its own closer, then its arguments, so they are
     * popped left to right before it. {@code exclude} is the proof a
     * {@code plet} is defining, which must not print as its own identifier.
     **/
    private void printProofInternal(Appendable out, Proof pn, LetMap<Expr> letMap,
        LetMap<Proof> pletMap, Map<Expr, Integer> passumeMap, Proof exclude)
        throws IOException
    {
        Deque<PExpr> visit = new ArrayDeque<>();
        // rule applications whose arguments are being printed
        Set<Proof> pending = Collections.newSetFromMap(new IdentityHashMap<>());
        boolean first = true;
        visit.push(PExpr.of(pn));
        do
        {
            PExpr cur = visit.pop();
            if (cur.isProof() && pending.remove(cur.getProof()))
            {
                // a node reached again without a let binding prints again
                out.append(')');
                continue;
            }
            if (!first)
                out.append(' ');
            first = false;
            if (cur.isProof())
            {
                Proof p = cur.getProof();
                Integer pid = p == exclude ? null : pletMap.lookup(p);
                if (pid != null)
                {
                    printProofId(out, pid);
                }
                else if (p.isAssume())
                {
                    Integer aid = passumeMap.get(m_tproc.toInternal(p.getResult()));
                    if (aid == null)
                        throw new LfscConsistencyException("Assumption "
                            + TermPrinter.describe(p.getResult()) + " of " + p
                            + " is not among the asserted formulas");
                    printAssumeId(out, aid);
                }
                else
                {
                    List<PExpr> args = m_converter.computeProofArgs(p);
                    String name = m_converter.getRuleName(p);
                    pending.add(p);
                    visit.push(cur);
                    for (int i = args.size() - 1; i >= 0; i--)
                        visit.push(args.get(i));
                    out.append('(').append(name);
                }
            }
            else if (cur.isTerm())
            {
                TermPrinter.printInternal(out, internalize(cur.getTerm()), letMap, null);
            }
            else
            {
                out.append('_');
            }
        } while (!visit.isEmpty());
    }

    private void printLetify(Appendable out, Expr n) throws IOException
    {
        Deque<String> cparen = new ArrayDeque<>();
        LetMap<Expr> letMap = m_termLets
            ? Letify.computeTermLet(n, m_dagThresh) : LetMap.<Expr>empty();

        // [1] the letification
        TermPrinter.printLetList(out, cparen, letMap);

        // [2] the body
        TermPrinter.printInternal(out, n, letMap, null);

        flush(out, cparen);
    }

    private void printDeclType(Appendable out, FuncDecl f) throws IOException
    {
        Sort[] domain = f.getDomain();
        for (int i = 0; i < domain.length; i++)
            domain[i] = m_tproc.toInternalType(domain[i]);
        TermPrinter.printDeclType(out, domain, m_tproc.toInternalType(f.getRange()));
    }

    private List<Expr> internalize(List<Expr> ns)
    {
        List<Expr> res = new ArrayList<>(ns.size());
        for (Expr n : ns)
            res.add(m_tproc.toInternal(n));
        return res;
    }

    private AST internalize(AST n)
    {
        if (n.isSort())
            return m_tproc.toInternalType((Sort) n);
        if (n.isExpr())
            return m_tproc.toInternal((Expr) n);
        return n;
    }

    private static void flush(Appendable out, Deque<String> cparen) throws IOException
    {
        while (!cparen.isEmpty())
            out.append(cparen.pop());
    }

    private static void printProofId(Appendable out, int id) throws IOException
    {
        out.append(PROOF_ID_PREFIX).append(Integer.toString(id));
    }

    private static void printAssumeId(Appendable out, int id) throws IOException
    {
        out.append(ASSUME_ID_PREFIX).append(Integer.toString(id));
    }
}
