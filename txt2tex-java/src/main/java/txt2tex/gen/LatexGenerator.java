package txt2tex.gen;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import txt2tex.ast.BibliographyMetadata;
import txt2tex.ast.Document;
import txt2tex.ast.DocumentItem;
import txt2tex.ast.PartsFormat;
import txt2tex.ast.TitleMetadata;
import txt2tex.ast.decl.*;
import txt2tex.ast.doc.*;
import txt2tex.ast.expr.*;
import txt2tex.ast.proof.ProofTree;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class LatexGenerator {

    private static final Logger log = LogManager.getLogger(LatexGenerator.class);

    private final Dialect dialect;
    private final SymbolTable symbols;
    private final ProofRenderer proofs;
    private final ProseMath prose;

    public LatexGenerator(Dialect dialect) {
        this.dialect = dialect;
        this.symbols = SymbolTable.forDialect(dialect);
        this.proofs = new ProofRenderer(this, symbols);
        this.prose = new ProseMath(this);
    }

    // ---------- document ----------
    public String generateDocument(Document doc) {
        StringBuilder out = new StringBuilder();
        out.append("\\documentclass[a4paper,10pt,fleqn]{article}\n");
        for (String pkg : dialect.packages()) {
            out.append("\\usepackage{").append(pkg).append("}\n");
        }
        out.append("\\usepackage{amsmath}\n");
        out.append("\\usepackage{proof}\n");

        TitleMetadata title = doc.title();
        if (title != null) appendTitle(out, title);

        out.append("\n\\begin{document}\n\n");
        if (title != null && title.title() != null) out.append("\\maketitle\n\n");

        for (String block : generateItems(doc.items(), doc.partsFormat())) {
            out.append(block).append("\n\n");
        }

        BibliographyMetadata bib = doc.bibliography();
        if (bib != null) {
            out.append("\\bibliographystyle{").append(bib.style() == null ? "plain" : bib.style()).append("}\n");
            out.append("\\bibliography{").append(bib.file()).append("}\n\n");
        }
        out.append("\\end{document}\n");

        log.debug("generated {} chars for {} items ({})", out.length(), doc.items().size(), dialect);
        return out.toString();
    }

    private void appendTitle(StringBuilder out, TitleMetadata t) {
        if (t.title() != null) {
            out.append("\\title{").append(ProseMath.escape(t.title()));
            if (t.subtitle() != null) out.append("\\\\\n\\large ").append(ProseMath.escape(t.subtitle()));
            out.append("}\n");
        }
        if (t.author() != null) {
            out.append("\\author{").append(ProseMath.escape(t.author()));
            if (t.institution() != null) out.append("\\\\\n").append(ProseMath.escape(t.institution()));
            out.append("}\n");
        }
        if (t.date() != null) out.append("\\date{").append(ProseMath.escape(t.date())).append("}\n");
    }

    /** Renders items in order, merging each maximal run of zed items into one environment. */
    List<String> generateItems(List<DocumentItem> items, PartsFormat parts) {
        List<String> blocks = new ArrayList<>();
        List<ZedItem> run = new ArrayList<>();
        for (DocumentItem item : items) {
            if (item instanceof ZedItem z) {
                run.add(z);
                continue;
            }
            if (!run.isEmpty()) {
                blocks.add(zed(run));
                run.clear();
            }
            blocks.add(generateItem(item, parts));
        }
        if (!run.isEmpty()) blocks.add(zed(run));
        return blocks;
    }

    public String generateItem(DocumentItem item) {
        return generateItem(item, PartsFormat.INLINE);
    }

    private String generateItem(DocumentItem item, PartsFormat parts) {
        if (item instanceof ZedItem z) return zed(List.of(z));
        if (item instanceof DeclarationBlock b) return block(b);
        if (item instanceof ProofTree p) return proofs.render(p);
        if (item instanceof ExprItem e) return "$" + generateExpr(e.expression()) + "$";
        if (item instanceof Paragraph p) return prose.render(p.text());
        if (item instanceof PureParagraph p) return ProseMath.escape(p.text());
        if (item instanceof LatexBlock l) return l.latex();
        if (item instanceof Section s) return "\\section*{" + ProseMath.escape(s.title()) + "}";
        if (item instanceof Solution s) {
            return "\\bigskip\n\\noindent\\textbf{" + ProseMath.escape(s.label()) + "}\n\\medskip";
        }
        if (item instanceof Part p) {
            return parts == PartsFormat.SUBSECTION
                    ? "\\subsection*{" + p.label() + "}"
                    : "\\medskip\n\\noindent\\textbf{" + p.label() + "}";
        }
        if (item instanceof PageBreak) return "\\newpage";
        if (item instanceof ArgueChain a) return argue(a);
        throw new GenerationException("No rendering for item " + item.getClass().getSimpleName(), item.line(), 0);
    }

    // ---------- declaration blocks ----------
    private String block(DeclarationBlock b) {
        String open;
        String env;
        String generics = b.genericParams().isEmpty() ? "" : "[" + String.join(", ", b.genericParams()) + "]";
        if (b instanceof Schema s) {
            env = "schema";
            open = "\\begin{schema}{" + symbols.identifier(s.name()) + "}" + generics;
        } else if (b instanceof AxDef) {
            env = "axdef";
            open = "\\begin{axdef}" + generics;
        } else {
            env = "gendef";
            open = "\\begin{gendef}" + generics;
        }

        StringBuilder sb = new StringBuilder(open).append('\n');
        String decls = b.declarations().stream().map(this::declaration).collect(Collectors.joining(" \\\\\n"));
        if (!decls.isEmpty()) sb.append(decls).append('\n');
        if (!b.predicateGroups().isEmpty()) {
            sb.append("\\where\n");
            sb.append(predicateGroups(b.predicateGroups())).append('\n');
        }
        sb.append("\\end{").append(env).append('}');
        return sb.toString();
    }

    private String declaration(Declaration d) {
        String names = d.names().stream().map(symbols::identifier).collect(Collectors.joining(", "));
        return names + " : " + generateExpr(d.type());
    }

    /** Lines of a group end in {@code \\}; consecutive groups are separated by {@code \also}. */
    String predicateGroups(List<List<Expr>> groups) {
        return groups.stream()
                .map(g -> g.stream().map(this::generateExpr).collect(Collectors.joining(" \\\\\n")))
                .collect(Collectors.joining("\n\\also\n"));
    }

    // ---------- zed ----------
    private String zed(List<ZedItem> run) {
        String body = run.stream().map(this::zedLine).collect(Collectors.joining("\n\\also\n"));
        return "\\begin{zed}\n" + body + "\n\\end{zed}";
    }

    private String zedLine(ZedItem item) {
        if (item instanceof GivenType g) {
            return "[" + g.names().stream().map(symbols::identifier).collect(Collectors.joining(", ")) + "]";
        }
        if (item instanceof FreeType f) {
            String branches = f.branches().stream().map(this::branch).collect(Collectors.joining(" | "));
            return symbols.identifier(f.name()) + " ::= " + branches;
        }
        Abbreviation a = (Abbreviation) item;
        String generics = a.genericParams().isEmpty() ? "" : "[" + String.join(", ", a.genericParams()) + "]";
        return symbols.identifier(a.name()) + generics + " == " + generateExpr(a.expression());
    }

    private String branch(FreeBranch b) {
        String name = symbols.identifier(b.name());
        if (b.parameter() == null) return name;
        return name + " \\ldata " + generateExpr(b.parameter()) + " \\rdata";
    }

    // ---------- equivalence chains ----------
    private String argue(ArgueChain chain) {
        String iff = symbols.binary(BinaryExpr.Operator.IFF);
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < chain.steps().size(); i++) {
            ArgueStep step = chain.steps().get(i);
            StringBuilder line = new StringBuilder("  ");
            if (i > 0) line.append(iff).append(' ');
            line.append(generateExpr(step.expression()));
            if (step.justification() != null) {
                line.append(" & [").append(proofs.justification(step.justification())).append(']');
            }
            lines.add(line.toString());
        }
        return "\\begin{argue}\n" + String.join(" \\\\\n", lines) + "\n\\end{argue}";
    }

    // ---------- expressions ----------
    public String generateExpr(Expr e) {
        if (e instanceof Identifier id) return symbols.identifier(id.name());
        if (e instanceof NumberLiteral n) return n.value();
        if (e instanceof BinaryExpr b) {
            return operand(b.left(), b, true) + " " + symbols.binary(b.op()) + " " + operand(b.right(), b, false);
        }
        if (e instanceof UnaryExpr u) return unary(u);
        if (e instanceof Quantifier q) return quantifier(q);
        if (e instanceof SetComprehension c) return comprehension(c);
        if (e instanceof SetLiteral s) return "\\{" + list(s.elements()) + "\\}";
        if (e instanceof TupleExpr t) return "(" + list(t.elements()) + ")";
        if (e instanceof SequenceLiteral s) {
            return s.elements().isEmpty() ? "\\langle \\rangle" : "\\langle " + list(s.elements()) + " \\rangle";
        }
        if (e instanceof FunctionApp f) {
            String fn = f.function() instanceof Identifier || f.function() instanceof FunctionApp
                    ? generateExpr(f.function())
                    : "(" + generateExpr(f.function()) + ")";
            return fn + "(" + list(f.args()) + ")";
        }
        throw new GenerationException("No rendering for expression " + e.getClass().getSimpleName(), e.line(), e.column());
    }

    private String list(List<Expr> elems) {
        return elems.stream().map(this::generateExpr).collect(Collectors.joining(", "));
    }

    private String operand(Expr child, BinaryExpr parent, boolean left) {
        String s = generateExpr(child);
        return needsParens(child, parent, left) ? "(" + s + ")" : s;
    }

    /**
     * A child is grouped when it binds more loosely than its parent, when it sits on
     * the non-associative side at equal precedence, or when the source grouped it.
     */
    static boolean needsParens(Expr child, BinaryExpr parent, boolean left) {
        if (child instanceof Quantifier) return true;
        if (child instanceof UnaryExpr u && u.op() == UnaryExpr.Operator.NOT) {
            return parent.op().precedence() > BinaryExpr.Operator.NEGATION;
        }
        if (!(child instanceof BinaryExpr c)) return false;
        if (c.explicitParens()) return true;

        int cp = c.op().precedence();
        int pp = parent.op().precedence();
        if (cp != pp) return cp < pp;
        return parent.op().rightAssoc() ? left : !left;
    }

    private String unary(UnaryExpr u) {
        String sym = symbols.unary(u.op());
        String inner = generateExpr(u.operand());
        boolean atomic = isAtomic(u.operand());

        if (u.op() == UnaryExpr.Operator.NOT) {
            boolean group = u.operand() instanceof BinaryExpr || u.operand() instanceof Quantifier;
            return sym + " " + (group ? "(" + inner + ")" : inner);
        }
        if (u.op().postfix()) return (atomic ? inner : "(" + inner + ")") + sym;
        if (u.op() == UnaryExpr.Operator.NEGATE) return sym + (atomic ? inner : "(" + inner + ")");
        if (u.op().typeConstructor()) return sym + " " + (atomic ? inner : "(" + inner + ")");

        // #, dom, ran, bigcup chain without parens: dom ran R
        boolean group = u.operand() instanceof BinaryExpr || u.operand() instanceof Quantifier;
        return sym + " " + (group ? "(" + inner + ")" : inner);
    }

    private static boolean isAtomic(Expr e) {
        return e instanceof Identifier || e instanceof NumberLiteral
                || e instanceof FunctionApp || e instanceof SetLiteral
                || e instanceof SetComprehension || e instanceof TupleExpr
                || e instanceof SequenceLiteral
                || (e instanceof UnaryExpr u && u.op().postfix());
    }

    private String quantifier(Quantifier q) {
        StringBuilder sb = new StringBuilder(symbols.quantifier(q.kind())).append(' ');
        sb.append(q.variables().stream().map(symbols::identifier).collect(Collectors.joining(", ")));
        if (q.domain() != null) sb.append(" : ").append(generateExpr(q.domain()));

        if (q.kind() == Quantifier.Kind.MU) {
            if (q.constraint() != null) {
                sb.append(" | ").append(generateExpr(q.constraint())).append(" @ ").append(generateExpr(q.body()));
            } else {
                sb.append(" | ").append(generateExpr(q.body()));
            }
            return sb.toString();
        }
        return sb.append(" @ ").append(generateExpr(q.body())).toString();
    }

    private String comprehension(SetComprehension c) {
        StringBuilder sb = new StringBuilder("\\{ ");
        sb.append(c.variables().stream().map(symbols::identifier).collect(Collectors.joining(", ")));
        sb.append(" : ").append(generateExpr(c.domain()));
        if (c.predicate() != null) sb.append(" | ").append(generateExpr(c.predicate()));
        if (c.expression() != null) sb.append(" @ ").append(generateExpr(c.expression()));
        return sb.append(" \\}").toString();
    }

    String identifier(String name) {
        return symbols.identifier(name);
    }
}
