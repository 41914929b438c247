package txt2tex.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import txt2tex.TranslationException;
import txt2tex.ast.BibliographyMetadata;
import txt2tex.ast.Document;
import txt2tex.ast.DocumentItem;
import txt2tex.ast.PartsFormat;
import txt2tex.ast.TitleMetadata;
import txt2tex.ast.decl.*;
import txt2tex.ast.doc.*;
import txt2tex.ast.expr.*;
import txt2tex.ast.proof.ProofTree;
import txt2tex.lexer.LexerException;
import txt2tex.lexer.Token;
import txt2tex.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class Parser {

    private static final Logger log = LogManager.getLogger(Parser.class);

    // tokens that open a new top-level item and so close any open one
    private static final Set<TokenType> structural = EnumSet.of(
            TokenType.SCHEMA, TokenType.AXDEF, TokenType.GENDEF, TokenType.GIVEN,
            TokenType.TEXT, TokenType.PURETEXT, TokenType.LATEX,
            TokenType.SECTION, TokenType.SOLUTION, TokenType.PART_LABEL,
            TokenType.PROOF, TokenType.EQUIV, TokenType.PAGEBREAK,
            TokenType.TITLE, TokenType.SUBTITLE, TokenType.AUTHOR, TokenType.DATE,
            TokenType.INSTITUTION, TokenType.BIBLIOGRAPHY, TokenType.BIBLIOGRAPHY_STYLE,
            TokenType.PARTS);

    private static final Set<TokenType> operandStarts = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.NUMBER,
            TokenType.LPAREN, TokenType.LBRACE, TokenType.LANGLE,
            TokenType.HASH, TokenType.DOM, TokenType.RAN,
            TokenType.POWER, TokenType.POWER1, TokenType.FINSET, TokenType.FINSET1,
            TokenType.SEQ, TokenType.SEQ1, TokenType.ISEQ, TokenType.BAG,
            TokenType.BIGCUP, TokenType.BIGCAP);

    // bracket nesting beyond this is rejected before the call stack runs out
    static final int MAX_NESTING = 100;

    private final List<Token> tokens;
    private int pos = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens) {
        // '<<' and '>>' may be split in place when they open or close nested sequences
        this.tokens = new ArrayList<>(tokens);
    }

    // ---------- entry ----------
    public Document parseDocument() {
        List<DocumentItem> items = new ArrayList<>();
        String[] title = new String[5];
        String bibFile = null;
        String bibStyle = null;
        PartsFormat parts = PartsFormat.INLINE;

        skipLayout();
        while (!check(TokenType.EOF)) {
            Token t = peek();
            switch (t.type()) {
                case TITLE -> title[0] = advance().lexeme();
                case SUBTITLE -> title[1] = advance().lexeme();
                case AUTHOR -> title[2] = advance().lexeme();
                case DATE -> title[3] = advance().lexeme();
                case INSTITUTION -> title[4] = advance().lexeme();
                case BIBLIOGRAPHY -> bibFile = advance().lexeme();
                case BIBLIOGRAPHY_STYLE -> bibStyle = advance().lexeme();
                case PARTS -> parts = parsePartsFormat(advance());
                default -> items.add(parseItem());
            }
            skipLayout();
        }

        TitleMetadata meta = null;
        for (String s : title) {
            if (s != null) {
                meta = new TitleMetadata(title[0], title[1], title[2], title[3], title[4]);
                break;
            }
        }
        BibliographyMetadata bib = bibFile == null ? null : new BibliographyMetadata(bibFile, bibStyle);

        log.debug("parsed document with {} items", items.size());
        return new Document(items, meta, bib, parts);
    }

    /** Expression-only mode: the whole input must be one expression. */
    public Expr parseExpression() {
        skipLayout();
        Expr e = parseExpr();
        skipLayout();
        if (!check(TokenType.EOF)) throw error(peek(), "Unexpected token after expression");
        return e;
    }

    // ---------- items ----------
    private DocumentItem parseItem() {
        Token t = peek();
        switch (t.type()) {
            case TEXT:
                advance();
                return new Paragraph(t.lexeme(), t.line());
            case PURETEXT:
                advance();
                return new PureParagraph(t.lexeme(), t.line());
            case LATEX:
                advance();
                return new LatexBlock(t.lexeme(), t.line());
            case SECTION:
                advance();
                return new Section(t.lexeme(), t.line());
            case SOLUTION:
                advance();
                return new Solution(t.lexeme(), t.line());
            case PART_LABEL:
                advance();
                return new Part(t.lexeme(), t.line());
            case PAGEBREAK:
                advance();
                return new PageBreak(t.line());
            case PROOF:
                return parseProof();
            case EQUIV:
                return parseArgueChain();
            case SCHEMA:
                return parseSchema();
            case AXDEF:
                return parseAxDef();
            case GENDEF:
                return parseGenDef();
            case GIVEN:
                return parseGiven();
            default:
                break;
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.FREE_EQ)) return parseFreeType();
        if (looksLikeAbbreviation()) return parseAbbreviation();

        Expr e = parseExpr();
        lineEnd();
        return new ExprItem(e, t.line());
    }

    private PartsFormat parsePartsFormat(Token t) {
        return switch (t.lexeme().toLowerCase(Locale.ROOT)) {
            case "inline" -> PartsFormat.INLINE;
            case "subsection" -> PartsFormat.SUBSECTION;
            default -> throw error(t, "PARTS must be 'inline' or 'subsection'");
        };
    }

    // ---------- declaration blocks ----------
    private Schema parseSchema() {
        Token kw = advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected schema name after 'schema'");
        List<String> generics = parseGenericParamsOpt();
        lineEnd();
        Body body = parseBody("schema " + name.lexeme());
        log.debug("schema {}: {} declarations, {} predicate groups",
                name.lexeme(), body.declarations().size(), body.groups().size());
        return new Schema(name.lexeme(), generics, body.declarations(), body.groups(), kw.line(), kw.column());
    }

    private AxDef parseAxDef() {
        Token kw = advance();
        List<String> generics = parseGenericParamsOpt();
        lineEnd();
        Body body = parseBody("axdef");
        return new AxDef(generics, body.declarations(), body.groups(), kw.line(), kw.column());
    }

    private GenDef parseGenDef() {
        Token kw = advance();
        List<String> generics = parseGenericParamsOpt();
        lineEnd();
        Body body = parseBody("gendef");
        return new GenDef(generics, body.declarations(), body.groups(), kw.line(), kw.column());
    }

    private record Body(List<Declaration> declarations, List<List<Expr>> groups) {}

    private Body parseBody(String what) {
        List<Declaration> decls = new ArrayList<>();
        skipLayout();
        while (!check(TokenType.WHERE) && !check(TokenType.END)) {
            if (check(TokenType.EOF) || structural.contains(peek().type())) {
                throw error(peek(), "Expected 'where' or 'end' to close " + what);
            }
            do {
                decls.add(parseDeclaration());
            } while (match(TokenType.SEMICOLON) && !check(TokenType.NEWLINE));
            lineEnd();
            skipLayout();
        }

        List<List<Expr>> groups = new ArrayList<>();
        if (match(TokenType.WHERE)) {
            List<Expr> current = new ArrayList<>();
            while (!check(TokenType.END)) {
                if (check(TokenType.EOF) || structural.contains(peek().type())) {
                    throw error(peek(), "Expected 'end' to close " + what);
                }
                if (match(TokenType.BLANK_LINE)) {
                    // a run of blank lines is one boundary
                    if (!current.isEmpty()) {
                        groups.add(current);
                        current = new ArrayList<>();
                    }
                    continue;
                }
                if (match(TokenType.NEWLINE)) continue;
                current.add(parseExpr());
                lineEnd();
            }
            if (!current.isEmpty()) groups.add(current);
        }
        consume(TokenType.END, "Expected 'end' to close " + what);
        lineEnd();
        return new Body(decls, groups);
    }

    private Declaration parseDeclaration() {
        Token first = consume(TokenType.IDENTIFIER, "Expected identifier in declaration");
        List<String> names = new ArrayList<>();
        names.add(first.lexeme());
        while (match(TokenType.COMMA)) {
            names.add(consume(TokenType.IDENTIFIER, "Expected identifier after ','").lexeme());
        }
        consume(TokenType.COLON, "Expected ':' after declared name");
        Expr type = parseExpr();
        return new Declaration(names, type, first.line(), first.column());
    }

    private List<String> parseGenericParamsOpt() {
        if (!match(TokenType.LBRACKET)) return List.of();
        List<String> params = new ArrayList<>();
        do {
            params.add(consume(TokenType.IDENTIFIER, "Expected generic parameter name").lexeme());
        } while (match(TokenType.COMMA));
        consume(TokenType.RBRACKET, "Expected ']' after generic parameters");
        return params;
    }

    // ---------- zed items ----------
    private GivenType parseGiven() {
        Token kw = advance();
        List<String> names = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "Expected identifier after 'given'").lexeme());
        } while (match(TokenType.COMMA));
        lineEnd();
        return new GivenType(names, kw.line(), kw.column());
    }

    private FreeType parseFreeType() {
        Token name = advance();
        advance(); // ::=
        if (check(TokenType.EQUALS)) {
            throw typo(peek(), "Unexpected '=' in free type definition. Did you mean '::=' instead of '::=='?");
        }

        List<FreeBranch> branches = new ArrayList<>();
        match(TokenType.PIPE);
        do {
            branches.add(parseBranch());
        } while (branchSeparator());
        lineEnd();

        log.debug("free type {} with {} branches", name.lexeme(), branches.size());
        return new FreeType(name.lexeme(), branches, name.line(), name.column());
    }

    private boolean branchSeparator() {
        if (check(TokenType.NEWLINE) && checkNext(TokenType.PIPE)) advance();
        return match(TokenType.PIPE);
    }

    private FreeBranch parseBranch() {
        Token t = peek();
        boolean nameToken = switch (t.type()) {
            case IDENTIFIER, POWER, POWER1, FINSET, FINSET1 -> true;
            default -> false;
        };
        if (!nameToken) {
            throw typo(t, "Expected branch name or '|' in free type definition, got " + t.type());
        }
        advance();

        Expr param = null;
        if (match(TokenType.LDATA)) {
            param = parseExpr();
            consume(TokenType.RDATA, "Expected '>>' to close constructor parameter");
        } else if (match(TokenType.LANGLE)) {
            param = parseExpr();
            consume(TokenType.RANGLE, "Expected '⟩' to close constructor parameter");
        } else if (match(TokenType.LESS)) {
            param = parseRelation();
            consume(TokenType.GREATER, "Expected '>' to close constructor parameter");
        }
        return new FreeBranch(t.lexeme(), param, t.line(), t.column());
    }

    private boolean looksLikeAbbreviation() {
        int i = pos;
        if (typeAt(i) == TokenType.LBRACKET) {
            i = skipBracketed(i);
            if (i < 0) return false;
        }
        if (typeAt(i) != TokenType.IDENTIFIER) return false;
        i++;
        if (typeAt(i) == TokenType.LBRACKET) {
            i = skipBracketed(i);
            if (i < 0) return false;
        }
        return typeAt(i) == TokenType.DEFEQ;
    }

    private int skipBracketed(int i) {
        i++;
        while (typeAt(i) == TokenType.IDENTIFIER || typeAt(i) == TokenType.COMMA) i++;
        return typeAt(i) == TokenType.RBRACKET ? i + 1 : -1;
    }

    private Abbreviation parseAbbreviation() {
        Token start = peek();
        List<String> generics = parseGenericParamsOpt();
        Token name = consume(TokenType.IDENTIFIER, "Expected abbreviation name");
        if (generics.isEmpty()) generics = parseGenericParamsOpt();
        consume(TokenType.DEFEQ, "Expected '==' in abbreviation");
        Expr e = parseExpr();
        lineEnd();
        return new Abbreviation(name.lexeme(), generics, e, start.line(), start.column());
    }

    // ---------- proofs ----------
    private ProofTree parseProof() {
        Token kw = advance();
        ProofBuilder builder = new ProofBuilder();

        while (!check(TokenType.EOF) && !check(TokenType.BLANK_LINE) && !structural.contains(peek().type())) {
            if (match(TokenType.NEWLINE)) continue;
            int indent = peek().line() == kw.line() ? 0 : peek().indent();
            if (!builder.accepts(indent)) break;

            Token first = peek();
            String problem = builder.add(indent, parseProofLine());
            if (problem != null) throw error(first, problem);
        }
        if (builder.isEmpty()) throw error(peek(), "Expected a proof step after 'PROOF:'");
        return new ProofTree(builder.build(), kw.line());
    }

    private ProofBuilder.Open parseProofLine() {
        Token first = peek();
        if (match(TokenType.CASE)) {
            Token name = consume(TokenType.IDENTIFIER, "Expected case name after 'case'");
            consume(TokenType.COLON, "Expected ':' after case name");
            lineEnd();
            return new ProofBuilder.OpenCase(name.lexeme(), first.line());
        }

        boolean sibling = match(TokenType.DCOLON);
        Integer label = null;
        if (check(TokenType.LBRACKET) && checkNext(TokenType.NUMBER) && typeAt(pos + 2) == TokenType.RBRACKET) {
            advance();
            label = parseLabel(advance());
            advance();
        }

        Expr e = parseExpr();
        String justification = null;
        if (match(TokenType.LBRACKET)) justification = collectJustification();
        lineEnd();

        boolean assumption = label != null || "assumption".equals(justification);
        return new ProofBuilder.OpenNode(e, justification, label, assumption, sibling, first.line());
    }

    // spacing of the source is gone, so rebuild it: words apart, no gap before ',' or ')'
    private String collectJustification() {
        StringBuilder sb = new StringBuilder();
        TokenType prev = null;
        while (!check(TokenType.RBRACKET) && !check(TokenType.NEWLINE) && !check(TokenType.EOF)) {
            Token t = advance();
            boolean tight = t.type() == TokenType.COMMA || t.type() == TokenType.RPAREN
                    || prev == TokenType.LPAREN;
            if (sb.length() > 0 && !tight) sb.append(' ');
            sb.append(t.lexeme());
            prev = t.type();
        }
        consume(TokenType.RBRACKET, "Expected ']' to close justification");
        return sb.toString();
    }

    // ---------- equivalence chains ----------
    private ArgueChain parseArgueChain() {
        Token kw = advance();
        List<ArgueStep> steps = new ArrayList<>();
        while (!check(TokenType.EOF) && !check(TokenType.BLANK_LINE) && !structural.contains(peek().type())) {
            if (match(TokenType.NEWLINE)) continue;
            Token first = peek();
            match(TokenType.IFF);
            Expr e = parseExpr();
            String justification = null;
            if (match(TokenType.LBRACKET)) justification = collectJustification();
            lineEnd();
            steps.add(new ArgueStep(e, justification, first.line()));
        }
        if (steps.isEmpty()) throw error(peek(), "Expected at least one step after 'EQUIV:'");
        return new ArgueChain(steps, kw.line());
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseIff(); }

    private Expr parseIff() {
        List<Expr> operands = new ArrayList<>();
        List<Token> ops = new ArrayList<>();
        operands.add(parseImplies());
        while (match(TokenType.IFF)) {
            ops.add(previous());
            operands.add(parseImplies());
        }
        return foldRight(BinaryExpr.Operator.IFF, operands, ops);
    }

    private Expr parseImplies() {
        List<Expr> operands = new ArrayList<>();
        List<Token> ops = new ArrayList<>();
        operands.add(parseOr());
        while (match(TokenType.IMPLIES)) {
            ops.add(previous());
            operands.add(parseOr());
        }
        return foldRight(BinaryExpr.Operator.IMPLIES, operands, ops);
    }

    // a op b op c  =>  a op (b op c)
    private static Expr foldRight(BinaryExpr.Operator op, List<Expr> operands, List<Token> ops) {
        Expr e = operands.get(operands.size() - 1);
        for (int i = ops.size() - 1; i >= 0; i--) {
            Token t = ops.get(i);
            e = new BinaryExpr(op, operands.get(i), e, t.line(), t.column());
        }
        return e;
    }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(toBinOp(op.type()), e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseNot();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseNot();
            e = new BinaryExpr(toBinOp(op.type()), e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseNot() {
        List<Token> nots = new ArrayList<>();
        while (match(TokenType.NOT)) nots.add(previous());
        Expr e = parseComparison();
        for (int i = nots.size() - 1; i >= 0; i--) {
            Token op = nots.get(i);
            e = new UnaryExpr(UnaryExpr.Operator.NOT, e, op.line(), op.column());
        }
        return e;
    }

    private Expr parseComparison() {
        Expr e = parseRelation();
        while (match(TokenType.EQUALS, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.GREATER,
                TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.IN, TokenType.NOTIN, TokenType.SUBSETEQ, TokenType.PSUBSET)) {
            Token op = previous();
            Expr r = parseRelation();
            e = new BinaryExpr(toBinOp(op.type()), e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseRelation() {
        Expr e = parseSetOp();
        while (match(TokenType.REL, TokenType.TFUN, TokenType.PFUN, TokenType.TINJ, TokenType.PINJ,
                TokenType.TSURJ, TokenType.PSURJ, TokenType.BIJ, TokenType.FFUN)) {
            Token op = previous();
            Expr r = parseSetOp();
            e = new BinaryExpr(toBinOp(op.type()), e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseSetOp() {
        Expr e = parseAdditive();
        while (match(TokenType.MAPSTO, TokenType.UNION, TokenType.INTERSECT, TokenType.SETMINUS,
                TokenType.DRES, TokenType.RRES, TokenType.NDRES, TokenType.NRRES,
                TokenType.COMP, TokenType.OVERRIDE, TokenType.CAT, TokenType.FILTER, TokenType.UPTO)) {
            Token op = previous();
            Expr r = parseAdditive();
            e = new BinaryExpr(toBinOp(op.type()), e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseAdditive() {
        Expr e = parseMultiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMultiplicative();
            e = new BinaryExpr(toBinOp(op.type()), e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseMultiplicative() {
        Expr e = parseCross();
        while (match(TokenType.TIMES, TokenType.DIV, TokenType.MOD)) {
            Token op = previous();
            Expr r = parseCross();
            e = new BinaryExpr(toBinOp(op.type()), e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseCross() {
        Expr e = parseUnary();
        while (match(TokenType.CROSS)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(BinaryExpr.Operator.CROSS, e, r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseUnary() {
        List<Token> prefixes = new ArrayList<>();
        Expr e = null;
        while (e == null) {
            Token t = peek();
            if (toPrefixOp(t.type()) == null) {
                e = parsePostfix();
            } else if (isNameLike(t.type()) && !operandStarts.contains(typeAt(pos + 1))) {
                // P and F double as plain names when nothing follows them
                advance();
                e = new Identifier(t.lexeme(), t.line(), t.column());
            } else {
                prefixes.add(advance());
            }
        }
        for (int i = prefixes.size() - 1; i >= 0; i--) {
            Token t = prefixes.get(i);
            e = new UnaryExpr(toPrefixOp(t.type()), e, t.line(), t.column());
        }
        return e;
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if ((e instanceof Identifier || e instanceof FunctionApp) && match(TokenType.LPAREN)) {
                Token open = previous();
                List<Expr> args = new ArrayList<>();
                if (!check(TokenType.RPAREN)) {
                    do { args.add(parseExpr()); } while (match(TokenType.COMMA));
                }
                consume(TokenType.RPAREN, "Expected ')' to close argument list");
                e = new FunctionApp(e, args, open.line(), open.column());
                continue;
            }
            if (match(TokenType.INVERSE)) {
                Token op = previous();
                e = new UnaryExpr(UnaryExpr.Operator.INVERSE, e, op.line(), op.column());
                continue;
            }
            break;
        }
        return e;
    }

    private Expr parsePrimary() {
        Token t = peek();
        if (nesting >= MAX_NESTING) throw typo(t, "Expression nested too deeply");
        nesting++;
        try {
            return primary(t);
        } finally {
            nesting--;
        }
    }

    private Expr primary(Token t) {
        switch (t.type()) {
            case IDENTIFIER:
                advance();
                return new Identifier(t.lexeme(), t.line(), t.column());
            case NUMBER:
                advance();
                return new NumberLiteral(t.lexeme(), t.line(), t.column());
            case FORALL:
            case EXISTS:
            case EXISTS1:
            case MU:
                return parseQuantifier();
            case LPAREN:
                return parseParenthesized();
            case LBRACE:
                return parseBraced();
            case LANGLE:
                advance();
                return parseSequence(t, TokenType.RANGLE, "Expected '⟩' to close sequence");
            case LESS:
                advance();
                return parseSequence(t, TokenType.GREATER, "Expected '>' to close sequence");
            case LDATA:
                // '<<a>, <b>>': the outer sequence takes the first '<', the next element starts at the second
                tokens.set(pos, new Token(TokenType.LESS, "<", t.line(), t.column() + 1));
                return parseSequence(t, TokenType.GREATER, "Expected '>' to close sequence");
            default:
                throw error(t, "Expected expression");
        }
    }

    private Expr parseParenthesized() {
        Token open = advance();
        Expr e = parseExpr();
        if (match(TokenType.COMMA)) {
            List<Expr> elems = new ArrayList<>();
            elems.add(e);
            do {
                elems.add(parseExpr());
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "Unclosed '(': expected ')' after tuple");
            return new TupleExpr(elems, open.line(), open.column());
        }
        consume(TokenType.RPAREN, "Unclosed '(': expected ')'");
        return e instanceof BinaryExpr b ? b.withExplicitParens() : e;
    }

    private Expr parseQuantifier() {
        Token kw = advance();
        Quantifier.Kind kind = switch (kw.type()) {
            case FORALL -> Quantifier.Kind.FORALL;
            case EXISTS -> Quantifier.Kind.EXISTS;
            case EXISTS1 -> Quantifier.Kind.EXISTS1;
            default -> Quantifier.Kind.MU;
        };

        List<String> vars = parseBoundVariables();
        Expr domain = null;
        if (match(TokenType.COLON)) domain = parseRelation();

        if (kind == Quantifier.Kind.MU) {
            consume(TokenType.PIPE, "Expected '|' after mu declaration");
            Expr predicate = parseExpr();
            if (match(TokenType.DOT, TokenType.BULLET)) {
                Expr body = parseExpr();
                return new Quantifier(kind, vars, domain, predicate, body, kw.line(), kw.column());
            }
            return new Quantifier(kind, vars, domain, null, predicate, kw.line(), kw.column());
        }

        if (!match(TokenType.PIPE, TokenType.BULLET, TokenType.DOT)) {
            throw error(peek(), "Expected '|' after quantifier declaration");
        }
        Expr first = parseExpr();
        Expr body = first;
        if (match(TokenType.PIPE)) {
            Token bar = previous();
            Expr rest = parseExpr();
            // constraint | body means constraint => body
            body = new BinaryExpr(BinaryExpr.Operator.IMPLIES, first, rest, bar.line(), bar.column());
        }
        return new Quantifier(kind, vars, domain, null, body, kw.line(), kw.column());
    }

    private List<String> parseBoundVariables() {
        List<String> vars = new ArrayList<>();
        do {
            vars.add(consume(TokenType.IDENTIFIER, "Expected identifier for bound variable").lexeme());
        } while (match(TokenType.COMMA));
        return vars;
    }

    private Expr parseBraced() {
        Token open = advance();
        if (match(TokenType.RBRACE)) return new SetLiteral(List.of(), open.line(), open.column());

        if (comprehensionAhead()) {
            List<String> vars = parseBoundVariables();
            consume(TokenType.COLON, "Expected ':' in set comprehension");
            Expr domain = parseRelation();

            Expr predicate = null;
            Expr expression = null;
            if (match(TokenType.DOT, TokenType.BULLET)) {
                expression = parseExpr();
            } else {
                consume(TokenType.PIPE, "Expected '|' or '.' in set comprehension");
                predicate = parseExpr();
                if (match(TokenType.PIPE, TokenType.DOT, TokenType.BULLET)) expression = parseExpr();
            }
            consume(TokenType.RBRACE, "Unclosed '{': expected '}' after set comprehension");
            return new SetComprehension(vars, domain, predicate, expression, open.line(), open.column());
        }

        List<Expr> elems = new ArrayList<>();
        do {
            elems.add(parseExpr());
        } while (match(TokenType.COMMA));
        consume(TokenType.RBRACE, "Unclosed '{': expected '}' after set elements");
        return new SetLiteral(elems, open.line(), open.column());
    }

    // x, y : ... inside braces
    private boolean comprehensionAhead() {
        int i = pos;
        if (typeAt(i) != TokenType.IDENTIFIER) return false;
        i++;
        while (typeAt(i) == TokenType.COMMA && typeAt(i + 1) == TokenType.IDENTIFIER) i += 2;
        return typeAt(i) == TokenType.COLON;
    }

    // elements sit above comparison level so a closing '>' is not read as an operator
    private Expr parseSequence(Token open, TokenType close, String msg) {
        List<Expr> elems = new ArrayList<>();
        if (close == TokenType.GREATER) splitClosingData();
        if (!check(close)) {
            do {
                elems.add(close == TokenType.GREATER ? parseRelation() : parseExpr());
            } while (match(TokenType.COMMA));
        }
        if (close == TokenType.GREATER) splitClosingData();
        consume(close, msg);
        return new SequenceLiteral(elems, open.line(), open.column());
    }

    // '>>' ending an inner sequence: the inner one takes the first '>', the second is left for the outer
    private void splitClosingData() {
        if (!check(TokenType.RDATA)) return;
        Token t = peek();
        tokens.set(pos, new Token(TokenType.GREATER, ">", t.line(), t.column() + 1));
        tokens.add(pos, new Token(TokenType.GREATER, ">", t.line(), t.column()));
    }

    private static Integer parseLabel(Token t) {
        try {
            return Integer.valueOf(t.lexeme());
        } catch (NumberFormatException e) {
            throw new ParserException("Assumption label out of range", t.line(), t.column());
        }
    }

    // ---------- helpers ----------
    private void lineEnd() {
        if (match(TokenType.NEWLINE)) return;
        if (check(TokenType.BLANK_LINE) || check(TokenType.EOF)) return;
        throw error(peek(), "Expected end of line");
    }

    private void skipLayout() {
        while (match(TokenType.NEWLINE, TokenType.BLANK_LINE)) {
            // skip
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        return typeAt(pos + 1) == t;
    }

    private TokenType typeAt(int i) {
        if (i >= tokens.size()) return TokenType.EOF;
        return tokens.get(i).type();
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private TranslationException error(Token at, String msg) {
        if (at.type() == TokenType.UNKNOWN) {
            return new LexerException("Unexpected character '" + at.lexeme() + "'", at.line(), at.column());
        }
        String got = at.type() == TokenType.EOF ? "end of input" : at.type() + " '" + at.lexeme() + "'";
        return new ParserException(msg + " (got " + got + ")", at.line(), at.column());
    }

    // known mistakes get the message alone, it already names the fix
    private TranslationException typo(Token at, String msg) {
        if (at.type() == TokenType.UNKNOWN) return error(at, msg);
        return new ParserException(msg, at.line(), at.column());
    }

    private static boolean isNameLike(TokenType t) {
        return t == TokenType.POWER || t == TokenType.POWER1
                || t == TokenType.FINSET || t == TokenType.FINSET1;
    }

    private static UnaryExpr.Operator toPrefixOp(TokenType t) {
        return switch (t) {
            case MINUS   -> UnaryExpr.Operator.NEGATE;
            case HASH    -> UnaryExpr.Operator.CARD;
            case DOM     -> UnaryExpr.Operator.DOM;
            case RAN     -> UnaryExpr.Operator.RAN;
            case POWER   -> UnaryExpr.Operator.POWER;
            case POWER1  -> UnaryExpr.Operator.POWER1;
            case FINSET  -> UnaryExpr.Operator.FINSET;
            case FINSET1 -> UnaryExpr.Operator.FINSET1;
            case SEQ     -> UnaryExpr.Operator.SEQ;
            case SEQ1    -> UnaryExpr.Operator.SEQ1;
            case ISEQ    -> UnaryExpr.Operator.ISEQ;
            case BAG     -> UnaryExpr.Operator.BAG;
            case BIGCUP  -> UnaryExpr.Operator.BIGCUP;
            case BIGCAP  -> UnaryExpr.Operator.BIGCAP;
            default      -> null;
        };
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case OR  -> BinaryExpr.Operator.OR;
            case AND -> BinaryExpr.Operator.AND;

            case EQUALS        -> BinaryExpr.Operator.EQUALS;
            case NOT_EQUAL     -> BinaryExpr.Operator.NOT_EQUAL;
            case LESS          -> BinaryExpr.Operator.LESS;
            case GREATER       -> BinaryExpr.Operator.GREATER;
            case LESS_EQUAL    -> BinaryExpr.Operator.LESS_EQUAL;
            case GREATER_EQUAL -> BinaryExpr.Operator.GREATER_EQUAL;
            case IN            -> BinaryExpr.Operator.IN;
            case NOTIN         -> BinaryExpr.Operator.NOTIN;
            case SUBSETEQ      -> BinaryExpr.Operator.SUBSETEQ;
            case PSUBSET       -> BinaryExpr.Operator.PSUBSET;

            case REL   -> BinaryExpr.Operator.REL;
            case TFUN  -> BinaryExpr.Operator.TFUN;
            case PFUN  -> BinaryExpr.Operator.PFUN;
            case TINJ  -> BinaryExpr.Operator.TINJ;
            case PINJ  -> BinaryExpr.Operator.PINJ;
            case TSURJ -> BinaryExpr.Operator.TSURJ;
            case PSURJ -> BinaryExpr.Operator.PSURJ;
            case BIJ   -> BinaryExpr.Operator.BIJ;
            case FFUN  -> BinaryExpr.Operator.FFUN;

            case MAPSTO    -> BinaryExpr.Operator.MAPSTO;
            case UNION     -> BinaryExpr.Operator.UNION;
            case INTERSECT -> BinaryExpr.Operator.INTERSECT;
            case SETMINUS  -> BinaryExpr.Operator.SETMINUS;
            case DRES      -> BinaryExpr.Operator.DRES;
            case RRES      -> BinaryExpr.Operator.RRES;
            case NDRES     -> BinaryExpr.Operator.NDRES;
            case NRRES     -> BinaryExpr.Operator.NRRES;
            case COMP      -> BinaryExpr.Operator.COMP;
            case OVERRIDE  -> BinaryExpr.Operator.OVERRIDE;
            case CAT       -> BinaryExpr.Operator.CAT;
            case FILTER    -> BinaryExpr.Operator.FILTER;
            case UPTO      -> BinaryExpr.Operator.UPTO;

            case PLUS  -> BinaryExpr.Operator.PLUS;
            case MINUS -> BinaryExpr.Operator.MINUS;
            case TIMES -> BinaryExpr.Operator.TIMES;
            case DIV   -> BinaryExpr.Operator.DIV;
            case MOD   -> BinaryExpr.Operator.MOD;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }
}
