package txt2tex.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    NUMBER,

    // raw line/block captures
    TEXT, PURETEXT, LATEX,
    TITLE, SUBTITLE, AUTHOR, DATE, INSTITUTION,
    BIBLIOGRAPHY, BIBLIOGRAPHY_STYLE, PARTS,
    SECTION, SOLUTION, PART_LABEL,

    // directives
    PROOF, EQUIV, PAGEBREAK,

    // block keywords
    SCHEMA, AXDEF, GENDEF, WHERE, END, GIVEN, CASE,

    // quantifiers
    FORALL, EXISTS, EXISTS1, MU,

    // logic
    IFF, IMPLIES, AND, OR, NOT,

    // comparison and membership
    EQUALS, NOT_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL,
    IN, NOTIN, SUBSETEQ, PSUBSET,

    // relations and functions
    REL, TFUN, PFUN, TINJ, PINJ, TSURJ, PSURJ, BIJ, FFUN,

    // set and relation operators
    MAPSTO, UNION, INTERSECT, SETMINUS,
    DRES, RRES, NDRES, NRRES,
    COMP, OVERRIDE, CAT, FILTER, UPTO,

    // arithmetic
    PLUS, MINUS, TIMES, DIV, MOD, CROSS,

    // prefix and postfix
    HASH, DOM, RAN,
    POWER, POWER1, FINSET, FINSET1,
    SEQ, SEQ1, ISEQ, BAG,
    BIGCUP, BIGCAP,
    INVERSE,

    // definitions
    DEFEQ, FREE_EQ,

    // symbols
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    LANGLE, RANGLE,
    LDATA, RDATA,
    COMMA, SEMICOLON, COLON, DCOLON,
    DOT, PIPE, BULLET,

    // layout
    NEWLINE,
    BLANK_LINE,

    UNKNOWN,
    EOF
}
