package uniqv.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    BOOL_LITERAL,

    // keywords
    FNC,
    CLASS,
    IF,
    ELSE,
    WHILE,
    FOR,
    IN,
    RETURN,
    PUBLIC,
    PRIVATE,
    LET,
    MUT,
    REPEAT,
    UNTIL,
    FIXUP,
    SWITCH,
    CASE,
    DEFAULT,

    // types
    INT,
    FLOAT,
    BOOL,
    STRING,
    VOID,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, DCOLON, SEMICOLON, COMMA,
    DOT, RANGE,

    EOF
}
