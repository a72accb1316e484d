package uniqv.parser;

import uniqv.lexer.Token;

public class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(Token at, String message) {
        super("[" + at.line() + ":" + at.column() + "] " + message
                + " (got " + at.type() + " '" + at.lexeme() + "')");
        this.token = at;
    }

    public Token token() {
        return token;
    }
}
