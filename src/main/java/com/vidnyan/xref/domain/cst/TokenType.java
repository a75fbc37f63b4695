package com.vidnyan.xref.domain.cst;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token kinds produced by the tokenizer. Operators carry their literal text.
 */
public enum TokenType implements NodeType {
    ENDMARKER(null),
    NAME(null),
    NUMBER(null),
    STRING(null),
    NEWLINE(null),
    INDENT(null),
    DEDENT(null),
    ASYNC(null),
    AWAIT(null),

    LPAR("("),
    RPAR(")"),
    LSQB("["),
    RSQB("]"),
    LBRACE("{"),
    RBRACE("}"),
    COLON(":"),
    COMMA(","),
    SEMI(";"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    VBAR("|"),
    AMPER("&"),
    LESS("<"),
    GREATER(">"),
    EQUAL("="),
    DOT("."),
    PERCENT("%"),
    BACKQUOTE("`"),
    TILDE("~"),
    CIRCUMFLEX("^"),
    AT("@"),
    EQEQUAL("=="),
    NOTEQUAL("!="),
    LESSGREATER("<>"),
    LESSEQUAL("<="),
    GREATEREQUAL(">="),
    LEFTSHIFT("<<"),
    RIGHTSHIFT(">>"),
    DOUBLESTAR("**"),
    DOUBLESLASH("//"),
    RARROW("->"),
    PLUSEQUAL("+="),
    MINEQUAL("-="),
    STAREQUAL("*="),
    SLASHEQUAL("/="),
    PERCENTEQUAL("%="),
    AMPEREQUAL("&="),
    VBAREQUAL("|="),
    CIRCUMFLEXEQUAL("^="),
    ATEQUAL("@="),
    LEFTSHIFTEQUAL("<<="),
    RIGHTSHIFTEQUAL(">>="),
    DOUBLESTAREQUAL("**="),
    DOUBLESLASHEQUAL("//=");

    private static final Map<String, TokenType> BY_OPERATOR;

    static {
        Map<String, TokenType> ops = new HashMap<>();
        for (TokenType type : values()) {
            if (type.operator != null) {
                ops.put(type.operator, type);
            }
        }
        BY_OPERATOR = Collections.unmodifiableMap(ops);
    }

    private final String operator;

    TokenType(String operator) {
        this.operator = operator;
    }

    @Override
    public String grammarName() {
        return name();
    }

    @Override
    public boolean isToken() {
        return true;
    }

    public boolean isOperator() {
        return operator != null;
    }

    public String operator() {
        return operator;
    }

    public static Optional<TokenType> forOperator(String text) {
        return Optional.ofNullable(BY_OPERATOR.get(text));
    }
}
