package com.vidnyan.xref.domain.cst;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Nonterminal symbols of the lib2to3 Python grammar (the union of the Python 2 and
 * Python 3 syntax).
 */
public enum Symbol implements NodeType {
    AND_EXPR,
    AND_TEST,
    ANNASSIGN,
    ARGLIST,
    ARGUMENT,
    ARITH_EXPR,
    ASSERT_STMT,
    ASYNC_FUNCDEF,
    ASYNC_STMT,
    ATOM,
    AUGASSIGN,
    BREAK_STMT,
    CLASSDEF,
    COMP_FOR,
    COMP_IF,
    COMP_ITER,
    COMP_OP,
    COMPARISON,
    COMPOUND_STMT,
    CONTINUE_STMT,
    DECORATED,
    DECORATOR,
    DECORATORS,
    DEL_STMT,
    DICTSETMAKER,
    DOTTED_AS_NAME,
    DOTTED_AS_NAMES,
    DOTTED_NAME,
    ENCODING_DECL,
    EVAL_INPUT,
    EXCEPT_CLAUSE,
    EXEC_STMT,
    EXPR,
    EXPR_STMT,
    EXPRLIST,
    FACTOR,
    FILE_INPUT,
    FLOW_STMT,
    FOR_STMT,
    FUNCDEF,
    GLOBAL_STMT,
    IF_STMT,
    IMPORT_AS_NAME,
    IMPORT_AS_NAMES,
    IMPORT_FROM,
    IMPORT_NAME,
    IMPORT_STMT,
    LAMBDEF,
    LISTMAKER,
    NOT_TEST,
    OLD_LAMBDEF,
    OLD_TEST,
    OR_TEST,
    PARAMETERS,
    PASS_STMT,
    POWER,
    PRINT_STMT,
    RAISE_STMT,
    RETURN_STMT,
    SHIFT_EXPR,
    SIMPLE_STMT,
    SINGLE_INPUT,
    SLICEOP,
    SMALL_STMT,
    STAR_EXPR,
    STMT,
    SUBSCRIPT,
    SUBSCRIPTLIST,
    SUITE,
    TERM,
    TEST,
    TESTLIST,
    TESTLIST1,
    TESTLIST_GEXP,
    TESTLIST_SAFE,
    TESTLIST_STAR_EXPR,
    TFPDEF,
    TFPLIST,
    TNAME,
    TRAILER,
    TRY_STMT,
    TYPEDARGSLIST,
    VARARGSLIST,
    VFPDEF,
    VFPLIST,
    VNAME,
    WHILE_STMT,
    WITH_ITEM,
    WITH_STMT,
    WITH_VAR,
    XOR_EXPR,
    YIELD_ARG,
    YIELD_EXPR,
    YIELD_STMT;

    private static final Map<String, Symbol> BY_GRAMMAR_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Symbol::grammarName, Function.identity()));

    @Override
    public String grammarName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean isToken() {
        return false;
    }

    /**
     * Look up a symbol by its grammar name (e.g. {@code "and_expr"}), as used in configuration.
     */
    public static Optional<Symbol> forGrammarName(String grammarName) {
        if (grammarName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_GRAMMAR_NAME.get(grammarName.trim().toLowerCase(Locale.ROOT)));
    }
}
