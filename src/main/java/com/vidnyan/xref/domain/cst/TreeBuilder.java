package com.vidnyan.xref.domain.cst;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Turns raw grammar reductions into CST nodes. The parser calls {@link #build} every time a
 * rule or token is recognized, so the tree is built strictly bottom-up.
 *
 * <p>Symbols in the collapsible set that reduce to exactly one child are replaced by that child,
 * which removes wrapper levels without losing information. The set is empty unless configured:
 * the converter handles every wrapper symbol, and collapsing one changes which rule sees the
 * child, so a symbol should only be added after its shapes are covered by tests. Start symbols
 * never collapse: the root of a tree is always a node of its start symbol.
 */
@Slf4j
public class TreeBuilder {

    private static final Set<Symbol> START_SYMBOLS =
            EnumSet.of(Symbol.FILE_INPUT, Symbol.SINGLE_INPUT, Symbol.EVAL_INPUT);

    private final Set<Symbol> collapsible;

    public TreeBuilder() {
        this(Set.of());
    }

    public TreeBuilder(Set<Symbol> collapsible) {
        EnumSet<Symbol> symbols = EnumSet.noneOf(Symbol.class);
        symbols.addAll(collapsible);
        symbols.removeAll(START_SYMBOLS);
        this.collapsible = symbols.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(symbols);
        if (!this.collapsible.isEmpty()) {
            log.debug("Collapsing single-child symbols: {}", this.collapsible);
        }
    }

    public CstNode build(Reduction reduction) {
        NodeType type = reduction.type();
        if (type.isToken()) {
            if (!reduction.children().isEmpty()) {
                throw new IllegalArgumentException("Token reduction with children: " + reduction);
            }
            return new CstLeaf((TokenType) type, reduction.value(), reduction.context());
        }
        Symbol symbol = (Symbol) type;
        if (reduction.children().size() == 1 && collapsible.contains(symbol)) {
            return reduction.children().get(0);
        }
        return CstComposite.of(symbol, reduction.children());
    }

    public Set<Symbol> collapsible() {
        return collapsible;
    }

    /**
     * The parser requires every file to end with a newline; append one if it is missing.
     */
    public static String withTrailingNewline(String source) {
        if (source.isEmpty() || source.endsWith("\n")) {
            return source;
        }
        return source + "\n";
    }
}
