package com.vidnyan.xref.domain.cooked;

/**
 * An empty bracket pair: {@code ()}, {@code []}, {@code {}} or an empty call/parameter list.
 * All empty groupings normalize to this one node, keyed by the punctuation.
 */
public record EmptyPairNode(Pair pair) implements CookedNode {

    public enum Pair {
        PARENS("()"),
        BRACKETS("[]"),
        BRACES("{}"),
        BACKQUOTES("``");

        private final String text;

        Pair(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }
}
