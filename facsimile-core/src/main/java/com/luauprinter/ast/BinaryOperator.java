package com.luauprinter.ast;

/**
 * Binary operators with their Luau spelling and precedence. The left and right
 * binding powers differ for the right-associative {@code ..} and {@code ^}.
 */
public enum BinaryOperator {
    ADD("+", 6, 6),
    SUB("-", 6, 6),
    MUL("*", 7, 7),
    DIV("/", 7, 7),
    FLOOR_DIV("//", 7, 7),
    MOD("%", 7, 7),
    POW("^", 10, 9),
    CONCAT("..", 5, 4),
    COMPARE_NE("~=", 3, 3),
    COMPARE_EQ("==", 3, 3),
    COMPARE_LT("<", 3, 3),
    COMPARE_LE("<=", 3, 3),
    COMPARE_GT(">", 3, 3),
    COMPARE_GE(">=", 3, 3),
    AND("and", 2, 2),
    OR("or", 1, 1);

    private final String text;
    private final int leftPriority;
    private final int rightPriority;

    BinaryOperator(String text, int leftPriority, int rightPriority) {
        this.text = text;
        this.leftPriority = leftPriority;
        this.rightPriority = rightPriority;
    }

    public String text() {
        return text;
    }

    public int leftPriority() {
        return leftPriority;
    }

    public int rightPriority() {
        return rightPriority;
    }

    /**
     * Whether the operator is spelled with letters and therefore needs word
     * boundaries around it.
     */
    public boolean isWord() {
        return this == AND || this == OR;
    }
}
