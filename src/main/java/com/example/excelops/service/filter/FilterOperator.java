package com.example.excelops.service.filter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum FilterOperator {
    EQ("=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    CONTAINS("contains"),
    IN("in"),
    COLUMN_EQ("== Column", "column-equals"),
    COLUMN_NE("!= Column", "column-not-equals");

    private final String symbol;
    private final List<String> aliases;

    FilterOperator(String symbol, String... aliases) {
        this.symbol = symbol;
        this.aliases = List.of(aliases);
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<FilterOperator> fromSymbol(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.trim();
        return Arrays.stream(values())
                .filter(op -> op.symbol.equalsIgnoreCase(s)
                        || op.aliases.contains(s.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    public boolean isRelational() {
        return ordinal() <= LE.ordinal();
    }

    public boolean isColumnComparison() {
        return this == COLUMN_EQ || this == COLUMN_NE;
    }

    /**
     * Numeric test for the relational operators. A {@code null} operand fails every test except {@link #NE}.
     */
    public boolean test(Double left, double right) {
        if (left == null) {
            return this == NE;
        }
        int cmp = Double.compare(left, right);
        return switch (this) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case GT -> cmp > 0;
            case LT -> cmp < 0;
            case GE -> cmp >= 0;
            case LE -> cmp <= 0;
            default -> throw new IllegalStateException("Not a relational operator: " + this);
        };
    }
}
