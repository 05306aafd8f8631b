package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.Location;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Literal value, also used for annotation values (arrays, structures, {@code ...}).
 */
public class Literal extends Expression {
    private final LiteralKind kind;
    private final Object value;
    private final List<Expression> items;
    private final LinkedHashMap<String, Expression> struct;

    private Literal(LiteralKind kind, Object value, List<Expression> items,
                                    LinkedHashMap<String, Expression> struct, Location location) {
        super(location);
        this.kind = kind;
        this.value = value;
        this.items = items;
        this.struct = struct;
    }

    public static Literal string(String value, Location location) {
        return new Literal(LiteralKind.STRING, value, null, null, location);
    }

    public static Literal number(Number value, Location location) {
        return new Literal(LiteralKind.NUMBER, value, null, null, location);
    }

    public static Literal bool(boolean value, Location location) {
        return new Literal(LiteralKind.BOOLEAN, value, null, null, location);
    }

    public static Literal nullValue(Location location) {
        return new Literal(LiteralKind.NULL, null, null, null, location);
    }

    public static Literal enumSymbol(String symbol, Location location) {
        return new Literal(LiteralKind.ENUM, symbol, null, null, location);
    }

    public static Literal ellipsis(Location location) {
        return new Literal(LiteralKind.ELLIPSIS, "...", null, null, location);
    }

    public static Literal array(List<? extends Expression> items, Location location) {
        return new Literal(LiteralKind.ARRAY, null, new ArrayList<>(items), null, location);
    }

    public static Literal struct(Map<String, ? extends Expression> values, Location location) {
        return new Literal(LiteralKind.STRUCT, null, null, new LinkedHashMap<>(values), location);
    }

    public LiteralKind getKind() { return kind; }
    public Object getValue() { return value; }
    public List<Expression> getItems() { return items; }
    public LinkedHashMap<String, Expression> getStruct() { return struct; }

    public boolean isEllipsis() {
        return kind == LiteralKind.ELLIPSIS;
    }

    public boolean isArray() {
        return kind == LiteralKind.ARRAY;
    }

    /**
     * Truthiness as used for flag annotations: {@code null}, {@code false},
     * {@code 0} and {@code ''} are false.
     */
    public boolean isTruthy() {
        switch (kind) {
            case NULL:
                return false;
            case BOOLEAN:
                return (Boolean) value;
            case NUMBER:
                return ((Number) value).doubleValue() != 0;
            case STRING:
                return !((String) value).isEmpty();
            default:
                return true;
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "'" + value + "'";
            case ENUM:
                return "#" + value;
            case NULL:
                return "null";
            case ARRAY:
                return items.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
            case STRUCT:
                return struct.entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", ", "{", "}"));
            default:
                return String.valueOf(value);
        }
    }
}
