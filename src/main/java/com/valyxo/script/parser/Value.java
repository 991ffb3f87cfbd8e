package com.valyxo.script.parser;

import com.fasterxml.jackson.core.io.NumberOutput;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Script value: a tagged union over {@link Type}.
 *
 * Values are immutable. Lists and dicts are wrapped unmodifiable on construction, so a value
 * bound to two names can never be changed through either of them.
 */
public final class Value {
    public enum Type { INT, FLOAT, STRING, BOOL, LIST, DICT, NONE }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    private final Object value;
    private final int depth;

    private Value(Type type, Object value) {
        this(type, value, 0);
    }

    private Value(Type type, Object value, int depth) {
        this.type = type;
        this.value = value;
        this.depth = depth;
    }

    public static Value integer(long n) { return new Value(Type.INT, BigInteger.valueOf(n)); }
    public static Value integer(BigInteger n) { return new Value(Type.INT, Objects.requireNonNull(n)); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value none() { return NONE; }

    public static Value list(List<Value> items) {
        List<Value> copy = new ArrayList<>(items);
        return new Value(Type.LIST, Collections.unmodifiableList(copy), 1 + maxDepth(copy));
    }

    public static Value dict(Map<String, Value> entries) {
        Map<String, Value> copy = new LinkedHashMap<>(entries);
        return new Value(Type.DICT, Collections.unmodifiableMap(copy), 1 + maxDepth(copy.values()));
    }

    private static int maxDepth(Iterable<Value> items) {
        int max = 0;
        for (Value v : items) max = Math.max(max, v.depth);
        return max;
    }

    public Type getType() { return type; }

    /** List/dict nesting level: 0 for scalars, 1 for a list of scalars. */
    public int depth() { return depth; }

    public boolean isNumber() { return type == Type.INT || type == Type.FLOAT; }

    public BigInteger asInteger() {
        if (type != Type.INT) throw typeError("int");
        return (BigInteger) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw typeError("float");
        return (Double) value;
    }

    /** Numeric view of an int or float. */
    public double asNumber() {
        if (type == Type.INT) return ((BigInteger) value).doubleValue();
        if (type == Type.FLOAT) return (Double) value;
        throw typeError("number");
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw typeError("bool");
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw typeError("str");
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw typeError("list");
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asDict() {
        if (type != Type.DICT) throw typeError("dict");
        return (Map<String, Value>) value;
    }

    /** Name used in diagnostics. */
    public String typeName() {
        return typeName(type);
    }

    public static String typeName(Type type) {
        switch (type) {
            case INT: return "int";
            case FLOAT: return "float";
            case STRING: return "str";
            case BOOL: return "bool";
            case LIST: return "list";
            case DICT: return "dict";
            default: return "None";
        }
    }

    /** Size counted against the runtime's value-size cap: characters or elements. */
    public int size() {
        switch (type) {
            case STRING: return asString().length();
            case LIST: return asList().size();
            case DICT: return asDict().size();
            default: return 1;
        }
    }

    /**
     * Text written by print: strings unquoted, booleans as True/False, None as None,
     * floats in their shortest form.
     */
    public String display() {
        if (type == Type.STRING) return asString();
        return repr();
    }

    /** Text used for elements inside lists and dicts: like display, but strings are quoted. */
    public String repr() {
        switch (type) {
            case INT:
                return asInteger().toString();
            case FLOAT:
                return formatFloat(asFloat());
            case STRING:
                return quote(asString());
            case BOOL:
                return asBool() ? "True" : "False";
            case LIST: {
                StringBuilder sb = new StringBuilder("[");
                List<Value> items = asList();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i).repr());
                }
                return sb.append(']').toString();
            }
            case DICT: {
                StringBuilder sb = new StringBuilder("{");
                boolean first = true;
                for (Map.Entry<String, Value> e : asDict().entrySet()) {
                    if (!first) sb.append(", ");
                    first = false;
                    sb.append(quote(e.getKey())).append(": ").append(e.getValue().repr());
                }
                return sb.append('}').toString();
            }
            default:
                return "None";
        }
    }

    /**
     * Shortest round-tripping digits; positional between 1e-4 and 1e16,
     * otherwise exponent form with at least two exponent digits (1.5e-07, 1e+23).
     */
    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        String sign = (d < 0 || (d == 0.0 && 1.0 / d < 0)) ? "-" : "";
        if (d == 0.0) return sign + "0.0";

        BigDecimal shortest = new BigDecimal(NumberOutput.toString(Math.abs(d), true)).stripTrailingZeros();
        String digits = shortest.unscaledValue().toString();
        int exp = digits.length() - shortest.scale() - 1;

        if (exp >= -4 && exp < 16) {
            String plain = shortest.toPlainString();
            return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
        }
        StringBuilder sb = new StringBuilder(sign).append(digits.charAt(0));
        if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
        int abs = Math.abs(exp);
        return sb.append('e').append(exp < 0 ? '-' : '+').append(abs < 10 ? "0" : "").append(abs).toString();
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\'': sb.append("\\'"); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    private ScriptError typeError(String expected) {
        return new ScriptError(ErrorKind.TYPE_ERROR, 0, null, "Expected " + expected + ", got " + typeName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return repr();
    }
}
