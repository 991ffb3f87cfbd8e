package com.valyxo.script.parser;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.valyxo.script.parser.Expr.Binary;
import com.valyxo.script.parser.Expr.DictLiteral;
import com.valyxo.script.parser.Expr.ExprInterface;
import com.valyxo.script.parser.Expr.ExprVisitor;
import com.valyxo.script.parser.Expr.Index;
import com.valyxo.script.parser.Expr.ListLiteral;
import com.valyxo.script.parser.Expr.Literal;
import com.valyxo.script.parser.Expr.Logical;
import com.valyxo.script.parser.Expr.Unary;
import com.valyxo.script.parser.Expr.Variable;

/**
 * Tree-walking evaluator for the expression grammar.
 *
 * It only reads the environment: no host calls, no reflection, no string evaluation.
 * Integer and value-size caps from {@link RuntimeLimits} are checked before large results are built.
 */
public class Evaluator implements ExprVisitor<Value> {

    private final Environment env;
    private final RuntimeLimits limits;

    public Evaluator(Environment env, RuntimeLimits limits) {
        this.env = env;
        this.limits = limits;
    }

    public Evaluator(Environment env) {
        this(env, RuntimeLimits.DEFAULTS);
    }

    /** One-shot evaluation under the default limits. */
    public static Value evaluate(ExprInterface expr, Environment env) {
        return new Evaluator(env).eval(expr);
    }

    public Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    public static boolean isTruthy(Value v) {
        switch (v.type) {
            case NONE: return false;
            case BOOL: return v.asBool();
            case INT: return v.asInteger().signum() != 0;
            case FLOAT: return v.asFloat() != 0.0;
            case STRING: return !v.asString().isEmpty();
            case LIST: return !v.asList().isEmpty();
            case DICT: return !v.asDict().isEmpty();
            default: return true;
        }
    }

    // -------------------------
    // Visitors
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        try {
            return env.lookup(expr.name.lexeme);
        } catch (ScriptError e) {
            throw e.at(expr.name.line, null);
        }
    }

    @Override
    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.items.size());
        for (ExprInterface item : expr.items) items.add(eval(item));
        return checkDepth(Value.list(items));
    }

    @Override
    public Value visitDictLiteralExpr(DictLiteral expr) {
        Map<String, Value> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ExprInterface> e : expr.entries.entrySet()) {
            entries.put(e.getKey(), eval(e.getValue()));
        }
        return checkDepth(Value.dict(entries));
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (isTruthy(left)) return left;
        } else {
            if (!isTruthy(left)) return left;
        }
        return eval(expr.right);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!isTruthy(right));
            case MINUS:
                if (right.type == Value.Type.INT) return Value.integer(right.asInteger().negate());
                if (right.type == Value.Type.FLOAT) return Value.floating(-right.asFloat());
                throw typeError(expr.operator, "bad operand type for unary -: '" + right.typeName() + "'", null);
            case PLUS:
                if (right.isNumber()) return right;
                throw typeError(expr.operator, "bad operand type for unary +: '" + right.typeName() + "'", null);
            default:
                throw typeError(expr.operator, "Unsupported unary operator: " + expr.operator.lexeme, null);
        }
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        Token at = expr.bracket;

        switch (target.type) {
            case LIST: {
                List<Value> items = target.asList();
                int i = position(index, items.size(), "list", at);
                return items.get(i);
            }
            case STRING: {
                String s = target.asString();
                int i = position(index, s.length(), "string", at);
                return Value.string(String.valueOf(s.charAt(i)));
            }
            case DICT: {
                if (index.type != Value.Type.STRING) {
                    throw typeError(at, "dict keys are strings, got " + index.typeName(), null);
                }
                Value v = target.asDict().get(index.asString());
                if (v == null) {
                    String close = NameSuggester.closest(index.asString(), target.asDict().keySet());
                    throw typeError(at, "key " + index.repr() + " not found in dict",
                            close == null ? null : "did you mean '" + close + "'?");
                }
                return v;
            }
            default:
                throw typeError(at, "'" + target.typeName() + "' value is not indexable", null);
        }
    }

    private int position(Value index, int size, String what, Token at) {
        if (index.type != Value.Type.INT) {
            throw typeError(at, what + " indices must be integers, got " + index.typeName(), null);
        }
        BigInteger raw = index.asInteger();
        BigInteger i = raw.signum() < 0 ? raw.add(BigInteger.valueOf(size)) : raw;
        if (i.signum() < 0 || i.compareTo(BigInteger.valueOf(size)) >= 0) {
            throw typeError(at, what + " index " + raw + " out of range (size " + size + ")", null);
        }
        return i.intValue();
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                return add(left, right, op);
            case MINUS:
                requireNumbers(left, right, op);
                if (bothInts(left, right)) return checkedInt(left.asInteger().subtract(right.asInteger()), op);
                return Value.floating(toDouble(left, op) - toDouble(right, op));
            case STAR:
                return multiply(left, right, op);
            case SLASH:
                requireNumbers(left, right, op);
                requireNonZero(right, op);
                if (bothInts(left, right)) return Value.floating(divideExact(left.asInteger(), right.asInteger(), op));
                return Value.floating(toDouble(left, op) / toDouble(right, op));
            case DOUBLE_SLASH:
                requireNumbers(left, right, op);
                requireNonZero(right, op);
                if (bothInts(left, right)) {
                    // BigInteger.divide truncates toward zero
                    return Value.integer(left.asInteger().divide(right.asInteger()));
                }
                double q = toDouble(left, op) / toDouble(right, op);
                return Value.floating(q < 0 ? Math.ceil(q) : Math.floor(q));
            case PERCENT:
                requireNumbers(left, right, op);
                requireNonZero(right, op);
                return modulo(left, right, op);
            case DOUBLE_STAR:
                return power(left, right, op);

            case EQUAL_EQUAL:
                return Value.bool(valuesEqual(left, right));
            case BANG_EQUAL:
                return Value.bool(!valuesEqual(left, right));
            case GREATER:
            case GREATER_EQUAL:
            case LESS:
            case LESS_EQUAL:
                return Value.bool(compare(left, right, op));

            default:
                throw typeError(op, "Unsupported binary operator: " + op.lexeme, null);
        }
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    private Value add(Value left, Value right, Token op) {
        if (bothInts(left, right)) return checkedInt(left.asInteger().add(right.asInteger()), op);
        if (left.isNumber() && right.isNumber()) return Value.floating(toDouble(left, op) + toDouble(right, op));

        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            checkSize((long) left.asString().length() + right.asString().length(), op);
            return Value.string(left.asString() + right.asString());
        }
        if (left.type == Value.Type.LIST && right.type == Value.Type.LIST) {
            checkSize((long) left.asList().size() + right.asList().size(), op);
            List<Value> joined = new ArrayList<>(left.asList());
            joined.addAll(right.asList());
            return Value.list(joined);
        }

        String hint = null;
        if (left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
            hint = "strings are never joined with other types; print them separated by a comma instead";
        }
        throw typeError(op, unsupported(op, left, right), hint);
    }

    private Value multiply(Value left, Value right, Token op) {
        if (bothInts(left, right)) return checkedInt(left.asInteger().multiply(right.asInteger()), op);
        if (left.isNumber() && right.isNumber()) return Value.floating(toDouble(left, op) * toDouble(right, op));

        // repetition: "ab" * 3, [0] * 5
        if (right.type == Value.Type.INT && (left.type == Value.Type.STRING || left.type == Value.Type.LIST)) {
            return repeat(left, right.asInteger(), op);
        }
        if (left.type == Value.Type.INT && (right.type == Value.Type.STRING || right.type == Value.Type.LIST)) {
            return repeat(right, left.asInteger(), op);
        }
        throw typeError(op, unsupported(op, left, right), null);
    }

    private Value repeat(Value seq, BigInteger times, Token op) {
        int unit = seq.size();
        if (times.signum() <= 0 || unit == 0) {
            return seq.type == Value.Type.STRING ? Value.string("") : Value.list(new ArrayList<>());
        }
        if (times.bitLength() > 31) checkSize(Long.MAX_VALUE, op);
        checkSize((long) unit * times.intValue(), op);

        int n = times.intValue();
        if (seq.type == Value.Type.STRING) {
            StringBuilder sb = new StringBuilder(unit * n);
            for (int i = 0; i < n; i++) sb.append(seq.asString());
            return Value.string(sb.toString());
        }
        List<Value> out = new ArrayList<>(unit * n);
        for (int i = 0; i < n; i++) out.addAll(seq.asList());
        return Value.list(out);
    }

    // result takes the sign of the divisor
    private Value modulo(Value left, Value right, Token op) {
        if (bothInts(left, right)) {
            BigInteger b = right.asInteger();
            BigInteger r = left.asInteger().remainder(b);
            if (r.signum() != 0 && r.signum() != b.signum()) r = r.add(b);
            return Value.integer(r);
        }
        double b = toDouble(right, op);
        double r = toDouble(left, op) % b;
        if (r != 0.0 && (r < 0) != (b < 0)) r += b;
        return Value.floating(r);
    }

    private Value power(Value left, Value right, Token op) {
        requireNumbers(left, right, op);

        if (bothInts(left, right) && right.asInteger().signum() >= 0) {
            BigInteger base = left.asInteger();
            BigInteger exp = right.asInteger();
            if (base.signum() == 0 || base.abs().equals(BigInteger.ONE)) {
                if (base.signum() == 0) return Value.integer(exp.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO);
                boolean odd = exp.testBit(0);
                return Value.integer(base.signum() < 0 && odd ? BigInteger.ONE.negate() : BigInteger.ONE);
            }
            // bit length of base**exp is about bitLength(base) * exp
            long estimate = exp.bitLength() > 31 ? Long.MAX_VALUE : (long) (base.abs().bitLength() - 1) * exp.longValue() + 1;
            if (estimate > limits.maxIntegerBits) {
                throw resourceError(op, "integer result of '**' would exceed " + limits.maxIntegerBits + " bits");
            }
            return checkedInt(base.pow(exp.intValue()), op);
        }

        double base = toDouble(left, op);
        double exp = toDouble(right, op);
        if (base == 0.0 && exp < 0) {
            throw new ScriptError(ErrorKind.DIVISION_BY_ZERO, op.line, null,
                    "0 cannot be raised to a negative power", null);
        }
        if (base < 0 && exp != Math.rint(exp)) {
            throw typeError(op, "negative number cannot be raised to a fractional power", null);
        }
        return Value.floating(Math.pow(base, exp));
    }

    // -------------------------
    // Comparison
    // -------------------------

    /** Equality across all kinds; only int and float compare equal to each other across kinds. */
    public static boolean valuesEqual(Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            if (a.type == Value.Type.INT && b.type == Value.Type.INT) return a.asInteger().equals(b.asInteger());
            if (a.type == Value.Type.FLOAT && b.type == Value.Type.FLOAT) return a.asFloat() == b.asFloat();
            Value i = a.type == Value.Type.INT ? a : b;
            double f = (a.type == Value.Type.FLOAT ? a : b).asFloat();
            return !Double.isNaN(f) && compareIntToFloat(i.asInteger(), f) == 0;
        }
        if (a.type != b.type) return false;
        switch (a.type) {
            case LIST: {
                List<Value> x = a.asList();
                List<Value> y = b.asList();
                if (x.size() != y.size()) return false;
                for (int i = 0; i < x.size(); i++) {
                    if (!valuesEqual(x.get(i), y.get(i))) return false;
                }
                return true;
            }
            case DICT: {
                Map<String, Value> x = a.asDict();
                Map<String, Value> y = b.asDict();
                if (!x.keySet().equals(y.keySet())) return false;
                for (Map.Entry<String, Value> e : x.entrySet()) {
                    if (!valuesEqual(e.getValue(), y.get(e.getKey()))) return false;
                }
                return true;
            }
            default:
                return a.equals(b);
        }
    }

    private boolean compare(Value left, Value right, Token op) {
        int c;
        if (bothInts(left, right)) {
            c = left.asInteger().compareTo(right.asInteger());
        } else if (left.type == Value.Type.FLOAT && right.type == Value.Type.FLOAT) {
            double a = left.asFloat();
            double b = right.asFloat();
            if (Double.isNaN(a) || Double.isNaN(b)) return false;
            c = Double.compare(a, b);
            if (a == b) c = 0; // -0.0 == 0.0
        } else if (left.isNumber() && right.isNumber()) {
            if (left.type == Value.Type.INT) {
                double f = right.asFloat();
                if (Double.isNaN(f)) return false;
                c = compareIntToFloat(left.asInteger(), f);
            } else {
                double f = left.asFloat();
                if (Double.isNaN(f)) return false;
                c = -compareIntToFloat(right.asInteger(), f);
            }
        } else if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            c = left.asString().compareTo(right.asString());
        } else {
            throw typeError(op, "'" + op.lexeme + "' not supported between '" + left.typeName()
                    + "' and '" + right.typeName() + "'", null);
        }

        switch (op.type) {
            case GREATER: return c > 0;
            case GREATER_EQUAL: return c >= 0;
            case LESS: return c < 0;
            default: return c <= 0;
        }
    }

    // -------------------------
    // Checks
    // -------------------------

    /** Exact ordering of an int against a non-NaN float, without rounding the int. */
    private static int compareIntToFloat(BigInteger i, double f) {
        if (Double.isInfinite(f)) return f > 0 ? -1 : 1;
        return new BigDecimal(i).compareTo(new BigDecimal(f));
    }

    private static boolean bothInts(Value a, Value b) {
        return a.type == Value.Type.INT && b.type == Value.Type.INT;
    }

    private void requireNumbers(Value left, Value right, Token op) {
        if (left.isNumber() && right.isNumber()) return;
        throw typeError(op, unsupported(op, left, right), null);
    }

    private void requireNonZero(Value divisor, Token op) {
        boolean zero = divisor.type == Value.Type.INT
                ? divisor.asInteger().signum() == 0
                : divisor.asNumber() == 0.0;
        if (zero) {
            String what = op.type == TokenType.PERCENT ? "modulo" : "division";
            throw new ScriptError(ErrorKind.DIVISION_BY_ZERO, op.line, null,
                    what + " by zero", "check the divisor before dividing: if [d != 0] then [...]");
        }
    }

    private Value checkedInt(BigInteger n, Token op) {
        if (n.bitLength() > limits.maxIntegerBits) {
            throw resourceError(op, "integer result exceeds " + limits.maxIntegerBits + " bits");
        }
        return Value.integer(n);
    }

    /** Float view of a number operand; ints beyond the double range are rejected, not turned into inf. */
    private static double toDouble(Value v, Token op) {
        if (v.type != Value.Type.INT) return v.asNumber();
        double d = v.asInteger().doubleValue();
        if (Double.isInfinite(d)) throw resourceError(op, "integer is too large to convert to float");
        return d;
    }

    private static double divideExact(BigInteger a, BigInteger b, Token op) {
        double q = new BigDecimal(a).divide(new BigDecimal(b), MathContext.DECIMAL128).doubleValue();
        if (Double.isInfinite(q)) throw resourceError(op, "integer division result is too large for a float");
        return q;
    }

    private Value checkDepth(Value v) {
        if (v.depth() > limits.maxNestingDepth) {
            throw new ScriptError(ErrorKind.RESOURCE_LIMIT_EXCEEDED, 0, null,
                    "value nesting exceeds " + limits.maxNestingDepth + " levels", null);
        }
        return v;
    }

    private void checkSize(long size, Token op) {
        if (size > limits.maxValueSize) {
            throw resourceError(op, "value would exceed the maximum size of " + limits.maxValueSize + " elements");
        }
    }

    private static String unsupported(Token op, Value left, Value right) {
        return "unsupported operand types for " + op.lexeme + ": '" + left.typeName() + "' and '" + right.typeName() + "'";
    }

    private static ScriptError typeError(Token at, String message, String suggestion) {
        return new ScriptError(ErrorKind.TYPE_ERROR, at.line, null, message, suggestion);
    }

    private static ScriptError resourceError(Token at, String message) {
        return new ScriptError(ErrorKind.RESOURCE_LIMIT_EXCEEDED, at.line, null, message, null);
    }
}
