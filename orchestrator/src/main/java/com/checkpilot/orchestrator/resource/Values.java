package com.checkpilot.orchestrator.resource;

import com.checkpilot.orchestrator.model.ResourceRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Value semantics of the expression language.
 *
 * Runtime values are {@code String}, {@code Long}, {@code Double},
 * {@code Boolean}, {@code null}, {@code List<Object>} and the bound
 * {@link ResourceRecord}. Booleans take part in arithmetic as 0/1, numbers
 * compare across integer and float, mismatched ordering or arithmetic raises
 * {@link EvaluationException}.
 */
final class Values {

    private Values() {}

    static boolean truthy(Object v) {
        if (v == null)                 return false;
        if (v instanceof Boolean b)    return b;
        if (v instanceof Long l)       return l != 0L;
        if (v instanceof Double d)     return d != 0.0;
        if (v instanceof String s)     return !s.isEmpty();
        if (v instanceof List<?> list) return !list.isEmpty();
        return true;
    }

    static String typeName(Object v) {
        if (v == null)                   return "NoneType";
        if (v instanceof Boolean)        return "bool";
        if (v instanceof Long)           return "int";
        if (v instanceof Double)         return "float";
        if (v instanceof String)         return "str";
        if (v instanceof List<?>)        return "list";
        if (v instanceof ResourceRecord) return "resource";
        return v.getClass().getSimpleName();
    }

    private static boolean isNumber(Object v) {
        return v instanceof Long || v instanceof Double || v instanceof Boolean;
    }

    private static boolean isIntegral(Object v) {
        return v instanceof Long || v instanceof Boolean;
    }

    private static long asLong(Object v) {
        if (v instanceof Boolean b) return b ? 1L : 0L;
        return (Long) v;
    }

    private static double asDouble(Object v) {
        if (v instanceof Double d) return d;
        return asLong(v);
    }

    // -------------------------------------------------------------------------
    // Equality and ordering
    // -------------------------------------------------------------------------

    static boolean equal(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (isNumber(a) && isNumber(b)) {
            if (isIntegral(a) && isIntegral(b)) return asLong(a) == asLong(b);
            return asDouble(a) == asDouble(b);
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) return false;
            for (int i = 0; i < la.size(); i++) {
                if (!equal(la.get(i), lb.get(i))) return false;
            }
            return true;
        }
        if (a instanceof ResourceRecord || b instanceof ResourceRecord) return a == b;
        return a.equals(b);
    }

    private static int order(Object a, Object b) {
        if (isNumber(a) && isNumber(b)) {
            if (isIntegral(a) && isIntegral(b)) return Long.compare(asLong(a), asLong(b));
            double x = asDouble(a);
            double y = asDouble(b);
            if (Double.isNaN(x) || Double.isNaN(y)) {
                throw new EvaluationException("NaN is unordered");
            }
            return Double.compare(x, y);
        }
        if (a instanceof String sa && b instanceof String sb) {
            return sa.compareTo(sb);
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            int n = Math.min(la.size(), lb.size());
            for (int i = 0; i < n; i++) {
                if (!equal(la.get(i), lb.get(i))) {
                    return order(la.get(i), lb.get(i));
                }
            }
            return Integer.compare(la.size(), lb.size());
        }
        throw new EvaluationException("cannot order " + typeName(a) + " and " + typeName(b));
    }

    static boolean compare(String op, Object left, Object right) {
        return switch (op) {
            case "==" -> equal(left, right);
            case "!=" -> !equal(left, right);
            case "<"  -> order(left, right) < 0;
            case "<=" -> order(left, right) <= 0;
            case ">"  -> order(left, right) > 0;
            case ">=" -> order(left, right) >= 0;
            case "in" -> contains(right, left);
            default   -> throw new EvaluationException("unknown comparison " + op);
        };
    }

    static boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            if (!(item instanceof String needle)) {
                throw new EvaluationException("'in <string>' requires string as left operand, not " + typeName(item));
            }
            return s.contains(needle);
        }
        if (container instanceof List<?> list) {
            for (Object element : list) {
                if (equal(element, item)) return true;
            }
            return false;
        }
        if (container instanceof ResourceRecord r) {
            return item instanceof String key && r.has(key);
        }
        throw new EvaluationException("argument of type '" + typeName(container) + "' is not iterable");
    }

    // -------------------------------------------------------------------------
    // Arithmetic
    // -------------------------------------------------------------------------

    static Object unary(String op, Object v) {
        if (!isNumber(v)) {
            throw new EvaluationException("bad operand type for unary " + op + ": " + typeName(v));
        }
        if (v instanceof Double d) {
            return op.equals("-") ? -d : d;
        }
        long l = asLong(v);
        return op.equals("-") ? -l : l;
    }

    static Object arithmetic(String op, Object a, Object b) {
        if (op.equals("+")) {
            if (a instanceof String sa && b instanceof String sb) return sa + sb;
            if (a instanceof List<?> la && b instanceof List<?> lb) {
                List<Object> out = new ArrayList<>(la);
                out.addAll(lb);
                return out;
            }
        }
        if (op.equals("*")) {
            if (a instanceof String s && isIntegral(b)) return repeat(s, asLong(b));
            if (isIntegral(a) && b instanceof String s) return repeat(s, asLong(a));
            if (a instanceof List<?> l && isIntegral(b)) return repeat(l, asLong(b));
            if (isIntegral(a) && b instanceof List<?> l) return repeat(l, asLong(a));
        }
        if (op.equals("%") && a instanceof String) {
            throw new EvaluationException("string formatting is not supported");
        }
        if (!isNumber(a) || !isNumber(b)) {
            throw new EvaluationException("unsupported operand types for " + op + ": "
                    + typeName(a) + " and " + typeName(b));
        }
        if (op.equals("/")) {
            double divisor = asDouble(b);
            if (divisor == 0.0) throw new EvaluationException("division by zero");
            return asDouble(a) / divisor;
        }
        if (isIntegral(a) && isIntegral(b)) {
            long x = asLong(a);
            long y = asLong(b);
            return switch (op) {
                case "+"  -> x + y;
                case "-"  -> x - y;
                case "*"  -> x * y;
                case "//" -> { checkDivisor(y); yield Math.floorDiv(x, y); }
                case "%"  -> { checkDivisor(y); yield Math.floorMod(x, y); }
                default   -> throw new EvaluationException("unknown operator " + op);
            };
        }
        double x = asDouble(a);
        double y = asDouble(b);
        return switch (op) {
            case "+"  -> x + y;
            case "-"  -> x - y;
            case "*"  -> x * y;
            case "//" -> { checkDivisor(y); yield Math.floor(x / y); }
            case "%"  -> { checkDivisor(y); yield x - y * Math.floor(x / y); }
            default   -> throw new EvaluationException("unknown operator " + op);
        };
    }

    private static void checkDivisor(double y) {
        if (y == 0.0) throw new EvaluationException("division by zero");
    }

    private static String repeat(String s, long n) {
        return n <= 0 ? "" : s.repeat((int) Math.min(n, 4096));
    }

    private static List<Object> repeat(List<?> list, long n) {
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < Math.min(n, 4096); i++) {
            out.addAll(list);
        }
        return Collections.unmodifiableList(out);
    }

    // -------------------------------------------------------------------------
    // Coercion helpers
    // -------------------------------------------------------------------------

    static Long toInt(Object v) {
        if (v instanceof Boolean || v instanceof Long) return asLong(v);
        if (v instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) throw new EvaluationException("cannot convert " + d + " to int");
            return (long) d.doubleValue();
        }
        if (v instanceof String s) {
            String t = s.strip().replace("_", "");
            try {
                return Long.parseLong(t);
            } catch (NumberFormatException e) {
                throw new EvaluationException("invalid literal for int(): '" + s + "'");
            }
        }
        throw new EvaluationException("int() argument must be a string or a number, not " + typeName(v));
    }

    static Double toFloat(Object v) {
        if (isNumber(v)) return asDouble(v);
        if (v instanceof String s) {
            String t = s.strip();
            String lower = t.toLowerCase();
            switch (lower) {
                case "inf", "+inf", "infinity", "+infinity" -> { return Double.POSITIVE_INFINITY; }
                case "-inf", "-infinity"                    -> { return Double.NEGATIVE_INFINITY; }
                case "nan", "+nan", "-nan"                  -> { return Double.NaN; }
                default -> { }
            }
            if (t.isEmpty() || !lower.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)(e[+-]?\\d+)?")) {
                throw new EvaluationException("could not convert string to float: '" + s + "'");
            }
            return Double.parseDouble(t);
        }
        throw new EvaluationException("float() argument must be a string or a number, not " + typeName(v));
    }
}
