package com.checkpilot.orchestrator.resource;

import com.checkpilot.orchestrator.model.ResourceRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Typed AST of a requirement expression. Nodes are immutable and are
 * evaluated against a single record bound to the expression's one free name.
 */
interface Node {

    Object eval(ResourceRecord record);

    /** Adds every free name referenced below this node. */
    default void collectNames(Set<String> names) {}

    // -------------------------------------------------------------------------

    record Literal(Object value) implements Node {
        public Object eval(ResourceRecord record) { return value; }
    }

    record ListLiteral(List<Node> items) implements Node {
        public Object eval(ResourceRecord record) {
            List<Object> out = new ArrayList<>(items.size());
            for (Node item : items) {
                out.add(item.eval(record));
            }
            return out;
        }
        public void collectNames(Set<String> names) {
            items.forEach(i -> i.collectNames(names));
        }
    }

    /** The free variable: evaluates to the record itself. */
    record NameRef(String name) implements Node {
        public Object eval(ResourceRecord record) { return record; }
        public void collectNames(Set<String> names) { names.add(name); }
    }

    record AttributeRef(Node target, String attribute) implements Node {
        public Object eval(ResourceRecord record) {
            Object base = target.eval(record);
            if (base instanceof ResourceRecord r) {
                return r.get(attribute).orElseThrow(() ->
                        new EvaluationException("record has no attribute '" + attribute + "'"));
            }
            throw new EvaluationException(Values.typeName(base) + " has no attribute '" + attribute + "'");
        }
        public void collectNames(Set<String> names) { target.collectNames(names); }
    }

    record UnaryOp(String op, Node operand) implements Node {
        public Object eval(ResourceRecord record) {
            return Values.unary(op, operand.eval(record));
        }
        public void collectNames(Set<String> names) { operand.collectNames(names); }
    }

    record BinaryOp(String op, Node left, Node right) implements Node {
        public Object eval(ResourceRecord record) {
            return Values.arithmetic(op, left.eval(record), right.eval(record));
        }
        public void collectNames(Set<String> names) {
            left.collectNames(names);
            right.collectNames(names);
        }
    }

    record Not(Node operand) implements Node {
        public Object eval(ResourceRecord record) {
            return !Values.truthy(operand.eval(record));
        }
        public void collectNames(Set<String> names) { operand.collectNames(names); }
    }

    /** {@code and}/{@code or}: short-circuits and yields the deciding operand. */
    record BoolOp(boolean isAnd, List<Node> operands) implements Node {
        public Object eval(ResourceRecord record) {
            Object value = null;
            for (Node operand : operands) {
                value = operand.eval(record);
                boolean t = Values.truthy(value);
                if (isAnd != t) {
                    return value;
                }
            }
            return value;
        }
        public void collectNames(Set<String> names) {
            operands.forEach(o -> o.collectNames(names));
        }
    }

    /** Chained comparison: {@code a < b < c} means {@code a < b and b < c}. */
    record Compare(Node first, List<String> ops, List<Node> rest) implements Node {
        public Object eval(ResourceRecord record) {
            Object left = first.eval(record);
            for (int i = 0; i < ops.size(); i++) {
                Object right = rest.get(i).eval(record);
                if (!Values.compare(ops.get(i), left, right)) {
                    return false;
                }
                left = right;
            }
            return true;
        }
        public void collectNames(Set<String> names) {
            first.collectNames(names);
            rest.forEach(r -> r.collectNames(names));
        }
    }

    /** One of the coercion helpers {@code int}, {@code float}, {@code bool}. */
    record Call(String function, Node argument) implements Node {
        public Object eval(ResourceRecord record) {
            Object arg = argument.eval(record);
            return switch (function) {
                case "int"   -> Values.toInt(arg);
                case "float" -> Values.toFloat(arg);
                case "bool"  -> Values.truthy(arg);
                default      -> throw new EvaluationException("call to " + function + " not allowed");
            };
        }
        public void collectNames(Set<String> names) { argument.collectNames(names); }
    }
}
