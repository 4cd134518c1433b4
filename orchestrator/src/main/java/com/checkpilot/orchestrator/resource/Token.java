package com.checkpilot.orchestrator.resource;

record Token(Type type, String text, int position) {

    enum Type { NAME, NUMBER, STRING, OPERATOR, END }

    boolean is(Type t, String s) {
        return type == t && text.equals(s);
    }

    boolean isOperator(String s) {
        return is(Type.OPERATOR, s);
    }

    boolean isKeyword(String s) {
        return is(Type.NAME, s);
    }
}
