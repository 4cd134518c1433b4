package com.checkpilot.orchestrator.resource;

/**
 * Runtime failure of one expression against one record (missing attribute,
 * incompatible operand types, bad conversion). Confined to this package:
 * the evaluator turns it into a non-matching record.
 */
class EvaluationException extends RuntimeException {

    EvaluationException(String message) {
        super(message);
    }
}
