package com.checkpilot.orchestrator.resource;

import com.checkpilot.orchestrator.model.ResourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One compiled line of a requirement program.
 *
 * The expression references exactly one resource through a free name (the
 * resource job's partial id or an import alias). Against a resource group it
 * is true when ANY record makes it true; a record that fails to evaluate
 * counts as false. The expression cannot correlate two records, so
 * {@code pkg.name == 'a' and pkg.name == 'b'} is never satisfied even when
 * both packages are present.
 */
public final class ResourceExpression {

    private static final Logger log = LoggerFactory.getLogger(ResourceExpression.class);

    private final String text;
    private final Node   root;
    private final String resourceName;
    private final String resourceId;

    ResourceExpression(String text, Node root, String resourceName, String resourceId) {
        this.text         = text;
        this.root         = root;
        this.resourceName = resourceName;
        this.resourceId   = resourceId;
    }

    public String text()         { return text; }

    /** The free name as written in the expression. */
    public String resourceName() { return resourceName; }

    /** Fully qualified id of the resource job the expression reads. */
    public String resourceId()   { return resourceId; }

    /** {@code any()} over the group; an empty or missing group is false. */
    public boolean evaluate(List<ResourceRecord> group) {
        if (group == null) {
            return false;
        }
        for (ResourceRecord record : group) {
            if (matches(record)) {
                return true;
            }
        }
        return false;
    }

    /** Evaluates against a single record, runtime errors yield false. */
    public boolean matches(ResourceRecord record) {
        try {
            return Values.truthy(root.eval(record));
        } catch (EvaluationException | ClassCastException | ArithmeticException e) {
            log.debug("Expression '{}' failed on {}: {}", text, record, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResourceExpression other
                && text.equals(other.text) && resourceId.equals(other.resourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, resourceId);
    }

    @Override
    public String toString() {
        return text;
    }
}
