package dk.cloudcreate.essentials.eventstreams.aggregates;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Thrown by {@link EventSourcedAggregate#checkRule(BusinessRule)} when a {@link BusinessRule} is broken
 */
public class BusinessRuleValidationException extends AggregateException {
    public final BusinessRule brokenRule;

    public BusinessRuleValidationException(BusinessRule brokenRule) {
        super(requireNonNull(brokenRule, "No brokenRule provided").message());
        this.brokenRule = brokenRule;
    }
}
