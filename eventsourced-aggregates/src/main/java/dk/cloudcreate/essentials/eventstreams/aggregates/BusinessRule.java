package dk.cloudcreate.essentials.eventstreams.aggregates;

import java.util.function.BooleanSupplier;

/**
 * A predicate an {@link EventSourcedAggregate} checks, using {@link EventSourcedAggregate#checkRule(BusinessRule)}, before
 * applying a state changing event
 */
public interface BusinessRule {
    boolean isBroken();

    /**
     * @return the message explaining why the rule is broken
     */
    String message();

    /**
     * Create a {@link BusinessRule} from a predicate
     *
     * @param isBroken returns true if the rule is broken
     * @param message  the message explaining why the rule is broken
     * @return the business rule
     */
    static BusinessRule of(BooleanSupplier isBroken, String message) {
        return new BusinessRule() {
            @Override
            public boolean isBroken() {
                return isBroken.getAsBoolean();
            }

            @Override
            public String message() {
                return message;
            }

            @Override
            public String toString() {
                return message;
            }
        };
    }
}
