package dk.cloudcreate.essentials.eventstreams.aggregates.order;

import dk.cloudcreate.essentials.eventstreams.aggregates.*;
import dk.cloudcreate.essentials.eventstreams.aggregates.order.OrderEvent.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public class Order extends EventSourcedAggregate<OrderId, OrderEvent> {
    private CustomerId              orderingCustomerId;
    private long                    orderNumber;
    private Map<ProductId, Integer> productAndQuantity = new HashMap<>();
    private boolean                 accepted;

    /**
     * Used for rehydration
     */
    public Order(OrderId orderId) {
        super(orderId);
    }

    public Order(OrderId orderId,
                 CustomerId orderingCustomerId,
                 long orderNumber) {
        this(orderId);
        requireNonNull(orderingCustomerId, "You must provide an orderingCustomerId");
        checkRule(BusinessRule.of(() -> orderNumber <= 0, "The orderNumber must be positive"));
        applyEvent(new OrderAdded(orderId, orderingCustomerId, orderNumber));
    }

    public void addProduct(ProductId productId, int quantity) {
        requireNonNull(productId, "You must provide a productId");
        checkRule(orderIsNotAccepted());
        checkRule(BusinessRule.of(() -> quantity <= 0, "The quantity must be positive"));
        applyEvent(new ProductAddedToOrder(aggregateId(), productId, quantity));
    }

    public void adjustProductQuantity(ProductId productId, int newQuantity) {
        requireNonNull(productId, "You must provide a productId");
        checkRule(orderIsNotAccepted());
        if (productAndQuantity.containsKey(productId)) {
            applyEvent(new ProductOrderQuantityAdjusted(aggregateId(), productId, newQuantity));
        }
    }

    public void removeProduct(ProductId productId) {
        requireNonNull(productId, "You must provide a productId");
        checkRule(orderIsNotAccepted());
        if (productAndQuantity.containsKey(productId)) {
            applyEvent(new ProductRemovedFromOrder(aggregateId(), productId));
        }
    }

    public void accept() {
        if (accepted) {
            return;
        }
        applyEvent(new OrderAccepted(aggregateId()));
    }

    /**
     * Reapply an event that has already been queued. Only for tests of the uncommitted event queue
     */
    public void reapply(OrderEvent event) {
        applyEvent(event);
    }

    private BusinessRule orderIsNotAccepted() {
        return BusinessRule.of(() -> accepted, "Order is already accepted");
    }

    @Override
    protected void when(OrderEvent event) {
        event.accept(new OrderEvent.Visitor() {
            @Override
            public void visit(OrderAdded event) {
                orderingCustomerId = event.orderingCustomerId;
                orderNumber = event.orderNumber;
            }

            @Override
            public void visit(ProductAddedToOrder event) {
                productAndQuantity.merge(event.productId, event.quantity, Integer::sum);
            }

            @Override
            public void visit(ProductOrderQuantityAdjusted event) {
                productAndQuantity.put(event.productId, event.newQuantity);
            }

            @Override
            public void visit(ProductRemovedFromOrder event) {
                productAndQuantity.remove(event.productId);
            }

            @Override
            public void visit(OrderAccepted event) {
                accepted = true;
            }
        });
    }

    public CustomerId orderingCustomerId() {
        return orderingCustomerId;
    }

    public long orderNumber() {
        return orderNumber;
    }

    public Map<ProductId, Integer> productAndQuantity() {
        return Collections.unmodifiableMap(productAndQuantity);
    }

    public boolean isAccepted() {
        return accepted;
    }
}
