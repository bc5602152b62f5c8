package dk.cloudcreate.essentials.eventstreams.eventstore.postgresql.test_data;

import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.EventTypeRegistry;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public class OrderEvent {
    public final OrderId orderId;

    public OrderEvent(OrderId orderId) {
        this.orderId = requireNonNull(orderId);
    }

    public static EventTypeRegistry registerAll(EventTypeRegistry registry) {
        return registry.register(OrderAdded.class)
                       .register(ProductAddedToOrder.class)
                       .register(OrderAccepted.class);
    }

    public static class OrderAdded extends OrderEvent {
        public final CustomerId orderingCustomerId;
        public final long       orderNumber;

        public OrderAdded(OrderId orderId, CustomerId orderingCustomerId, long orderNumber) {
            super(orderId);
            this.orderingCustomerId = orderingCustomerId;
            this.orderNumber = orderNumber;
        }
    }

    public static class ProductAddedToOrder extends OrderEvent {
        public final ProductId productId;
        public final int       quantity;

        public ProductAddedToOrder(OrderId orderId, ProductId productId, int quantity) {
            super(orderId);
            this.productId = productId;
            this.quantity = quantity;
        }
    }

    public static class OrderAccepted extends OrderEvent {
        public OrderAccepted(OrderId orderId) {
            super(orderId);
        }
    }
}
