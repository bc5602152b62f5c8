package dk.cloudcreate.essentials.eventstreams.eventstore.subscription;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.essentials.eventstreams.eventstore.projection.ReadProjection;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.EventTypeRegistry;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.json.JacksonEventSerializer;
import dk.cloudcreate.essentials.eventstreams.eventstore.test_data.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.test_data.OrderEvent.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class CheckpointedSubscriptionTest {
    private static final SubscriberId SUBSCRIBER_ID = SubscriberId.of("OrderSummaries");

    private InMemoryEventStore                       eventStore;
    private InMemorySubscriptionCheckpointRepository checkpointRepository;
    private List<CheckpointedSubscription>           subscriptions;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore(new JacksonEventSerializer(OrderEvent.registerAll(new EventTypeRegistry())));
        checkpointRepository = new InMemorySubscriptionCheckpointRepository();
        subscriptions = new ArrayList<>();
    }

    @AfterEach
    void cleanup() {
        subscriptions.forEach(CheckpointedSubscription::stop);
    }

    @Test
    void a_new_subscriber_receives_all_events_and_stores_its_checkpoint() {
        // Given
        var orderId = OrderId.random();
        appendProductsAdded(orderId, 3);
        var received     = new CopyOnWriteArrayList<StreamEventEnvelope<?>>();
        var subscription = subscribe(received::add);
        assertThat(subscription.currentResumePoint()).isEqualTo(GlobalEventPosition.FIRST_GLOBAL_EVENT_POSITION);

        // When
        subscription.start();

        // Then
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(received).hasSize(3));
        assertThat(subscription.isActive()).isTrue();
        assertThat(received.get(0).event()).isInstanceOf(ProductAddedToOrder.class);
        assertThat(received.get(0).isPersisted()).isTrue();
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(3)));
        assertThat(subscription.currentResumePoint()).isEqualTo(GlobalEventPosition.of(4));
    }

    @Test
    void a_restarted_subscriber_resumes_after_its_checkpoint() {
        // Given a subscriber that has handled the first 3 events and was then stopped
        var orderId        = OrderId.random();
        appendProductsAdded(orderId, 3);
        var firstReceived  = new CopyOnWriteArrayList<Long>();
        var firstInstance  = subscribe(event -> firstReceived.add(globalPositionOf(event)));
        firstInstance.start();
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(3)));
        firstInstance.stop();
        assertThat(firstInstance.isActive()).isFalse();

        // And more events were committed while the subscriber was down
        eventStore.appendEvent(StreamId.of("Order-" + orderId), StreamEventEnvelope.of(new OrderAccepted(orderId)), ExpectedStreamVersion.exactly(2));
        var otherOrderId = OrderId.random();
        eventStore.appendEvent(StreamId.of("Order-" + otherOrderId), StreamEventEnvelope.of(new OrderAdded(otherOrderId, CustomerId.random(), 2)));

        // When a new instance of the same subscriber starts
        var secondReceived = new CopyOnWriteArrayList<Long>();
        var secondInstance = subscribe(event -> secondReceived.add(globalPositionOf(event)));
        assertThat(secondInstance.currentResumePoint()).isEqualTo(GlobalEventPosition.of(4));
        secondInstance.start();

        // Then it only receives the events it hasn't handled
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(secondReceived).containsExactly(4L, 5L));
        assertThat(firstReceived).containsExactly(1L, 2L, 3L);
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(5)));
    }

    @Test
    void a_failing_projection_does_not_advance_the_checkpoint_and_receives_the_event_again() {
        // Given
        var orderId    = OrderId.random();
        appendProductsAdded(orderId, 2);
        var failedOnce = new AtomicBoolean();
        var received   = new CopyOnWriteArrayList<Long>();
        var subscription = new CheckpointedSubscription(SUBSCRIBER_ID,
                                                        eventStore,
                                                        checkpointRepository,
                                                        event -> {
                                                            if (globalPositionOf(event) == 2 && failedOnce.compareAndSet(false, true)) {
                                                                throw new IllegalStateException("Read model unavailable");
                                                            }
                                                            received.add(globalPositionOf(event));
                                                        },
                                                        Optional.of(10),
                                                        Optional.of(Duration.ofMillis(20)),
                                                        Duration.ofMillis(50));
        subscriptions.add(subscription);

        // When
        subscription.start();

        // Then
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(received).containsExactly(1L, 2L));
        assertThat(failedOnce).isTrue();
        assertThat(subscription.isActive()).isTrue();
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(2)));
    }

    @Test
    void resetFrom_replays_the_events_from_the_given_position() {
        // Given
        appendProductsAdded(OrderId.random(), 4);
        var received     = new CopyOnWriteArrayList<Long>();
        var subscription = subscribe(event -> received.add(globalPositionOf(event)));
        subscription.start();
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(4)));

        // When
        subscription.resetFrom(GlobalEventPosition.of(3));

        // Then
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(received).containsExactly(1L, 2L, 3L, 4L, 3L, 4L));
        assertThat(subscription.isActive()).isTrue();

        // And when resetting to the first position of a stopped subscription
        subscription.stop();
        subscription.resetFrom(GlobalEventPosition.FIRST_GLOBAL_EVENT_POSITION);

        // Then the checkpoint is removed and the subscription stays stopped
        assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).isEmpty();
        assertThat(subscription.isActive()).isFalse();
    }

    private CheckpointedSubscription subscribe(ReadProjection projection) {
        var subscription = new CheckpointedSubscription(SUBSCRIBER_ID,
                                                        eventStore,
                                                        checkpointRepository,
                                                        projection,
                                                        Optional.of(10),
                                                        Optional.of(Duration.ofMillis(20)),
                                                        Duration.ofMillis(50));
        subscriptions.add(subscription);
        return subscription;
    }

    private void appendProductsAdded(OrderId orderId, int numberOfEvents) {
        eventStore.appendEvents(StreamId.of("Order-" + orderId),
                                IntStream.rangeClosed(1, numberOfEvents)
                                         .mapToObj(quantity -> StreamEventEnvelope.of(new ProductAddedToOrder(orderId, ProductId.random(), quantity)))
                                         .collect(Collectors.toList()),
                                ExpectedStreamVersion.noStream());
    }

    private static long globalPositionOf(StreamEventEnvelope<?> event) {
        return event.streamMetadata().get().globalEventPosition().longValue();
    }
}
