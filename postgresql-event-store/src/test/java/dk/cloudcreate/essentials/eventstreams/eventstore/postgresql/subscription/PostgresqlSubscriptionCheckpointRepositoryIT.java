package dk.cloudcreate.essentials.eventstreams.eventstore.postgresql.subscription;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.postgresql.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.postgresql.test_data.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.postgresql.test_data.OrderEvent.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.EventTypeRegistry;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.json.JacksonEventSerializer;
import dk.cloudcreate.essentials.eventstreams.eventstore.subscription.CheckpointedSubscription;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@Testcontainers
class PostgresqlSubscriptionCheckpointRepositoryIT {
    private static final SubscriberId SUBSCRIBER_ID = SubscriberId.of("OrderSummaries");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                                       jdbi;
    private PostgresqlEventStore                       eventStore;
    private PostgresqlSubscriptionCheckpointRepository checkpointRepository;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        var serializer = new JacksonEventSerializer(OrderEvent.registerAll(new EventTypeRegistry()));
        eventStore = new PostgresqlEventStore(jdbi, PostgresqlEventStoreConfiguration.standardConfiguration(serializer));
        checkpointRepository = new PostgresqlSubscriptionCheckpointRepository(jdbi);
    }

    @Test
    void checkpoints_are_created_updated_and_deleted() {
        assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).isEmpty();

        checkpointRepository.storeCheckpoint(SUBSCRIBER_ID, GlobalEventPosition.of(7));
        assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(7));

        checkpointRepository.storeCheckpoint(SUBSCRIBER_ID, GlobalEventPosition.of(12));
        assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(12));
        assertThat(checkpointRepository.loadCheckpoint(SubscriberId.of("Other"))).isEmpty();

        checkpointRepository.deleteCheckpoint(SUBSCRIBER_ID);
        assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).isEmpty();
    }

    @Test
    void checkpoints_survive_a_new_repository_instance() {
        checkpointRepository.storeCheckpoint(SUBSCRIBER_ID, GlobalEventPosition.of(3));

        var otherInstance = new PostgresqlSubscriptionCheckpointRepository(jdbi);

        assertThat(otherInstance.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(3));
    }

    @Test
    void invalid_table_names_are_rejected() {
        assertThatThrownBy(() -> new PostgresqlSubscriptionCheckpointRepository(jdbi, "checkpoints; DROP TABLE x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void a_restarted_subscription_resumes_after_the_stored_checkpoint() {
        // Given a subscription that has handled the first two events
        var orderId  = OrderId.random();
        var streamId = StreamId.of("Order-" + orderId);
        eventStore.appendEvent(streamId, StreamEventEnvelope.of(new OrderAdded(orderId, CustomerId.random(), 1)));
        eventStore.appendEvent(streamId, StreamEventEnvelope.of(new ProductAddedToOrder(orderId, ProductId.random(), 2)), ExpectedStreamVersion.exactly(0));
        var firstReceived = new CopyOnWriteArrayList<Long>();
        var firstInstance = newSubscription(firstReceived);
        firstInstance.start();
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(2)));
        firstInstance.stop();

        // And an event committed while it was stopped
        eventStore.appendEvent(streamId, StreamEventEnvelope.of(new OrderAccepted(orderId)), ExpectedStreamVersion.exactly(1));

        // When a subscription for the same subscriber starts using a new repository instance
        var secondReceived = new CopyOnWriteArrayList<Long>();
        var secondInstance = new CheckpointedSubscription(SUBSCRIBER_ID,
                                                          eventStore,
                                                          new PostgresqlSubscriptionCheckpointRepository(jdbi),
                                                          event -> secondReceived.add(event.streamMetadata().get().globalEventPosition().longValue()),
                                                          Optional.of(10),
                                                          Optional.of(Duration.ofMillis(50)),
                                                          Duration.ofMillis(100));
        try {
            secondInstance.start();

            // Then
            await().atMost(Duration.ofSeconds(10))
                   .untilAsserted(() -> assertThat(secondReceived).containsExactly(3L));
            assertThat(firstReceived).containsExactly(1L, 2L);
            await().atMost(Duration.ofSeconds(10))
                   .untilAsserted(() -> assertThat(checkpointRepository.loadCheckpoint(SUBSCRIBER_ID)).hasValue(GlobalEventPosition.of(3)));
        } finally {
            secondInstance.stop();
        }
    }

    private CheckpointedSubscription newSubscription(CopyOnWriteArrayList<Long> received) {
        return new CheckpointedSubscription(SUBSCRIBER_ID,
                                            eventStore,
                                            checkpointRepository,
                                            event -> received.add(event.streamMetadata().get().globalEventPosition().longValue()),
                                            Optional.of(10),
                                            Optional.of(Duration.ofMillis(50)),
                                            Duration.ofMillis(100));
    }
}
