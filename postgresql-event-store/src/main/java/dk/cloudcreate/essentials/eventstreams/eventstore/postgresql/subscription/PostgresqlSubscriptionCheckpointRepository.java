package dk.cloudcreate.essentials.eventstreams.eventstore.postgresql.subscription;

import dk.cloudcreate.essentials.eventstreams.eventstore.subscription.SubscriptionCheckpointRepository;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import java.time.*;
import java.util.Optional;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;

/**
 * {@link SubscriptionCheckpointRepository} that stores one row per {@link SubscriberId} in a Postgresql table:
 * <pre>
 * subscriber_id    text PRIMARY KEY
 * global_position  bigint NOT NULL
 * last_updated     TIMESTAMP WITH TIME ZONE NOT NULL
 * </pre>
 * The table is created on construction if it doesn't exist
 */
public class PostgresqlSubscriptionCheckpointRepository implements SubscriptionCheckpointRepository {
    private static final Logger  log                            = LoggerFactory.getLogger(PostgresqlSubscriptionCheckpointRepository.class);
    public static final  String  DEFAULT_CHECKPOINTS_TABLE_NAME = "subscription_checkpoints";
    private static final Pattern VALID_TABLE_NAME               = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");

    private final Jdbi   jdbi;
    private final String checkpointsTableName;

    public PostgresqlSubscriptionCheckpointRepository(Jdbi jdbi) {
        this(jdbi, DEFAULT_CHECKPOINTS_TABLE_NAME);
    }

    public PostgresqlSubscriptionCheckpointRepository(Jdbi jdbi, String checkpointsTableName) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        requireNonNull(checkpointsTableName, "No checkpointsTableName provided");
        requireTrue(VALID_TABLE_NAME.matcher(checkpointsTableName).matches(),
                    msg("Invalid checkpointsTableName '{}'", checkpointsTableName));
        this.checkpointsTableName = checkpointsTableName.toLowerCase();
        initializeCheckpointStorage();
    }

    private void initializeCheckpointStorage() {
        log.info("Initializing subscription checkpoint storage in table '{}'", checkpointsTableName);
        jdbi.useTransaction(handle -> handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                                                  "            subscriber_id text PRIMARY KEY,\n" +
                                                                  "            global_position bigint NOT NULL,\n" +
                                                                  "            last_updated TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                                                  "        )",
                                                          arg("tableName", checkpointsTableName))));
    }

    public String getCheckpointsTableName() {
        return checkpointsTableName;
    }

    @Override
    public Optional<GlobalEventPosition> loadCheckpoint(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        return jdbi.withHandle(handle -> handle.createQuery(bind("SELECT global_position FROM {:tableName} WHERE subscriber_id = :subscriberId",
                                                                 arg("tableName", checkpointsTableName)))
                                               .bind("subscriberId", subscriberId.toString())
                                               .mapTo(Long.class)
                                               .findOne()
                                               .map(GlobalEventPosition::of));
    }

    @Override
    public void storeCheckpoint(SubscriberId subscriberId, GlobalEventPosition lastHandledEvent) {
        requireNonNull(subscriberId, "No subscriberId provided");
        requireNonNull(lastHandledEvent, "No lastHandledEvent provided");
        jdbi.useHandle(handle -> handle.createUpdate(bind("INSERT INTO {:tableName} (subscriber_id, global_position, last_updated) " +
                                                                  "VALUES (:subscriberId, :globalPosition, :lastUpdated) " +
                                                                  "ON CONFLICT (subscriber_id) DO UPDATE SET global_position = EXCLUDED.global_position, last_updated = EXCLUDED.last_updated",
                                                          arg("tableName", checkpointsTableName)))
                                       .bind("subscriberId", subscriberId.toString())
                                       .bind("globalPosition", lastHandledEvent.longValue())
                                       .bind("lastUpdated", OffsetDateTime.now(Clock.systemUTC()))
                                       .execute());
    }

    @Override
    public void deleteCheckpoint(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        var rowsDeleted = jdbi.withHandle(handle -> handle.createUpdate(bind("DELETE FROM {:tableName} WHERE subscriber_id = :subscriberId",
                                                                             arg("tableName", checkpointsTableName)))
                                                          .bind("subscriberId", subscriberId.toString())
                                                          .execute());
        log.debug("[{}] Deleted {} checkpoint(s) from '{}'", subscriberId, rowsDeleted, checkpointsTableName);
    }

    @Override
    public String toString() {
        return "PostgresqlSubscriptionCheckpointRepository{" +
                "checkpointsTableName='" + checkpointsTableName + '\'' +
                '}';
    }
}
