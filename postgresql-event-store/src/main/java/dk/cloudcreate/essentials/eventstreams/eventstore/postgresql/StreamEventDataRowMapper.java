package dk.cloudcreate.essentials.eventstreams.eventstore.postgresql;

import dk.cloudcreate.essentials.eventstreams.eventstore.StreamEventData;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;
import java.util.Optional;

class StreamEventDataRowMapper implements RowMapper<StreamEventData> {
    @Override
    public StreamEventData map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new StreamEventData(EventId.of(rs.getString("event_id")),
                                   EventTypeName.of(rs.getString("event_type")),
                                   rs.getBytes("data"),
                                   Optional.ofNullable(rs.getBytes("metadata")),
                                   StreamId.of(rs.getString("stream_id")),
                                   EventNumber.of(rs.getLong("event_number")),
                                   GlobalEventPosition.of(rs.getLong("global_position")),
                                   rs.getObject("timestamp", OffsetDateTime.class));
    }
}
