package com.herzen.quiz.repository;

import com.herzen.quiz.session.SessionModels.ChannelError;
import com.herzen.quiz.session.SessionModels.SessionEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class SessionEventJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SessionEventJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveEvent(SessionEvent event) {
        jdbcTemplate.update(
                "INSERT INTO session_events(channel_key, event_type, ts, payload) VALUES (?,?,?,?)",
                event.channelKey(), event.eventType(), event.ts().toString(), event.payload());
    }

    public List<SessionEvent> loadEvents(String channelKey) {
        return jdbcTemplate.query(
                "SELECT channel_key, event_type, ts, payload FROM session_events WHERE channel_key=? ORDER BY id",
                (rs, rowNum) -> new SessionEvent(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3)), rs.getString(4)),
                channelKey);
    }

    public void saveError(String channelKey, ChannelError error) {
        jdbcTemplate.update(
                "INSERT INTO channel_errors(channel_key, operation, message, ts) VALUES (?,?,?,?)",
                channelKey, error.operation(), truncate(error.message()), error.ts().toString());
    }

    public List<ChannelError> loadErrors(String channelKey) {
        return jdbcTemplate.query(
                "SELECT operation, message, ts FROM channel_errors WHERE channel_key=? ORDER BY id",
                (rs, rowNum) -> new ChannelError(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))),
                channelKey);
    }

    public int countErrors(String channelKey) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM channel_errors WHERE channel_key=?", Integer.class, channelKey);
        return count == null ? 0 : count;
    }

    // both trims keep the newest rows of every channel
    public int trimErrors(int keep) {
        return trim("channel_errors", keep);
    }

    public int trimEvents(int keep) {
        return trim("session_events", keep);
    }

    private int trim(String table, int keep) {
        List<String> channels = jdbcTemplate.queryForList(
                "SELECT channel_key FROM " + table + " GROUP BY channel_key HAVING COUNT(*) > ?", String.class, keep);
        int deleted = 0;
        for (String channel : channels) {
            List<Long> ids = jdbcTemplate.queryForList(
                    "SELECT id FROM " + table + " WHERE channel_key=? ORDER BY id DESC", Long.class, channel);
            if (ids.size() > keep) {
                deleted += jdbcTemplate.update(
                        "DELETE FROM " + table + " WHERE channel_key=? AND id <= ?", channel, ids.get(keep));
            }
        }
        return deleted;
    }

    private String truncate(String message) {
        if (message == null) return null;
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
