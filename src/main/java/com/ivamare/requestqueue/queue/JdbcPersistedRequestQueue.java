package com.ivamare.requestqueue.queue;

import com.ivamare.requestqueue.diagnostics.RequestDiagnostics;
import com.ivamare.requestqueue.exception.DuplicateRequestException;
import com.ivamare.requestqueue.exception.RequestQueueException;
import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.RequestOrigin;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * PostgreSQL-backed persisted request queue.
 *
 * <p>Uses table {@code requestqueue.persisted_request} (see
 * {@code db/requestqueue/schema.sql}). Each statement touches a single row,
 * so increment and removal are atomic per identity.
 *
 * <p>A row whose data can no longer be read is discarded when the queue is
 * listed and reported as a {@code listPending} storage fault, so it cannot
 * hold up the requests behind it.
 */
public class JdbcPersistedRequestQueue implements PersistedRequestQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcPersistedRequestQueue.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RequestDiagnostics diagnostics;
    private final RowMapper<Request> requestMapper;

    public JdbcPersistedRequestQueue(
            JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper,
            RequestDiagnostics diagnostics) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.diagnostics = diagnostics;
        this.requestMapper = (rs, rowNum) -> {
            UUID requestId = UUID.fromString(rs.getString("request_id"));
            return mapRequest(rs, requestId, deserializeData(requestId, rs.getString("data_json")));
        };
    }

    @Override
    public void enqueue(Request request) {
        if (request.origin() != RequestOrigin.QUEUED) {
            throw new IllegalArgumentException("Only queued requests can be persisted");
        }
        try {
            jdbcTemplate.update("""
                INSERT INTO requestqueue.persisted_request (
                    request_id, command, data_json, retry_count, created_at
                ) VALUES (?, ?, ?::jsonb, ?, ?)
                """,
                request.requestId(),
                request.command(),
                serializeData(request),
                request.retryCount(),
                Timestamp.from(request.createdAt())
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateRequestException(request.requestId(), e);
        }
        log.debug("Persisted request {} ({})", request.requestId(), request.command());
    }

    @Override
    public OptionalInt incrementRetries(UUID requestId) {
        List<Integer> counts = jdbcTemplate.query("""
            UPDATE requestqueue.persisted_request
               SET retry_count = retry_count + 1, updated_at = NOW()
             WHERE request_id = ?
            RETURNING retry_count
            """,
            (rs, rowNum) -> rs.getInt("retry_count"),
            requestId
        );
        return counts.isEmpty() ? OptionalInt.empty() : OptionalInt.of(counts.get(0));
    }

    @Override
    public void remove(UUID requestId) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM requestqueue.persisted_request WHERE request_id = ?",
            requestId
        );
        if (deleted > 0) {
            log.debug("Removed persisted request {}", requestId);
        }
    }

    @Override
    public List<Request> listPending() {
        List<Request> pending = new ArrayList<>();
        List<Request> unreadable = new ArrayList<>();
        List<RequestQueueException> causes = new ArrayList<>();

        jdbcTemplate.query(
            "SELECT * FROM requestqueue.persisted_request ORDER BY seq ASC",
            (RowCallbackHandler) rs -> {
                UUID requestId = UUID.fromString(rs.getString("request_id"));
                try {
                    pending.add(mapRequest(rs, requestId, deserializeData(requestId, rs.getString("data_json"))));
                } catch (RequestQueueException e) {
                    unreadable.add(mapRequest(rs, requestId, Map.of()));
                    causes.add(e);
                }
            }
        );

        for (int i = 0; i < unreadable.size(); i++) {
            discard(unreadable.get(i), causes.get(i));
        }
        return pending;
    }

    @Override
    public Optional<Request> get(UUID requestId) {
        List<Request> results = jdbcTemplate.query(
            "SELECT * FROM requestqueue.persisted_request WHERE request_id = ?",
            requestMapper,
            requestId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public int size() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM requestqueue.persisted_request",
            Integer.class
        );
        return count != null ? count : 0;
    }

    @Override
    public void clear() {
        int deleted = jdbcTemplate.update("DELETE FROM requestqueue.persisted_request");
        log.info("Cleared {} persisted requests", deleted);
    }

    private void discard(Request request, RequestQueueException cause) {
        log.error("Discarding persisted request {} ({}) with unreadable data",
            request.requestId(), request.command());
        try {
            diagnostics.storageFault("listPending", request, cause);
        } catch (RuntimeException e) {
            log.warn("Request diagnostics failed: {}", e.getMessage());
        }
        remove(request.requestId());
    }

    private Request mapRequest(ResultSet rs, UUID requestId, Map<String, Object> data) throws SQLException {
        return new Request(
            requestId,
            rs.getString("command"),
            data,
            RequestOrigin.QUEUED,
            rs.getInt("retry_count"),
            rs.getTimestamp("created_at").toInstant(),
            null
        );
    }

    private String serializeData(Request request) {
        try {
            return objectMapper.writeValueAsString(request.data());
        } catch (JsonProcessingException e) {
            throw new RequestQueueException(
                "Failed to serialize data of request " + request.requestId(), e);
        }
    }

    private Map<String, Object> deserializeData(UUID requestId, String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new RequestQueueException("Corrupt data for persisted request " + requestId, e);
        }
    }
}
