package com.dietwatch.search.service;

import com.dietwatch.search.exception.BackendTimeoutException;
import com.dietwatch.search.exception.BackendUnavailableException;
import com.dietwatch.search.exception.SearchEngineException;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.SearchableEntity;
import com.dietwatch.search.model.VectorRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Postgres + pgvector. Similarity is {@code 1 - cosine distance}; category, status and date are
 * plain columns so filters are pushed into the nearest-neighbour query.
 */
@Service
public class PgVectorStoreGateway implements VectorStoreGateway {

    private static final String UPSERT_SQL = """
            INSERT INTO vector_records (entity_id, embedding, source_version, category, status, entity_date, updated_at)
            VALUES (?, CAST(? AS vector), ?, ?, ?, ?, NOW())
            ON CONFLICT (entity_id)
            DO UPDATE SET
              embedding = EXCLUDED.embedding,
              source_version = EXCLUDED.source_version,
              category = EXCLUDED.category,
              status = EXCLUDED.status,
              entity_date = EXCLUDED.entity_date,
              updated_at = NOW()
            WHERE vector_records.source_version < EXCLUDED.source_version
            """;

    private final JdbcTemplate jdbcTemplate;
    private final int queryTimeoutSeconds;

    public PgVectorStoreGateway(
            JdbcTemplate jdbcTemplate,
            @Value("${vector.query-timeout-seconds:2}") int queryTimeoutSeconds
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.queryTimeoutSeconds = Math.max(1, queryTimeoutSeconds);
    }

    @Override
    public List<ScoredHit> nearest(float[] embedding, int k, SearchFilters filters) {
        String vectorLiteral = toVectorLiteral(embedding);
        StringBuilder sql = new StringBuilder("""
                SELECT entity_id, entity_date,
                       (1 - (embedding <=> CAST(? AS vector))) AS similarity_score
                FROM vector_records
                WHERE 1 = 1
                """);
        List<Object> args = new ArrayList<>();
        args.add(vectorLiteral);
        if (filters != null) {
            if (hasText(filters.getCategory())) {
                sql.append(" AND category = ?");
                args.add(filters.getCategory().trim());
            }
            if (hasText(filters.getStatus())) {
                sql.append(" AND status = ?");
                args.add(filters.getStatus().trim());
            }
            if (hasText(filters.getDateFrom())) {
                sql.append(" AND entity_date >= ?");
                args.add(Date.valueOf(LocalDate.parse(filters.getDateFrom().trim())));
            }
            if (hasText(filters.getDateTo())) {
                sql.append(" AND entity_date <= ?");
                args.add(Date.valueOf(LocalDate.parse(filters.getDateTo().trim())));
            }
        }
        sql.append(" ORDER BY embedding <=> CAST(? AS vector) LIMIT ?");
        args.add(vectorLiteral);
        args.add(k);

        return translate(() -> jdbcTemplate.query(
                sql.toString(),
                statement -> {
                    statement.setQueryTimeout(queryTimeoutSeconds);
                    for (int i = 0; i < args.size(); i++) {
                        statement.setObject(i + 1, args.get(i));
                    }
                },
                (rs, rowNum) -> {
                    Date date = rs.getDate("entity_date");
                    return new ScoredHit(
                            rs.getString("entity_id"),
                            rs.getDouble("similarity_score"),
                            date == null ? null : date.toLocalDate()
                    );
                }
        ));
    }

    @Override
    public boolean upsert(VectorRecord record) {
        LocalDate date = SearchableEntity.parseDate(record.metadata().get("date"));
        Object category = record.metadata().get("category");
        Object status = record.metadata().get("status");
        int updated = translate(() -> jdbcTemplate.update(
                UPSERT_SQL,
                record.entityId(),
                toVectorLiteral(record.embedding()),
                record.sourceVersion(),
                category == null ? null : category.toString(),
                status == null ? null : status.toString(),
                date == null ? null : Date.valueOf(date)
        ));
        return updated > 0;
    }

    @Override
    public OptionalLong sourceVersion(String entityId) {
        List<Long> versions = translate(() -> jdbcTemplate.queryForList(
                "SELECT source_version FROM vector_records WHERE entity_id = ?",
                Long.class,
                entityId
        ));
        return versions.isEmpty() ? OptionalLong.empty() : OptionalLong.of(versions.get(0));
    }

    @Override
    public boolean delete(String entityId) {
        int deleted = translate(() -> jdbcTemplate.update("DELETE FROM vector_records WHERE entity_id = ?", entityId));
        return deleted > 0;
    }

    public static String toVectorLiteral(float[] embedding) {
        StringBuilder sb = new StringBuilder(embedding.length * 10);
        sb.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(embedding[i]);
        }
        return sb.append(']').toString();
    }

    private static <T> T translate(Supplier<T> call) {
        try {
            return call.get();
        } catch (QueryTimeoutException ex) {
            throw new BackendTimeoutException("vector store query timed out", ex);
        } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
            throw new BackendUnavailableException("vector store unavailable: " + ex.getMessage(), ex);
        } catch (DataAccessException ex) {
            throw new SearchEngineException("vector store rejected the statement: " + ex.getMessage(), ex);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
