package com.dcruver.organizer.store;

import com.dcruver.organizer.domain.Document;
import com.dcruver.organizer.io.RecordValidationException;
import com.dcruver.organizer.io.RecordValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed document store in SQLite. Upserts are idempotent on doc_id;
 * documents no longer present on disk are never collected.
 */
@Component
@Slf4j
public class DocumentStore {

    private static final String UPSERT_SQL = """
        INSERT INTO documents (doc_id, path, payload, updated_at) VALUES (?, ?, ?, ?)
        ON CONFLICT(doc_id) DO UPDATE SET
            path = excluded.path,
            payload = excluded.payload,
            updated_at = excluded.updated_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public DocumentStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS documents (
                doc_id TEXT PRIMARY KEY,
                path TEXT,
                payload TEXT,
                updated_at INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_documents_path
            ON documents(path)
            """);

        log.info("Initialized document store");
    }

    /**
     * Insert or replace every document in one batch.
     */
    public int upsertAll(List<Document> documents) {
        if (documents.isEmpty()) {
            return 0;
        }

        long now = Instant.now().getEpochSecond();
        List<Object[]> rows = new ArrayList<>(documents.size());
        for (Document doc : documents) {
            rows.add(new Object[]{doc.getDocId(), doc.getPath(), toJson(doc), now});
        }

        jdbcTemplate.batchUpdate(UPSERT_SQL, rows);
        log.debug("Upserted {} documents", documents.size());
        return documents.size();
    }

    public List<Document> findAll() {
        return jdbcTemplate.query(
            "SELECT doc_id, payload FROM documents ORDER BY rowid",
            new DocumentRowMapper()
        );
    }

    /**
     * All stored documents keyed by doc_id, in insertion order
     */
    public Map<String, Document> findAllIndexed() {
        Map<String, Document> index = new LinkedHashMap<>();
        for (Document doc : findAll()) {
            index.put(doc.getDocId(), doc);
        }
        return index;
    }

    public Optional<Document> findById(String docId) {
        List<Document> results = jdbcTemplate.query(
            "SELECT doc_id, payload FROM documents WHERE doc_id = ?",
            new DocumentRowMapper(),
            docId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM documents", Integer.class);
        return count != null ? count : 0;
    }

    private String toJson(Document doc) {
        try {
            return objectMapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize document " + doc.getDocId(), e);
        }
    }

    private class DocumentRowMapper implements RowMapper<Document> {
        @Override
        public Document mapRow(ResultSet rs, int rowNum) throws SQLException {
            String docId = rs.getString("doc_id");
            String source = "documents[" + docId + "]";
            try {
                Document doc = objectMapper.readValue(rs.getString("payload"), Document.class);
                return RecordValidator.validate(doc, source);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new RecordValidationException("Document", source, e.getMessage(), e);
            }
        }
    }
}
