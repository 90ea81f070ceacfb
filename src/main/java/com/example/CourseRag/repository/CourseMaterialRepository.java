package com.example.CourseRag.repository;

import com.example.CourseRag.model.MaterialRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class CourseMaterialRepository {

    private static final String FIND_BY_IDS_SQL = """
            SELECT d.id,
                   d.content,
                   d.source,
                   d.chunk_number,
                   a.title,
                   a.topic
            FROM documents d
            JOIN assignments a ON d.assignment_id = a.id
            WHERE d.id IN (:ids)
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /**
     * Loads all documents for the given ids in one query.
     * Ids with no row are simply absent from the result.
     */
    public Map<UUID, MaterialRecord> findByIds(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return Map.of();
        }
        List<MaterialRecord> rows = jdbcTemplate.query(
                FIND_BY_IDS_SQL,
                new MapSqlParameterSource("ids", ids),
                new MaterialRecordRowMapper());

        Map<UUID, MaterialRecord> byId = new LinkedHashMap<>();
        for (MaterialRecord row : rows) {
            byId.put(row.id(), row);
        }
        return byId;
    }

    private static class MaterialRecordRowMapper implements RowMapper<MaterialRecord> {
        @Override
        public MaterialRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new MaterialRecord(
                    rs.getObject("id", UUID.class),
                    rs.getString("content"),
                    rs.getString("source"),
                    rs.getObject("chunk_number", Integer.class),
                    rs.getString("title"),
                    rs.getString("topic")
            );
        }
    }
}
