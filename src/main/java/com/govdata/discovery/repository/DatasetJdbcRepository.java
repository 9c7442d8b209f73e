package com.govdata.discovery.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govdata.discovery.domain.DomainModels.Accessibility;
import com.govdata.discovery.domain.DomainModels.Agency;
import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.domain.DomainModels.DatasetRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.*;
import java.util.stream.Collectors;

@Repository
public class DatasetJdbcRepository implements DatasetStore {
    private static final Logger log = LoggerFactory.getLogger(DatasetJdbcRepository.class);

    private static final String SELECT_DATASET =
            "SELECT d.id, d.name, d.description, d.keywords, d.domains, d.accessibility, d.frequency, d.format, " +
                    "d.api_endpoint, d.download_url, d.data_portal_url, d.collection_date, d.updated_at, " +
                    "a.id, a.code, a.name, a.description, a.website, " +
                    "(SELECT COUNT(*) FROM dataset_relations r WHERE r.to_id = d.id), " +
                    "(SELECT COUNT(*) FROM dataset_relations r WHERE r.from_id = d.id) " +
                    "FROM datasets d JOIN agencies a ON a.id = d.agency_id";

    private static final String NEWEST_FIRST = " ORDER BY d.updated_at DESC, d.id";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public DatasetJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Dataset> findByTextMatch(List<String> candidateTerms, String domainFilter, String agencyCode, int limit) {
        List<String> terms = candidateTerms == null ? List.of() : candidateTerms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        if (terms.isEmpty()) return List.of();

        StringBuilder sql = new StringBuilder(SELECT_DATASET).append(" WHERE (");
        List<Object> args = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) sql.append(" OR ");
            sql.append("LOWER(d.name) LIKE ? OR LOWER(d.description) LIKE ? OR LOWER(d.keywords) LIKE ? OR LOWER(d.domains) LIKE ? ")
                    .append("OR EXISTS (SELECT 1 FROM dataset_tags dt JOIN tags t ON t.id = dt.tag_id WHERE dt.dataset_id = d.id AND LOWER(t.name) LIKE ?)");
            String pattern = contains(terms.get(i));
            for (int n = 0; n < 5; n++) args.add(pattern);
        }
        sql.append(")");
        appendFilters(sql, args, domainFilter, agencyCode);
        sql.append(NEWEST_FIRST).append(" LIMIT ?");
        args.add(limit);
        return query(sql.toString(), args);
    }

    @Override
    public Optional<Dataset> findById(String id) {
        if (id == null) return Optional.empty();
        List<Dataset> rows = query(SELECT_DATASET + " WHERE d.id = ?", List.of(id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Dataset> findByDomain(String domain, String excludeId, int limit) {
        if (domain == null || domain.isBlank()) return List.of();
        StringBuilder sql = new StringBuilder(SELECT_DATASET).append(" WHERE LOWER(d.domains) LIKE ?");
        List<Object> args = new ArrayList<>();
        args.add(jsonElement(domain));
        excludeId(sql, args, excludeId);
        sql.append(NEWEST_FIRST).append(" LIMIT ?");
        args.add(limit);
        return query(sql.toString(), args);
    }

    @Override
    public List<Dataset> findByAgency(String agencyId, String excludeId, int limit) {
        if (agencyId == null) return List.of();
        StringBuilder sql = new StringBuilder(SELECT_DATASET).append(" WHERE d.agency_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(agencyId);
        excludeId(sql, args, excludeId);
        sql.append(NEWEST_FIRST).append(" LIMIT ?");
        args.add(limit);
        return query(sql.toString(), args);
    }

    @Override
    public List<Dataset> findByKeywords(List<String> keywords, int limit) {
        List<String> terms = keywords == null ? List.of() : keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        if (terms.isEmpty()) return List.of();

        String where = terms.stream().map(k -> "LOWER(d.keywords) LIKE ?").collect(Collectors.joining(" OR "));
        List<Object> args = new ArrayList<>();
        terms.forEach(k -> args.add(contains(k)));
        args.add(limit);
        return query(SELECT_DATASET + " WHERE (" + where + ")" + NEWEST_FIRST + " LIMIT ?", args);
    }

    @Override
    public List<Dataset> findApiAccessible(int limit) {
        return query(SELECT_DATASET + " WHERE d.accessibility = ? AND d.api_endpoint IS NOT NULL" + NEWEST_FIRST + " LIMIT ?",
                List.of(Accessibility.API.value(), limit));
    }

    @Override
    public List<Dataset> findRecentlyUpdated(int limit) {
        return query(SELECT_DATASET + NEWEST_FIRST + " LIMIT ?", List.of(limit));
    }

    @Override
    public List<DatasetRelation> getRelations(String datasetId) {
        return jdbcTemplate.query(
                "SELECT id, from_id, to_id, relation_type, description FROM dataset_relations " +
                        "WHERE from_id = ? OR to_id = ? ORDER BY CASE WHEN from_id = ? THEN 0 ELSE 1 END, id",
                (rs, n) -> new DatasetRelation(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5)),
                datasetId, datasetId, datasetId);
    }

    @Override
    public List<Dataset> findAll(String domainFilter, String agencyCode, int limit, int offset) {
        StringBuilder sql = new StringBuilder(SELECT_DATASET).append(" WHERE 1=1");
        List<Object> args = new ArrayList<>();
        appendFilters(sql, args, domainFilter, agencyCode);
        sql.append(NEWEST_FIRST).append(" LIMIT ? OFFSET ?");
        args.add(limit);
        args.add(offset);
        return query(sql.toString(), args);
    }

    @Override
    public long count(String domainFilter, String agencyCode) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM datasets d JOIN agencies a ON a.id = d.agency_id WHERE 1=1");
        List<Object> args = new ArrayList<>();
        appendFilters(sql, args, domainFilter, agencyCode);
        Long value = jdbcTemplate.queryForObject(sql.toString(), Long.class, args.toArray());
        return value == null ? 0 : value;
    }

    private void appendFilters(StringBuilder sql, List<Object> args, String domainFilter, String agencyCode) {
        if (domainFilter != null && !domainFilter.isBlank()) {
            sql.append(" AND LOWER(d.domains) LIKE ?");
            args.add(contains(domainFilter.toLowerCase(Locale.ROOT)));
        }
        if (agencyCode != null && !agencyCode.isBlank()) {
            sql.append(" AND a.code = ?");
            args.add(agencyCode);
        }
    }

    private void excludeId(StringBuilder sql, List<Object> args, String excludeId) {
        if (excludeId != null) {
            sql.append(" AND d.id <> ?");
            args.add(excludeId);
        }
    }

    private List<Dataset> query(String sql, List<Object> args) {
        List<Dataset> rows = jdbcTemplate.query(sql, datasetMapper(), args.toArray());
        return attachTags(rows);
    }

    private RowMapper<Dataset> datasetMapper() {
        return (rs, n) -> {
            Date collected = rs.getDate(12);
            Timestamp updated = rs.getTimestamp(13);
            String id = rs.getString(1);
            return new Dataset(
                    id, rs.getString(2), rs.getString(3),
                    parseStringList(rs.getString(4), id, "keywords"),
                    parseStringList(rs.getString(5), id, "domains"),
                    List.of(),
                    new Agency(rs.getString(14), rs.getString(15), rs.getString(16), rs.getString(17), rs.getString(18)),
                    Accessibility.fromValue(rs.getString(6)),
                    rs.getString(7), rs.getString(8), rs.getString(9), rs.getString(10), rs.getString(11),
                    collected == null ? null : collected.toLocalDate(),
                    updated == null ? null : updated.toInstant(),
                    rs.getInt(19), rs.getInt(20));
        };
    }

    private List<Dataset> attachTags(List<Dataset> datasets) {
        if (datasets.isEmpty()) return datasets;
        String placeholders = String.join(",", Collections.nCopies(datasets.size(), "?"));
        Map<String, List<String>> tagsById = new HashMap<>();
        jdbcTemplate.query(
                "SELECT dt.dataset_id, t.name FROM dataset_tags dt JOIN tags t ON t.id = dt.tag_id " +
                        "WHERE dt.dataset_id IN (" + placeholders + ") ORDER BY t.name",
                (RowCallbackHandler) rs -> tagsById
                        .computeIfAbsent(rs.getString(1), k -> new ArrayList<>())
                        .add(rs.getString(2)),
                datasets.stream().map(Dataset::id).toArray());

        return datasets.stream()
                .map(d -> new Dataset(d.id(), d.name(), d.description(), d.keywords(), d.domains(),
                        tagsById.getOrDefault(d.id(), List.of()), d.agency(), d.accessibility(),
                        d.frequency(), d.format(), d.apiEndpoint(), d.downloadUrl(), d.dataPortalUrl(),
                        d.collectionDate(), d.updatedAt(), d.incomingRelations(), d.outgoingRelations()))
                .toList();
    }

    List<String> parseStringList(String json, String datasetId, String column) {
        if (json == null || json.isBlank()) return List.of();
        try {
            List<String> values = objectMapper.readValue(json, STRING_LIST);
            if (values == null) return List.of();
            return values.stream().filter(Objects::nonNull).map(String::trim).filter(v -> !v.isEmpty()).distinct().toList();
        } catch (JsonProcessingException ex) {
            log.debug("malformed {} on dataset={}, using empty list: {}", column, datasetId, ex.getOriginalMessage());
            return List.of();
        }
    }

    private static String contains(String term) {
        return "%" + escapeLike(term) + "%";
    }

    private static String jsonElement(String value) {
        return "%\"" + escapeLike(value.toLowerCase(Locale.ROOT)) + "\"%";
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
