package com.govdata.discovery.support;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.domain.DomainModels.DatasetRelation;
import com.govdata.discovery.repository.DatasetStore;

import java.util.List;
import java.util.Optional;

/**
 * Empty store; tests override the lookups they care about.
 */
public class StubDatasetStore implements DatasetStore {
    @Override
    public List<Dataset> findByTextMatch(List<String> candidateTerms, String domainFilter, String agencyCode, int limit) {
        return List.of();
    }

    @Override
    public Optional<Dataset> findById(String id) {
        return Optional.empty();
    }

    @Override
    public List<Dataset> findByDomain(String domain, String excludeId, int limit) {
        return List.of();
    }

    @Override
    public List<Dataset> findByAgency(String agencyId, String excludeId, int limit) {
        return List.of();
    }

    @Override
    public List<Dataset> findByKeywords(List<String> keywords, int limit) {
        return List.of();
    }

    @Override
    public List<Dataset> findApiAccessible(int limit) {
        return List.of();
    }

    @Override
    public List<Dataset> findRecentlyUpdated(int limit) {
        return List.of();
    }

    @Override
    public List<DatasetRelation> getRelations(String datasetId) {
        return List.of();
    }

    @Override
    public List<Dataset> findAll(String domainFilter, String agencyCode, int limit, int offset) {
        return List.of();
    }

    @Override
    public long count(String domainFilter, String agencyCode) {
        return 0;
    }
}
