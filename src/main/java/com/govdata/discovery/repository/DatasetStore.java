package com.govdata.discovery.repository;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.domain.DomainModels.DatasetRelation;

import java.util.List;
import java.util.Optional;

/**
 * Read operations the discovery core needs from the dataset store. Every list comes back
 * most recently updated first. Implementations may throw; callers treat a failed fetch as
 * an empty result.
 */
public interface DatasetStore {
    /**
     * Substring match of any candidate term against name, description, keywords, tags and
     * domains. {@code domainFilter} and {@code agencyCode} narrow the match when non-null.
     */
    List<Dataset> findByTextMatch(List<String> candidateTerms, String domainFilter, String agencyCode, int limit);

    Optional<Dataset> findById(String id);

    List<Dataset> findByDomain(String domain, String excludeId, int limit);

    List<Dataset> findByAgency(String agencyId, String excludeId, int limit);

    /** Datasets whose keyword list contains any of the given keywords. */
    List<Dataset> findByKeywords(List<String> keywords, int limit);

    List<Dataset> findApiAccessible(int limit);

    List<Dataset> findRecentlyUpdated(int limit);

    /** Relations where the dataset is source or target, outgoing first. */
    List<DatasetRelation> getRelations(String datasetId);

    List<Dataset> findAll(String domainFilter, String agencyCode, int limit, int offset);

    long count(String domainFilter, String agencyCode);
}
