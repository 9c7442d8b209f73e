package com.govdata.discovery.catalog;

import com.govdata.discovery.catalog.CatalogModels.DatasetDetail;
import com.govdata.discovery.catalog.CatalogModels.DatasetPage;
import com.govdata.discovery.catalog.CatalogModels.LinkedDataset;
import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.domain.DomainModels.DatasetRelation;
import com.govdata.discovery.repository.DatasetStore;
import com.govdata.discovery.validation.RequestValidator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain browsing of the catalogue: filtered pages and a single dataset with its links.
 */
@Service
public class DatasetCatalogService {
    private final DatasetStore store;
    private final RequestValidator validator;

    public DatasetCatalogService(DatasetStore store, RequestValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    public DatasetPage list(String domainFilter, String agencyCode, int limit, int offset) {
        validator.requireValid(validator.validatePage(limit, offset));
        String domain = blankToNull(domainFilter);
        String agency = blankToNull(agencyCode);
        List<Dataset> datasets = store.findAll(domain, agency, limit, offset);
        return new DatasetPage(datasets, store.count(domain, agency), limit, offset);
    }

    public DatasetDetail get(String datasetId) {
        Dataset dataset = store.findById(datasetId).orElseThrow(() -> new DatasetNotFoundException(datasetId));

        List<LinkedDataset> outgoing = new ArrayList<>();
        List<LinkedDataset> incoming = new ArrayList<>();
        for (DatasetRelation relation : store.getRelations(datasetId)) {
            String otherId = relation.otherEnd(datasetId);
            store.findById(otherId).ifPresent(other -> {
                if (datasetId.equals(relation.fromId())) {
                    outgoing.add(LinkedDataset.of(relation, other));
                } else {
                    incoming.add(LinkedDataset.of(relation, other));
                }
            });
        }
        return new DatasetDetail(dataset, outgoing, incoming);
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
