package com.govdata.discovery.catalog;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.domain.DomainModels.DatasetRelation;

import java.util.List;

public class CatalogModels {
    public record DatasetPage(List<Dataset> datasets, long total, int limit, int offset) {}

    public record DatasetDetail(Dataset dataset, List<LinkedDataset> outgoing, List<LinkedDataset> incoming) {}

    public record LinkedDataset(String relationId, String kind, String description, Dataset dataset) {
        static LinkedDataset of(DatasetRelation relation, Dataset other) {
            return new LinkedDataset(relation.id(), relation.kind(), relation.description(), other);
        }
    }
}
