package com.govdata.discovery.search;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.query.QueryExpansionService;
import com.govdata.discovery.query.QueryInterpreter;
import com.govdata.discovery.search.SearchModels.RankedDataset;
import com.govdata.discovery.search.SearchModels.SearchResponse;
import com.govdata.discovery.support.StubDatasetStore;
import com.govdata.discovery.validation.InvalidRequestException;
import com.govdata.discovery.validation.RequestValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SearchServiceTest {
    @Autowired
    private SearchService searchService;

    @Test
    void labourForceQueryRanksLabourForceDatasetFirst() {
        SearchResponse response = searchService.search("labour force", null, null);

        assertFalse(response.results().isEmpty());
        assertEquals("ds-labour-force", response.results().get(0).dataset().id());
        assertTrue(response.results().get(0).relevanceScore() >= 150);
        assertEquals(response.results().size(), response.total());
        assertEquals("labour force", response.query());
    }

    @Test
    void resultsAreSortedByDescendingScore() {
        List<RankedDataset> results = searchService.search("aged care workforce trends since 2015", null, null).results();

        assertFalse(results.isEmpty());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).relevanceScore() >= results.get(i).relevanceScore());
        }
    }

    @Test
    void domainAndAgencyFiltersRestrictCandidates() {
        SearchResponse byDomain = searchService.search("employment", "education", null);
        assertFalse(byDomain.results().isEmpty());
        assertTrue(byDomain.results().stream().allMatch(r -> r.dataset().domains().contains("education")));

        SearchResponse byAgency = searchService.search("employment", null, "DoE");
        assertFalse(byAgency.results().isEmpty());
        assertTrue(byAgency.results().stream().allMatch(r -> "DoE".equals(r.dataset().agency().code())));
    }

    @Test
    void responseCarriesInterpretationAndExpansion() {
        SearchResponse response = searchService.search("housing affordability", null, null);

        assertEquals("housing", response.nlp().processedQuery().domains().get(0));
        assertFalse(response.nlp().relatedTerms().isEmpty());
        assertFalse(response.nlp().suggestions().isEmpty());
    }

    @Test
    void blankQueryIsRejected() {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class, () -> searchService.search("   ", null, null));
        assertEquals("MISSING_QUERY", ex.getErrors().get(0).code());
        assertThrows(InvalidRequestException.class, () -> searchService.search(null, null, null));
    }

    @Test
    void storeFailureYieldsEmptyResults() {
        StubDatasetStore failing = new StubDatasetStore() {
            @Override
            public List<Dataset> findByTextMatch(List<String> candidateTerms, String domainFilter, String agencyCode, int limit) {
                throw new DataAccessResourceFailureException("database down");
            }
        };
        SearchService service = new SearchService(new QueryInterpreter(), new QueryExpansionService(),
                new RelevanceScorer(), failing, new RequestValidator(), 20);

        SearchResponse response = service.search("labour force", null, null);

        assertTrue(response.results().isEmpty());
        assertEquals(0, response.total());
        assertNotNull(response.nlp());
    }
}
