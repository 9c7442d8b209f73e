package com.govdata.discovery.search;

import com.govdata.discovery.domain.DomainModels.Accessibility;
import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.support.SampleDatasets;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelevanceScorerTest {
    private final RelevanceScorer scorer = new RelevanceScorer();

    private final Dataset labourForce = SampleDatasets.dataset("ds-labour-force", "Labour Force, Australia",
            List.of("employment", "unemployment", "labour force", "participation rate"),
            List.of("labour", "economy"), List.of("labour-market", "workforce"),
            SampleDatasets.ABS, Accessibility.API, 0, 0);

    @Test
    void nameMatchWithKeywordsScoresAtLeast150() {
        double score = scorer.score(labourForce, "labour force", List.of("labour", "force"));

        assertTrue(score >= 150, "score was " + score);
        assertEquals(150, score, 1e-9);
    }

    @Test
    void eachAdditionalMatchingKeywordAddsExactly25() {
        double one = scorer.score(labourForce, "jobs", List.of("employment"));
        double two = scorer.score(labourForce, "jobs", List.of("employment", "participation"));
        double withMiss = scorer.score(labourForce, "jobs", List.of("employment", "zebra"));

        assertEquals(25, two - one, 1e-9);
        assertEquals(one, withMiss, 1e-9);
    }

    @Test
    void queryIsMatchedCaseInsensitivelyAfterTrimming() {
        assertEquals(100, scorer.score(labourForce, "  LABOUR FORCE  ", List.of()), 1e-9);
    }

    @Test
    void descriptionAndTagHitsAddTheirWeights() {
        assertEquals(50, scorer.score(labourForce, "description", List.of()), 1e-9);
        assertEquals(20, scorer.score(labourForce, "workforce", List.of()), 1e-9);
    }

    @Test
    void relationsAddTenEach() {
        Dataset linked = SampleDatasets.dataset("ds-linked", "Linked", List.of(), List.of(), List.of(),
                SampleDatasets.ABS, Accessibility.PUBLIC, 2, 1);

        assertEquals(30, scorer.score(linked, "nothing matches", List.of()), 1e-9);
    }

    @Test
    void nullDatasetScoresZero() {
        assertEquals(0, scorer.score(null, "labour", List.of("labour")), 1e-9);
    }
}
