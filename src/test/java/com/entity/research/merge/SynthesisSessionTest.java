package com.entity.research.merge;

import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.EntityFields;
import com.entity.research.core.model.EntityType;
import com.entity.research.core.model.MergedEntity;
import com.entity.research.core.model.SourceType;
import com.entity.research.matching.EntityMatcher;
import com.entity.research.rules.DefaultNormalizationRules;
import com.entity.research.similarity.NameSimilarityScorer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SynthesisSessionTest {

    private static final List<CandidateRecord> RECORDS = List.of(
            record("r1", "Acme Capital, LLC", SourceType.REGULATORY_FILING, EntityFields.AUM, 500_000_000L),
            record("r2", "Acme Capital", SourceType.FIRST_PARTY_CONTENT, EntityFields.WEBSITE, "acmecap.com"),
            record("r3", "ACME CAPITAL INC.", SourceType.PRESS_NEWS, EntityFields.HEADQUARTERS, "Boston"),
            record("r4", "Zenith Ventures", SourceType.PRESS_NEWS, EntityFields.HEADQUARTERS, "Austin"));

    private static CandidateRecord record(String id, String name, SourceType type, String field, Object value) {
        return CandidateRecord.builder()
                .id(id)
                .rawName(name)
                .entityType(EntityType.INVESTOR)
                .sourceType(type)
                .attribute(field, value)
                .build();
    }

    private static SynthesisSession newSession() {
        EntityMatcher matcher = new EntityMatcher(DefaultNormalizationRules.createDefaultEngine(),
                new NameSimilarityScorer(), 0.85);
        return new SynthesisSession(matcher,
                new Synthesizer(SourcePriority.defaultOrder(), ScoringPolicy.defaults()));
    }

    private static List<MergedEntity> sorted(Collection<MergedEntity> entities) {
        List<MergedEntity> list = new ArrayList<>(entities);
        list.sort(Comparator.comparing(MergedEntity::normalizedKey));
        return list;
    }

    @Test
    void groupsVariantsOfOneNameTogether() {
        SynthesisSession session = newSession();
        session.addAll(RECORDS);

        assertEquals(2, session.entities().size());
        assertEquals(4, session.recordCount());
        MergedEntity acme = session.get("acme capital").orElseThrow();
        assertEquals(3, acme.recordCount());
        assertEquals(3, acme.sourceCount());
        assertEquals("Acme Capital, LLC", acme.attributes().get(EntityFields.NAME));
    }

    @Test
    void resultDoesNotDependOnArrivalOrder() {
        SynthesisSession forward = newSession();
        forward.addAll(RECORDS);
        List<CandidateRecord> reversed = new ArrayList<>(RECORDS);
        java.util.Collections.reverse(reversed);
        SynthesisSession backward = newSession();
        backward.addAll(reversed);

        List<MergedEntity> a = sorted(forward.entities());
        List<MergedEntity> b = sorted(backward.entities());
        assertEquals(a.size(), b.size());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).normalizedKey(), b.get(i).normalizedKey());
            assertEquals(a.get(i).attributes(), b.get(i).attributes());
            assertEquals(a.get(i).provenance(), b.get(i).provenance());
            assertEquals(a.get(i).confidenceScore(), b.get(i).confidenceScore());
        }
    }

    @Test
    void findsTargetByFuzzyName() {
        SynthesisSession session = newSession();
        session.addAll(RECORDS);

        assertEquals("acme capital", session.findTarget("The Acme Capitol").orElseThrow().normalizedKey());
        assertTrue(session.findTarget("Northwind Holdings").isEmpty());
        assertTrue(newSession().findTarget("Acme").isEmpty());
    }
}
