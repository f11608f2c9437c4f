package com.entity.research.merge;

import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.EntityType;
import com.entity.research.core.model.MergedEntity;
import com.entity.research.core.model.ProvenanceEntry;
import com.entity.research.core.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds candidate records into merged entities, field by field.
 *
 * <p>A field keeps the value from the highest-ranked source that reported it. A value
 * from a lower-ranked source only fills a field no higher-ranked source reported.
 * Between sources of equal rank the higher record confidence wins, then the smaller
 * record id, so the result does not depend on the order records arrive in.
 * Merging a record that already contributes is a no-op.</p>
 */
public class Synthesizer {
    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final SourcePriority priority;
    private final ScoringPolicy scoring;

    public Synthesizer(SourcePriority priority, ScoringPolicy scoring) {
        this.priority = Objects.requireNonNull(priority, "priority is required");
        this.scoring = Objects.requireNonNull(scoring, "scoring is required");
    }

    public SourcePriority getPriority() {
        return priority;
    }

    /**
     * Merges one candidate into an existing entity, or starts a new entity when
     * {@code existing} is null. The candidate must carry a normalized key when
     * starting a new entity.
     */
    public MergedEntity merge(MergedEntity existing, CandidateRecord candidate) {
        Objects.requireNonNull(candidate, "candidate is required");
        if (existing != null && existing.hasRecord(candidate.id())) {
            log.debug("synthesize.skipDuplicate key={} recordId={}", existing.normalizedKey(), candidate.id());
            return existing;
        }

        String key = existing != null ? existing.normalizedKey() : candidate.normalizedKey();
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Candidate record " + candidate.id() + " has no normalized key");
        }
        EntityType type = existing != null && existing.entityType() != null
                ? existing.entityType() : candidate.entityType();

        Map<String, Object> attributes = new LinkedHashMap<>(existing != null ? existing.attributes() : Map.of());
        Map<String, ProvenanceEntry> provenance =
                new LinkedHashMap<>(existing != null ? existing.provenance() : Map.of());
        int rank = priority.rank(candidate.sourceType());

        for (Map.Entry<String, Object> field : candidate.fields().entrySet()) {
            Object value = field.getValue();
            if (isEmpty(value)) {
                continue;
            }
            ProvenanceEntry current = provenance.get(field.getKey());
            if (current == null || outranks(rank, candidate, current)) {
                if (current != null) {
                    log.debug("synthesize.replace key={} field={} from={} to={}",
                            key, field.getKey(), current.sourceType(), candidate.sourceType());
                }
                attributes.put(field.getKey(), value);
                provenance.put(field.getKey(), new ProvenanceEntry(field.getKey(), value, candidate.id(),
                        candidate.sourceType(), rank, candidate.confidence(), candidate.sourceUrl()));
            }
        }

        List<CandidateRecord> records = new ArrayList<>(existing != null ? existing.contributingRecords() : List.of());
        records.add(candidate);
        return score(key, type, attributes, provenance, records);
    }

    /**
     * Builds an entity from scratch out of the given records, in order.
     */
    public MergedEntity mergeAll(String key, Collection<CandidateRecord> records) {
        MergedEntity entity = null;
        for (CandidateRecord record : records) {
            entity = merge(entity, entity == null ? record.withNormalizedKey(key) : record);
        }
        return entity != null ? entity : empty(key, null);
    }

    /**
     * Folds the records of {@code update} into {@code base}. Used when a job's result is
     * stored over an entity collected by an earlier job.
     */
    public MergedEntity combine(MergedEntity base, MergedEntity update) {
        MergedEntity result = base;
        for (CandidateRecord record : update.contributingRecords()) {
            result = merge(result, record);
        }
        return result;
    }

    /**
     * An entity with no records: completeness 0, confidence 0.
     */
    public MergedEntity empty(String key, EntityType type) {
        return new MergedEntity(key, type, Map.of(), Map.of(), 0, 0.0, 0, List.of());
    }

    private MergedEntity score(String key, EntityType type, Map<String, Object> attributes,
                               Map<String, ProvenanceEntry> provenance, List<CandidateRecord> records) {
        Set<SourceType> sourceTypes = EnumSet.noneOf(SourceType.class);
        records.forEach(r -> sourceTypes.add(r.sourceType()));
        boolean topTier = sourceTypes.stream().anyMatch(priority::isTopTier);
        int completeness = scoring.completeness(type, attributes);
        double confidence = scoring.confidence(sourceTypes, topTier, completeness);
        return new MergedEntity(key, type, attributes, provenance, completeness, confidence,
                sourceTypes.size(), records);
    }

    private static boolean outranks(int rank, CandidateRecord candidate, ProvenanceEntry current) {
        if (rank != current.sourceRank()) {
            return rank > current.sourceRank();
        }
        if (candidate.confidence() != current.confidence()) {
            return candidate.confidence().isHigherThan(current.confidence());
        }
        return candidate.id().compareTo(current.recordId()) < 0;
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }
}
