package com.entity.research.merge;

import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.MatchResult;
import com.entity.research.core.model.MergedEntity;
import com.entity.research.matching.EntityMatcher;
import com.entity.research.matching.KnownEntity;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job-scoped grouping and merging of candidate records. Keys are unique within a session.
 * Not thread-safe; the orchestrator owns one session per synthesis pass.
 */
public class SynthesisSession {

    private final EntityMatcher matcher;
    private final Synthesizer synthesizer;
    private final Map<String, MergedEntity> entities = new LinkedHashMap<>();
    private final Map<String, MatchResult> ambiguous = new LinkedHashMap<>();
    private int recordCount;

    public SynthesisSession(EntityMatcher matcher, Synthesizer synthesizer) {
        this.matcher = matcher;
        this.synthesizer = synthesizer;
    }

    /**
     * Matches the record against the groups seen so far and merges it into its group.
     */
    public MatchResult add(CandidateRecord record) {
        CandidateRecord keyed = record.normalizedKey() == null
                ? record.withNormalizedKey(matcher.keyFor(record)) : record;
        List<KnownEntity> known = entities.values().stream().map(KnownEntity::of).toList();
        MatchResult result = matcher.match(keyed, known);

        MergedEntity existing = entities.get(result.normalizedKey());
        CandidateRecord toMerge = existing == null ? keyed.withNormalizedKey(result.normalizedKey()) : keyed;
        entities.put(result.normalizedKey(), synthesizer.merge(existing, toMerge));
        if (result.ambiguous()) {
            ambiguous.put(record.id(), result);
        }
        recordCount++;
        return result;
    }

    public void addAll(Collection<CandidateRecord> records) {
        records.forEach(this::add);
    }

    public Collection<MergedEntity> entities() {
        return List.copyOf(entities.values());
    }

    public Optional<MergedEntity> get(String key) {
        return Optional.ofNullable(entities.get(key));
    }

    /**
     * The entity for the given target name: exact key first, then the best fuzzy match.
     */
    public Optional<MergedEntity> findTarget(String targetIdentity) {
        if (entities.isEmpty()) {
            return Optional.empty();
        }
        List<KnownEntity> known = entities.values().stream().map(KnownEntity::of).toList();
        MatchResult result = matcher.matchName(targetIdentity, known);
        return result.isNew() ? Optional.empty() : get(result.normalizedKey());
    }

    /**
     * Ambiguous match results keyed by the id of the record that triggered them.
     */
    public Map<String, MatchResult> ambiguousMatches() {
        return new LinkedHashMap<>(ambiguous);
    }

    public int recordCount() {
        return recordCount;
    }
}
