package com.entity.research.matching;

import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.IdentifierSupport;
import com.entity.research.core.model.MatchDecision;
import com.entity.research.core.model.MatchResult;
import com.entity.research.core.model.MergedEntity;
import com.entity.research.rules.NormalizationEngine;
import com.entity.research.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns candidate records to identity groups.
 *
 * <p>Matching order:</p>
 * <ol>
 *   <li>An identifier present on both sides with equal values forces a match.</li>
 *   <li>Identical normalized names match exactly.</li>
 *   <li>Names similar at or above the threshold match fuzzily.</li>
 *   <li>Otherwise the candidate starts a new group under its own key.</li>
 * </ol>
 * A fuzzy match goes to the most similar group. When several groups tie at the top
 * score, or share an identifier, the one with more contributing records wins, then the
 * lexicographically smaller key; the result is flagged ambiguous.
 * A name match against a group carrying a different value for the same identifier
 * is kept but also flagged ambiguous.
 */
public class EntityMatcher {
    private static final Logger log = LoggerFactory.getLogger(EntityMatcher.class);

    private static final Comparator<KnownEntity> PREFERENCE =
            Comparator.comparingInt(KnownEntity::recordCount).reversed()
                    .thenComparing(KnownEntity::normalizedKey);

    private final NormalizationEngine normalizationEngine;
    private final SimilarityAlgorithm similarity;
    private final double threshold;

    public EntityMatcher(NormalizationEngine normalizationEngine, SimilarityAlgorithm similarity,
                         double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Fuzzy match threshold must be in (0.0, 1.0]");
        }
        this.normalizationEngine = normalizationEngine;
        this.similarity = similarity;
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public String normalize(String rawName) {
        return normalizationEngine.normalize(rawName);
    }

    /**
     * Key a candidate would get if it started a new group. Records without a usable
     * name fall back to an identifier, then to their record id.
     */
    public String keyFor(CandidateRecord candidate) {
        if (candidate.normalizedKey() != null && !candidate.normalizedKey().isBlank()) {
            return candidate.normalizedKey();
        }
        String normalized = normalize(candidate.rawName());
        if (!normalized.isEmpty()) {
            return normalized;
        }
        Map<String, String> ids = IdentifierSupport.extract(candidate.attributes());
        if (!ids.isEmpty()) {
            Map.Entry<String, String> first = ids.entrySet().iterator().next();
            return first.getKey() + ":" + first.getValue().toLowerCase(Locale.ROOT);
        }
        return "record:" + candidate.id();
    }

    /**
     * Matches a candidate record against the known groups.
     */
    public MatchResult match(CandidateRecord candidate, Collection<KnownEntity> existing) {
        return match(keyFor(candidate), IdentifierSupport.extract(candidate.attributes()), existing);
    }

    /**
     * Matches a merged entity from one job against groups stored by earlier jobs.
     */
    public MatchResult matchEntity(MergedEntity entity, Collection<KnownEntity> existing) {
        return match(entity.normalizedKey(), entity.identifiers(), existing);
    }

    /**
     * Matches a free-text name (no identifiers) against the known groups.
     */
    public MatchResult matchName(String rawName, Collection<KnownEntity> existing) {
        return match(normalize(rawName), Map.of(), existing);
    }

    MatchResult match(String key, Map<String, String> identifiers, Collection<KnownEntity> existing) {
        if (existing.isEmpty()) {
            return MatchResult.newKey(key);
        }

        Optional<MatchResult> byIdentifier = matchByIdentifier(identifiers, existing);
        if (byIdentifier.isPresent()) {
            return byIdentifier.get();
        }

        for (KnownEntity known : existing) {
            if (known.normalizedKey().equals(key)) {
                return withConflictCheck(known, identifiers, 1.0, MatchDecision.EXACT,
                        "Normalized name '" + key + "' matched exactly", List.of(known.normalizedKey()));
            }
        }

        List<KnownEntity> qualifying = new ArrayList<>();
        double best = 0.0;
        for (KnownEntity known : existing) {
            double score = similarity.compute(key, known.normalizedKey());
            if (score < threshold) {
                best = Math.max(best, score);
                continue;
            }
            // Only the best-scoring groups compete; record count breaks ties among them
            if (qualifying.isEmpty() || score > best) {
                qualifying.clear();
                best = score;
            }
            if (score == best) {
                qualifying.add(known);
            }
        }
        if (qualifying.isEmpty()) {
            log.debug("match.new key={} bestScore={}", key, best);
            return MatchResult.newKey(key);
        }

        qualifying.sort(PREFERENCE);
        KnownEntity chosen = qualifying.get(0);
        List<String> considered = qualifying.stream().map(KnownEntity::normalizedKey).toList();
        MatchResult result = withConflictCheck(chosen, identifiers, best, MatchDecision.FUZZY,
                String.format("Name '%s' matched '%s' with similarity %.3f", key, chosen.normalizedKey(), best),
                considered);
        if (qualifying.size() > 1) {
            log.info("match.ambiguous key={} candidates={} chosen={}", key, considered, chosen.normalizedKey());
            return new MatchResult(result.normalizedKey(), best, MatchDecision.FUZZY, true, considered,
                    result.reasoning() + "; tie-break among " + considered + " preferred more records");
        }
        return result;
    }

    private Optional<MatchResult> matchByIdentifier(Map<String, String> identifiers,
                                                    Collection<KnownEntity> existing) {
        if (identifiers.isEmpty()) {
            return Optional.empty();
        }
        List<KnownEntity> matches = new ArrayList<>();
        String sharedField = null;
        for (KnownEntity known : existing) {
            for (Map.Entry<String, String> id : identifiers.entrySet()) {
                if (id.getValue().equals(known.identifiers().get(id.getKey()))) {
                    matches.add(known);
                    sharedField = sharedField != null ? sharedField : id.getKey();
                    break;
                }
            }
        }
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        matches.sort(PREFERENCE);
        KnownEntity chosen = matches.get(0);
        List<String> considered = matches.stream().map(KnownEntity::normalizedKey).toList();
        boolean ambiguous = matches.size() > 1;
        String reasoning = "Identifier " + sharedField + " matched '" + chosen.normalizedKey() + "'";
        if (ambiguous) {
            log.info("match.ambiguous identifierMatches={} chosen={}", considered, chosen.normalizedKey());
            reasoning += "; identifier shared by " + considered + ", preferred more records";
        }
        return Optional.of(new MatchResult(chosen.normalizedKey(), 1.0, MatchDecision.IDENTIFIER,
                ambiguous, considered, reasoning));
    }

    private MatchResult withConflictCheck(KnownEntity known, Map<String, String> identifiers, double score,
                                          MatchDecision decision, String reasoning, List<String> considered) {
        for (Map.Entry<String, String> id : identifiers.entrySet()) {
            String other = known.identifiers().get(id.getKey());
            if (other != null && !other.equals(id.getValue())) {
                log.warn("match.identifierConflict key={} field={} candidate={} existing={}",
                        known.normalizedKey(), id.getKey(), id.getValue(), other);
                return new MatchResult(known.normalizedKey(), score, decision, true, considered,
                        reasoning + "; identifier conflict on " + id.getKey() + " ("
                                + id.getValue() + " vs " + other + ")");
            }
        }
        return new MatchResult(known.normalizedKey(), score, decision, false, considered, reasoning);
    }
}
