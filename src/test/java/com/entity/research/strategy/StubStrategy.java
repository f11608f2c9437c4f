package com.entity.research.strategy;

import com.entity.research.core.model.CandidateRecord;
import com.entity.research.core.model.EntityFields;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.SourceType;
import com.entity.research.retry.CollectionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Strategy returning canned rows through the shared fetch pipeline. Each row is a field map
 * whose {@code name} entry becomes the record's raw name.
 */
public class StubStrategy extends AbstractStrategy {

    private final List<Map<String, Object>> rows;
    private final CollectionException failure;
    private final CountDownLatch gate;
    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicInteger fetches = new AtomicInteger();

    private StubStrategy(StrategyKind kind, SourceType sourceType, String targetKey,
                         List<Map<String, Object>> rows, CollectionException failure, CountDownLatch gate) {
        super(kind, sourceType, targetKey, null);
        this.rows = rows;
        this.failure = failure;
        this.gate = gate;
    }

    public static StubStrategy returning(StrategyKind kind, SourceType sourceType, String targetKey,
                                         List<Map<String, Object>> rows) {
        return new StubStrategy(kind, sourceType, targetKey, rows, null, null);
    }

    public static StubStrategy failing(StrategyKind kind, SourceType sourceType, String targetKey,
                                       CollectionException failure) {
        return new StubStrategy(kind, sourceType, targetKey, List.of(), failure, null);
    }

    /**
     * Returns the rows only after {@code gate} opens.
     */
    public static StubStrategy gated(StrategyKind kind, SourceType sourceType, String targetKey,
                                     List<Map<String, Object>> rows, CountDownLatch gate) {
        return new StubStrategy(kind, sourceType, targetKey, rows, null, gate);
    }

    @Override
    protected List<CandidateRecord> collect(EntityProfile profile, Session session) throws InterruptedException {
        started.countDown();
        if (gate != null) {
            gate.await();
        }
        List<Map<String, Object>> fetched = session.fetch("lookup", Map.of("name", profile.targetIdentity()), () -> {
            fetches.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return rows;
        });
        List<CandidateRecord> records = new ArrayList<>();
        for (Map<String, Object> row : fetched) {
            CandidateRecord.Builder builder = record(profile)
                    .rawName(String.valueOf(row.getOrDefault(EntityFields.NAME, "")))
                    .sourceUrl("https://" + targetKey() + ".example/" + id());
            row.forEach((field, value) -> {
                if (!EntityFields.NAME.equals(field)) {
                    builder.attribute(field, value);
                }
            });
            records.add(builder.build());
        }
        return records;
    }

    public CountDownLatch getStarted() {
        return started;
    }

    /**
     * Requests that actually reached the stubbed source, cache hits excluded.
     */
    public int getFetches() {
        return fetches.get();
    }
}
