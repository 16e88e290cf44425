package io.github.chirino.atlas.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.atlas.MutableClock;
import io.github.chirino.atlas.metadata.MemoryMetadataStore;
import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.query.BoundingBox;
import io.github.chirino.atlas.query.FieldFilter;
import io.github.chirino.atlas.query.FilterField;
import io.github.chirino.atlas.query.QueryPlan;
import io.github.chirino.atlas.query.QueryPlanner;
import io.github.chirino.atlas.query.QuerySpec;
import io.github.chirino.atlas.query.ScoredDocument;
import io.github.chirino.atlas.query.SemanticQuery;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryRecordStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MemoryMetadataStore metadata;
    private MemoryRecordStore store;
    private final QueryPlanner planner = new QueryPlanner();

    @BeforeEach
    void setUp() {
        metadata = new MemoryMetadataStore();
        store = MemoryStores.recordStore(metadata, MutableClock.startingAt("2024-06-01T00:00:00Z"));
    }

    private UUID add(String sourceId, String date, float[] embedding, Position position) {
        DocumentDraft draft =
                new DocumentDraft(
                        "arxiv",
                        sourceId,
                        "Title " + sourceId,
                        "Abstract " + sourceId,
                        date == null ? null : LocalDate.parse(date),
                        Map.of());
        UUID id = store.upsert(draft).id();
        if (embedding != null) {
            assertTrue(store.writeEmbedding(id, embedding, draft.contentHash()));
        }
        if (position != null) {
            assertTrue(store.writePosition(id, position, draft.contentHash()));
        }
        return id;
    }

    private List<ScoredDocument> run(QuerySpec spec) {
        QueryPlan plan = planner.plan(spec);
        return store.execute(plan, TIMEOUT);
    }

    @Test
    void upsert_reports_created_unchanged_and_text_changed() {
        DocumentDraft draft = new DocumentDraft("arxiv", "1", "A", "B", null, Map.of());
        assertEquals(UpsertOutcome.CREATED, store.upsert(draft).outcome());
        assertEquals(UpsertOutcome.UNCHANGED, store.upsert(draft).outcome());

        DocumentDraft retitled = new DocumentDraft("arxiv", "1", "A2", "B", null, Map.of());
        assertEquals(UpsertOutcome.TEXT_CHANGED, store.upsert(retitled).outcome());
        assertEquals(1, store.size());
    }

    @Test
    void date_only_change_keeps_enrichment() {
        UUID id = add("1", "2024-01-01", new float[] {1, 0}, new Position(1, 1));

        UpsertResult result =
                store.upsert(
                        new DocumentDraft(
                                "arxiv",
                                "1",
                                "Title 1",
                                "Abstract 1",
                                LocalDate.parse("2024-02-01"),
                                Map.of()));

        assertEquals(UpsertOutcome.UNCHANGED, result.outcome());
        DocumentRecord record = store.findById(id).orElseThrow();
        assertTrue(record.hasPosition());
        assertEquals(LocalDate.parse("2024-02-01"), record.getPrimaryDate());
    }

    @Test
    void embedding_write_is_refused_when_text_changed() {
        DocumentDraft draft = new DocumentDraft("arxiv", "1", "A", "B", null, Map.of());
        UUID id = store.upsert(draft).id();
        String staleHash = draft.contentHash();
        store.upsert(new DocumentDraft("arxiv", "1", "A changed", "B", null, Map.of()));

        assertFalse(store.writeEmbedding(id, new float[] {1, 0}, staleHash));
        assertFalse(store.findById(id).orElseThrow().hasEmbedding());
    }

    @Test
    void position_write_requires_embedding() {
        UUID id = add("1", null, null, null);

        assertFalse(store.writePosition(id, new Position(0, 0), null));
        assertFalse(store.writePosition(UUID.randomUUID(), new Position(0, 0), null));
        assertNull(store.findById(id).orElseThrow().getPosition());
    }

    @Test
    void position_write_is_refused_after_re_embedding() {
        DocumentDraft draft = new DocumentDraft("arxiv", "1", "A", "B", null, Map.of());
        UUID id = store.upsert(draft).id();
        assertTrue(store.writeEmbedding(id, new float[] {1, 0}, draft.contentHash()));
        String projectedFrom = store.findById(id).orElseThrow().getEmbeddingHash();

        DocumentDraft changed = new DocumentDraft("arxiv", "1", "A changed", "B", null, Map.of());
        store.upsert(changed);
        // Still the old embedding: a position computed from it is consistent with the row.
        assertEquals(projectedFrom, store.findById(id).orElseThrow().getEmbeddingHash());
        assertTrue(store.writeEmbedding(id, new float[] {0, 1}, changed.contentHash()));

        assertFalse(store.writePosition(id, new Position(3, 3), projectedFrom));
        assertNull(store.findById(id).orElseThrow().getPosition());
        assertTrue(store.writePosition(id, new Position(4, 4), changed.contentHash()));
    }

    @Test
    void queries_only_return_positioned_records() {
        add("unembedded", "2024-01-03", null, null);
        add("embedded", "2024-01-02", new float[] {1, 0}, null);
        UUID positioned = add("positioned", "2024-01-01", new float[] {1, 0}, new Position(0, 0));

        List<ScoredDocument> hits = run(QuerySpec.builder().build());

        assertEquals(1, hits.size());
        assertEquals(positioned, hits.get(0).document().id());
    }

    @Test
    void sorted_view_returns_newest_first_and_stops_after_cap_plus_one() {
        for (int i = 1; i <= 9; i++) {
            add("d" + i, "2024-01-0" + i, new float[] {1, 0}, new Position(i, i));
        }
        add("undated", null, new float[] {1, 0}, new Position(5, 5));

        List<ScoredDocument> hits = run(QuerySpec.builder().cap(3).build());

        assertEquals(4, hits.size());
        assertEquals(LocalDate.parse("2024-01-09"), hits.get(0).document().primaryDate());
        assertEquals(LocalDate.parse("2024-01-06"), hits.get(3).document().primaryDate());
    }

    @Test
    void undated_records_sort_last() {
        add("undated", null, new float[] {1, 0}, new Position(0, 0));
        add("dated", "2020-01-01", new float[] {1, 0}, new Position(0, 0));

        List<ScoredDocument> hits = run(QuerySpec.builder().build());

        assertEquals("dated", hits.get(0).document().sourceId());
        assertEquals("undated", hits.get(1).document().sourceId());
    }

    @Test
    void bounding_box_and_filters_are_combined() {
        add("inside", "2024-03-01", new float[] {1, 0}, new Position(1, 1));
        add("outside", "2024-03-01", new float[] {1, 0}, new Position(10, 10));
        add("too-old", "2023-01-01", new float[] {1, 0}, new Position(2, 2));

        List<ScoredDocument> hits =
                run(
                        QuerySpec.builder()
                                .box(BoundingBox.of(0, 0, 5, 5))
                                .filter(
                                        FieldFilter.between(
                                                FilterField.PRIMARY_DATE,
                                                LocalDate.parse("2024-01-01"),
                                                null))
                                .build());

        assertEquals(1, hits.size());
        assertEquals("inside", hits.get(0).document().sourceId());
    }

    @Test
    void metadata_filters_read_the_side_table() {
        UUID physics = add("p", "2024-01-01", new float[] {1, 0}, new Position(0, 0));
        UUID biology = add("b", "2024-01-02", new float[] {1, 0}, new Position(0, 0));
        metadata.put(physics, "arxiv", Map.of("category", "physics"));
        metadata.put(biology, "arxiv", Map.of("category", "biology"));

        List<ScoredDocument> hits =
                run(
                        QuerySpec.builder()
                                .filter(
                                        FieldFilter.equalTo(
                                                FilterField.metadata("category"), "physics"))
                                .build());

        assertEquals(1, hits.size());
        assertEquals(physics, hits.get(0).document().id());
    }

    @Test
    void semantic_queries_rank_by_similarity_and_apply_floor() {
        add("close", "2024-01-01", new float[] {1, 0.1f}, new Position(0, 0));
        add("closest", "2020-01-01", new float[] {1, 0}, new Position(0, 0));
        add("orthogonal", "2024-01-01", new float[] {0, 1}, new Position(0, 0));

        List<ScoredDocument> hits =
                run(
                        QuerySpec.builder()
                                .semantic(new SemanticQuery(new float[] {1, 0}, 0.5))
                                .build());

        assertEquals(2, hits.size());
        assertEquals("closest", hits.get(0).document().sourceId());
        assertEquals(1.0, hits.get(0).similarity(), 1e-6);
        assertEquals("close", hits.get(1).document().sourceId());
    }

    @Test
    void stored_embedding_is_a_copy() {
        float[] embedding = {1, 2};
        UUID id = add("1", null, embedding, null);
        embedding[0] = 99;

        assertArrayEquals(new float[] {1, 2}, store.findById(id).orElseThrow().getEmbedding());
    }
}
