package com.essaycoach.corpus;

import com.essaycoach.TestData;
import com.essaycoach.errors.DuplicatePromptIdException;
import com.essaycoach.errors.MalformedImportException;
import com.essaycoach.models.EvaluationCriteria;
import com.essaycoach.models.GradeTier;
import com.essaycoach.models.ProficiencyLevel;
import com.essaycoach.models.PromptRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PromptCorpusTest {

    @TempDir
    Path tempDir;

    private PromptCorpus corpus;

    @BeforeEach
    void setUp() {
        corpus = new PromptCorpus(new HashingEmbedder(64));
    }

    @Test
    void testInsertComputesEmbedding() {
        PromptRecord stored = corpus.insert(TestData.familyPrompt());

        assertEquals(1, corpus.count());
        assertTrue(stored.hasEmbedding());
        assertEquals(64, stored.getEmbeddingDimension());
        assertEquals(stored, corpus.findById("1").orElseThrow());
    }

    @Test
    void testDuplicateIdRejected() {
        corpus.insert(TestData.prompt("7", GradeTier.PRIMARY_SCHOOL, ProficiencyLevel.BEGINNER, "narrative", "pets"));
        corpus.insert(TestData.prompt("8", GradeTier.PRIMARY_SCHOOL, ProficiencyLevel.BEGINNER, "narrative", "food"));

        DuplicatePromptIdException error = assertThrows(DuplicatePromptIdException.class, () ->
                corpus.insert(TestData.prompt("7", GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "opinion", "cars")));
        assertEquals("7", error.getPromptId());
        assertEquals(2, corpus.count());
    }

    @Test
    void testMissingFieldsRejected() {
        PromptRecord noTopic = TestData.prompt("3", GradeTier.PRIMARY_SCHOOL, ProficiencyLevel.BEGINNER, "narrative", " ");
        assertThrows(IllegalArgumentException.class, () -> corpus.insert(noTopic));
        assertEquals(0, corpus.count());
    }

    @Test
    void testSuppliedEmbeddingMustMatchDimension() {
        PromptRecord record = TestData.familyPrompt().withEmbedding(new double[8]);
        assertThrows(IllegalArgumentException.class, () -> corpus.insert(record));
    }

    @Test
    void testExactMatchPerTier() {
        for (GradeTier tier : GradeTier.values()) {
            corpus.insert(TestData.prompt(tier.getValue(), tier, ProficiencyLevel.INTERMEDIATE, "narrative", "school"));
        }

        for (GradeTier tier : GradeTier.values()) {
            SearchResult result = corpus.search(new EvaluationCriteria(tier, ProficiencyLevel.INTERMEDIATE), null);
            assertEquals(RelaxationStep.EXACT, result.relaxation());
            assertEquals(tier, result.best().orElseThrow().prompt().getGrade());
        }
    }

    @Test
    void testRelaxationChain() {
        corpus.insert(TestData.prompt("1", GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.INTERMEDIATE, "letter", "travel"));

        SearchResult genreDropped = corpus.search(
                new EvaluationCriteria(GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.INTERMEDIATE, "narrative", null), null);
        assertEquals(RelaxationStep.IGNORE_GENRE_TOPIC, genreDropped.relaxation());

        SearchResult levelDropped = corpus.search(
                new EvaluationCriteria(GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.ADVANCED), null);
        assertEquals(RelaxationStep.IGNORE_LEVEL, levelDropped.relaxation());

        SearchResult gradeDropped = corpus.search(
                new EvaluationCriteria(GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "letter", "travel"), null);
        assertEquals(RelaxationStep.IGNORE_GRADE, gradeDropped.relaxation());
        assertEquals("1", gradeDropped.best().orElseThrow().prompt().getId());
    }

    @Test
    void testGenreAndTopicMatchExactly() {
        corpus.insert(TestData.prompt("1", GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "Argumentative", "technology"));
        corpus.insert(TestData.prompt("2", GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "argumentative", "technology"));

        SearchResult exact = corpus.search(
                new EvaluationCriteria(GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "argumentative", "technology"), null);
        assertEquals(RelaxationStep.EXACT, exact.relaxation());
        assertEquals(1, exact.hits().size());
        assertEquals("2", exact.hits().get(0).prompt().getId());

        SearchResult caseMismatch = corpus.search(
                new EvaluationCriteria(GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "argumentative", "TECHNOLOGY"), null);
        assertEquals(RelaxationStep.IGNORE_GENRE_TOPIC, caseMismatch.relaxation());
    }

    @Test
    void testEmptyCorpusReturnsEmptyResult() {
        SearchResult result = corpus.search(new EvaluationCriteria(GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED), "anything");
        assertTrue(result.isEmpty());
        assertNull(result.relaxation());
        assertThrows(IllegalArgumentException.class,
                () -> corpus.search(new EvaluationCriteria(GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED), null, 0));
    }

    @Test
    void testTiesBrokenByLowestId() {
        PromptRecord template = TestData.prompt("x", GradeTier.PRIMARY_SCHOOL, ProficiencyLevel.BEGINNER, "narrative", "family");
        double[] shared = new HashingEmbedder(64).embed(template.toEmbeddingText());
        corpus.insert(copyWithId(template, "10").withEmbedding(shared));
        corpus.insert(copyWithId(template, "2").withEmbedding(shared));

        EvaluationCriteria criteria = new EvaluationCriteria(GradeTier.PRIMARY_SCHOOL, ProficiencyLevel.BEGINNER);
        assertEquals("2", corpus.search(criteria, "family story").best().orElseThrow().prompt().getId());
        assertEquals("2", corpus.search(criteria, null).best().orElseThrow().prompt().getId());
    }

    @Test
    void testQueryRanksBySimilarity() {
        PromptCorpus wide = new PromptCorpus(new HashingEmbedder());
        wide.insert(TestData.prompt("1", GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.INTERMEDIATE, "descriptive", "hometown"));
        wide.insert(TestData.prompt("2", GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.INTERMEDIATE, "descriptive", "volcanoes"));

        SearchResult result = wide.search(
                new EvaluationCriteria(GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.INTERMEDIATE), "volcanoes", 2);

        assertEquals(2, result.hits().size());
        assertEquals("2", result.hits().get(0).prompt().getId());
        assertTrue(result.hits().get(0).similarity() >= result.hits().get(1).similarity());
    }

    @Test
    void testExportImportRoundTrip() throws Exception {
        new PromptSeedLoader().seedIfEmpty(corpus);
        Path file = tempDir.resolve("corpus.json");
        corpus.exportTo(file);

        PromptCorpus restored = new PromptCorpus(new HashingEmbedder(64));
        assertEquals(5, restored.importFrom(file));
        assertEquals(corpus.getAll(), restored.getAll());
    }

    @Test
    void testImportRejectsWrongDimensionAtomically() {
        PromptCorpus source = new PromptCorpus(new HashingEmbedder(32));
        source.insert(TestData.familyPrompt());
        String payload = source.exportJson();

        corpus.insert(TestData.prompt("9", GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "opinion", "sports"));
        MalformedImportException error = assertThrows(MalformedImportException.class, () -> corpus.importJson(payload));
        assertFalse(error.getProblems().isEmpty());
        assertEquals(1, corpus.count());
    }

    @Test
    void testImportRejectsDuplicatesAndMissingFields() {
        PromptCorpus source = new PromptCorpus(new HashingEmbedder(64));
        source.insert(TestData.prompt("1", GradeTier.PRIMARY_SCHOOL, ProficiencyLevel.BEGINNER, "narrative", "pets"));
        source.insert(TestData.prompt("2", GradeTier.PRIMARY_SCHOOL, ProficiencyLevel.BEGINNER, "narrative", "food"));
        String valid = source.exportJson();

        String duplicated = valid.replace("\"id\" : \"2\"", "\"id\" : \"1\"");
        assertNotEquals(valid, duplicated);
        assertThrows(MalformedImportException.class, () -> corpus.importJson(duplicated));

        String missingTitle = valid.replace("\"title\" : \"Prompt 2\",", "");
        assertNotEquals(valid, missingTitle);
        assertThrows(MalformedImportException.class, () -> corpus.importJson(missingTitle));

        assertThrows(MalformedImportException.class, () -> corpus.importJson("{not json"));
        assertThrows(MalformedImportException.class, () -> corpus.importJson(""));
        assertEquals(0, corpus.count());

        assertEquals(2, corpus.importJson(valid));
        assertThrows(MalformedImportException.class, () -> corpus.importJson(valid));
        assertEquals(2, corpus.count());
    }

    @Test
    void testConcurrentInsertsAndSearches() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = String.valueOf(i);
                futures.add(executor.submit(() -> corpus.insert(
                        TestData.prompt(id, GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.INTERMEDIATE, "narrative", "topic" + id))));
                futures.add(executor.submit(() -> corpus.search(
                        new EvaluationCriteria(GradeTier.MIDDLE_SCHOOL, ProficiencyLevel.INTERMEDIATE), "topic")));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(40, corpus.count());
    }

    private static PromptRecord copyWithId(PromptRecord record, String id) {
        return new PromptRecord(id, record.getTitle(), record.getPrompt(), record.getGrade(), record.getLevel(),
                record.getGenre(), record.getTopic(), record.getRequirements(), record.getKeywords());
    }
}
