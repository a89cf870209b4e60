package com.essaycoach.corpus;

import com.essaycoach.errors.DuplicatePromptIdException;
import com.essaycoach.errors.EmbeddingException;
import com.essaycoach.errors.EssayCoachException;
import com.essaycoach.errors.MalformedImportException;
import com.essaycoach.models.EvaluationCriteria;
import com.essaycoach.models.PromptRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store of writing prompts with metadata-filtered similarity search.
 *
 * <p>Readers work against an immutable snapshot and never block. Writers serialise on a lock,
 * build a new snapshot and publish it with a single volatile write. Embeddings are computed
 * before the lock is taken.
 */
public class PromptCorpus {
    private static final Logger logger = LoggerFactory.getLogger(PromptCorpus.class);

    private static final TypeReference<List<PromptRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Embedder embedder;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public PromptCorpus(Embedder embedder) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public int getEmbeddingDimension() {
        return embedder.dimension();
    }

    /**
     * Store a prompt. The embedding is computed from the record text when the record has none.
     *
     * @return the stored record, carrying its embedding
     * @throws DuplicatePromptIdException if the id is already present
     * @throws IllegalArgumentException if required fields are missing or the embedding has the wrong dimension
     */
    public PromptRecord insert(PromptRecord record) {
        Objects.requireNonNull(record, "record");
        List<String> missing = record.missingFields();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Prompt record is missing required fields: " + missing);
        }
        if (snapshot.byId.containsKey(record.getId())) {
            throw new DuplicatePromptIdException(record.getId());
        }

        PromptRecord embedded = embedIfAbsent(record);

        writeLock.lock();
        try {
            Snapshot current = snapshot;
            if (current.byId.containsKey(embedded.getId())) {
                throw new DuplicatePromptIdException(embedded.getId());
            }
            snapshot = current.append(List.of(embedded));
        } finally {
            writeLock.unlock();
        }
        logger.debug("Inserted prompt {} ({} {})", embedded.getId(), embedded.getGrade(), embedded.getLevel());
        return embedded;
    }

    private PromptRecord embedIfAbsent(PromptRecord record) {
        if (record.hasEmbedding()) {
            if (record.getEmbeddingDimension() != embedder.dimension()) {
                throw new IllegalArgumentException("Prompt " + record.getId() + " has embedding dimension "
                        + record.getEmbeddingDimension() + ", corpus expects " + embedder.dimension());
            }
            return record;
        }
        double[] vector = embedder.embed(record.toEmbeddingText());
        if (vector.length != embedder.dimension()) {
            throw new EmbeddingException("Embedder produced " + vector.length + " values, expected "
                    + embedder.dimension());
        }
        return record.withEmbedding(vector);
    }

    /**
     * Single best match for the criteria.
     */
    public SearchResult search(EvaluationCriteria criteria, String queryText) {
        return search(criteria, queryText, 1);
    }

    /**
     * Filter by metadata, relaxing genre/topic, then level, then grade tier until something matches,
     * and rank the survivors. With query text the ranking is cosine similarity descending;
     * without it survivors keep id order. Equal similarities are broken by lowest id.
     *
     * @return up to {@code k} hits and the relaxation step that produced them, or an empty result
     */
    public SearchResult search(EvaluationCriteria criteria, String queryText, int k) {
        Objects.requireNonNull(criteria, "criteria");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        Snapshot current = snapshot;
        if (current.records.isEmpty()) {
            return SearchResult.empty();
        }

        for (RelaxationStep step : RelaxationStep.values()) {
            if (step == RelaxationStep.IGNORE_GENRE_TOPIC && !criteria.hasGenreOrTopic()) {
                // same filter as EXACT when no genre or topic was requested
                continue;
            }
            List<PromptRecord> survivors = current.records.stream()
                    .filter(record -> matches(record, criteria, step))
                    .toList();
            if (!survivors.isEmpty()) {
                if (step != RelaxationStep.EXACT) {
                    logger.info("🔎 No prompt matched {} exactly, relaxed to {}", criteria, step);
                }
                return new SearchResult(rank(survivors, queryText, k), step);
            }
        }
        return SearchResult.empty();
    }

    private static boolean matches(PromptRecord record, EvaluationCriteria criteria, RelaxationStep step) {
        if (step.matchesGrade() && record.getGrade() != criteria.getGrade()) {
            return false;
        }
        if (step.matchesLevel() && record.getLevel() != criteria.getLevel()) {
            return false;
        }
        if (step.matchesGenreTopic()) {
            if (criteria.getGenre().isPresent() && !criteria.getGenre().get().equals(record.getGenre())) {
                return false;
            }
            if (criteria.getTopic().isPresent() && !criteria.getTopic().get().equals(record.getTopic())) {
                return false;
            }
        }
        return true;
    }

    private List<ScoredPrompt> rank(List<PromptRecord> survivors, String queryText, int k) {
        List<ScoredPrompt> scored = new ArrayList<>(survivors.size());
        if (queryText == null || queryText.isBlank()) {
            for (PromptRecord record : survivors) {
                scored.add(new ScoredPrompt(record, 0.0));
            }
            scored.sort(Comparator.comparing((ScoredPrompt hit) -> hit.prompt().getId(), PromptIds.ORDER));
        } else {
            double[] query = embedder.embed(queryText);
            for (PromptRecord record : survivors) {
                scored.add(new ScoredPrompt(record, record.cosineSimilarity(query)));
            }
            scored.sort(Comparator.comparingDouble(ScoredPrompt::similarity).reversed()
                    .thenComparing(hit -> hit.prompt().getId(), PromptIds.ORDER));
        }
        return scored.size() > k ? List.copyOf(scored.subList(0, k)) : scored;
    }

    /**
     * All records in insertion order
     */
    public List<PromptRecord> getAll() {
        return snapshot.records;
    }

    public int count() {
        return snapshot.records.size();
    }

    public Optional<PromptRecord> findById(String id) {
        return Optional.ofNullable(snapshot.byId.get(id));
    }

    /**
     * JSON array of every record, embeddings included, in insertion order.
     */
    public String exportJson() {
        try {
            return objectMapper.writeValueAsString(snapshot.records);
        } catch (JsonProcessingException e) {
            throw new EssayCoachException("Failed to serialise prompt corpus: " + e.getMessage(), e);
        }
    }

    /**
     * Append every record of a JSON array produced by {@link #exportJson()}.
     * All records are validated before anything is stored; on any problem nothing is added.
     *
     * @return number of records added
     * @throws MalformedImportException if the payload cannot be parsed or any record is invalid
     */
    public int importJson(String data) {
        if (data == null || data.isBlank()) {
            throw new MalformedImportException("Import payload is empty");
        }
        List<PromptRecord> incoming;
        try {
            incoming = objectMapper.readValue(data, RECORD_LIST);
        } catch (JsonProcessingException e) {
            throw new MalformedImportException("Import payload is not a valid prompt array: "
                    + e.getOriginalMessage(), e);
        }
        if (incoming == null) {
            throw new MalformedImportException("Import payload is not a valid prompt array");
        }

        writeLock.lock();
        try {
            Snapshot current = snapshot;
            List<String> problems = validate(incoming, current);
            if (!problems.isEmpty()) {
                logger.warn("❌ Rejected import of {} prompt(s), {} problem(s)", incoming.size(), problems.size());
                throw new MalformedImportException("Import rejected", problems);
            }
            snapshot = current.append(incoming);
        } finally {
            writeLock.unlock();
        }
        logger.info("📥 Imported {} prompt(s), corpus now holds {}", incoming.size(), count());
        return incoming.size();
    }

    private List<String> validate(List<PromptRecord> incoming, Snapshot current) {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < incoming.size(); i++) {
            PromptRecord record = incoming.get(i);
            if (record == null) {
                problems.add("record " + i + " is null");
                continue;
            }
            String label = "record " + i + (record.getId() == null ? "" : " (id " + record.getId() + ")");
            List<String> missing = record.missingFields();
            if (!missing.isEmpty()) {
                problems.add(label + " missing " + String.join(", ", missing));
            }
            if (!record.hasEmbedding()) {
                problems.add(label + " has no embedding");
            } else if (record.getEmbeddingDimension() != embedder.dimension()) {
                problems.add(label + " has embedding dimension " + record.getEmbeddingDimension()
                        + ", expected " + embedder.dimension());
            }
            if (record.getId() != null) {
                if (!seen.add(record.getId())) {
                    problems.add(label + " duplicates an id earlier in the payload");
                } else if (current.byId.containsKey(record.getId())) {
                    problems.add(label + " duplicates an id already in the corpus");
                }
            }
        }
        return problems;
    }

    /**
     * Write {@link #exportJson()} to a file
     */
    public void exportTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, exportJson(), StandardCharsets.UTF_8);
        logger.info("💾 Saved {} prompt(s) to {}", count(), file);
    }

    /**
     * Read and import a file written by {@link #exportTo(Path)}
     */
    public int importFrom(Path file) throws IOException {
        return importJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(List.of(), Map.of());

        final List<PromptRecord> records;
        final Map<String, PromptRecord> byId;

        private Snapshot(List<PromptRecord> records, Map<String, PromptRecord> byId) {
            this.records = records;
            this.byId = byId;
        }

        Snapshot append(List<PromptRecord> added) {
            List<PromptRecord> nextRecords = new ArrayList<>(records);
            nextRecords.addAll(added);
            Map<String, PromptRecord> nextById = new HashMap<>(byId);
            for (PromptRecord record : added) {
                nextById.put(record.getId(), record);
            }
            return new Snapshot(Collections.unmodifiableList(nextRecords), Collections.unmodifiableMap(nextById));
        }
    }
}
