package com.jreinhal.knowledge.memory;

import com.jreinhal.knowledge.model.MemoryEntry;
import com.mongodb.client.result.DeleteResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * Memory entries stored in MongoDB alongside their embeddings; similarity is computed in
 * process with cosine distance over the caller's partition.
 */
@Component
public class MongoMemoryStore implements MemoryStore {
    private static final Logger log = LoggerFactory.getLogger(MongoMemoryStore.class);
    static final String COLLECTION = "knowledge_memories";

    private final MongoTemplate mongoTemplate;
    private final EmbeddingModel embeddingModel;
    private final Clock clock;
    private final double similarityThreshold;

    public MongoMemoryStore(MongoTemplate mongoTemplate, EmbeddingModel embeddingModel, Clock clock,
                            @Value("${knowledge.presearch.similarity-threshold:0.7}") double similarityThreshold) {
        this.mongoTemplate = mongoTemplate;
        this.embeddingModel = embeddingModel;
        this.clock = clock;
        this.similarityThreshold = similarityThreshold;
    }

    @Override
    public MemoryEntry add(String userId, String content, Map<String, Object> metadata) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Memory content must not be blank");
        }
        Instant now = this.clock.instant();
        MemoryDocument doc = new MemoryDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setUserId(userId);
        doc.setContent(content);
        doc.setMetadata(metadata == null ? new HashMap<>() : new HashMap<>(metadata));
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        this.embed(doc);
        try {
            this.mongoTemplate.insert(doc, COLLECTION);
        }
        catch (DataAccessException e) {
            throw new MemoryStoreException("Failed to save memory: " + e.getMessage(), e);
        }
        log.debug("Saved memory {} in partition {}", doc.getId(), userId);
        return toEntry(doc, 0.0);
    }

    @Override
    public List<MemoryEntry> search(String userId, String query, int topK) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        float[] queryEmbedding;
        List<MemoryDocument> candidates;
        try {
            queryEmbedding = this.embeddingModel.embed(query);
            candidates = this.mongoTemplate.find(new Query(Criteria.where("userId").is(userId)), MemoryDocument.class, COLLECTION);
        }
        catch (DataAccessException e) {
            throw new MemoryStoreException("Memory search failed: " + e.getMessage(), e);
        }
        double queryNorm = computeNorm(queryEmbedding);
        List<MemoryEntry> scored = new ArrayList<>();
        for (MemoryDocument doc : candidates) {
            double score = cosineSimilarity(queryEmbedding, queryNorm, doc.getEmbedding(), doc.getEmbeddingNorm());
            if (score >= this.similarityThreshold) {
                scored.add(toEntry(doc, score));
            }
        }
        scored.sort((a, b) -> Double.compare(b.score(), a.score()));
        log.debug("Memory search in partition {}: {} candidates, {} above threshold", userId, candidates.size(), scored.size());
        return scored.size() > topK ? List.copyOf(scored.subList(0, Math.max(0, topK))) : scored;
    }

    @Override
    public MemoryEntry update(String userId, String id, String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Memory content must not be blank");
        }
        MemoryDocument doc = this.load(userId, id);
        doc.setContent(content);
        doc.setUpdatedAt(this.clock.instant());
        this.embed(doc);
        try {
            this.mongoTemplate.save(doc, COLLECTION);
        }
        catch (DataAccessException e) {
            throw new MemoryStoreException("Failed to update memory " + id + ": " + e.getMessage(), e);
        }
        return toEntry(doc, 0.0);
    }

    @Override
    public void delete(String userId, String id) {
        DeleteResult result;
        try {
            result = this.mongoTemplate.remove(new Query(Criteria.where("_id").is(id).and("userId").is(userId)), COLLECTION);
        }
        catch (DataAccessException e) {
            throw new MemoryStoreException("Failed to delete memory " + id + ": " + e.getMessage(), e);
        }
        if (result.getDeletedCount() == 0L) {
            throw new MemoryStoreException("Memory entry not found: " + id);
        }
    }

    private MemoryDocument load(String userId, String id) {
        MemoryDocument doc;
        try {
            doc = this.mongoTemplate.findOne(new Query(Criteria.where("_id").is(id).and("userId").is(userId)), MemoryDocument.class, COLLECTION);
        }
        catch (DataAccessException e) {
            throw new MemoryStoreException("Failed to load memory " + id + ": " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new MemoryStoreException("Memory entry not found: " + id);
        }
        return doc;
    }

    private void embed(MemoryDocument doc) {
        float[] raw = this.embeddingModel.embed(doc.getContent());
        List<Double> embedding = new ArrayList<>(raw.length);
        for (float f : raw) {
            embedding.add((double) f);
        }
        doc.setEmbedding(embedding);
        doc.setEmbeddingNorm(computeNorm(raw));
    }

    private static MemoryEntry toEntry(MemoryDocument doc, double score) {
        return new MemoryEntry(doc.getId(), doc.getUserId(), doc.getContent(), doc.getMetadata(), score, doc.getCreatedAt(), doc.getUpdatedAt());
    }

    static double cosineSimilarity(float[] query, double queryNorm, List<Double> candidate, Double candidateNorm) {
        if (query == null || candidate == null || query.length == 0 || query.length != candidate.size()) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < query.length; ++i) {
            Double value = candidate.get(i);
            if (value != null) {
                dot += query[i] * value;
            }
        }
        double norm = candidateNorm != null ? candidateNorm : computeNorm(candidate);
        if (queryNorm == 0.0 || norm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(queryNorm) * Math.sqrt(norm));
    }

    /**
     * Squared L2 norm.
     */
    static double computeNorm(float[] embedding) {
        double sum = 0.0;
        for (float f : embedding) {
            sum += (double) f * (double) f;
        }
        return sum;
    }

    static double computeNorm(List<Double> embedding) {
        double sum = 0.0;
        for (Double value : embedding) {
            if (value != null) {
                sum += value * value;
            }
        }
        return sum;
    }

    public static class MemoryDocument {
        @Id
        private String id;
        private String userId;
        private String content;
        private Map<String, Object> metadata;
        private List<Double> embedding;
        private Double embeddingNorm;
        private Instant createdAt;
        private Instant updatedAt;

        public String getId() {
            return this.id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getUserId() {
            return this.userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        public String getContent() {
            return this.content;
        }

        public void setContent(String content) {
            this.content = content;
        }

        public Map<String, Object> getMetadata() {
            return this.metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }

        public List<Double> getEmbedding() {
            return this.embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }

        public Double getEmbeddingNorm() {
            return this.embeddingNorm;
        }

        public void setEmbeddingNorm(Double embeddingNorm) {
            this.embeddingNorm = embeddingNorm;
        }

        public Instant getCreatedAt() {
            return this.createdAt;
        }

        public void setCreatedAt(Instant createdAt) {
            this.createdAt = createdAt;
        }

        public Instant getUpdatedAt() {
            return this.updatedAt;
        }

        public void setUpdatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
        }
    }
}
