package com.billing.leakdetector.repository.memory;

import com.billing.leakdetector.exception.DuplicateRowException;
import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.AnomalyFilter;
import com.billing.leakdetector.model.PagedResponse;
import com.billing.leakdetector.model.ReviewStatus;
import com.billing.leakdetector.repository.AnomalyRepository;
import com.billing.leakdetector.repository.UploadRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Anomalies keyed by ID in a {@link ConcurrentHashMap}. Conditional writes run inside
 * {@code compute}, which holds the entry for the duration of the remapping function.
 */
@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "memory")
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private static final Comparator<Anomaly> BY_SCORE_DESC = Comparator
            .comparingDouble(Anomaly::getAnomalyScore).reversed()
            .thenComparingInt(Anomaly::getRowIndex);

    private final Map<String, Anomaly> anomalies = new ConcurrentHashMap<>();
    private final UploadRepository uploadRepository;

    public InMemoryAnomalyRepository(UploadRepository uploadRepository) {
        this.uploadRepository = uploadRepository;
    }

    @Override
    public void put(Anomaly anomaly) {
        String expectedId = Anomaly.idFor(anomaly.getUploadId(), anomaly.getRowIndex());
        if (!expectedId.equals(anomaly.getId())) {
            throw new IllegalArgumentException("Anomaly id " + anomaly.getId()
                    + " does not match row " + anomaly.getRowIndex() + " of upload " + anomaly.getUploadId());
        }
        Anomaly stored = anomalies.putIfAbsent(anomaly.getId(), copy(anomaly));
        if (stored != null) {
            throw new DuplicateRowException(anomaly.getUploadId(), anomaly.getRowIndex());
        }
    }

    @Override
    public boolean attachExplanation(String anomalyId, Map<String, Double> explanation) {
        AtomicBoolean written = new AtomicBoolean(false);
        Anomaly result = anomalies.computeIfPresent(anomalyId, (id, current) -> {
            if (current.getExplanation() != null) return current;
            written.set(true);
            return current.toBuilder()
                    .explanation(new LinkedHashMap<>(explanation))
                    .updatedAt(System.currentTimeMillis())
                    .build();
        });
        if (result == null) {
            throw new NotFoundException("Anomaly", anomalyId);
        }
        return written.get();
    }

    @Override
    public PagedResponse<Anomaly> listByUpload(String uploadId, AnomalyFilter filter, int offset, int limit) {
        if (!uploadRepository.exists(uploadId)) {
            throw new NotFoundException("Upload", uploadId);
        }
        AnomalyFilter effective = filter != null ? filter : AnomalyFilter.none();
        List<Anomaly> matching = anomalies.values().stream()
                .filter(a -> uploadId.equals(a.getUploadId()))
                .filter(effective::matches)
                .sorted(BY_SCORE_DESC)
                .toList();

        int total = matching.size();
        int from = Math.min(offset, total);
        int to = Math.min(from + limit, total);
        List<Anomaly> page = new ArrayList<>();
        for (Anomaly anomaly : matching.subList(from, to)) {
            page.add(copy(anomaly));
        }
        return new PagedResponse<>(page, total, offset, limit, to < total);
    }

    @Override
    public boolean markReviewState(String anomalyId, ReviewStatus target) {
        AtomicBoolean changed = new AtomicBoolean(false);
        Anomaly result = anomalies.computeIfPresent(anomalyId, (id, current) -> {
            if (current.getStatus() == target) return current;
            if (!current.getStatus().isBefore(target)) {
                throw new InvalidTransitionException("anomaly " + anomalyId, current.getStatus(), target);
            }
            changed.set(true);
            return current.toBuilder()
                    .status(target)
                    .updatedAt(System.currentTimeMillis())
                    .build();
        });
        if (result == null) {
            throw new NotFoundException("Anomaly", anomalyId);
        }
        return changed.get();
    }

    @Override
    public Optional<Anomaly> findById(String anomalyId) {
        return Optional.ofNullable(anomalies.get(anomalyId)).map(this::copy);
    }

    @Override
    public Set<Integer> findRowIndexes(String uploadId) {
        return anomalies.values().stream()
                .filter(a -> uploadId.equals(a.getUploadId()))
                .map(Anomaly::getRowIndex)
                .collect(Collectors.toSet());
    }

    @Override
    public long countByUpload(String uploadId) {
        return anomalies.values().stream()
                .filter(a -> uploadId.equals(a.getUploadId()))
                .count();
    }

    @Override
    public List<Anomaly> findAll() {
        return anomalies.values().stream().map(this::copy).toList();
    }

    @Override
    public int deleteByUpload(String uploadId) {
        List<String> ids = anomalies.values().stream()
                .filter(a -> uploadId.equals(a.getUploadId()))
                .map(Anomaly::getId)
                .toList();
        ids.forEach(anomalies::remove);
        return ids.size();
    }

    // Callers get their own instance and maps; stored entries are only replaced, never mutated.
    private Anomaly copy(Anomaly anomaly) {
        return anomaly.toBuilder()
                .featureValues(anomaly.getFeatureValues() == null ? null : new LinkedHashMap<>(anomaly.getFeatureValues()))
                .explanation(anomaly.getExplanation() == null ? null : new LinkedHashMap<>(anomaly.getExplanation()))
                .build();
    }
}
