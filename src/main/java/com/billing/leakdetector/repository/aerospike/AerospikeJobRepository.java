package com.billing.leakdetector.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.billing.leakdetector.config.AerospikeConfig;
import com.billing.leakdetector.exception.AlreadyProcessingException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.JobStatus;
import com.billing.leakdetector.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Jobs live in {@code jobs}. The one-active-job-per-upload rule is held by a claim record in
 * {@code active_jobs}, keyed by upload ID and written create-only, so two concurrent submissions
 * for the same upload cannot both succeed. The claim is deleted when its job turns terminal.
 */
@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeJobRepository.class);

    private static final int MAX_CAS_ATTEMPTS = 16;
    private static final int MAX_CLAIM_ATTEMPTS = 3;

    // A claim whose owner has no job record (an upload lock, or a job whose write failed)
    // is treated as abandoned after this long.
    static final long ORPHAN_CLAIM_AGE_MS = 60_000;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeJobRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public Job create(Job job) {
        acquireClaim(job.getUploadId(), job.getId());

        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(createOnly, jobKey(job.getId()), bins(job));
        } catch (AerospikeException e) {
            releaseClaim(job.getUploadId(), job.getId());
            throw e;
        }
        return job;
    }

    @Override
    public Job update(String jobId, UnaryOperator<Job> transition) {
        Key key = jobKey(jobId);

        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            if (record == null) {
                throw new NotFoundException("Job", jobId);
            }
            Job current = mapRecord(record);
            Job next = transition.apply(current);

            WritePolicy cas = new WritePolicy(writePolicy);
            cas.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
            cas.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            cas.generation = record.generation;
            try {
                client.put(cas, key, bins(next));
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) throw e;
                log.debug("Job {} changed concurrently, retrying transition", jobId);
                continue;
            }

            if (next.getStatus().isTerminal() && !current.getStatus().isTerminal()) {
                releaseClaim(next.getUploadId(), jobId);
            }
            return next;
        }
        throw new ConcurrentModificationException("Could not update job " + jobId
                + " after " + MAX_CAS_ATTEMPTS + " attempts");
    }

    @Override
    public void lockUpload(String uploadId, String ownerId) {
        acquireClaim(uploadId, ownerId);
    }

    @Override
    public void unlockUpload(String uploadId, String ownerId) {
        releaseClaim(uploadId, ownerId);
    }

    @Override
    public Optional<Job> findById(String jobId) {
        Record record = client.get(readPolicy, jobKey(jobId));
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(record));
    }

    @Override
    public Optional<Job> findActiveByUpload(String uploadId) {
        Record claim = client.get(readPolicy, claimKey(uploadId));
        if (claim == null) return Optional.empty();
        return findById(claim.getString("jobId"))
                .filter(job -> !job.getStatus().isTerminal());
    }

    @Override
    public List<Job> findByUpload(String uploadId) {
        List<Job> results = scan(uploadId);
        results.sort(Comparator.comparingLong(Job::getCreatedAt).reversed());
        return results;
    }

    @Override
    public List<Job> findAll() {
        return scan(null);
    }

    @Override
    public int deleteByUpload(String uploadId) {
        List<Key> keys = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_JOBS,
                (key, record) -> {
                    if (uploadId.equals(record.getString("uploadId"))) {
                        synchronized (keys) {
                            keys.add(key);
                        }
                    }
                }, "uploadId");

        int deleted = 0;
        for (Key key : keys) {
            if (client.delete(writePolicy, key)) deleted++;
        }
        return deleted;
    }

    private void acquireClaim(String uploadId, String ownerId) {
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        Key key = claimKey(uploadId);

        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            try {
                client.put(createOnly, key,
                        new Bin("uploadId", uploadId),
                        new Bin("jobId", ownerId),
                        new Bin("claimedAt", System.currentTimeMillis()));
                return;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) throw e;
            }

            Record claim = client.get(readPolicy, key);
            if (claim == null) {
                continue; // released between our write and read
            }
            String holderId = claim.getString("jobId");
            Optional<Job> holder = findById(holderId);
            boolean stale = holder.map(h -> h.getStatus().isTerminal())
                    .orElseGet(() -> System.currentTimeMillis() - claim.getLong("claimedAt") > ORPHAN_CLAIM_AGE_MS);
            if (!stale) {
                throw new AlreadyProcessingException(uploadId, holderId);
            }

            log.warn("Removing stale claim on upload {} held by job {}", uploadId, holderId);
            deleteClaimIfUnchanged(key, claim.generation);
        }
        throw new ConcurrentModificationException("Could not claim upload " + uploadId
                + " after " + MAX_CLAIM_ATTEMPTS + " attempts");
    }

    private void releaseClaim(String uploadId, String jobId) {
        Key key = claimKey(uploadId);
        Record claim = client.get(readPolicy, key);
        if (claim == null || !jobId.equals(claim.getString("jobId"))) {
            return;
        }
        deleteClaimIfUnchanged(key, claim.generation);
    }

    private void deleteClaimIfUnchanged(Key key, int generation) {
        WritePolicy cas = new WritePolicy(writePolicy);
        cas.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        cas.generation = generation;
        try {
            client.delete(cas, key);
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.GENERATION_ERROR) throw e;
            log.debug("Claim {} was replaced before it could be released", key.userKey);
        }
    }

    private List<Job> scan(String uploadId) {
        List<Job> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_JOBS,
                (key, record) -> {
                    try {
                        if (uploadId == null || uploadId.equals(record.getString("uploadId"))) {
                            Job job = mapRecord(record);
                            synchronized (results) {
                                results.add(job);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read job record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Bin[] bins(Job job) {
        return new Bin[] {
                new Bin("id", job.getId()),
                new Bin("uploadId", job.getUploadId()),
                new Bin("status", job.getStatus().name()),
                new Bin("progress", job.getProgress()),
                new Bin("rowsTotal", job.getRowsTotal()),
                new Bin("rowsDone", job.getRowsProcessed()),
                new Bin("anomalies", job.getAnomaliesFound()),
                new Bin("skipped", job.getSkippedRows()),
                new Bin("procSeconds", job.getProcessingTimeSeconds()),
                // null removes the bin
                new Bin("errorMessage", job.getErrorMessage()),
                new Bin("createdAt", job.getCreatedAt()),
                new Bin("updatedAt", job.getUpdatedAt()),
                new Bin("startedAt", job.getStartedAt()),
                new Bin("completedAt", job.getCompletedAt())
        };
    }

    private Job mapRecord(Record record) {
        return Job.builder()
                .id(record.getString("id"))
                .uploadId(record.getString("uploadId"))
                .status(JobStatus.valueOf(record.getString("status")))
                .progress(record.getInt("progress"))
                .rowsTotal(record.getInt("rowsTotal"))
                .rowsProcessed(record.getInt("rowsDone"))
                .anomaliesFound(record.getInt("anomalies"))
                .skippedRows(record.getInt("skipped"))
                .processingTimeSeconds(record.getDouble("procSeconds"))
                .errorMessage(record.getString("errorMessage"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .startedAt(record.getLong("startedAt"))
                .completedAt(record.getLong("completedAt"))
                .build();
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }

    private Key jobKey(String jobId) {
        return new Key(namespace, AerospikeConfig.SET_JOBS, jobId);
    }

    private Key claimKey(String uploadId) {
        return new Key(namespace, AerospikeConfig.SET_ACTIVE_JOBS, uploadId);
    }
}
