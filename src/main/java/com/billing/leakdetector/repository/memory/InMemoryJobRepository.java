package com.billing.leakdetector.repository.memory;

import com.billing.leakdetector.exception.AlreadyProcessingException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.repository.JobRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "memory")
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    // uploadId -> jobId of its queued or running job, or the owner of a lock
    private final Map<String, String> activeByUpload = new ConcurrentHashMap<>();
    private final Set<String> lockOwners = ConcurrentHashMap.newKeySet();

    @Override
    public Job create(Job job) {
        String holder = activeByUpload.compute(job.getUploadId(), (uploadId, current) -> {
            if (isHeld(current)) {
                return current;
            }
            jobs.put(job.getId(), job);
            return job.getId();
        });
        if (!holder.equals(job.getId())) {
            throw new AlreadyProcessingException(job.getUploadId(), holder);
        }
        return job;
    }

    @Override
    public Job update(String jobId, UnaryOperator<Job> transition) {
        Job[] previous = new Job[1];
        Job next = jobs.computeIfPresent(jobId, (id, current) -> {
            previous[0] = current;
            return transition.apply(current);
        });
        if (next == null) {
            throw new NotFoundException("Job", jobId);
        }
        if (next.getStatus().isTerminal() && !previous[0].getStatus().isTerminal()) {
            activeByUpload.remove(next.getUploadId(), jobId);
        }
        return next;
    }

    @Override
    public void lockUpload(String uploadId, String ownerId) {
        String holder = activeByUpload.compute(uploadId, (id, current) -> {
            if (isHeld(current)) {
                return current;
            }
            lockOwners.add(ownerId);
            return ownerId;
        });
        if (!holder.equals(ownerId)) {
            throw new AlreadyProcessingException(uploadId, holder);
        }
    }

    @Override
    public void unlockUpload(String uploadId, String ownerId) {
        activeByUpload.remove(uploadId, ownerId);
        lockOwners.remove(ownerId);
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<Job> findActiveByUpload(String uploadId) {
        String jobId = activeByUpload.get(uploadId);
        if (jobId == null) return Optional.empty();
        return findById(jobId).filter(job -> !job.getStatus().isTerminal());
    }

    @Override
    public List<Job> findByUpload(String uploadId) {
        List<Job> results = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (uploadId.equals(job.getUploadId())) {
                results.add(job);
            }
        }
        results.sort(Comparator.comparingLong(Job::getCreatedAt).reversed());
        return results;
    }

    @Override
    public List<Job> findAll() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public int deleteByUpload(String uploadId) {
        List<String> ids = findByUpload(uploadId).stream().map(Job::getId).toList();
        ids.forEach(jobs::remove);
        activeByUpload.computeIfPresent(uploadId, (id, holder) -> lockOwners.contains(holder) ? holder : null);
        return ids.size();
    }

    private boolean isHeld(String holder) {
        if (holder == null) return false;
        if (lockOwners.contains(holder)) return true;
        Job active = jobs.get(holder);
        return active != null && !active.getStatus().isTerminal();
    }
}
