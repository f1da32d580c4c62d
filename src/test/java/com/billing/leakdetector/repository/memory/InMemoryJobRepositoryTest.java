package com.billing.leakdetector.repository.memory;

import com.billing.leakdetector.engine.JobStateMachine;
import com.billing.leakdetector.exception.AlreadyProcessingException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobRepositoryTest {

    private InMemoryJobRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository();
    }

    @Test
    void create_whileAnotherJobIsActive_throwsAlreadyProcessing() {
        repository.create(JobStateMachine.queued("J1", "U1", 10, 1000));

        assertThatThrownBy(() -> repository.create(JobStateMachine.queued("J2", "U1", 10, 2000)))
                .isInstanceOf(AlreadyProcessingException.class)
                .satisfies(e -> assertThat(((AlreadyProcessingException) e).getActiveJobId()).isEqualTo("J1"));
        assertThat(repository.findById("J2")).isEmpty();
    }

    @Test
    void create_concurrentSubmissions_exactlyOneSucceeds() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String jobId = "J" + i;
            results.add(pool.submit(() -> {
                start.await();
                try {
                    repository.create(JobStateMachine.queued(jobId, "U1", 10, System.currentTimeMillis()));
                    return true;
                } catch (AlreadyProcessingException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int created = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) created++;
        }
        pool.shutdown();

        assertThat(created).isEqualTo(1);
        assertThat(repository.findByUpload("U1")).hasSize(1);
    }

    @Test
    void update_toTerminal_releasesUpload() {
        repository.create(JobStateMachine.queued("J1", "U1", 10, 1000));
        repository.update("J1", JobStateMachine.claim(1100));
        assertThat(repository.findActiveByUpload("U1")).map(Job::getId).contains("J1");

        repository.update("J1", JobStateMachine.complete(10, 10, 0, 2100));

        assertThat(repository.findActiveByUpload("U1")).isEmpty();
        Job next = repository.create(JobStateMachine.queued("J2", "U1", 10, 3000));
        assertThat(next.getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void update_unknownJob_throwsNotFound() {
        assertThatThrownBy(() -> repository.update("nope", JobStateMachine.claim(1)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void findByUpload_newestFirst() {
        repository.create(JobStateMachine.queued("J1", "U1", 10, 1000));
        repository.update("J1", JobStateMachine.fail("down", 1500));
        repository.create(JobStateMachine.queued("J2", "U1", 10, 2000));

        assertThat(repository.findByUpload("U1")).extracting(Job::getId).containsExactly("J2", "J1");
    }

    @Test
    void deleteByUpload_clearsJobsAndClaim() {
        repository.create(JobStateMachine.queued("J1", "U1", 10, 1000));

        assertThat(repository.deleteByUpload("U1")).isEqualTo(1);
        assertThat(repository.findActiveByUpload("U1")).isEmpty();
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void lockUpload_blocksCreateUntilUnlocked() {
        repository.lockUpload("U1", "delete-1");

        assertThatThrownBy(() -> repository.create(JobStateMachine.queued("J1", "U1", 10, 1000)))
                .isInstanceOf(AlreadyProcessingException.class);
        assertThat(repository.deleteByUpload("U1")).isZero();
        assertThatThrownBy(() -> repository.create(JobStateMachine.queued("J1", "U1", 10, 1000)))
                .isInstanceOf(AlreadyProcessingException.class);

        repository.unlockUpload("U1", "delete-1");

        assertThat(repository.create(JobStateMachine.queued("J1", "U1", 10, 1000)).getId()).isEqualTo("J1");
    }

    @Test
    void lockUpload_whileJobQueued_throwsAlreadyProcessing() {
        repository.create(JobStateMachine.queued("J1", "U1", 10, 1000));

        assertThatThrownBy(() -> repository.lockUpload("U1", "delete-1"))
                .isInstanceOf(AlreadyProcessingException.class)
                .hasMessageContaining("J1");

        repository.unlockUpload("U1", "delete-1");
        assertThat(repository.findActiveByUpload("U1")).map(Job::getId).contains("J1");
    }
}
