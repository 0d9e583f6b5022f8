package com.flamingo.ai.docpipeline.domain.store;

import com.flamingo.ai.docpipeline.domain.model.Job;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Process-local job store. Jobs do not outlive the process. */
@Component
public class InMemoryJobStore implements JobStore {

  private final Map<String, Job> jobs = new ConcurrentHashMap<>();

  @Override
  public void save(Job job) {
    if (jobs.putIfAbsent(job.getId(), job) != null) {
      throw new IllegalStateException("Job already exists: " + job.getId());
    }
  }

  @Override
  public Optional<Job> findById(String jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  @Override
  public void remove(String jobId) {
    jobs.remove(jobId);
  }

  @Override
  public int evictFinishedBefore(Instant cutoff) {
    int removed = 0;
    for (Map.Entry<String, Job> entry : jobs.entrySet()) {
      Instant finishedAt = entry.getValue().getFinishedAt();
      if (finishedAt != null
          && finishedAt.isBefore(cutoff)
          && jobs.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public int size() {
    return jobs.size();
  }

  @Override
  public long countActive() {
    return jobs.values().stream().filter(job -> job.getFinishedAt() == null).count();
  }
}
