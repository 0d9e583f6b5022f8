package com.flamingo.ai.docpipeline.domain.store;

import com.flamingo.ai.docpipeline.domain.model.Job;
import java.time.Instant;
import java.util.Optional;

/** Storage for in-flight and recently finished jobs. */
public interface JobStore {

  void save(Job job);

  Optional<Job> findById(String jobId);

  void remove(String jobId);

  /**
   * Removes finished jobs whose finish time is before the cutoff.
   *
   * @return number of jobs removed
   */
  int evictFinishedBefore(Instant cutoff);

  int size();

  /** Jobs that still have chunks outstanding. */
  long countActive();
}
