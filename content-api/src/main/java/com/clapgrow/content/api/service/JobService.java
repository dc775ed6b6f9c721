package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.RetryProperties;
import com.clapgrow.content.api.dto.CreateJobRequest;
import com.clapgrow.content.api.dto.JobResponse;
import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.exception.JobNotFoundException;
import com.clapgrow.content.api.repository.ContentJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JobService {

    private final ContentJobRepository jobRepository;
    private final RetryProperties retryProperties;

    /**
     * Create a job in PENDING. Creation is not a transition, so no transition row is written.
     */
    @Transactional
    public JobResponse createJob(CreateJobRequest request) {
        ContentJob job = new ContentJob();
        job.setTopic(request.getTopic().trim());
        job.setStatus(JobStatus.PENDING);
        job.setRetryCount(0);
        job.setMaxRetries(request.getMaxRetries() != null
            ? request.getMaxRetries()
            : retryProperties.getDefaultMaxRetries());
        job.setMaxRetriesOverridden(false);

        ContentJob saved = jobRepository.save(job);
        log.info("Created content job {} (maxRetries={})", saved.getId(), saved.getMaxRetries());
        return JobResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public JobResponse getJob(UUID jobId) {
        return jobRepository.findById(jobId)
            .map(JobResponse::from)
            .orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
