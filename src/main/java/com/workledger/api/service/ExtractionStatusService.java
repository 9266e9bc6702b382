package com.workledger.api.service;

import com.workledger.api.dto.ExtractionStatusDTO;
import com.workledger.api.repository.ExtractionJobRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class ExtractionStatusService {

    private final ExtractionJobRepository jobRepository;

    public ExtractionStatusService(ExtractionJobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    /**
     * The given job of this user, or the user's most recent one when no job id is passed.
     */
    @Transactional(readOnly = true)
    public ExtractionStatusDTO get(String userId, UUID jobId) {
        return (jobId != null
                ? jobRepository.findByJobIdAndUserId(jobId, userId)
                : jobRepository.findFirstByUserIdOrderByCreatedAtDesc(userId))
                .map(ExtractionStatusDTO::new)
                .orElseGet(ExtractionStatusDTO::notFound);
    }
}
