package com.finfact.pipeline.service;

import com.finfact.pipeline.candidate.FactCandidate;
import com.finfact.pipeline.domain.FactCandidateEntity;
import com.finfact.pipeline.repository.FactCandidateRepository;
import jakarta.transaction.Transactional;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class CandidatePersistenceService {

    private final FactCandidateRepository factCandidateRepository;

    public CandidatePersistenceService(FactCandidateRepository factCandidateRepository) {
        this.factCandidateRepository = factCandidateRepository;
    }

    @Transactional
    public int saveAll(String reportId, List<FactCandidate> candidates) {
        if (candidates.isEmpty()) {
            return 0;
        }
        List<FactCandidateEntity> entities = candidates.stream()
            .map(candidate -> FactCandidateEntity.fromCandidate(reportId, candidate))
            .toList();
        factCandidateRepository.saveAll(entities);
        return entities.size();
    }
}
