package com.outreachagent.application.lead;

import com.outreachagent.application.lead.exception.LeadNotFoundException;
import com.outreachagent.application.pipeline.PipelineOrchestrator;
import com.outreachagent.application.pipeline.exception.PipelineBusyException;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.domain.lead.model.Message;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.domain.lead.repository.MessageRepository;
import com.outreachagent.domain.lead.repository.OffsetPageRequest;
import com.outreachagent.domain.run.model.LogEntry;
import com.outreachagent.domain.run.repository.LogEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Read side of the lead store plus the reset operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadQueryService {

    private final LeadRepository leadRepository;
    private final MessageRepository messageRepository;
    private final LogEntryRepository logEntryRepository;
    private final PipelineOrchestrator pipelineOrchestrator;

    /**
     * Newest leads first, skipping the first {@code offset} rows.
     *
     * @throws IllegalArgumentException for an unknown status name or a non-positive limit
     */
    @Transactional(readOnly = true)
    public List<Lead> findLeads(String status, int limit, int offset) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        Pageable page = new OffsetPageRequest(Math.max(offset, 0), limit, Sort.by(Sort.Direction.DESC, "id"));
        if (status == null || status.isBlank()) {
            return leadRepository.findAll(page).getContent();
        }
        return leadRepository.findByStatus(parseStatus(status), page).getContent();
    }

    @Transactional(readOnly = true)
    public LeadMessages findMessages(Long leadId) {
        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new LeadNotFoundException(leadId));
        return new LeadMessages(lead, messageRepository.findByLeadIdOrderByIdDesc(leadId));
    }

    @Transactional(readOnly = true)
    public List<LogEntry> recentLogs(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return logEntryRepository.findAllByOrderByTsDescIdDesc(PageRequest.of(0, limit));
    }

    /**
     * Clears leads, messages and audit entries. Run history is kept.
     *
     * @throws PipelineBusyException while a run is active
     */
    @Transactional
    public void reset() {
        pipelineOrchestrator.whileIdle(() -> {
            messageRepository.deleteAllInBatch();
            logEntryRepository.deleteAllInBatch();
            leadRepository.deleteAllInBatch();
        });
        log.info("[Reset] Leads, messages and logs cleared");
    }

    private static LeadStatus parseStatus(String status) {
        try {
            return LeadStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown lead status: " + status, e);
        }
    }

    public record LeadMessages(Lead lead, List<Message> messages) {
    }
}
