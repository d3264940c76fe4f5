package com.outreachagent.domain.run.repository;

import com.outreachagent.domain.run.model.LogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LogEntryRepository extends JpaRepository<LogEntry, Long> {

    List<LogEntry> findAllByOrderByTsDescIdDesc(Pageable pageable);

    List<LogEntry> findByLeadIdOrderByIdAsc(Long leadId);
}
