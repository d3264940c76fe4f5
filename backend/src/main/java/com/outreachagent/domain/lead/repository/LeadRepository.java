package com.outreachagent.domain.lead.repository;

import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.LeadStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LeadRepository extends JpaRepository<Lead, Long> {

    List<Lead> findByStatusOrderByIdAsc(LeadStatus status);

    Page<Lead> findByStatus(LeadStatus status, Pageable pageable);

    long countByStatus(LeadStatus status);
}
