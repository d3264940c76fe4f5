package com.outreachagent.domain.lead.repository;

import com.outreachagent.domain.lead.model.Message;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MessageRepository extends JpaRepository<Message, Long> {

    Optional<Message> findTopByLeadIdOrderByIdDesc(Long leadId);

    List<Message> findByLeadIdOrderByIdDesc(Long leadId);
}
