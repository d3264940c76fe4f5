package com.outreachagent.domain.run.repository;

import com.outreachagent.domain.run.model.Run;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RunRepository extends JpaRepository<Run, Long> {
}
