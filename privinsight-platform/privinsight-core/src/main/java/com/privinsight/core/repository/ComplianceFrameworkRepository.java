package com.privinsight.core.repository;

import com.privinsight.core.domain.ComplianceFramework;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ComplianceFrameworkRepository extends JpaRepository<ComplianceFramework, String> {
}
