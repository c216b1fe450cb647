package com.privinsight.core.repository;

import com.privinsight.core.domain.PrivacyPolicy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PrivacyPolicyRepository extends JpaRepository<PrivacyPolicy, String> {

    List<PrivacyPolicy> findAllByOrderByCategoryAsc();
}
