package com.privinsight.core.repository;

import com.privinsight.core.domain.CircuitRegistration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CircuitRegistrationRepository extends JpaRepository<CircuitRegistration, String> {
}
