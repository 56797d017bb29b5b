package com.planverify.core.repository;

import com.planverify.core.domain.Provider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only provider lookups keyed by NPI.
 */
@Repository
public interface ProviderRepository extends JpaRepository<Provider, String> {
}
