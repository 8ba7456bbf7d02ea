package com.nosota.disbursement.repository;

import com.nosota.disbursement.model.DistributionAccountVaultEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DistributionAccountVaultRepository extends JpaRepository<DistributionAccountVaultEntry, String> {
}
