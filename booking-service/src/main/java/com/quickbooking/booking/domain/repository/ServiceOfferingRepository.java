package com.quickbooking.booking.domain.repository;

import com.quickbooking.booking.domain.model.ServiceOffering;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, String> {

    Optional<ServiceOffering> findByIdAndTenantId(String id, String tenantId);

    Optional<ServiceOffering> findFirstByTenantIdAndActiveTrueOrderByNameAsc(String tenantId);
}
