package com.quickbooking.booking.domain.repository;

import com.quickbooking.booking.domain.model.BookableResource;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BookableResourceRepository extends JpaRepository<BookableResource, String> {

    /**
     * Loads the resource with SELECT FOR UPDATE. Concurrent confirmations for the same
     * resource queue here until the holder commits or rolls back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM BookableResource r WHERE r.id = :id")
    Optional<BookableResource> findByIdWithLock(@Param("id") String id);
}
