package com.egg.repository;

import com.egg.entity.Device;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for Device entity operations.
 */
@Repository
public interface DeviceRepository extends JpaRepository<Device, String> {

    /**
     * Find a device only if it is linked to the given user.
     *
     * @param id the client-supplied device ID
     * @param userId the owning user ID
     * @return Optional containing the device if owned by the user
     */
    Optional<Device> findByIdAndUserId(String id, UUID userId);
}
