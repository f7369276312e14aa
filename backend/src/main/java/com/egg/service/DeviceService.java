package com.egg.service;

import com.egg.dto.request.DeviceRequest;
import com.egg.dto.response.DeviceResponse;
import com.egg.entity.Device;
import com.egg.exception.ConflictException;
import com.egg.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Device registration. A device id belongs to exactly one user.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeviceService {

    private final DeviceRepository deviceRepository;

    /**
     * Create the device or refresh its metadata.
     *
     * @throws ConflictException if the device is linked to another user
     */
    @Transactional
    public DeviceResponse register(UUID userId, DeviceRequest request) {
        String deviceId = request.getDeviceId().trim();

        Device device = deviceRepository.findById(deviceId).orElse(null);
        if (device != null && !userId.equals(device.getUserId())) {
            log.warn("Device registration conflict: deviceId={}, userId={}", deviceId, userId);
            throw ConflictException.deviceLinkedToAnotherUser();
        }

        if (device == null) {
            device = new Device();
            device.setId(deviceId);
            device.setUserId(userId);
            log.info("Registering new device: deviceId={}, userId={}", deviceId, userId);
        } else {
            log.debug("Refreshing device metadata: deviceId={}", deviceId);
        }

        device.setDeviceModel(request.getDeviceModel());
        device.setOs(request.getOs());
        device.setLanguage(request.getLanguage());
        device.setTimezone(request.getTimezone());
        deviceRepository.save(device);

        return DeviceResponse.builder()
                .message("Device registered")
                .deviceId(deviceId)
                .build();
    }
}
