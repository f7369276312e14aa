package com.egg.service;

import com.egg.dto.request.DeviceRequest;
import com.egg.dto.response.DeviceResponse;
import com.egg.entity.Device;
import com.egg.exception.ConflictException;
import com.egg.repository.DeviceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeviceService Unit Tests")
class DeviceServiceTest {

    @Mock
    private DeviceRepository deviceRepository;

    @InjectMocks
    private DeviceService deviceService;

    private UUID userId;
    private DeviceRequest request;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        request = new DeviceRequest(" pixel-8-abc ", "Pixel 8", "android 15", "en", "Europe/Berlin");
    }

    @Test
    @DisplayName("register should create a new device for the user")
    void testRegister_NewDevice() {
        // Arrange
        when(deviceRepository.findById("pixel-8-abc")).thenReturn(Optional.empty());

        // Act
        DeviceResponse response = deviceService.register(userId, request);

        // Assert
        assertEquals("Device registered", response.getMessage());
        assertEquals("pixel-8-abc", response.getDeviceId());
        ArgumentCaptor<Device> captor = ArgumentCaptor.forClass(Device.class);
        verify(deviceRepository).save(captor.capture());
        assertEquals(userId, captor.getValue().getUserId());
        assertEquals("Europe/Berlin", captor.getValue().getTimezone());
    }

    @Test
    @DisplayName("register should refresh metadata of the user's own device")
    void testRegister_ExistingDevice() {
        // Arrange
        Device existing = new Device();
        existing.setId("pixel-8-abc");
        existing.setUserId(userId);
        existing.setOs("android 14");
        when(deviceRepository.findById("pixel-8-abc")).thenReturn(Optional.of(existing));

        // Act
        deviceService.register(userId, request);

        // Assert
        assertEquals("android 15", existing.getOs());
        verify(deviceRepository).save(existing);
    }

    @Test
    @DisplayName("register should throw ConflictException for a device of another user")
    void testRegister_OtherUser() {
        // Arrange
        Device existing = new Device();
        existing.setId("pixel-8-abc");
        existing.setUserId(UUID.randomUUID());
        when(deviceRepository.findById("pixel-8-abc")).thenReturn(Optional.of(existing));

        // Act & Assert
        assertThrows(ConflictException.class, () -> deviceService.register(userId, request));
        verify(deviceRepository, never()).save(any());
    }
}
