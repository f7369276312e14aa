package com.egg.controller;

import com.egg.dto.request.DeviceRequest;
import com.egg.dto.response.DeviceResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.DeviceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Device registration. Returns 409 when the device id is linked to another user.
 */
@RestController
@RequestMapping("/v1/devices")
@RequiredArgsConstructor
@Slf4j
public class DeviceController {

    private final DeviceService deviceService;

    @PostMapping
    public ResponseEntity<DeviceResponse> register(
            @Valid @RequestBody DeviceRequest request,
            Authentication authentication) {

        log.info("Device registration requested: deviceId={}, userId={}",
                request.getDeviceId(), authentication.getName());

        return ResponseEntity.ok(deviceService.register(AuthenticatedUser.id(authentication), request));
    }
}
