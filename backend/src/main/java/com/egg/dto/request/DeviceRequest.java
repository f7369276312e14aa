package com.egg.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device registration payload (snake_case on the wire).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceRequest {

    @NotBlank(message = "device_id is required")
    @Size(max = 128, message = "device_id must be at most 128 characters")
    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("device_model")
    private String deviceModel;

    private String os;

    private String language;

    private String timezone;
}
