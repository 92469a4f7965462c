package com.meshnexus.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationRequest {
    @NotBlank
    private String nodeId;
    private String address;
    private Map<String, Object> details = new HashMap<>(); // hostname, platform, cpu, memory, interfaces
}
