package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SecurityFinding {
    private String type;     // "suspicious-connection", "failed-login", "integrity"
    private String severity; // "info", "warning", "critical"
    private String message;
    private String address;
}
