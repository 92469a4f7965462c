package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverlayNetwork {
    private String networkId;
    private String name;
    private String status; // "OK", "ACCESS_DENIED", "NOT_FOUND", ...
    private List<String> assignedAddresses;
}
