package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {
    private String nodeId;
    private NodeAction action;
    private boolean success;
    private Object result;
    private String message;
}
