package com.meshnexus.realtime;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire envelope of every realtime frame, in both directions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeMessage {
    private String event;
    private Object data;
}
