package com.openisp.ha.controller.rest.dto;

import com.openisp.ha.controller.failover.PromotionAck;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to a peer control message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeerAckDto {

    private String status;
    private String message;

    public static PeerAckDto fromAck(PromotionAck ack) {
        return PeerAckDto.builder()
                .status(ack.getStatus().name().toLowerCase())
                .message(ack.getMessage())
                .build();
    }

    public static PeerAckDto processed(String message) {
        return PeerAckDto.builder()
                .status("processed")
                .message(message)
                .build();
    }
}
