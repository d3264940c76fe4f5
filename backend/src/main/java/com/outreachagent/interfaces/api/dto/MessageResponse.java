package com.outreachagent.interfaces.api.dto;

import com.outreachagent.domain.lead.model.Message;

import java.time.LocalDateTime;

public record MessageResponse(
        Long id,
        String emailA,
        String emailB,
        String dmA,
        String dmB,
        String cta,
        LocalDateTime createdAt
) {

    public static MessageResponse from(Message message) {
        return new MessageResponse(
                message.getId(),
                message.getEmailA(),
                message.getEmailB(),
                message.getDmA(),
                message.getDmB(),
                message.getCta(),
                message.getCreatedAt());
    }
}
