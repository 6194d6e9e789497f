package com.example.spacewars.message.dto.response;

import com.example.spacewars.message.domain.Message;

public record MessageResponse(
        Long id,
        Long recipientId,
        String content,
        boolean read,
        long createdAt
) {
    public static MessageResponse from(Message message) {
        return new MessageResponse(
                message.getId(),
                message.getRecipientId(),
                message.getContent(),
                message.isRead(),
                message.getCreatedAt());
    }
}
