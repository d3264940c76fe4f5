package com.outreachagent.interfaces.api.dto;

import java.util.List;

public record LeadMessagesResponse(LeadResponse lead, List<MessageResponse> messages) {
}
