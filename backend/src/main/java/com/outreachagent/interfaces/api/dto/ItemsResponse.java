package com.outreachagent.interfaces.api.dto;

import java.util.List;

public record ItemsResponse<T>(List<T> items) {
}
