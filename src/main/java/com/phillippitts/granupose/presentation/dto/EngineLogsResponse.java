package com.phillippitts.granupose.presentation.dto;

import com.phillippitts.granupose.domain.engine.LogEntry;

import java.util.List;

public record EngineLogsResponse(boolean ok, List<LogEntry> entries) {
}
