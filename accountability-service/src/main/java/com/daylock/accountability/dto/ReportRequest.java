package com.daylock.accountability.dto;

import com.daylock.engine.model.AttendanceRecord;
import com.daylock.engine.model.Consequence;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything known about one member of one room, supplied by the persistence layer.
 *
 * @param consequences optional; absent means no consequence was ever issued
 * @param window       optional; when present the report carries window status and copy
 */
public record ReportRequest(
    @JsonProperty("roomId")       String roomId,
    @JsonProperty("userId")       String userId,
    @JsonProperty("records")      List<AttendanceRecord> records,
    @JsonProperty("consequences") List<Consequence> consequences,
    @JsonProperty("window")       WindowRequest window
) {}
