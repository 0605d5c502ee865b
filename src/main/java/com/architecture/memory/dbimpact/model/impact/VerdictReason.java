package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VerdictReason {
    int priority;           // 1 = most important
    String statement;       // "3 stored procedures read from this table"
    String implication;     // "Coordinate testing across these procedures"
    List<String> evidence;  // stable keys, e.g. ["StoredProcedure:10"]
}
