package com.agileflow.planning.workgraph.service.capacity;

import com.agileflow.planning.workgraph.dto.capacity.WorkloadItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class MemberWorkload {

    private final List<WorkloadItem> tasks;
    private final List<WorkloadItem> stories;
    private final double total;
}
