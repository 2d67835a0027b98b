package com.hcltech.stackorder.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.hcltech.stackorder.dag.OrderedStack;

/** Wire shape of one plan entry. */
@JsonPropertyOrder({"directory", "runner_label", "planned_changes", "order", "skip_when_destroying"})
public record OrderedStackJson(
        @JsonProperty("directory") String directory,
        @JsonProperty("runner_label") String runnerLabel,
        @JsonProperty("planned_changes") boolean plannedChanges,
        @JsonProperty("order") int order,
        @JsonProperty("skip_when_destroying") boolean skipWhenDestroying
) {
    public static OrderedStackJson from(OrderedStack s) {
        return new OrderedStackJson(s.directory(), s.runnerLabel().label(), s.plannedChanges(), s.order(), s.skipWhenDestroying());
    }
}
