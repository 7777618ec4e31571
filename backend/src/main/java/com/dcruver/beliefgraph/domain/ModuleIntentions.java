package com.dcruver.beliefgraph.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What the user wants out of a module. Persisted as JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleIntentions {
    private String primary;
    private List<String> secondary;
    private String definitionOfDone;
    private Integer declaredPriority;
}
