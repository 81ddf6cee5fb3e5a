package com.agentos.core.model;

import java.util.List;

/**
 * @param members  worker ids in roster order
 * @param goalsDir storage token used by the goal source, opaque to the core
 */
public record Team(
    String id,
    String name,
    List<String> members,
    String goalsDir
) {
    public Team {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
