package com.trellis.core.approval;

import com.trellis.core.config.TrellisProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which operations must pass the approval gate, from the per-agent-type
 * table configured under {@code trellis.approval.gates}.
 */
@Component
public class ApprovalPolicy {

    private final Map<String, Set<String>> gates;

    @Autowired
    public ApprovalPolicy(TrellisProperties properties) {
        this(properties.getApproval().getGates());
    }

    public ApprovalPolicy(Map<String, List<String>> gates) {
        this.gates = gates.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        e -> normalize(e.getKey()),
                        e -> Set.copyOf(e.getValue())));
    }

    public boolean requiresApproval(String agentType, String operationName) {
        if (agentType == null || operationName == null) {
            return false;
        }
        return gates.getOrDefault(normalize(agentType), Set.of()).contains(operationName);
    }

    public Set<String> gatedOperations(String agentType) {
        return agentType == null ? Set.of() : gates.getOrDefault(normalize(agentType), Set.of());
    }

    private static String normalize(String agentType) {
        return agentType.toLowerCase(Locale.ROOT);
    }
}
