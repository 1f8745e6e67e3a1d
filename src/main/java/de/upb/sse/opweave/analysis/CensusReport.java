package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.model.CandidateKind;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

@Data
public class CensusReport {
    private final Map<CandidateKind, Integer> countsByKind = new EnumMap<>(CandidateKind.class);
    private int dependentCandidates;
    private int arrayIndexAccesses;
    private int nonArrayIndexAccesses;
    private int systemOriginCandidates;

    public void incrementKind(CandidateKind kind) {
        countsByKind.merge(kind, 1, Integer::sum);
    }

    public void incrementDependentCandidates() {
        dependentCandidates++;
    }

    public void incrementArrayIndexAccesses() {
        arrayIndexAccesses++;
    }

    public void incrementNonArrayIndexAccesses() {
        nonArrayIndexAccesses++;
    }

    public void incrementSystemOriginCandidates() {
        systemOriginCandidates++;
    }

    public int count(CandidateKind kind) {
        return countsByKind.getOrDefault(kind, 0);
    }

    public int totalCandidates() {
        return countsByKind.values().stream().mapToInt(Integer::intValue).sum();
    }

    public String toSummaryString() {
        StringBuilder sb = new StringBuilder("Operator census:\n");
        for (CandidateKind kind : CandidateKind.values()) {
            sb.append("  ").append(kind).append(": ").append(count(kind)).append('\n');
        }
        sb.append("  index accesses on arrays: ").append(arrayIndexAccesses).append('\n');
        sb.append("  index accesses on other types: ").append(nonArrayIndexAccesses).append('\n');
        sb.append("  generic-dependent: ").append(dependentCandidates).append('\n');
        sb.append("  in system/library code: ").append(systemOriginCandidates).append('\n');
        sb.append("  total: ").append(totalCandidates());
        return sb.toString();
    }
}
