package com.chainwatch.attribution;

import com.chainwatch.domain.EntityLabel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies label precedence for an address on a chain. Within one label source, chain-scoped
 * labels shadow global ones; sources never shadow each other. Output is sorted by source, then name.
 */
@Component
@RequiredArgsConstructor
public class LabelResolver {

    private final AttributionDirectory directory;

    public List<EntityLabel> effectiveLabels(long chainId, String address) {
        return applyPrecedence(chainId, directory.labelsFor(address));
    }

    public boolean isSanctioned(long chainId, String address) {
        return effectiveLabels(chainId, address).stream().anyMatch(EntityLabel::isSanctioned)
                || !directory.watchlistFor(address).isEmpty();
    }

    static List<EntityLabel> applyPrecedence(long chainId, List<EntityLabel> labels) {
        Map<Object, List<EntityLabel>> bySource = new LinkedHashMap<>();
        for (EntityLabel label : labels) {
            if (label.getChainId() != null && label.getChainId() != chainId) {
                continue;
            }
            bySource.computeIfAbsent(label.getLabelSource(), k -> new ArrayList<>()).add(label);
        }
        List<EntityLabel> result = new ArrayList<>();
        for (List<EntityLabel> group : bySource.values()) {
            boolean hasScoped = group.stream().anyMatch(l -> l.getChainId() != null);
            for (EntityLabel label : group) {
                if (!hasScoped || label.getChainId() != null) {
                    result.add(label);
                }
            }
        }
        result.sort(Comparator
                .comparing((EntityLabel l) -> l.getLabelSource() == null ? "" : l.getLabelSource().name())
                .thenComparing(l -> Objects.toString(l.getEntityName(), "")));
        return result;
    }
}
