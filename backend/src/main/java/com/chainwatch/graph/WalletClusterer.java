package com.chainwatch.graph;

import com.chainwatch.domain.WalletCluster;
import com.chainwatch.domain.WalletClusterRepository;
import com.chainwatch.domain.WalletGraphEdge;
import com.chainwatch.domain.WalletGraphEdgeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups wallets that sent funds to each other in both directions. Clusters are transitive:
 * A&lt;-&gt;B and B&lt;-&gt;C put A, B and C together. One-way edges never merge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletClusterer {

    private final WalletGraphEdgeRepository edgeRepository;
    private final WalletClusterRepository clusterRepository;

    static final int BATCH_SIZE = 1000;

    /**
     * Replace all cluster assignments of the chain. Returns the number of clusters written.
     * <p>
     * Rows are written in batches tagged with this run's generation, then rows of any other
     * generation are removed. No transaction spans the run; an interrupted run is repaired by the next.
     */
    public int recluster(long chainId) {
        Map<String, String> clusterByAddress = computeClusters(edgeRepository.findByChainId(chainId));
        Instant now = Instant.now();
        long generation = now.toEpochMilli();
        List<WalletCluster> batch = new ArrayList<>(BATCH_SIZE);
        int written = 0;
        for (Map.Entry<String, String> entry : clusterByAddress.entrySet()) {
            WalletCluster row = new WalletCluster();
            row.setId(chainId + ":" + entry.getKey());
            row.setAddress(entry.getKey());
            row.setChainId(chainId);
            row.setClusterId(entry.getValue());
            row.setGeneration(generation);
            row.setAssignedAt(now);
            batch.add(row);
            if (batch.size() == BATCH_SIZE) {
                clusterRepository.saveAll(batch);
                written += batch.size();
                batch = new ArrayList<>(BATCH_SIZE);
            }
        }
        if (!batch.isEmpty()) {
            clusterRepository.saveAll(batch);
            written += batch.size();
        }
        long stale = clusterRepository.deleteByChainIdAndGenerationNot(chainId, generation);
        int clusters = new HashSet<>(clusterByAddress.values()).size();
        log.info("Chain {} clustered {} wallets into {} clusters ({} stale assignments removed)",
                chainId, written, clusters, stale);
        return clusters;
    }

    /**
     * Address to cluster id (smallest member address) for every wallet in a bidirectional pair.
     */
    Map<String, String> computeClusters(List<WalletGraphEdge> edges) {
        Set<String> directed = new HashSet<>();
        for (WalletGraphEdge e : edges) {
            directed.add(e.getSourceAddress() + ">" + e.getDestAddress());
        }
        UnionFind uf = new UnionFind();
        for (WalletGraphEdge e : edges) {
            String src = e.getSourceAddress();
            String dst = e.getDestAddress();
            if (!src.equals(dst) && directed.contains(dst + ">" + src)) {
                uf.union(src, dst);
            }
        }
        Map<String, String> smallestByRoot = new HashMap<>();
        for (String address : uf.members()) {
            smallestByRoot.merge(uf.find(address), address, (a, b) -> a.compareTo(b) <= 0 ? a : b);
        }
        Map<String, String> result = new HashMap<>();
        for (String address : uf.members()) {
            result.put(address, smallestByRoot.get(uf.find(address)));
        }
        return result;
    }

    static final class UnionFind {

        private final Map<String, String> parent = new HashMap<>();
        private final Map<String, Integer> rank = new HashMap<>();

        String find(String x) {
            parent.putIfAbsent(x, x);
            String root = x;
            while (!root.equals(parent.get(root))) {
                root = parent.get(root);
            }
            String cur = x;
            while (!cur.equals(root)) {
                String next = parent.get(cur);
                parent.put(cur, root);
                cur = next;
            }
            return root;
        }

        void union(String a, String b) {
            String ra = find(a);
            String rb = find(b);
            if (ra.equals(rb)) {
                return;
            }
            int rankA = rank.getOrDefault(ra, 0);
            int rankB = rank.getOrDefault(rb, 0);
            if (rankA < rankB) {
                parent.put(ra, rb);
            } else if (rankA > rankB) {
                parent.put(rb, ra);
            } else {
                parent.put(rb, ra);
                rank.put(ra, rankA + 1);
            }
        }

        Set<String> members() {
            return new HashSet<>(parent.keySet());
        }
    }
}
