package com.chainwatch.graph;

import com.chainwatch.domain.FirstSeenDirection;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.TransferRepository;
import com.chainwatch.domain.WalletFirstSeen;
import com.chainwatch.domain.WalletFirstSeenRepository;
import com.chainwatch.domain.WalletGraphEdge;
import com.chainwatch.domain.WalletGraphEdgeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Re-derives edges and first-seen records from the transfers that survive a rollback.
 * Totals are recomputed from rows, never decremented.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphRebuilder {

    private final MongoTemplate mongoTemplate;
    private final TransferRepository transferRepository;
    private final WalletGraphEdgeRepository edgeRepository;
    private final WalletFirstSeenRepository firstSeenRepository;

    /**
     * @param removed  transfers already deleted from the store
     * @param ancestor common ancestor height; records from at or below it are untouched
     */
    public void rebuild(long chainId, Collection<Transfer> removed, long ancestor) {
        Set<Pair> pairs = new LinkedHashSet<>();
        Set<String> addresses = new LinkedHashSet<>();
        for (Transfer t : removed) {
            pairs.add(new Pair(t.getFromAddress(), t.getToAddress()));
            addresses.add(t.getFromAddress());
            addresses.add(t.getToAddress());
        }
        pairs.forEach(pair -> rebuildEdge(chainId, pair));
        addresses.forEach(address -> rebuildFirstSeen(chainId, address, ancestor));
        log.info("Chain {} graph rebuilt for {} pairs and {} addresses above block {}",
                chainId, pairs.size(), addresses.size(), ancestor);
    }

    void rebuildEdge(long chainId, Pair pair) {
        String id = WalletGraphEdge.idOf(chainId, pair.source(), pair.dest());
        List<Transfer> remaining = transferRepository.findByChainIdAndFromAddressAndToAddress(chainId, pair.source(), pair.dest());
        if (remaining.isEmpty()) {
            edgeRepository.deleteById(id);
            return;
        }
        BigDecimal total = BigDecimal.ZERO;
        Instant first = null;
        Instant last = null;
        for (Transfer t : remaining) {
            total = total.add(t.getAmount());
            Instant ts = t.getBlockTimestamp();
            first = first == null || ts.isBefore(first) ? ts : first;
            last = last == null || ts.isAfter(last) ? ts : last;
        }
        WalletGraphEdge edge = new WalletGraphEdge();
        edge.setId(id);
        edge.setSourceAddress(pair.source());
        edge.setDestAddress(pair.dest());
        edge.setChainId(chainId);
        edge.setTransferCount(remaining.size());
        edge.setTotalAmount(total);
        edge.setFirstSeen(first);
        edge.setLastSeen(last);
        edgeRepository.save(edge);
    }

    void rebuildFirstSeen(long chainId, String address, long ancestor) {
        String id = WalletFirstSeen.idOf(chainId, address);
        WalletFirstSeen current = firstSeenRepository.findById(id).orElse(null);
        if (current != null && current.getFirstBlock() <= ancestor) {
            return;
        }
        Query earliestQuery = Query.query(where("chainId").is(chainId)
                        .orOperator(Criteria.where("fromAddress").is(address), Criteria.where("toAddress").is(address)))
                .with(Sort.by(Sort.Order.asc("blockNumber"), Sort.Order.asc("logIndex")))
                .limit(1);
        Transfer earliest = mongoTemplate.findOne(earliestQuery, Transfer.class);
        if (earliest == null) {
            firstSeenRepository.deleteById(id);
            return;
        }
        WalletFirstSeen rebuilt = new WalletFirstSeen();
        rebuilt.setId(id);
        rebuilt.setAddress(address);
        rebuilt.setChainId(chainId);
        rebuilt.setFirstSeenAt(earliest.getBlockTimestamp());
        rebuilt.setFirstBlock(earliest.getBlockNumber());
        rebuilt.setFirstTxHash(earliest.getTxHash());
        rebuilt.setFirstDirection(address.equals(earliest.getFromAddress()) ? FirstSeenDirection.OUT : FirstSeenDirection.IN);
        firstSeenRepository.save(rebuilt);
    }

    record Pair(String source, String dest) {
    }
}
