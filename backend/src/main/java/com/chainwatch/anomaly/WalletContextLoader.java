package com.chainwatch.anomaly;

import com.chainwatch.anomaly.config.AnomalyProperties;
import com.chainwatch.attribution.LabelResolver;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.WalletFirstSeen;
import com.chainwatch.domain.WalletGraphEdge;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Component
@RequiredArgsConstructor
public class WalletContextLoader {

    private final MongoTemplate mongoTemplate;
    private final LabelResolver labelResolver;
    private final AnomalyProperties properties;

    public WalletContext load(Transfer transfer) {
        long chainId = transfer.getChainId();
        String from = transfer.getFromAddress();
        String to = transfer.getToAddress();

        Instant ts = transfer.getBlockTimestamp();
        Instant windowStart = ts.minus(properties.getVelocity().getWindow());
        long senderCount = mongoTemplate.count(Query.query(where("chainId").is(chainId)
                .and("fromAddress").is(from)
                .and("blockTimestamp").gte(windowStart).lte(ts)), Transfer.class);

        WalletFirstSeen receiverFirstSeen = mongoTemplate.findById(WalletFirstSeen.idOf(chainId, to), WalletFirstSeen.class);
        WalletGraphEdge reverseEdge = mongoTemplate.findById(WalletGraphEdge.idOf(chainId, to, from), WalletGraphEdge.class);

        return new WalletContext(
                TokenAmounts.toHuman(transfer.getAmount(), transfer.getTokenDecimals()),
                senderCount,
                receiverFirstSeen,
                reverseEdge,
                labelResolver.isSanctioned(chainId, from),
                labelResolver.isSanctioned(chainId, to),
                findSanctionedFunder(chainId, from));
    }

    private String findSanctionedFunder(long chainId, String address) {
        Query inbound = Query.query(where("chainId").is(chainId).and("destAddress").is(address))
                .limit(properties.getSanctionedProximity().getMaxInboundEdges());
        List<WalletGraphEdge> edges = mongoTemplate.find(inbound, WalletGraphEdge.class);
        for (WalletGraphEdge edge : edges) {
            String source = edge.getSourceAddress();
            if (!source.equals(address) && labelResolver.isSanctioned(chainId, source)) {
                return source;
            }
        }
        return null;
    }
}
