package com.chainwatch.attribution;

import com.chainwatch.domain.AttributionSourceType;
import com.chainwatch.domain.EntityLabel;
import com.chainwatch.domain.EntityType;
import com.chainwatch.domain.OnrampDirection;
import com.chainwatch.domain.OnrampTransfer;
import com.chainwatch.domain.ProviderWallet;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.TransferEntityFlag;
import com.chainwatch.domain.TransferSide;
import com.chainwatch.domain.WatchlistEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Attaches entity flags and on-ramp attribution to a recorded transfer. Every write is an upsert
 * on a deterministic key, so replays add nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityAttributor {

    private final AttributionDirectory directory;
    private final LabelResolver labelResolver;
    private final MongoTemplate mongoTemplate;

    public AttributionResult attribute(Transfer transfer) {
        int flags = flagSide(transfer, transfer.getFromAddress(), TransferSide.FROM)
                + flagSide(transfer, transfer.getToAddress(), TransferSide.TO);
        OnrampOutcome onramp = attributeOnramp(transfer);
        return new AttributionResult(flags, onramp);
    }

    private int flagSide(Transfer transfer, String address, TransferSide side) {
        int count = 0;
        for (EntityLabel label : labelResolver.effectiveLabels(transfer.getChainId(), address)) {
            upsertFlag(transfer, AttributionSourceType.ENTITY_LABEL, label.getId(), side, label.getEntityName(), label.getEntityType());
            count++;
        }
        for (WatchlistEntry entry : directory.watchlistFor(address)) {
            upsertFlag(transfer, AttributionSourceType.WATCHLIST, entry.getId(), side, entry.getEntityName(), EntityType.SANCTIONED);
            count++;
        }
        return count;
    }

    private void upsertFlag(Transfer transfer, AttributionSourceType sourceType, String sourceId, TransferSide side,
                            String entityName, EntityType entityType) {
        String id = TransferEntityFlag.idOf(transfer.getId(), sourceType, sourceId, side);
        Update update = new Update()
                .setOnInsert("transferId", transfer.getId())
                .setOnInsert("chainId", transfer.getChainId())
                .setOnInsert("blockNumber", transfer.getBlockNumber())
                .setOnInsert("sourceType", sourceType.name())
                .setOnInsert("sourceId", sourceId)
                .setOnInsert("side", side.name())
                .setOnInsert("entityName", entityName)
                .setOnInsert("entityType", entityType == null ? null : entityType.name());
        mongoTemplate.upsert(Query.query(where("_id").is(id)), update, TransferEntityFlag.class);
    }

    private OnrampOutcome attributeOnramp(Transfer transfer) {
        Optional<ProviderWallet> fromWallet = directory.providerWalletFor(transfer.getChainId(), transfer.getFromAddress());
        Optional<ProviderWallet> toWallet = directory.providerWalletFor(transfer.getChainId(), transfer.getToAddress());
        if (fromWallet.isPresent() && toWallet.isPresent()) {
            log.warn("Ambiguous on-ramp attribution for transfer {}: from provider {}, to provider {}; skipped",
                    transfer.getId(), fromWallet.get().getProviderId(), toWallet.get().getProviderId());
            return OnrampOutcome.AMBIGUOUS;
        }
        if (toWallet.isPresent()) {
            upsertOnramp(transfer, toWallet.get(), OnrampDirection.DEPOSIT);
            return OnrampOutcome.DEPOSIT;
        }
        if (fromWallet.isPresent()) {
            upsertOnramp(transfer, fromWallet.get(), OnrampDirection.WITHDRAWAL);
            return OnrampOutcome.WITHDRAWAL;
        }
        return OnrampOutcome.NONE;
    }

    private void upsertOnramp(Transfer transfer, ProviderWallet wallet, OnrampDirection direction) {
        Update update = new Update()
                .setOnInsert("providerId", wallet.getProviderId())
                .setOnInsert("chainId", transfer.getChainId())
                .setOnInsert("blockNumber", transfer.getBlockNumber())
                .setOnInsert("direction", direction.name());
        mongoTemplate.upsert(Query.query(where("_id").is(transfer.getId())), update, OnrampTransfer.class);
    }
}
