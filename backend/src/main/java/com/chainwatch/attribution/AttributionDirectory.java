package com.chainwatch.attribution;

import com.chainwatch.config.CaffeineConfig;
import com.chainwatch.domain.EntityLabel;
import com.chainwatch.domain.EntityLabelRepository;
import com.chainwatch.domain.ProviderWallet;
import com.chainwatch.domain.ProviderWalletRepository;
import com.chainwatch.domain.WatchlistEntry;
import com.chainwatch.domain.WatchlistEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Cached read access to the reference tables maintained by the external loader. Read-only.
 */
@Component
@RequiredArgsConstructor
public class AttributionDirectory {

    private final EntityLabelRepository entityLabelRepository;
    private final WatchlistEntryRepository watchlistEntryRepository;
    private final ProviderWalletRepository providerWalletRepository;

    /** All labels for the address, global and chain-scoped alike. */
    @Cacheable(cacheNames = CaffeineConfig.ENTITY_LABEL_CACHE, key = "#address")
    public List<EntityLabel> labelsFor(String address) {
        return entityLabelRepository.findByAddress(address);
    }

    @Cacheable(cacheNames = CaffeineConfig.WATCHLIST_CACHE, key = "#address")
    public List<WatchlistEntry> watchlistFor(String address) {
        return watchlistEntryRepository.findByAddress(address);
    }

    @Cacheable(cacheNames = CaffeineConfig.PROVIDER_WALLET_CACHE, key = "#chainId + ':' + #address")
    public Optional<ProviderWallet> providerWalletFor(long chainId, String address) {
        return providerWalletRepository.findByChainIdAndAddress(chainId, address);
    }
}
