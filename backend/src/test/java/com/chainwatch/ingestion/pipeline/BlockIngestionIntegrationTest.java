package com.chainwatch.ingestion.pipeline;

import com.chainwatch.domain.Anomaly;
import com.chainwatch.domain.AnomalyRepository;
import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.BlockHash;
import com.chainwatch.domain.BlockHashRepository;
import com.chainwatch.domain.ChainCheckpoint;
import com.chainwatch.domain.ChainCheckpointRepository;
import com.chainwatch.domain.ChainSyncStatus;
import com.chainwatch.domain.FirstSeenDirection;
import com.chainwatch.domain.NetworkId;
import com.chainwatch.domain.OnrampTransfer;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.TransferEntityFlag;
import com.chainwatch.domain.TransferRepository;
import com.chainwatch.domain.WalletFirstSeen;
import com.chainwatch.domain.WalletFirstSeenRepository;
import com.chainwatch.domain.WalletGraphEdge;
import com.chainwatch.domain.WalletGraphEdgeRepository;
import com.chainwatch.ingestion.checkpoint.CheckpointStore;
import com.chainwatch.ingestion.error.DeepReorgException;
import com.chainwatch.ingestion.error.GapException;
import com.chainwatch.ingestion.source.BlockHeader;
import com.chainwatch.ingestion.source.CanonicalChainView;
import com.chainwatch.ingestion.source.FetchedBlock;
import com.chainwatch.ingestion.source.FetchedTransfer;
import com.chainwatch.ingestion.store.RecordedTransfer;
import com.chainwatch.ingestion.store.TransferRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Block-by-block ingestion against a real replica set. ETHEREUM runs with max-reorg-depth 3 (test config).
 */
@SpringBootTest
@Testcontainers
class BlockIngestionIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    private static final NetworkId NETWORK = NetworkId.ETHEREUM;
    private static final long CHAIN = NETWORK.getChainId();
    private static final Instant GENESIS = Instant.parse("2025-02-01T00:00:00Z");
    private static final CanonicalChainView NO_VIEW = h -> Optional.empty();

    @Autowired
    BlockIngestionService ingestionService;
    @Autowired
    CheckpointStore checkpointStore;
    @Autowired
    TransferRecorder transferRecorder;
    @Autowired
    TransferEnrichment transferEnrichment;
    @Autowired
    MongoTemplate mongoTemplate;
    @Autowired
    CacheManager cacheManager;
    @Autowired
    ChainCheckpointRepository checkpointRepository;
    @Autowired
    TransferRepository transferRepository;
    @Autowired
    WalletGraphEdgeRepository edgeRepository;
    @Autowired
    WalletFirstSeenRepository firstSeenRepository;
    @Autowired
    AnomalyRepository anomalyRepository;
    @Autowired
    BlockHashRepository blockHashRepository;

    @BeforeEach
    void clean() {
        for (Class<?> type : List.of(Transfer.class, BlockHash.class, ChainCheckpoint.class, WalletGraphEdge.class,
                WalletFirstSeen.class, Anomaly.class, TransferEntityFlag.class, OnrampTransfer.class, ChainSyncStatus.class)) {
            mongoTemplate.remove(new Query(), type);
        }
        cacheManager.getCacheNames().forEach(name -> cacheManager.getCache(name).clear());
        checkpointStore.initializeIfAbsent(CHAIN, 1L);
    }

    private static Instant time(long block) {
        return GENESIS.plusSeconds(12 * block);
    }

    /** Whole-token USDC amount to raw units. */
    private static FetchedTransfer usdc(String tx, int logIndex, String from, String to, String wholeTokens) {
        return new FetchedTransfer(tx, logIndex, "0xusdc", from, to,
                new BigDecimal(wholeTokens).movePointRight(6), "USDC", 6);
    }

    private static FetchedBlock block(long number, String hash, String parent, FetchedTransfer... transfers) {
        return new FetchedBlock(number, hash, parent, time(number), List.of(transfers));
    }

    private ChainCheckpoint checkpoint() {
        return checkpointRepository.findById(CHAIN).orElseThrow();
    }

    /** A(1) -> B(2) -> C(3). C carries a large transfer from 0xbb to a fresh wallet 0xcc. */
    private void ingestABC() {
        ingestionService.advance(NETWORK, block(1, "0xa", "0x0",
                usdc("0xt1", 0, "0xaa", "0xbb", "500")), NO_VIEW);
        ingestionService.advance(NETWORK, block(2, "0xb", "0xa",
                usdc("0xt2", 0, "0xaa", "0xbb", "250"),
                usdc("0xt2", 1, "0xbb", "0xdd", "10")), NO_VIEW);
        ingestionService.advance(NETWORK, block(3, "0xc", "0xb",
                usdc("0xt3", 0, "0xbb", "0xcc", "200000"),
                usdc("0xt3", 1, "0xaa", "0xbb", "1")), NO_VIEW);
    }

    @Test
    @DisplayName("blocks 1..N in order advance the checkpoint to N without rollback")
    void linearExtension() {
        String parent = "0x0";
        for (long n = 1; n <= 6; n++) {
            String hash = "0xh" + n;
            AdvanceResult result = ingestionService.advance(NETWORK,
                    block(n, hash, parent, usdc("0xtx" + n, 0, "0xaa", "0xbb", "1")), NO_VIEW);
            assertThat(result.outcome()).isEqualTo(AdvanceResult.Outcome.EXTENDED);
            assertThat(result.newTransfers()).isEqualTo(1);
            parent = hash;
        }

        ChainCheckpoint cp = checkpoint();
        assertThat(cp.getLastIndexedBlock()).isEqualTo(6);
        assertThat(cp.getLastBlockHash()).isEqualTo("0xh6");
        assertThat(transferRepository.countByChainId(CHAIN)).isEqualTo(6);
        // hashes older than max-reorg-depth (3) below the tip are pruned
        assertThat(blockHashRepository.countByChainId(CHAIN)).isEqualTo(4);
        assertThat(blockHashRepository.findByChainIdAndBlockNumber(CHAIN, 3)).isPresent();
        assertThat(blockHashRepository.findByChainIdAndBlockNumber(CHAIN, 2)).isEmpty();
    }

    @Test
    @DisplayName("re-feeding an indexed block is a duplicate no-op")
    void duplicateBlock() {
        ingestABC();
        long transfers = transferRepository.countByChainId(CHAIN);

        AdvanceResult result = ingestionService.advance(NETWORK, block(2, "0xb", "0xa",
                usdc("0xt2", 0, "0xaa", "0xbb", "250")), NO_VIEW);

        assertThat(result.outcome()).isEqualTo(AdvanceResult.Outcome.DUPLICATE);
        assertThat(transferRepository.countByChainId(CHAIN)).isEqualTo(transfers);
        assertThat(checkpoint().getLastIndexedBlock()).isEqualTo(3);
    }

    @Test
    @DisplayName("block ahead of the checkpoint raises GapException and changes nothing")
    void gap() {
        ingestABC();

        assertThatThrownBy(() -> ingestionService.advance(NETWORK, block(5, "0xe", "0xd",
                usdc("0xt5", 0, "0xaa", "0xbb", "1")), NO_VIEW))
                .isInstanceOf(GapException.class);

        assertThat(checkpoint().getLastIndexedBlock()).isEqualTo(3);
        assertThat(transferRepository.findByChainIdAndTxHashAndLogIndex(CHAIN, "0xt5", 0)).isEmpty();
    }

    @Test
    @DisplayName("competing block at height 3 rolls back to 2, then re-ingestion rebuilds the graph from A, B, C'")
    void reorgReplacesTip() {
        ingestABC();
        String largeId = Transfer.idOf(CHAIN, "0xt3", 0);
        assertThat(anomalyRepository.findByTransferIdAndAnomalyType(largeId, AnomalyType.LARGE_TRANSFER)).isPresent();
        assertThat(firstSeenRepository.findByAddressAndChainId("0xcc", CHAIN)).isPresent();

        FetchedBlock cPrime = block(3, "0xc2", "0xb",
                usdc("0xt3b", 0, "0xbb", "0xee", "40"),
                usdc("0xt3b", 1, "0xdd", "0xaa", "5"));
        CanonicalChainView view = canonical(Map.of(
                1L, new BlockHeader(1, "0xa", "0x0"),
                2L, new BlockHeader(2, "0xb", "0xa"),
                3L, cPrime.header()));

        AdvanceResult rollback = ingestionService.advance(NETWORK, cPrime, view);

        assertThat(rollback.outcome()).isEqualTo(AdvanceResult.Outcome.ROLLED_BACK);
        assertThat(rollback.rollback().commonAncestor()).isEqualTo(2);
        assertThat(rollback.rollback().deletedTransfers()).isEqualTo(2);
        assertThat(checkpoint().getLastIndexedBlock()).isEqualTo(2);
        assertThat(checkpoint().getLastBlockHash()).isEqualTo("0xb");
        assertThat(transferRepository.findByChainIdAndBlockNumberGreaterThan(CHAIN, 2)).isEmpty();
        assertThat(anomalyRepository.findByTransferId(largeId)).isEmpty();
        assertThat(blockHashRepository.findByChainIdAndBlockNumber(CHAIN, 3)).isEmpty();
        assertThat(firstSeenRepository.findByAddressAndChainId("0xcc", CHAIN)).isEmpty();

        AdvanceResult reingest = ingestionService.advance(NETWORK, cPrime, view);

        assertThat(reingest.outcome()).isEqualTo(AdvanceResult.Outcome.EXTENDED);
        assertThat(checkpoint().getLastIndexedBlock()).isEqualTo(3);
        assertThat(checkpoint().getLastBlockHash()).isEqualTo("0xc2");

        WalletGraphEdge aaToBb = edgeRepository.findBySourceAddressAndDestAddressAndChainId("0xaa", "0xbb", CHAIN).orElseThrow();
        assertThat(aaToBb.getTransferCount()).isEqualTo(2);
        assertThat(aaToBb.getTotalAmount()).isEqualByComparingTo(new BigDecimal("750").movePointRight(6));
        assertThat(aaToBb.getLastSeen()).isEqualTo(time(2));
        assertThat(edgeRepository.findBySourceAddressAndDestAddressAndChainId("0xbb", "0xcc", CHAIN)).isEmpty();
        assertThat(edgeRepository.findBySourceAddressAndDestAddressAndChainId("0xbb", "0xee", CHAIN)).isPresent();

        WalletFirstSeen ee = firstSeenRepository.findByAddressAndChainId("0xee", CHAIN).orElseThrow();
        assertThat(ee.getFirstBlock()).isEqualTo(3);
        assertThat(ee.getFirstDirection()).isEqualTo(FirstSeenDirection.IN);

        assertGraphConsistent();
        assertFirstSeenIsMinimumBlock();
    }

    @Test
    @DisplayName("fork deeper than max-reorg-depth raises DeepReorgException and leaves state unchanged")
    void deepReorg() {
        String parent = "0x0";
        for (long n = 1; n <= 6; n++) {
            ingestionService.advance(NETWORK, block(n, "0xh" + n, parent, usdc("0xtx" + n, 0, "0xaa", "0xbb", "1")), NO_VIEW);
            parent = "0xh" + n;
        }
        Map<Long, BlockHeader> fork = new HashMap<>();
        for (long n = 2; n <= 7; n++) {
            fork.put(n, new BlockHeader(n, "0xy" + n, n == 2 ? "0xh1" : "0xy" + (n - 1)));
        }

        assertThatThrownBy(() -> ingestionService.advance(NETWORK,
                block(7, "0xy7", "0xy6", usdc("0xfork", 0, "0xaa", "0xbb", "1")), canonical(fork)))
                .isInstanceOf(DeepReorgException.class);

        assertThat(checkpoint().getLastIndexedBlock()).isEqualTo(6);
        assertThat(checkpoint().getLastBlockHash()).isEqualTo("0xh6");
        assertThat(transferRepository.countByChainId(CHAIN)).isEqualTo(6);
        assertThat(edgeRepository.findBySourceAddressAndDestAddressAndChainId("0xaa", "0xbb", CHAIN).orElseThrow()
                .getTransferCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("stale uncle below the tip is ignored while the canonical chain is unchanged")
    void staleUncleBelowTip() {
        ingestABC();
        long transfers = transferRepository.countByChainId(CHAIN);
        CanonicalChainView unchanged = canonical(Map.of(
                1L, new BlockHeader(1, "0xa", "0x0"),
                2L, new BlockHeader(2, "0xb", "0xa"),
                3L, new BlockHeader(3, "0xc", "0xb")));

        AdvanceResult result = ingestionService.advance(NETWORK, block(2, "0xuncle2", "0xa",
                usdc("0xuncletx", 0, "0xaa", "0xff", "1")), unchanged);

        assertThat(result.outcome()).isEqualTo(AdvanceResult.Outcome.DUPLICATE);
        assertThat(checkpoint().getLastIndexedBlock()).isEqualTo(3);
        assertThat(checkpoint().getLastBlockHash()).isEqualTo("0xc");
        assertThat(transferRepository.countByChainId(CHAIN)).isEqualTo(transfers);
        assertThat(transferRepository.findByChainIdAndTxHashAndLogIndex(CHAIN, "0xuncletx", 0)).isEmpty();
        assertThat(anomalyRepository.findByTransferIdAndAnomalyType(Transfer.idOf(CHAIN, "0xt3", 0), AnomalyType.LARGE_TRANSFER))
                .isPresent();
    }

    @Test
    @DisplayName("stale uncle at the oldest retained hash neither rolls back nor halts")
    void staleUncleAtPruningBoundary() {
        Map<Long, BlockHeader> headers = new HashMap<>();
        String parent = "0x0";
        for (long n = 1; n <= 6; n++) {
            ingestionService.advance(NETWORK, block(n, "0xh" + n, parent, usdc("0xtx" + n, 0, "0xaa", "0xbb", "1")), NO_VIEW);
            headers.put(n, new BlockHeader(n, "0xh" + n, parent));
            parent = "0xh" + n;
        }
        assertThat(blockHashRepository.findByChainIdAndBlockNumber(CHAIN, 3)).isPresent();

        AdvanceResult result = ingestionService.advance(NETWORK,
                block(3, "0xuncle3", "0xh2", usdc("0xuncletx", 0, "0xaa", "0xbb", "1")), canonical(headers));

        assertThat(result.outcome()).isEqualTo(AdvanceResult.Outcome.DUPLICATE);
        assertThat(checkpoint().getLastIndexedBlock()).isEqualTo(6);
        assertThat(transferRepository.countByChainId(CHAIN)).isEqualTo(6);
    }

    @Test
    @DisplayName("T1 (block 10, 100) and T2 (block 12, 50) from A to B build one edge with count 2 and total 150")
    void edgeExample() {
        NetworkId base = NetworkId.BASE;
        long chainId = base.getChainId();
        checkpointStore.initializeIfAbsent(chainId, 10L);

        FetchedTransfer t1 = new FetchedTransfer("0xt1", 0, "0xusdc", "0xA", "0xB", new BigDecimal("100"), "USDC", 0);
        FetchedTransfer t2 = new FetchedTransfer("0xt2", 0, "0xusdc", "0xA", "0xB", new BigDecimal("50"), "USDC", 0);
        ingestionService.advance(base, block(10, "0x10", "0x09", t1), NO_VIEW);
        ingestionService.advance(base, block(11, "0x11", "0x10"), NO_VIEW);
        ingestionService.advance(base, block(12, "0x12", "0x11", t2), NO_VIEW);

        WalletGraphEdge edge = edgeRepository.findBySourceAddressAndDestAddressAndChainId("0xa", "0xb", chainId).orElseThrow();
        assertThat(edge.getTransferCount()).isEqualTo(2);
        assertThat(edge.getTotalAmount()).isEqualByComparingTo("150");
        assertThat(edge.getFirstSeen()).isEqualTo(time(10));
        assertThat(edge.getLastSeen()).isEqualTo(time(12));
        assertThat(firstSeenRepository.findByAddressAndChainId("0xa", chainId).orElseThrow().getFirstDirection())
                .isEqualTo(FirstSeenDirection.OUT);
        assertThat(firstSeenRepository.findByAddressAndChainId("0xb", chainId).orElseThrow().getFirstBlock())
                .isEqualTo(10);
    }

    @Test
    @DisplayName("replaying a block after a crash before the checkpoint moved does not double count")
    void replayAfterPartialProcessing() {
        FetchedBlock first = block(1, "0xa", "0x0", usdc("0xt1", 0, "0xaa", "0xbb", "500"));
        Transfer pending = BlockIngestionService.toTransfer(CHAIN, first, first.transfers().get(0));
        RecordedTransfer recorded = transferRecorder.record(pending);
        transferEnrichment.enrich(recorded);
        assertThat(checkpoint().getLastIndexedBlock()).isZero();

        AdvanceResult result = ingestionService.advance(NETWORK, first, NO_VIEW);

        assertThat(result.outcome()).isEqualTo(AdvanceResult.Outcome.EXTENDED);
        assertThat(result.newTransfers()).isZero();
        WalletGraphEdge edge = edgeRepository.findBySourceAddressAndDestAddressAndChainId("0xaa", "0xbb", CHAIN).orElseThrow();
        assertThat(edge.getTransferCount()).isEqualTo(1);
        assertThat(edge.getTotalAmount()).isEqualByComparingTo(new BigDecimal("500").movePointRight(6));
    }

    @Test
    @DisplayName("addresses and hashes are normalized to lowercase")
    void normalization() {
        ingestionService.advance(NETWORK, block(1, "0xABC", "0x0",
                usdc("0xT1", 0, "0xAbCd", "0xEF01", "1")), NO_VIEW);

        Transfer stored = transferRepository.findByChainIdAndTxHashAndLogIndex(CHAIN, "0xt1", 0).orElseThrow();
        assertThat(stored.getFromAddress()).isEqualTo("0xabcd");
        assertThat(stored.getToAddress()).isEqualTo("0xef01");
        assertThat(checkpoint().getLastBlockHash()).isEqualTo("0xabc");
    }

    private static CanonicalChainView canonical(Map<Long, BlockHeader> headers) {
        return h -> Optional.ofNullable(headers.get(h));
    }

    private void assertGraphConsistent() {
        Map<String, BigDecimal> totals = new HashMap<>();
        Map<String, Long> counts = new HashMap<>();
        for (Transfer t : transferRepository.findByChainId(CHAIN)) {
            String key = t.getFromAddress() + ">" + t.getToAddress();
            totals.merge(key, t.getAmount(), BigDecimal::add);
            counts.merge(key, 1L, Long::sum);
        }
        List<WalletGraphEdge> edges = new ArrayList<>(edgeRepository.findByChainId(CHAIN));
        assertThat(edges).hasSize(counts.size());
        for (WalletGraphEdge edge : edges) {
            String key = edge.getSourceAddress() + ">" + edge.getDestAddress();
            assertThat(edge.getTransferCount()).as(key).isEqualTo(counts.get(key));
            assertThat(edge.getTotalAmount()).as(key).isEqualByComparingTo(totals.get(key));
        }
    }

    private void assertFirstSeenIsMinimumBlock() {
        Map<String, Long> minBlock = new HashMap<>();
        for (Transfer t : transferRepository.findByChainId(CHAIN)) {
            minBlock.merge(t.getFromAddress(), t.getBlockNumber(), Math::min);
            minBlock.merge(t.getToAddress(), t.getBlockNumber(), Math::min);
        }
        List<WalletFirstSeen> records = firstSeenRepository.findByChainId(CHAIN);
        assertThat(records).hasSize(minBlock.size());
        for (WalletFirstSeen fs : records) {
            assertThat(fs.getFirstBlock()).as(fs.getAddress()).isEqualTo(minBlock.get(fs.getAddress()));
        }
    }
}
