package com.sparrowwallet.ballast.mempool;

import com.google.common.eventbus.EventBus;
import com.sparrowwallet.ballast.eviction.EvictionScore;
import com.sparrowwallet.ballast.protocol.FeeRate;
import com.sparrowwallet.ballast.protocol.OutPoint;
import com.sparrowwallet.ballast.protocol.Transaction;
import com.sparrowwallet.ballast.protocol.TxId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

public class TxMemPoolTest {
    private static final long START = 1700000000L;

    private MutableClock clock;
    private EventBus eventBus;
    private EventCollector events;
    private TxMemPool mempool;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.ofEpochSecond(START));
        eventBus = new EventBus();
        events = new EventCollector();
        eventBus.register(events);
        mempool = new TxMemPool(MempoolSettings.DEFAULT, eventBus, clock, EvictionScore::score);
    }

    @Test
    public void testAddAndStats() {
        MempoolEntry standalone = add(MempoolTestAccess.entry(1000, 1000, 1, MempoolTestAccess.confirmedInput()));
        MempoolEntry secondary = add(MempoolTestAccess.entry(0, 500, 1, MempoolTestAccess.confirmedInput()));

        Assertions.assertEquals(2, mempool.size());
        Assertions.assertEquals(1, mempool.getPrimaryMempoolSize());
        Assertions.assertEquals(new SecondaryMempoolStats(1, 500 + MempoolEntry.ENTRY_OVERHEAD), mempool.getSecondaryMempoolStats());
        Assertions.assertEquals(1500, mempool.getTotalTxSize());
        Assertions.assertEquals(1500 + 2 * MempoolEntry.ENTRY_OVERHEAD, mempool.dynamicMemoryUsage());
        Assertions.assertEquals(List.of(standalone, secondary), mempool.getEntries());
        Assertions.assertTrue(mempool.exists(standalone.getTxId()));
        Assertions.assertTrue(mempool.isSpent(standalone.getTransaction().getInputs().get(0)));
        Assertions.assertFalse(mempool.isSpent(standalone.getTransaction().getOutput(0)));
        Assertions.assertEquals(Optional.of(secondary), mempool.getEntry(secondary.getTxId()));
        Assertions.assertEquals(secondary.getTxId(), mempool.getMostWorthless().orElseThrow().getTxId());

        Assertions.assertEquals(1, events.getPrimaryChanges().size());
        Assertions.assertEquals(Set.of(standalone.getTxId()), events.getPrimaryChanges().get(0).getAccepted());
        mempool.checkMempool();
    }

    @Test
    public void testDiskStoredEntryChargesOverheadOnly() {
        Transaction transaction = MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput());
        MempoolEntry entry = new MempoolEntry(transaction, 1000, START, TxStorage.DISK);
        mempool.addUnchecked(entry);

        Assertions.assertEquals(TxStorage.DISK, entry.getStorage());
        Assertions.assertEquals(1000, mempool.getTotalTxSize());
        Assertions.assertEquals(MempoolEntry.ENTRY_OVERHEAD, mempool.dynamicMemoryUsage());
        mempool.checkMempool();
    }

    @Test
    public void testDuplicateAndConflictRejected() {
        OutPoint input = MempoolTestAccess.confirmedInput();
        MempoolEntry entry = add(MempoolTestAccess.entry(1000, 1000, 1, input));

        Assertions.assertThrows(IllegalArgumentException.class, () -> mempool.addUnchecked(MempoolTestAccess.entry(entry.getTransaction(), 1000)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> mempool.addUnchecked(MempoolTestAccess.entry(1000, 900, 1, input)));
        Assertions.assertEquals(1, mempool.size());
        mempool.checkMempool();
    }

    @Test
    public void testRemoveRecursive() {
        MempoolEntry parent = add(MempoolTestAccess.entry(1000, 1000, 2, MempoolTestAccess.confirmedInput()));
        MempoolEntry child = add(MempoolTestAccess.entry(1000, 1000, 1, parent.getTransaction().getOutput(0)));
        MempoolEntry grandchild = add(MempoolTestAccess.entry(1000, 1000, 1, child.getTransaction().getOutput(0)));
        MempoolEntry sibling = add(MempoolTestAccess.entry(1000, 1000, 1, parent.getTransaction().getOutput(1)));
        MempoolEntry unrelated = add(MempoolTestAccess.entry(1000, 1000, 1, MempoolTestAccess.confirmedInput()));

        Assertions.assertEquals(Set.of(child.getTxId(), grandchild.getTxId()), mempool.calculateDescendants(child.getTxId()));

        List<TxId> removed = mempool.removeRecursive(parent.getTransaction(), RemovalReason.UNKNOWN);
        Assertions.assertEquals(List.of(sibling.getTxId(), grandchild.getTxId(), child.getTxId(), parent.getTxId()), removed);
        Assertions.assertEquals(1, mempool.size());
        Assertions.assertTrue(mempool.exists(unrelated.getTxId()));
        Assertions.assertFalse(mempool.isSpent(parent.getTransaction().getInputs().get(0)));

        MempoolTransactionsRemoved event = events.getRemoved().get(0);
        Assertions.assertEquals(RemovalReason.UNKNOWN, event.getReason());
        Assertions.assertEquals(removed, event.getTxIds());
        mempool.checkMempool();
    }

    @Test
    public void testRemoveRecursiveRemovesSpendersOfAbsentTransaction() {
        Transaction reorged = MempoolTestAccess.transaction(1000, 2, MempoolTestAccess.confirmedInput());
        MempoolEntry spender1 = add(MempoolTestAccess.entry(1000, 1000, 1, reorged.getOutput(0)));
        MempoolEntry spender2 = add(MempoolTestAccess.entry(1000, 1000, 1, reorged.getOutput(1)));
        MempoolEntry child = add(MempoolTestAccess.entry(1000, 1000, 1, spender2.getTransaction().getOutput(0)));

        List<TxId> removed = mempool.removeRecursive(reorged, RemovalReason.REORG);
        Assertions.assertEquals(Set.of(spender1.getTxId(), spender2.getTxId(), child.getTxId()), new HashSet<>(removed));
        Assertions.assertEquals(0, mempool.size());
        Assertions.assertEquals(RemovalReason.REORG, events.getRemoved().get(0).getReason());

        Assertions.assertTrue(mempool.removeRecursive(reorged, RemovalReason.REORG).isEmpty());
        mempool.checkMempool();
    }

    @Test
    public void testConflictsRemovedForBlock() {
        OutPoint doubleSpent = MempoolTestAccess.confirmedInput();
        MempoolEntry toBeMined = add(MempoolTestAccess.entry(1000, 1000, 1, MempoolTestAccess.confirmedInput()));
        MempoolEntry dsMempool = add(MempoolTestAccess.entry(1000, 1000, 1, doubleSpent));
        MempoolEntry dsChild = add(MempoolTestAccess.entry(1000, 1000, 1, dsMempool.getTransaction().getOutput(0)));
        MempoolEntry remaining = add(MempoolTestAccess.entry(1000, 1000, 1, MempoolTestAccess.confirmedInput()));
        Transaction dsBlock = MempoolTestAccess.transaction(800, 1, doubleSpent);

        events.clear();
        mempool.removeForBlock(List.of(toBeMined.getTransaction(), dsBlock));

        Assertions.assertEquals(1, mempool.size());
        Assertions.assertTrue(mempool.exists(remaining.getTxId()));
        Assertions.assertEquals(2, events.getRemoved().size());
        Assertions.assertEquals(RemovalReason.CONFLICT, events.getRemoved().get(0).getReason());
        Assertions.assertEquals(List.of(dsChild.getTxId(), dsMempool.getTxId()), events.getRemoved().get(0).getTxIds());
        Assertions.assertEquals(RemovalReason.BLOCK, events.getRemoved().get(1).getReason());
        Assertions.assertEquals(List.of(toBeMined.getTxId()), events.getRemoved().get(1).getTxIds());
        mempool.checkMempool();
    }

    @Test
    public void testConfirmedParentLeavesChildrenInPlace() {
        MempoolEntry parent = add(MempoolTestAccess.entry(1000, 1000, 2, MempoolTestAccess.confirmedInput()));
        MempoolEntry child1 = add(MempoolTestAccess.entry(1000, 1000, 1, parent.getTransaction().getOutput(0)));
        MempoolEntry child2 = add(MempoolTestAccess.entry(0, 1000, 1, parent.getTransaction().getOutput(1)));

        mempool.removeForBlock(List.of(parent.getTransaction()));

        Assertions.assertEquals(2, mempool.size());
        Assertions.assertTrue(mempool.getParents(child1.getTxId()).isEmpty());
        Assertions.assertTrue(child1.isInPrimaryMempool());
        Assertions.assertFalse(child2.isInPrimaryMempool());
        Assertions.assertEquals(Set.of(child1.getTxId(), child2.getTxId()), mempool.getAllCandidates());
        mempool.checkMempool();
    }

    @Test
    public void testExpire() {
        MempoolEntry old = add(new MempoolEntry(MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput()), 1000, 100));
        MempoolEntry oldChild = add(new MempoolEntry(MempoolTestAccess.transaction(1000, 1, old.getTransaction().getOutput(0)), 1000, 300));
        MempoolEntry recent = add(new MempoolEntry(MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput()), 1000, 200));

        Assertions.assertEquals(2, mempool.expire(150));
        Assertions.assertFalse(mempool.exists(oldChild.getTxId()));
        Assertions.assertTrue(mempool.exists(recent.getTxId()));
        Assertions.assertEquals(RemovalReason.EXPIRY, events.getRemoved().get(0).getReason());
        Assertions.assertEquals(0, mempool.expire(150));
        mempool.checkMempool();
    }

    @Test
    public void testLimitMempoolSize() {
        MempoolSettings settings = new MempoolSettings(MempoolSettings.DEFAULT_BLOCK_MIN_TX_FEE, MempoolSettings.DEFAULT_INCREMENTAL_RELAY_FEE,
                2 * (1000 + MempoolEntry.ENTRY_OVERHEAD), 25, 25, Duration.ofHours(336), Duration.ofHours(12), 1.0);
        mempool = new TxMemPool(settings, eventBus, clock, EvictionScore::score);

        long now = START;
        long stale = now - Duration.ofHours(337).getSeconds();
        MempoolEntry expired = add(new MempoolEntry(MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput()), 50000, stale));
        MempoolEntry cheap = add(new MempoolEntry(MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput()), 600, now));
        MempoolEntry rich = add(new MempoolEntry(MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput()), 5000, now));
        MempoolEntry richer = add(new MempoolEntry(MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput()), 9000, now));

        List<TxId> trimmed = mempool.limitMempoolSize();

        Assertions.assertFalse(mempool.exists(expired.getTxId()));
        Assertions.assertEquals(List.of(cheap.getTxId()), trimmed);
        Assertions.assertTrue(mempool.exists(rich.getTxId()));
        Assertions.assertTrue(mempool.exists(richer.getTxId()));
        mempool.checkMempool();
    }

    @Test
    public void testAncestorLimits() {
        MempoolSettings settings = new MempoolSettings(MempoolSettings.DEFAULT_BLOCK_MIN_TX_FEE, MempoolSettings.DEFAULT_INCREMENTAL_RELAY_FEE,
                MempoolSettings.DEFAULT_MAX_MEMPOOL, 3, 2, Duration.ofHours(336), Duration.ofHours(12), 1.0);
        mempool = new TxMemPool(settings, eventBus, clock, EvictionScore::score);

        MempoolEntry a = add(MempoolTestAccess.entry(1000, 1000, 1, MempoolTestAccess.confirmedInput()));
        MempoolEntry b = add(MempoolTestAccess.entry(1000, 1000, 1, a.getTransaction().getOutput(0)));
        MempoolEntry c = add(MempoolTestAccess.entry(1000, 1000, 1, b.getTransaction().getOutput(0)));

        Assertions.assertTrue(mempool.checkAncestorLimits(MempoolTestAccess.transaction(1000, 1, b.getTransaction().getOutput(0))).isEmpty());
        Optional<String> tooLong = mempool.checkAncestorLimits(MempoolTestAccess.transaction(1000, 1, c.getTransaction().getOutput(0)));
        Assertions.assertTrue(tooLong.isPresent());
        Assertions.assertTrue(tooLong.get().contains("too many unconfirmed ancestors [limit: 3]"));

        MempoolEntry s1 = add(MempoolTestAccess.entry(0, 1000, 1, MempoolTestAccess.confirmedInput()));
        MempoolEntry s2 = add(MempoolTestAccess.entry(0, 1000, 1, s1.getTransaction().getOutput(0)));

        Assertions.assertTrue(mempool.checkAncestorLimits(MempoolTestAccess.transaction(1000, 1, s1.getTransaction().getOutput(0))).isEmpty());
        Optional<String> tooLongSecondary = mempool.checkAncestorLimits(MempoolTestAccess.transaction(1000, 1, s2.getTransaction().getOutput(0)));
        Assertions.assertTrue(tooLongSecondary.isPresent());
        Assertions.assertTrue(tooLongSecondary.get().contains("secondary mempool [limit: 2]"));
    }

    @Test
    public void testPrioritiseBeforeInsert() {
        Transaction transaction = MempoolTestAccess.transaction(1000, 1, MempoolTestAccess.confirmedInput());
        mempool.prioritiseTransaction(transaction.getTxId(), 300);
        mempool.prioritiseTransaction(transaction.getTxId(), 300);
        Assertions.assertEquals(600, mempool.getFeeDelta(transaction.getTxId()));

        MempoolEntry entry = add(MempoolTestAccess.entry(transaction, 0));
        Assertions.assertEquals(600, entry.getModifiedFee());
        Assertions.assertTrue(entry.isInPrimaryMempool());

        mempool.clearPrioritisation(transaction.getTxId());
        Assertions.assertEquals(0, mempool.getFeeDelta(transaction.getTxId()));
        Assertions.assertEquals(600, entry.getFeeDelta());
        mempool.checkMempool();
    }

    @Test
    public void testPrioritiseMovesEntryToGroup() {
        MempoolEntry parent = add(MempoolTestAccess.entry(600, 1000, 1, MempoolTestAccess.confirmedInput()));
        MempoolEntry child = add(MempoolTestAccess.entry(1000, 1000, 1, parent.getTransaction().getOutput(0)));
        Assertions.assertSame(Admission.STANDALONE, parent.getAdmission());
        Assertions.assertSame(Admission.STANDALONE, child.getAdmission());

        mempool.prioritiseTransaction(parent.getTxId(), -200);

        Assertions.assertEquals(400, parent.getModifiedFee());
        CpfpGroup group = child.getCpfpGroup().orElseThrow();
        Assertions.assertEquals(List.of(parent.getTxId(), child.getTxId()), group.getMembers());
        Assertions.assertEquals(new GroupingData(1600, -200, 2000, 1), group.getEvaluationParams());
        mempool.checkMempool();
    }

    @Test
    public void testEmptyMempool() {
        Assertions.assertTrue(mempool.getMostWorthless().isEmpty());
        Assertions.assertTrue(mempool.getAllCandidates().isEmpty());
        Assertions.assertTrue(mempool.trimToSize(0).isEmpty());
        Assertions.assertEquals(FeeRate.ZERO, mempool.getMinFee(MempoolSettings.DEFAULT_MAX_MEMPOOL));
        Assertions.assertEquals(new SecondaryMempoolStats(0, 0), mempool.getSecondaryMempoolStats());
        mempool.checkMempool();
    }

    @Test
    public void testClear() {
        add(MempoolTestAccess.entry(1000, 1000, 1, MempoolTestAccess.confirmedInput()));
        add(MempoolTestAccess.entry(0, 1000, 1, MempoolTestAccess.confirmedInput()));
        mempool.clear();

        Assertions.assertEquals(0, mempool.size());
        Assertions.assertEquals(0, mempool.dynamicMemoryUsage());
        Assertions.assertTrue(mempool.getAllCandidates().isEmpty());
        mempool.checkMempool();
    }

    @Test
    public void testRandomOperationsKeepInvariants() {
        Random random = new Random(3);
        List<OutPoint> unspent = new ArrayList<>();
        List<Transaction> transactions = new ArrayList<>();
        for(int i = 0; i < 400; i++) {
            int operation = random.nextInt(10);
            if(operation < 7 || transactions.isEmpty()) {
                OutPoint input = unspent.isEmpty() || random.nextInt(3) == 0 ? MempoolTestAccess.confirmedInput() : unspent.remove(random.nextInt(unspent.size()));
                MempoolEntry entry = MempoolTestAccess.entry(random.nextInt(1200), 500 + random.nextInt(1000), 2, input);
                if(mempool.isSpent(input)) {
                    continue;
                }
                add(entry);
                transactions.add(entry.getTransaction());
                unspent.add(entry.getTransaction().getOutput(0));
                unspent.add(entry.getTransaction().getOutput(1));
            } else if(operation == 7) {
                Transaction transaction = transactions.get(random.nextInt(transactions.size()));
                mempool.prioritiseTransaction(transaction.getTxId(), random.nextInt(2000) - 1000);
            } else if(operation == 8) {
                Transaction transaction = transactions.remove(random.nextInt(transactions.size()));
                mempool.removeRecursive(transaction, RemovalReason.UNKNOWN);
            } else {
                Transaction transaction = transactions.remove(random.nextInt(transactions.size()));
                if(mempool.exists(transaction.getTxId()) && mempool.getParents(transaction.getTxId()).isEmpty()) {
                    mempool.removeForBlock(List.of(transaction));
                }
            }
            mempool.checkMempool();
        }

        mempool.rebuild();
        mempool.checkMempool();
    }

    private MempoolEntry add(MempoolEntry entry) {
        mempool.addUnchecked(entry);
        return entry;
    }
}
