package com.sparrowwallet.ballast.mempool;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.eventbus.EventBus;
import com.sparrowwallet.ballast.eviction.EvictionCandidateTracker;
import com.sparrowwallet.ballast.eviction.EvictionScore;
import com.sparrowwallet.ballast.protocol.FeeRate;
import com.sparrowwallet.ballast.protocol.OutPoint;
import com.sparrowwallet.ballast.protocol.Transaction;
import com.sparrowwallet.ballast.protocol.TxId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.ToLongFunction;

/**
 * Owns the entry table and keeps the dependency graph, the admission state of every entry and the eviction
 * candidates consistent with it. Every mutation runs as one logical operation under the write lock; events describing
 * the outcome are posted once the lock has been released.
 */
public class TxMemPool {
    private static final Logger log = LoggerFactory.getLogger(TxMemPool.class);

    //Seconds between decays of the rolling minimum fee
    private static final long ROLLING_FEE_UPDATE_INTERVAL = 10;

    private final MempoolSettings settings;
    private final EventBus eventBus;
    private final Clock clock;
    private final ToLongFunction<MempoolEntry> evaluator;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<TxId, MempoolEntry> entries = new HashMap<>();
    private final Map<OutPoint, TxId> spentBy = new HashMap<>();
    private final Map<TxId, Long> deltas = new HashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final AdmissionClassifier classifier;
    private final SizeLimiter sizeLimiter;
    private EvictionCandidateTracker tracker;

    private long nextInsertionIndex;
    private long totalTxSize;
    private long usage;

    private double rollingMinimumFeeRate;
    private long lastRollingFeeUpdate;
    private boolean blockSinceLastRollingFeeBump;

    public TxMemPool(MempoolSettings settings, EventBus eventBus) {
        this(settings, eventBus, Clock.systemUTC(), EvictionScore::score);
    }

    public TxMemPool(MempoolSettings settings, EventBus eventBus, Clock clock, ToLongFunction<MempoolEntry> evaluator) {
        this.settings = settings;
        this.eventBus = eventBus;
        this.clock = clock;
        this.evaluator = evaluator;
        this.classifier = new AdmissionClassifier(graph, entries, settings.blockMinTxFee());
        this.sizeLimiter = new SizeLimiter(this);
        this.tracker = createTracker();
        this.lastRollingFeeUpdate = getTime();
    }

    private EvictionCandidateTracker createTracker() {
        return new EvictionCandidateTracker(graph, entries, evaluator, settings.evictionCompactionRatio());
    }

    /**
     * Inserts an entry that has already been validated. Inputs that are not in the pool are treated as confirmed.
     */
    public void addUnchecked(MempoolEntry entry) {
        List<Object> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            addUncheckedNL(entry, events);
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
    }

    private void addUncheckedNL(MempoolEntry entry, List<Object> events) {
        TxId txId = entry.getTxId();
        Transaction transaction = entry.getTransaction();
        Preconditions.checkArgument(!entries.containsKey(txId), "Transaction " + txId + " is already in the mempool");
        for(OutPoint input : transaction.getInputs()) {
            TxId spender = spentBy.get(input);
            Preconditions.checkArgument(spender == null, "Transaction " + txId + " conflicts with " + spender + " spending " + input);
        }
        for(int i = 0; i < transaction.getOutputCount(); i++) {
            Preconditions.checkArgument(!spentBy.containsKey(transaction.getOutput(i)), "Transaction " + txId + " already has a spender in the mempool");
        }

        Set<TxId> parents = new LinkedHashSet<>();
        for(OutPoint input : transaction.getInputs()) {
            if(entries.containsKey(input.txId())) {
                parents.add(input.txId());
            }
        }

        entry.setInsertionIndex(nextInsertionIndex++);
        entry.setFeeDelta(deltas.getOrDefault(txId, 0L));
        entry.setAdmission(new Admission.Secondary(GroupingData.of(entry)));

        entries.put(txId, entry);
        for(OutPoint input : transaction.getInputs()) {
            spentBy.put(input, txId);
        }
        graph.addEntry(txId, parents);
        totalTxSize += entry.getSize();
        usage += entry.getUsageSize();

        tracker.entryAdded(entry);
        AdmissionChanges changes = classifier.tryAcceptToPrimary(List.of(txId));
        notifyModified(changes);
        addPrimaryChangedEvent(changes, events);
    }

    /**
     * Removes the given transactions together with all their in-pool descendants.
     */
    public List<TxId> removeStaged(Collection<TxId> txIds, RemovalReason reason) {
        List<Object> events = new ArrayList<>();
        List<TxId> removed;
        lock.writeLock().lock();
        try {
            List<TxId> present = new ArrayList<>();
            for(TxId txId : txIds) {
                if(entries.containsKey(txId)) {
                    present.add(txId);
                }
            }
            removed = removeStagedNL(graph.calculateDescendants(present), reason, events);
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
        return removed;
    }

    /**
     * Removes a transaction and its descendants. When the transaction itself is not in the pool, any in-pool spenders
     * of its outputs are removed with their descendants instead.
     */
    public List<TxId> removeRecursive(Transaction transaction, RemovalReason reason) {
        List<Object> events = new ArrayList<>();
        List<TxId> removed;
        lock.writeLock().lock();
        try {
            removed = removeRecursiveNL(transaction, reason, events);
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
        return removed;
    }

    private List<TxId> removeRecursiveNL(Transaction transaction, RemovalReason reason, List<Object> events) {
        List<TxId> roots = new ArrayList<>();
        if(entries.containsKey(transaction.getTxId())) {
            roots.add(transaction.getTxId());
        } else {
            for(int i = 0; i < transaction.getOutputCount(); i++) {
                TxId spender = spentBy.get(transaction.getOutput(i));
                if(spender != null) {
                    roots.add(spender);
                }
            }
        }

        if(roots.isEmpty()) {
            return Collections.emptyList();
        }

        return removeStagedNL(graph.calculateDescendants(roots), reason, events);
    }

    /**
     * Removes a set of transactions that must already include every in-pool descendant, children first, and
     * re-evaluates the survivors that depended on them for their admission.
     */
    List<TxId> removeStagedNL(Set<TxId> stage, RemovalReason reason, List<Object> events) {
        AdmissionChanges changes = classifier.removeFromPrimary(stage);

        List<MempoolEntry> ordered = new ArrayList<>(stage.size());
        for(TxId txId : stage) {
            ordered.add(getEntryNL(txId));
        }
        ordered.sort(AdmissionClassifier.INSERTION_ORDER.reversed());

        List<TxId> removed = new ArrayList<>(ordered.size());
        for(MempoolEntry entry : ordered) {
            removeUncheckedNL(entry);
            removed.add(entry.getTxId());
        }

        Set<TxId> survivors = new LinkedHashSet<>(changes.getRemoved());
        survivors.removeAll(stage);
        changes.addAll(classifier.tryAcceptToPrimary(survivors));
        notifyModified(changes);

        if(!removed.isEmpty()) {
            events.add(new MempoolTransactionsRemoved(removed, reason));
        }
        addPrimaryChangedEvent(changes, events);
        return removed;
    }

    private void removeUncheckedNL(MempoolEntry entry) {
        TxId txId = entry.getTxId();
        Set<TxId> parents = graph.removeEntry(txId);
        entries.remove(txId);
        for(OutPoint input : entry.getTransaction().getInputs()) {
            spentBy.remove(input);
        }
        totalTxSize -= entry.getSize();
        usage -= entry.getUsageSize();
        tracker.entryRemoved(txId, parents);
    }

    /**
     * Called when a block is connected. Confirmed transactions leave the pool without their descendants, in-pool
     * transactions spending the same outputs as a block transaction are removed as conflicts, and everything that
     * depended on either is re-evaluated.
     */
    public void removeForBlock(List<Transaction> blockTransactions) {
        List<Object> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            AdmissionChanges changes = new AdmissionChanges();
            Set<TxId> toUpdate = new LinkedHashSet<>();
            List<TxId> confirmed = new ArrayList<>();
            for(Transaction transaction : blockTransactions) {
                TxId txId = transaction.getTxId();
                MempoolEntry entry = entries.get(txId);
                if(entry != null) {
                    changes.addAll(classifier.removeFromPrimary(List.of(txId)));
                    Set<TxId> parents = new LinkedHashSet<>(graph.getParents(txId));
                    Set<TxId> children = graph.removeConfirmed(txId);
                    entries.remove(txId);
                    for(OutPoint input : transaction.getInputs()) {
                        spentBy.remove(input);
                    }
                    totalTxSize -= entry.getSize();
                    usage -= entry.getUsageSize();
                    tracker.entryRemoved(txId, parents);
                    toUpdate.addAll(children);
                    confirmed.add(txId);
                }

                for(OutPoint input : transaction.getInputs()) {
                    TxId spender = spentBy.get(input);
                    if(spender != null && !spender.equals(txId)) {
                        deltas.remove(spender);
                        removeStagedNL(graph.calculateDescendants(List.of(spender)), RemovalReason.CONFLICT, events);
                    }
                }
                deltas.remove(txId);
            }

            toUpdate.addAll(changes.getRemoved());
            toUpdate.removeIf(txId -> !entries.containsKey(txId));
            changes.addAll(classifier.tryAcceptToPrimary(toUpdate));
            notifyModified(changes);

            if(!confirmed.isEmpty()) {
                events.add(new MempoolTransactionsRemoved(confirmed, RemovalReason.BLOCK));
            }
            addPrimaryChangedEvent(changes, events);

            lastRollingFeeUpdate = getTime();
            blockSinceLastRollingFeeBump = true;
            log.debug("Removed " + confirmed.size() + " confirmed transactions from the mempool, " + entries.size() + " remaining");
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
    }

    /**
     * Removes transactions that entered the pool before the cutoff time, along with their descendants.
     */
    public int expire(long cutoffTime) {
        List<Object> events = new ArrayList<>();
        int removed;
        lock.writeLock().lock();
        try {
            List<TxId> expired = new ArrayList<>();
            for(MempoolEntry entry : entries.values()) {
                if(entry.getTime() < cutoffTime) {
                    expired.add(entry.getTxId());
                }
            }

            removed = expired.isEmpty() ? 0 : removeStagedNL(graph.calculateDescendants(expired), RemovalReason.EXPIRY, events).size();
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
        return removed;
    }

    /**
     * Adds to the manual fee delta of a transaction. Deltas for transactions not yet in the pool are applied when they arrive.
     */
    public void prioritiseTransaction(TxId txId, long feeDelta) {
        List<Object> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            long total = deltas.merge(txId, feeDelta, Long::sum);
            MempoolEntry entry = entries.get(txId);
            if(entry != null) {
                entry.setFeeDelta(total);
                AdmissionChanges changes;
                if(entry.isInPrimaryMempool()) {
                    changes = classifier.removeFromPrimary(List.of(txId));
                    changes.addAll(classifier.tryAcceptToPrimary(changes.getRemoved()));
                } else {
                    changes = classifier.tryAcceptToPrimary(List.of(txId));
                }

                tracker.entryModified(entry);
                notifyModified(changes);
                addPrimaryChangedEvent(changes, events);
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Prioritised transaction " + txId + " with fee delta " + feeDelta);
        post(events);
    }

    /**
     * Groups the given entries, parents first, with the last one as the paying transaction.
     */
    public CpfpGroup formGroup(List<TxId> orderedMembers) {
        List<Object> events = new ArrayList<>();
        CpfpGroup group;
        lock.writeLock().lock();
        try {
            AdmissionChanges changes = classifier.formGroup(orderedMembers);
            notifyModified(changes);
            addPrimaryChangedEvent(changes, events);
            group = getEntryNL(orderedMembers.get(orderedMembers.size() - 1)).getCpfpGroup().orElseThrow();
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
        return group;
    }

    /**
     * Disbands the group the given transaction belongs to and re-evaluates its members. Returns false if the
     * transaction is absent or not a group member.
     */
    public boolean disbandGroup(TxId txId) {
        List<Object> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            MempoolEntry entry = entries.get(txId);
            Optional<CpfpGroup> optGroup = entry == null ? Optional.empty() : entry.getCpfpGroup();
            if(optGroup.isEmpty()) {
                return false;
            }

            AdmissionChanges changes = classifier.disbandGroup(optGroup.get());
            notifyModified(changes);
            addPrimaryChangedEvent(changes, events);
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
        return true;
    }

    public void clearPrioritisation(TxId txId) {
        lock.writeLock().lock();
        try {
            deltas.remove(txId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long getFeeDelta(TxId txId) {
        lock.readLock().lock();
        try {
            return deltas.getOrDefault(txId, 0L);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TxId> trimToSize(long sizeLimit) {
        return trimToSize(sizeLimit, null);
    }

    /**
     * Evicts until dynamic memory usage is at most the limit and returns the evicted transactions. When a list is
     * given, confirmed or foreign outpoints that no remaining transaction spends any more are added to it.
     */
    public List<TxId> trimToSize(long sizeLimit, List<OutPoint> noSpendsRemaining) {
        List<Object> events = new ArrayList<>();
        List<TxId> removed;
        lock.writeLock().lock();
        try {
            removed = sizeLimiter.trimToSize(sizeLimit, noSpendsRemaining, events);
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
        return removed;
    }

    /**
     * Expires transactions older than the configured expiry, then trims to the configured maximum size.
     */
    public List<TxId> limitMempoolSize() {
        int expired = expire(getTime() - settings.mempoolExpiry().getSeconds());
        if(expired > 0) {
            log.info("Expired " + expired + " transactions from the memory pool");
        }

        return trimToSize(settings.maxMempool());
    }

    void trackPackageRemovedNL(FeeRate rate) {
        if(rate.satoshisPerK() > rollingMinimumFeeRate) {
            rollingMinimumFeeRate = rate.satoshisPerK();
            blockSinceLastRollingFeeBump = false;
        }
    }

    /**
     * The minimum fee rate to get into the pool, raised by evictions and decaying after each block.
     */
    public FeeRate getMinFee(long sizeLimit) {
        lock.writeLock().lock();
        try {
            if(!blockSinceLastRollingFeeBump || rollingMinimumFeeRate == 0) {
                return new FeeRate((long)rollingMinimumFeeRate);
            }

            long time = getTime();
            if(time > lastRollingFeeUpdate + ROLLING_FEE_UPDATE_INTERVAL) {
                double halflife = settings.rollingFeeHalflife().getSeconds();
                if(usage < sizeLimit / 4) {
                    halflife /= 4;
                } else if(usage < sizeLimit / 2) {
                    halflife /= 2;
                }

                rollingMinimumFeeRate = rollingMinimumFeeRate / Math.pow(2.0, (time - lastRollingFeeUpdate) / halflife);
                lastRollingFeeUpdate = time;

                if(rollingMinimumFeeRate < (double)settings.incrementalRelayFee().satoshisPerK() / 2) {
                    rollingMinimumFeeRate = 0;
                    return FeeRate.ZERO;
                }
            }

            return new FeeRate((long)rollingMinimumFeeRate);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Checks whether a transaction spending the given outpoints would stay within the ancestor limits, returning the
     * reason for rejection if not.
     */
    public Optional<String> checkAncestorLimits(Transaction transaction) {
        lock.readLock().lock();
        try {
            Set<TxId> parents = new LinkedHashSet<>();
            for(OutPoint input : transaction.getInputs()) {
                if(entries.containsKey(input.txId())) {
                    parents.add(input.txId());
                }
            }

            int ancestors = graph.calculateAncestors(parents).size();
            if(ancestors + 1 > settings.limitAncestorCount()) {
                return Optional.of("too-long-mempool-chain, too many unconfirmed ancestors [limit: " + settings.limitAncestorCount() + "]");
            }

            GroupingData prospective = classifier.getProspectiveGroupingData(parents, GroupingData.EMPTY);
            if(prospective.ancestorsCount() + 1 > settings.limitSecondaryMempoolAncestorCount()) {
                return Optional.of("too-long-mempool-chain, too many unconfirmed ancestors in the secondary mempool [limit: " + settings.limitSecondaryMempoolAncestorCount() + "]");
            }

            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops all derived state and resubmits every entry in insertion order. This is the recovery path when the
     * derived structures can no longer be trusted.
     */
    public void rebuild() {
        List<Object> events = new ArrayList<>();
        lock.writeLock().lock();
        try {
            List<MempoolEntry> ordered = getEntriesNL();
            Set<TxId> primaryBefore = getPrimaryTxIdsNL();

            entries.clear();
            spentBy.clear();
            graph.clear();
            totalTxSize = 0;
            usage = 0;
            tracker = createTracker();

            for(MempoolEntry entry : ordered) {
                addUncheckedNL(entry, new ArrayList<>());
            }

            events.add(new PrimaryMempoolChanged(getPrimaryTxIdsNL(), primaryBefore));
            log.info("Rebuilt mempool of " + ordered.size() + " transactions");
        } finally {
            lock.writeLock().unlock();
        }

        post(events);
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            spentBy.clear();
            graph.clear();
            totalTxSize = 0;
            usage = 0;
            tracker = createTracker();
            rollingMinimumFeeRate = 0;
            blockSinceLastRollingFeeBump = false;
            lastRollingFeeUpdate = getTime();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Verifies every cross-structure invariant, throwing {@link IllegalStateException} on the first violation.
     */
    public void checkMempool() {
        lock.readLock().lock();
        try {
            if(!graph.getTxIds().equals(entries.keySet())) {
                throw new IllegalStateException("Dependency graph holds " + graph.size() + " transactions but the mempool holds " + entries.size());
            }
            graph.checkConsistency();

            long checkTotalTxSize = 0;
            long checkUsage = 0;
            Map<CpfpGroup, List<TxId>> groups = new HashMap<>();
            for(MempoolEntry entry : entries.values()) {
                TxId txId = entry.getTxId();
                checkTotalTxSize += entry.getSize();
                checkUsage += entry.getUsageSize();

                Set<TxId> parents = new LinkedHashSet<>();
                for(OutPoint input : entry.getTransaction().getInputs()) {
                    if(entries.containsKey(input.txId())) {
                        parents.add(input.txId());
                    }
                    if(!txId.equals(spentBy.get(input))) {
                        throw new IllegalStateException("Input " + input + " of " + txId + " is not indexed as spent by it");
                    }
                }
                if(!parents.equals(graph.getParents(txId))) {
                    throw new IllegalStateException("Parents of " + txId + " do not match its inputs");
                }

                boolean hasSecondaryParent = false;
                for(TxId parentId : parents) {
                    MempoolEntry parent = entries.get(parentId);
                    if(!parent.isInPrimaryMempool()) {
                        hasSecondaryParent = true;
                        if(entry.isInPrimaryMempool()) {
                            throw new IllegalStateException("Primary transaction " + txId + " has secondary parent " + parentId);
                        }
                    }
                    if(entry.isCpfpGroupMember() && parent.isCpfpGroupMember() && parent.getCpfpGroup().get() == entry.getCpfpGroup().get()
                            && parent.getInsertionIndex() > entry.getInsertionIndex()) {
                        throw new IllegalStateException("Group member " + txId + " was inserted before its parent " + parentId);
                    }
                }

                if(entry.getAdmission() instanceof Admission.Secondary && !hasSecondaryParent && classifier.isPayingEnough(GroupingData.of(entry))) {
                    throw new IllegalStateException("Transaction " + txId + " pays enough but is held in the secondary mempool");
                }

                entry.getCpfpGroup().ifPresent(group -> groups.computeIfAbsent(group, g -> new ArrayList<>()).add(txId));
            }

            for(Map.Entry<CpfpGroup, List<TxId>> groupEntry : groups.entrySet()) {
                CpfpGroup group = groupEntry.getKey();
                if(!new HashSet<>(group.getMembers()).equals(new HashSet<>(groupEntry.getValue()))) {
                    throw new IllegalStateException(group + " does not match the entries referencing it");
                }

                List<MempoolEntry> members = new ArrayList<>();
                for(TxId memberId : group.getMembers()) {
                    members.add(entries.get(memberId));
                }
                GroupingData exact = AdmissionClassifier.calculateGroupingData(members);
                if(!exact.equals(group.getEvaluationParams())) {
                    throw new IllegalStateException(group + " has stale evaluation parameters");
                }
                if(!classifier.isPayingEnough(exact)) {
                    throw new IllegalStateException(group + " does not pay enough");
                }
            }

            if(checkTotalTxSize != totalTxSize || checkUsage != usage) {
                throw new IllegalStateException("Size accounting has diverged");
            }

            Set<TxId> expectedCandidates = createTracker().getAllCandidates();
            if(!expectedCandidates.equals(tracker.getAllCandidates())) {
                throw new IllegalStateException("Eviction candidates do not match the childless transactions, expected " + expectedCandidates.size() + " but tracking " + tracker.size());
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean exists(TxId txId) {
        lock.readLock().lock();
        try {
            return existsNL(txId);
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean existsNL(TxId txId) {
        return entries.containsKey(txId);
    }

    public boolean isSpent(OutPoint outPoint) {
        lock.readLock().lock();
        try {
            return isSpentNL(outPoint);
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean isSpentNL(OutPoint outPoint) {
        return spentBy.containsKey(outPoint);
    }

    public Optional<MempoolEntry> getEntry(TxId txId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(txId));
        } finally {
            lock.readLock().unlock();
        }
    }

    MempoolEntry getEntryNL(TxId txId) {
        MempoolEntry entry = entries.get(txId);
        Preconditions.checkState(entry != null, "Transaction " + txId + " is not in the mempool");
        return entry;
    }

    /**
     * All entries in insertion order, which is also a valid topological order.
     */
    public List<MempoolEntry> getEntries() {
        lock.readLock().lock();
        try {
            return ImmutableList.copyOf(getEntriesNL());
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<MempoolEntry> getEntriesNL() {
        List<MempoolEntry> ordered = new ArrayList<>(entries.values());
        ordered.sort(AdmissionClassifier.INSERTION_ORDER);
        return ordered;
    }

    public Set<TxId> getParents(TxId txId) {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(graph.getParents(txId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<TxId> getChildren(TxId txId) {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(graph.getChildren(txId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<TxId> calculateDescendants(TxId txId) {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(graph.calculateDescendants(List.of(txId)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<MempoolEntry> getMostWorthless() {
        lock.readLock().lock();
        try {
            if(tracker.size() == 0) {
                return Optional.empty();
            }

            return Optional.of(tracker.getMostWorthless());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<TxId> getAllCandidates() {
        lock.readLock().lock();
        try {
            return tracker.getAllCandidates();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return sizeNL();
        } finally {
            lock.readLock().unlock();
        }
    }

    int sizeNL() {
        return entries.size();
    }

    public int getPrimaryMempoolSize() {
        lock.readLock().lock();
        try {
            return getPrimaryTxIdsNL().size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Set<TxId> getPrimaryTxIdsNL() {
        Set<TxId> primary = new LinkedHashSet<>();
        for(MempoolEntry entry : getEntriesNL()) {
            if(entry.isInPrimaryMempool()) {
                primary.add(entry.getTxId());
            }
        }

        return primary;
    }

    public SecondaryMempoolStats getSecondaryMempoolStats() {
        lock.readLock().lock();
        try {
            int count = 0;
            long secondaryUsage = 0;
            for(MempoolEntry entry : entries.values()) {
                if(!entry.isInPrimaryMempool()) {
                    count++;
                    secondaryUsage += entry.getUsageSize();
                }
            }

            return new SecondaryMempoolStats(count, secondaryUsage);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getTotalTxSize() {
        lock.readLock().lock();
        try {
            return totalTxSize;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long dynamicMemoryUsage() {
        lock.readLock().lock();
        try {
            return dynamicMemoryUsageNL();
        } finally {
            lock.readLock().unlock();
        }
    }

    long dynamicMemoryUsageNL() {
        return usage;
    }

    public MempoolSettings getSettings() {
        return settings;
    }

    DependencyGraph getGraph() {
        return graph;
    }

    EvictionCandidateTracker getTracker() {
        return tracker;
    }

    AdmissionClassifier getClassifier() {
        return classifier;
    }

    private void notifyModified(AdmissionChanges changes) {
        for(TxId txId : changes.getModified()) {
            MempoolEntry entry = entries.get(txId);
            if(entry != null) {
                tracker.entryModified(entry);
            }
        }
    }

    private void addPrimaryChangedEvent(AdmissionChanges changes, List<Object> events) {
        if(!changes.getAccepted().isEmpty() || !changes.getRemoved().isEmpty()) {
            events.add(new PrimaryMempoolChanged(ImmutableSet.copyOf(changes.getAccepted()), ImmutableSet.copyOf(changes.getRemoved())));
        }
    }

    private void post(List<Object> events) {
        for(Object event : events) {
            eventBus.post(event);
        }
    }

    private long getTime() {
        return clock.millis() / 1000;
    }
}
