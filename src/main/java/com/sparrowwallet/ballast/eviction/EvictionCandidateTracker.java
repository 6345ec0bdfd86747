package com.sparrowwallet.ballast.eviction;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.sparrowwallet.ballast.mempool.CpfpGroup;
import com.sparrowwallet.ballast.mempool.DependencyGraph;
import com.sparrowwallet.ballast.mempool.MempoolEntry;
import com.sparrowwallet.ballast.protocol.TxId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.ToLongFunction;

/**
 * Keeps every childless entry ordered by worthlessness. A grouped entry is represented by its group's paying
 * transaction, which counts as childless when no member of the group has a child outside it.
 * <p>
 * Replaced candidates are only flagged as expired and stay in the heap until they reach the top, or until expired
 * candidates outnumber live ones by the configured ratio, at which point the heap is rebuilt from the live set.
 * The top of the heap is always a live candidate between calls.
 */
public class EvictionCandidateTracker {
    private static final Logger log = LoggerFactory.getLogger(EvictionCandidateTracker.class);

    public static final double DEFAULT_MAX_INVALID_TO_VALID_RATIO = 1.0;

    private final DependencyGraph graph;
    private final Map<TxId, MempoolEntry> entries;
    private final ToLongFunction<MempoolEntry> evaluator;
    private final double maxInvalidToValidRatio;

    private final Map<TxId, Candidate> candidates = new HashMap<>();
    private PriorityQueue<Candidate> heap;
    private long nextSequence;

    public EvictionCandidateTracker(DependencyGraph graph, Map<TxId, MempoolEntry> entries, ToLongFunction<MempoolEntry> evaluator) {
        this(graph, entries, evaluator, DEFAULT_MAX_INVALID_TO_VALID_RATIO);
    }

    public EvictionCandidateTracker(DependencyGraph graph, Map<TxId, MempoolEntry> entries, ToLongFunction<MempoolEntry> evaluator, double maxInvalidToValidRatio) {
        Preconditions.checkArgument(maxInvalidToValidRatio >= 0, "Compaction ratio cannot be negative");
        this.graph = graph;
        this.entries = entries;
        this.evaluator = evaluator;
        this.maxInvalidToValidRatio = maxInvalidToValidRatio;

        List<MempoolEntry> initial = new ArrayList<>();
        for(TxId txId : graph.getTxIds()) {
            MempoolEntry entry = getEntry(txId);
            if(isRepresentative(entry) && !hasChildren(entry)) {
                initial.add(entry);
            }
        }

        initial.sort(Comparator.comparingLong(MempoolEntry::getInsertionIndex));
        for(MempoolEntry entry : initial) {
            Candidate candidate = new Candidate(evaluator.applyAsLong(entry), nextSequence++, entry.getTxId());
            candidates.put(entry.getTxId(), candidate);
        }

        heap = new PriorityQueue<>(candidates.values());
    }

    /**
     * Called after an entry has been linked to its parents. The parents stop being childless and the entry becomes a candidate.
     */
    public void entryAdded(MempoolEntry entry) {
        for(TxId parentId : graph.getParents(entry.getTxId())) {
            expire(getRepresentative(getEntry(parentId)).getTxId());
        }

        popExpired();
        if(isRepresentative(entry) && !hasChildren(entry)) {
            insert(entry);
        }
    }

    /**
     * Called after an entry has been unlinked. Former parents left without children become candidates again.
     */
    public void entryRemoved(TxId txId, Collection<TxId> immediateParents) {
        expire(txId);
        popExpired();

        for(TxId parentId : immediateParents) {
            MempoolEntry parent = entries.get(parentId);
            if(parent == null) {
                continue;
            }

            MempoolEntry representative = getRepresentative(parent);
            if(!candidates.containsKey(representative.getTxId()) && !hasChildren(representative)) {
                insert(representative);
            }
        }
    }

    /**
     * Called when the score or the group membership of an entry has changed.
     */
    public void entryModified(MempoolEntry entry) {
        expire(entry.getTxId());
        if(isRepresentative(entry) && !hasChildren(entry)) {
            insert(entry);
        }

        popExpired();
    }

    public MempoolEntry getMostWorthless() {
        Preconditions.checkState(!candidates.isEmpty(), "There are no eviction candidates");
        return getEntry(heap.peek().txId);
    }

    public Set<TxId> getAllCandidates() {
        return ImmutableSet.copyOf(candidates.keySet());
    }

    public boolean isCandidate(TxId txId) {
        return candidates.containsKey(txId);
    }

    public int size() {
        return candidates.size();
    }

    /**
     * Number of replaced candidates still waiting in the heap to be discarded.
     */
    public int getExpiredCount() {
        return heap.size() - candidates.size();
    }

    public double getMaxInvalidToValidRatio() {
        return maxInvalidToValidRatio;
    }

    private void insert(MempoolEntry entry) {
        Candidate candidate = new Candidate(evaluator.applyAsLong(entry), nextSequence++, entry.getTxId());
        candidates.put(entry.getTxId(), candidate);
        heap.add(candidate);
    }

    private void expire(TxId txId) {
        Candidate candidate = candidates.remove(txId);
        if(candidate != null) {
            candidate.expired = true;
        }
    }

    private void popExpired() {
        int expired = heap.size() - candidates.size();
        if(candidates.isEmpty() || (double)expired / candidates.size() > maxInvalidToValidRatio) {
            heap = new PriorityQueue<>(candidates.values());
            if(log.isTraceEnabled()) {
                log.trace("Compacted eviction candidates, discarded " + expired + " expired, " + candidates.size() + " remaining");
            }
            return;
        }

        while(!heap.isEmpty() && heap.peek().expired) {
            heap.poll();
        }
    }

    private boolean isRepresentative(MempoolEntry entry) {
        return entry.getCpfpGroup().map(group -> group.isPayingTx(entry.getTxId())).orElse(true);
    }

    private MempoolEntry getRepresentative(MempoolEntry entry) {
        Optional<CpfpGroup> optGroup = entry.getCpfpGroup();
        if(optGroup.isPresent()) {
            return getEntry(optGroup.get().getPayingTxId());
        }

        return entry;
    }

    private boolean hasChildren(MempoolEntry entry) {
        Optional<CpfpGroup> optGroup = entry.getCpfpGroup();
        if(optGroup.isEmpty()) {
            return graph.hasChildren(entry.getTxId());
        }

        List<TxId> members = optGroup.get().getMembers();
        for(TxId memberId : members) {
            for(TxId childId : graph.getChildren(memberId)) {
                if(!members.contains(childId)) {
                    return true;
                }
            }
        }

        return false;
    }

    private MempoolEntry getEntry(TxId txId) {
        MempoolEntry entry = entries.get(txId);
        Preconditions.checkState(entry != null, "Transaction " + txId + " is linked but has no mempool entry");
        return entry;
    }

    private static final class Candidate implements Comparable<Candidate> {
        private final long score;
        private final long sequence;
        private final TxId txId;
        private boolean expired;

        private Candidate(long score, long sequence, TxId txId) {
            this.score = score;
            this.sequence = sequence;
            this.txId = txId;
        }

        @Override
        public int compareTo(Candidate o) {
            int compare = Long.compare(score, o.score);
            if(compare != 0) {
                return compare;
            }

            return Long.compare(sequence, o.sequence);
        }
    }
}
