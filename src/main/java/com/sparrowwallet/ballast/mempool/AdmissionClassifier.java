package com.sparrowwallet.ballast.mempool;

import com.google.common.base.Preconditions;
import com.sparrowwallet.ballast.protocol.FeeRate;
import com.sparrowwallet.ballast.protocol.TxId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Decides which entries are block eligible. An entry is accepted standalone when it has no secondary parent and pays
 * the block minimum fee on its own, or as the paying transaction of a new group when its fee also covers every
 * still-secondary ancestor. Everything else stays in the secondary mempool.
 */
public class AdmissionClassifier {
    private static final Logger log = LoggerFactory.getLogger(AdmissionClassifier.class);

    public static final Comparator<MempoolEntry> INSERTION_ORDER = Comparator.comparingLong(MempoolEntry::getInsertionIndex);

    private final DependencyGraph graph;
    private final Map<TxId, MempoolEntry> entries;
    private final FeeRate blockMinTxFee;

    public AdmissionClassifier(DependencyGraph graph, Map<TxId, MempoolEntry> entries, FeeRate blockMinTxFee) {
        this.graph = graph;
        this.entries = entries;
        this.blockMinTxFee = blockMinTxFee;
    }

    public FeeRate getBlockMinTxFee() {
        return blockMinTxFee;
    }

    public boolean isPayingEnough(GroupingData groupingData) {
        return groupingData.getModifiedFee() >= blockMinTxFee.getFee(groupingData.size());
    }

    /**
     * Re-evaluates the given secondary entries, parents before children, and follows the effect down to their
     * secondary descendants. Entries already in the primary mempool are left untouched.
     */
    public AdmissionChanges tryAcceptToPrimary(Collection<TxId> toUpdate) {
        AdmissionChanges changes = new AdmissionChanges();
        Set<TxId> initial = new HashSet<>(toUpdate);
        TreeSet<MempoolEntry> queue = new TreeSet<>(INSERTION_ORDER);
        for(TxId txId : toUpdate) {
            MempoolEntry entry = entries.get(txId);
            if(entry != null) {
                queue.add(entry);
            }
        }

        while(!queue.isEmpty()) {
            MempoolEntry entry = queue.pollFirst();
            if(entry.isInPrimaryMempool() || !entries.containsKey(entry.getTxId())) {
                continue;
            }

            GroupingData previous = entry.getGroupingData().orElse(null);
            List<MempoolEntry> secondaryParents = getSecondaryParents(entry);
            GroupingData own = GroupingData.of(entry);
            if(secondaryParents.isEmpty() && isPayingEnough(own)) {
                entry.setAdmission(Admission.STANDALONE);
                changes.accepted(entry.getTxId());
                queueSecondaryChildren(entry, queue);
                continue;
            }

            GroupingData groupingData = own;
            for(MempoolEntry parent : secondaryParents) {
                groupingData = groupingData.plusAncestor(parent.getGroupingData().orElse(GroupingData.of(parent)));
            }

            if(isPayingEnough(groupingData)) {
                List<MempoolEntry> members = getSecondaryAncestors(entry);
                members.add(entry);
                GroupingData exact = calculateGroupingData(members);
                if(isPayingEnough(exact)) {
                    CpfpGroup group = createGroup(members, exact);
                    for(MempoolEntry member : members) {
                        changes.accepted(member.getTxId());
                    }
                    for(MempoolEntry member : members) {
                        queueSecondaryChildren(member, queue);
                    }
                    log.debug("Formed " + group);
                    continue;
                }
            }

            entry.setAdmission(new Admission.Secondary(groupingData));
            if(!groupingData.equals(previous) || initial.contains(entry.getTxId())) {
                queueSecondaryChildren(entry, queue);
            }
        }

        return changes;
    }

    /**
     * Takes the given entries and all their primary descendants out of the primary mempool, disbanding every group
     * touched on the way. The affected entries are left secondary with only their own data and must be re-evaluated
     * with {@link #tryAcceptToPrimary(Collection)} once the caller has finished mutating the graph.
     */
    public AdmissionChanges removeFromPrimary(Collection<TxId> roots) {
        AdmissionChanges changes = new AdmissionChanges();
        Set<TxId> visited = new HashSet<>();
        Deque<TxId> work = new ArrayDeque<>(roots);
        while(!work.isEmpty()) {
            TxId txId = work.pop();
            if(!visited.add(txId)) {
                continue;
            }

            MempoolEntry entry = entries.get(txId);
            if(entry == null || !entry.isInPrimaryMempool()) {
                continue;
            }

            Optional<CpfpGroup> optGroup = entry.getCpfpGroup();
            if(optGroup.isPresent()) {
                CpfpGroup group = optGroup.get();
                for(TxId memberId : group.getMembers()) {
                    MempoolEntry member = entries.get(memberId);
                    visited.add(memberId);
                    if(member != null) {
                        member.setAdmission(new Admission.Secondary(GroupingData.of(member)));
                        changes.removed(memberId);
                        work.addAll(graph.getChildren(memberId));
                    }
                }
                log.debug("Disbanded " + group);
            } else {
                entry.setAdmission(new Admission.Secondary(GroupingData.of(entry)));
                changes.removed(txId);
                work.addAll(graph.getChildren(txId));
            }
        }

        return changes;
    }

    /**
     * Groups the given entries, parents first, with the last one paying. Members of other groups are folded in after
     * their old groups are disbanded. The remaining members of those groups and the secondary children of the new
     * group are re-evaluated afterwards.
     */
    public AdmissionChanges formGroup(List<TxId> orderedMembers) {
        Preconditions.checkArgument(!orderedMembers.isEmpty(), "Cannot form an empty group");
        List<MempoolEntry> members = new ArrayList<>();
        List<TxId> grouped = new ArrayList<>();
        for(TxId txId : orderedMembers) {
            MempoolEntry member = entries.get(txId);
            Preconditions.checkArgument(member != null, "Transaction " + txId + " is not in the mempool");
            Preconditions.checkArgument(member.isCpfpGroupMember() || !member.isInPrimaryMempool(), "Transaction " + txId + " is already accepted standalone");
            if(member.isCpfpGroupMember()) {
                grouped.add(txId);
            }
            members.add(member);
        }

        Set<CpfpGroup> disbanding = new HashSet<>();
        for(TxId txId : grouped) {
            entries.get(txId).getCpfpGroup().ifPresent(disbanding::add);
        }

        Set<TxId> preceding = new HashSet<>();
        for(MempoolEntry member : members) {
            for(TxId parentId : graph.getParents(member.getTxId())) {
                MempoolEntry parent = entries.get(parentId);
                boolean stillPrimary = parent.isInPrimaryMempool() && parent.getCpfpGroup().map(group -> !disbanding.contains(group)).orElse(true);
                Preconditions.checkArgument(preceding.contains(parentId) || stillPrimary, "Parent " + parentId + " of group member " + member.getTxId() + " is neither primary nor an earlier member");
            }
            preceding.add(member.getTxId());
        }

        GroupingData groupingData = calculateGroupingData(members);
        Preconditions.checkArgument(isPayingEnough(groupingData), "Group paid by " + orderedMembers.get(orderedMembers.size() - 1) + " does not pay the block minimum fee");

        AdmissionChanges changes = removeFromPrimary(grouped);
        CpfpGroup group = createGroup(members, groupingData);
        for(TxId txId : orderedMembers) {
            changes.accepted(txId);
        }
        log.debug("Formed " + group);

        Set<TxId> toUpdate = new LinkedHashSet<>(changes.getRemoved());
        for(MempoolEntry member : members) {
            for(TxId childId : graph.getChildren(member.getTxId())) {
                MempoolEntry child = entries.get(childId);
                if(child != null && !child.isInPrimaryMempool()) {
                    toUpdate.add(childId);
                }
            }
        }
        toUpdate.removeAll(orderedMembers);
        changes.addAll(tryAcceptToPrimary(toUpdate));
        return changes;
    }

    /**
     * Disbands a group and re-evaluates its former members and any descendants that depended on it.
     */
    public AdmissionChanges disbandGroup(CpfpGroup group) {
        AdmissionChanges changes = removeFromPrimary(group.getMembers());
        changes.addAll(tryAcceptToPrimary(changes.getRemoved()));
        return changes;
    }

    /**
     * The aggregate a new transaction spending the given parents would start from if it stayed secondary.
     */
    public GroupingData getProspectiveGroupingData(Collection<TxId> parents, GroupingData own) {
        GroupingData groupingData = own;
        for(TxId parentId : parents) {
            MempoolEntry parent = entries.get(parentId);
            if(parent != null && !parent.isInPrimaryMempool()) {
                groupingData = groupingData.plusAncestor(parent.getGroupingData().orElse(GroupingData.of(parent)));
            }
        }

        return groupingData;
    }

    private CpfpGroup createGroup(List<MempoolEntry> members, GroupingData groupingData) {
        List<TxId> memberIds = new ArrayList<>(members.size());
        for(MempoolEntry member : members) {
            memberIds.add(member.getTxId());
        }

        CpfpGroup group = new CpfpGroup(groupingData, memberIds);
        Admission.Grouped admission = new Admission.Grouped(group);
        for(MempoolEntry member : members) {
            member.setAdmission(admission);
        }

        return group;
    }

    static GroupingData calculateGroupingData(List<MempoolEntry> members) {
        GroupingData groupingData = GroupingData.EMPTY;
        for(MempoolEntry member : members) {
            groupingData = groupingData.plus(member);
        }

        return new GroupingData(groupingData.fee(), groupingData.feeDelta(), groupingData.size(), members.size() - 1);
    }

    private List<MempoolEntry> getSecondaryParents(MempoolEntry entry) {
        List<MempoolEntry> secondaryParents = new ArrayList<>();
        for(TxId parentId : graph.getParents(entry.getTxId())) {
            MempoolEntry parent = entries.get(parentId);
            if(parent != null && !parent.isInPrimaryMempool()) {
                secondaryParents.add(parent);
            }
        }

        return secondaryParents;
    }

    private List<MempoolEntry> getSecondaryAncestors(MempoolEntry entry) {
        Set<MempoolEntry> ancestors = new TreeSet<>(INSERTION_ORDER);
        Deque<MempoolEntry> stack = new ArrayDeque<>(getSecondaryParents(entry));
        while(!stack.isEmpty()) {
            MempoolEntry ancestor = stack.pop();
            if(ancestors.add(ancestor)) {
                stack.addAll(getSecondaryParents(ancestor));
            }
        }

        return new ArrayList<>(ancestors);
    }

    private void queueSecondaryChildren(MempoolEntry entry, TreeSet<MempoolEntry> queue) {
        for(TxId childId : graph.getChildren(entry.getTxId())) {
            MempoolEntry child = entries.get(childId);
            if(child != null && !child.isInPrimaryMempool()) {
                queue.add(child);
            }
        }
    }
}
