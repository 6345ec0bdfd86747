package com.sparrowwallet.ballast.mempool;

import com.google.common.base.Preconditions;
import com.sparrowwallet.ballast.protocol.TxId;

import java.util.*;

/**
 * Direct parent and child links between in-pool transactions. Links are always symmetric and, since a transaction
 * can only spend outputs that already exist, acyclic.
 */
public class DependencyGraph {
    private final Map<TxId, Links> links = new HashMap<>();

    public void addEntry(TxId txId, Collection<TxId> parents) {
        Preconditions.checkArgument(!links.containsKey(txId), "Transaction " + txId + " is already linked");
        Links entryLinks = new Links();
        for(TxId parent : parents) {
            Links parentLinks = links.get(parent);
            Preconditions.checkState(parentLinks != null, "Parent " + parent + " of " + txId + " is not linked");
            parentLinks.children.add(txId);
            entryLinks.parents.add(parent);
        }

        links.put(txId, entryLinks);
    }

    /**
     * Unlinks a childless transaction and returns its former parents.
     */
    public Set<TxId> removeEntry(TxId txId) {
        Links entryLinks = getLinks(txId);
        Preconditions.checkState(entryLinks.children.isEmpty(), "Cannot remove " + txId + " while it still has " + entryLinks.children.size() + " children");
        for(TxId parent : entryLinks.parents) {
            getLinks(parent).children.remove(txId);
        }

        links.remove(txId);
        return entryLinks.parents;
    }

    /**
     * Unlinks a transaction that has been confirmed in a block. Its children stay in the graph and lose it as a parent.
     * Returns the former children.
     */
    public Set<TxId> removeConfirmed(TxId txId) {
        Links entryLinks = getLinks(txId);
        for(TxId parent : entryLinks.parents) {
            getLinks(parent).children.remove(txId);
        }
        for(TxId child : entryLinks.children) {
            getLinks(child).parents.remove(txId);
        }

        links.remove(txId);
        return entryLinks.children;
    }

    public boolean contains(TxId txId) {
        return links.containsKey(txId);
    }

    public Set<TxId> getParents(TxId txId) {
        return Collections.unmodifiableSet(getLinks(txId).parents);
    }

    public Set<TxId> getChildren(TxId txId) {
        return Collections.unmodifiableSet(getLinks(txId).children);
    }

    public boolean hasChildren(TxId txId) {
        return !getLinks(txId).children.isEmpty();
    }

    /**
     * All in-pool descendants of the given transactions, including the transactions themselves.
     */
    public Set<TxId> calculateDescendants(Collection<TxId> roots) {
        Set<TxId> descendants = new LinkedHashSet<>();
        Deque<TxId> stack = new ArrayDeque<>(roots);
        while(!stack.isEmpty()) {
            TxId txId = stack.pop();
            if(descendants.add(txId)) {
                stack.addAll(getLinks(txId).children);
            }
        }

        return descendants;
    }

    /**
     * All in-pool ancestors of the given transaction, excluding the transaction itself.
     */
    public Set<TxId> calculateAncestors(TxId txId) {
        return calculateAncestors(getLinks(txId).parents);
    }

    public Set<TxId> calculateAncestors(Collection<TxId> parents) {
        Set<TxId> ancestors = new LinkedHashSet<>();
        Deque<TxId> stack = new ArrayDeque<>(parents);
        while(!stack.isEmpty()) {
            TxId ancestor = stack.pop();
            if(ancestors.add(ancestor)) {
                stack.addAll(getLinks(ancestor).parents);
            }
        }

        return ancestors;
    }

    public Set<TxId> getTxIds() {
        return Collections.unmodifiableSet(links.keySet());
    }

    public int size() {
        return links.size();
    }

    public void clear() {
        links.clear();
    }

    /**
     * Verifies that every link has its counterpart.
     */
    public void checkConsistency() {
        for(Map.Entry<TxId, Links> entry : links.entrySet()) {
            for(TxId parent : entry.getValue().parents) {
                Links parentLinks = links.get(parent);
                if(parentLinks == null || !parentLinks.children.contains(entry.getKey())) {
                    throw new IllegalStateException("Parent link from " + entry.getKey() + " to " + parent + " has no matching child link");
                }
            }
            for(TxId child : entry.getValue().children) {
                Links childLinks = links.get(child);
                if(childLinks == null || !childLinks.parents.contains(entry.getKey())) {
                    throw new IllegalStateException("Child link from " + entry.getKey() + " to " + child + " has no matching parent link");
                }
            }
        }
    }

    private Links getLinks(TxId txId) {
        Links entryLinks = links.get(txId);
        Preconditions.checkState(entryLinks != null, "Transaction " + txId + " is not linked");
        return entryLinks;
    }

    private static class Links {
        private final Set<TxId> parents = new LinkedHashSet<>();
        private final Set<TxId> children = new LinkedHashSet<>();
    }
}
