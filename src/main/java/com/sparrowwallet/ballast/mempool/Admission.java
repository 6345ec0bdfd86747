package com.sparrowwallet.ballast.mempool;

/**
 * Admission state of a mempool entry. Exactly one of the three variants applies at any time.
 */
public interface Admission {
    Standalone STANDALONE = new Standalone();

    boolean isPrimary();

    /**
     * Block eligible on its own fee.
     */
    record Standalone() implements Admission {
        @Override
        public boolean isPrimary() {
            return true;
        }
    }

    /**
     * Held but not block eligible, carrying the data a descendant needs to pay for this entry and its secondary ancestors.
     */
    record Secondary(GroupingData groupingData) implements Admission {
        @Override
        public boolean isPrimary() {
            return false;
        }
    }

    /**
     * Block eligible as a member of a child-pays-for-parent group.
     */
    record Grouped(CpfpGroup group) implements Admission {
        @Override
        public boolean isPrimary() {
            return true;
        }
    }
}
