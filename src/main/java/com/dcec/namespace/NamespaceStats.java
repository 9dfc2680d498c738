package com.dcec.namespace;

/**
 * Statistics about a namespace
 */
public class NamespaceStats {
    private final int sortCount;
    private final int functionNameCount;
    private final int signatureCount;
    private final int atomicCount;

    public NamespaceStats(int sortCount, int functionNameCount, int signatureCount, int atomicCount) {
        this.sortCount = sortCount;
        this.functionNameCount = functionNameCount;
        this.signatureCount = signatureCount;
        this.atomicCount = atomicCount;
    }

    public int getSortCount() { return sortCount; }
    public int getFunctionNameCount() { return functionNameCount; }
    public int getSignatureCount() { return signatureCount; }
    public int getAtomicCount() { return atomicCount; }

    @Override
    public String toString() {
        return String.format("NamespaceStats{sorts=%d, functions=%d, signatures=%d, atomics=%d}",
                sortCount, functionNameCount, signatureCount, atomicCount);
    }
}
