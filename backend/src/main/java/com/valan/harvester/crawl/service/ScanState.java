package com.valan.harvester.crawl.service;

/**
 * Cursor over the ID space for one scan. The cursor only moves down and the lower
 * bound is exclusive and fixed for the whole scan.
 */
class ScanState {
    private final long lowerBound;
    private final ScanStats stats = new ScanStats();
    private long currentId;
    private long lastVisitedId;
    private int consecutiveMisses;

    ScanState(long startId, long lowerBound) {
        this.currentId = startId;
        this.lowerBound = lowerBound;
    }

    boolean hasNext() {
        return currentId > lowerBound;
    }

    long currentId() {
        return currentId;
    }

    long lowerBound() {
        return lowerBound;
    }

    long lastVisitedId() {
        return lastVisitedId;
    }

    ScanStats stats() {
        return stats;
    }

    void advance() {
        lastVisitedId = currentId;
        currentId--;
    }

    int recordMiss() {
        return ++consecutiveMisses;
    }

    void resetMisses() {
        consecutiveMisses = 0;
    }
}
