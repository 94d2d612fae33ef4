package io.repoinsight.graph;

/**
 * Fan-in/fan-out of one node.
 */
public record NodeCoupling(String nodeId, int fanIn, int fanOut) {

    public int coupling() {
        return fanIn + fanOut;
    }

    /**
     * fanOut / (fanIn + fanOut); 0 for an isolated node.
     */
    public double instability() {
        int total = coupling();
        return total == 0 ? 0.0 : (double) fanOut / total;
    }
}
