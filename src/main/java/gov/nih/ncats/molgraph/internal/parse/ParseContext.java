package gov.nih.ncats.molgraph.internal.parse;

import java.util.Objects;

/**
 * What every {@link GraphResolver} reads while it rewrites a molecule:
 * the normalized notation and its topology index. Lives for one parse only.
 */
public final class ParseContext {

    private final NormalizedNotation notation;
    private final TopologyIndex topologyIndex;

    public ParseContext(NormalizedNotation notation, TopologyIndex topologyIndex) {
        this.notation = Objects.requireNonNull(notation);
        this.topologyIndex = Objects.requireNonNull(topologyIndex);
    }

    public NormalizedNotation getNotation() {
        return notation;
    }

    public TopologyIndex getTopologyIndex() {
        return topologyIndex;
    }
}
