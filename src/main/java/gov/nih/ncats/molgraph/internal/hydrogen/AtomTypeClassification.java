package gov.nih.ncats.molgraph.internal.hydrogen;

import java.util.Objects;

import gov.nih.ncats.molgraph.Element;
import gov.nih.ncats.molgraph.Hybridization;

/**
 * The type an {@link AtomTyper} assigns to one heavy atom.
 */
public final class AtomTypeClassification {

    private final Element element;
    private final Hybridization hybridization;
    private final int heavyNeighborCount;

    private AtomTypeClassification(Element element, Hybridization hybridization, int heavyNeighborCount) {
        this.element = Objects.requireNonNull(element, "element can not be null");
        this.hybridization = Objects.requireNonNull(hybridization, "hybridization can not be null");
        if(heavyNeighborCount <0){
            throw new IllegalArgumentException("heavy neighbor count must be >= 0");
        }
        this.heavyNeighborCount = heavyNeighborCount;
    }

    public static AtomTypeClassification of(Element element, Hybridization hybridization, int heavyNeighborCount){
        return new AtomTypeClassification(element, hybridization, heavyNeighborCount);
    }

    public Element getElement() {
        return element;
    }

    public Hybridization getHybridization() {
        return hybridization;
    }

    public int getHeavyNeighborCount() {
        return heavyNeighborCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AtomTypeClassification)) return false;
        AtomTypeClassification that = (AtomTypeClassification) o;
        return heavyNeighborCount == that.heavyNeighborCount &&
                element == that.element &&
                hybridization == that.hybridization;
    }

    @Override
    public int hashCode() {
        return Objects.hash(element, hybridization, heavyNeighborCount);
    }

    @Override
    public String toString() {
        return element.getSymbol() + "." + hybridization.name().toLowerCase() + "/" + heavyNeighborCount;
    }
}
