package gov.nih.ncats.molgraph.internal.parse;

import java.util.Arrays;

/**
 * The two aligned streams derived from a notation string by {@link NotationNormalizer}.
 * <ul>
 *     <li>{@link #getAtomsOnly()} only the (single character) atom symbols, in written order.</li>
 *     <li>{@link #getTopologyOnly()} the normalized string with every atom symbol replaced by
 *     {@link NotationNormalizer#FILLER}; bond markers, parentheses and ring digits survive.</li>
 * </ul>
 */
public final class NormalizedNotation {

    private final String original;
    private final String normalized;
    private final String atomsOnly;
    private final String topologyOnly;
    private final int[] atomCodes;
    private final boolean[] aromatic;

    NormalizedNotation(String original, String normalized, String atomsOnly, String topologyOnly,
                       int[] atomCodes, boolean[] aromatic) {
        this.original = original;
        this.normalized = normalized;
        this.atomsOnly = atomsOnly;
        this.topologyOnly = topologyOnly;
        this.atomCodes = atomCodes;
        this.aromatic = aromatic;
    }

    public String getOriginal() {
        return original;
    }

    /**
     * The notation after two-letter elements were collapsed to placeholders
     * and stereo/bracket forms removed.
     */
    public String getNormalized() {
        return normalized;
    }

    public String getAtomsOnly() {
        return atomsOnly;
    }

    public String getTopologyOnly() {
        return topologyOnly;
    }

    public int getAtomCount(){
        return atomCodes.length;
    }

    public int[] getAtomCodes() {
        return Arrays.copyOf(atomCodes, atomCodes.length);
    }

    /**
     * Was the atom written in its lowercase aromatic form.
     * @param atom the atom index.
     */
    public boolean isAromatic(int atom){
        return aromatic[atom];
    }

    @Override
    public String toString() {
        return "NormalizedNotation{" + original + " -> atoms='" + atomsOnly + "', topology='" + topologyOnly + "'}";
    }
}
