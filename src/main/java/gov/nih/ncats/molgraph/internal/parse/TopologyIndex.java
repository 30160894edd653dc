package gov.nih.ncats.molgraph.internal.parse;

import java.util.Arrays;

/**
 * Maps every topology character of a normalized notation (bond marker,
 * parenthesis or ring digit) to the index of the atom written immediately
 * before it. That atom is called the character's <em>anchor</em>.
 *
 * A topology character written before any atom has anchor -1.
 */
public final class TopologyIndex {

    private static final int ATOM_POSITION = Integer.MIN_VALUE;

    private final char[] marks;
    private final int[] positions;
    private final int[] anchors;
    private final int[] anchorByPosition;
    private final int atomCount;

    private TopologyIndex(char[] marks, int[] positions, int[] anchors, int[] anchorByPosition, int atomCount) {
        this.marks = marks;
        this.positions = positions;
        this.anchors = anchors;
        this.anchorByPosition = anchorByPosition;
        this.atomCount = atomCount;
    }

    /**
     * Build the index for the topology-only stream of the given notation.
     *
     * First pass: count the atoms written before each position.
     * Second pass: collect the topology characters with their anchors.
     *
     * @param notation the normalized notation.
     * @return a new TopologyIndex.
     */
    public static TopologyIndex of(NormalizedNotation notation){
        String topology = notation.getTopologyOnly();
        int length = topology.length();

        int[] atomsBefore = new int[length];
        int seen =0;
        int markCount=0;
        for(int i=0; i< length; i++){
            atomsBefore[i] = seen;
            if(topology.charAt(i) == NotationNormalizer.FILLER){
                seen++;
            }else{
                markCount++;
            }
        }

        char[] marks = new char[markCount];
        int[] positions = new int[markCount];
        int[] anchors = new int[markCount];
        int[] anchorByPosition = new int[length];
        Arrays.fill(anchorByPosition, ATOM_POSITION);
        int k=0;
        for(int i=0; i< length; i++){
            char c = topology.charAt(i);
            if(c == NotationNormalizer.FILLER){
                continue;
            }
            marks[k] = c;
            positions[k] = i;
            anchors[k] = atomsBefore[i] -1;
            anchorByPosition[i] = anchors[k];
            k++;
        }
        return new TopologyIndex(marks, positions, anchors, anchorByPosition, seen);
    }

    /**
     * The number of topology characters.
     */
    public int size(){
        return marks.length;
    }

    public int getAtomCount() {
        return atomCount;
    }

    public char getMark(int k){
        return marks[k];
    }

    /**
     * The position of the k-th topology character in the normalized string.
     */
    int getPosition(int k){
        return positions[k];
    }

    public int getAnchor(int k){
        return anchors[k];
    }

    /**
     * The anchor of the topology character at the given position of the normalized string.
     * @throws IllegalArgumentException if that position holds an atom.
     */
    int getAnchorAtPosition(int position){
        int anchor = anchorByPosition[position];
        if(anchor == ATOM_POSITION){
            throw new IllegalArgumentException("position " + position + " is an atom");
        }
        return anchor;
    }

    /**
     * The anchors of every occurrence of the given topology character, in written order.
     * @param mark the topology character, for example '=' or '1'.
     * @return an array of atom indexes, empty if the character does not occur.
     */
    public int[] getAnchorsOf(char mark){
        int count=0;
        for(char c : marks){
            if(c == mark){
                count++;
            }
        }
        int[] result = new int[count];
        int j=0;
        for(int k=0; k< marks.length; k++){
            if(marks[k] == mark){
                result[j++] = anchors[k];
            }
        }
        return result;
    }

    public boolean contains(char mark){
        for(char c : marks){
            if(c == mark){
                return true;
            }
        }
        return false;
    }
}
