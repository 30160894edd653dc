package gov.nih.ncats.molgraph.internal.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;

import gov.nih.ncats.molgraph.Molecule;

/**
 * Rewires the chain at parenthesis boundaries.
 *
 * <p>
 * For a branch opened after atom {@code left} and closed after atom {@code right},
 * the chain bond {@code right -> right+1} is dropped and {@code left} is bonded to
 * {@code right+1} with the order the dropped bond had.
 * </p>
 *
 * <p>
 * Sibling branches such as {@code CCC(C)(C)CC} open right where the previous
 * branch closed, so the anchor of the second {@code (} is the last atom of the first
 * branch. Those anchors are moved back to the shared backbone atom before rewiring.
 * </p>
 */
public class BranchResolver implements GraphResolver{

    public static final char OPEN = '(';
    public static final char CLOSE = ')';

    @Override
    public Molecule resolve(Molecule molecule, ParseContext context) {
        List<int[]> pairs = findBranchPairs(context.getTopologyIndex(), molecule.getAtomCount());
        if(pairs.isEmpty()){
            return molecule;
        }
        int[] lefts = new int[pairs.size()];
        int[] rights = new int[pairs.size()];
        for(int k=0; k< pairs.size(); k++){
            lefts[k] = pairs.get(k)[0];
            rights[k] = pairs.get(k)[1];
        }
        correctSiblingAnchors(lefts, rights);

        double[] orders = new double[rights.length];
        for(int k=0; k< rights.length; k++){
            orders[k] = molecule.getBondOrder(rights[k], rights[k]+1);
        }
        for(int k=0; k< rights.length; k++){
            molecule.setBondOrder(rights[k], rights[k]+1, 0);
        }
        for(int k=0; k< rights.length; k++){
            molecule.setBondOrder(lefts[k], rights[k]+1, orders[k]);
        }
        return molecule;
    }

    /**
     * Match parentheses with a stack of open-branch anchors.
     * @return {left, right} anchor pairs in the order the branches close;
     * branches closing after the last atom are dropped since there is nothing to reattach.
     */
    static List<int[]> findBranchPairs(TopologyIndex index, int atomCount){
        Stack<Integer> open = new Stack<>();
        List<int[]> pairs = new ArrayList<>();
        for(int k=0; k< index.size(); k++){
            char mark = index.getMark(k);
            if(mark == OPEN){
                open.push(index.getAnchor(k));
            }else if(mark == CLOSE){
                pairs.add(new int[]{open.pop(), index.getAnchor(k)});
            }
        }
        pairs.removeIf(p-> p[1] == atomCount -1);
        return pairs;
    }

    /**
     * Wherever a branch opens at the atom where an earlier branch closed,
     * give it the earlier branch's (already corrected) left anchor.
     * Overlaps are found on the uncorrected anchors and applied in order.
     */
    static void correctSiblingAnchors(int[] lefts, int[] rights){
        List<int[]> overlaps = new ArrayList<>();
        for(int i=0; i< rights.length; i++){
            for(int j=0; j< lefts.length; j++){
                if(lefts[j] == rights[i]){
                    overlaps.add(new int[]{i, j});
                }
            }
        }
        for(int[] overlap : overlaps){
            lefts[overlap[1]] = lefts[overlap[0]];
        }
    }
}
