package gov.nih.ncats.molgraph.internal.parse;

import java.util.Arrays;

import gov.nih.ncats.molgraph.Molecule;

/**
 * Closes rings: atoms written before the same ring digit are single bonded.
 *
 * Only the digits {@code 1} to {@link #MAX_RING_DIGIT} form bonds. When a digit
 * occurs more than twice every pair of its atoms is bonded, not just consecutive
 * open/close pairs. An existing bond is never overwritten.
 */
public class RingClosureResolver implements GraphResolver{

    public static final char MAX_RING_DIGIT = '6';

    @Override
    public Molecule resolve(Molecule molecule, ParseContext context) {
        TopologyIndex index = context.getTopologyIndex();
        for(char digit = '1'; digit <= MAX_RING_DIGIT; digit++){
            if(!index.contains(digit)){
                continue;
            }
            int[] anchors = index.getAnchorsOf(digit);
            Arrays.sort(anchors);
            for(int i=0; i< anchors.length; i++){
                for(int j=i+1; j< anchors.length; j++){
                    int a = anchors[i];
                    int b = anchors[j];
                    if(a != b && !molecule.hasBond(a, b)){
                        molecule.setBondOrder(a, b, 1);
                    }
                }
            }
        }
        return molecule;
    }
}
