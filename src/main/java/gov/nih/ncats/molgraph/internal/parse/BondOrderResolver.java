package gov.nih.ncats.molgraph.internal.parse;

import gov.nih.ncats.molgraph.Molecule;

/**
 * Applies explicit double ({@code =}) and triple ({@code #}) bond markers
 * to the chain bond between the marker's anchor and the next atom.
 *
 * Runs before branch and ring resolution so that a bond moved by
 * {@link BranchResolver} keeps its order.
 */
public class BondOrderResolver implements GraphResolver{

    public static final char DOUBLE_BOND = '=';
    public static final char TRIPLE_BOND = '#';

    @Override
    public Molecule resolve(Molecule molecule, ParseContext context) {
        TopologyIndex index = context.getTopologyIndex();
        for(int anchor : index.getAnchorsOf(DOUBLE_BOND)){
            molecule.setBondOrder(anchor, anchor+1, 2);
        }
        for(int anchor : index.getAnchorsOf(TRIPLE_BOND)){
            molecule.setBondOrder(anchor, anchor+1, 3);
        }
        return molecule;
    }
}
