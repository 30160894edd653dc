package gov.nih.ncats.molgraph.internal.parse;

import gov.nih.ncats.molgraph.Molecule;

/**
 * Builds the default graph of a notation: its atoms in written order,
 * each single bonded to the next one. Branches, rings and bond markers
 * are corrected afterwards by the {@link GraphResolver}s.
 */
public final class ChainBuilder {

    private ChainBuilder(){
        //can not instantiate
    }

    /**
     * Create the consecutive chain for the given notation.
     * @param notation the normalized notation.
     * @return a new Molecule where atom i is bonded to atom i+1 with order 1.
     */
    public static Molecule buildChain(NormalizedNotation notation){
        Molecule molecule = new Molecule(notation.getAtomCodes());
        for(int i=0; i< molecule.getAtomCount() -1; i++){
            molecule.setBondOrder(i, i+1, 1);
        }
        return molecule;
    }

    /**
     * Create the parse context (notation + topology index) the resolvers share.
     */
    public static ParseContext indexTopology(NormalizedNotation notation){
        return new ParseContext(notation, TopologyIndex.of(notation));
    }
}
