package gov.nih.ncats.molgraph.internal.hydrogen;

import java.util.ArrayList;
import java.util.List;

import gov.nih.ncats.molgraph.Hybridization;
import gov.nih.ncats.molgraph.Molecule;

/**
 * Default {@link AtomTyper} that derives hybridization from the bond orders
 * written by the parser.
 * <ul>
 *     <li>sp1: a bond of order &ge; 2.5, or two bonds of order &ge; 2</li>
 *     <li>sp2: any bond of order above 1 (double, aromatic or delocalized)</li>
 *     <li>sp3: everything else</li>
 * </ul>
 */
public class ValenceAtomTyper implements AtomTyper{

    private static final double EPSILON = 1E-6;

    @Override
    public List<AtomTypeClassification> classify(Molecule molecule) {
        List<AtomTypeClassification> types = new ArrayList<>(molecule.getAtomCount());
        for(int i=0; i< molecule.getAtomCount(); i++){
            types.add(AtomTypeClassification.of(molecule.getElement(i),
                    hybridizationOf(molecule, i),
                    heavyNeighborCount(molecule, i)));
        }
        return types;
    }

    static Hybridization hybridizationOf(Molecule molecule, int atom){
        int doubleOrHigher=0;
        boolean multiple = false;
        for(int neighbor : molecule.getNeighbors(atom)){
            double order = molecule.getBondOrder(atom, neighbor);
            if(order >= 2.5 - EPSILON){
                return Hybridization.SP1;
            }
            if(order >= 2 - EPSILON){
                doubleOrHigher++;
            }
            if(order > 1 + EPSILON){
                multiple = true;
            }
        }
        if(doubleOrHigher >=2){
            return Hybridization.SP1;
        }
        return multiple ? Hybridization.SP2 : Hybridization.SP3;
    }

    static int heavyNeighborCount(Molecule molecule, int atom){
        int count=0;
        for(int neighbor : molecule.getNeighbors(atom)){
            if(molecule.getElement(neighbor).isHeavy()){
                count++;
            }
        }
        return count;
    }
}
