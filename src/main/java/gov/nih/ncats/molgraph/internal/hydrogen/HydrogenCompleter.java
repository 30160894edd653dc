package gov.nih.ncats.molgraph.internal.hydrogen;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.molgraph.Element;
import gov.nih.ncats.molgraph.Hybridization;
import gov.nih.ncats.molgraph.Molecule;

/**
 * Adds the implicit hydrogens of a heavy-atom graph.
 *
 * <table>
 *     <caption>hydrogens per heavy atom</caption>
 *     <tr><th>element</th><th>hybridization</th><th>heavy neighbors</th><th>H</th></tr>
 *     <tr><td>C</td><td>sp3</td><td>0/1/2/3</td><td>4/3/2/1</td></tr>
 *     <tr><td>C</td><td>sp2</td><td>1/2</td><td>2/1</td></tr>
 *     <tr><td>C</td><td>sp1</td><td>1</td><td>1</td></tr>
 *     <tr><td>N, P</td><td>sp3</td><td>0/1/2</td><td>3/2/1</td></tr>
 *     <tr><td>N, P</td><td>sp2</td><td>1</td><td>1</td></tr>
 *     <tr><td>O, S</td><td>sp3</td><td>any</td><td>1</td></tr>
 * </table>
 *
 * Hydrogens are appended after the heavy atoms: first those of every atom
 * getting one hydrogen, then two, three and four, each group in atom order.
 * Each hydrogen is single bonded to its parent only.
 */
public final class HydrogenCompleter {

    private static final Logger logger = Logger.getLogger(HydrogenCompleter.class.getName());

    static final int MAX_HYDROGENS = 4;

    private HydrogenCompleter(){
        //can not instantiate
    }

    /**
     * Type the atoms with the given typer and add the hydrogens.
     * @see #complete(Molecule, List)
     */
    public static Molecule complete(Molecule heavyAtoms, AtomTyper typer){
        Objects.requireNonNull(typer, "atom typer can not be null");
        return complete(heavyAtoms, typer.classify(heavyAtoms));
    }

    /**
     * Create a new Molecule made of the given heavy-atom graph plus its implicit hydrogens.
     * The given molecule is not modified.
     *
     * @param heavyAtoms the heavy-atom graph.
     * @param types one classification per atom of heavyAtoms.
     * @return a new Molecule; the heavy-heavy bonds are unchanged.
     * @throws IllegalArgumentException if the number of classifications does not match the atom count.
     */
    public static Molecule complete(Molecule heavyAtoms, List<AtomTypeClassification> types){
        Objects.requireNonNull(heavyAtoms, "molecule can not be null");
        Objects.requireNonNull(types, "atom types can not be null");
        int n = heavyAtoms.getAtomCount();
        if(types.size() != n){
            throw new IllegalArgumentException("expected " + n + " atom types but got " + types.size());
        }

        List<Integer> parents = new ArrayList<>();
        for(int count=1; count <= MAX_HYDROGENS; count++){
            for(int i=0; i< n; i++){
                if(hydrogenCount(types.get(i)) == count){
                    for(int h=0; h< count; h++){
                        parents.add(i);
                    }
                }
            }
        }

        int total = n + parents.size();
        int[] codes = new int[total];
        double[][] bonds = new double[total][total];
        double[][] heavy = heavyAtoms.getUpperTriangularMatrix();
        for(int i=0; i< n; i++){
            codes[i] = heavyAtoms.getAtomCode(i);
            System.arraycopy(heavy[i], 0, bonds[i], 0, n);
        }
        for(int h=0; h< parents.size(); h++){
            codes[n+h] = Element.HYDROGEN.getCode();
            bonds[parents.get(h)][n+h] = 1;
        }
        if(logger.isLoggable(Level.FINE)){
            logger.fine("added " + parents.size() + " hydrogens to " + n + " heavy atoms");
        }
        return new Molecule(codes, bonds);
    }

    /**
     * The number of implicit hydrogens for an atom of the given type.
     * @return 0 to {@value #MAX_HYDROGENS}.
     */
    public static int hydrogenCount(AtomTypeClassification type){
        Hybridization hybridization = type.getHybridization();
        int neighbors = type.getHeavyNeighborCount();
        switch(type.getElement()){
            case CARBON:
                if(hybridization == Hybridization.SP3){
                    return neighbors <= 3 ? 4 - neighbors : 0;
                }
                if(hybridization == Hybridization.SP2){
                    return neighbors ==1 || neighbors ==2 ? 3 - neighbors : 0;
                }
                return neighbors ==1 ? 1 : 0;
            case NITROGEN:
            case PHOSPHORUS:
                if(hybridization == Hybridization.SP3){
                    return neighbors <= 2 ? 3 - neighbors : 0;
                }
                if(hybridization == Hybridization.SP2){
                    return neighbors ==1 ? 1 : 0;
                }
                return 0;
            case OXYGEN:
            case SULFUR:
                return hybridization == Hybridization.SP3 ? 1 : 0;
            default:
                return 0;
        }
    }
}
