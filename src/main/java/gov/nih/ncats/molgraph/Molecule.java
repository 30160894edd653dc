package gov.nih.ncats.molgraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import gov.nih.ncats.molgraph.internal.util.CachedSupplier;

/**
 * A molecular graph: an ordered list of atom-type codes (see {@link Element})
 * and a matrix of bond orders between them.
 *
 * <p>
 * Bond orders are stored upper-triangular, every bond lives at
 * {@code [min(i,j)][max(i,j)]}; all accessors taking two atom indexes
 * accept them in either order. 0 means no bond, 1/2/3 single/double/triple,
 * 1.5 aromatic and other fractional values delocalized bonds.
 * </p>
 *
 * <p>
 * Instances are not thread safe. A Molecule is owned by whoever is resolving it
 * and must never be handed to more than one parse pipeline at a time.
 * </p>
 */
public class Molecule {

    private final int[] atoms;
    private final double[][] bonds;

    private final CachedSupplier<int[][]> _neighbors = CachedSupplier.of(this::_computeNeighbors);

    /**
     * Create a new Molecule with the given atoms and no bonds.
     * @param atomCodes the atom-type codes, one per atom; can not be null.
     * @throws NullPointerException if atomCodes is null.
     */
    public Molecule(int[] atomCodes){
        this.atoms = Arrays.copyOf(Objects.requireNonNull(atomCodes, "atom codes can not be null"), atomCodes.length);
        this.bonds = new double[atoms.length][atoms.length];
    }

    /**
     * Create a new Molecule with the given atoms and bond orders.
     * Only the strict upper triangle of the given matrix is read.
     *
     * @param atomCodes the atom-type codes, one per atom; can not be null.
     * @param bondOrders a square matrix the same size as atomCodes.
     * @throws IllegalArgumentException if the matrix is not atomCodes.length square.
     */
    public Molecule(int[] atomCodes, double[][] bondOrders){
        this(atomCodes);
        if(bondOrders.length != atoms.length){
            throw new IllegalArgumentException("bond matrix must be " + atoms.length + " x " + atoms.length);
        }
        for(int i=0; i< atoms.length; i++){
            if(bondOrders[i].length != atoms.length){
                throw new IllegalArgumentException("bond matrix must be " + atoms.length + " x " + atoms.length);
            }
            System.arraycopy(bondOrders[i], i+1, bonds[i], i+1, atoms.length - i -1);
        }
    }

    public int getAtomCount(){
        return atoms.length;
    }

    public int getAtomCode(int atom){
        return atoms[atom];
    }

    public Element getElement(int atom){
        return Element.ofCode(atoms[atom]);
    }

    /**
     * Get a copy of the atom-type codes.
     * @return a new array; never null.
     */
    public int[] getAtomCodes(){
        return Arrays.copyOf(atoms, atoms.length);
    }

    public int getHeavyAtomCount(){
        int count=0;
        for(int a : atoms){
            if(a != Element.HYDROGEN.getCode()){
                count++;
            }
        }
        return count;
    }

    /**
     * The bond order between two atoms, in either order.
     * @return the bond order, 0 if the atoms are not bonded or i==j.
     */
    public double getBondOrder(int i, int j){
        if(i==j){
            return 0;
        }
        return i < j ? bonds[i][j] : bonds[j][i];
    }

    public boolean hasBond(int i, int j){
        return getBondOrder(i, j) != 0;
    }

    /**
     * Set the bond order between two atoms, in either order.
     * An order of 0 removes the bond.
     * @throws IllegalArgumentException if i == j or order is negative.
     */
    public Molecule setBondOrder(int i, int j, double order){
        if(i==j){
            throw new IllegalArgumentException("an atom can not be bonded to itself: " + i);
        }
        if(order < 0){
            throw new IllegalArgumentException("bond order must be >= 0");
        }
        if(i < j){
            bonds[i][j] = order;
        }else{
            bonds[j][i] = order;
        }
        _neighbors.resetCache();
        return this;
    }

    /**
     * The indexes of all atoms bonded to the given atom in ascending order.
     * @param atom the atom index.
     * @return a new array of atom indexes.
     */
    public int[] getNeighbors(int atom){
        int[] neighbors = _neighbors.get()[atom];
        return Arrays.copyOf(neighbors, neighbors.length);
    }

    public int getBondCount(){
        int count=0;
        for(int i=0; i< atoms.length; i++){
            for(int j=i+1; j< atoms.length; j++){
                if(bonds[i][j] !=0){
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Visit every bond once, lower atom index first.
     * @param visitor the visitor to call for each nonzero bond.
     */
    public void forEachBond(BondVisitor visitor){
        for(int i=0; i< atoms.length; i++){
            for(int j=i+1; j< atoms.length; j++){
                if(bonds[i][j] !=0){
                    visitor.visit(i, j, bonds[i][j]);
                }
            }
        }
    }

    /**
     * A copy of the bond matrix in the upper-triangular form the resolvers work on.
     * @return a new n x n array.
     */
    public double[][] getUpperTriangularMatrix(){
        double[][] copy = new double[atoms.length][];
        for(int i=0; i< atoms.length; i++){
            copy[i] = Arrays.copyOf(bonds[i], atoms.length);
        }
        return copy;
    }

    /**
     * A symmetric copy of the bond matrix where {@code m[i][j] == m[j][i]}.
     * @return a new n x n array.
     */
    public double[][] toAdjacencyMatrix(){
        double[][] full = new double[atoms.length][atoms.length];
        for(int i=0; i< atoms.length; i++){
            for(int j=i+1; j< atoms.length; j++){
                full[i][j] = bonds[i][j];
                full[j][i] = bonds[i][j];
            }
        }
        return full;
    }

    public Molecule copy(){
        return new Molecule(atoms, bonds);
    }

    private int[][] _computeNeighbors(){
        List<List<Integer>> lists = new ArrayList<>(atoms.length);
        for(int i=0; i< atoms.length; i++){
            lists.add(new ArrayList<>());
        }
        forEachBond((i,j,order)->{
            lists.get(i).add(j);
            lists.get(j).add(i);
        });
        int[][] neighbors = new int[atoms.length][];
        for(int i=0; i< atoms.length; i++){
            neighbors[i] = lists.get(i).stream().mapToInt(Integer::intValue).sorted().toArray();
        }
        return neighbors;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Molecule{atoms=[");
        for(int i=0; i< atoms.length; i++){
            if(i>0){
                builder.append(", ");
            }
            builder.append(Element.ofCode(atoms[i]).getSymbol());
        }
        builder.append("], bonds=[");
        boolean[] first = new boolean[]{true};
        forEachBond((i,j,order)->{
            if(!first[0]){
                builder.append(", ");
            }
            first[0]=false;
            builder.append(i).append('-').append(j).append(':').append(order);
        });
        return builder.append("]}").toString();
    }

    /**
     * Callback for {@link #forEachBond(BondVisitor)}.
     */
    @FunctionalInterface
    public interface BondVisitor{
        void visit(int atom1, int atom2, double order);
    }
}
