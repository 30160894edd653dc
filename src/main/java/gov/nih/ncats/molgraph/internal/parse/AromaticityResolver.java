package gov.nih.ncats.molgraph.internal.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import gov.nih.ncats.molgraph.Element;
import gov.nih.ncats.molgraph.Molecule;

/**
 * Two passes over the finished heavy-atom graph.
 *
 * <ol>
 *     <li>Every bond between two aromatic (lowercase) atoms gets 0.5 added to its order.</li>
 *     <li>Conjugated systems, the connected groups of at least {@value #MIN_SYSTEM_SIZE}
 *     carbon, nitrogen or oxygen atoms that are aromatic or carry a double bond,
 *     have all their internal bond orders replaced by the mean order of those bonds.</li>
 * </ol>
 */
public class AromaticityResolver implements GraphResolver{

    public static final double AROMATIC_INCREMENT = 0.5;

    static final int MIN_SYSTEM_SIZE = 3;

    @Override
    public Molecule resolve(Molecule molecule, ParseContext context) {
        NormalizedNotation notation = context.getNotation();
        boolean[] aromatic = new boolean[molecule.getAtomCount()];
        for(int i=0; i< aromatic.length; i++){
            aromatic[i] = notation.isAromatic(i);
        }
        boostAromaticBonds(molecule, aromatic);
        for(List<Integer> system : findConjugatedSystems(molecule, aromatic)){
            averageBondOrders(molecule, system);
        }
        return molecule;
    }

    static void boostAromaticBonds(Molecule molecule, boolean[] aromatic){
        for(int i=0; i< aromatic.length; i++){
            if(!aromatic[i]){
                continue;
            }
            for(int j=i+1; j< aromatic.length; j++){
                double order = molecule.getBondOrder(i, j);
                if(aromatic[j] && order > 0){
                    molecule.setBondOrder(i, j, order + AROMATIC_INCREMENT);
                }
            }
        }
    }

    /**
     * Breadth first search for connected components over the candidate atoms.
     * @return each system as a list of atom indexes in visiting order.
     */
    static List<List<Integer>> findConjugatedSystems(Molecule molecule, boolean[] aromatic){
        int n = molecule.getAtomCount();
        boolean[] candidate = new boolean[n];
        for(int i=0; i< n; i++){
            candidate[i] = isConjugationElement(molecule.getElement(i))
                            && (aromatic[i] || hasDoubleBond(molecule, i));
        }

        List<List<Integer>> systems = new ArrayList<>();
        boolean[] visited = new boolean[n];
        for(int start=0; start< n; start++){
            if(!candidate[start] || visited[start]){
                continue;
            }
            List<Integer> system = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start]=true;
            while(!queue.isEmpty()){
                int atom = queue.poll();
                system.add(atom);
                for(int neighbor : molecule.getNeighbors(atom)){
                    if(candidate[neighbor] && !visited[neighbor]){
                        visited[neighbor]=true;
                        queue.add(neighbor);
                    }
                }
            }
            if(system.size() >= MIN_SYSTEM_SIZE){
                systems.add(Collections.unmodifiableList(system));
            }
        }
        return systems;
    }

    static void averageBondOrders(Molecule molecule, List<Integer> system){
        double total=0;
        int count=0;
        for(int a=0; a< system.size(); a++){
            for(int b=a+1; b< system.size(); b++){
                double order = molecule.getBondOrder(system.get(a), system.get(b));
                if(order > 0){
                    total += order;
                    count++;
                }
            }
        }
        if(count==0){
            return;
        }
        double mean = total/count;
        for(int a=0; a< system.size(); a++){
            for(int b=a+1; b< system.size(); b++){
                if(molecule.hasBond(system.get(a), system.get(b))){
                    molecule.setBondOrder(system.get(a), system.get(b), mean);
                }
            }
        }
    }

    private static boolean hasDoubleBond(Molecule molecule, int atom){
        for(int neighbor : molecule.getNeighbors(atom)){
            if(molecule.getBondOrder(atom, neighbor) == 2D){
                return true;
            }
        }
        return false;
    }

    private static boolean isConjugationElement(Element e){
        return e == Element.CARBON || e == Element.NITROGEN || e == Element.OXYGEN;
    }
}
