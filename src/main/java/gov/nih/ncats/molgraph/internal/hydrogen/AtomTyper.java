package gov.nih.ncats.molgraph.internal.hydrogen;

import java.util.List;

import gov.nih.ncats.molgraph.Molecule;

/**
 * Classifies every atom of a heavy-atom graph by element,
 * hybridization and number of heavy neighbors.
 * {@link HydrogenCompleter} trusts whatever it returns.
 */
@FunctionalInterface
public interface AtomTyper {

    /**
     * Classify the atoms of the given molecule.
     * @param molecule a molecule without hydrogens; must not be modified.
     * @return one classification per atom, in atom order.
     */
    List<AtomTypeClassification> classify(Molecule molecule);
}
