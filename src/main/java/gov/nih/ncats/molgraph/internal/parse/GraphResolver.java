package gov.nih.ncats.molgraph.internal.parse;

import gov.nih.ncats.molgraph.Molecule;

/**
 * One correction stage of the parse pipeline. A resolver takes ownership of the
 * molecule, rewrites its bonds in place and hands it back for the next stage.
 */
@FunctionalInterface
public interface GraphResolver {

    /**
     * Resolve this stage's topology characters.
     * @param molecule the molecule built so far; will be mutated.
     * @param context the notation being parsed.
     * @return the same molecule.
     */
    Molecule resolve(Molecule molecule, ParseContext context);
}
