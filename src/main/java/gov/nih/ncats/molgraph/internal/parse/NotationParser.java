package gov.nih.ncats.molgraph.internal.parse;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.molgraph.Molecule;

/**
 * Runs the parse pipeline for one notation string:
 * normalize, build the chain, then bond orders, branches, rings and aromaticity.
 * The result is the heavy-atom graph; hydrogens are added separately.
 *
 * Each call owns its Molecule, so parsing different strings from
 * different threads at the same time is safe.
 */
public final class NotationParser {

    private static final Logger logger = Logger.getLogger(NotationParser.class.getName());

    private static final List<GraphResolver> RESOLVERS = Collections.unmodifiableList(Arrays.asList(
            new BondOrderResolver(),
            new BranchResolver(),
            new RingClosureResolver(),
            new AromaticityResolver()));

    private NotationParser(){
        //can not instantiate
    }

    /**
     * Parse the given notation into its heavy-atom graph.
     * The notation is trusted, malformed input gives unspecified results.
     *
     * @param notation the notation to parse; can not be null.
     * @return a new Molecule.
     * @throws NullPointerException if notation is null.
     */
    public static Molecule parse(String notation){
        NormalizedNotation normalized = NotationNormalizer.normalize(notation);
        ParseContext context = ChainBuilder.indexTopology(normalized);
        Molecule molecule = ChainBuilder.buildChain(normalized);
        if(logger.isLoggable(Level.FINE)){
            logger.fine(normalized + " " + context.getTopologyIndex().size() + " topology marks");
        }
        for(GraphResolver resolver : RESOLVERS){
            molecule = resolver.resolve(molecule, context);
            if(logger.isLoggable(Level.FINER)){
                logger.finer(resolver.getClass().getSimpleName() + " -> " + molecule);
            }
        }
        return molecule;
    }

    public static List<GraphResolver> getResolvers(){
        return RESOLVERS;
    }
}
