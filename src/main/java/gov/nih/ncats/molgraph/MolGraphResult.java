package gov.nih.ncats.molgraph;

import java.util.Map;
import java.util.Optional;

/**
 * Object to hold the information of a single notation to molecular graph result.
 */
public interface MolGraphResult {
    /**
     * Returns the resolved molecular graph. Changes made to the returned
     * Molecule do not affect this result.
     * @return an Optional containing the Molecule or Empty Optional if there was an error.
     */
    Optional<Molecule> getMolecule();

    /**
     * Returns a molfile of the molecular graph.
     * @return an Optional containing the molfile as String or Empty Optional if there was an error.
     */
    Optional<String> getMolfile();

    /**
     * Returns a SDfile ( structure-data file) of the molecular graph with the properties
     * from {@link #getProperties()}.
     * @return an Optional containing the SDfile as String or Empty Optional if there was an error.
     */
    default Optional<String> getSDfile(){
        return getSDfile(getProperties().orElse(null));
    }
    /**
     * Returns a SDfile ( structure-data file) of the molecular graph with the given properties.
     * @param properties a mapping of properties to include in the formatted SDfile. If null, then no properties are included.
     * @return an Optional containing the SDfile as String or Empty Optional if there was an error.
     */
    Optional<String> getSDfile(Map<String,String> properties);

    /**
     * The properties recorded for this result, for example its name.
     * @return an Optional map or Empty Optional if there are none.
     */
    Optional<Map<String,String>> getProperties();

    /**
     * If there was an error during computing the result.
     */
    boolean hasError();

    /**
     * Return the Throwable error if there is one; or empty optional if there is no error.
     *
     * @see #hasError()
     */
    Optional<Throwable> getError();

    /**
     * Factory method to create a MolGraphResult that has the given error.
     * @param t the error; can not be null.
     */
    static MolGraphResult createFromError(Throwable t){
        return new ErrorResult(t);
    }
}
