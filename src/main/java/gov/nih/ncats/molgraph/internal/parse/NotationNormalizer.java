package gov.nih.ncats.molgraph.internal.parse;

import java.util.Objects;
import java.util.regex.Pattern;

import gov.nih.ncats.molgraph.Element;

/**
 * Rewrites a notation string into the aligned atom and topology streams
 * the graph builders work on.
 *
 * The input is trusted: nothing here checks that the notation is well formed,
 * see {@link NotationValidator} for that.
 */
public final class NotationNormalizer {

    public static final char BROMINE_PLACEHOLDER = 'R';
    public static final char CHLORINE_PLACEHOLDER = 'L';
    /**
     * Stands in for an atom in the topology-only stream.
     */
    public static final char FILLER = '0';

    private static final Pattern BROMINE = Pattern.compile("Br");
    private static final Pattern CHLORINE = Pattern.compile("Cl");
    private static final Pattern STEREO_CARBON = Pattern.compile("\\[C@@?H?\\]");
    private static final Pattern AROMATIC_NH = Pattern.compile("\\[nH\\]");
    private static final Pattern DIRECTIONAL_BOND = Pattern.compile("[/\\\\]");
    //any other bracket atom of a supported element: charges, explicit H, stereo
    private static final Pattern BRACKET_ATOM = Pattern.compile("\\[([CNOSPFIRLcnosp])(?![a-z])[^\\]]*\\]");
    private static final Pattern TOPOLOGY_MARKS = Pattern.compile("[=#()1-9]");

    private NotationNormalizer(){
        //can not instantiate
    }

    /**
     * Apply the textual rewrites (strip, collapse two-letter elements,
     * drop stereo and bracket decorations) without splitting into streams.
     * @param notation the raw notation; can not be null.
     * @return the rewritten string.
     */
    public static String collapse(String notation){
        Objects.requireNonNull(notation, "notation can not be null");
        String s = notation.trim();
        s = BROMINE.matcher(s).replaceAll(String.valueOf(BROMINE_PLACEHOLDER));
        s = CHLORINE.matcher(s).replaceAll(String.valueOf(CHLORINE_PLACEHOLDER));
        s = STEREO_CARBON.matcher(s).replaceAll("C");
        s = AROMATIC_NH.matcher(s).replaceAll("n");
        s = DIRECTIONAL_BOND.matcher(s).replaceAll("");
        s = BRACKET_ATOM.matcher(s).replaceAll("$1");
        return s;
    }

    /**
     * Normalize the given notation.
     * @param notation the raw notation; can not be null.
     * @return a new {@link NormalizedNotation}.
     * @throws NullPointerException if notation is null.
     */
    public static NormalizedNotation normalize(String notation){
        String normalized = collapse(notation);

        String atomsOnly = TOPOLOGY_MARKS.matcher(normalized).replaceAll("");

        int[] codes = new int[atomsOnly.length()];
        boolean[] aromatic = new boolean[atomsOnly.length()];
        for(int i=0; i< atomsOnly.length(); i++){
            char c = atomsOnly.charAt(i);
            codes[i] = atomCodeOf(c);
            aromatic[i] = Character.isLowerCase(c);
        }

        StringBuilder topology = new StringBuilder(normalized.length());
        for(int i=0; i< normalized.length(); i++){
            char c = normalized.charAt(i);
            topology.append(isAtomSymbol(c) ? FILLER : c);
        }

        return new NormalizedNotation(notation, normalized, atomsOnly, topology.toString(), codes, aromatic);
    }

    /**
     * Is the given character an atom symbol once two-letter elements are collapsed.
     */
    public static boolean isAtomSymbol(char c){
        switch(c){
            case 'C': case 'c':
            case 'N': case 'n':
            case 'O': case 'o':
            case 'S': case 's':
            case 'P': case 'p':
            case 'F':
            case CHLORINE_PLACEHOLDER:
            case BROMINE_PLACEHOLDER:
            case 'I':
                return true;
            default:
                return false;
        }
    }

    /**
     * Translate a collapsed atom symbol into its atom-type code.
     * @throws IllegalArgumentException if c is not an atom symbol.
     */
    public static int atomCodeOf(char c){
        switch(c){
            case 'C': case 'c': return Element.CARBON.getCode();
            case 'N': case 'n': return Element.NITROGEN.getCode();
            case 'O': case 'o': return Element.OXYGEN.getCode();
            case 'S': case 's': return Element.SULFUR.getCode();
            case 'P': case 'p': return Element.PHOSPHORUS.getCode();
            case 'F': return Element.FLUORINE.getCode();
            case CHLORINE_PLACEHOLDER: return Element.CHLORINE.getCode();
            case BROMINE_PLACEHOLDER: return Element.BROMINE.getCode();
            case 'I': return Element.IODINE.getCode();
            default:
                throw new IllegalArgumentException("unsupported atom symbol '" + c + "'");
        }
    }
}
