package gov.nih.ncats.molgraph;

/**
 * Thrown by the validating front end when a notation string
 * can not be parsed by the restricted grammar.
 */
public class InvalidNotationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String notation;
    private final int position;

    public InvalidNotationException(String notation, int position, String message) {
        super(message + (position >=0 ? " at position " + position : "") + " in '" + notation + "'");
        this.notation = notation;
        this.position = position;
    }

    public String getNotation() {
        return notation;
    }

    /**
     * The offending position in the normalized notation, or -1 if the
     * problem is not tied to one character.
     */
    public int getPosition() {
        return position;
    }
}
