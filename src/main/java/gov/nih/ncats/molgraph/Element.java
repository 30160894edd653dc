package gov.nih.ncats.molgraph;

import java.util.Optional;

/**
 * The elements understood by the notation parser, each with the
 * atom-type code stored in a {@link Molecule}.
 * Aromatic and non-aromatic forms of an element share one code.
 */
public enum Element {
    CARBON(0, "C", true),
    NITROGEN(1, "N", true),
    OXYGEN(2, "O", true),
    SULFUR(3, "S", true),
    PHOSPHORUS(4, "P", true),
    FLUORINE(5, "F", false),
    CHLORINE(6, "Cl", false),
    BROMINE(7, "Br", false),
    IODINE(8, "I", false),
    HYDROGEN(9, "H", false);

    private static final Element[] BY_CODE = new Element[values().length];
    static{
        for(Element e : values()){
            BY_CODE[e.code] = e;
        }
    }

    private final int code;
    private final String symbol;
    private final boolean aromaticForm;

    Element(int code, String symbol, boolean aromaticForm){
        this.code = code;
        this.symbol = symbol;
        this.aromaticForm = aromaticForm;
    }

    public int getCode() {
        return code;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isHeavy(){
        return this != HYDROGEN;
    }

    /**
     * Look up the element for an atom-type code.
     * @param code the code as stored in {@link Molecule#getAtomCode(int)}.
     * @return the Element.
     * @throws IllegalArgumentException if the code is not a known atom-type code.
     */
    public static Element ofCode(int code){
        if(code < 0 || code >= BY_CODE.length){
            throw new IllegalArgumentException("unknown atom type code " + code);
        }
        return BY_CODE[code];
    }

    /**
     * Look up the element for a (possibly lowercase aromatic) symbol.
     * @param symbol the symbol, for example "C", "c", "Cl".
     * @return an Optional containing the Element or empty if the symbol is not supported.
     */
    static Optional<Element> ofSymbol(String symbol){
        if(symbol == null || symbol.isEmpty()){
            return Optional.empty();
        }
        for(Element e : values()){
            if(e.symbol.equals(symbol) || (e.aromaticForm && e.symbol.toLowerCase().equals(symbol))){
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }
}
